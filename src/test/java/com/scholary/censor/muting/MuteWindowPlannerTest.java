package com.scholary.censor.muting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.censor.TestProperties;
import com.scholary.censor.interval.Interval;
import com.scholary.censor.record.MatchRecord;
import com.scholary.censor.record.MatchRecordCsvReader;
import com.scholary.censor.record.MatchRecordCsvWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MuteWindowPlannerTest {

  @TempDir Path tempDir;

  private MuteWindowPlanner planner;

  @BeforeEach
  void setUp() {
    planner =
        new MuteWindowPlanner(
            new MatchRecordCsvReader(), new ObjectMapper(), TestProperties.defaults());
  }

  @Test
  void plan_mergesRecordsFromTheSameEvent() {
    List<MatchRecord> records =
        List.of(
            record(1000, 2500, "damn"),
            record(1000, 2500, "heck"),
            record(2500, 3000, "damn"),
            record(7250, 9000, "damn"));

    List<Interval> windows = planner.plan(records);

    assertThat(windows).containsExactly(new Interval(1.0, 3.0), new Interval(7.25, 9.0));
  }

  @Test
  void plan_skipsBackwardsRanges() {
    List<Interval> windows = planner.plan(List.of(record(5000, 4000, "bad"), record(0, 1000, "ok")));

    assertThat(windows).containsExactly(new Interval(0.0, 1.0));
  }

  @Test
  void volumeFilter_joinsWindows() {
    String filter =
        planner.volumeFilter(List.of(new Interval(1.0, 2.5), new Interval(7.25, 9.0)));

    assertThat(filter)
        .isEqualTo("volume=enable='between(t,1.000,2.500)+between(t,7.250,9.000)':volume=0");
  }

  @Test
  void volumeFilter_rejectsEmptyWindows() {
    assertThatThrownBy(() -> planner.volumeFilter(List.of()))
        .isInstanceOf(MuteWindowException.class);
  }

  @Test
  void sidecar_roundTrip() throws IOException {
    Path sidecar = tempDir.resolve("mute_windows.json");
    List<Interval> windows = List.of(new Interval(1.0, 2.5), new Interval(7.25, 9.0));

    planner.writeSidecar(windows, sidecar);

    assertThat(Files.readString(sidecar)).contains("\"start\"").contains("\"end\"");
    assertThat(planner.readSidecar(sidecar)).isEqualTo(windows);
    assertThat(planner.loadWindows(sidecar)).isEqualTo(windows);
  }

  @Test
  void readSidecar_mergesHandEditedFile() throws IOException {
    Path sidecar = tempDir.resolve("edited.json");
    Files.writeString(
        sidecar, "[{\"start\": 3.0, \"end\": 4.0}, {\"start\": 1.0, \"end\": 3.5}]");

    assertThat(planner.readSidecar(sidecar)).containsExactly(new Interval(1.0, 4.0));
  }

  @Test
  void planSidecar_fromMatchCsv() throws IOException {
    Path csv = tempDir.resolve("profanity_matches.csv");
    new MatchRecordCsvWriter()
        .write(List.of(record(1000, 2500, "damn"), record(2000, 3000, "heck")), csv);

    Path sidecar = planner.planSidecar(csv, tempDir.resolve("out"));

    assertThat(sidecar).isEqualTo(tempDir.resolve("out").resolve("mute_windows.json"));
    assertThat(planner.readSidecar(sidecar)).containsExactly(new Interval(1.0, 3.0));
  }

  @Test
  void loadWindows_emptyCsvFails() throws IOException {
    Path csv = tempDir.resolve("empty.csv");
    Files.writeString(csv, "start_ms,end_ms\n");

    assertThatThrownBy(() -> planner.loadWindows(csv))
        .isInstanceOf(MuteWindowException.class)
        .hasMessageContaining("No mute windows");
  }

  private static MatchRecord record(long startMs, long endMs, String word) {
    return new MatchRecord(startMs, endMs, word, word, 100.0, word, "****");
  }
}
