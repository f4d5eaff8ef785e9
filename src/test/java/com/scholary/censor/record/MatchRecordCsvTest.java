package com.scholary.censor.record;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.censor.interval.Interval;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MatchRecordCsvTest {

  @TempDir Path tempDir;

  private final MatchRecordCsvWriter writer = new MatchRecordCsvWriter();
  private final MatchRecordCsvReader reader = new MatchRecordCsvReader();

  @Test
  void write_headerAndRows() throws IOException {
    StringWriter out = new StringWriter();

    writer.write(
        List.of(
            new MatchRecord(
                1000, 2500, "damn", "damn", 100.0, "This is damn funny", "This is **** funny")),
        out);

    assertThat(out.toString())
        .isEqualTo(
            "start_ms,end_ms,matched_text,target_word,score,original_text,masked_text\n"
                + "1000,2500,damn,damn,100.0,This is damn funny,This is **** funny\n");
  }

  @Test
  void write_quotesCommasAndNewlines() throws IOException {
    StringWriter out = new StringWriter();

    writer.write(
        List.of(new MatchRecord(0, 1000, "heck", "heck", 100.0, "Oh, heck\nno", "Oh, ****\nno")),
        out);

    assertThat(out.toString()).contains("\"Oh, heck\nno\",\"Oh, ****\nno\"");
  }

  @Test
  void readIntervals_readsWhatWasWritten() throws IOException {
    Path csv = tempDir.resolve("matches.csv");
    writer.write(
        List.of(
            new MatchRecord(1000, 2500, "damn", "damn", 100.0, "a, b", "*, b"),
            new MatchRecord(7250, 9000, "heck", "heck", 92.5, "c", "*")),
        csv);

    List<Interval> intervals = reader.readIntervals(csv);

    assertThat(intervals).containsExactly(new Interval(1.0, 2.5), new Interval(7.25, 9.0));
  }

  @Test
  void readIntervals_skipsUnusableRows() throws IOException {
    String csv =
        "start_ms,end_ms,matched_text\n"
            + "1000,2000,damn\n"
            + "abc,2000,bad\n"
            + ",3000,empty\n"
            + "5000,4000,backwards\n"
            + "6500.0,7000,fractional\n";

    List<Interval> intervals = reader.readIntervals(new StringReader(csv));

    assertThat(intervals).containsExactly(new Interval(1.0, 2.0), new Interval(6.5, 7.0));
  }

  @Test
  void readIntervals_missingColumnReadsAsZero() throws IOException {
    String csv = "end_ms,matched_text\n1500,damn\n";

    List<Interval> intervals = reader.readIntervals(new StringReader(csv));

    assertThat(intervals).containsExactly(new Interval(0.0, 1.5));
  }
}
