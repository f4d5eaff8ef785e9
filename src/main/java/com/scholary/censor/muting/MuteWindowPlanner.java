package com.scholary.censor.muting;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.censor.config.CensorProperties;
import com.scholary.censor.interval.Interval;
import com.scholary.censor.interval.IntervalMerger;
import com.scholary.censor.logging.StructuredLogger;
import com.scholary.censor.record.MatchRecord;
import com.scholary.censor.record.MatchRecordCsvReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns match records into the mute windows handed to the transcoder.
 *
 * <p>Each record's event range becomes one interval; overlapping and touching intervals are
 * merged so that a line with several matches, or back-to-back matched lines, mute once.
 *
 * <p>The merged windows are persisted as a JSON sidecar:
 *
 * <pre>
 * [
 *   {"start": 1.0, "end": 2.5},
 *   {"start": 7.25, "end": 9.0}
 * ]
 * </pre>
 */
@Component
public class MuteWindowPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(MuteWindowPlanner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final TypeReference<List<Interval>> INTERVAL_LIST = new TypeReference<>() {};

  private final MatchRecordCsvReader csvReader;
  private final ObjectMapper objectMapper;
  private final double epsilon;
  private final String sidecarFileName;

  public MuteWindowPlanner(
      MatchRecordCsvReader csvReader, ObjectMapper objectMapper, CensorProperties properties) {
    this.csvReader = csvReader;
    this.objectMapper = objectMapper;
    this.epsilon = properties.intervals().mergeEpsilon();
    this.sidecarFileName = properties.output().windowsSidecarFile();
  }

  /**
   * Derive mute windows from a match CSV and write the sidecar next to the other outputs.
   *
   * @param matchesCsv the match CSV written by the masking run
   * @param outputDir directory for the sidecar, created if missing
   * @return the sidecar path
   * @throws IOException if reading or writing fails
   * @throws MuteWindowException if the CSV holds no usable window
   */
  public Path planSidecar(Path matchesCsv, Path outputDir) throws IOException {
    List<Interval> windows = readCsv(matchesCsv);
    if (windows.isEmpty()) {
      throw new MuteWindowException("No mute windows found in matches CSV");
    }
    Files.createDirectories(outputDir);
    Path sidecar = outputDir.resolve(sidecarFileName);
    writeSidecar(windows, sidecar);
    return sidecar;
  }

  /**
   * Plan mute windows from in-memory records.
   *
   * @param records match records from a masking run
   * @return merged windows in seconds, sorted
   */
  public List<Interval> plan(List<MatchRecord> records) {
    List<Interval> intervals = new ArrayList<>(records.size());
    for (MatchRecord record : records) {
      try {
        intervals.add(record.toInterval());
      } catch (IllegalArgumentException e) {
        LOGGER.warn(
            "Skipping record with unusable range [{}-{}]ms: {}",
            record.startMs(),
            record.endMs(),
            e.getMessage());
      }
    }
    return mergeAndLog(intervals);
  }

  /**
   * Load windows from a match CSV or a JSON sidecar, chosen by file extension.
   *
   * @param path a {@code .json} sidecar or a match CSV
   * @return merged windows
   * @throws IOException if the file can't be read
   * @throws MuteWindowException if the file holds no usable window
   */
  public List<Interval> loadWindows(Path path) throws IOException {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    List<Interval> windows = name.endsWith(".json") ? readSidecar(path) : readCsv(path);
    if (windows.isEmpty()) {
      throw new MuteWindowException("No mute windows found in " + path);
    }
    return windows;
  }

  /**
   * Read a match CSV and merge its rows into windows.
   *
   * @param csvPath the match CSV
   * @return merged windows, possibly empty
   * @throws IOException if the file can't be read
   */
  public List<Interval> readCsv(Path csvPath) throws IOException {
    return mergeAndLog(csvReader.readIntervals(csvPath));
  }

  /**
   * Write windows as a JSON sidecar.
   *
   * @param windows merged windows
   * @param path destination file
   * @throws IOException if writing fails
   */
  public void writeSidecar(List<Interval> windows, Path path) throws IOException {
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), windows);
    LOGGER.info("Mute windows written to {} ({} windows)", path, windows.size());
  }

  /**
   * Read a JSON sidecar. The windows are merged again in case the file was edited by hand.
   *
   * @param path the sidecar file
   * @return merged windows
   * @throws IOException if the file can't be read or parsed
   */
  public List<Interval> readSidecar(Path path) throws IOException {
    List<Interval> windows = objectMapper.readValue(path.toFile(), INTERVAL_LIST);
    return IntervalMerger.merge(windows, epsilon);
  }

  /**
   * Build the transcoder audio filter that silences every window.
   *
   * <p>One volume filter with all ranges OR-ed in its enable expression:
   * {@code volume=enable='between(t,1.000,2.500)+between(t,7.250,9.000)':volume=0}
   *
   * @param windows merged windows
   * @return the filter expression for the transcoder's {@code -af} option
   * @throws MuteWindowException if there are no windows
   */
  public String volumeFilter(List<Interval> windows) {
    if (windows.isEmpty()) {
      throw new MuteWindowException("No mute windows to apply");
    }
    List<String> conditions = new ArrayList<>(windows.size());
    for (Interval window : windows) {
      conditions.add(
          String.format(Locale.ROOT, "between(t,%.3f,%.3f)", window.start(), window.end()));
    }
    return "volume=enable='" + String.join("+", conditions) + "':volume=0";
  }

  private List<Interval> mergeAndLog(List<Interval> intervals) {
    List<Interval> merged = IntervalMerger.merge(intervals, epsilon);
    double mutedSeconds = merged.stream().mapToDouble(Interval::duration).sum();
    STRUCTURED_LOGGER.logWindowsPlanned(intervals.size(), merged.size(), mutedSeconds);
    return merged;
  }
}
