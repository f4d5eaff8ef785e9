package com.scholary.censor.record;

import com.scholary.censor.interval.Interval;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the time ranges back out of a match CSV.
 *
 * <p>Only {@code start_ms} and {@code end_ms} are used. A missing column reads as 0; rows whose
 * times don't parse are skipped.
 */
@Component
public class MatchRecordCsvReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(MatchRecordCsvReader.class);

  private static final CSVFormat FORMAT =
      CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).setIgnoreEmptyLines(true).build();

  /**
   * Read intervals from a match CSV file.
   *
   * @param path the CSV file
   * @return one interval per usable row, in seconds, in file order
   * @throws IOException if the file can't be read
   */
  public List<Interval> readIntervals(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return readIntervals(reader);
    }
  }

  public List<Interval> readIntervals(Reader reader) throws IOException {
    List<Interval> intervals = new ArrayList<>();
    int skipped = 0;

    try (CSVParser parser = FORMAT.parse(reader)) {
      for (CSVRecord row : parser) {
        try {
          double startMs = Double.parseDouble(column(row, "start_ms"));
          double endMs = Double.parseDouble(column(row, "end_ms"));
          intervals.add(new Interval(startMs / 1000.0, endMs / 1000.0));
        } catch (IllegalArgumentException e) {
          // Unparsable number, or end before start
          skipped++;
        }
      }
    }

    if (skipped > 0) {
      LOGGER.warn("Skipped {} match rows with unusable times", skipped);
    }
    return intervals;
  }

  private static String column(CSVRecord row, String name) {
    if (!row.isMapped(name) || !row.isSet(name)) {
      return "0";
    }
    return row.get(name).trim();
  }
}
