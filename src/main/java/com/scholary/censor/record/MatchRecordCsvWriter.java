package com.scholary.censor.record;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

/**
 * Writes match records as CSV for the muting stage.
 *
 * <p>Column order is fixed:
 *
 * <pre>
 * start_ms,end_ms,matched_text,target_word,score,original_text,masked_text
 * 1000,2500,damn,damn,100.0,This is damn funny,This is **** funny
 * </pre>
 */
@Component
public class MatchRecordCsvWriter {

  static final String[] HEADER = {
    "start_ms", "end_ms", "matched_text", "target_word", "score", "original_text", "masked_text"
  };

  static final CSVFormat FORMAT =
      CSVFormat.DEFAULT.builder().setHeader(HEADER).setRecordSeparator("\n").build();

  /**
   * Write records to a file, replacing it if it exists.
   *
   * @param records records in emission order
   * @param path destination file
   * @throws IOException if writing fails
   */
  public void write(List<MatchRecord> records, Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(records, writer);
    }
  }

  /**
   * Write records to an open writer. The writer is flushed but not closed.
   *
   * @param records records in emission order
   * @param writer destination
   * @throws IOException if writing fails
   */
  public void write(List<MatchRecord> records, Writer writer) throws IOException {
    CSVPrinter printer = new CSVPrinter(writer, FORMAT);
    for (MatchRecord record : records) {
      printer.printRecord(
          record.startMs(),
          record.endMs(),
          record.matchedText(),
          record.targetWord(),
          record.score(),
          record.originalText(),
          record.maskedText());
    }
    printer.flush();
  }
}
