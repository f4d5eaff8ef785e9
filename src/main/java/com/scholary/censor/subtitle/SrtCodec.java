package com.scholary.censor.subtitle;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes SubRip (SRT) subtitles.
 *
 * <p>Format:
 *
 * <pre>
 * 1
 * 00:00:00,000 --> 00:00:05,200
 * Hello world
 *
 * 2
 * 00:00:05,200 --> 00:00:10,300
 * This is a test
 * second line
 * </pre>
 *
 * <p>Multi-line text is kept as a single event text joined with {@code \n}. Event order is
 * preserved exactly; the masking stage relies on it.
 */
@Component
public class SrtCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(SrtCodec.class);

  // Example: 00:01:02,345 --> 00:01:04,000 (some tools write '.' instead of ',')
  private static final Pattern TIMING_PATTERN =
      Pattern.compile(
          "(\\d+):(\\d{1,2}):(\\d{1,2})[,.](\\d{1,3})\\s*-->\\s*(\\d+):(\\d{1,2}):(\\d{1,2})[,.](\\d{1,3}).*");

  private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n\\s*\\n");

  /**
   * Parse SRT content.
   *
   * <p>Blocks without a valid timing line are skipped with a warning.
   *
   * @param content the full SRT text
   * @return events in file order
   */
  public List<SubtitleEvent> parse(String content) {
    List<SubtitleEvent> events = new ArrayList<>();
    if (content == null || content.isBlank()) {
      return events;
    }

    String text = content.replace("\r\n", "\n").replace('\r', '\n');
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }

    int skipped = 0;
    for (String block : BLOCK_SEPARATOR.split(text.strip())) {
      List<String> lines = new ArrayList<>(List.of(block.strip().split("\n")));

      // Sequence number is optional; the timing line is not
      if (!lines.isEmpty() && !TIMING_PATTERN.matcher(lines.get(0).trim()).matches()) {
        lines.remove(0);
      }
      if (lines.isEmpty()) {
        skipped++;
        continue;
      }

      Matcher timing = TIMING_PATTERN.matcher(lines.get(0).trim());
      if (!timing.matches()) {
        skipped++;
        continue;
      }

      long start = toMillis(timing, 1);
      long end = toMillis(timing, 5);
      String body = String.join("\n", lines.subList(1, lines.size()));
      events.add(new SubtitleEvent(start, end, body));
    }

    if (skipped > 0) {
      LOGGER.warn("Skipped {} malformed SRT blocks", skipped);
    }
    return events;
  }

  /**
   * Write events as SRT, numbering them from 1.
   *
   * @param events events in order
   * @return the SRT text
   */
  public String write(List<SubtitleEvent> events) {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < events.size(); i++) {
      SubtitleEvent event = events.get(i);

      srt.append(i + 1).append("\n");
      srt.append(formatTime(event.startMs()))
          .append(" --> ")
          .append(formatTime(event.endMs()))
          .append("\n");
      srt.append(event.text()).append("\n");

      // Blank line between entries
      srt.append("\n");
    }

    return srt.toString();
  }

  /**
   * Format milliseconds as an SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds)
   */
  static String formatTime(long millis) {
    long clamped = Math.max(0, millis);
    long hours = clamped / 3_600_000;
    long minutes = (clamped % 3_600_000) / 60_000;
    long secs = (clamped % 60_000) / 1000;
    long ms = clamped % 1000;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, ms);
  }

  private static long toMillis(Matcher matcher, int firstGroup) {
    long hours = Long.parseLong(matcher.group(firstGroup));
    long minutes = Long.parseLong(matcher.group(firstGroup + 1));
    long seconds = Long.parseLong(matcher.group(firstGroup + 2));
    String fraction = matcher.group(firstGroup + 3);
    // ",5" means 500 ms, not 5 ms
    long millis = Long.parseLong((fraction + "00").substring(0, 3));
    return hours * 3_600_000 + minutes * 60_000 + seconds * 1000 + millis;
  }
}
