package com.scholary.censor.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the event's fields into the MDC, logs one line, and clears the fields
 * again, so log shippers can index the fields without parsing the message.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log catalog loaded event. */
  public void logCatalogLoaded(String source, int terms) {
    try {
      MDC.put("event_type", "catalog_loaded");
      MDC.put("catalog_source", source);
      MDC.put("terms", String.valueOf(terms));

      logger.info("Catalog loaded: source={}, terms={}", source, terms);
    } finally {
      clearEventFields();
    }
  }

  /** Log a masked subtitle event. */
  public void logEventMasked(int eventIndex, long startMs, long endMs, int matches) {
    try {
      MDC.put("event_type", "event_masked");
      MDC.put("event_index", String.valueOf(eventIndex));
      MDC.put("start_ms", String.valueOf(startMs));
      MDC.put("end_ms", String.valueOf(endMs));
      MDC.put("matches", String.valueOf(matches));

      logger.debug(
          "Event masked: index={}, range=[{}-{}]ms, matches={}", eventIndex, startMs, endMs, matches);
    } finally {
      clearEventFields();
    }
  }

  /** Log a match that was recorded but left no visible redaction. */
  public void logMatchUnredacted(int eventIndex, String windowText, String targetWord) {
    try {
      MDC.put("event_type", "match_unredacted");
      MDC.put("event_index", String.valueOf(eventIndex));
      MDC.put("matched_text", windowText);
      MDC.put("target_word", targetWord);

      logger.warn(
          "Match could not be redacted: index={}, matched='{}', target='{}'",
          eventIndex,
          windowText,
          targetWord);
    } finally {
      clearEventFields();
    }
  }

  /** Log masking run finished event. */
  public void logMaskingCompleted(int events, int maskedEvents, int records, long elapsedMs) {
    try {
      MDC.put("event_type", "masking_completed");
      MDC.put("events", String.valueOf(events));
      MDC.put("masked_events", String.valueOf(maskedEvents));
      MDC.put("records", String.valueOf(records));
      MDC.put("elapsed_ms", String.valueOf(elapsedMs));

      logger.info(
          "Masking completed: events={}, masked={}, records={}, elapsed={}ms",
          events,
          maskedEvents,
          records,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log mute window planning event. */
  public void logWindowsPlanned(int sourceIntervals, int mergedWindows, double mutedSeconds) {
    try {
      MDC.put("event_type", "windows_planned");
      MDC.put("source_intervals", String.valueOf(sourceIntervals));
      MDC.put("merged_windows", String.valueOf(mergedWindows));
      MDC.put("muted_seconds", String.valueOf(mutedSeconds));

      logger.info(
          "Mute windows planned: intervals={}, windows={}, muted={}s",
          sourceIntervals,
          mergedWindows,
          mutedSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log QC verdict event. */
  public void logQcVerdict(String stage, boolean passed, String detail) {
    try {
      MDC.put("event_type", "qc_verdict");
      MDC.put("stage", stage);
      MDC.put("passed", String.valueOf(passed));

      if (passed) {
        logger.info("QC passed: stage={}, {}", stage, detail);
      } else {
        logger.warn("QC failed: stage={}, {}", stage, detail);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String correlationId, String source) {
    MDC.put("correlationId", correlationId);
    MDC.put("source", source);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove("correlationId");
    MDC.remove("source");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("catalog_source");
    MDC.remove("terms");
    MDC.remove("event_index");
    MDC.remove("start_ms");
    MDC.remove("end_ms");
    MDC.remove("matches");
    MDC.remove("matched_text");
    MDC.remove("target_word");
    MDC.remove("events");
    MDC.remove("masked_events");
    MDC.remove("records");
    MDC.remove("elapsed_ms");
    MDC.remove("source_intervals");
    MDC.remove("merged_windows");
    MDC.remove("muted_seconds");
    MDC.remove("stage");
    MDC.remove("passed");
  }
}
