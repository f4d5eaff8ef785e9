package com.scholary.censor.record;

import com.scholary.censor.interval.Interval;

/**
 * Flat, persisted form of one match, consumed by the muting stage.
 *
 * @param startMs start of the subtitle event
 * @param endMs end of the subtitle event
 * @param matchedText the normalized window that matched
 * @param targetWord the term word as configured
 * @param score similarity score, 0-100
 * @param originalText the event's text before masking
 * @param maskedText the event's text after masking
 */
public record MatchRecord(
    long startMs,
    long endMs,
    String matchedText,
    String targetWord,
    double score,
    String originalText,
    String maskedText) {

  /** The event's time range in seconds. */
  public Interval toInterval() {
    return Interval.ofMillis(startMs, endMs);
  }
}
