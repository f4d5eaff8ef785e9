package com.scholary.censor.catalog;

/**
 * A forbidden term with its own matching tolerance.
 *
 * <p>Terms are not deduplicated: the same word may appear several times with different
 * thresholds, and each one is matched independently.
 *
 * @param word the term as configured (not normalized)
 * @param threshold minimum score (0-100, inclusive) for a window to count as a match
 * @param aggressive widens the suffix set and enables substring and compound matching
 */
public record Term(String word, double threshold, boolean aggressive) {

  public static final double MIN_THRESHOLD = 0.0;
  public static final double MAX_THRESHOLD = 100.0;

  public Term {
    if (word == null || word.isBlank()) {
      throw new IllegalArgumentException("Term word cannot be blank");
    }
    if (Double.isNaN(threshold) || threshold < MIN_THRESHOLD || threshold > MAX_THRESHOLD) {
      throw new IllegalArgumentException(
          "Threshold must be between " + MIN_THRESHOLD + " and " + MAX_THRESHOLD + ": " + threshold);
    }
  }

  public Term(String word, double threshold) {
    this(word, threshold, false);
  }
}
