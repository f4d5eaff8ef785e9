package com.scholary.censor.matching;

import java.util.List;

/**
 * Scores a window of normalized words against a normalized term.
 *
 * <p>Single words go through morphological checks before falling back to edit similarity:
 *
 * <ol>
 *   <li>Exact equality scores 100
 *   <li>One word is the other plus an allowed suffix: 100
 *   <li>Aggressive terms of 3+ letters: the term inside the word, or the word being the term
 *       bracketed by a compound particle: 100
 *   <li>Otherwise edit similarity, with a first-letter penalty
 * </ol>
 *
 * <p>Phrases (either side has more than one word) only use plain edit similarity.
 */
public final class TermScorer {

  /** Subtracted when two words differ in their first letter and share no substring. */
  static final double FIRST_LETTER_PENALTY = 25.0;

  private static final int MIN_LENGTH_FOR_LOOSE_RULES = 3;

  private TermScorer() {}

  /**
   * Score a window against a term.
   *
   * @param windowText normalized window, words separated by single spaces
   * @param target normalized term
   * @param aggressive whether the term uses aggressive matching
   * @return score in [0, 100]
   */
  public static double scoreWindow(String windowText, String target, boolean aggressive) {
    if (windowText.isEmpty() || target.isEmpty()) {
      return 0.0;
    }
    if (windowText.indexOf(' ') < 0 && target.indexOf(' ') < 0) {
      return scoreSingleWord(windowText, target, aggressive);
    }
    return SimilarityRatio.ratio(windowText, target);
  }

  /**
   * Score one normalized word against one normalized term word.
   *
   * @param query the word from the text
   * @param target the term word
   * @param aggressive whether the term uses aggressive matching
   * @return score in [0, 100]
   */
  public static double scoreSingleWord(String query, String target, boolean aggressive) {
    if (query.equals(target)) {
      return 100.0;
    }

    List<String> suffixes =
        aggressive ? MatchingTables.AGGRESSIVE_SUFFIXES : MatchingTables.BASE_SUFFIXES;
    for (String suffix : suffixes) {
      if (query.equals(target + suffix) || target.equals(query + suffix)) {
        return 100.0;
      }
    }

    if (aggressive && target.length() >= MIN_LENGTH_FOR_LOOSE_RULES) {
      if (query.contains(target)) {
        return 100.0;
      }
      for (String particle : MatchingTables.COMPOUND_PARTICLES) {
        if (query.equals(particle + target) || query.equals(target + particle)) {
          return 100.0;
        }
      }
    }

    double score = SimilarityRatio.ratio(query, target);
    if (query.length() >= MIN_LENGTH_FOR_LOOSE_RULES
        && target.length() >= MIN_LENGTH_FOR_LOOSE_RULES
        && query.charAt(0) != target.charAt(0)
        && !query.contains(target)
        && !target.contains(query)) {
      score = Math.max(0.0, score - FIRST_LETTER_PENALTY);
    }
    return score;
  }
}
