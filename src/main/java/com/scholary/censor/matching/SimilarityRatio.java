package com.scholary.censor.matching;

/**
 * Normalized edit similarity between two strings, as a percentage.
 *
 * <p>Uses the insertion/deletion form of Levenshtein alignment: the score is
 * {@code 100 * 2 * LCS(a, b) / (|a| + |b|)}, where LCS is the longest common subsequence.
 * Symmetric, 100 for identical strings, 0 when no character lines up.
 */
public final class SimilarityRatio {

  private SimilarityRatio() {}

  /**
   * Compute the similarity of two strings.
   *
   * @param a first string
   * @param b second string
   * @return similarity in [0, 100]; two empty strings are identical
   */
  public static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 100.0;
    }
    return 100.0 * (2.0 * longestCommonSubsequence(a, b)) / total;
  }

  /** Classic two-row dynamic program, O(|a| * |b|) time and O(|b|) space. */
  static int longestCommonSubsequence(String a, String b) {
    if (a.isEmpty() || b.isEmpty()) {
      return 0;
    }
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];

    for (int i = 1; i <= a.length(); i++) {
      char ca = a.charAt(i - 1);
      for (int j = 1; j <= b.length(); j++) {
        if (ca == b.charAt(j - 1)) {
          current[j] = previous[j - 1] + 1;
        } else {
          current[j] = Math.max(previous[j], current[j - 1]);
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }
}
