package com.scholary.censor.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw dialogue text into the form the matcher compares against.
 *
 * <p>Steps, in order:
 *
 * <ol>
 *   <li>Lowercase
 *   <li>NFKD decomposition, then drop combining marks ("café" becomes "cafe")
 *   <li>Hyphens, underscores and apostrophes become a space
 *   <li>Remaining punctuation and symbols become a space
 *   <li>Digits become a space
 *   <li>Collapse whitespace runs and trim
 * </ol>
 *
 * <p>The result only contains letters separated by single spaces, so normalizing it again
 * returns it unchanged.
 */
public final class TextNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern WORD_JOINERS = Pattern.compile("[-_'\\u2019]");
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern DIGITS = Pattern.compile("\\p{N}+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private TextNormalizer() {}

  /**
   * Normalize text for matching.
   *
   * @param text raw text, may be null
   * @return the canonical form, or an empty string for null/blank input
   */
  public static String normalize(String text) {
    if (text == null || text.isBlank()) {
      return "";
    }

    String result = text.toLowerCase(Locale.ROOT);
    result = Normalizer.normalize(result, Normalizer.Form.NFKD);
    result = COMBINING_MARKS.matcher(result).replaceAll("");
    // Compatibility decomposition can surface uppercase letters (e.g. "ℌ" -> "H")
    result = result.toLowerCase(Locale.ROOT);
    result = WORD_JOINERS.matcher(result).replaceAll(" ");
    result = NON_WORD.matcher(result).replaceAll(" ");
    result = DIGITS.matcher(result).replaceAll(" ");
    result = WHITESPACE.matcher(result).replaceAll(" ");
    return result.trim();
  }

  /**
   * Normalize text and split it into words.
   *
   * @param text raw text, may be null
   * @return normalized words in order, empty if nothing survives normalization
   */
  public static List<String> words(String text) {
    String normalized = normalize(text);
    List<String> words = new ArrayList<>();
    if (normalized.isEmpty()) {
      return words;
    }
    for (String word : normalized.split(" ")) {
      words.add(word);
    }
    return words;
  }
}
