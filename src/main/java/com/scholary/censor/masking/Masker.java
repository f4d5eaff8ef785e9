package com.scholary.censor.masking;

import com.scholary.censor.matching.MatchResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rewrites an original (non-normalized) line so that matched terms become asterisks.
 *
 * <p>Matches carry normalized text only, so each one is searched for again in the original
 * line. For every match, longest window first:
 *
 * <ol>
 *   <li>replace every whole-word, case-insensitive occurrence of the window text
 *   <li>if nothing was replaced, try the term's configured word instead
 *   <li>if that fails too, the match leaves the line untouched
 * </ol>
 *
 * <p>Longest first means a phrase is blanked before any single word inside it, so the shorter
 * match doesn't split the phrase. Each replaced run keeps its exact character count, and all
 * other characters (spacing, punctuation, markup) are left alone.
 */
@Component
public class Masker {

  static final char MASK_CHAR = '*';

  private static final int PATTERN_FLAGS =
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

  /**
   * Mask a line.
   *
   * @param originalText the line as it appears in the subtitle track
   * @param matches matches found in that line
   * @return the masked line, same length as the original
   */
  public String mask(String originalText, List<MatchResult> matches) {
    return redact(originalText, matches).maskedText();
  }

  /**
   * Mask a line and report which matches could not be located.
   *
   * @param originalText the line as it appears in the subtitle track
   * @param matches matches found in that line
   * @return the masked line and the matches that produced no replacement
   */
  public Redaction redact(String originalText, List<MatchResult> matches) {
    if (originalText == null || matches.isEmpty()) {
      return new Redaction(originalText, List.of());
    }

    List<MatchResult> ordered = new ArrayList<>(matches);
    // List.sort is stable, so equal-length windows keep their match order
    ordered.sort(Comparator.comparingInt((MatchResult m) -> m.windowText().length()).reversed());

    String masked = originalText;
    List<MatchResult> unredacted = new ArrayList<>();

    for (MatchResult match : ordered) {
      boolean replaced = false;
      for (String literal : List.of(match.windowText(), match.term().word())) {
        if (literal == null || literal.isEmpty()) {
          continue;
        }
        Replacement replacement = maskWholeWords(masked, literal);
        masked = replacement.text();
        if (replacement.count() > 0) {
          replaced = true;
          break;
        }
      }
      if (!replaced) {
        unredacted.add(match);
      }
    }

    return new Redaction(masked, unredacted);
  }

  /**
   * Count whole-word, case-insensitive occurrences of a literal.
   *
   * @param text text to search
   * @param literal the word or phrase to look for
   * @return number of occurrences
   */
  public static int countWholeWords(String text, String literal) {
    if (text == null || literal == null || literal.isEmpty()) {
      return 0;
    }
    Matcher matcher = wholeWordPattern(literal).matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  static Pattern wholeWordPattern(String literal) {
    return Pattern.compile("\\b" + Pattern.quote(literal) + "\\b", PATTERN_FLAGS);
  }

  private static Replacement maskWholeWords(String text, String literal) {
    Matcher matcher = wholeWordPattern(literal).matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    int count = 0;
    while (matcher.find()) {
      String found = matcher.group();
      matcher.appendReplacement(
          out, String.valueOf(MASK_CHAR).repeat(found.codePointCount(0, found.length())));
      count++;
    }
    matcher.appendTail(out);
    return new Replacement(out.toString(), count);
  }

  private record Replacement(String text, int count) {}
}
