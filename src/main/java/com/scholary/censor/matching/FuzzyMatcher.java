package com.scholary.censor.matching;

import com.scholary.censor.catalog.Term;
import com.scholary.censor.catalog.TermCatalog;
import com.scholary.censor.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds catalog terms in free-form text, including inflected and obfuscated forms.
 *
 * <p>Algorithm: normalize the text into words, then for every term slide a window as wide as
 * the term's word count across those words (step 1) and score each window. Windows that are
 * a bare stop-word are skipped. A window matches when its score reaches the term's threshold.
 *
 * <p>Example: term "damn" against "He was damned!" normalizes to ["he", "was", "damned"];
 * "he" and "was" are stop-words, "damned" is "damn" + "ed", so one match scores 100.
 *
 * <p>Matches are not deduplicated. The same span can match several terms, and a phrase match
 * can overlap a single-word match; the masker deals with that.
 */
@Component
public class FuzzyMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(FuzzyMatcher.class);

  /**
   * Find every term occurrence in a text.
   *
   * @param text the original text
   * @param catalog the terms to look for
   * @return matches ordered by catalog order, then window position (left to right)
   */
  public List<MatchResult> findMatches(String text, TermCatalog catalog) {
    List<MatchResult> matches = new ArrayList<>();
    if (catalog.isEmpty()) {
      return matches;
    }

    List<String> words = TextNormalizer.words(text);
    if (words.isEmpty()) {
      return matches;
    }

    for (Term term : catalog.terms()) {
      String target = TextNormalizer.normalize(term.word());
      if (target.isEmpty()) {
        continue;
      }
      int width = target.split(" ").length;

      for (int start = 0; start + width <= words.size(); start++) {
        String windowText = String.join(" ", words.subList(start, start + width));
        if (MatchingTables.STOP_WORDS.contains(windowText)) {
          continue;
        }

        double score = TermScorer.scoreWindow(windowText, target, term.aggressive());
        if (score >= term.threshold()) {
          matches.add(new MatchResult(term, windowText, score));
        }
      }
    }

    if (!matches.isEmpty()) {
      LOGGER.debug("Found {} matches in '{}'", matches.size(), text);
    }
    return matches;
  }
}
