package com.scholary.censor.masking;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.censor.catalog.Term;
import com.scholary.censor.matching.MatchResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MaskerTest {

  private Masker masker;

  @BeforeEach
  void setUp() {
    masker = new Masker();
  }

  @Test
  void mask_replacesMatchedWord() {
    String masked = masker.mask("This is damn funny", List.of(match("damn", "damn")));

    assertThat(masked).isEqualTo("This is **** funny");
  }

  @Test
  void mask_keepsLengthAndPunctuation() {
    String original = "Damn, heck!";

    String masked =
        masker.mask(original, List.of(match("damn", "damn"), match("heck", "heck")));

    assertThat(masked).isEqualTo("****, ****!");
    assertThat(masked).hasSameSizeAs(original);
  }

  @Test
  void mask_replacesEveryOccurrenceCaseInsensitively() {
    String masked = masker.mask("damn DAMN Damn", List.of(match("damn", "damn")));

    assertThat(masked).isEqualTo("**** **** ****");
  }

  @Test
  void mask_onlyWholeWords() {
    String masked = masker.mask("damnation damn", List.of(match("damn", "damn")));

    assertThat(masked).isEqualTo("damnation ****");
  }

  @Test
  void mask_keepsMarkupAroundWord() {
    String masked = masker.mask("<i>damn</i> it", List.of(match("damn", "damn")));

    assertThat(masked).isEqualTo("<i>****</i> it");
  }

  @Test
  void mask_fallsBackToTermWord() {
    // Normalized window "don t" doesn't occur in the original; the configured word does
    String masked = masker.mask("Don't do that", List.of(match("don't", "don t")));

    assertThat(masked).isEqualTo("***** do that");
  }

  @Test
  void mask_noMatchesReturnsOriginal() {
    assertThat(masker.mask("clean line", List.of())).isEqualTo("clean line");
  }

  @Test
  void redact_reportsMatchesThatCannotBeLocated() {
    MatchResult accented = match("cafe", "cafe");

    Redaction redaction = masker.redact("café au lait", List.of(accented));

    assertThat(redaction.maskedText()).isEqualTo("café au lait");
    assertThat(redaction.unredacted()).containsExactly(accented);
    assertThat(redaction.fullyRedacted()).isFalse();
  }

  @Test
  void redact_longestWindowFirst() {
    MatchResult word = match("damn", "damn");
    MatchResult phrase = match("damn it all", "damn it all");

    Redaction redaction = masker.redact("Oh damn it all", List.of(word, phrase));

    assertThat(redaction.maskedText()).isEqualTo("Oh ***********");
    // The word was already covered by the phrase
    assertThat(redaction.unredacted()).containsExactly(word);
  }

  @Test
  void redact_fullyRedacted() {
    Redaction redaction = masker.redact("This is damn funny", List.of(match("damn", "damn")));

    assertThat(redaction.fullyRedacted()).isTrue();
  }

  @Test
  void mask_isDeterministic() {
    List<MatchResult> matches =
        List.of(match("damn", "damn"), match("heck", "heck"), match("hell", "hell"));
    String original = "Damn, what the heck the hell";

    assertThat(masker.mask(original, matches)).isEqualTo(masker.mask(original, matches));
  }

  @Test
  void countWholeWords_countsCaseInsensitiveWholeWords() {
    assertThat(Masker.countWholeWords("Damn damn damnation DAMN", "damn")).isEqualTo(3);
    assertThat(Masker.countWholeWords("**** funny", "damn")).isZero();
    assertThat(Masker.countWholeWords(null, "damn")).isZero();
  }

  private static MatchResult match(String termWord, String windowText) {
    return new MatchResult(new Term(termWord, 85.0), windowText, 100.0);
  }
}
