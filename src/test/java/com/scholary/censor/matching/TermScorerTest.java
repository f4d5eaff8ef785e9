package com.scholary.censor.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TermScorerTest {

  @Test
  void scoreSingleWord_exactMatch() {
    assertThat(TermScorer.scoreSingleWord("damn", "damn", false)).isEqualTo(100.0);
  }

  @Test
  void scoreSingleWord_baseSuffixes() {
    assertThat(TermScorer.scoreSingleWord("damned", "damn", false)).isEqualTo(100.0);
    assertThat(TermScorer.scoreSingleWord("damning", "damn", false)).isEqualTo(100.0);
    assertThat(TermScorer.scoreSingleWord("damns", "damn", false)).isEqualTo(100.0);
  }

  @Test
  void scoreSingleWord_suffixWorksInBothDirections() {
    assertThat(TermScorer.scoreSingleWord("damn", "damned", false)).isEqualTo(100.0);
  }

  @Test
  void scoreSingleWord_derivationalSuffixNeedsAggressive() {
    assertThat(TermScorer.scoreSingleWord("coolness", "cool", true)).isEqualTo(100.0);
    assertThat(TermScorer.scoreSingleWord("coolness", "cool", false))
        .isCloseTo(66.667, within(0.001));
  }

  @Test
  void scoreSingleWord_aggressiveSubstring() {
    assertThat(TermScorer.scoreSingleWord("misuse", "use", true)).isEqualTo(100.0);
    assertThat(TermScorer.scoreSingleWord("overuse", "use", true)).isEqualTo(100.0);
    assertThat(TermScorer.scoreSingleWord("placement", "place", true)).isEqualTo(100.0);
  }

  @Test
  void scoreSingleWord_aggressiveRulesNeedThreeLetters() {
    // "ho" is too short for the substring rule
    assertThat(TermScorer.scoreSingleWord("shoe", "ho", true)).isLessThan(100.0);
  }

  @Test
  void scoreSingleWord_firstLetterPenalty() {
    // "ass" is common: 2 * 3 / 8 = 75, minus the penalty
    assertThat(TermScorer.scoreSingleWord("bass", "mass", false)).isEqualTo(50.0);
    // Same first letter: no penalty
    assertThat(TermScorer.scoreSingleWord("mast", "mass", false)).isEqualTo(75.0);
  }

  @Test
  void scoreSingleWord_noPenaltyWhenOneContainsTheOther() {
    assertThat(TermScorer.scoreSingleWord("bass", "ass", false)).isCloseTo(85.714, within(0.001));
  }

  @Test
  void scoreSingleWord_neverNegative() {
    assertThat(TermScorer.scoreSingleWord("xyz", "abc", false)).isEqualTo(0.0);
  }

  @Test
  void scoreWindow_phrasesUsePlainSimilarity() {
    assertThat(TermScorer.scoreWindow("son of a gun", "son of a gun", false)).isEqualTo(100.0);
    assertThat(TermScorer.scoreWindow("sons of a gun", "son of a gun", false))
        .isCloseTo(96.0, within(0.001));
  }

  @Test
  void scoreWindow_emptyInput() {
    assertThat(TermScorer.scoreWindow("", "damn", false)).isEqualTo(0.0);
  }
}
