package com.scholary.censor.text;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

  @Test
  void normalize_lowercases() {
    assertThat(TextNormalizer.normalize("HELLO WORLD")).isEqualTo("hello world");
  }

  @Test
  void normalize_stripsDiacritics() {
    assertThat(TextNormalizer.normalize("café")).isEqualTo("cafe");
    assertThat(TextNormalizer.normalize("naïve")).isEqualTo("naive");
  }

  @Test
  void normalize_splitsOnHyphensUnderscoresAndApostrophes() {
    assertThat(TextNormalizer.normalize("don't")).isEqualTo("don t");
    assertThat(TextNormalizer.normalize("mother-in-law")).isEqualTo("mother in law");
    assertThat(TextNormalizer.normalize("snake_case")).isEqualTo("snake case");
  }

  @Test
  void normalize_removesPunctuation() {
    assertThat(TextNormalizer.normalize("hello, world!")).isEqualTo("hello world");
    assertThat(TextNormalizer.normalize("what?")).isEqualTo("what");
    assertThat(TextNormalizer.normalize("<i>Hey</i>")).isEqualTo("i hey i");
  }

  @Test
  void normalize_removesDigits() {
    assertThat(TextNormalizer.normalize("test123abc")).isEqualTo("test abc");
    assertThat(TextNormalizer.normalize("42")).isEmpty();
  }

  @Test
  void normalize_collapsesWhitespace() {
    assertThat(TextNormalizer.normalize("hello   world")).isEqualTo("hello world");
    assertThat(TextNormalizer.normalize("  leading trailing  ")).isEqualTo("leading trailing");
    assertThat(TextNormalizer.normalize("two\nlines\ttabbed")).isEqualTo("two lines tabbed");
  }

  @Test
  void normalize_emptyInputs() {
    assertThat(TextNormalizer.normalize(null)).isEmpty();
    assertThat(TextNormalizer.normalize("")).isEmpty();
    assertThat(TextNormalizer.normalize("   ")).isEmpty();
    assertThat(TextNormalizer.normalize("?!...")).isEmpty();
  }

  @Test
  void normalize_foldsCompatibilityCharacters() {
    assertThat(TextNormalizer.normalize("ℌello Wörld – 42 d'oh!!")).isEqualTo("hello world d oh");
  }

  @Test
  void normalize_isIdempotent() {
    List<String> samples =
        List.of(
            "This is DAMN funny!",
            "Crème brûlée, s'il vous plaît",
            "İstanbul",
            "ℌello Wörld – 42 d'oh!!",
            "f.u.c.k_this-thing 99 times",
            "  \t spaced out  ");

    for (String sample : samples) {
      String once = TextNormalizer.normalize(sample);
      assertThat(TextNormalizer.normalize(once)).as(sample).isEqualTo(once);
    }
  }

  @Test
  void words_splitsNormalizedText() {
    assertThat(TextNormalizer.words("He was DAMNED!")).containsExactly("he", "was", "damned");
    assertThat(TextNormalizer.words("  ")).isEmpty();
  }
}
