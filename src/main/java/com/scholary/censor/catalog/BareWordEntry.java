package com.scholary.censor.catalog;

import java.util.Optional;

/** A catalog entry given as a plain string; it always uses the default threshold. */
public record BareWordEntry(String word) implements CatalogEntry {

  @Override
  public Optional<Term> toTerm(double defaultThreshold) {
    if (word == null || word.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new Term(word.trim(), defaultThreshold, false));
  }
}
