package com.scholary.censor.catalog;

import java.util.Optional;

/**
 * A catalog entry given as an object.
 *
 * @param word the term word, possibly blank
 * @param threshold per-term threshold override, or null to use the catalog default
 * @param aggressive whether aggressive matching was requested
 */
public record StructuredEntry(String word, Double threshold, boolean aggressive)
    implements CatalogEntry {

  @Override
  public Optional<Term> toTerm(double defaultThreshold) {
    if (word == null || word.isBlank()) {
      return Optional.empty();
    }
    double effective = threshold != null ? threshold : defaultThreshold;
    return Optional.of(new Term(word.trim(), effective, aggressive));
  }
}
