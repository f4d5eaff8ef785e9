package com.scholary.censor.catalog;

import java.util.Optional;

/**
 * One raw entry of a term catalog, before it is resolved into a {@link Term}.
 *
 * <p>Catalog files mix bare words and structured objects. Each shape gets its own
 * implementation and is resolved exactly once, when the catalog is built.
 */
public interface CatalogEntry {

  /**
   * Resolve this entry into a term.
   *
   * @param defaultThreshold the catalog-wide threshold used when the entry has none
   * @return the term, or empty if the entry has no usable word
   */
  Optional<Term> toTerm(double defaultThreshold);
}
