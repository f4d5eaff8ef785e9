package com.scholary.censor.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered, read-only list of terms.
 *
 * <p>Built once per run and shared by every matching pass. Order matters: matches are
 * emitted in catalog order, then by window position.
 */
public final class TermCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(TermCatalog.class);

  public static final double DEFAULT_THRESHOLD = 85.0;

  private final List<Term> terms;
  private final double defaultThreshold;
  private final String source;

  public TermCatalog(List<Term> terms, double defaultThreshold, String source) {
    this.terms = List.copyOf(terms);
    this.defaultThreshold = defaultThreshold;
    this.source = source == null ? "<inline>" : source;
  }

  public TermCatalog(List<Term> terms) {
    this(terms, DEFAULT_THRESHOLD, null);
  }

  /**
   * Resolve raw entries into a catalog.
   *
   * <p>Entries without a usable word, or with a threshold outside 0-100, are dropped. They
   * are logged at debug level only; a partially broken catalog still loads.
   *
   * @param entries raw entries in file order
   * @param defaultThreshold threshold for entries that don't carry their own
   * @param source where the entries came from, used in log and error messages
   * @return the catalog, possibly empty
   */
  public static TermCatalog fromEntries(
      List<? extends CatalogEntry> entries, double defaultThreshold, String source) {
    List<Term> terms = new ArrayList<>();
    int dropped = 0;
    for (CatalogEntry entry : entries) {
      Optional<Term> term;
      try {
        term = entry.toTerm(defaultThreshold);
      } catch (IllegalArgumentException e) {
        LOGGER.debug("Dropping catalog entry {}: {}", entry, e.getMessage());
        dropped++;
        continue;
      }
      if (term.isPresent()) {
        terms.add(term.get());
      } else {
        LOGGER.debug("Dropping catalog entry without a word: {}", entry);
        dropped++;
      }
    }
    if (dropped > 0) {
      LOGGER.debug("Dropped {} malformed entries from {}", dropped, source);
    }
    return new TermCatalog(terms, defaultThreshold, source);
  }

  public List<Term> terms() {
    return terms;
  }

  public double defaultThreshold() {
    return defaultThreshold;
  }

  public String source() {
    return source;
  }

  public int size() {
    return terms.size();
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  /**
   * Fail if there is nothing to match against.
   *
   * @return this catalog, for chaining
   * @throws EmptyCatalogException if the catalog has no terms
   */
  public TermCatalog requireNonEmpty() {
    if (terms.isEmpty()) {
      throw new EmptyCatalogException(source);
    }
    return this;
  }

  @Override
  public String toString() {
    return "TermCatalog[source=" + source + ", terms=" + terms.size() + "]";
  }
}
