package com.scholary.censor.catalog;

/**
 * Exception thrown when masking is requested with no terms configured.
 *
 * <p>This aborts the masking run entirely: without terms there is nothing to redact, and
 * producing an untouched subtitle track would look like a successful pass.
 */
public class EmptyCatalogException extends TermCatalogException {

  public EmptyCatalogException(String source) {
    super("No profanities configured in " + source);
  }
}
