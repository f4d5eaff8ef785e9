package com.scholary.censor.catalog;

/**
 * Exception thrown when a term catalog cannot be read or has an unusable shape.
 *
 * <p>Individual malformed entries never cause this; they are skipped while loading.
 */
public class TermCatalogException extends RuntimeException {

  public TermCatalogException(String message) {
    super(message);
  }

  public TermCatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
