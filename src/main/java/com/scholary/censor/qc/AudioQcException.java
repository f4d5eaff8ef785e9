package com.scholary.censor.qc;

/** Exception thrown when audio QC can't be carried out. */
public class AudioQcException extends RuntimeException {

  public AudioQcException(String message) {
    super(message);
  }
}
