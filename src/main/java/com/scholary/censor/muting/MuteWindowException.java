package com.scholary.censor.muting;

/** Exception thrown when no usable mute windows can be derived. */
public class MuteWindowException extends RuntimeException {

  public MuteWindowException(String message) {
    super(message);
  }
}
