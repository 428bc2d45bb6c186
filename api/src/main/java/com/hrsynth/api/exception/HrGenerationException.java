package com.hrsynth.api.exception;

/** Base type for every failure raised while producing a dataset. */
public class HrGenerationException extends RuntimeException {

  public HrGenerationException(String message) {
    super(message);
  }

  public HrGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
