package com.hrsynth.api.exception;

/**
 * Invalid request parameters or generator configuration: employee count below one, an empty or
 * inverted date window, malformed bands, or band minimums that cannot be met at the requested size.
 */
public class ConfigurationException extends HrGenerationException {

  public ConfigurationException(String message) {
    super(message);
  }
}
