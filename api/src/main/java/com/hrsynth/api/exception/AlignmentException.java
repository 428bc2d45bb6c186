package com.hrsynth.api.exception;

/** The reference catalogs cannot pair a job family with an organization of the same unit. */
public class AlignmentException extends HrGenerationException {

  private final String jobFamily;

  public AlignmentException(String jobFamily, String message) {
    super(message);
    this.jobFamily = jobFamily;
  }

  public String getJobFamily() {
    return jobFamily;
  }
}
