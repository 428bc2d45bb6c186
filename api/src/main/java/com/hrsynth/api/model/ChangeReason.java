package com.hrsynth.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why a compensation record was opened. */
public enum ChangeReason {
  NEW_HIRE("New Hire"),
  ANNUAL_MERIT("Annual Merit"),
  PROMOTION("Promotion");

  private final String label;

  ChangeReason(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
