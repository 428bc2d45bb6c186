package com.hrsynth.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EmploymentType {
  FULL_TIME("Full-time"),
  CONTRACT("Contract"),
  PART_TIME("Part-time");

  private final String label;

  EmploymentType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
