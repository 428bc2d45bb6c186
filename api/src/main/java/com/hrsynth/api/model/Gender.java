package com.hrsynth.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Gender {
  NA("na"),
  FEMALE("female"),
  MALE("male");

  private final String code;

  Gender(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }
}
