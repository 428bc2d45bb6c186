package com.hrsynth.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** First-name lists per gender and the shared last-name list. */
public record NameTables(
    @JsonProperty("female_first_names") List<String> femaleFirstNames,
    @JsonProperty("male_first_names") List<String> maleFirstNames,
    @JsonProperty("neutral_first_names") List<String> neutralFirstNames,
    @JsonProperty("last_names") List<String> lastNames) {

  public List<String> firstNamesFor(Gender gender) {
    return switch (gender) {
      case FEMALE -> femaleFirstNames;
      case MALE -> maleFirstNames;
      case NA -> neutralFirstNames;
    };
  }
}
