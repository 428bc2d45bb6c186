package com.hrsynth.api.model;

import java.time.LocalDate;

/**
 * Parameters of one generation run. Null dates and seed are resolved by the service; the include
 * flags decide whether the compensation and performance tables are produced at all.
 */
public record GenerationRequest(
    int nEmployees,
    LocalDate startDate,
    LocalDate endDate,
    Long seed,
    boolean includePerformance,
    boolean includeCompensation) {

  public static GenerationRequest of(int nEmployees, LocalDate startDate, LocalDate endDate, Long seed) {
    return new GenerationRequest(nEmployees, startDate, endDate, seed, true, true);
  }
}
