package com.hrsynth.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import lombok.Data;

/** Request body of {@code POST /api/v1/hr-data}. */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerateHrDataInput {

  @Min(1)
  @NotNull
  @JsonProperty("n_employees")
  private Integer employeeCount;

  private LocalDate startDate;

  private LocalDate endDate;

  private Long seed;

  private Boolean includePerformance;

  private Boolean includeCompensation;

  public GenerationRequest toRequest() {
    return new GenerationRequest(
        employeeCount,
        startDate,
        endDate,
        seed,
        includePerformance == null || includePerformance,
        includeCompensation == null || includeCompensation);
  }
}
