package com.hrsynth.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PerformanceReview {

  String employeeId;

  int reviewPeriodYear;

  LocalDate reviewDate;

  int rating;

  String ratingLabel;

  String managerId;
}
