package com.hrsynth.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CompensationRecord implements TimeVariant {

  String employeeId;

  BigDecimal baseSalary;

  BigDecimal bonusTargetPct;

  String currency;

  LocalDate startDate;

  @With LocalDate endDate;

  ChangeReason changeReason;
}
