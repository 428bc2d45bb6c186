package com.hrsynth.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Row of the {@code employee} hub table. */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Employee {

  public static final String STATUS_ACTIVE = "Active";
  public static final String STATUS_TERMINATED = "Terminated";

  String employeeId;

  String firstName;

  String lastName;

  Gender gender;

  LocalDate birthDate;

  LocalDate hireDate;

  LocalDate terminationDate;

  EmploymentType employmentType;

  String employmentStatus;

  String locationId;

  String managerId;

  int seniorityLevel;

  String workEmail;

  public static String idFor(int slotIndex) {
    return String.format("EMP%06d", slotIndex + 1);
  }
}
