package com.hrsynth.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobAssignment implements TimeVariant {

  String employeeId;

  String jobId;

  String jobTitle;

  String jobFamily;

  String jobLevel;

  int seniorityLevel;

  LocalDate startDate;

  @With LocalDate endDate;

  public static JobAssignment open(String employeeId, JobRole job, LocalDate startDate) {
    return JobAssignment.builder()
        .employeeId(employeeId)
        .jobId(job.getJobId())
        .jobTitle(job.getJobTitle())
        .jobFamily(job.getJobFamily())
        .jobLevel(job.getJobLevel())
        .seniorityLevel(job.getSeniorityLevel())
        .startDate(startDate)
        .build();
  }
}
