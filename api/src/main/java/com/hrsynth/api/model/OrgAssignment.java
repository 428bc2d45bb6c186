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
public class OrgAssignment implements TimeVariant {

  String employeeId;

  String orgId;

  String orgName;

  String costCenter;

  String businessUnit;

  LocalDate startDate;

  @With LocalDate endDate;

  public static OrgAssignment open(String employeeId, OrganizationUnit org, LocalDate startDate) {
    return OrgAssignment.builder()
        .employeeId(employeeId)
        .orgId(org.getOrgId())
        .orgName(org.getOrgName())
        .costCenter(org.getCostCenter())
        .businessUnit(org.getBusinessUnit())
        .startDate(startDate)
        .build();
  }
}
