package com.hrsynth.api.model;

import java.util.List;

/** Output table catalog, in the order tables appear in a generated dataset. */
public enum TableName {
  EMPLOYEE(
      "employee",
      List.of(
          "employee_id",
          "first_name",
          "last_name",
          "gender",
          "birth_date",
          "hire_date",
          "termination_date",
          "employment_type",
          "employment_status",
          "location_id",
          "manager_id",
          "seniority_level",
          "work_email")),
  EMPLOYEE_JOB_ASSIGNMENT(
      "employee_job_assignment",
      List.of(
          "employee_id",
          "job_id",
          "job_title",
          "job_family",
          "job_level",
          "seniority_level",
          "start_date",
          "end_date")),
  EMPLOYEE_ORG_ASSIGNMENT(
      "employee_org_assignment",
      List.of(
          "employee_id",
          "org_id",
          "org_name",
          "cost_center",
          "business_unit",
          "start_date",
          "end_date")),
  EMPLOYEE_COMPENSATION(
      "employee_compensation",
      List.of(
          "employee_id",
          "base_salary",
          "bonus_target_pct",
          "currency",
          "start_date",
          "end_date",
          "change_reason")),
  EMPLOYEE_PERFORMANCE(
      "employee_performance",
      List.of(
          "employee_id",
          "review_period_year",
          "review_date",
          "rating",
          "rating_label",
          "manager_id")),
  ORGANIZATION_UNIT(
      "organization_unit",
      List.of("org_id", "org_name", "parent_org_id", "cost_center", "business_unit")),
  JOB_ROLE("job_role", List.of("job_id", "job_title", "job_family", "job_level", "seniority_level")),
  LOCATION(
      "location", List.of("location_id", "city", "country", "region", "latitude", "longitude"));

  private final String tableName;
  private final List<String> columns;

  TableName(String tableName, List<String> columns) {
    this.tableName = tableName;
    this.columns = columns;
  }

  public String tableName() {
    return tableName;
  }

  public List<String> columns() {
    return columns;
  }
}
