package com.hrsynth.api.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A generated dataset. Compensation and performance are null when the run excluded them, and the
 * corresponding tables are then absent from {@link #tables()}.
 */
public record HrDataset(
    long seed,
    LocalDate startDate,
    LocalDate endDate,
    List<Employee> employees,
    List<JobAssignment> jobAssignments,
    List<OrgAssignment> orgAssignments,
    List<CompensationRecord> compensation,
    List<PerformanceReview> performance,
    ReferenceCatalog reference) {

  public Optional<List<CompensationRecord>> compensationRecords() {
    return Optional.ofNullable(compensation);
  }

  public Optional<List<PerformanceReview>> performanceReviews() {
    return Optional.ofNullable(performance);
  }

  public Map<String, DataTable<?>> tables() {
    Map<String, DataTable<?>> tables = new LinkedHashMap<>();
    put(tables, DataTable.of(TableName.EMPLOYEE, employees));
    put(tables, DataTable.of(TableName.EMPLOYEE_JOB_ASSIGNMENT, jobAssignments));
    put(tables, DataTable.of(TableName.EMPLOYEE_ORG_ASSIGNMENT, orgAssignments));
    if (compensation != null) {
      put(tables, DataTable.of(TableName.EMPLOYEE_COMPENSATION, compensation));
    }
    if (performance != null) {
      put(tables, DataTable.of(TableName.EMPLOYEE_PERFORMANCE, performance));
    }
    tables.putAll(reference.tables());
    return Collections.unmodifiableMap(tables);
  }

  private static void put(Map<String, DataTable<?>> tables, DataTable<?> table) {
    tables.put(table.name(), table);
  }
}
