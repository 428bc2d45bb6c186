package com.hrsynth.api.generator;

import com.hrsynth.api.model.CompensationRecord;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.JobAssignment;
import com.hrsynth.api.model.OrgAssignment;
import com.hrsynth.api.model.PerformanceReview;
import java.util.List;

/**
 * Everything generated for one employee. {@code compensation} and {@code reviews} are empty when
 * the run did not ask for them.
 */
public record EmployeeHistory(
    Employee employee,
    List<JobAssignment> jobs,
    List<OrgAssignment> orgs,
    List<CompensationRecord> compensation,
    List<PerformanceReview> reviews) {}
