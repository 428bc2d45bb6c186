package com.hrsynth.api.generator;

import com.hrsynth.api.model.CompensationRecord;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.HrDataset;
import com.hrsynth.api.model.JobAssignment;
import com.hrsynth.api.model.OrgAssignment;
import com.hrsynth.api.model.PerformanceReview;
import com.hrsynth.api.model.ReferenceCatalog;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Accumulates per-employee histories, in the order added, into one {@link HrDataset}. */
public class HrDatasetBuilder {

  private final long seed;
  private final LocalDate startDate;
  private final LocalDate endDate;
  private final boolean includeCompensation;
  private final boolean includePerformance;

  private final List<Employee> employees = new ArrayList<>();
  private final List<JobAssignment> jobAssignments = new ArrayList<>();
  private final List<OrgAssignment> orgAssignments = new ArrayList<>();
  private final List<CompensationRecord> compensation = new ArrayList<>();
  private final List<PerformanceReview> performance = new ArrayList<>();

  public HrDatasetBuilder(
      long seed,
      LocalDate startDate,
      LocalDate endDate,
      boolean includeCompensation,
      boolean includePerformance) {
    this.seed = seed;
    this.startDate = startDate;
    this.endDate = endDate;
    this.includeCompensation = includeCompensation;
    this.includePerformance = includePerformance;
  }

  public HrDatasetBuilder add(EmployeeHistory history) {
    employees.add(history.employee());
    jobAssignments.addAll(history.jobs());
    orgAssignments.addAll(history.orgs());
    if (includeCompensation) {
      compensation.addAll(history.compensation());
    }
    if (includePerformance) {
      performance.addAll(history.reviews());
    }
    return this;
  }

  public HrDatasetBuilder addAll(List<EmployeeHistory> histories) {
    histories.forEach(this::add);
    return this;
  }

  public HrDataset build(ReferenceCatalog reference) {
    return new HrDataset(
        seed,
        startDate,
        endDate,
        List.copyOf(employees),
        List.copyOf(jobAssignments),
        List.copyOf(orgAssignments),
        includeCompensation ? List.copyOf(compensation) : null,
        includePerformance ? List.copyOf(performance) : null,
        reference);
  }
}
