package com.hrsynth.api.service;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.config.HrGeneratorProperties.SeniorityBand;
import com.hrsynth.api.exception.DataIntegrityException;
import com.hrsynth.api.model.CompensationRecord;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.HrDataset;
import com.hrsynth.api.model.JobAssignment;
import com.hrsynth.api.model.OrgAssignment;
import com.hrsynth.api.model.PerformanceReview;
import com.hrsynth.api.model.ReferenceCatalog;
import com.hrsynth.api.model.TimeVariant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single integrity pass over a finished dataset. Collects every violation before failing so one
 * run reports all defects at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetValidator {

  private final HrGeneratorProperties properties;

  public void validate(HrDataset dataset) {
    List<String> violations = findViolations(dataset);
    if (!violations.isEmpty()) {
      throw new DataIntegrityException(violations);
    }
    log.debug("Dataset passed integrity checks ({} employees)", dataset.employees().size());
  }

  public List<String> findViolations(HrDataset dataset) {
    List<String> violations = new ArrayList<>();
    ReferenceCatalog catalog = dataset.reference();
    Map<String, Employee> employees =
        dataset.employees().stream()
            .collect(Collectors.toMap(Employee::getEmployeeId, Function.identity(), (a, b) -> a));
    if (employees.size() != dataset.employees().size()) {
      violations.add("employee: duplicate employee_id values");
    }

    checkEmployees(dataset, employees, catalog, violations);

    Map<String, List<JobAssignment>> jobs = byEmployee(dataset.jobAssignments());
    Map<String, List<OrgAssignment>> orgs = byEmployee(dataset.orgAssignments());
    for (Employee employee : dataset.employees()) {
      String id = employee.getEmployeeId();
      List<JobAssignment> jobChain = jobs.getOrDefault(id, List.of());
      List<OrgAssignment> orgChain = orgs.getOrDefault(id, List.of());
      checkChain("employee_job_assignment", id, jobChain, dataset.endDate(), violations);
      checkChain("employee_org_assignment", id, orgChain, dataset.endDate(), violations);
      checkJobs(id, jobChain, catalog, violations);
      checkOrgs(id, orgChain, catalog, violations);
      checkAlignment(id, jobChain, orgChain, violations);
    }
    checkOrphans("employee_job_assignment", jobs, employees, violations);
    checkOrphans("employee_org_assignment", orgs, employees, violations);

    dataset
        .compensationRecords()
        .ifPresent(
            records -> {
              Map<String, List<CompensationRecord>> compensation = byEmployee(records);
              for (Employee employee : dataset.employees()) {
                String id = employee.getEmployeeId();
                List<CompensationRecord> chain = compensation.getOrDefault(id, List.of());
                checkChain("employee_compensation", id, chain, dataset.endDate(), violations);
                checkSalaries(id, chain, jobs.getOrDefault(id, List.of()), violations);
              }
              checkOrphans("employee_compensation", compensation, employees, violations);
            });

    dataset
        .performanceReviews()
        .ifPresent(reviews -> checkReviews(reviews, employees, violations));
    return violations;
  }

  private void checkEmployees(
      HrDataset dataset,
      Map<String, Employee> employees,
      ReferenceCatalog catalog,
      List<String> violations) {
    long roots = dataset.employees().stream().filter(e -> e.getManagerId() == null).count();
    if (roots != 1) {
      violations.add("employee: expected exactly one employee without manager, found " + roots);
    }
    for (Employee employee : dataset.employees()) {
      String id = employee.getEmployeeId();
      if (!catalog.hasLocation(employee.getLocationId())) {
        violations.add(id + ": unknown location_id " + employee.getLocationId());
      }
      if (employee.getManagerId() != null) {
        Employee manager = employees.get(employee.getManagerId());
        if (manager == null) {
          violations.add(id + ": unknown manager_id " + employee.getManagerId());
        } else if (!outranks(manager, employee)) {
          violations.add(
              id
                  + ": manager "
                  + manager.getEmployeeId()
                  + " has seniority "
                  + manager.getSeniorityLevel()
                  + ", not above "
                  + employee.getSeniorityLevel());
        }
      }
      if (employee.getTerminationDate() != null
          && employee.getTerminationDate().isBefore(employee.getHireDate())) {
        violations.add(id + ": termination_date precedes hire_date");
      }
    }
  }

  // The root ranks above every level, so its level-5 direct reports are allowed.
  static boolean outranks(Employee manager, Employee report) {
    if (manager.getManagerId() == null) {
      return manager.getSeniorityLevel() >= report.getSeniorityLevel();
    }
    return manager.getSeniorityLevel() > report.getSeniorityLevel();
  }

  /** Sorted by start, contiguous, exactly one open record and that record is the last. */
  static void checkChain(
      String table,
      String employeeId,
      List<? extends TimeVariant> chain,
      LocalDate endDate,
      List<String> violations) {
    if (chain.isEmpty()) {
      violations.add(table + " " + employeeId + ": no records");
      return;
    }
    for (int i = 0; i < chain.size(); i++) {
      TimeVariant current = chain.get(i);
      boolean last = i == chain.size() - 1;
      if (last) {
        if (current.getEndDate() != null) {
          violations.add(table + " " + employeeId + ": last record is closed");
        }
        if (current.getStartDate().isAfter(endDate)) {
          violations.add(table + " " + employeeId + ": last record starts after " + endDate);
        }
      } else {
        TimeVariant next = chain.get(i + 1);
        if (current.getEndDate() == null) {
          violations.add(table + " " + employeeId + ": open record before the last one");
        } else if (!current.getEndDate().equals(next.getStartDate())) {
          violations.add(
              table
                  + " "
                  + employeeId
                  + ": gap or overlap between "
                  + current.getEndDate()
                  + " and "
                  + next.getStartDate());
        }
        if (!current.getStartDate().isBefore(next.getStartDate())) {
          violations.add(table + " " + employeeId + ": records out of order");
        }
      }
    }
  }

  private static void checkJobs(
      String employeeId,
      List<JobAssignment> chain,
      ReferenceCatalog catalog,
      List<String> violations) {
    int previousLevel = 0;
    for (JobAssignment job : chain) {
      if (catalog.job(job.getJobId()).isEmpty()) {
        violations.add(employeeId + ": unknown job_id " + job.getJobId());
      }
      if (job.getSeniorityLevel() < previousLevel) {
        violations.add(employeeId + ": seniority decreases on " + job.getStartDate());
      }
      previousLevel = job.getSeniorityLevel();
    }
  }

  private static void checkOrgs(
      String employeeId,
      List<OrgAssignment> chain,
      ReferenceCatalog catalog,
      List<String> violations) {
    for (OrgAssignment org : chain) {
      if (catalog.org(org.getOrgId()).isEmpty()) {
        violations.add(employeeId + ": unknown org_id " + org.getOrgId());
      }
    }
  }

  /** Every boundary of either chain is checked, which covers every overlapping period. */
  private void checkAlignment(
      String employeeId,
      List<JobAssignment> jobChain,
      List<OrgAssignment> orgChain,
      List<String> violations) {
    if (jobChain.isEmpty() || orgChain.isEmpty()) {
      return;
    }
    List<LocalDate> boundaries = new ArrayList<>();
    jobChain.forEach(job -> boundaries.add(job.getStartDate()));
    orgChain.forEach(org -> boundaries.add(org.getStartDate()));
    for (LocalDate date : boundaries.stream().distinct().sorted().toList()) {
      JobAssignment job = inForce(jobChain, date);
      OrgAssignment org = inForce(orgChain, date);
      if (job == null || org == null) {
        continue;
      }
      String expected = properties.businessUnitFor(job.getJobFamily());
      if (!expected.equals(org.getBusinessUnit())) {
        violations.add(
            employeeId
                + ": job family "
                + job.getJobFamily()
                + " in org "
                + org.getOrgId()
                + " of business unit "
                + org.getBusinessUnit()
                + " on "
                + date);
      }
    }
  }

  private void checkSalaries(
      String employeeId,
      List<CompensationRecord> chain,
      List<JobAssignment> jobChain,
      List<String> violations) {
    CompensationRecord previous = null;
    for (CompensationRecord record : chain) {
      if (previous != null && record.getBaseSalary().compareTo(previous.getBaseSalary()) < 0) {
        violations.add(employeeId + ": base salary decreases on " + record.getStartDate());
      }
      JobAssignment job = inForce(jobChain, record.getStartDate());
      if (job != null) {
        SeniorityBand band = properties.band(job.getSeniorityLevel());
        if (!band.contains(record.getBaseSalary())) {
          violations.add(
              employeeId
                  + ": base salary "
                  + record.getBaseSalary()
                  + " outside level "
                  + band.level()
                  + " range on "
                  + record.getStartDate());
        }
      }
      previous = record;
    }
  }

  private static void checkReviews(
      List<PerformanceReview> reviews, Map<String, Employee> employees, List<String> violations) {
    for (PerformanceReview review : reviews) {
      Employee employee = employees.get(review.getEmployeeId());
      if (employee == null) {
        violations.add("employee_performance: unknown employee_id " + review.getEmployeeId());
        continue;
      }
      if (review.getRating() < 1 || review.getRating() > 5) {
        violations.add(review.getEmployeeId() + ": rating " + review.getRating() + " outside 1-5");
      }
      if (review.getManagerId() != null && !employees.containsKey(review.getManagerId())) {
        violations.add(review.getEmployeeId() + ": review names unknown manager");
      }
    }
  }

  private static <T extends TimeVariant> void checkOrphans(
      String table,
      Map<String, List<T>> records,
      Map<String, Employee> employees,
      List<String> violations) {
    records.keySet().stream()
        .filter(id -> !employees.containsKey(id))
        .sorted()
        .forEach(id -> violations.add(table + ": unknown employee_id " + id));
  }

  private static <T extends TimeVariant> Map<String, List<T>> byEmployee(List<T> records) {
    return records.stream()
        .collect(
            Collectors.groupingBy(
                TimeVariant::getEmployeeId,
                Collectors.collectingAndThen(
                    Collectors.toList(),
                    list -> {
                      list.sort(Comparator.comparing(TimeVariant::getStartDate));
                      return list;
                    })));
  }

  private static <T extends TimeVariant> T inForce(List<T> chain, LocalDate date) {
    T current = null;
    for (T record : chain) {
      if (record.getStartDate().isAfter(date)) {
        break;
      }
      current = record;
    }
    return current;
  }
}
