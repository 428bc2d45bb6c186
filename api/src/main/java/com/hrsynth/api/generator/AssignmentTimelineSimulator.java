package com.hrsynth.api.generator;

import static com.hrsynth.api.config.HrGeneratorProperties.MAX_LEVEL;
import static com.hrsynth.api.config.HrGeneratorProperties.MIN_LEVEL;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.exception.AlignmentException;
import com.hrsynth.api.exception.ConfigurationException;
import com.hrsynth.api.model.AssignmentTimeline;
import com.hrsynth.api.model.CareerEvent;
import com.hrsynth.api.model.CareerTimeline;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.JobAssignment;
import com.hrsynth.api.model.JobRole;
import com.hrsynth.api.model.OrgAssignment;
import com.hrsynth.api.model.OrganizationUnit;
import com.hrsynth.api.model.ReferenceCatalog;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.rng.UniformRandomProvider;
import org.springframework.stereotype.Component;

/**
 * Turns career events into chained job and org assignment records.
 *
 * <p>Every record's end date is the next record's start date and the last record stays open. The
 * org an employee sits in always belongs to the business unit of their current job family.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssignmentTimelineSimulator {

  private final HrGeneratorProperties properties;

  /**
   * Fails fast when the catalogs cannot staff every level: each job family needs at least one org
   * of its business unit, and each level needs at least one job outside the CEO role.
   */
  public void checkAlignment(ReferenceCatalog catalog) {
    for (JobRole job : catalog.jobRoles()) {
      if (compatibleOrgs(job.getJobFamily(), catalog).isEmpty()) {
        throw new AlignmentException(
            job.getJobFamily(),
            "No organization unit in business unit '"
                + properties.businessUnitFor(job.getJobFamily())
                + "' for job family '"
                + job.getJobFamily()
                + "'");
      }
    }
    for (int level = MIN_LEVEL; level <= MAX_LEVEL; level++) {
      if (assignableJobs(level, catalog).isEmpty()) {
        throw new AlignmentException(null, "No assignable job at seniority level " + level);
      }
    }
    String ceoJobId = properties.ceoJobId();
    if (hasCeoJob()) {
      JobRole ceoJob =
          catalog
              .job(ceoJobId)
              .orElseThrow(
                  () -> new ConfigurationException("Configured CEO job " + ceoJobId + " not found"));
      if (ceoJob.getSeniorityLevel() != MAX_LEVEL) {
        throw new ConfigurationException("CEO job " + ceoJobId + " must be at level " + MAX_LEVEL);
      }
    }
  }

  public AssignmentTimeline simulate(
      Employee employee,
      boolean ceo,
      CareerTimeline careerTimeline,
      ReferenceCatalog catalog,
      UniformRandomProvider rng) {
    String employeeId = employee.getEmployeeId();
    LocalDate hireDate = employee.getHireDate();

    JobRole job = initialJob(employee.getSeniorityLevel(), ceo, catalog, rng);
    OrganizationUnit org = ceo ? ceoOrg(job, catalog, rng) : pickOrg(job, null, catalog, rng);

    List<JobAssignment> jobs = new ArrayList<>();
    List<OrgAssignment> orgs = new ArrayList<>();
    jobs.add(JobAssignment.open(employeeId, job, hireDate));
    orgs.add(OrgAssignment.open(employeeId, org, hireDate));

    for (CareerEvent event : careerTimeline.events()) {
      LocalDate date = event.effectiveDate();
      if (event.isPromotion()) {
        JobRole next = promotedJob(job, event.seniorityLevel(), catalog, rng);
        closeJob(jobs, date);
        jobs.add(JobAssignment.open(employeeId, next, date));
        boolean familyChanged = !next.getJobFamily().equals(job.getJobFamily());
        job = next;
        if (familyChanged) {
          org = pickOrg(job, null, catalog, rng);
          moveOrg(orgs, employeeId, org, date);
        }
      } else {
        if (date.equals(last(orgs).getStartDate())) {
          continue;
        }
        OrganizationUnit target = pickOrg(job, org.getOrgId(), catalog, rng);
        if (target == null) {
          continue;
        }
        org = target;
        moveOrg(orgs, employeeId, org, date);
      }
    }
    return new AssignmentTimeline(jobs, orgs);
  }

  private JobRole initialJob(
      int level, boolean ceo, ReferenceCatalog catalog, UniformRandomProvider rng) {
    if (ceo && hasCeoJob()) {
      return catalog
          .job(properties.ceoJobId())
          .orElseThrow(
              () ->
                  new ConfigurationException(
                      "Configured CEO job " + properties.ceoJobId() + " not found"));
    }
    List<JobRole> candidates = assignableJobs(level, catalog);
    if (candidates.isEmpty()) {
      throw new AlignmentException(null, "No assignable job at seniority level " + level);
    }
    return RandomStreams.pick(candidates, rng);
  }

  /** Same family one level up; a different family when the current one stops below that level. */
  private JobRole promotedJob(
      JobRole current, int level, ReferenceCatalog catalog, UniformRandomProvider rng) {
    List<JobRole> candidates = assignableJobs(level, catalog);
    List<JobRole> sameFamily =
        candidates.stream().filter(job -> job.getJobFamily().equals(current.getJobFamily())).toList();
    if (!sameFamily.isEmpty()) {
      return RandomStreams.pick(sameFamily, rng);
    }
    if (candidates.isEmpty()) {
      throw new AlignmentException(
          current.getJobFamily(), "No assignable job at seniority level " + level);
    }
    JobRole lateral = RandomStreams.pick(candidates, rng);
    log.debug(
        "Lateral promotion from family {} to {} at level {}",
        current.getJobFamily(),
        lateral.getJobFamily(),
        level);
    return lateral;
  }

  /**
   * Leaf orgs of the job's business unit are preferred; {@code excludedOrgId} is never returned.
   * Returns null when no other compatible org exists.
   */
  private OrganizationUnit pickOrg(
      JobRole job, String excludedOrgId, ReferenceCatalog catalog, UniformRandomProvider rng) {
    List<OrganizationUnit> compatible =
        compatibleOrgs(job.getJobFamily(), catalog).stream()
            .filter(org -> !org.getOrgId().equals(excludedOrgId))
            .toList();
    if (compatible.isEmpty()) {
      if (excludedOrgId == null) {
        throw new AlignmentException(
            job.getJobFamily(), "No organization unit for job family '" + job.getJobFamily() + "'");
      }
      return null;
    }
    List<OrganizationUnit> leaves = compatible.stream().filter(catalog::isLeaf).toList();
    return RandomStreams.pick(leaves.isEmpty() ? compatible : leaves, rng);
  }

  /** The CEO sits in a root org of its business unit when one exists. */
  private OrganizationUnit ceoOrg(JobRole job, ReferenceCatalog catalog, UniformRandomProvider rng) {
    List<OrganizationUnit> roots =
        compatibleOrgs(job.getJobFamily(), catalog).stream()
            .filter(org -> org.getParentOrgId() == null || org.getParentOrgId().isBlank())
            .toList();
    return roots.isEmpty() ? pickOrg(job, null, catalog, rng) : roots.get(0);
  }

  private List<JobRole> assignableJobs(int level, ReferenceCatalog catalog) {
    return catalog.jobsAtLevel(level).stream()
        .filter(job -> !isCeoJob(job))
        .filter(job -> !compatibleOrgs(job.getJobFamily(), catalog).isEmpty())
        .toList();
  }

  private List<OrganizationUnit> compatibleOrgs(String jobFamily, ReferenceCatalog catalog) {
    return catalog.orgsInBusinessUnit(properties.businessUnitFor(jobFamily));
  }

  private boolean hasCeoJob() {
    return properties.ceoJobId() != null && !properties.ceoJobId().isBlank();
  }

  private boolean isCeoJob(JobRole job) {
    return hasCeoJob() && Objects.equals(job.getJobId(), properties.ceoJobId());
  }

  private static void moveOrg(
      List<OrgAssignment> orgs, String employeeId, OrganizationUnit org, LocalDate date) {
    if (date.equals(last(orgs).getStartDate())) {
      orgs.set(orgs.size() - 1, OrgAssignment.open(employeeId, org, date));
      return;
    }
    orgs.set(orgs.size() - 1, last(orgs).withEndDate(date));
    orgs.add(OrgAssignment.open(employeeId, org, date));
  }

  private static void closeJob(List<JobAssignment> jobs, LocalDate date) {
    jobs.set(jobs.size() - 1, last(jobs).withEndDate(date));
  }

  private static <T> T last(List<T> records) {
    return records.get(records.size() - 1);
  }
}
