package com.hrsynth.api.model;

import java.util.List;

/** The job and org assignment chains of one employee, oldest record first. */
public record AssignmentTimeline(List<JobAssignment> jobs, List<OrgAssignment> orgs) {

  public AssignmentTimeline {
    jobs = List.copyOf(jobs);
    orgs = List.copyOf(orgs);
  }

  public JobAssignment currentJob() {
    return jobs.get(jobs.size() - 1);
  }

  public OrgAssignment currentOrg() {
    return orgs.get(orgs.size() - 1);
  }
}
