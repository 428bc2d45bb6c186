package com.hrsynth.api.model;

import com.hrsynth.api.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only reference data shared by every generation run: the organization, job and location
 * catalogs plus the name tables used for demographics.
 */
public final class ReferenceCatalog {

  private final List<OrganizationUnit> organizationUnits;
  private final List<JobRole> jobRoles;
  private final List<Location> locations;
  private final NameTables names;

  private final Map<String, OrganizationUnit> orgsById;
  private final Map<String, JobRole> jobsById;
  private final Set<String> locationIds;
  private final Set<String> parentOrgIds;

  public ReferenceCatalog(
      List<OrganizationUnit> organizationUnits,
      List<JobRole> jobRoles,
      List<Location> locations,
      NameTables names) {
    this.organizationUnits = List.copyOf(organizationUnits);
    this.jobRoles = List.copyOf(jobRoles);
    this.locations = List.copyOf(locations);
    this.names = names;
    this.orgsById = index(this.organizationUnits, OrganizationUnit::getOrgId);
    this.jobsById = index(this.jobRoles, JobRole::getJobId);
    this.locationIds =
        this.locations.stream().map(Location::getLocationId).collect(Collectors.toUnmodifiableSet());
    this.parentOrgIds =
        this.organizationUnits.stream()
            .map(OrganizationUnit::getParentOrgId)
            .filter(id -> id != null && !id.isBlank())
            .collect(Collectors.toUnmodifiableSet());
  }

  public List<OrganizationUnit> organizationUnits() {
    return organizationUnits;
  }

  public List<JobRole> jobRoles() {
    return jobRoles;
  }

  public List<Location> locations() {
    return locations;
  }

  public NameTables names() {
    return names;
  }

  public Optional<JobRole> job(String jobId) {
    return Optional.ofNullable(jobsById.get(jobId));
  }

  public Optional<OrganizationUnit> org(String orgId) {
    return Optional.ofNullable(orgsById.get(orgId));
  }

  public boolean hasLocation(String locationId) {
    return locationIds.contains(locationId);
  }

  public List<JobRole> jobsAtLevel(int seniorityLevel) {
    return jobRoles.stream().filter(job -> job.getSeniorityLevel() == seniorityLevel).toList();
  }

  public List<OrganizationUnit> orgsInBusinessUnit(String businessUnit) {
    return organizationUnits.stream()
        .filter(org -> businessUnit.equals(org.getBusinessUnit()))
        .toList();
  }

  /** Orgs that no other org names as its parent. */
  public boolean isLeaf(OrganizationUnit org) {
    return !parentOrgIds.contains(org.getOrgId());
  }

  public Map<String, DataTable<?>> tables() {
    Map<String, DataTable<?>> tables = new LinkedHashMap<>();
    tables.put(
        TableName.ORGANIZATION_UNIT.tableName(),
        DataTable.of(TableName.ORGANIZATION_UNIT, organizationUnits));
    tables.put(TableName.JOB_ROLE.tableName(), DataTable.of(TableName.JOB_ROLE, jobRoles));
    tables.put(TableName.LOCATION.tableName(), DataTable.of(TableName.LOCATION, locations));
    return Collections.unmodifiableMap(tables);
  }

  private static <T> Map<String, T> index(List<T> rows, Function<T, String> key) {
    return rows.stream()
        .collect(
            Collectors.toUnmodifiableMap(
                key,
                Function.identity(),
                (first, second) -> {
                  throw new ConfigurationException(
                      "Duplicate reference id " + key.apply(second) + " in catalog");
                }));
  }
}
