package com.hrsynth.api.client;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.exception.ConfigurationException;
import com.hrsynth.api.model.JobRole;
import com.hrsynth.api.model.Location;
import com.hrsynth.api.model.NameTables;
import com.hrsynth.api.model.OrganizationUnit;
import com.hrsynth.api.model.ReferenceCatalog;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the bundled reference catalogs from the classpath. Each resource is opened and closed
 * within a single call; I/O failures reach the caller as thrown.
 */
@Slf4j
public class ReferenceDataLoader {

  public static final String DEFAULT_BASE_PATH = "reference/";

  static final String ORG_FILE = "org_data.csv";
  static final String JOB_FILE = "job_data.csv";
  static final String LOCATION_FILE = "location_data.csv";
  static final String NAMES_FILE = "names.yaml";

  private final String basePath;
  private final ClassLoader classLoader;
  private final CsvMapper csvMapper;
  private final YAMLMapper yamlMapper;

  public ReferenceDataLoader() {
    this(DEFAULT_BASE_PATH, ReferenceDataLoader.class.getClassLoader());
  }

  public ReferenceDataLoader(String basePath, ClassLoader classLoader) {
    this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
    this.classLoader = classLoader;
    this.csvMapper = CsvMapper.builder().enable(CsvParser.Feature.EMPTY_STRING_AS_NULL).build();
    this.yamlMapper = new YAMLMapper();
  }

  public ReferenceCatalog loadCatalog() throws IOException {
    List<OrganizationUnit> orgs = loadOrganizationUnits();
    List<JobRole> jobs = loadJobRoles();
    List<Location> locations = loadLocations();
    NameTables names = loadNames();

    validate(orgs, jobs, locations, names);
    log.info(
        "Loaded reference data: {} organization units, {} job roles, {} locations",
        orgs.size(),
        jobs.size(),
        locations.size());
    return new ReferenceCatalog(orgs, jobs, locations, names);
  }

  public List<OrganizationUnit> loadOrganizationUnits() throws IOException {
    return readCsv(ORG_FILE, OrganizationUnit.class);
  }

  public List<JobRole> loadJobRoles() throws IOException {
    return readCsv(JOB_FILE, JobRole.class);
  }

  public List<Location> loadLocations() throws IOException {
    return readCsv(LOCATION_FILE, Location.class);
  }

  public NameTables loadNames() throws IOException {
    try (InputStream in = open(NAMES_FILE)) {
      return yamlMapper.readValue(in, NameTables.class);
    }
  }

  private <T> List<T> readCsv(String file, Class<T> type) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    try (InputStream in = open(file);
        MappingIterator<T> rows = csvMapper.readerFor(type).with(schema).readValues(in)) {
      List<T> result = rows.readAll();
      log.debug("Read {} rows from {}{}", result.size(), basePath, file);
      return result;
    }
  }

  private InputStream open(String file) throws IOException {
    InputStream in = classLoader.getResourceAsStream(basePath + file);
    if (in == null) {
      throw new FileNotFoundException("Reference resource not found on classpath: " + basePath + file);
    }
    return in;
  }

  private static void validate(
      List<OrganizationUnit> orgs, List<JobRole> jobs, List<Location> locations, NameTables names) {
    if (orgs.isEmpty() || jobs.isEmpty() || locations.isEmpty()) {
      throw new ConfigurationException("Reference catalogs must not be empty");
    }
    Set<String> orgIds = orgs.stream().map(OrganizationUnit::getOrgId).collect(Collectors.toSet());
    for (OrganizationUnit org : orgs) {
      if (org.getBusinessUnit() == null) {
        throw new ConfigurationException("Organization " + org.getOrgId() + " has no business unit");
      }
      if (org.getParentOrgId() != null && !orgIds.contains(org.getParentOrgId())) {
        throw new ConfigurationException(
            "Organization " + org.getOrgId() + " references unknown parent " + org.getParentOrgId());
      }
    }
    for (JobRole job : jobs) {
      int level = job.getSeniorityLevel();
      if (level < HrGeneratorProperties.MIN_LEVEL || level > HrGeneratorProperties.MAX_LEVEL) {
        throw new ConfigurationException(
            "Job " + job.getJobId() + " has seniority level " + level + " outside 1-5");
      }
      if (job.getJobFamily() == null) {
        throw new ConfigurationException("Job " + job.getJobId() + " has no job family");
      }
    }
    if (names == null
        || isEmpty(names.femaleFirstNames())
        || isEmpty(names.maleFirstNames())
        || isEmpty(names.neutralFirstNames())
        || isEmpty(names.lastNames())) {
      throw new ConfigurationException("Name tables must provide every first-name list and last names");
    }
  }

  private static boolean isEmpty(List<String> values) {
    return values == null || values.isEmpty();
  }
}
