package com.hrsynth.api.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.hrsynth.api.HrTestData;
import com.hrsynth.api.exception.AlignmentException;
import com.hrsynth.api.exception.ConfigurationException;
import com.hrsynth.api.exception.DataIntegrityException;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.EmploymentType;
import com.hrsynth.api.model.Gender;
import com.hrsynth.api.model.HrDataset;
import com.hrsynth.api.model.JobAssignment;
import com.hrsynth.api.model.OrgAssignment;
import com.hrsynth.api.service.HrDataService;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = HrDataController.class)
class HrDataControllerTest {
  private static final LocalDate HIRE = LocalDate.of(2021, 4, 12);

  @Autowired private MockMvc mockMvc;

  @MockBean private HrDataService hrDataService;

  private HrDataset sampleDataset;

  @BeforeEach
  void setup() {
    Employee ceo =
        Employee.builder()
            .employeeId("EMP000001")
            .firstName("Ada")
            .lastName("Lovelace")
            .gender(Gender.FEMALE)
            .birthDate(LocalDate.of(1970, 1, 2))
            .hireDate(HIRE)
            .employmentType(EmploymentType.FULL_TIME)
            .employmentStatus(Employee.STATUS_ACTIVE)
            .locationId("LOC-NYC")
            .seniorityLevel(5)
            .workEmail("ada.lovelace.1@example.com")
            .build();
    JobAssignment job =
        JobAssignment.builder()
            .employeeId("EMP000001")
            .jobId("JOB-CORP-CEO")
            .jobTitle("Chief Executive Officer")
            .jobFamily("Corporate")
            .jobLevel("Director")
            .seniorityLevel(5)
            .startDate(HIRE)
            .build();
    OrgAssignment org =
        OrgAssignment.builder()
            .employeeId("EMP000001")
            .orgId("ORG-000")
            .orgName("Executive Office")
            .costCenter("CC-1000")
            .businessUnit("Corporate")
            .startDate(HIRE)
            .build();
    sampleDataset =
        new HrDataset(
            42L,
            LocalDate.of(2020, 1, 1),
            LocalDate.of(2024, 12, 31),
            List.of(ceo),
            List.of(job),
            List.of(org),
            null,
            null,
            HrTestData.catalog());
  }

  @Test
  void generate_ShouldReturnTables() throws Exception {
    Mockito.when(hrDataService.generate(any())).thenReturn(sampleDataset);

    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"n_employees\": 1, \"start_date\": \"2020-01-01\", \"end_date\":"
                        + " \"2024-12-31\", \"seed\": 42, \"include_performance\": false,"
                        + " \"include_compensation\": false}"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Generation-Seed", "42"))
        .andExpect(jsonPath("$.status", is("ok")))
        .andExpect(jsonPath("$.data.employee.rows", hasSize(1)))
        .andExpect(jsonPath("$.data.employee.columns[0]", is("employee_id")))
        .andExpect(jsonPath("$.data.employee.rows[0].first_name", is("Ada")))
        .andExpect(jsonPath("$.data.employee.rows[0].gender", is("female")))
        .andExpect(jsonPath("$.data.employee.rows[0].employment_type", is("Full-time")))
        .andExpect(jsonPath("$.data.employee.rows[0].hire_date", is("2021-04-12")))
        .andExpect(jsonPath("$.data.employee_job_assignment.rows[0].job_id", is("JOB-CORP-CEO")))
        .andExpect(jsonPath("$.data.employee_compensation").doesNotExist())
        .andExpect(jsonPath("$.data.location.rows").isArray());

    Mockito.verify(hrDataService)
        .generate(
            argThat(
                request ->
                    request.nEmployees() == 1
                        && request.seed() == 42L
                        && !request.includePerformance()
                        && !request.includeCompensation()
                        && request.startDate().equals(LocalDate.of(2020, 1, 1))));
  }

  @Test
  void generate_ShouldDefaultIncludeFlagsToTrue() throws Exception {
    Mockito.when(hrDataService.generate(any())).thenReturn(sampleDataset);

    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"n_employees\": 5}"))
        .andExpect(status().isOk());

    Mockito.verify(hrDataService)
        .generate(
            argThat(
                request ->
                    request.includePerformance()
                        && request.includeCompensation()
                        && request.seed() == null
                        && request.startDate() == null));
  }

  @Test
  void generate_ShouldReturn400_WhenEmployeeCountMissing() throws Exception {
    mockMvc
        .perform(post("/api/v1/hr-data").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status", is("error")))
        .andExpect(jsonPath("$.details[0]", startsWith("employeeCount:")));

    Mockito.verifyNoInteractions(hrDataService);
  }

  @Test
  void generate_ShouldReturn400_WhenEmployeeCountBelowOne() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"n_employees\": 0}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void generate_ShouldReturn400_WhenBodyMalformed() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"n_employees\": 5, \"start_date\": \"not-a-date\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", is("Malformed request body")));
  }

  @Test
  void generate_ShouldReturn400_OnConfigurationException() throws Exception {
    Mockito.when(hrDataService.generate(any()))
        .thenThrow(
            new ConfigurationException("start_date 2024-01-01 must be before end_date 2023-01-01"));

    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"n_employees\": 5}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", startsWith("start_date 2024-01-01 must be before")));
  }

  @Test
  void generate_ShouldReturn422_OnAlignmentException() throws Exception {
    Mockito.when(hrDataService.generate(any()))
        .thenThrow(new AlignmentException("Sales", "No organization unit for job family 'Sales'"));

    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"n_employees\": 5}"))
        .andExpect(status().isUnprocessableEntity());
  }

  @Test
  void generate_ShouldHideIntegrityDetails() throws Exception {
    Mockito.when(hrDataService.generate(any()))
        .thenThrow(new DataIntegrityException(List.of("EMP000002: unknown manager_id EMP009999")));

    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"n_employees\": 5}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error", is("An unexpected error occurred")))
        .andExpect(jsonPath("$.details").doesNotExist());
  }

  @Test
  void generate_ShouldReturn503_WhenBulkheadFull() throws Exception {
    Mockito.when(hrDataService.generate(any()))
        .thenThrow(BulkheadFullException.createBulkheadFullException(Bulkhead.ofDefaults("busy")));

    mockMvc
        .perform(
            post("/api/v1/hr-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"n_employees\": 5}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error", is("Service temporarily unavailable")));
  }

  @Test
  void getReferenceTables_ShouldReturnReferenceOnly() throws Exception {
    Mockito.when(hrDataService.getReferenceCatalog()).thenReturn(HrTestData.catalog());

    mockMvc
        .perform(get("/api/v1/hr-data/reference"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.organization_unit.rows[0].org_id", is("ORG-000")))
        .andExpect(jsonPath("$.data.job_role.columns", hasSize(5)))
        .andExpect(jsonPath("$.data.location.rows[0].location_id").isNotEmpty())
        .andExpect(jsonPath("$.data.employee").doesNotExist());
  }
}
