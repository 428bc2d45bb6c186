package com.hrsynth.api.model;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class ApiModelTests {

  private final ObjectMapper mapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  @Test
  void apiResponse_successAndErrorFactories_workAsExpected() {
    ApiResponse<String> ok = ApiResponse.success("data");
    assertEquals("ok", ok.status());
    assertEquals("data", ok.data());
    assertNull(ok.error());

    ApiResponse<Void> err = ApiResponse.error("bad request", List.of("n_employees: too small"));
    assertEquals("error", err.status());
    assertEquals("bad request", err.error());
    assertEquals(List.of("n_employees: too small"), err.details());
    assertNull(err.data());
  }

  @Test
  void employee_serializesWithSnakeCaseAndLabels() throws Exception {
    Employee employee =
        Employee.builder()
            .employeeId(Employee.idFor(0))
            .firstName("Alice")
            .gender(Gender.NA)
            .employmentType(EmploymentType.PART_TIME)
            .hireDate(LocalDate.of(2022, 2, 1))
            .seniorityLevel(3)
            .build();

    String json = mapper.writeValueAsString(employee);
    assertTrue(json.contains("\"employee_id\":\"EMP000001\""));
    assertTrue(json.contains("\"first_name\":\"Alice\""));
    assertTrue(json.contains("\"gender\":\"na\""));
    assertTrue(json.contains("\"employment_type\":\"Part-time\""));
    assertTrue(json.contains("\"hire_date\":\"2022-02-01\""));
    assertTrue(json.contains("\"seniority_level\":3"));
  }

  @Test
  void compensationRecord_serializesChangeReasonLabel() throws Exception {
    CompensationRecord record =
        CompensationRecord.builder()
            .employeeId("EMP000002")
            .baseSalary(new BigDecimal("85000.50"))
            .bonusTargetPct(new BigDecimal("0.10"))
            .currency("USD")
            .startDate(LocalDate.of(2023, 4, 1))
            .changeReason(ChangeReason.ANNUAL_MERIT)
            .build();

    String json = mapper.writeValueAsString(record);
    assertTrue(json.contains("\"change_reason\":\"Annual Merit\""));
    assertTrue(json.contains("\"base_salary\":85000.50"));
    assertTrue(json.contains("\"bonus_target_pct\":0.10"));
  }

  @Test
  void generateInput_deserializesSnakeCaseAndDefaultsFlags() throws Exception {
    GenerateHrDataInput input =
        mapper.readValue(
            "{\"n_employees\": 25, \"end_date\": \"2024-06-30\", \"include_performance\": false}",
            GenerateHrDataInput.class);

    GenerationRequest request = input.toRequest();
    assertEquals(25, request.nEmployees());
    assertEquals(LocalDate.of(2024, 6, 30), request.endDate());
    assertNull(request.startDate());
    assertFalse(request.includePerformance());
    assertTrue(request.includeCompensation());
  }

  @Test
  void dataTable_carriesCatalogColumns() {
    DataTable<PerformanceReview> table = DataTable.of(TableName.EMPLOYEE_PERFORMANCE, List.of());

    assertEquals("employee_performance", table.name());
    assertEquals("review_period_year", table.columns().get(1));
    assertEquals(0, table.size());
  }

  @Test
  void careerEvent_promotionSortsBeforeTransferOnSameDay() {
    LocalDate day = LocalDate.of(2023, 5, 1);
    CareerEvent transfer = new CareerEvent("EMP000002", CareerEventType.TRANSFER, day, 2);
    CareerEvent promotion = new CareerEvent("EMP000002", CareerEventType.PROMOTION, day, 3);

    assertTrue(CareerEvent.CHRONOLOGICAL.compare(promotion, transfer) < 0);
  }
}
