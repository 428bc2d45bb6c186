package com.hrsynth.api.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hrsynth.api.HrTestData;
import com.hrsynth.api.exception.AlignmentException;
import com.hrsynth.api.generator.AssignmentTimelineSimulator;
import com.hrsynth.api.generator.EmployeeHistoryGenerator;
import com.hrsynth.api.generator.HierarchyBuilder;
import com.hrsynth.api.model.EmployeeSlot;
import com.hrsynth.api.model.GenerationRequest;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HrDataServiceFailureTest {

  private static final LocalDate START = LocalDate.of(2020, 1, 1);
  private static final LocalDate END = LocalDate.of(2024, 12, 31);

  @Mock HierarchyBuilder hierarchyBuilder;
  @Mock AssignmentTimelineSimulator assignmentTimelineSimulator;
  @Mock EmployeeHistoryGenerator employeeHistoryGenerator;
  @Mock DatasetValidator datasetValidator;

  private ExecutorService executor;
  private Bulkhead bulkhead;
  private HrDataService service;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    bulkhead =
        Bulkhead.of(
            "test",
            BulkheadConfig.custom().maxConcurrentCalls(1).maxWaitDuration(Duration.ZERO).build());
    service =
        new HrDataService(
            HrTestData.properties().parallelism(2).build(),
            HrTestData.catalog(),
            hierarchyBuilder,
            assignmentTimelineSimulator,
            employeeHistoryGenerator,
            datasetValidator,
            executor,
            bulkhead,
            Clock.systemUTC());
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void generate_failsFastWhenBulkheadIsFull() {
    bulkhead.acquirePermission();
    try {
      assertThatThrownBy(() -> service.generate(GenerationRequest.of(10, START, END, 1L)))
          .isInstanceOf(BulkheadFullException.class);
    } finally {
      bulkhead.onComplete();
    }
    verify(hierarchyBuilder, never()).build(anyInt(), any());
  }

  @Test
  void generate_rethrowsWorkerFailureUnwrapped() {
    when(hierarchyBuilder.build(anyInt(), any()))
        .thenReturn(
            List.of(
                new EmployeeSlot(0, 5, EmployeeSlot.NO_MANAGER),
                new EmployeeSlot(1, 4, 0),
                new EmployeeSlot(2, 4, 0)));
    when(employeeHistoryGenerator.generate(any(), any()))
        .thenThrow(new AlignmentException("Sales", "No organization unit for job family 'Sales'"));

    assertThatThrownBy(() -> service.generate(GenerationRequest.of(3, START, END, 1L)))
        .isInstanceOf(AlignmentException.class)
        .hasMessageContaining("Sales");
    verify(datasetValidator, never()).validate(any());
  }

  @Test
  void generate_propagatesAlignmentCheckFailure() {
    doThrow(new AlignmentException(null, "No assignable job at seniority level 3"))
        .when(assignmentTimelineSimulator)
        .checkAlignment(any());

    assertThatThrownBy(() -> service.generate(GenerationRequest.of(3, START, END, 1L)))
        .isInstanceOf(AlignmentException.class);
    verify(hierarchyBuilder, never()).build(anyInt(), any());
  }
}
