package com.hrsynth.api.service;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.exception.ConfigurationException;
import com.hrsynth.api.exception.HrGenerationException;
import com.hrsynth.api.generator.AssignmentTimelineSimulator;
import com.hrsynth.api.generator.EmployeeHistory;
import com.hrsynth.api.generator.EmployeeHistoryGenerator;
import com.hrsynth.api.generator.EmployeeHistoryGenerator.RunContext;
import com.hrsynth.api.generator.HierarchyBuilder;
import com.hrsynth.api.generator.HrDatasetBuilder;
import com.hrsynth.api.generator.RandomStreams;
import com.hrsynth.api.generator.RandomStreams.Stage;
import com.hrsynth.api.model.EmployeeSlot;
import com.hrsynth.api.model.GenerationRequest;
import com.hrsynth.api.model.HrDataset;
import com.hrsynth.api.model.ReferenceCatalog;
import io.github.resilience4j.bulkhead.Bulkhead;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class HrDataService {

  static final int DEFAULT_HISTORY_YEARS = 5;
  private static final int CHUNKS_PER_WORKER = 4;

  private final HrGeneratorProperties properties;
  private final ReferenceCatalog catalog;
  private final HierarchyBuilder hierarchyBuilder;
  private final AssignmentTimelineSimulator assignmentTimelineSimulator;
  private final EmployeeHistoryGenerator employeeHistoryGenerator;
  private final DatasetValidator datasetValidator;
  private final ExecutorService executor;
  private final Bulkhead bulkhead;
  private final Clock clock;

  // Primary constructor for production use
  @Autowired
  public HrDataService(
      HrGeneratorProperties properties,
      ReferenceCatalog catalog,
      HierarchyBuilder hierarchyBuilder,
      AssignmentTimelineSimulator assignmentTimelineSimulator,
      EmployeeHistoryGenerator employeeHistoryGenerator,
      DatasetValidator datasetValidator,
      ExecutorService generationExecutor,
      Bulkhead generationBulkhead) {
    this(
        properties,
        catalog,
        hierarchyBuilder,
        assignmentTimelineSimulator,
        employeeHistoryGenerator,
        datasetValidator,
        generationExecutor,
        generationBulkhead,
        Clock.systemUTC());
  }

  // Constructor for testing with custom clock
  public HrDataService(
      HrGeneratorProperties properties,
      ReferenceCatalog catalog,
      HierarchyBuilder hierarchyBuilder,
      AssignmentTimelineSimulator assignmentTimelineSimulator,
      EmployeeHistoryGenerator employeeHistoryGenerator,
      DatasetValidator datasetValidator,
      ExecutorService generationExecutor,
      Bulkhead generationBulkhead,
      Clock clock) {
    this.properties = properties;
    this.catalog = catalog;
    this.hierarchyBuilder = hierarchyBuilder;
    this.assignmentTimelineSimulator = assignmentTimelineSimulator;
    this.employeeHistoryGenerator = employeeHistoryGenerator;
    this.datasetValidator = datasetValidator;
    this.executor = generationExecutor;
    this.bulkhead = generationBulkhead;
    this.clock = clock;
  }

  public ReferenceCatalog getReferenceCatalog() {
    return catalog;
  }

  /**
   * Generates a full dataset. The same request with the same seed always yields the same tables,
   * whatever the configured parallelism.
   */
  public HrDataset generate(GenerationRequest request) {
    return bulkhead.executeSupplier(() -> generateGuarded(request));
  }

  private HrDataset generateGuarded(GenerationRequest request) {
    if (request == null) {
      throw new ConfigurationException("Generation request must not be null");
    }
    LocalDate endDate = request.endDate() != null ? request.endDate() : LocalDate.now(clock);
    LocalDate startDate =
        request.startDate() != null
            ? request.startDate()
            : LocalDate.of(endDate.getYear() - DEFAULT_HISTORY_YEARS, 1, 1);
    validateRequest(request.nEmployees(), startDate, endDate);

    long seed = request.seed() != null ? request.seed() : RandomStreams.randomSeed();
    log.info(
        "Generating {} employees from {} to {} with seed {}",
        request.nEmployees(),
        startDate,
        endDate,
        seed);
    Instant started = clock.instant();

    assignmentTimelineSimulator.checkAlignment(catalog);

    RandomStreams streams = new RandomStreams(seed);
    List<EmployeeSlot> slots =
        hierarchyBuilder.build(request.nEmployees(), streams.global(Stage.HIERARCHY));

    RunContext context =
        new RunContext(
            streams,
            startDate,
            endDate,
            catalog,
            request.includeCompensation(),
            request.includePerformance());
    List<EmployeeHistory> histories = generateHistories(slots, context);

    HrDataset dataset =
        new HrDatasetBuilder(
                seed,
                startDate,
                endDate,
                request.includeCompensation(),
                request.includePerformance())
            .addAll(histories)
            .build(catalog);

    if (properties.validateOutput()) {
      datasetValidator.validate(dataset);
    }

    log.info(
        "Generated {} employees, {} job records, {} org records in {} ms (seed {})",
        dataset.employees().size(),
        dataset.jobAssignments().size(),
        dataset.orgAssignments().size(),
        Duration.between(started, clock.instant()).toMillis(),
        seed);
    return dataset;
  }

  private void validateRequest(int employeeCount, LocalDate startDate, LocalDate endDate) {
    if (employeeCount < 1) {
      throw new ConfigurationException("n_employees must be at least 1, got " + employeeCount);
    }
    if (employeeCount > properties.maxEmployees()) {
      throw new ConfigurationException(
          "n_employees must not exceed " + properties.maxEmployees() + ", got " + employeeCount);
    }
    if (!startDate.isBefore(endDate)) {
      throw new ConfigurationException(
          "start_date " + startDate + " must be before end_date " + endDate);
    }
  }

  /** Results always come back in slot order. */
  private List<EmployeeHistory> generateHistories(List<EmployeeSlot> slots, RunContext context) {
    int parallelism = properties.effectiveParallelism();
    if (parallelism <= 1 || slots.size() < 2) {
      log.debug("Generating {} employee histories sequentially", slots.size());
      return generateChunk(slots, context);
    }

    int chunkSize =
        Math.max(1, (int) Math.ceil(slots.size() / (double) (parallelism * CHUNKS_PER_WORKER)));
    List<Future<List<EmployeeHistory>>> futures = new ArrayList<>();
    for (int from = 0; from < slots.size(); from += chunkSize) {
      List<EmployeeSlot> chunk = slots.subList(from, Math.min(slots.size(), from + chunkSize));
      futures.add(executor.submit(() -> generateChunk(chunk, context)));
    }
    log.debug("Submitted {} chunks of up to {} employees", futures.size(), chunkSize);

    List<EmployeeHistory> histories = new ArrayList<>(slots.size());
    try {
      for (Future<List<EmployeeHistory>> future : futures) {
        histories.addAll(future.get());
      }
    } catch (InterruptedException e) {
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new HrGenerationException("Generation interrupted", e);
    } catch (ExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new HrGenerationException("Employee generation failed", e.getCause());
    }
    return histories;
  }

  private List<EmployeeHistory> generateChunk(List<EmployeeSlot> chunk, RunContext context) {
    List<EmployeeHistory> histories = new ArrayList<>(chunk.size());
    for (EmployeeSlot slot : chunk) {
      histories.add(employeeHistoryGenerator.generate(slot, context));
    }
    return histories;
  }
}
