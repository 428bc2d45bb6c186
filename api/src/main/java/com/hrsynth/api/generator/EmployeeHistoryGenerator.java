package com.hrsynth.api.generator;

import com.hrsynth.api.generator.RandomStreams.Stage;
import com.hrsynth.api.model.AssignmentTimeline;
import com.hrsynth.api.model.CareerTimeline;
import com.hrsynth.api.model.CompensationRecord;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.EmployeeSlot;
import com.hrsynth.api.model.PerformanceReview;
import com.hrsynth.api.model.ReferenceCatalog;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Runs the per-employee stages for one hierarchy slot. Each stage draws from its own stream, so
 * leaving out compensation or reviews does not change any other value.
 */
@Component
@RequiredArgsConstructor
public class EmployeeHistoryGenerator {

  private final DemographicsGenerator demographicsGenerator;
  private final CareerEventScheduler careerEventScheduler;
  private final AssignmentTimelineSimulator assignmentTimelineSimulator;
  private final CompensationTimelineSimulator compensationTimelineSimulator;
  private final PerformanceReviewGenerator performanceReviewGenerator;

  /** Parameters shared by every employee of one run. */
  public record RunContext(
      RandomStreams streams,
      LocalDate startDate,
      LocalDate endDate,
      ReferenceCatalog catalog,
      boolean includeCompensation,
      boolean includePerformance) {}

  public EmployeeHistory generate(EmployeeSlot slot, RunContext context) {
    RandomStreams streams = context.streams();
    int index = slot.index();

    Employee employee =
        demographicsGenerator.generate(
            slot,
            context.endDate(),
            context.catalog(),
            streams.forEmployee(index, Stage.DEMOGRAPHICS));

    CareerTimeline careerTimeline =
        careerEventScheduler.schedule(
            employee,
            context.startDate(),
            context.endDate(),
            streams.forEmployee(index, Stage.CAREER_EVENTS));
    if (careerTimeline.terminationDate() != null) {
      employee =
          employee.toBuilder()
              .terminationDate(careerTimeline.terminationDate())
              .employmentStatus(Employee.STATUS_TERMINATED)
              .build();
    }

    AssignmentTimeline assignments =
        assignmentTimelineSimulator.simulate(
            employee,
            slot.isCeo(),
            careerTimeline,
            context.catalog(),
            streams.forEmployee(index, Stage.ASSIGNMENTS));

    List<CompensationRecord> compensation =
        context.includeCompensation()
            ? compensationTimelineSimulator.simulate(
                employee,
                careerTimeline,
                assignments,
                context.startDate(),
                context.endDate(),
                streams.forEmployee(index, Stage.COMPENSATION))
            : List.of();

    List<PerformanceReview> reviews =
        context.includePerformance()
            ? performanceReviewGenerator.generate(
                employee,
                careerTimeline,
                context.startDate(),
                context.endDate(),
                streams.forEmployee(index, Stage.PERFORMANCE))
            : List.of();

    return new EmployeeHistory(
        employee, assignments.jobs(), assignments.orgs(), compensation, reviews);
  }
}
