package com.hrsynth.api.generator;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.config.HrGeneratorProperties.CompensationSettings;
import com.hrsynth.api.config.HrGeneratorProperties.SeniorityBand;
import com.hrsynth.api.model.AssignmentTimeline;
import com.hrsynth.api.model.CareerEvent;
import com.hrsynth.api.model.CareerTimeline;
import com.hrsynth.api.model.ChangeReason;
import com.hrsynth.api.model.CompensationRecord;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.JobAssignment;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.springframework.stereotype.Component;

/**
 * Builds the salary chain of one employee: a New Hire record, one record per promotion and one per
 * merit date. Base salary never decreases and always stays within the band of the seniority level
 * in force.
 */
@Component
@RequiredArgsConstructor
public class CompensationTimelineSimulator {

  static final int SALARY_SCALE = HrGeneratorProperties.SALARY_SCALE;

  private final HrGeneratorProperties properties;

  public List<CompensationRecord> simulate(
      Employee employee,
      CareerTimeline careerTimeline,
      AssignmentTimeline assignments,
      LocalDate windowStart,
      LocalDate windowEnd,
      UniformRandomProvider rng) {
    CompensationSettings settings = properties.compensation();
    LocalDate hireDate = employee.getHireDate();

    JobAssignment hireJob = jobAt(assignments, hireDate);
    SeniorityBand hireBand = properties.band(hireJob.getSeniorityLevel());
    BigDecimal salary = uniform(hireBand.salaryMin(), hireBand.salaryMax(), rng);

    List<CompensationRecord> records = new ArrayList<>();
    records.add(record(employee, salary, hireJob, hireDate, ChangeReason.NEW_HIRE));

    TreeMap<LocalDate, ChangeReason> changes = new TreeMap<>();
    for (CareerEvent promotion : careerTimeline.promotions()) {
      changes.put(promotion.effectiveDate(), ChangeReason.PROMOTION);
    }
    LocalDate from = hireDate.isAfter(windowStart) ? hireDate : windowStart;
    LocalDate to =
        careerTimeline.termination().filter(date -> date.isBefore(windowEnd)).orElse(windowEnd);
    for (LocalDate meritDate : meritDates(hireDate, from, to)) {
      changes.putIfAbsent(meritDate, ChangeReason.ANNUAL_MERIT);
    }

    for (var change : changes.entrySet()) {
      LocalDate date = change.getKey();
      JobAssignment job = jobAt(assignments, date);
      SeniorityBand band = properties.band(job.getSeniorityLevel());
      if (change.getValue() == ChangeReason.PROMOTION) {
        BigDecimal raised =
            raise(salary, settings.promotionRaiseMin(), settings.promotionRaiseMax(), rng);
        salary = raised.max(band.salaryMin()).min(band.salaryMax());
      } else {
        BigDecimal raised = raise(salary, settings.meritRaiseMin(), settings.meritRaiseMax(), rng);
        salary = raised.min(band.salaryMax());
      }
      CompensationRecord previous = records.get(records.size() - 1);
      records.set(records.size() - 1, previous.withEndDate(date));
      records.add(record(employee, salary, job, date, change.getValue()));
    }
    return records;
  }

  /** Merit dates strictly after hire, inside {@code [from, to)}. */
  List<LocalDate> meritDates(LocalDate hireDate, LocalDate from, LocalDate to) {
    CompensationSettings settings = properties.compensation();
    List<LocalDate> dates = new ArrayList<>();
    if (!from.isBefore(to)) {
      return dates;
    }
    if (settings.meritCycle() == HrGeneratorProperties.MeritCycle.ANNIVERSARY) {
      for (int year = 1; hireDate.plusYears(year).isBefore(to); year++) {
        LocalDate anniversary = hireDate.plusYears(year);
        if (!anniversary.isBefore(from)) {
          dates.add(anniversary);
        }
      }
    } else {
      for (int year = from.getYear(); year <= to.getYear(); year++) {
        LocalDate date = LocalDate.of(year, settings.meritMonth(), settings.meritDay());
        if (date.isAfter(hireDate) && !date.isBefore(from) && date.isBefore(to)) {
          dates.add(date);
        }
      }
    }
    return dates;
  }

  private CompensationRecord record(
      Employee employee,
      BigDecimal salary,
      JobAssignment job,
      LocalDate startDate,
      ChangeReason reason) {
    CompensationSettings settings = properties.compensation();
    return CompensationRecord.builder()
        .employeeId(employee.getEmployeeId())
        .baseSalary(salary)
        .bonusTargetPct(settings.bonusTargetFor(job.getJobLevel()))
        .currency(settings.currency())
        .startDate(startDate)
        .changeReason(reason)
        .build();
  }

  /** The job record in force on {@code date}. */
  static JobAssignment jobAt(AssignmentTimeline assignments, LocalDate date) {
    JobAssignment current = assignments.jobs().get(0);
    for (JobAssignment job : assignments.jobs()) {
      if (job.getStartDate().isAfter(date)) {
        break;
      }
      current = job;
    }
    return current;
  }

  private static BigDecimal uniform(BigDecimal min, BigDecimal max, UniformRandomProvider rng) {
    BigDecimal span = max.subtract(min);
    BigDecimal offset = span.multiply(BigDecimal.valueOf(rng.nextDouble()));
    return min.add(offset).setScale(SALARY_SCALE, RoundingMode.HALF_UP).min(max);
  }

  private static BigDecimal raise(
      BigDecimal salary, double minRate, double maxRate, UniformRandomProvider rng) {
    double rate =
        minRate == maxRate ? minRate : ContinuousUniformSampler.of(rng, minRate, maxRate).sample();
    return salary
        .multiply(BigDecimal.ONE.add(BigDecimal.valueOf(rate)))
        .setScale(SALARY_SCALE, RoundingMode.HALF_UP);
  }
}
