package com.hrsynth.api.generator;

import static com.hrsynth.api.config.HrGeneratorProperties.MAX_LEVEL;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.config.HrGeneratorProperties.CareerRates;
import com.hrsynth.api.model.CareerEvent;
import com.hrsynth.api.model.CareerEventType;
import com.hrsynth.api.model.CareerTimeline;
import com.hrsynth.api.model.Employee;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.apache.commons.rng.UniformRandomProvider;
import org.springframework.stereotype.Component;

/**
 * Simulates promotions, transfers and a possible termination for one employee.
 *
 * <p>Candidate dates are the hire anniversaries inside {@code [max(hire, start), end)}. At each
 * one the employee may be promoted (probability scaled by the levels still above them), may
 * transfer a few months later, and may leave during the following year. Nothing happens on or
 * after the termination date.
 */
@Component
@RequiredArgsConstructor
public class CareerEventScheduler {

  private final HrGeneratorProperties properties;

  public CareerTimeline schedule(
      Employee employee, LocalDate windowStart, LocalDate windowEnd, UniformRandomProvider rng) {
    CareerRates rates = properties.career();
    LocalDate hireDate = employee.getHireDate();
    LocalDate from = hireDate.isAfter(windowStart) ? hireDate : windowStart;

    List<CareerEvent> events = new ArrayList<>();
    int level = employee.getSeniorityLevel();
    LocalDate terminationDate = null;

    for (int year = 1; ; year++) {
      LocalDate anniversary = hireDate.plusYears(year);
      if (!anniversary.isBefore(windowEnd)) {
        break;
      }
      if (anniversary.isBefore(from)) {
        continue;
      }

      if (level < MAX_LEVEL && rng.nextDouble() < promotionProbability(level)) {
        level++;
        events.add(
            new CareerEvent(
                employee.getEmployeeId(), CareerEventType.PROMOTION, anniversary, level));
      }

      if (rng.nextDouble() < rates.transferRate()) {
        LocalDate transferDate = anniversary.plusDays(rng.nextInt(rates.transferOffsetDays()));
        if (transferDate.isBefore(windowEnd)) {
          events.add(
              new CareerEvent(
                  employee.getEmployeeId(), CareerEventType.TRANSFER, transferDate, level));
        }
      }

      if (rng.nextDouble() < rates.terminationRate()) {
        LocalDate leaveDate = anniversary.plusDays(1 + rng.nextInt(364));
        if (leaveDate.isBefore(windowEnd)) {
          terminationDate = leaveDate;
          break;
        }
      }
    }

    if (terminationDate != null) {
      LocalDate cutoff = terminationDate;
      events.removeIf(event -> !event.effectiveDate().isBefore(cutoff));
    }
    events.sort(CareerEvent.CHRONOLOGICAL);
    return new CareerTimeline(events, terminationDate);
  }

  /** Annual promotion probability; level 1 gets the full rate, level 4 a quarter of it. */
  double promotionProbability(int level) {
    if (level >= MAX_LEVEL) {
      return 0;
    }
    return properties.career().promotionRate() * (MAX_LEVEL - level) / (MAX_LEVEL - 1);
  }
}
