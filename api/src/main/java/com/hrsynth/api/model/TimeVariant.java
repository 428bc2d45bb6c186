package com.hrsynth.api.model;

import java.time.LocalDate;

/**
 * A satellite row valid over {@code [startDate, endDate)}. A null end date means the record is
 * currently in force.
 */
public interface TimeVariant {

  String getEmployeeId();

  LocalDate getStartDate();

  LocalDate getEndDate();
}
