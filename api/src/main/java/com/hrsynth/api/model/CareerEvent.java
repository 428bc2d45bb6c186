package com.hrsynth.api.model;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * A simulated promotion or transfer. {@code seniorityLevel} is the level in force once the event
 * applies; transfers carry the unchanged level.
 */
public record CareerEvent(
    String employeeId, CareerEventType eventType, LocalDate effectiveDate, int seniorityLevel) {

  public static final Comparator<CareerEvent> CHRONOLOGICAL =
      Comparator.comparing(CareerEvent::effectiveDate).thenComparing(CareerEvent::eventType);

  public boolean isPromotion() {
    return eventType == CareerEventType.PROMOTION;
  }
}
