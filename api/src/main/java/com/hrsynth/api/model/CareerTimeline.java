package com.hrsynth.api.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/** Ordered career events of one employee plus the termination date, if one was drawn. */
public record CareerTimeline(List<CareerEvent> events, LocalDate terminationDate) {

  public CareerTimeline {
    events = List.copyOf(events);
  }

  public Optional<LocalDate> termination() {
    return Optional.ofNullable(terminationDate);
  }

  public List<CareerEvent> promotions() {
    return events.stream().filter(CareerEvent::isPromotion).toList();
  }
}
