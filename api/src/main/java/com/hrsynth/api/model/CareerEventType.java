package com.hrsynth.api.model;

/** Declaration order is the tie-break order for events sharing an effective date. */
public enum CareerEventType {
  PROMOTION,
  TRANSFER
}
