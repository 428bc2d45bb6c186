package com.hrsynth.api.exception;

import java.util.List;

/**
 * Raised by the post-generation validation pass. A non-empty violation list always means a defect
 * in the generator, never bad input.
 */
public class DataIntegrityException extends HrGenerationException {

  private static final int MAX_IN_MESSAGE = 10;

  private final List<String> violations;

  public DataIntegrityException(List<String> violations) {
    super(summarize(violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }

  private static String summarize(List<String> violations) {
    String shown = String.join("; ", violations.subList(0, Math.min(MAX_IN_MESSAGE, violations.size())));
    int hidden = violations.size() - MAX_IN_MESSAGE;
    return "Generated dataset failed "
        + violations.size()
        + " integrity check(s): "
        + shown
        + (hidden > 0 ? " (+" + hidden + " more)" : "");
  }
}
