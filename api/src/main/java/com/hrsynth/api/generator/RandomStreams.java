package com.hrsynth.api.generator;

import java.util.List;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Derives independent XoShiRo256++ generators from one master seed. Every (employee, stage)
 * pair gets its own stream, so the values an employee receives do not depend on how many other
 * employees exist, on processing order, or on which optional tables were requested.
 */
public final class RandomStreams {

  /** Consumers of random draws. The ordinal is part of the derived seed; append only. */
  public enum Stage {
    HIERARCHY,
    DEMOGRAPHICS,
    CAREER_EVENTS,
    ASSIGNMENTS,
    COMPENSATION,
    PERFORMANCE
  }

  private static final RandomSource ALGORITHM = RandomSource.XO_SHI_RO_256_PP;
  private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;
  private static final int STATE_WORDS = 4;

  private final long masterSeed;

  public RandomStreams(long masterSeed) {
    this.masterSeed = masterSeed;
  }

  /** A fresh seed for runs that did not ask for one. */
  public static long randomSeed() {
    return RandomSource.createLong();
  }

  public long masterSeed() {
    return masterSeed;
  }

  /** Stream for global, once-per-run work such as the manager graph. */
  public UniformRandomProvider global(Stage stage) {
    return create(-1, stage);
  }

  public UniformRandomProvider forEmployee(int employeeIndex, Stage stage) {
    if (employeeIndex < 0) {
      throw new IllegalArgumentException("employeeIndex must not be negative: " + employeeIndex);
    }
    return create(employeeIndex, stage);
  }

  private UniformRandomProvider create(long employeeIndex, Stage stage) {
    long base =
        mix64(masterSeed)
            ^ mix64((employeeIndex + 2) * GOLDEN_GAMMA)
            ^ mix64((stage.ordinal() + 1L) * (GOLDEN_GAMMA >>> 1));
    long[] state = new long[STATE_WORDS];
    for (int i = 0; i < STATE_WORDS; i++) {
      state[i] = mix64(base + (i + 1) * GOLDEN_GAMMA);
    }
    return ALGORITHM.create(state);
  }

  /** Stafford variant 13 finalizer, as used by SplitMix64. */
  static long mix64(long z) {
    z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
    z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
    return z ^ (z >>> 31);
  }

  /** Uniform pick from a non-empty list. */
  public static <T> T pick(List<T> values, UniformRandomProvider rng) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Cannot pick from an empty list");
    }
    return values.get(rng.nextInt(values.size()));
  }
}
