package com.hrsynth.api.config;

import com.hrsynth.api.exception.ConfigurationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed view of the {@code hr.generator} block of {@code application.yml}. Every band, rate and
 * range is checked when the record is bound, so a malformed file stops the application before any
 * dataset is generated.
 */
@ConfigurationProperties(prefix = "hr.generator")
public record HrGeneratorProperties(
    List<SeniorityBand> seniorityBands,
    boolean requireDirector,
    String ceoJobId,
    GenderMix gender,
    EmploymentTypeMix employmentType,
    CareerRates career,
    CompensationSettings compensation,
    ReviewSettings review,
    Map<String, String> familyBusinessUnits,
    String emailDomain,
    int maxTenureYears,
    int maxEmployees,
    int parallelism,
    boolean validateOutput,
    int maxConcurrentRuns) {

  public static final int MIN_LEVEL = 1;
  public static final int MAX_LEVEL = 5;
  public static final int SALARY_SCALE = 2;
  private static final double EPSILON = 1e-6;

  public HrGeneratorProperties {
    require(seniorityBands != null, "seniority-bands must be configured");
    seniorityBands =
        seniorityBands.stream().sorted(Comparator.comparingInt(SeniorityBand::level)).toList();
    validateBands(seniorityBands);
    require(gender != null, "gender mix must be configured");
    require(employmentType != null, "employment-type mix must be configured");
    require(career != null, "career rates must be configured");
    require(compensation != null, "compensation settings must be configured");
    require(review != null, "review settings must be configured");
    familyBusinessUnits = familyBusinessUnits == null ? Map.of() : Map.copyOf(familyBusinessUnits);
    require(emailDomain != null && !emailDomain.isBlank(), "email-domain must not be blank");
    require(maxTenureYears >= 1, "max-tenure-years must be at least 1");
    require(maxEmployees >= 1, "max-employees must be at least 1");
    require(parallelism >= 0, "parallelism must not be negative");
    require(maxConcurrentRuns >= 1, "max-concurrent-runs must be at least 1");
  }

  public SeniorityBand band(int level) {
    if (level < MIN_LEVEL || level > MAX_LEVEL) {
      throw new IllegalArgumentException("No seniority band for level " + level);
    }
    return seniorityBands.get(level - MIN_LEVEL);
  }

  /** Business unit an org must belong to for a job of the given family. */
  public String businessUnitFor(String jobFamily) {
    return familyBusinessUnits.getOrDefault(jobFamily, jobFamily);
  }

  public int effectiveParallelism() {
    return parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
  }

  private static void validateBands(List<SeniorityBand> bands) {
    require(
        bands.size() == MAX_LEVEL,
        "Exactly " + MAX_LEVEL + " seniority bands are required, found " + bands.size());
    double shareTotal = 0;
    SeniorityBand previous = null;
    for (int i = 0; i < bands.size(); i++) {
      SeniorityBand band = bands.get(i);
      require(band.level() == i + MIN_LEVEL, "Seniority bands must cover levels 1-5 exactly once");
      shareTotal += band.share();
      if (previous != null) {
        require(
            band.salaryMin().compareTo(previous.salaryMin()) >= 0
                && band.salaryMax().compareTo(previous.salaryMax()) >= 0,
            "Salary ranges must not decrease from level " + previous.level() + " to " + band.level());
      }
      previous = band;
    }
    require(Math.abs(shareTotal - 1.0) < EPSILON, "Seniority shares must sum to 1, got " + shareTotal);
    require(
        bands.get(MAX_LEVEL - 1).minimumCount() >= 1,
        "Level 5 needs a minimum count of at least 1 so a CEO can be designated");
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new ConfigurationException(message);
    }
  }

  private static void requireProbability(double value, String name) {
    require(value >= 0 && value <= 1, name + " must be within [0, 1], got " + value);
  }

  private static void requireRange(double min, double max, String name) {
    require(min >= 0 && min <= max, name + " range is invalid: [" + min + ", " + max + "]");
  }

  public record SeniorityBand(
      int level,
      double share,
      int minimumCount,
      int ageMin,
      int ageMax,
      BigDecimal salaryMin,
      BigDecimal salaryMax) {

    public SeniorityBand {
      requireProbability(share, "share of level " + level);
      require(minimumCount >= 0, "minimum-count of level " + level + " must not be negative");
      require(
          ageMin >= 18 && ageMin <= ageMax,
          "age range of level " + level + " is invalid: [" + ageMin + ", " + ageMax + "]");
      require(
          salaryMin != null && salaryMax != null && salaryMin.signum() > 0,
          "salary range of level " + level + " must be positive");
      require(
          salaryMin.compareTo(salaryMax) <= 0,
          "salary range of level " + level + " is inverted: [" + salaryMin + ", " + salaryMax + "]");
      // Bounds are returned as-is when salaries are clipped, so they carry the money scale.
      salaryMin = salaryMin.setScale(SALARY_SCALE, RoundingMode.HALF_UP);
      salaryMax = salaryMax.setScale(SALARY_SCALE, RoundingMode.HALF_UP);
    }

    public boolean contains(BigDecimal salary) {
      return salary.compareTo(salaryMin) >= 0 && salary.compareTo(salaryMax) <= 0;
    }
  }

  public record GenderMix(double na, double female, double male) {

    public GenderMix {
      requireProbability(na, "gender.na");
      requireProbability(female, "gender.female");
      requireProbability(male, "gender.male");
      require(Math.abs(na + female + male - 1.0) < EPSILON, "gender probabilities must sum to 1");
    }
  }

  public record EmploymentTypeMix(double fullTime, double contract, double partTime) {

    public EmploymentTypeMix {
      requireProbability(fullTime, "employment-type.full-time");
      requireProbability(contract, "employment-type.contract");
      requireProbability(partTime, "employment-type.part-time");
      require(
          Math.abs(fullTime + contract + partTime - 1.0) < EPSILON,
          "employment-type probabilities must sum to 1");
    }
  }

  public record CareerRates(
      double promotionRate, double transferRate, double terminationRate, int transferOffsetDays) {

    public CareerRates {
      requireProbability(promotionRate, "career.promotion-rate");
      requireProbability(transferRate, "career.transfer-rate");
      requireProbability(terminationRate, "career.termination-rate");
      require(
          transferOffsetDays >= 1 && transferOffsetDays <= 365,
          "career.transfer-offset-days must be within [1, 365]");
    }
  }

  public enum MeritCycle {
    ANNIVERSARY,
    CALENDAR
  }

  public record CompensationSettings(
      String currency,
      double meritRaiseMin,
      double meritRaiseMax,
      double promotionRaiseMin,
      double promotionRaiseMax,
      MeritCycle meritCycle,
      int meritMonth,
      int meritDay,
      Map<String, BigDecimal> bonusTargets,
      BigDecimal defaultBonusTarget) {

    public CompensationSettings {
      require(currency != null && currency.length() == 3, "compensation.currency must be ISO-4217");
      requireRange(meritRaiseMin, meritRaiseMax, "compensation.merit-raise");
      requireRange(promotionRaiseMin, promotionRaiseMax, "compensation.promotion-raise");
      require(meritCycle != null, "compensation.merit-cycle must be set");
      require(meritMonth >= 1 && meritMonth <= 12, "compensation.merit-month must be 1-12");
      require(meritDay >= 1 && meritDay <= 28, "compensation.merit-day must be 1-28");
      bonusTargets = bonusTargets == null ? Map.of() : Map.copyOf(bonusTargets);
      require(defaultBonusTarget != null, "compensation.default-bonus-target must be set");
    }

    public BigDecimal bonusTargetFor(String jobLevel) {
      return bonusTargets.getOrDefault(jobLevel, defaultBonusTarget);
    }
  }

  public record ReviewSettings(int month, int day, int cutoffMonth) {

    public ReviewSettings {
      require(month >= 1 && month <= 12, "review.month must be 1-12");
      require(day >= 1 && day <= 28, "review.day must be 1-28");
      require(cutoffMonth >= 1 && cutoffMonth <= 12, "review.cutoff-month must be 1-12");
    }
  }
}
