package com.hrsynth.api.generator;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.config.HrGeneratorProperties.EmploymentTypeMix;
import com.hrsynth.api.config.HrGeneratorProperties.GenderMix;
import com.hrsynth.api.config.HrGeneratorProperties.SeniorityBand;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.EmployeeSlot;
import com.hrsynth.api.model.EmploymentType;
import com.hrsynth.api.model.Gender;
import com.hrsynth.api.model.NameTables;
import com.hrsynth.api.model.ReferenceCatalog;
import java.text.Normalizer;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.DiscreteProbabilityCollectionSampler;
import org.apache.commons.rng.sampling.distribution.DiscreteUniformSampler;
import org.springframework.stereotype.Component;

/** Samples the personal attributes of one employee. Holds no state between calls. */
@Component
@RequiredArgsConstructor
public class DemographicsGenerator {

  static final int CAREER_START_AGE = 21;

  private static final List<Gender> GENDERS = List.of(Gender.NA, Gender.FEMALE, Gender.MALE);
  private static final List<EmploymentType> EMPLOYMENT_TYPES =
      List.of(EmploymentType.FULL_TIME, EmploymentType.CONTRACT, EmploymentType.PART_TIME);

  private final HrGeneratorProperties properties;

  /**
   * Builds the employee row for {@code slot}. Age is measured at {@code endDate}; the hire date
   * falls between the 21st birthday (or the oldest allowed tenure, whichever is later) and {@code
   * endDate}.
   */
  public Employee generate(
      EmployeeSlot slot, LocalDate endDate, ReferenceCatalog catalog, UniformRandomProvider rng) {
    SeniorityBand band = properties.band(slot.seniorityLevel());
    int age = DiscreteUniformSampler.of(rng, band.ageMin(), band.ageMax()).sample();

    Gender gender = sampleGender(rng);
    NameTables names = catalog.names();
    String firstName = RandomStreams.pick(names.firstNamesFor(gender), rng);
    String lastName = RandomStreams.pick(names.lastNames(), rng);

    LocalDate birthDate = endDate.minusYears(age).minusDays(rng.nextInt(365));
    LocalDate hireDate = sampleHireDate(birthDate, endDate, rng);

    return Employee.builder()
        .employeeId(slot.employeeId())
        .firstName(firstName)
        .lastName(lastName)
        .gender(gender)
        .birthDate(birthDate)
        .hireDate(hireDate)
        .employmentType(sampleEmploymentType(rng))
        .employmentStatus(Employee.STATUS_ACTIVE)
        .locationId(RandomStreams.pick(catalog.locations(), rng).getLocationId())
        .managerId(slot.managerId())
        .seniorityLevel(slot.seniorityLevel())
        .workEmail(workEmail(firstName, lastName, slot.index() + 1))
        .build();
  }

  LocalDate sampleHireDate(LocalDate birthDate, LocalDate endDate, UniformRandomProvider rng) {
    LocalDate careerStart = birthDate.plusYears(CAREER_START_AGE);
    LocalDate oldestAllowed = endDate.minusYears(properties.maxTenureYears());
    LocalDate earliest = careerStart.isAfter(oldestAllowed) ? careerStart : oldestAllowed;
    if (!earliest.isBefore(endDate)) {
      return endDate;
    }
    long span = ChronoUnit.DAYS.between(earliest, endDate);
    return earliest.plusDays(rng.nextLong(span + 1));
  }

  private Gender sampleGender(UniformRandomProvider rng) {
    GenderMix mix = properties.gender();
    return new DiscreteProbabilityCollectionSampler<>(
            rng, GENDERS, new double[] {mix.na(), mix.female(), mix.male()})
        .sample();
  }

  private EmploymentType sampleEmploymentType(UniformRandomProvider rng) {
    EmploymentTypeMix mix = properties.employmentType();
    return new DiscreteProbabilityCollectionSampler<>(
            rng, EMPLOYMENT_TYPES, new double[] {mix.fullTime(), mix.contract(), mix.partTime()})
        .sample();
  }

  private String workEmail(String firstName, String lastName, int sequence) {
    return emailPart(firstName)
        + "."
        + emailPart(lastName)
        + "."
        + sequence
        + "@"
        + properties.emailDomain();
  }

  private static String emailPart(String name) {
    String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    return ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
  }
}
