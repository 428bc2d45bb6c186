package com.hrsynth.api.generator;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.config.HrGeneratorProperties.ReviewSettings;
import com.hrsynth.api.model.CareerTimeline;
import com.hrsynth.api.model.Employee;
import com.hrsynth.api.model.PerformanceReview;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.DiscreteProbabilityCollectionSampler;
import org.springframework.stereotype.Component;

/** One year-end review per calendar year the employee was around for long enough. */
@Component
@RequiredArgsConstructor
public class PerformanceReviewGenerator {

  static final List<Integer> RATINGS = List.of(1, 2, 3, 4, 5);
  static final double[] RATING_WEIGHTS = {0.05, 0.15, 0.50, 0.25, 0.05};
  static final List<String> RATING_LABELS =
      List.of(
          "Needs Improvement",
          "Partially Meets Expectations",
          "Meets Expectations",
          "Exceeds Expectations",
          "Outstanding");

  private final HrGeneratorProperties properties;

  public List<PerformanceReview> generate(
      Employee employee,
      CareerTimeline careerTimeline,
      LocalDate windowStart,
      LocalDate windowEnd,
      UniformRandomProvider rng) {
    ReviewSettings settings = properties.review();
    LocalDate terminationDate = careerTimeline.terminationDate();
    DiscreteProbabilityCollectionSampler<Integer> ratings =
        new DiscreteProbabilityCollectionSampler<>(rng, RATINGS, RATING_WEIGHTS);

    List<PerformanceReview> reviews = new ArrayList<>();
    for (int year = windowStart.getYear(); year <= windowEnd.getYear(); year++) {
      LocalDate reviewDate = LocalDate.of(year, settings.month(), settings.day());
      if (reviewDate.isBefore(windowStart) || reviewDate.isAfter(windowEnd)) {
        continue;
      }
      if (terminationDate != null && !reviewDate.isBefore(terminationDate)) {
        continue;
      }
      LocalDate cutoff = LocalDate.of(year, settings.cutoffMonth(), 1);
      if (!employee.getHireDate().isBefore(cutoff)) {
        continue;
      }
      int rating = ratings.sample();
      reviews.add(
          PerformanceReview.builder()
              .employeeId(employee.getEmployeeId())
              .reviewPeriodYear(year)
              .reviewDate(reviewDate)
              .rating(rating)
              .ratingLabel(labelFor(rating))
              .managerId(employee.getManagerId())
              .build());
    }
    return reviews;
  }

  static String labelFor(int rating) {
    return RATING_LABELS.get(rating - 1);
  }
}
