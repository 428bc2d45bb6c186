package com.hrsynth.api.generator;

import static com.hrsynth.api.config.HrGeneratorProperties.MAX_LEVEL;
import static com.hrsynth.api.config.HrGeneratorProperties.MIN_LEVEL;

import com.hrsynth.api.config.HrGeneratorProperties;
import com.hrsynth.api.exception.ConfigurationException;
import com.hrsynth.api.model.EmployeeSlot;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.rng.UniformRandomProvider;
import org.springframework.stereotype.Component;

/**
 * Splits the population into seniority buckets and wires every employee to a manager.
 *
 * <p>Slots are laid out highest level first. Slot 0 is always a level-5 employee and is the CEO,
 * the only slot without a manager. Managers are drawn uniformly from the bucket(s) above:
 *
 * <ul>
 *   <li>level 5 reports to the CEO;
 *   <li>level 4 reports to any level-5 employee, the CEO included;
 *   <li>level 3 reports to level 4;
 *   <li>levels 2 and 1 report to level 3 or level 4.
 * </ul>
 *
 * An empty pool falls back to the next non-empty level above it, which in the worst case is the
 * CEO.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HierarchyBuilder {

  static final int CEO_INDEX = 0;

  private final HrGeneratorProperties properties;

  public List<EmployeeSlot> build(int employeeCount, UniformRandomProvider rng) {
    int[] counts = bucketSizes(employeeCount);

    List<List<Integer>> buckets = new ArrayList<>();
    for (int level = 0; level <= MAX_LEVEL; level++) {
      buckets.add(new ArrayList<>());
    }
    int[] levelOf = new int[employeeCount];
    int next = 0;
    for (int level = MAX_LEVEL; level >= MIN_LEVEL; level--) {
      for (int i = 0; i < counts[level]; i++) {
        levelOf[next] = level;
        buckets.get(level).add(next++);
      }
    }

    List<EmployeeSlot> slots = new ArrayList<>(employeeCount);
    slots.add(new EmployeeSlot(CEO_INDEX, MAX_LEVEL, EmployeeSlot.NO_MANAGER));
    for (int index = 1; index < employeeCount; index++) {
      int level = levelOf[index];
      List<Integer> pool = managerPool(level, buckets);
      slots.add(new EmployeeSlot(index, level, RandomStreams.pick(pool, rng)));
    }

    log.debug(
        "Built hierarchy of {} employees, bucket sizes (level 1..5) {}",
        employeeCount,
        Arrays.toString(Arrays.copyOfRange(counts, MIN_LEVEL, MAX_LEVEL + 1)));
    return slots;
  }

  /**
   * Number of employees per level, indexed by level (index 0 unused). Each bucket gets {@code
   * max(minimum, floor(n * share))}; the difference to {@code n} is settled on the largest-share
   * buckets.
   */
  int[] bucketSizes(int employeeCount) {
    if (employeeCount < 1) {
      throw new ConfigurationException("n_employees must be at least 1, got " + employeeCount);
    }
    int[] minimums = new int[MAX_LEVEL + 1];
    for (int level = MIN_LEVEL; level <= MAX_LEVEL; level++) {
      minimums[level] = properties.band(level).minimumCount();
    }
    if (properties.requireDirector()) {
      minimums[MAX_LEVEL] = Math.max(minimums[MAX_LEVEL], 2);
    }
    int minimumTotal = Arrays.stream(minimums).sum();
    if (minimumTotal > employeeCount) {
      throw new ConfigurationException(
          "Seniority minimums need at least "
              + minimumTotal
              + " employees"
              + (properties.requireDirector() ? " (a CEO and at least one director)" : "")
              + ", but only "
              + employeeCount
              + " were requested");
    }

    int[] counts = new int[MAX_LEVEL + 1];
    for (int level = MIN_LEVEL; level <= MAX_LEVEL; level++) {
      int target = (int) Math.floor(employeeCount * properties.band(level).share() + 1e-9);
      counts[level] = Math.max(minimums[level], target);
    }

    List<Integer> byShare =
        IntStream.rangeClosed(MIN_LEVEL, MAX_LEVEL)
            .boxed()
            .sorted(
                Comparator.comparingDouble((Integer level) -> properties.band(level).share())
                    .reversed())
            .toList();
    int difference = employeeCount - Arrays.stream(counts).sum();
    if (difference > 0) {
      counts[byShare.get(0)] += difference;
    }
    for (int level : byShare) {
      if (difference >= 0) {
        break;
      }
      int removable = Math.min(counts[level] - minimums[level], -difference);
      counts[level] -= removable;
      difference += removable;
    }
    return counts;
  }

  private static List<Integer> managerPool(int level, List<List<Integer>> buckets) {
    if (level == MAX_LEVEL) {
      return List.of(CEO_INDEX);
    }
    List<Integer> pool = new ArrayList<>();
    int highestCandidate;
    if (level == 4) {
      pool.addAll(buckets.get(5));
      highestCandidate = 5;
    } else if (level == 3) {
      pool.addAll(buckets.get(4));
      highestCandidate = 4;
    } else {
      pool.addAll(buckets.get(3));
      pool.addAll(buckets.get(4));
      highestCandidate = 4;
    }
    for (int above = highestCandidate + 1; pool.isEmpty() && above <= MAX_LEVEL; above++) {
      pool.addAll(buckets.get(above));
    }
    return pool;
  }
}
