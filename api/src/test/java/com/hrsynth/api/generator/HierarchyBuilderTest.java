package com.hrsynth.api.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hrsynth.api.HrTestData;
import com.hrsynth.api.exception.ConfigurationException;
import com.hrsynth.api.model.EmployeeSlot;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class HierarchyBuilderTest {

  private final HierarchyBuilder builder = new HierarchyBuilder(HrTestData.defaultProperties());

  @Test
  void bucketSizes_followSharesAndSumToN() {
    int[] counts = builder.bucketSizes(100);

    assertThat(Arrays.copyOfRange(counts, 1, 6)).containsExactly(25, 30, 25, 15, 5);
  }

  @Test
  void bucketSizes_giveRemainderToLargestShare() {
    int[] counts = builder.bucketSizes(7);

    assertThat(Arrays.stream(counts).sum()).isEqualTo(7);
    assertThat(counts[5]).isEqualTo(1);
    // floors are 1, 2, 1, 1, 0 (+1 minimum at level 5) = 6; one left for level 2
    assertThat(Arrays.copyOfRange(counts, 1, 6)).containsExactly(1, 3, 1, 1, 1);
  }

  @Test
  void bucketSizes_removeExcessAboveMinimums() {
    HierarchyBuilder withMinimums =
        new HierarchyBuilder(
            HrTestData.properties()
                .bands(
                    List.of(
                        HrTestData.band(1, 0.25, 0, 21, 40, 50000, 75000),
                        HrTestData.band(2, 0.30, 0, 22, 45, 70000, 100000),
                        HrTestData.band(3, 0.25, 1, 30, 60, 90000, 140000),
                        HrTestData.band(4, 0.15, 1, 40, 65, 130000, 200000),
                        HrTestData.band(5, 0.05, 1, 45, 65, 180000, 300000)))
                .build());

    int[] counts = withMinimums.bucketSizes(4);

    assertThat(Arrays.stream(counts).sum()).isEqualTo(4);
    assertThat(counts[3]).isGreaterThanOrEqualTo(1);
    assertThat(counts[4]).isGreaterThanOrEqualTo(1);
    assertThat(counts[5]).isGreaterThanOrEqualTo(1);
  }

  @Test
  void bucketSizes_rejectNonPositiveCount() {
    assertThatThrownBy(() -> builder.bucketSizes(0))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("at least 1");
  }

  @Test
  void bucketSizes_rejectUnsatisfiableDirectorRequirement() {
    HierarchyBuilder strict =
        new HierarchyBuilder(HrTestData.properties().requireDirector(true).build());

    assertThatThrownBy(() -> strict.bucketSizes(1))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("director");
    assertThat(strict.bucketSizes(2)[5]).isEqualTo(2);
  }

  @Test
  void build_singleEmployeeIsCeo() {
    List<EmployeeSlot> slots = builder.build(1, new RandomStreams(1L).global(RandomStreams.Stage.HIERARCHY));

    assertThat(slots).hasSize(1);
    assertThat(slots.get(0).isCeo()).isTrue();
    assertThat(slots.get(0).seniorityLevel()).isEqualTo(5);
    assertThat(slots.get(0).managerId()).isNull();
  }

  @Test
  void build_everyManagerOutranksReport() {
    List<EmployeeSlot> slots =
        builder.build(2_000, new RandomStreams(7L).global(RandomStreams.Stage.HIERARCHY));
    Map<Integer, EmployeeSlot> byIndex =
        slots.stream().collect(Collectors.toMap(EmployeeSlot::index, Function.identity()));

    assertThat(slots.stream().filter(EmployeeSlot::isCeo)).hasSize(1);
    assertThat(slots.get(0).isCeo()).isTrue();
    for (EmployeeSlot slot : slots) {
      if (slot.isCeo()) {
        continue;
      }
      EmployeeSlot manager = byIndex.get(slot.managerIndex());
      assertThat(manager).isNotNull();
      if (slot.seniorityLevel() == 5) {
        assertThat(manager.isCeo()).isTrue();
      } else {
        assertThat(manager.seniorityLevel()).isGreaterThan(slot.seniorityLevel());
      }
    }
  }

  @Test
  void build_emptyPoolFallsBackToCeo() {
    List<EmployeeSlot> slots =
        builder.build(3, new RandomStreams(3L).global(RandomStreams.Stage.HIERARCHY));

    // one level-5 CEO plus two lower levels with nobody at levels 3 and 4
    assertThat(slots).hasSize(3);
    slots.stream()
        .filter(slot -> !slot.isCeo() && slot.seniorityLevel() < 3)
        .forEach(slot -> assertThat(slot.managerIndex()).isZero());
  }

  @Test
  void build_isDeterministicForSeed() {
    List<EmployeeSlot> first =
        builder.build(500, new RandomStreams(42L).global(RandomStreams.Stage.HIERARCHY));
    List<EmployeeSlot> second =
        builder.build(500, new RandomStreams(42L).global(RandomStreams.Stage.HIERARCHY));

    assertThat(first).isEqualTo(second);
  }
}
