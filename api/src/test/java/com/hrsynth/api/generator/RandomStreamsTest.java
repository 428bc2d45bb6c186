package com.hrsynth.api.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hrsynth.api.generator.RandomStreams.Stage;
import java.util.List;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;

class RandomStreamsTest {

  private static long[] draw(UniformRandomProvider rng) {
    return new long[] {rng.nextLong(), rng.nextLong(), rng.nextLong()};
  }

  @Test
  void sameSeedGivesSameStreams() {
    RandomStreams first = new RandomStreams(42L);
    RandomStreams second = new RandomStreams(42L);

    assertThat(draw(first.forEmployee(17, Stage.COMPENSATION)))
        .containsExactly(draw(second.forEmployee(17, Stage.COMPENSATION)));
    assertThat(draw(first.global(Stage.HIERARCHY)))
        .containsExactly(draw(second.global(Stage.HIERARCHY)));
  }

  @Test
  void streamsDifferAcrossEmployeesStagesAndSeeds() {
    RandomStreams streams = new RandomStreams(42L);
    long[] base = draw(streams.forEmployee(0, Stage.DEMOGRAPHICS));

    assertThat(draw(streams.forEmployee(1, Stage.DEMOGRAPHICS))).isNotEqualTo(base);
    assertThat(draw(streams.forEmployee(0, Stage.CAREER_EVENTS))).isNotEqualTo(base);
    assertThat(draw(streams.global(Stage.DEMOGRAPHICS))).isNotEqualTo(base);
    assertThat(draw(new RandomStreams(43L).forEmployee(0, Stage.DEMOGRAPHICS)))
        .isNotEqualTo(base);
  }

  @Test
  void streamDoesNotDependOnCreationOrder() {
    RandomStreams streams = new RandomStreams(7L);
    long[] direct = draw(streams.forEmployee(250, Stage.PERFORMANCE));

    RandomStreams other = new RandomStreams(7L);
    for (int i = 0; i < 250; i++) {
      other.forEmployee(i, Stage.PERFORMANCE).nextLong();
    }

    assertThat(draw(other.forEmployee(250, Stage.PERFORMANCE))).containsExactly(direct);
  }

  @Test
  void forEmployee_rejectsNegativeIndex() {
    assertThatThrownBy(() -> new RandomStreams(1L).forEmployee(-1, Stage.ASSIGNMENTS))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void pick_rejectsEmptyList() {
    UniformRandomProvider rng = new RandomStreams(1L).global(Stage.HIERARCHY);

    assertThat(RandomStreams.pick(List.of("only"), rng)).isEqualTo("only");
    assertThatThrownBy(() -> RandomStreams.pick(List.of(), rng))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
