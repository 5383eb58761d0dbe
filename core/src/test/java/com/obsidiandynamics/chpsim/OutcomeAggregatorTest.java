package com.obsidiandynamics.chpsim;

import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

final class OutcomeAggregatorTest {
  private static final List<Integer> QUBITS = List.of(0, 1);

  private static ShotResult shot(String bits) {
    return new ShotResult(QUBITS, bits);
  }

  @Test
  void testAggregate() {
    final var dist = OutcomeAggregator.aggregate(List.of(shot("00"), shot("00"), shot("01"), shot("00")), 4);
    assertThat(dist.getQubits()).isEqualTo(QUBITS);
    assertThat(dist.getShots()).isEqualTo(4);
    assertThat(dist.asMap()).containsExactly(entry("00", 0.75), entry("01", 0.25));
  }

  @Test
  void testAggregate_singleShot() {
    final var dist = OutcomeAggregator.aggregate(List.of(shot("10")), 1);
    assertThat(dist.asMap()).containsExactly(entry("10", 1.0));
  }

  @Test
  void testAggregate_probabilitiesSumToOne() {
    final var shots = new ArrayList<ShotResult>();
    final var patterns = new String[] {"00", "01", "10", "11", "01", "01", "10"};
    for (var bits : patterns) {
      shots.add(shot(bits));
    }
    final var dist = OutcomeAggregator.aggregate(shots, patterns.length);
    final var sum = dist.asMap().values().stream().mapToDouble(Double::doubleValue).sum();
    assertThat(sum).isCloseTo(1.0, within(1e-12));
    assertThat(dist.get("01")).isCloseTo(3.0 / 7, within(1e-12));
  }

  @Test
  void testAggregate_invalidShotCount() {
    assertThat(catchThrowable(() -> OutcomeAggregator.aggregate(List.of(), 0))).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void testAggregate_countMismatch() {
    assertThat(catchThrowable(() -> OutcomeAggregator.aggregate(List.of(shot("00")), 2)))
        .isInstanceOf(IllegalArgumentException.class)
        .isNotInstanceOf(ConfigurationException.class);
  }

  @Test
  void testAggregate_mixedQubits() {
    final var shots = List.of(shot("00"), new ShotResult(List.of(1, 0), "00"));
    assertThat(catchThrowable(() -> OutcomeAggregator.aggregate(shots, 2))).isInstanceOf(IllegalArgumentException.class);
  }
}
