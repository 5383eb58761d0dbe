package com.obsidiandynamics.chpsim.gates;

import com.obsidiandynamics.chpsim.*;
import com.obsidiandynamics.chpsim.ExternalForwardSimulator.*;
import org.junit.jupiter.api.*;

import java.util.*;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.*;

final class NoiseTest {
  private static List<String> lines(List<Instruction> instructions) {
    return instructions.stream().map(Instruction::toString).collect(Collectors.toList());
  }

  @Test
  void testDepolarizingWeights() {
    final var channel = Noise.depolarizing(0.3, 0);
    assertThat(channel.getNumQubits()).isEqualTo(1);
    assertThat(channel.isDeterministic()).isFalse();
    assertThat(channel.getAlternatives()).hasSize(3);
    for (var alternative : channel.getAlternatives()) {
      assertThat(alternative.getWeight()).isCloseTo(0.1, within(1e-12));
    }
    assertThat(lines(channel.getAlternatives().get(1).getInstructions())).containsExactly("y 0");
  }

  @Test
  void testBitFlipCertain() {
    final var channel = Noise.bitFlip(1.0, 5);
    for (var i = 0; i < 20; i++) {
      assertThat(lines(channel.getInstructions(List.of(4)))).containsExactly("x 4");
    }
  }

  @Test
  void testPhaseFlipNever() {
    final var channel = Noise.phaseFlip(0.0, 5);
    for (var i = 0; i < 20; i++) {
      assertThat(channel.getInstructions(List.of(0))).isEmpty();
    }
  }

  @Test
  void testPauli_excessiveRates() {
    assertThat(catchThrowable(() -> Noise.pauli(0.5, 0.4, 0.2, 0))).isInstanceOf(ConfigurationException.class);
    assertThat(catchThrowable(() -> Noise.depolarizing(1.5, 0))).isInstanceOf(ConfigurationException.class);
    assertThat(catchThrowable(() -> Noise.bitFlip(-0.1, 0))).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void testIndependent_embedsPerQubit() {
    final var channel = Noise.independent(3, qubit -> Noise.bitFlip(qubit == 1 ? 0.0 : 1.0, qubit));
    assertThat(channel.getNumQubits()).isEqualTo(3);
    assertThat(channel.isDeterministic()).isFalse();
    assertThat(lines(channel.getInstructions(List.of(5, 6, 7)))).containsExactly("x 5", "x 7");
  }

  @Test
  void testAfter() {
    final var noisy = Noise.after(StandardGates.get("Gxpi"), Noise.bitFlip(1.0, 0));
    assertThat(noisy.getNumQubits()).isEqualTo(1);
    assertThat(lines(noisy.getInstructions(List.of(2)))).containsExactly("x 2", "x 2");
  }

  @Test
  void testAfter_sizeMismatch() {
    assertThat(catchThrowable(() -> Noise.after(StandardGates.get("Gcnot"), Noise.bitFlip(0.1, 0))))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void testNoisyGateThroughSimulator_sampledOncePerCall() throws SimulationFailure, InterruptedException {
    final var table = OpTable.builder()
        .withAll(StandardGates.table())
        .with("Gxpi", Noise.after(StandardGates.get("Gxpi"), Noise.bitFlip(0.25, 99)))
        .build();
    final var circuit = Circuit.builder(1).layer(OpLabel.of("Gxpi", 0)).build();
    final var options = new Options() {{
      shotCount = 4;
      parallelism = 1;
    }};
    final var calls = 400;
    var flipped = 0;
    try (var sim = new ExternalForwardSimulator(table, options, new TableauShotExecutor(3))) {
      for (var call = 0; call < calls; call++) {
        final var dist = sim.probabilities(circuit);
        assertThat(dist.asMap()).hasSize(1);
        if (dist.get("0") == 1.0) flipped++;
      }
    }
    assertThat((double) flipped / calls).isCloseTo(0.25, within(0.08));
  }
}
