package com.obsidiandynamics.chpsim;

import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

final class StaticOpRepTest {
  @Test
  void testGetInstructions_identityTargets() {
    final var rep = StaticOpRep.parse(2, "h 0", "c 0 1");
    assertThat(rep.getInstructions(OpRep.identityTargets(2)))
        .containsExactly(Instruction.parse("h 0"), Instruction.parse("c 0 1"));
  }

  @Test
  void testGetInstructions_remapped() {
    final var rep = StaticOpRep.parse(2, "h 0", "c 0 1");
    assertThat(rep.getInstructions(List.of(5, 3)))
        .containsExactly(Instruction.parse("h 5"), Instruction.parse("c 5 3"));
  }

  @Test
  void testGetInstructions_empty() {
    assertThat(StaticOpRep.parse(1).getInstructions(List.of(0))).isEmpty();
  }

  @Test
  void testGetInstructions_wrongTargetCount() {
    final var rep = StaticOpRep.parse(2, "c 0 1");
    assertThat(catchThrowable(() -> rep.getInstructions(List.of(0)))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testOperandOutsideRegister() {
    assertThat(catchThrowable(() -> StaticOpRep.parse(1, "c 0 1"))).isInstanceOf(ConfigurationException.class).hasMessageContaining("exceeds");
  }

  @Test
  void testResetAndMeasureRejected() {
    assertThat(catchThrowable(() -> StaticOpRep.parse(1, "m 0"))).isInstanceOf(ConfigurationException.class);
    assertThat(catchThrowable(() -> StaticOpRep.parse(1, "r"))).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void testUnparseable() {
    assertThat(catchThrowable(() -> StaticOpRep.parse(1, "hadamard 0"))).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void testIsDeterministic() {
    assertThat(StaticOpRep.parse(1, "h 0").isDeterministic()).isTrue();
  }

  @Test
  void testImmutable() {
    final var instructions = new ArrayList<>(List.of(Instruction.parse("h 0")));
    final var rep = new StaticOpRep(1, instructions);
    instructions.add(Instruction.parse("p 0"));
    assertThat(rep.getLocalInstructions()).hasSize(1);
    assertThat(catchThrowable(() -> rep.getLocalInstructions().clear())).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void testToString() {
    final var toString = StaticOpRep.parse(1, "h 0").toString();
    assertThat(toString).contains(StaticOpRep.class.getSimpleName());
    assertThat(toString).contains("numQubits=1");
    assertThat(toString).contains("h 0");
  }
}
