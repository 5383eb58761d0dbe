package com.obsidiandynamics.chpsim;

import nl.jqno.equalsverifier.*;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

final class InstructionTest {
  @Test
  void testEqualsAndHashCode() {
    EqualsVerifier.forClass(Instruction.class).verify();
  }

  @Test
  void testToString() {
    assertThat(Instruction.of(Opcode.H, 3).toString()).isEqualTo("h 3");
    assertThat(Instruction.of(Opcode.CNOT, 0, 2).toString()).isEqualTo("c 0 2");
    assertThat(Instruction.reset().toString()).isEqualTo("r");
    assertThat(Instruction.measure(1).toString()).isEqualTo("m 1");
  }

  @Test
  void testParse() {
    assertThat(Instruction.parse("x 0")).isEqualTo(Instruction.of(Opcode.X, 0));
    assertThat(Instruction.parse("  c 1   0 ")).isEqualTo(Instruction.of(Opcode.CNOT, 1, 0));
    assertThat(Instruction.parse("r")).isEqualTo(Instruction.reset());
  }

  @Test
  void testParse_rejectsMalformed() {
    assertThat(catchThrowable(() -> Instruction.parse("q 0"))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Unknown opcode");
    assertThat(catchThrowable(() -> Instruction.parse(""))).isInstanceOf(IllegalArgumentException.class);
    assertThat(catchThrowable(() -> Instruction.parse("h one"))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Invalid operand");
    assertThat(catchThrowable(() -> Instruction.parse("h 0 1"))).isInstanceOf(ConfigurationException.class);
    assertThat(catchThrowable(() -> Instruction.parse("c 0"))).isInstanceOf(ConfigurationException.class);
    assertThat(catchThrowable(() -> Instruction.parse("m -1"))).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void testRepeatedOperand_rejected() {
    assertThat(catchThrowable(() -> Instruction.of(Opcode.CNOT, 1, 1))).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void testRemap() {
    final var cnot = Instruction.of(Opcode.CNOT, 0, 1);
    assertThat(cnot.remap(List.of(4, 2))).isEqualTo(Instruction.of(Opcode.CNOT, 4, 2));
    assertThat(cnot.remap(List.of(2, 4))).isEqualTo(Instruction.of(Opcode.CNOT, 2, 4));
  }

  @Test
  void testRemap_noOperands() {
    final var reset = Instruction.reset();
    assertThat(reset.remap(List.of())).isSameAs(reset);
  }

  @Test
  void testRemap_missingTarget() {
    assertThat(catchThrowable(() -> Instruction.of(Opcode.H, 1).remap(List.of(5)))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testGetQubits_isDefensiveCopy() {
    final var instruction = Instruction.of(Opcode.H, 1);
    instruction.getQubits()[0] = 7;
    assertThat(instruction.getQubits()).containsExactly(1);
  }

  @Test
  void testOpcodeForToken() {
    for (var opcode : Opcode.values()) {
      assertThat(Opcode.forToken(opcode.getToken())).isEqualTo(opcode);
    }
    assertThat(Opcode.forToken("cnot")).isNull();
  }
}
