package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class Instruction {
  private final Opcode opcode;

  private final int[] qubits;

  public Instruction(Opcode opcode, int... qubits) {
    Assert.isNotNull(opcode, ConfigurationException::new, Assert.withMessage("Opcode cannot be null"));
    Assert.that(qubits.length == opcode.getArity(), ConfigurationException::new,
                () -> String.format("Opcode %s takes %d operand(s), got %d", opcode, opcode.getArity(), qubits.length));
    for (var qubit : qubits) {
      Assert.that(qubit >= 0, ConfigurationException::new, () -> "Negative qubit index " + qubit);
    }
    if (qubits.length == 2) {
      Assert.that(qubits[0] != qubits[1], ConfigurationException::new, () -> "Repeated operand in " + opcode + " " + qubits[0]);
    }
    this.opcode = opcode;
    this.qubits = qubits.clone();
  }

  public static Instruction of(Opcode opcode, int... qubits) {
    return new Instruction(opcode, qubits);
  }

  public static Instruction reset() {
    return new Instruction(Opcode.RESET);
  }

  public static Instruction measure(int qubit) {
    return new Instruction(Opcode.MEASURE, qubit);
  }

  public Opcode getOpcode() {
    return opcode;
  }

  public int[] getQubits() {
    return qubits.clone();
  }

  public int maxQubit() {
    var max = -1;
    for (var qubit : qubits) {
      max = Math.max(max, qubit);
    }
    return max;
  }

  public Instruction remap(List<Integer> targets) {
    if (qubits.length == 0) return this;

    final var mapped = new int[qubits.length];
    for (var i = 0; i < qubits.length; i++) {
      final var local = qubits[i];
      if (local >= targets.size()) {
        throw new IllegalArgumentException("Operand " + local + " of " + this + " has no target in " + targets);
      }
      mapped[i] = targets.get(local);
    }
    return new Instruction(opcode, mapped);
  }

  public static Instruction parse(String line) {
    final var fields = line.strip().split("\\s+");
    final var opcode = Opcode.forToken(fields[0]);
    if (opcode == null) {
      throw new IllegalArgumentException("Unknown opcode in '" + line + "'");
    }
    final var qubits = new int[fields.length - 1];
    for (var i = 0; i < qubits.length; i++) {
      try {
        qubits[i] = Integer.parseInt(fields[i + 1]);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid operand in '" + line + "'", e);
      }
    }
    return new Instruction(opcode, qubits);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Instruction) o;
    if (opcode != that.opcode) return false;
    return Arrays.equals(qubits, that.qubits);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(opcode);
    result = 31 * result + Arrays.hashCode(qubits);
    return result;
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder(opcode.getToken());
    for (var qubit : qubits) {
      sb.append(' ').append(qubit);
    }
    return sb.toString();
  }
}
