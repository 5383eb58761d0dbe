package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class ShotResult {
  private final List<Integer> qubits;

  private final String bits;

  public ShotResult(List<Integer> qubits, String bits) {
    Assert.that(qubits.size() == bits.length(), IllegalArgumentException::new,
                () -> "Expected " + qubits.size() + " bit(s), got '" + bits + "'");
    Assert.that(bits.chars().allMatch(ch -> ch == '0' || ch == '1'), IllegalArgumentException::new,
                () -> "Not a bitstring: '" + bits + "'");
    this.qubits = List.copyOf(qubits);
    this.bits = bits;
  }

  public List<Integer> getQubits() {
    return qubits;
  }

  public String getBits() {
    return bits;
  }

  public int bit(int qubit) {
    final var index = qubits.indexOf(qubit);
    Assert.that(index != -1, IllegalArgumentException::new, () -> "Qubit " + qubit + " was not measured");
    return bits.charAt(index) - '0';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (ShotResult) o;
    if (!Objects.equals(qubits, that.qubits)) return false;
    return Objects.equals(bits, that.bits);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(qubits);
    result = 31 * result + Objects.hashCode(bits);
    return result;
  }

  @Override
  public String toString() {
    return ShotResult.class.getSimpleName() + "[qubits=" + qubits + ", bits=" + bits + ']';
  }
}
