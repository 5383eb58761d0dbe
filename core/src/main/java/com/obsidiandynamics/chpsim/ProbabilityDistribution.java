package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class ProbabilityDistribution {
  private final List<Integer> qubits;

  private final int shots;

  private final SortedMap<String, Double> probabilities;

  public ProbabilityDistribution(List<Integer> qubits, int shots, Map<String, Double> probabilities) {
    for (var outcome : probabilities.keySet()) {
      Assert.that(outcome.length() == qubits.size(), IllegalArgumentException::new,
                  () -> "Outcome '" + outcome + "' does not match qubits " + qubits);
    }
    this.qubits = List.copyOf(qubits);
    this.shots = shots;
    this.probabilities = Collections.unmodifiableSortedMap(new TreeMap<>(probabilities));
  }

  public List<Integer> getQubits() {
    return qubits;
  }

  public int getShots() {
    return shots;
  }

  public SortedMap<String, Double> asMap() {
    return probabilities;
  }

  public double get(String outcome) {
    return probabilities.getOrDefault(outcome, 0d);
  }

  public ProbabilityDistribution marginalize(List<Integer> subset) {
    final var positions = new int[subset.size()];
    for (var i = 0; i < positions.length; i++) {
      final var qubit = subset.get(i);
      positions[i] = qubits.indexOf(qubit);
      Assert.that(positions[i] != -1, IllegalArgumentException::new, () -> "Qubit " + qubit + " is not in " + qubits);
    }
    Assert.that(new HashSet<>(subset).size() == subset.size(), IllegalArgumentException::new,
                () -> "Repeated qubit in " + subset);

    final var marginal = new TreeMap<String, Double>();
    for (var entry : probabilities.entrySet()) {
      final var outcome = entry.getKey();
      final var key = new char[positions.length];
      for (var i = 0; i < positions.length; i++) {
        key[i] = outcome.charAt(positions[i]);
      }
      marginal.merge(new String(key), entry.getValue(), Double::sum);
    }
    return new ProbabilityDistribution(subset, shots, marginal);
  }

  public ProbabilityDistribution marginalize(Integer... subset) {
    return marginalize(List.of(subset));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (ProbabilityDistribution) o;
    if (shots != that.shots) return false;
    if (!Objects.equals(qubits, that.qubits)) return false;
    return Objects.equals(probabilities, that.probabilities);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(qubits);
    result = 31 * result + shots;
    result = 31 * result + Objects.hashCode(probabilities);
    return result;
  }

  @Override
  public String toString() {
    return ProbabilityDistribution.class.getSimpleName() + "[qubits=" + qubits + ", shots=" + shots +
        ", probabilities=" + probabilities + ']';
  }
}
