package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class OutcomeAggregator {
  private OutcomeAggregator() {}

  public static ProbabilityDistribution aggregate(List<ShotResult> shots, int expectedShots) {
    Assert.that(expectedShots >= 1, ConfigurationException::new, () -> "Invalid shot count " + expectedShots);
    Assert.that(shots.size() == expectedShots, IllegalArgumentException::new,
                () -> String.format("Expected %d shot(s), got %d", expectedShots, shots.size()));

    final var qubits = shots.get(0).getQubits();
    final var counts = new TreeMap<String, Integer>();
    for (var shot : shots) {
      Assert.that(shot.getQubits().equals(qubits), IllegalArgumentException::new,
                  () -> "Shot over " + shot.getQubits() + " mixed with shots over " + qubits);
      counts.merge(shot.getBits(), 1, Integer::sum);
    }

    final var probabilities = new TreeMap<String, Double>();
    for (var entry : counts.entrySet()) {
      probabilities.put(entry.getKey(), (double) entry.getValue() / expectedShots);
    }
    return new ProbabilityDistribution(qubits, expectedShots, probabilities);
  }
}
