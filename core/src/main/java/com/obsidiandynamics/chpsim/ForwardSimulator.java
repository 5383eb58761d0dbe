package com.obsidiandynamics.chpsim;

import java.util.*;

public interface ForwardSimulator {
  ProbabilityDistribution probabilities(Circuit circuit) throws SimulationFailure, InterruptedException;

  default Map<Circuit, ProbabilityDistribution> bulkProbabilities(List<Circuit> circuits) throws SimulationFailure, InterruptedException {
    final var results = new LinkedHashMap<Circuit, ProbabilityDistribution>(circuits.size());
    for (var circuit : circuits) {
      results.put(circuit, probabilities(circuit));
    }
    return results;
  }
}
