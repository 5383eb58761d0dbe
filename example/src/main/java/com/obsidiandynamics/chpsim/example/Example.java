package com.obsidiandynamics.chpsim.example;

import com.obsidiandynamics.chpsim.*;
import com.obsidiandynamics.chpsim.gates.*;
import org.apache.logging.log4j.*;

import java.io.*;
import java.util.*;

public class Example {
  private static final Logger log = LogManager.getLogger(Example.class);

  public static void main(String[] args) throws Exception {
    // Options come from chpsim.properties, if present; the first argument overrides the executable.
    final var props = new Properties();
    try (var in = Example.class.getResourceAsStream("/chpsim.properties")) {
      if (in != null) props.load(in);
    }
    final var options = ExternalForwardSimulator.Options.fromProperties(props);
    if (args.length > 0) {
      options.executablePath = args[0];
    }
    if (options.executablePath == null) {
      System.err.println("usage: Example <path-to-chp-executable>");
      System.exit(1);
    }

    // Ideal single-qubit gates; a noisy CNOT followed by independent depolarizing noise on both qubits.
    final var noisyCnot = Noise.after(StandardGates.get("Gcnot"),
                                      Noise.independent(2, qubit -> Noise.depolarizing(0.02, 1_000 + qubit)));
    final var table = OpTable.builder()
        .withAll(StandardGates.table("Gi", "Gxpi2", "Gypi2"))
        .with("Gcnot", noisyCnot)
        .build();

    // A Bell-state preparation, measured on both qubits.
    final var bell = Circuit.builder(2)
        .layer(OpLabel.of("Gypi2", 0), OpLabel.of("Gi", 1))
        .layer(OpLabel.of("Gcnot", 0, 1))
        .build();

    try (var simulator = new ExternalForwardSimulator(table, options)) {
      final var distribution = simulator.probabilities(bell);
      System.out.format("joint: %s%n", distribution.asMap());
      System.out.format("qubit 0: %s%n", distribution.marginalize(0).asMap());
      System.out.format("qubit 1: %s%n", distribution.marginalize(1).asMap());
    } catch (SimulationFailure e) {
      log.error("Simulation failed", e);
      System.exit(1);
    }
  }
}
