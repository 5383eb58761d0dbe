package com.obsidiandynamics.chpsim.gates;

import com.obsidiandynamics.chpsim.*;
import com.obsidiandynamics.chpsim.StochasticOpRep.*;

import java.util.*;
import java.util.function.*;

public final class Noise {
  private Noise() {}

  public static StochasticOpRep depolarizing(double p, long seed) {
    return pauli(p / 3, p / 3, p / 3, seed);
  }

  public static StochasticOpRep bitFlip(double p, long seed) {
    return pauli(p, 0, 0, seed);
  }

  public static StochasticOpRep phaseFlip(double p, long seed) {
    return pauli(0, 0, p, seed);
  }

  public static StochasticOpRep pauli(double px, double py, double pz, long seed) {
    return new StochasticOpRep(1, List.of(Alternative.of(px, Instruction.of(Opcode.X, 0)),
                                          Alternative.of(py, Instruction.of(Opcode.Y, 0)),
                                          Alternative.of(pz, Instruction.of(Opcode.Z, 0))), seed);
  }

  public static ComposedOpRep independent(int numQubits, IntFunction<? extends OpRep> perQubit) {
    final var embedded = new ArrayList<OpRep>(numQubits);
    for (var qubit = 0; qubit < numQubits; qubit++) {
      embedded.add(new EmbeddedOpRep(numQubits, perQubit.apply(qubit), qubit));
    }
    return new ComposedOpRep(embedded);
  }

  public static ComposedOpRep after(OpRep gate, OpRep noise) {
    return ComposedOpRep.of(gate, noise);
  }
}
