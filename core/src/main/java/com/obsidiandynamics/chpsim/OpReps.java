package com.obsidiandynamics.chpsim;

import java.util.*;

final class OpReps {
  private OpReps() {}

  static void checkTargets(OpRep rep, List<Integer> targets) {
    if (targets.size() != rep.getNumQubits()) {
      throw new IllegalArgumentException(String.format("%s acts on %d qubit(s), given targets %s",
                                                       rep.getClass().getSimpleName(), rep.getNumQubits(), targets));
    }
  }

  static List<Instruction> remapAll(List<Instruction> instructions, List<Integer> targets) {
    final var remapped = new ArrayList<Instruction>(instructions.size());
    for (var instruction : instructions) {
      remapped.add(instruction.remap(targets));
    }
    return remapped;
  }

  static List<Instruction> checkLocal(int numQubits, List<Instruction> instructions) {
    if (numQubits < 0) {
      throw new ConfigurationException("Negative qubit count " + numQubits);
    }
    for (var instruction : instructions) {
      if (instruction.getOpcode() == Opcode.RESET || instruction.getOpcode() == Opcode.MEASURE) {
        throw new ConfigurationException("Representations cannot contain " + instruction.getOpcode() + " instructions");
      }
      if (instruction.maxQubit() >= numQubits) {
        throw new ConfigurationException("Instruction '" + instruction + "' exceeds a local register of " + numQubits + " qubit(s)");
      }
    }
    return List.copyOf(instructions);
  }
}
