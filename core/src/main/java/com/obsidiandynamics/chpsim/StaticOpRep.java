package com.obsidiandynamics.chpsim;

import java.util.*;

public final class StaticOpRep implements OpRep {
  private final int numQubits;

  private final List<Instruction> instructions;

  public StaticOpRep(int numQubits, List<Instruction> instructions) {
    this.instructions = OpReps.checkLocal(numQubits, instructions);
    this.numQubits = numQubits;
  }

  public static StaticOpRep parse(int numQubits, String... lines) {
    final var instructions = new ArrayList<Instruction>(lines.length);
    for (var line : lines) {
      try {
        instructions.add(Instruction.parse(line));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(e.getMessage(), e);
      }
    }
    return new StaticOpRep(numQubits, instructions);
  }

  @Override
  public int getNumQubits() {
    return numQubits;
  }

  @Override
  public boolean isDeterministic() {
    return true;
  }

  public List<Instruction> getLocalInstructions() {
    return instructions;
  }

  @Override
  public List<Instruction> getInstructions(List<Integer> targets) {
    OpReps.checkTargets(this, targets);
    return OpReps.remapAll(instructions, targets);
  }

  @Override
  public String toString() {
    return StaticOpRep.class.getSimpleName() + "[numQubits=" + numQubits + ", instructions=" + instructions + ']';
  }
}
