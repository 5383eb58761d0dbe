package com.obsidiandynamics.chpsim;

import java.util.*;

public final class CircuitProgram {
  private final int numQubits;

  private final List<Instruction> instructions;

  private final List<Integer> measuredQubits;

  public CircuitProgram(int numQubits, List<Instruction> instructions, List<Integer> measuredQubits) {
    this.numQubits = numQubits;
    this.instructions = List.copyOf(instructions);
    this.measuredQubits = List.copyOf(measuredQubits);
  }

  public int getNumQubits() {
    return numQubits;
  }

  public List<Instruction> getInstructions() {
    return instructions;
  }

  public List<Integer> getMeasuredQubits() {
    return measuredQubits;
  }

  @Override
  public String toString() {
    return CircuitProgram.class.getSimpleName() + "[numQubits=" + numQubits + ", instructions=" + instructions.size() +
        ", measuredQubits=" + measuredQubits + ']';
  }
}
