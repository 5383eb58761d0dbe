package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class ComposedOpRep implements OpRep {
  private final int numQubits;

  private final List<OpRep> children;

  public ComposedOpRep(List<? extends OpRep> children) {
    Assert.that(!children.isEmpty(), ConfigurationException::new, Assert.withMessage("No children to compose"));
    final var numQubits = children.get(0).getNumQubits();
    for (var child : children) {
      Assert.that(child.getNumQubits() == numQubits, ConfigurationException::new,
                  () -> String.format("Cannot compose %d-qubit %s with %d-qubit siblings", child.getNumQubits(), child, numQubits));
    }
    this.numQubits = numQubits;
    this.children = List.copyOf(children);
  }

  public static ComposedOpRep of(OpRep... children) {
    return new ComposedOpRep(List.of(children));
  }

  @Override
  public int getNumQubits() {
    return numQubits;
  }

  @Override
  public boolean isDeterministic() {
    for (var child : children) {
      if (!child.isDeterministic()) return false;
    }
    return true;
  }

  public List<OpRep> getChildren() {
    return children;
  }

  @Override
  public List<Instruction> getInstructions(List<Integer> targets) {
    OpReps.checkTargets(this, targets);
    final var instructions = new ArrayList<Instruction>();
    for (var child : children) {
      instructions.addAll(child.getInstructions(targets));
    }
    return instructions;
  }

  @Override
  public String toString() {
    return ComposedOpRep.class.getSimpleName() + "[numQubits=" + numQubits + ", children=" + children + ']';
  }
}
