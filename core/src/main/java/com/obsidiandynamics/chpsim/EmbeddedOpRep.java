package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class EmbeddedOpRep implements OpRep {
  private final int numQubits;

  private final OpRep child;

  private final int[] mapping;

  public EmbeddedOpRep(int numQubits, OpRep child, int... mapping) {
    Assert.that(numQubits >= 0, ConfigurationException::new, () -> "Negative qubit count " + numQubits);
    Assert.that(mapping.length == child.getNumQubits(), ConfigurationException::new,
                () -> String.format("Mapping %s does not cover the %d qubit(s) of %s", Arrays.toString(mapping), child.getNumQubits(), child));
    final var used = new BitSet(numQubits);
    for (var target : mapping) {
      Assert.that(target >= 0 && target < numQubits, ConfigurationException::new,
                  () -> String.format("Mapping target %d lies outside a %d-qubit register", target, numQubits));
      Assert.that(!used.get(target), ConfigurationException::new,
                  () -> String.format("Mapping %s is not injective", Arrays.toString(mapping)));
      used.set(target);
    }
    this.numQubits = numQubits;
    this.child = child;
    this.mapping = mapping.clone();
  }

  @Override
  public int getNumQubits() {
    return numQubits;
  }

  @Override
  public boolean isDeterministic() {
    return child.isDeterministic();
  }

  public OpRep getChild() {
    return child;
  }

  public int[] getMapping() {
    return mapping.clone();
  }

  @Override
  public List<Instruction> getInstructions(List<Integer> targets) {
    OpReps.checkTargets(this, targets);
    final var childTargets = new ArrayList<Integer>(mapping.length);
    for (var index : mapping) {
      childTargets.add(targets.get(index));
    }
    return child.getInstructions(childTargets);
  }

  @Override
  public String toString() {
    return EmbeddedOpRep.class.getSimpleName() + "[numQubits=" + numQubits + ", mapping=" + Arrays.toString(mapping) +
        ", child=" + child + ']';
  }
}
