package com.obsidiandynamics.chpsim;

import java.util.*;

/**
 *  A node describing how an operation on {@code n} local qubits is realised as a sequence of
 *  primitive simulator instructions. The set of node kinds is closed: fixed sequences
 *  ({@link StaticOpRep}), randomised choices ({@link StochasticOpRep}), sequential composition
 *  ({@link ComposedOpRep}) and sub-register embedding ({@link EmbeddedOpRep}).<p>
 *
 *  Nodes are immutable once built, with the exception of the sampling sequence owned by each
 *  stochastic node.
 */
public sealed interface OpRep permits StaticOpRep, StochasticOpRep, ComposedOpRep, EmbeddedOpRep {
  /**
   *  @return The size of the local register this node acts on.
   */
  int getNumQubits();

  /**
   *  @return Whether repeated calls to {@link #getInstructions} with the same targets always
   *  return the same sequence.
   */
  boolean isDeterministic();

  /**
   *  Produces the instructions for this node, acting on the given enclosing-register labels.
   *  Local index {@code i} is emitted as {@code targets.get(i)}.
   *
   *  @param targets The register labels to act on; one per local qubit.
   *  @return The instructions, in application order.
   */
  List<Instruction> getInstructions(List<Integer> targets);

  static List<Integer> identityTargets(int numQubits) {
    final var targets = new ArrayList<Integer>(numQubits);
    for (var i = 0; i < numQubits; i++) {
      targets.add(i);
    }
    return Collections.unmodifiableList(targets);
  }
}
