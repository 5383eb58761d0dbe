package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.InvalidLayerFailure.*;
import org.apache.logging.log4j.*;

import java.util.*;
import java.util.concurrent.*;

/**
 *  Lowers a {@link Circuit} to a {@link CircuitProgram} by resolving every label through an
 *  {@link OpTable}.<p>
 *
 *  Each layer is validated in full before any of its labels is expanded, and the whole circuit
 *  is expanded before the program is returned; a failure therefore leaves nothing half-built.
 *  Parallel entries are emitted in order of their smallest target so that the program text is
 *  reproducible. Expansions of deterministic representations are cached per label; stochastic
 *  representations are sampled afresh at every occurrence.
 */
public final class CircuitTranslator {
  private static final Logger log = LogManager.getLogger(CircuitTranslator.class);

  private static final Comparator<OpLabel> BY_MIN_TARGET = Comparator.comparingInt(OpLabel::minTarget);

  private final OpTable table;

  private final Map<OpLabel, List<Instruction>> cache = new ConcurrentHashMap<>();

  public CircuitTranslator(OpTable table) {
    this.table = table;
  }

  public OpTable getTable() {
    return table;
  }

  public CircuitProgram translate(Circuit circuit) throws TranslationFailure {
    final var numQubits = circuit.getNumQubits();
    final var layers = circuit.getLayers();
    final var resolved = new ArrayList<List<Map.Entry<OpLabel, OpRep>>>(layers.size());
    for (var layerIndex = 0; layerIndex < layers.size(); layerIndex++) {
      resolved.add(resolveLayer(layerIndex, layers.get(layerIndex), numQubits));
    }

    final var instructions = new ArrayList<Instruction>();
    instructions.add(Instruction.reset());
    for (var layer : resolved) {
      for (var entry : layer) {
        instructions.addAll(expand(entry.getKey(), entry.getValue()));
      }
    }
    for (var qubit : circuit.getMeasuredQubits()) {
      instructions.add(Instruction.measure(qubit));
    }

    log.debug("Translated {} layer(s) into {} instruction(s)", layers.size(), instructions.size());
    return new CircuitProgram(numQubits, instructions, circuit.getMeasuredQubits());
  }

  private List<Map.Entry<OpLabel, OpRep>> resolveLayer(int layerIndex, Layer layer, int numQubits) throws TranslationFailure {
    final var occupied = new BitSet(numQubits);
    for (var label : layer.getLabels()) {
      for (var target : label.getTargets()) {
        if (target < 0 || target >= numQubits) {
          throw new InvalidLayerFailure(Reason.TARGET_OUT_OF_RANGE, layerIndex,
                                        "Target " + target + " of " + label + " lies outside a " + numQubits + "-qubit register");
        }
        if (occupied.get(target)) {
          throw new InvalidLayerFailure(Reason.OVERLAPPING_TARGETS, layerIndex,
                                        "Qubit " + target + " is acted on more than once in " + layer);
        }
        occupied.set(target);
      }
    }

    final var ordered = new ArrayList<>(layer.getLabels());
    ordered.sort(BY_MIN_TARGET);
    final var entries = new ArrayList<Map.Entry<OpLabel, OpRep>>(ordered.size());
    for (var label : ordered) {
      final var rep = table.resolve(label);
      if (rep == null) {
        throw new UnknownOperatorFailure(label);
      }
      if (rep.getNumQubits() != label.getTargets().size()) {
        throw new InvalidLayerFailure(Reason.SIZE_MISMATCH, layerIndex,
                                      String.format("%s resolves to a %d-qubit representation", label, rep.getNumQubits()));
      }
      entries.add(Map.entry(label, rep));
    }
    return entries;
  }

  private List<Instruction> expand(OpLabel label, OpRep rep) {
    if (rep.isDeterministic()) {
      return cache.computeIfAbsent(label, __ -> List.copyOf(rep.getInstructions(label.getTargets())));
    } else {
      return rep.getInstructions(label.getTargets());
    }
  }
}
