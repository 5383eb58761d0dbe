package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

/**
 *  A randomised choice between weighted instruction sequences and an implicit identity, whose
 *  probability is whatever weight remains below 1.<p>
 *
 *  Each call to {@link #getInstructions} consumes exactly one draw from a
 *  {@link SplittableRandom} seeded at construction, so for a given seed the n-th call always
 *  selects the same alternative, whichever caller makes it.
 */
public final class StochasticOpRep implements OpRep {
  /** Absorbs rounding in weights that are meant to sum to exactly 1. */
  private static final double WEIGHT_TOLERANCE = 1e-12;

  public static final class Alternative {
    private final double weight;

    private final List<Instruction> instructions;

    public Alternative(double weight, List<Instruction> instructions) {
      this.weight = weight;
      this.instructions = List.copyOf(instructions);
    }

    public static Alternative of(double weight, Instruction... instructions) {
      return new Alternative(weight, List.of(instructions));
    }

    public double getWeight() {
      return weight;
    }

    public List<Instruction> getInstructions() {
      return instructions;
    }

    @Override
    public String toString() {
      return Alternative.class.getSimpleName() + "[weight=" + weight + ", instructions=" + instructions + ']';
    }
  }

  private final int numQubits;

  private final List<Alternative> alternatives;

  private final double[] cumulative;

  private final long seed;

  private final SplittableRandom rng;

  private long draws;

  public StochasticOpRep(int numQubits, List<Alternative> alternatives, long seed) {
    cumulative = new double[alternatives.size()];
    var sum = 0d;
    for (var i = 0; i < cumulative.length; i++) {
      final var alternative = alternatives.get(i);
      final var weight = alternative.getWeight();
      Assert.that(Double.isFinite(weight) && weight >= 0, ConfigurationException::new,
                  () -> "Invalid weight " + weight + " for " + alternative);
      OpReps.checkLocal(numQubits, alternative.getInstructions());
      sum += weight;
      cumulative[i] = sum;
    }
    final var total = sum;
    Assert.that(total <= 1 + WEIGHT_TOLERANCE, ConfigurationException::new, () -> "Weights sum to " + total + ", exceeding 1");

    this.numQubits = numQubits;
    this.alternatives = List.copyOf(alternatives);
    this.seed = seed;
    rng = new SplittableRandom(seed);
  }

  @Override
  public int getNumQubits() {
    return numQubits;
  }

  @Override
  public boolean isDeterministic() {
    return false;
  }

  public List<Alternative> getAlternatives() {
    return alternatives;
  }

  public long getSeed() {
    return seed;
  }

  /**
   *  @return The number of draws taken so far.
   */
  public synchronized long getDraws() {
    return draws;
  }

  /**
   *  Draws the next alternative.
   *
   *  @return The index of the selected alternative, or -1 for the identity.
   */
  public synchronized int sample() {
    draws++;
    final var rnd = rng.nextDouble();
    for (var i = 0; i < cumulative.length; i++) {
      if (cumulative[i] > rnd) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public List<Instruction> getInstructions(List<Integer> targets) {
    OpReps.checkTargets(this, targets);
    final var selected = sample();
    if (selected == -1) {
      return List.of();
    } else {
      return OpReps.remapAll(alternatives.get(selected).getInstructions(), targets);
    }
  }

  @Override
  public String toString() {
    return StochasticOpRep.class.getSimpleName() + "[numQubits=" + numQubits + ", seed=" + seed +
        ", alternatives=" + alternatives + ']';
  }
}
