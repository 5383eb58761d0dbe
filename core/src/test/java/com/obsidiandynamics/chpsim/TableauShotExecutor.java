package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.exec.*;

import java.util.*;
import java.util.concurrent.atomic.*;

/**
 *  An in-process {@link ShotExecutor} backed by {@link TableauSimulator}. Each shot draws its
 *  randomness from a generator split off a seeded parent.
 */
public final class TableauShotExecutor implements ShotExecutor {
  private final SplittableRandom rng;

  private final AtomicInteger executions = new AtomicInteger();

  public TableauShotExecutor(long seed) {
    rng = new SplittableRandom(seed);
  }

  @Override
  public ShotResult execute(CircuitProgram program) {
    final SplittableRandom shotRng;
    synchronized (rng) {
      shotRng = rng.split();
    }
    executions.incrementAndGet();
    return new TableauSimulator(program.getNumQubits(), shotRng).run(program);
  }

  public int getExecutions() {
    return executions.get();
  }
}
