package com.obsidiandynamics.chpsim.exec;

import com.obsidiandynamics.chpsim.*;

@FunctionalInterface
public interface ShotExecutor {
  ShotResult execute(CircuitProgram program) throws ShotFailure, InterruptedException;
}
