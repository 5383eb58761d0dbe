package com.obsidiandynamics.chpsim;

public abstract class SimulationFailure extends Exception {
  protected SimulationFailure(String m, Throwable cause) {
    super(m, cause);
  }
}
