package com.obsidiandynamics.chpsim.exec;

import com.obsidiandynamics.chpsim.*;

public abstract class ShotFailure extends SimulationFailure {
  protected ShotFailure(String m, Throwable cause) {
    super(m, cause);
  }
}
