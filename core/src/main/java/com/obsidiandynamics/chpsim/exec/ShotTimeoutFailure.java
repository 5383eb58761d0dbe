package com.obsidiandynamics.chpsim.exec;

import java.time.*;

public final class ShotTimeoutFailure extends ShotFailure {
  private final Duration timeout;

  public ShotTimeoutFailure(Duration timeout) {
    super("Shot did not complete within " + timeout, null);
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
