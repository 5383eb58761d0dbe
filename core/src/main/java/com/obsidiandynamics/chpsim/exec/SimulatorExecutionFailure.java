package com.obsidiandynamics.chpsim.exec;

public final class SimulatorExecutionFailure extends ShotFailure {
  private final int exitCode;

  public SimulatorExecutionFailure(String m, int exitCode) {
    super(m, null);
    this.exitCode = exitCode;
  }

  public SimulatorExecutionFailure(String m, Throwable cause) {
    super(m, cause);
    exitCode = -1;
  }

  public int getExitCode() {
    return exitCode;
  }
}
