package com.obsidiandynamics.chpsim.exec;

public final class OutputParseFailure extends ShotFailure {
  public OutputParseFailure(String m) {
    super(m, null);
  }
}
