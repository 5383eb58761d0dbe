package com.obsidiandynamics.chpsim;

public abstract class TranslationFailure extends SimulationFailure {
  protected TranslationFailure(String m) {
    super(m, null);
  }
}
