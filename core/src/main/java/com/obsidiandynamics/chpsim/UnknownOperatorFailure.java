package com.obsidiandynamics.chpsim;

public final class UnknownOperatorFailure extends TranslationFailure {
  private final OpLabel label;

  public UnknownOperatorFailure(OpLabel label) {
    super("No representation for operator " + label);
    this.label = label;
  }

  public OpLabel getLabel() {
    return label;
  }
}
