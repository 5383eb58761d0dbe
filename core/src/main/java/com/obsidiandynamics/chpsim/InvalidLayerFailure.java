package com.obsidiandynamics.chpsim;

public final class InvalidLayerFailure extends TranslationFailure {
  public enum Reason {
    OVERLAPPING_TARGETS,
    TARGET_OUT_OF_RANGE,
    SIZE_MISMATCH
  }

  private final Reason reason;

  private final int layerIndex;

  public InvalidLayerFailure(Reason reason, int layerIndex, String m) {
    super("Layer " + layerIndex + ": " + m);
    this.reason = reason;
    this.layerIndex = layerIndex;
  }

  public Reason getReason() {
    return reason;
  }

  public int getLayerIndex() {
    return layerIndex;
  }
}
