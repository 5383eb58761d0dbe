package com.obsidiandynamics.chpsim;

import java.util.*;

public final class Layer {
  private final List<OpLabel> labels;

  public Layer(List<OpLabel> labels) {
    this.labels = List.copyOf(labels);
  }

  public static Layer of(OpLabel... labels) {
    return new Layer(List.of(labels));
  }

  public List<OpLabel> getLabels() {
    return labels;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Layer) o;
    return Objects.equals(labels, that.labels);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(labels);
  }

  @Override
  public String toString() {
    return labels.toString();
  }
}
