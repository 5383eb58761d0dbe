package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class Circuit {
  private final int numQubits;

  private final List<Layer> layers;

  private final List<Integer> measuredQubits;

  public Circuit(int numQubits, List<Layer> layers, List<Integer> measuredQubits) {
    Assert.that(numQubits > 0, IllegalArgumentException::new, () -> "Invalid register size " + numQubits);
    Assert.that(!measuredQubits.isEmpty(), IllegalArgumentException::new, Assert.withMessage("No measured qubits"));
    final var seen = new HashSet<Integer>();
    for (var qubit : measuredQubits) {
      Assert.that(qubit >= 0 && qubit < numQubits, IllegalArgumentException::new,
                  () -> "Measured qubit " + qubit + " lies outside a " + numQubits + "-qubit register");
      Assert.that(seen.add(qubit), IllegalArgumentException::new, () -> "Qubit " + qubit + " is measured twice");
    }
    this.numQubits = numQubits;
    this.layers = List.copyOf(layers);
    this.measuredQubits = List.copyOf(measuredQubits);
  }

  public static Builder builder(int numQubits) {
    return new Builder(numQubits);
  }

  public static final class Builder {
    private final int numQubits;

    private final List<Layer> layers = new ArrayList<>();

    private List<Integer> measuredQubits;

    private Builder(int numQubits) {
      this.numQubits = numQubits;
    }

    public Builder layer(OpLabel... labels) {
      layers.add(Layer.of(labels));
      return this;
    }

    public Builder layer(Layer layer) {
      layers.add(layer);
      return this;
    }

    public Builder measure(Integer... qubits) {
      measuredQubits = List.of(qubits);
      return this;
    }

    public Circuit build() {
      return new Circuit(numQubits, layers, measuredQubits != null ? measuredQubits : OpRep.identityTargets(numQubits));
    }
  }

  public int getNumQubits() {
    return numQubits;
  }

  public List<Layer> getLayers() {
    return layers;
  }

  public List<Integer> getMeasuredQubits() {
    return measuredQubits;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Circuit) o;
    if (numQubits != that.numQubits) return false;
    if (!Objects.equals(layers, that.layers)) return false;
    return Objects.equals(measuredQubits, that.measuredQubits);
  }

  @Override
  public int hashCode() {
    int result = numQubits;
    result = 31 * result + Objects.hashCode(layers);
    result = 31 * result + Objects.hashCode(measuredQubits);
    return result;
  }

  @Override
  public String toString() {
    return Circuit.class.getSimpleName() + "[numQubits=" + numQubits + ", layers=" + layers +
        ", measuredQubits=" + measuredQubits + ']';
  }
}
