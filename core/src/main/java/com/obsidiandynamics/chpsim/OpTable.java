package com.obsidiandynamics.chpsim;

import java.util.*;

/**
 *  Resolves operator labels to representations. A representation may be registered for a
 *  specific label ({@code Gxpi2:1}) or for a bare name ({@code Gxpi2}) that applies to any
 *  targets; a specific registration takes precedence.
 */
public final class OpTable {
  private final Map<OpLabel, OpRep> byLabel;

  private final Map<String, OpRep> byName;

  private OpTable(Map<OpLabel, OpRep> byLabel, Map<String, OpRep> byName) {
    this.byLabel = Map.copyOf(byLabel);
    this.byName = Map.copyOf(byName);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<OpLabel, OpRep> byLabel = new LinkedHashMap<>();

    private final Map<String, OpRep> byName = new LinkedHashMap<>();

    private Builder() {}

    public Builder with(String name, OpRep rep) {
      byName.put(name, Objects.requireNonNull(rep, "rep"));
      return this;
    }

    public Builder with(OpLabel label, OpRep rep) {
      if (rep.getNumQubits() != label.getTargets().size()) {
        throw new ConfigurationException(String.format("%s acts on %d qubit(s), cannot serve %s", rep, rep.getNumQubits(), label));
      }
      byLabel.put(label, rep);
      return this;
    }

    public Builder withAll(OpTable table) {
      byLabel.putAll(table.byLabel);
      byName.putAll(table.byName);
      return this;
    }

    public OpTable build() {
      return new OpTable(byLabel, byName);
    }
  }

  /**
   *  @return The representation for the label, or {@code null} if none is registered.
   */
  public OpRep resolve(OpLabel label) {
    final var specific = byLabel.get(label);
    return specific != null ? specific : byName.get(label.getName());
  }

  public Set<String> names() {
    return byName.keySet();
  }

  public Set<OpLabel> labels() {
    return byLabel.keySet();
  }

  @Override
  public String toString() {
    return OpTable.class.getSimpleName() + "[names=" + byName.keySet() + ", labels=" + byLabel.keySet() + ']';
  }
}
