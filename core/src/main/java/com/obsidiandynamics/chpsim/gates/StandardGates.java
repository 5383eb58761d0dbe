package com.obsidiandynamics.chpsim.gates;

import com.obsidiandynamics.chpsim.*;

import java.util.*;

public final class StandardGates {
  private static final Map<String, StaticOpRep> GATES = new LinkedHashMap<>();

  static {
    GATES.put("Gi", StaticOpRep.parse(1));
    GATES.put("Gxpi2", StaticOpRep.parse(1, "h 0", "p 0", "h 0"));
    GATES.put("Gypi2", StaticOpRep.parse(1, "h 0", "x 0"));
    GATES.put("Gzpi2", StaticOpRep.parse(1, "p 0"));
    GATES.put("Gxpi", StaticOpRep.parse(1, "x 0"));
    GATES.put("Gypi", StaticOpRep.parse(1, "y 0"));
    GATES.put("Gzpi", StaticOpRep.parse(1, "z 0"));
    GATES.put("Gh", StaticOpRep.parse(1, "h 0"));
    GATES.put("Gp", StaticOpRep.parse(1, "p 0"));
    GATES.put("Gcnot", StaticOpRep.parse(2, "c 0 1"));
    GATES.put("Gcphase", StaticOpRep.parse(2, "h 1", "c 0 1", "h 1"));
    GATES.put("Gswap", StaticOpRep.parse(2, "c 0 1", "c 1 0", "c 0 1"));
  }

  private StandardGates() {}

  public static Set<String> names() {
    return Collections.unmodifiableSet(GATES.keySet());
  }

  public static StaticOpRep get(String name) {
    final var gate = GATES.get(name);
    if (gate == null) {
      throw new ConfigurationException("Not a standard gate: " + name);
    }
    return gate;
  }

  public static OpTable table(String... names) {
    final var builder = OpTable.builder();
    for (var name : names) {
      builder.with(name, get(name));
    }
    return builder.build();
  }

  public static OpTable table() {
    return table(GATES.keySet().toArray(String[]::new));
  }
}
