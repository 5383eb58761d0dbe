package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.util.*;

import java.util.*;

public final class OpLabel {
  private final String name;

  private final List<Integer> targets;

  public OpLabel(String name, List<Integer> targets) {
    Assert.that(name != null && !name.isBlank(), IllegalArgumentException::new, Assert.withMessage("Blank operator name"));
    Assert.that(!targets.isEmpty(), IllegalArgumentException::new, () -> "No targets for " + name);
    Assert.that(new HashSet<>(targets).size() == targets.size(), IllegalArgumentException::new,
                () -> "Repeated target in " + name + targets);
    this.name = name;
    this.targets = List.copyOf(targets);
  }

  public static OpLabel of(String name, Integer... targets) {
    return new OpLabel(name, List.of(targets));
  }

  public static OpLabel parse(String text) {
    final var fields = text.strip().split(":");
    final var targets = new ArrayList<Integer>(fields.length - 1);
    for (var i = 1; i < fields.length; i++) {
      try {
        targets.add(Integer.parseInt(fields[i]));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid target in label '" + text + "'", e);
      }
    }
    return new OpLabel(fields[0], targets);
  }

  public String getName() {
    return name;
  }

  public List<Integer> getTargets() {
    return targets;
  }

  int minTarget() {
    return Collections.min(targets);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (OpLabel) o;
    if (!Objects.equals(name, that.name)) return false;
    return Objects.equals(targets, that.targets);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(name);
    result = 31 * result + Objects.hashCode(targets);
    return result;
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder(String.valueOf(name));
    for (var target : targets) {
      sb.append(':').append(target);
    }
    return sb.toString();
  }
}
