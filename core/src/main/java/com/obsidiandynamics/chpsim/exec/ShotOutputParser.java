package com.obsidiandynamics.chpsim.exec;

import com.obsidiandynamics.chpsim.*;

import java.util.*;
import java.util.regex.*;

public final class ShotOutputParser {
  private static final Pattern QUBIT_INDEX = Pattern.compile("0|[1-9][0-9]*");

  private ShotOutputParser() {}

  public static ShotResult parse(List<String> lines, List<Integer> measuredQubits) throws OutputParseFailure {
    final var outcomes = new HashMap<Integer, Character>();
    for (var lineNo = 0; lineNo < lines.size(); lineNo++) {
      final var line = lines.get(lineNo);
      final var fields = line.split(" ", -1);
      if (fields.length != 2) {
        throw new OutputParseFailure("Malformed line " + (lineNo + 1) + ": '" + line + "'");
      }

      final var qubit = parseQubit(fields[0]);
      if (qubit == -1) {
        throw new OutputParseFailure("Invalid qubit on line " + (lineNo + 1) + ": '" + line + "'");
      }
      if (!measuredQubits.contains(qubit)) {
        throw new OutputParseFailure("Outcome reported for unmeasured qubit " + qubit);
      }

      final var bit = fields[1];
      if (!bit.equals("0") && !bit.equals("1")) {
        throw new OutputParseFailure("Invalid bit on line " + (lineNo + 1) + ": '" + line + "'");
      }
      if (outcomes.put(qubit, bit.charAt(0)) != null) {
        throw new OutputParseFailure("Duplicate outcome for qubit " + qubit);
      }
    }

    if (outcomes.size() != measuredQubits.size()) {
      final var missing = new ArrayList<>(measuredQubits);
      missing.removeAll(outcomes.keySet());
      throw new OutputParseFailure("Incomplete output, no outcome for qubit(s) " + missing);
    }

    final var bits = new StringBuilder(measuredQubits.size());
    for (var qubit : measuredQubits) {
      bits.append(outcomes.get(qubit));
    }
    return new ShotResult(measuredQubits, bits.toString());
  }

  // -1 for anything but an unsigned decimal int without leading zeros
  private static int parseQubit(String field) {
    if (!QUBIT_INDEX.matcher(field).matches()) return -1;
    try {
      return Integer.parseInt(field);
    } catch (NumberFormatException e) {
      return -1;
    }
  }
}
