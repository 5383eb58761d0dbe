package com.obsidiandynamics.chpsim.exec;

import com.obsidiandynamics.chpsim.*;

import java.io.*;

public final class ProgramWriter {
  private ProgramWriter() {}

  public static void write(CircuitProgram program, Writer writer) throws IOException {
    for (var instruction : program.getInstructions()) {
      writer.write(instruction.toString());
      writer.write('\n');
    }
    writer.flush();
  }

  public static String toText(CircuitProgram program) {
    final var writer = new StringWriter();
    try {
      write(program, writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return writer.toString();
  }
}
