package com.obsidiandynamics.chpsim.exec;

import com.obsidiandynamics.chpsim.*;
import com.obsidiandynamics.chpsim.util.*;
import org.apache.logging.log4j.*;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

/**
 *  Executes each shot in a freshly launched instance of the external simulator.<p>
 *
 *  Every invocation gets its own temporary working directory, holding the program (fed to the
 *  process on standard input) and the captured standard output and error. The directory is
 *  removed once the shot completes, so concurrent shots never share files.
 */
public final class ProcessShotExecutor implements ShotExecutor {
  private static final Logger log = LogManager.getLogger(ProcessShotExecutor.class);

  static final String PROGRAM_FILE = "program.chp";

  static final String STDOUT_FILE = "stdout.txt";

  static final String STDERR_FILE = "stderr.txt";

  private static final int STDERR_TAIL_LINES = 10;

  private static final Duration KILL_WAIT = Duration.ofSeconds(5);

  private final List<String> command;

  private final Duration timeout;

  public ProcessShotExecutor(String executable, List<String> args, Duration timeout) {
    Assert.that(executable != null && !executable.isBlank(), ConfigurationException::new, Assert.withMessage("No executable given"));
    Assert.that(timeout != null && !timeout.isNegative() && !timeout.isZero(), ConfigurationException::new,
                () -> "Invalid timeout " + timeout);
    final var command = new ArrayList<String>(1 + args.size());
    command.add(executable);
    command.addAll(args);
    this.command = List.copyOf(command);
    this.timeout = timeout;
  }

  public List<String> getCommand() {
    return command;
  }

  public Duration getTimeout() {
    return timeout;
  }

  @Override
  public ShotResult execute(CircuitProgram program) throws ShotFailure, InterruptedException {
    final Path workDir;
    try {
      workDir = Files.createTempDirectory("chpsim-shot-");
    } catch (IOException e) {
      throw new SimulatorExecutionFailure("Unable to create a working directory", e);
    }

    try {
      return execute(program, workDir);
    } finally {
      delete(workDir);
    }
  }

  private ShotResult execute(CircuitProgram program, Path workDir) throws ShotFailure, InterruptedException {
    final var programFile = workDir.resolve(PROGRAM_FILE);
    final var stdoutFile = workDir.resolve(STDOUT_FILE);
    final var stderrFile = workDir.resolve(STDERR_FILE);
    try (var writer = Files.newBufferedWriter(programFile, StandardCharsets.UTF_8)) {
      ProgramWriter.write(program, writer);
    } catch (IOException e) {
      throw new SimulatorExecutionFailure("Unable to write program to " + programFile, e);
    }

    final Process process;
    try {
      process = new ProcessBuilder(command)
          .directory(workDir.toFile())
          .redirectInput(programFile.toFile())
          .redirectOutput(stdoutFile.toFile())
          .redirectError(stderrFile.toFile())
          .start();
    } catch (IOException e) {
      throw new SimulatorExecutionFailure("Unable to launch " + command, e);
    }

    final boolean finished;
    try {
      finished = process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      kill(process);
      throw e;
    }
    if (!finished) {
      kill(process);
      throw new ShotTimeoutFailure(timeout);
    }

    final var exitCode = process.exitValue();
    if (exitCode != 0) {
      throw new SimulatorExecutionFailure(String.format("%s exited with code %d: %s", command.get(0), exitCode, stderrTail(stderrFile)), exitCode);
    }

    final List<String> lines;
    try {
      lines = Files.readAllLines(stdoutFile, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SimulatorExecutionFailure("Unable to read output of " + command.get(0), e);
    }
    return ShotOutputParser.parse(lines, program.getMeasuredQubits());
  }

  private static void kill(Process process) throws InterruptedException {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    if (!process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
      log.warn("Process {} still running {} after being killed", process.pid(), KILL_WAIT);
    }
  }

  private static String stderrTail(Path stderrFile) {
    try {
      final var lines = Files.readAllLines(stderrFile, StandardCharsets.UTF_8);
      return String.join("\n", lines.subList(Math.max(0, lines.size() - STDERR_TAIL_LINES), lines.size()));
    } catch (IOException e) {
      return "<stderr unavailable: " + e.getMessage() + ">";
    }
  }

  private static void delete(Path dir) {
    try (Stream<Path> paths = Files.walk(dir)) {
      final var ordered = paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
      for (var path : ordered) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      log.warn("Unable to remove working directory {}", dir, e);
    }
  }

  @Override
  public String toString() {
    return ProcessShotExecutor.class.getSimpleName() + "[command=" + command + ", timeout=" + timeout + ']';
  }
}
