package com.obsidiandynamics.chpsim;

import com.obsidiandynamics.chpsim.exec.*;
import com.obsidiandynamics.chpsim.util.*;
import org.apache.logging.log4j.*;

import java.time.*;
import java.time.format.*;
import java.util.*;

/**
 *  A {@link ForwardSimulator} that lowers each circuit to a stabilizer program, runs it for a
 *  fixed number of shots on an external simulator, and reports relative outcome frequencies.<p>
 *
 *  A distribution is only ever returned over exactly {@link Options#shotCount} shots; any
 *  failure that outlives its retries aborts the whole call. With a shot count of 1 the result is
 *  a single outcome with probability 1, not a smoothed estimate.
 */
public final class ExternalForwardSimulator implements ForwardSimulator, AutoCloseable {
  private static final Logger log = LogManager.getLogger(ExternalForwardSimulator.class);

  public static class Options {
    /** Path to the simulator executable. */
    public String executablePath;

    /** Extra arguments passed to the executable on every launch. */
    public List<String> executableArgs = List.of();

    /** Number of independent shots per circuit. */
    public int shotCount = 1_000;

    /** Time allowed for a single shot before its process is killed. */
    public Duration timeout = Duration.ofSeconds(10);

    /** Number of times a failed shot is reattempted. */
    public int retryCount = 2;

    /** Upper bound on concurrently running shots. */
    public int parallelism = Runtime.getRuntime().availableProcessors();

    void validate() {
      Assert.that(shotCount >= 1, ConfigurationException::new, () -> "Shot count must be at least 1, got " + shotCount);
      Assert.that(timeout != null && !timeout.isNegative() && !timeout.isZero(), ConfigurationException::new,
                  () -> "Timeout must be positive, got " + timeout);
      Assert.that(retryCount >= 0, ConfigurationException::new, () -> "Retry count cannot be negative, got " + retryCount);
      Assert.that(parallelism >= 1, ConfigurationException::new, () -> "Parallelism must be at least 1, got " + parallelism);
      Assert.isNotNull(executableArgs, ConfigurationException::new, Assert.withMessage("Executable arguments cannot be null"));
    }

    /**
     *  Reads options from {@code chpsim.*} properties, keeping the defaults for absent keys.
     */
    public static Options fromProperties(Properties props) {
      final var options = new Options();
      options.executablePath = props.getProperty("chpsim.executable");
      final var args = props.getProperty("chpsim.args");
      if (args != null && !args.isBlank()) {
        options.executableArgs = List.of(args.strip().split("\\s+"));
      }
      options.shotCount = intProperty(props, "chpsim.shots", options.shotCount);
      options.retryCount = intProperty(props, "chpsim.retries", options.retryCount);
      options.parallelism = intProperty(props, "chpsim.parallelism", options.parallelism);
      final var timeout = props.getProperty("chpsim.timeout");
      if (timeout != null) {
        try {
          options.timeout = Duration.parse(timeout.strip());
        } catch (DateTimeParseException e) {
          throw new ConfigurationException("Invalid duration for chpsim.timeout: '" + timeout + "'", e);
        }
      }
      return options;
    }

    private static int intProperty(Properties props, String key, int defaultValue) {
      final var value = props.getProperty(key);
      if (value == null) return defaultValue;
      try {
        return Integer.parseInt(value.strip());
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Invalid integer for " + key + ": '" + value + "'", e);
      }
    }

    @Override
    public String toString() {
      return Options.class.getSimpleName() + "[executablePath=" + executablePath + ", executableArgs=" + executableArgs +
          ", shotCount=" + shotCount + ", timeout=" + timeout + ", retryCount=" + retryCount +
          ", parallelism=" + parallelism + ']';
    }
  }

  private final Options options;

  private final CircuitTranslator translator;

  private final ShotRunner runner;

  public ExternalForwardSimulator(OpTable table, Options options) {
    this(table, options, launcherFor(options));
  }

  /**
   *  Runs shots through the given executor instead of launching processes; the executable
   *  options are ignored.
   */
  public ExternalForwardSimulator(OpTable table, Options options, ShotExecutor executor) {
    options.validate();
    this.options = options;
    translator = new CircuitTranslator(table);
    runner = new ShotRunner(executor, options.retryCount, options.parallelism)
        .withFailureHandler(failure -> log.debug("Shot attempt failed", failure));
    log.debug("Created simulator with {}", options);
  }

  private static ShotExecutor launcherFor(Options options) {
    options.validate();
    return new ProcessShotExecutor(options.executablePath, options.executableArgs, options.timeout);
  }

  public Options getOptions() {
    return options;
  }

  @Override
  public ProbabilityDistribution probabilities(Circuit circuit) throws SimulationFailure, InterruptedException {
    final var program = translator.translate(circuit);
    final var shots = runner.run(program, options.shotCount);
    return OutcomeAggregator.aggregate(shots, options.shotCount);
  }

  @Override
  public void close() {
    runner.close();
  }
}
