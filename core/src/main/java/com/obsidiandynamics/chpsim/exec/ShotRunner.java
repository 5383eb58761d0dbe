package com.obsidiandynamics.chpsim.exec;

import com.obsidiandynamics.chpsim.*;
import com.obsidiandynamics.chpsim.util.*;
import org.apache.logging.log4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;

/**
 *  Runs the shots of a program on a bounded pool of worker threads, retrying each failed shot
 *  up to a fixed budget.<p>
 *
 *  Results are all-or-nothing: once any shot exhausts its retries the outstanding shots are
 *  cancelled and the shot's last failure is thrown, carrying the earlier attempts as suppressed
 *  exceptions. A failed shot is never dropped from the result. A cancelled shot makes no further
 *  attempts, even if its executor ignores interruption.
 */
public final class ShotRunner implements AutoCloseable {
  private static final Logger log = LogManager.getLogger(ShotRunner.class);

  private static final AtomicInteger POOL_IDS = new AtomicInteger();

  private final ShotExecutor executor;

  private final int retryCount;

  private final ExecutorService pool;

  private Consumer<ShotFailure> onFailure = __ -> {};

  public ShotRunner(ShotExecutor executor, int retryCount, int parallelism) {
    Assert.that(retryCount >= 0, ConfigurationException::new, () -> "Negative retry count " + retryCount);
    Assert.that(parallelism >= 1, ConfigurationException::new, () -> "Invalid parallelism " + parallelism);
    this.executor = executor;
    this.retryCount = retryCount;
    final var poolId = POOL_IDS.incrementAndGet();
    final var threadIds = new AtomicInteger();
    pool = Executors.newFixedThreadPool(parallelism, runnable -> {
      final var thread = new Thread(runnable, "chpsim-shot-" + poolId + "-" + threadIds.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   *  Registers a handler that is told of every failed attempt, including those that are
   *  subsequently retried. The handler may be called from several worker threads at once.
   */
  public ShotRunner withFailureHandler(Consumer<ShotFailure> onFailure) {
    this.onFailure = onFailure;
    return this;
  }

  public int getRetryCount() {
    return retryCount;
  }

  /**
   *  Executes {@code shots} independent shots of the program.
   *
   *  @param program The program.
   *  @param shots The number of shots; at least 1.
   *  @return Exactly {@code shots} results, in completion order.
   *  @throws ShotFailure If some shot failed on every permitted attempt.
   *  @throws InterruptedException If the calling thread is interrupted while waiting.
   */
  public List<ShotResult> run(CircuitProgram program, int shots) throws ShotFailure, InterruptedException {
    Assert.that(shots >= 1, ConfigurationException::new, () -> "Invalid shot count " + shots);
    final var completion = new ExecutorCompletionService<ShotResult>(pool);
    final var futures = new ArrayList<Future<ShotResult>>(shots);
    try {
      for (var shot = 0; shot < shots; shot++) {
        final var shotIndex = shot;
        futures.add(completion.submit(() -> runShot(program, shotIndex)));
      }

      final var results = new ArrayList<ShotResult>(shots);
      for (var i = 0; i < shots; i++) {
        results.add(unwrap(completion.take()));
      }
      log.debug("Completed {} shot(s) of {}", shots, program);
      return results;
    } finally {
      for (var future : futures) {
        future.cancel(true);
      }
    }
  }

  private static ShotResult unwrap(Future<ShotResult> future) throws ShotFailure, InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      final var cause = e.getCause();
      if (cause instanceof ShotFailure) {
        throw (ShotFailure) cause;
      } else if (cause instanceof InterruptedException) {
        throw (InterruptedException) cause;
      } else if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      } else if (cause instanceof Error) {
        throw (Error) cause;
      } else {
        throw new IllegalStateException("Unexpected shot failure", cause);
      }
    }
  }

  private ShotResult runShot(CircuitProgram program, int shotIndex) throws ShotFailure, InterruptedException {
    final var failures = new ArrayList<ShotFailure>(1);
    for (var attempt = 0; attempt <= retryCount; attempt++) {
      if (Thread.interrupted()) {
        throw new InterruptedException("Shot " + shotIndex + " cancelled before attempt " + (attempt + 1));
      }
      try {
        return executor.execute(program);
      } catch (ShotFailure failure) {
        onFailure.accept(failure);
        failures.add(failure);
        if (attempt < retryCount) {
          log.warn("Shot {} failed on attempt {} of {}: {}", shotIndex, attempt + 1, retryCount + 1, failure.getMessage());
        }
      }
    }

    final var last = failures.get(failures.size() - 1);
    for (var i = 0; i < failures.size() - 1; i++) {
      final var earlier = failures.get(i);
      if (earlier != last) last.addSuppressed(earlier);
    }
    log.error("Shot {} failed on all {} attempt(s)", shotIndex, failures.size(), last);
    throw last;
  }

  @Override
  public void close() {
    pool.shutdownNow();
  }
}
