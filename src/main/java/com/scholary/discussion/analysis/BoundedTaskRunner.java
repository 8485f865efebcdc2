package com.scholary.discussion.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Limits how many model calls are in flight across all sessions.
 *
 * <p>{@link #call} holds one of {@code permits} permits for the duration of the call, whichever
 * thread it runs on. {@link #runAll} fans work out onto the shared analysis executor; tasks that
 * make model calls are expected to go through {@link #call}.
 */
public class BoundedTaskRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoundedTaskRunner.class);

  private final Semaphore semaphore;
  private final int permits;
  private final Executor executor;

  public BoundedTaskRunner(int permits, Executor executor) {
    if (permits < 1) {
      throw new IllegalArgumentException("permits must be positive: " + permits);
    }
    this.permits = permits;
    this.semaphore = new Semaphore(permits, true);
    this.executor = executor;
  }

  public int permits() {
    return permits;
  }

  /**
   * Run {@code task} on the calling thread once a permit is free.
   *
   * @throws IllegalStateException if interrupted while waiting for a permit
   */
  public <R> R call(Supplier<R> task) {
    try {
      semaphore.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for a call permit", e);
    }
    try {
      return task.get();
    } finally {
      semaphore.release();
    }
  }

  /**
   * Run {@code task} for every item on the executor and wait for all of them.
   *
   * <p>A task that throws is logged and contributes no result.
   *
   * @return results of the tasks that completed, in completion order
   */
  public <T, R> List<R> runAll(List<T> items, Function<T, R> task) {
    if (items.isEmpty()) {
      return List.of();
    }
    List<R> results = Collections.synchronizedList(new ArrayList<>());
    List<CompletableFuture<Void>> futures =
        items.stream()
            .map(item -> CompletableFuture.runAsync(() -> runSafely(item, task, results), executor))
            .collect(Collectors.toList());
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    synchronized (results) {
      return new ArrayList<>(results);
    }
  }

  private <T, R> void runSafely(T item, Function<T, R> task, List<R> results) {
    try {
      results.add(task.apply(item));
    } catch (RuntimeException e) {
      LOGGER.error("Task for {} failed: {}", item, e.getMessage(), e);
    }
  }
}
