package com.gentoro.govdir.resolve;

import com.gentoro.govdir.exception.ExceptionUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded pool for parsing and resolution over already stored artifacts. Tasks never perform
 * network I/O.
 */
public class WorkerPool implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(WorkerPool.class);

  /** A task that completed exceptionally. */
  public record TaskFailure(String label, Throwable error) {}

  private final ExecutorService executor;
  private final int size;
  private final Queue<Pending> pending = new ConcurrentLinkedQueue<>();

  private record Pending(String label, CompletableFuture<?> future) {}

  /** @param size thread count; 0 or less means one per available processor */
  public WorkerPool(int size) {
    this.size = size > 0 ? size : Runtime.getRuntime().availableProcessors();
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newFixedThreadPool(
            this.size,
            r -> {
              Thread t = new Thread(r, "govdir-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    log.debug("Worker pool started with {} threads", this.size);
  }

  public int size() {
    return size;
  }

  public <T> CompletableFuture<T> submit(String label, Supplier<T> task) {
    CompletableFuture<T> future = CompletableFuture.supplyAsync(task, executor);
    pending.add(new Pending(label, future));
    return future;
  }

  public CompletableFuture<Void> submit(String label, Runnable task) {
    return submit(
        label,
        () -> {
          task.run();
          return null;
        });
  }

  /**
   * Wait for every task submitted so far, including tasks submitted while draining.
   *
   * @return the tasks that failed, in submission order
   */
  public List<TaskFailure> drain() {
    List<TaskFailure> failures = new ArrayList<>();
    Pending next;
    while ((next = pending.poll()) != null) {
      try {
        next.future().join();
      } catch (CompletionException e) {
        Throwable cause = ExceptionUtil.unwrap(e);
        log.error("Worker task {} failed", next.label(), cause);
        failures.add(new TaskFailure(next.label(), cause));
      }
    }
    return failures;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
