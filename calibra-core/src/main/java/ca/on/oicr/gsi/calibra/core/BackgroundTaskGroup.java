package ca.on.oicr.gsi.calibra.core;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A set of concurrent tasks that must all be awaited or cancelled before the group is closed
 *
 * <p>Tasks are started as soon as they are spawned. Waiting uses a single deadline for the whole
 * group; any task still running at the deadline is interrupted and reported as cancelled. Closing
 * the group cancels anything still running and waits, up to a grace period, for the cancelled
 * tasks to finish their cleanup.
 *
 * @param <T> the type of value tasks return
 */
public final class BackgroundTaskGroup<T> implements AutoCloseable {
  static final Gauge TASKS_ACTIVE =
      Gauge.build("calibra_background_tasks_active", "The number of background tasks running")
          .labelNames("group")
          .register();
  static final Counter TASKS_ABANDONED =
      Counter.build(
              "calibra_background_tasks_abandoned",
              "The number of background task groups whose tasks did not stop after cancellation")
          .labelNames("group")
          .register();
  static final Counter TASKS_CANCELLED =
      Counter.build(
              "calibra_background_tasks_cancelled",
              "The number of background tasks cancelled because they did not finish in time")
          .labelNames("group")
          .register();

  private final Set<String> executing = ConcurrentHashMap.newKeySet();
  private final ExecutorService executor;
  private final Duration gracePeriod;
  private final String name;
  private final RunMonitor monitor;
  private boolean open = true;
  private final Map<String, Future<T>> tasks = new LinkedHashMap<>();

  public BackgroundTaskGroup(String name, RunMonitor monitor) {
    this(name, Duration.ofMinutes(1), monitor);
  }

  /**
   * Create a task group
   *
   * @param name the name used for threads, metrics and log messages
   * @param gracePeriod how long {@link #close()} waits for cancelled tasks to stop
   * @param monitor where to report task failures
   */
  public BackgroundTaskGroup(String name, Duration gracePeriod, RunMonitor monitor) {
    this.name = name;
    this.gracePeriod = gracePeriod;
    this.monitor = monitor;
    final var threadCount = new AtomicInteger();
    executor =
        Executors.newCachedThreadPool(
            runnable -> {
              final var thread =
                  new Thread(runnable, name + "-" + threadCount.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  /**
   * Wait for every spawned task
   *
   * <p>The group waits at most <tt>perTaskTimeout</tt> multiplied by the number of tasks. Tasks
   * that finish in that time keep their results; the rest are cancelled.
   *
   * @param perTaskTimeout the time allowed for each task
   * @return the outcome of every task, in the order they were spawned
   * @throws InterruptedException if the waiting thread is interrupted; all remaining tasks are
   *     cancelled first
   */
  public Map<String, TaskOutcome<T>> awaitAll(Duration perTaskTimeout)
      throws InterruptedException {
    final List<Map.Entry<String, Future<T>>> pending;
    synchronized (this) {
      if (!open) {
        throw new IllegalStateException("Task group " + name + " is closed.");
      }
      pending = new ArrayList<>(tasks.entrySet());
    }
    final var timeout = perTaskTimeout.multipliedBy(pending.size());
    final var deadline = System.nanoTime() + timeout.toNanos();
    final var outcomes = new LinkedHashMap<String, TaskOutcome<T>>();
    try {
      for (final var task : pending) {
        final var remaining = Math.max(0, deadline - System.nanoTime());
        outcomes.put(task.getKey(), await(task.getKey(), task.getValue(), remaining, timeout));
      }
    } catch (InterruptedException e) {
      close();
      throw e;
    }
    return outcomes;
  }

  private TaskOutcome<T> await(String task, Future<T> future, long remaining, Duration timeout)
      throws InterruptedException {
    try {
      return TaskOutcome.completed(task, future.get(remaining, TimeUnit.NANOSECONDS));
    } catch (TimeoutException e) {
      future.cancel(true);
      TASKS_CANCELLED.labels(name).inc();
      monitor.log(
          Level.ERROR,
          String.format(
              "Background task %s did not finish in %s allowed for %s; cancelled.",
              task, timeout, name));
      return TaskOutcome.cancelled(task);
    } catch (CancellationException e) {
      return TaskOutcome.cancelled(task);
    } catch (ExecutionException e) {
      monitor.log(
          Level.ERROR,
          String.format("Background task %s failed: %s", task, e.getCause().getMessage()));
      return TaskOutcome.failed(task, e.getCause());
    }
  }

  /**
   * Cancel every task that is still running and wait for the threads to stop
   *
   * <p>If the threads have not stopped by the end of the grace period, they are abandoned and a
   * warning is logged. If the closing thread is interrupted while waiting, its interrupt status is
   * restored.
   */
  @Override
  public void close() {
    final List<Future<T>> remaining;
    synchronized (this) {
      if (!open) {
        return;
      }
      open = false;
      remaining = new ArrayList<>(tasks.values());
    }
    for (final var future : remaining) {
      if (future.cancel(true)) {
        TASKS_CANCELLED.labels(name).inc();
      }
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(gracePeriod.toNanos(), TimeUnit.NANOSECONDS)) {
        executor.shutdownNow();
        TASKS_ABANDONED.labels(name).inc();
        monitor.log(
            Level.WARNING,
            String.format(
                "Background tasks in %s did not stop within %s of being cancelled: %s",
                name, gracePeriod, unfinished()));
      }
    } catch (InterruptedException e) {
      monitor.log(
          Level.WARNING,
          String.format(
              "Interrupted while waiting for background tasks in %s to stop: %s",
              name, unfinished()));
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private List<String> unfinished() {
    return new ArrayList<>(new TreeSet<>(executing));
  }

  /** The number of tasks that have not finished */
  public synchronized int running() {
    return (int) tasks.values().stream().filter(f -> !f.isDone()).count();
  }

  /**
   * Start a task
   *
   * @param task the unique name of the task
   * @param body the work to perform; it should respond to interruption by ending promptly
   */
  public synchronized void spawn(String task, Callable<T> body) {
    if (!open) {
      throw new IllegalStateException("Task group " + name + " is closed.");
    }
    if (tasks.containsKey(task)) {
      throw new IllegalArgumentException(
          String.format("Task %s already exists in %s.", task, name));
    }
    monitor.log(Level.DEBUG, String.format("Starting background task %s in %s", task, name));
    tasks.put(
        task,
        executor.submit(
            () -> {
              TASKS_ACTIVE.labels(name).inc();
              executing.add(task);
              try {
                return body.call();
              } finally {
                executing.remove(task);
                TASKS_ACTIVE.labels(name).dec();
              }
            }));
  }

  /** The names of every task spawned, in order */
  public synchronized List<String> tasks() {
    return List.copyOf(tasks.keySet());
  }
}
