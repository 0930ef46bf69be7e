package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.EventStream;
import ca.on.oicr.gsi.calibra.JobCompletionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.Counter;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Matches results on the shared completion stream to the jobs that are waiting for them
 *
 * <p>Every job on the execution service publishes to the same stream, so most results belong to
 * someone else. Results are matched only by job identifier; arrival order does not matter. A
 * result that arrives before anyone asks for it is held in a bounded buffer, so a job that
 * finishes quickly is not lost; results nobody asks for eventually fall out of that buffer.
 *
 * <p>The correlator listens from construction until it is closed.
 */
public final class JobResultCorrelator implements AutoCloseable {
  static final Counter JOB_RESULTS =
      Counter.build("calibra_job_results", "The number of job results matched to waiting jobs")
          .labelNames("phase")
          .register();
  static final Counter JOB_TIMEOUTS =
      Counter.build("calibra_job_timeouts", "The number of jobs whose results never arrived")
          .register();
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private boolean closed;
  private final RunMonitor monitor;
  private final EventStream.Subscription subscription;
  private final Map<String, JobResult> unclaimed;
  private final Map<String, CompletableFuture<JobResult>> waiting = new HashMap<>();

  public JobResultCorrelator(EventStream<JobCompletionEvent> completions, RunMonitor monitor) {
    this(completions, 1000, monitor);
  }

  public JobResultCorrelator(
      EventStream<JobCompletionEvent> completions, int bufferLimit, RunMonitor monitor) {
    this.monitor = monitor;
    unclaimed =
        new LinkedHashMap<>() {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, JobResult> eldest) {
            return size() > bufferLimit;
          }
        };
    subscription = completions.subscribe(this::accept);
  }

  private void accept(JobCompletionEvent event) {
    if (event == null || event.result() == null) {
      monitor.log(Level.DEBUG, "Ignoring job result without payload.");
      return;
    }
    final JobResult result;
    try {
      final var node = MAPPER.readTree(event.result());
      final var jobId = node.path("jobId");
      if (!jobId.isTextual()) {
        monitor.log(Level.DEBUG, "Ignoring job result without job identifier: " + event.result());
        return;
      }
      result = new JobResult(jobId.asText(), node.path("phase").asText(""), node);
    } catch (JsonProcessingException e) {
      monitor.log(Level.DEBUG, "Ignoring job result that is not JSON: " + event.result());
      return;
    }
    final CompletableFuture<JobResult> waiter;
    synchronized (this) {
      if (closed) {
        return;
      }
      waiter = waiting.remove(result.jobId());
      if (waiter == null) {
        unclaimed.put(result.jobId(), result);
        return;
      }
    }
    waiter.complete(result);
  }

  /**
   * Wait for the result of a job and update the job's state
   *
   * @param job the job to wait for
   * @param timeout the maximum time to wait
   * @return the job's result
   * @throws JobTimeoutException if no result arrives in time
   */
  public JobResult awaitResult(Job job, Duration timeout)
      throws JobTimeoutException, InterruptedException {
    job.moveTo(JobState.RUNNING);
    final JobResult result;
    try {
      result = awaitResult(job.id(), timeout);
    } catch (JobTimeoutException e) {
      job.moveTo(JobState.TIMED_OUT);
      throw e;
    }
    job.moveTo(result.completed() ? JobState.COMPLETED : JobState.FAILED);
    return result;
  }

  /**
   * Wait for the result of a job
   *
   * @param jobId the job identifier assigned by the execution service
   * @param timeout the maximum time to wait
   * @return the job's result
   * @throws JobTimeoutException if no result arrives in time
   */
  public JobResult awaitResult(String jobId, Duration timeout)
      throws JobTimeoutException, InterruptedException {
    final var future = new CompletableFuture<JobResult>();
    synchronized (this) {
      if (closed) {
        throw new IllegalStateException("Correlator is closed.");
      }
      final var early = unclaimed.remove(jobId);
      if (early != null) {
        JOB_RESULTS.labels(early.phase()).inc();
        return early;
      }
      if (waiting.putIfAbsent(jobId, future) != null) {
        throw new IllegalStateException(
            String.format("Already waiting for result of job %s.", jobId));
      }
    }
    try {
      final var result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      JOB_RESULTS.labels(result.phase()).inc();
      monitor.log(
          Level.INFO, String.format("Job %s finished in phase %s", jobId, result.phase()));
      return result;
    } catch (TimeoutException e) {
      JOB_TIMEOUTS.inc();
      throw new JobTimeoutException(
          jobId, String.format("No result for job %s after %s.", jobId, timeout));
    } catch (ExecutionException e) {
      throw new IllegalStateException(
          String.format("Stopped waiting for job %s.", jobId), e.getCause());
    } finally {
      synchronized (this) {
        waiting.remove(jobId, future);
      }
    }
  }

  @Override
  public void close() {
    final Map<String, CompletableFuture<JobResult>> abandoned;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      abandoned = new HashMap<>(waiting);
      waiting.clear();
      unclaimed.clear();
    }
    subscription.close();
    abandoned.forEach(
        (jobId, future) ->
            future.completeExceptionally(new IllegalStateException("Correlator closed.")));
  }

  /**
   * The number of jobs currently waiting for results
   *
   * @return the number of registered waiters
   */
  public synchronized int waiting() {
    return waiting.size();
  }
}
