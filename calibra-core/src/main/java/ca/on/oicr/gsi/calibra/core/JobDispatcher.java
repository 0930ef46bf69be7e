package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.AckCode;
import ca.on.oicr.gsi.calibra.DataSelection;
import ca.on.oicr.gsi.calibra.ExecutionService;
import ca.on.oicr.gsi.calibra.PipelineRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.Counter;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits pipelines to the execution service
 *
 * <p>This only waits for the job identifier. Results are collected by a {@link
 * JobResultCorrelator}.
 */
public final class JobDispatcher {
  static final Counter DISPATCH_FAILURES =
      Counter.build(
              "calibra_job_dispatch_failures",
              "The number of pipeline submissions that did not produce a job")
          .labelNames("pipeline")
          .register();
  static final Counter JOBS_DISPATCHED =
      Counter.build("calibra_jobs_dispatched", "The number of jobs the execution service accepted")
          .labelNames("pipeline")
          .register();
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Duration acknowledgementTimeout;
  private final RunMonitor monitor;
  private final String pipelineInstrument;
  private final ExecutionService service;

  public JobDispatcher(
      ExecutionService service,
      String pipelineInstrument,
      Duration acknowledgementTimeout,
      RunMonitor monitor) {
    this.service = service;
    this.pipelineInstrument = pipelineInstrument;
    this.acknowledgementTimeout = acknowledgementTimeout;
    this.monitor = monitor;
  }

  /**
   * Submit a pipeline and wait for the execution service to assign a job identifier
   *
   * @param pipeline the pipeline to run
   * @param config the configuration string for the pipeline
   * @param selection the data to process
   * @return the acknowledged job
   * @throws DispatchException if the submission was rejected, not acknowledged in time, or the
   *     acknowledgement did not contain a job identifier
   */
  public Job dispatch(Pipeline pipeline, String config, DataSelection selection)
      throws DispatchException, InterruptedException {
    final var location = resolve(pipeline);
    final var job = new Job(location, config, selection);
    monitor.log(
        Level.INFO,
        String.format(
            "Submitting %s with configuration \"%s\" for %s",
            location, config, selection.toQuery()));
    final var future = service.submit(new PipelineRequest(location, config, selection));
    try {
      final var ack = future.get(acknowledgementTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (ack.code() != AckCode.IN_PROGRESS) {
        throw new DispatchException(
            String.format(
                "Execution service responded to %s with %s instead of a job: %s",
                location, ack.code(), ack.error()));
      }
      job.acknowledge(parseJobId(location, ack.result()));
    } catch (TimeoutException e) {
      future.cancel(true);
      job.moveTo(JobState.FAILED);
      DISPATCH_FAILURES.labels(pipeline.file()).inc();
      throw new DispatchException(
          String.format(
              "No acknowledgement for %s after %s.", location, acknowledgementTimeout),
          e);
    } catch (ExecutionException e) {
      job.moveTo(JobState.FAILED);
      DISPATCH_FAILURES.labels(pipeline.file()).inc();
      throw new DispatchException(
          String.format("Failed to submit %s: %s", location, e.getCause().getMessage()),
          e.getCause());
    } catch (DispatchException e) {
      job.moveTo(JobState.FAILED);
      DISPATCH_FAILURES.labels(pipeline.file()).inc();
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
    JOBS_DISPATCHED.labels(pipeline.file()).inc();
    monitor.log(Level.INFO, String.format("Job %s acknowledged for %s", job.id(), location));
    return job;
  }

  private static String parseJobId(String location, String result) throws DispatchException {
    if (result == null) {
      throw new DispatchException(
          String.format("Acknowledgement for %s has no result.", location));
    }
    try {
      final var id = MAPPER.readTree(result).path("job_id");
      if (!id.isTextual() || id.asText().isBlank()) {
        throw new DispatchException(
            String.format(
                "Acknowledgement for %s does not contain a job identifier: %s", location, result));
      }
      return id.asText();
    } catch (JsonProcessingException e) {
      throw new DispatchException(
          String.format("Acknowledgement for %s is not valid JSON: %s", location, result), e);
    }
  }

  /**
   * Find the definition to use for a pipeline
   *
   * <p>The instrument-specific definition is preferred; the generic one is used if it doesn't
   * exist.
   *
   * @param pipeline the pipeline to find
   * @return the location to submit
   */
  public String resolve(Pipeline pipeline) {
    final var specific = pipeline.forInstrument(pipelineInstrument);
    if (service.pipelineExists(specific)) {
      return specific;
    }
    final var generic = pipeline.generic();
    monitor.log(
        Level.DEBUG,
        String.format("No %s definition for %s; using %s", pipeline, pipelineInstrument, generic));
    return generic;
  }
}
