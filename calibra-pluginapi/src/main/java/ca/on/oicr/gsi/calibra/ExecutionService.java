package ca.on.oicr.gsi.calibra;

import java.util.concurrent.CompletableFuture;

/** A remote service that runs processing pipelines asynchronously */
public interface ExecutionService {

  /**
   * The stream of job results for every job run by this service
   *
   * @return the shared completion event stream
   */
  EventStream<JobCompletionEvent> completions();

  /**
   * Check whether a pipeline definition is available to the service
   *
   * @param pipeline the location of the pipeline definition
   * @return true if the service can run it
   */
  boolean pipelineExists(String pipeline);

  /**
   * Submit a pipeline without waiting for it to finish
   *
   * @param request the pipeline to run
   * @return a future that completes with the acknowledgement that carries the job identifier, or
   *     with a rejection
   */
  CompletableFuture<Acknowledgement> submit(PipelineRequest request);
}
