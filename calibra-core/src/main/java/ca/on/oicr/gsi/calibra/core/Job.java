package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.DataSelection;

/**
 * A pipeline submitted to the execution service
 *
 * <p>The job's identifier is assigned once, when the execution service acknowledges the
 * submission, and is used to find the job's result.
 */
public final class Job {
  private final String config;
  private String id;
  private final String pipeline;
  private final DataSelection selection;
  private JobState state = JobState.SUBMITTED;

  Job(String pipeline, String config, DataSelection selection) {
    this.pipeline = pipeline;
    this.config = config;
    this.selection = selection;
  }

  synchronized void acknowledge(String id) {
    if (this.id != null) {
      throw new IllegalStateException(
          String.format("Job %s already has identifier; cannot assign %s.", this.id, id));
    }
    this.id = id;
    moveTo(JobState.ACKNOWLEDGED);
  }

  /** The configuration string passed to the pipeline */
  public String config() {
    return config;
  }

  /**
   * The identifier assigned by the execution service
   *
   * @throws IllegalStateException if the job has not been acknowledged
   */
  public synchronized String id() {
    if (id == null) {
      throw new IllegalStateException("Job has not been acknowledged.");
    }
    return id;
  }

  synchronized void moveTo(JobState next) {
    if (!state.canMoveTo(next)) {
      throw new IllegalStateException(
          String.format("Job %s cannot move from %s to %s.", id, state, next));
    }
    state = next;
  }

  /** The resolved pipeline location */
  public String pipeline() {
    return pipeline;
  }

  /** The data the job processes */
  public DataSelection selection() {
    return selection;
  }

  public synchronized JobState state() {
    return state;
  }

  @Override
  public synchronized String toString() {
    return String.format("Job{%s, %s, %s}", id == null ? "unacknowledged" : id, pipeline, state);
  }
}
