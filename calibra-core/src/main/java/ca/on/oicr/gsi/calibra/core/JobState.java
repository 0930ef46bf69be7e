package ca.on.oicr.gsi.calibra.core;

import java.util.EnumSet;
import java.util.Set;

/** The lifecycle of a job submitted to the execution service */
public enum JobState {
  /** Sent to the execution service, but no identifier has been received */
  SUBMITTED,
  /** The execution service has assigned an identifier */
  ACKNOWLEDGED,
  /** A result for the job is being waited on */
  RUNNING,
  /** The job finished successfully */
  COMPLETED,
  /** The job was rejected or finished unsuccessfully */
  FAILED,
  /** No result arrived in the allowed time */
  TIMED_OUT;

  /**
   * Check whether a job can move to a new state
   *
   * @param next the proposed state
   * @return true if the transition is allowed
   */
  public boolean canMoveTo(JobState next) {
    return successors().contains(next);
  }

  /**
   * Whether the job has finished and its result has been consumed
   *
   * @return true for completed, failed, and timed-out jobs
   */
  public boolean isTerminal() {
    return successors().isEmpty();
  }

  private Set<JobState> successors() {
    return switch (this) {
      case SUBMITTED -> EnumSet.of(ACKNOWLEDGED, FAILED);
      case ACKNOWLEDGED -> EnumSet.of(RUNNING, COMPLETED, FAILED, TIMED_OUT);
      case RUNNING -> EnumSet.of(COMPLETED, FAILED, TIMED_OUT);
      case COMPLETED, FAILED, TIMED_OUT -> EnumSet.noneOf(JobState.class);
    };
  }
}
