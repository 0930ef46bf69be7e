package ca.on.oicr.gsi.calibra.core;

/** A job finished in a phase other than completed */
public final class JobFailedException extends Exception {
  private final JobResult result;

  JobFailedException(String description, JobResult result) {
    super(
        String.format(
            "%s job %s finished in phase %s: %s",
            description, result.jobId(), result.phase(), result.payload()));
    this.result = result;
  }

  public JobResult result() {
    return result;
  }
}
