package ca.on.oicr.gsi.calibra.core;

/** No result arrived for a job before the timeout */
public final class JobTimeoutException extends Exception {
  private final String jobId;

  JobTimeoutException(String jobId, String message) {
    super(message);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
