package ca.on.oicr.gsi.calibra.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The final status of a job reported by the execution service
 *
 * @param jobId the job identifier
 * @param phase the final phase of the job, such as <tt>completed</tt> or <tt>error</tt>
 * @param payload the complete result message
 */
public record JobResult(String jobId, String phase, JsonNode payload) {
  static final String COMPLETED = "completed";

  /**
   * Whether the job ran successfully
   *
   * @return true if the final phase is <tt>completed</tt>
   */
  public boolean completed() {
    return COMPLETED.equals(phase);
  }
}
