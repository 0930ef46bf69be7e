package ca.on.oicr.gsi.calibra;

/**
 * A response from the execution service to a submission
 *
 * @param code the acknowledgement state
 * @param result the JSON payload of the acknowledgement; for {@link AckCode#IN_PROGRESS}, this
 *     carries the job identifier as <tt>{"job_id": "..."}</tt>
 * @param error a human-readable explanation, if the command was rejected
 */
public record Acknowledgement(AckCode code, String result, String error) {}
