package ca.on.oicr.gsi.calibra;

/**
 * A job result published by the execution service
 *
 * <p>All jobs, no matter who submitted them, publish on the same stream.
 *
 * @param result the JSON payload, which contains at least <tt>jobId</tt> and <tt>phase</tt>
 */
public record JobCompletionEvent(String result) {}
