package ca.on.oicr.gsi.calibra.core;

/** The execution service did not accept a job or did not say what its identifier is */
public final class DispatchException extends Exception {
  DispatchException(String message) {
    super(message);
  }

  DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
