package ca.on.oicr.gsi.calibra.core;

/** The verification output for a calibration product could not be read */
public final class VerificationReadException extends Exception {
  VerificationReadException(String message) {
    super(message);
  }

  VerificationReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
