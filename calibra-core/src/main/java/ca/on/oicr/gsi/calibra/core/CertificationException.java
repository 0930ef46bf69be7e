package ca.on.oicr.gsi.calibra.core;

import java.util.Optional;

/** The certification tool failed to publish a calibration product */
public final class CertificationException extends Exception {
  private final Optional<Integer> exitCode;
  private final String output;

  CertificationException(String message, int exitCode, String output) {
    super(message);
    this.exitCode = Optional.of(exitCode);
    this.output = output;
  }

  CertificationException(String message, Throwable cause) {
    super(message, cause);
    this.exitCode = Optional.empty();
    this.output = "";
  }

  /** The tool's exit status, if it ran to completion */
  public Optional<Integer> exitCode() {
    return exitCode;
  }

  /** The diagnostic output captured from the tool */
  public String output() {
    return output;
  }
}
