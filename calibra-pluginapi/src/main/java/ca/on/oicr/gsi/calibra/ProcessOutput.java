package ca.on.oicr.gsi.calibra;

/**
 * The output status information from a locally-run process/program
 *
 * @param exitCode the process's final exit code
 * @param standardOutput the data gathered from standard output
 * @param standardError the data gathered from standard error
 */
public record ProcessOutput(int exitCode, String standardOutput, String standardError) {

  /**
   * Checks if the process exited successfully
   *
   * @return true if the exit code is zero
   */
  public boolean success() {
    return exitCode == 0;
  }
}
