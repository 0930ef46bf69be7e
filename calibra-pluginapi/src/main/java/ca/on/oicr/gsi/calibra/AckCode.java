package ca.on.oicr.gsi.calibra;

/** The acknowledgement codes the execution service can respond with */
public enum AckCode {
  /** The command was received */
  ACK,
  /** The command was accepted and a job is running */
  IN_PROGRESS,
  /** The command finished */
  COMPLETE,
  /** The command failed */
  FAILED,
  /** The caller is not allowed to run this command */
  NO_PERMISSION,
  /** The command was aborted */
  ABORTED,
  /** The service gave up waiting on the command */
  TIMEOUT;

  /**
   * Whether this code means the command will not produce a job
   *
   * @return true for failed, rejected, aborted, and timed out commands
   */
  public boolean isRejection() {
    return switch (this) {
      case FAILED, NO_PERMISSION, ABORTED, TIMEOUT -> true;
      default -> false;
    };
  }
}
