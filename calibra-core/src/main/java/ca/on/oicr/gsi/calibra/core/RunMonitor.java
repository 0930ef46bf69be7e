package ca.on.oicr.gsi.calibra.core;

/**
 * A place to report what a calibration run is doing
 *
 * <p>Components never print directly; they report through the monitor they were constructed with
 * so the caller decides where messages go.
 */
public interface RunMonitor {

  /**
   * Write something interesting
   *
   * @param level how important this message is
   * @param message the message to display
   */
  void log(System.Logger.Level level, String message);
}
