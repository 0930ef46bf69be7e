package ca.on.oicr.gsi.calibra.core;

import java.lang.System.Logger.Level;
import java.time.Instant;

/** Writes run messages to standard error, prefixed by a run name and time stamp */
public final class StandardErrorRunMonitor implements RunMonitor {
  private final Level minimum;
  private final String prefix;

  public StandardErrorRunMonitor(String prefix) {
    this(prefix, Level.INFO);
  }

  public StandardErrorRunMonitor(String prefix, Level minimum) {
    this.prefix = prefix;
    this.minimum = minimum;
  }

  @Override
  public void log(Level level, String message) {
    if (level.getSeverity() < minimum.getSeverity()) {
      return;
    }
    System.err.printf("%s: [%s] %s: %s%n", prefix, Instant.now(), level.name(), message);
  }
}
