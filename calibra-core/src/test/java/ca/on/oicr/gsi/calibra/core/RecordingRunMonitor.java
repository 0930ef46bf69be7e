package ca.on.oicr.gsi.calibra.core;

import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;

final class RecordingRunMonitor implements RunMonitor {
  record Entry(Level level, String message) {}

  private final List<Entry> entries = new ArrayList<>();

  synchronized boolean contains(Level level, String fragment) {
    return entries.stream()
        .anyMatch(e -> e.level() == level && e.message().contains(fragment));
  }

  synchronized List<Entry> entries() {
    return List.copyOf(entries);
  }

  @Override
  public synchronized void log(Level level, String message) {
    entries.add(new Entry(level, message));
  }
}
