package ca.on.oicr.gsi.calibra.core;

import java.util.Optional;

/**
 * How a task in a {@link BackgroundTaskGroup} ended
 *
 * @param name the name the task was spawned with
 * @param status how it ended
 * @param value the value it returned, if it completed
 * @param error the exception it threw, if it failed
 * @param <T> the type of value tasks return
 */
public record TaskOutcome<T>(
    String name, Status status, Optional<T> value, Optional<Throwable> error) {
  public enum Status {
    CANCELLED,
    COMPLETED,
    FAILED
  }

  static <T> TaskOutcome<T> cancelled(String name) {
    return new TaskOutcome<>(name, Status.CANCELLED, Optional.empty(), Optional.empty());
  }

  static <T> TaskOutcome<T> completed(String name, T value) {
    return new TaskOutcome<>(name, Status.COMPLETED, Optional.ofNullable(value), Optional.empty());
  }

  static <T> TaskOutcome<T> failed(String name, Throwable error) {
    return new TaskOutcome<>(name, Status.FAILED, Optional.empty(), Optional.of(error));
  }
}
