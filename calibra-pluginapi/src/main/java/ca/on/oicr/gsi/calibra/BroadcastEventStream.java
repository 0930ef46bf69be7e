package ca.on.oicr.gsi.calibra;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * An in-process event stream that delivers every event to every subscriber
 *
 * <p>Events published while nobody is subscribed are held in a bounded backlog and delivered to
 * the next subscriber, unless {@link #flush()} is called first. Adapters for remote systems
 * publish into this stream from their receiving thread.
 *
 * <p>A handler that throws does not prevent the other handlers from receiving the event. The
 * first exception thrown is rethrown to the publisher after every handler has run, with any
 * others attached as suppressed.
 *
 * @param <E> the type of event
 */
public final class BroadcastEventStream<E> implements EventStream<E> {
  private final Deque<E> backlog = new ArrayDeque<>();
  private final int backlogLimit;
  private final List<Consumer<? super E>> handlers = new ArrayList<>();

  public BroadcastEventStream() {
    this(1000);
  }

  public BroadcastEventStream(int backlogLimit) {
    if (backlogLimit < 0) {
      throw new IllegalArgumentException("Backlog limit cannot be negative.");
    }
    this.backlogLimit = backlogLimit;
  }

  /**
   * The number of events waiting for a subscriber
   *
   * @return the size of the backlog
   */
  public synchronized int backlog() {
    return backlog.size();
  }

  @Override
  public synchronized void flush() {
    backlog.clear();
  }

  /**
   * Deliver an event to all current subscribers
   *
   * @param event the event to deliver
   */
  public synchronized void publish(E event) {
    if (handlers.isEmpty()) {
      if (backlogLimit == 0) {
        return;
      }
      if (backlog.size() == backlogLimit) {
        backlog.pollFirst();
      }
      backlog.addLast(event);
      return;
    }
    RuntimeException failure = null;
    for (final var handler : List.copyOf(handlers)) {
      try {
        handler.accept(event);
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public synchronized Subscription subscribe(Consumer<? super E> handler) {
    handlers.add(handler);
    E waiting;
    while ((waiting = backlog.pollFirst()) != null) {
      handler.accept(waiting);
    }
    return () -> {
      synchronized (BroadcastEventStream.this) {
        handlers.remove(handler);
      }
    };
  }

  /**
   * The number of handlers currently registered
   *
   * @return the subscriber count
   */
  public synchronized int subscribers() {
    return handlers.size();
  }
}
