package ca.on.oicr.gsi.calibra;

import java.util.function.Consumer;

/**
 * A stream of events published by a remote system
 *
 * <p>Streams are shared: every subscriber sees every event and no subscriber can remove an event
 * from another subscriber's view. Handlers are called on the publishing thread and must not block.
 *
 * @param <E> the type of event
 */
public interface EventStream<E> {

  /** A registered handler that can be removed from the stream */
  interface Subscription extends AutoCloseable {
    /** Stop delivering events to this handler */
    @Override
    void close();
  }

  /**
   * Discard any events that were published but not yet delivered to a handler
   *
   * <p>This is used to avoid stale events from earlier requests being attributed to new ones.
   */
  void flush();

  /**
   * Start delivering events to a handler
   *
   * @param handler the handler to call for every event
   * @return a subscription that must be closed when the handler is no longer interested
   */
  Subscription subscribe(Consumer<? super E> handler);
}
