/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.stream;

import hindsight.internal.Nullable;
import java.io.Closeable;
import java.lang.ref.Cleaner;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

import static hindsight.stream.EventBroadcaster.CLOSED;

/**
 * A live feed of {@link TraceEvent}s from an {@link EventBroadcaster}. Iterating blocks until the
 * next event, and ends when this subscription is closed.
 *
 * <p>Not safe for use by multiple consumer threads.
 *
 * <pre>{@code
 * try (Subscription subscription = broadcaster.subscribe()) {
 *   for (TraceEvent event : subscription) {
 *     render(event);
 *   }
 * }
 * }</pre>
 */
public final class Subscription implements Iterable<TraceEvent>, Closeable {
  final EventBroadcaster.SubscriberQueue queue;
  Cleaner.Cleanable cleanable; // set once by EventBroadcaster.subscribe

  Subscription(EventBroadcaster.SubscriberQueue queue) {
    this.queue = queue;
  }

  /**
   * Waits for the next event. Returns null once this subscription is closed.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable public TraceEvent take() throws InterruptedException {
    if (queue.closed) return null;
    return unlessClosed(queue.events.take());
  }

  /**
   * Waits up to the timeout for the next event. Returns null on timeout or once this subscription
   * is closed.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable public TraceEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
    if (queue.closed) return null;
    return unlessClosed(queue.events.poll(timeout, unit));
  }

  @Nullable TraceEvent unlessClosed(@Nullable Object next) {
    if (next == null || next == CLOSED) return null;
    return (TraceEvent) next;
  }

  /** Events discarded because this subscriber fell behind. */
  public long dropped() {
    return queue.dropped.get();
  }

  public boolean isCanceled() {
    return queue.closed;
  }

  /**
   * Returns a blocking iterator over events. Iteration ends when this subscription closes, or when
   * the consuming thread is interrupted, in which case the interrupt flag is restored.
   */
  @Override public Iterator<TraceEvent> iterator() {
    return new Iterator<TraceEvent>() {
      TraceEvent next;

      @Override public boolean hasNext() {
        if (next != null) return true;
        try {
          next = take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
        return next != null;
      }

      @Override public TraceEvent next() {
        if (!hasNext()) throw new NoSuchElementException();
        TraceEvent result = next;
        next = null;
        return result;
      }
    };
  }

  /** Unsubscribes and wakes any consumer blocked on this subscription. Idempotent. */
  @Override public void close() {
    cleanable.clean();
  }

  @Override public String toString() {
    return "Subscription{buffered=" + queue.events.size() + ", dropped=" + dropped()
      + ", canceled=" + isCanceled() + "}";
  }
}
