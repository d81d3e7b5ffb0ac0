/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.stream;

import java.io.Closeable;
import java.lang.ref.Cleaner;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.util.logging.Level.FINE;

/**
 * Fans out trace events to any number of live subscribers.
 *
 * <h3>Delivery is lossy</h3>
 * Each subscriber has its own bounded queue. When it is full, the oldest buffered event for that
 * subscriber is dropped and counted in {@link Subscription#dropped()}. {@link #publish(TraceEvent)}
 * never blocks, so a slow subscriber delays neither producers nor other subscribers.
 *
 * <p>Subscribing and unsubscribing copy the subscriber list. Publishing reads it without a lock.
 *
 * <p>A subscription ends when {@linkplain Subscription#close() closed}, when this broadcaster is
 * closed, or when the subscription becomes unreachable and is cleaned.
 */
public final class EventBroadcaster implements Closeable {
  static final Logger LOG = Logger.getLogger(EventBroadcaster.class.getName());
  static final Cleaner CLEANER = Cleaner.create();
  static final Object CLOSED = new Object(); // wakes a blocked consumer

  public static final int DEFAULT_QUEUE_CAPACITY = 1024;

  public static EventBroadcaster create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    int queueCapacity = DEFAULT_QUEUE_CAPACITY;

    /** Events buffered per subscriber before the oldest is dropped. Defaults to 1024. */
    public Builder queueCapacity(int queueCapacity) {
      if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity <= 0");
      this.queueCapacity = queueCapacity;
      return this;
    }

    public EventBroadcaster build() {
      return new EventBroadcaster(this);
    }

    Builder() {
    }
  }

  final int queueCapacity;
  final List<SubscriberQueue> queues = new CopyOnWriteArrayList<>();
  final AtomicLong droppedEvents = new AtomicLong();
  volatile boolean closed;

  EventBroadcaster(Builder builder) {
    this.queueCapacity = builder.queueCapacity;
  }

  /**
   * Returns a new subscription, which sees events published from now on.
   *
   * @throws IllegalStateException if this broadcaster is closed
   */
  public Subscription subscribe() {
    if (closed) throw new IllegalStateException("broadcaster closed");
    SubscriberQueue queue = new SubscriberQueue(queueCapacity, droppedEvents);
    queues.add(queue);
    if (closed) { // lost a race with close(), which may have cleared before our add
      queue.close();
      queues.remove(queue);
    }
    Subscription subscription = new Subscription(queue);
    subscription.cleanable = CLEANER.register(subscription, new Unsubscribe(queues, queue));
    if (LOG.isLoggable(FINE)) LOG.fine("subscribed, subscriberCount=" + queues.size());
    return subscription;
  }

  /** Delivers the event to every current subscriber without blocking. */
  public void publish(TraceEvent event) {
    if (event == null) throw new NullPointerException("event == null");
    for (SubscriberQueue queue : queues) {
      queue.offer(event);
    }
  }

  public int subscriberCount() {
    return queues.size();
  }

  /** Total events dropped across all subscribers, including ones since closed. */
  public long droppedEvents() {
    return droppedEvents.get();
  }

  /** Ends all subscriptions. Later calls to {@link #subscribe()} fail. */
  @Override public void close() {
    closed = true;
    for (SubscriberQueue queue : queues) {
      queue.close();
    }
    queues.clear();
  }

  @Override public String toString() {
    return "EventBroadcaster{queueCapacity=" + queueCapacity + ", subscriberCount="
      + queues.size() + "}";
  }

  /** Must not reference the subscription, or it would never become unreachable. */
  static final class Unsubscribe implements Runnable {
    final List<SubscriberQueue> queues;
    final SubscriberQueue queue;

    Unsubscribe(List<SubscriberQueue> queues, SubscriberQueue queue) {
      this.queues = queues;
      this.queue = queue;
    }

    @Override public void run() {
      queues.remove(queue);
      queue.close();
      if (LOG.isLoggable(FINE)) LOG.fine("unsubscribed, subscriberCount=" + queues.size());
    }
  }

  static final class SubscriberQueue {
    final ArrayBlockingQueue<Object> events;
    final AtomicLong dropped = new AtomicLong();
    final AtomicLong totalDropped;
    volatile boolean closed;

    SubscriberQueue(int capacity, AtomicLong totalDropped) {
      this.events = new ArrayBlockingQueue<>(capacity);
      this.totalDropped = totalDropped;
    }

    void offer(Object event) {
      while (!events.offer(event)) {
        if (events.poll() != null) { // drop the oldest
          dropped.incrementAndGet();
          totalDropped.incrementAndGet();
        }
      }
    }

    void close() {
      if (closed) return;
      closed = true;
      events.clear();
      events.offer(CLOSED);
    }
  }
}
