/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector.discovery;

import hindsight.Call;
import hindsight.Callback;
import hindsight.internal.Nullable;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static hindsight.Call.propagateIfFatal;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Tracks the {@link CapabilitySet} of each connected producer.
 *
 * <p>Discovery runs once per connection, asynchronously, bounded by a timeout. A producer that
 * fails or never answers is recorded with an empty set and a warning. It keeps working, and its
 * spans are still ingested, as ingest never waits on discovery.
 *
 * <p>{@link #sessionClosed(String)} forgets the session and cancels any discovery in flight. A
 * result arriving after that is discarded. Reconnecting starts a new session and a new discovery.
 */
public final class CapabilityRegistry implements Closeable {
  static final Logger LOG = LoggerFactory.getLogger(CapabilityRegistry.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    Duration timeout = Duration.ofSeconds(5);
    Clock clock = Clock.systemUTC();
    ScheduledExecutorService scheduler;

    /** How long to wait for a producer to list its services. Defaults to 5 seconds. */
    public Builder timeout(Duration timeout) {
      if (timeout == null) throw new NullPointerException("timeout == null");
      if (timeout.isNegative() || timeout.isZero()) {
        throw new IllegalArgumentException("timeout <= 0");
      }
      this.timeout = timeout;
      return this;
    }

    /** Source of {@link CapabilitySet#discoveredAt()}. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /**
     * Schedules timeouts. When unset, a daemon thread is created and shut down on {@link
     * CapabilityRegistry#close()}.
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      if (scheduler == null) throw new NullPointerException("scheduler == null");
      this.scheduler = scheduler;
      return this;
    }

    public CapabilityRegistry build() {
      return new CapabilityRegistry(this);
    }

    Builder() {
    }
  }

  final ConcurrentHashMap<String, CapabilitySet> sessions = new ConcurrentHashMap<>();
  final ConcurrentHashMap<String, Discovery> pending = new ConcurrentHashMap<>();
  final Duration timeout;
  final Clock clock;
  final ScheduledExecutorService scheduler;
  final boolean ownsScheduler;
  volatile boolean closed;

  CapabilityRegistry(Builder builder) {
    this.timeout = builder.timeout;
    this.clock = builder.clock;
    this.ownsScheduler = builder.scheduler == null;
    this.scheduler = ownsScheduler
      ? Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r, "hindsight-discovery-timeout");
      thread.setDaemon(true);
      return thread;
    })
      : builder.scheduler;
  }

  /**
   * Returns the capabilities of the session, discovering them if this is the first call for it.
   * Concurrent calls for the same session share one discovery.
   *
   * <p>The future never completes exceptionally due to the producer: failures and timeouts yield
   * an {@linkplain CapabilitySet#isEmpty() empty} set. It is canceled if the session closes first.
   *
   * @throws IllegalStateException if this registry is closed
   */
  public CompletableFuture<CapabilitySet> discover(ControlSession session) {
    if (session == null) throw new NullPointerException("session == null");
    if (closed) throw new IllegalStateException("closed");
    String sessionId = session.sessionId();
    CapabilitySet known = sessions.get(sessionId);
    if (known != null) return CompletableFuture.completedFuture(known);

    Discovery attempt = new Discovery(session);
    Discovery existing = pending.putIfAbsent(sessionId, attempt);
    if (existing != null) return existing.copy();

    known = sessions.get(sessionId); // a discovery finished between our two reads
    if (known != null) {
      pending.remove(sessionId, attempt);
      return CompletableFuture.completedFuture(known);
    }

    attempt.start();
    return attempt.copy();
  }

  /** Returns the discovered capabilities, or null if discovery hasn't finished. */
  @Nullable public CapabilitySet get(String sessionId) {
    return sessions.get(sessionId);
  }

  public boolean supports(String sessionId, String serviceName) {
    CapabilitySet capabilities = sessions.get(sessionId);
    return capabilities != null && capabilities.supports(serviceName);
  }

  /** Forgets the session, canceling any discovery still in flight. */
  public void sessionClosed(String sessionId) {
    Discovery inFlight = pending.remove(sessionId);
    if (inFlight != null) inFlight.abandon();
    sessions.remove(sessionId);
  }

  /** Count of sessions with finished discovery. */
  public int sessionCount() {
    return sessions.size();
  }

  /** Count of discoveries in flight. */
  public int pendingCount() {
    return pending.size();
  }

  @Override public void close() {
    closed = true;
    for (String sessionId : pending.keySet()) {
      Discovery inFlight = pending.remove(sessionId);
      if (inFlight != null) inFlight.abandon();
    }
    sessions.clear();
    if (ownsScheduler) scheduler.shutdownNow();
  }

  @Override public String toString() {
    return "CapabilityRegistry{timeout=" + timeout + ", sessions=" + sessions.size()
      + ", pending=" + pending.size() + "}";
  }

  /** Bridges the producer's {@link Call} to the future returned by {@link #discover}. */
  final class Discovery extends CompletableFuture<CapabilitySet>
    implements Callback<List<String>> {
    final String sessionId;
    final IntrospectionClient client;
    final AtomicBoolean finished = new AtomicBoolean();
    volatile Call<List<String>> call;
    volatile ScheduledFuture<?> timeoutTask;

    Discovery(ControlSession session) {
      this.sessionId = session.sessionId();
      this.client = session.client();
    }

    void start() {
      try {
        timeoutTask = scheduler.schedule(this::onTimeout, timeout.toNanos(), NANOSECONDS);
        Call<List<String>> listServices = client.listServices();
        call = listServices;
        if (finished.get()) { // abandoned before the call was assigned
          cancelTimeout();
          listServices.cancel();
          return;
        }
        listServices.enqueue(this);
      } catch (Throwable t) {
        propagateIfFatal(t);
        onError(t);
      }
    }

    @Override public void onSuccess(@Nullable List<String> serviceNames) {
      if (serviceNames == null) {
        onError(new IllegalStateException("producer returned no service list"));
        return;
      }
      finish(CapabilitySet.create(sessionId, serviceNames, clock.instant()), null);
    }

    @Override public void onError(Throwable t) {
      finish(CapabilitySet.empty(sessionId, clock.instant()), t);
    }

    void onTimeout() {
      if (finished.get()) return;
      cancelCall();
      finish(CapabilitySet.empty(sessionId, clock.instant()),
        new TimeoutException("no answer within " + timeout));
    }

    void finish(CapabilitySet result, @Nullable Throwable error) {
      if (!finished.compareAndSet(false, true)) return;
      cancelTimeout();
      if (pending.get(sessionId) != this) { // session closed
        cancel(false);
        return;
      }

      // publish before leaving pending, so a concurrent discover never starts a second attempt
      sessions.put(sessionId, result);
      if (!pending.remove(sessionId, this)) { // lost a race with sessionClosed
        sessions.remove(sessionId, result);
        cancel(false);
        return;
      }

      if (error != null) {
        LOG.warn("Discovery failed for session {}; continuing with no capabilities: {}",
          sessionId, error.toString());
      } else if (LOG.isDebugEnabled()) {
        LOG.debug("Discovered session {}: {}", sessionId, result.serviceNames());
      }
      complete(result);
    }

    void abandon() {
      if (!finished.compareAndSet(false, true)) return;
      cancelTimeout();
      cancelCall();
      cancel(false);
      if (LOG.isDebugEnabled()) LOG.debug("Abandoned discovery for closed session {}", sessionId);
    }

    void cancelCall() {
      Call<List<String>> inFlight = call;
      if (inFlight != null) inFlight.cancel();
    }

    void cancelTimeout() {
      ScheduledFuture<?> task = timeoutTask;
      if (task != null) task.cancel(false);
    }

    @Override public String toString() {
      return "Discovery{sessionId=" + sessionId + "}";
    }
  }
}
