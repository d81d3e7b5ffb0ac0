/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector.discovery;

import com.github.valfirst.slf4jtest.TestLoggerFactoryExtension;
import hindsight.Call;
import hindsight.Callback;
import hindsight.Span;
import hindsight.TraceId;
import hindsight.collector.Collector;
import hindsight.storage.InMemoryStorage;
import hindsight.storage.QueryRequest;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.event.Level;

import static com.github.valfirst.slf4jtest.TestLoggerFactory.getAllLoggingEvents;
import static com.github.valfirst.slf4jtest.TestLoggerFactory.getLoggingEvents;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(TestLoggerFactoryExtension.class)
class CapabilityRegistryTest {
  static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  CapabilityRegistry registry = CapabilityRegistry.newBuilder()
    .timeout(Duration.ofMillis(200))
    .clock(Clock.fixed(NOW, ZoneOffset.UTC))
    .build();

  @AfterEach void close() {
    registry.close();
  }

  @Test void discover_recordsAdvertisedServices() throws Exception {
    ControlSession session = ControlSession.create("s1", () -> Call.create(List.of("Echo", "Kv")));

    CapabilitySet capabilities = registry.discover(session).get(1, TimeUnit.SECONDS);

    assertThat(capabilities.serviceNames()).containsExactly("Echo", "Kv");
    assertThat(capabilities.discoveredAt()).isEqualTo(NOW);
    assertThat(registry.get("s1")).isEqualTo(capabilities);
    assertThat(registry.supports("s1", "Echo")).isTrue();
    assertThat(registry.supports("s1", "Nope")).isFalse();
  }

  @Test void discover_oncePerConnection() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    ControlSession session = ControlSession.create("s1", () -> {
      calls.incrementAndGet();
      return Call.create(List.of("Echo"));
    });

    registry.discover(session).get(1, TimeUnit.SECONDS);
    registry.discover(session).get(1, TimeUnit.SECONDS);

    assertThat(calls).hasValue(1);
  }

  @Test void discover_concurrentCallsShareOneAttempt() throws Exception {
    PendingCall call = new PendingCall();
    AtomicInteger calls = new AtomicInteger();
    ControlSession session = ControlSession.create("s1", () -> {
      calls.incrementAndGet();
      return call;
    });

    CompletableFuture<CapabilitySet> first = registry.discover(session);
    CompletableFuture<CapabilitySet> second = registry.discover(session);
    assertThat(first).isNotDone();

    call.callback.onSuccess(List.of("Echo"));

    assertThat(first.get(1, TimeUnit.SECONDS)).isEqualTo(second.get(1, TimeUnit.SECONDS));
    assertThat(calls).hasValue(1);
    assertThat(registry.pendingCount()).isZero();
  }

  @Test void discover_timeoutYieldsEmptySet() throws Exception {
    PendingCall neverAnswers = new PendingCall();
    ControlSession session = ControlSession.create("s1", () -> neverAnswers);

    CapabilitySet capabilities = registry.discover(session).get(5, TimeUnit.SECONDS);

    assertThat(capabilities.isEmpty()).isTrue();
    assertThat(registry.get("s1")).isEqualTo(capabilities);
    assertThat(neverAnswers.isCanceled()).isTrue();
    assertThat(getAllLoggingEvents()) // logged on the timeout thread
      .filteredOn(event -> event.getLevel().equals(Level.WARN))
      .hasSize(1);
  }

  @Test void discover_errorYieldsEmptySet() throws Exception {
    ControlSession session = ControlSession.create("s1", () -> new Call.Base<List<String>>() {
      @Override protected List<String> doExecute() throws IOException {
        throw new IOException("connection reset");
      }

      @Override protected void doEnqueue(Callback<List<String>> callback) {
        callback.onError(new IOException("connection reset"));
      }

      @Override public Call<List<String>> clone() {
        throw new UnsupportedOperationException();
      }
    });

    CapabilitySet capabilities = registry.discover(session).get(1, TimeUnit.SECONDS);

    assertThat(capabilities.isEmpty()).isTrue();
    assertThat(getLoggingEvents())
      .filteredOn(event -> event.getLevel().equals(Level.WARN))
      .extracting(event -> event.getArguments().get(0))
      .containsExactly("s1");
  }

  @Test void discover_clientThrowingYieldsEmptySet() throws Exception {
    ControlSession session = ControlSession.create("s1", () -> {
      throw new IllegalStateException("not connected");
    });

    assertThat(registry.discover(session).get(1, TimeUnit.SECONDS).isEmpty()).isTrue();
  }

  @Test void sessionClosed_cancelsInFlightAndDiscardsLateResult() {
    PendingCall call = new PendingCall();
    ControlSession session = ControlSession.create("s1", () -> call);
    CompletableFuture<CapabilitySet> future = registry.discover(session);

    registry.sessionClosed("s1");

    assertThat(call.isCanceled()).isTrue();
    assertThat(future).isCompletedExceptionally();
    assertThat(registry.pendingCount()).isZero();

    call.callback.onSuccess(List.of("Echo")); // arrives after disconnect

    assertThat(registry.get("s1")).isNull();
    assertThat(registry.sessionCount()).isZero();
  }

  @Test void sessionClosed_whileListingCancelsProducerCall() {
    PendingCall call = new PendingCall();
    ControlSession session = ControlSession.create("s1", () -> {
      registry.sessionClosed("s1"); // disconnects before the call is handed back
      return call;
    });

    CompletableFuture<CapabilitySet> future = registry.discover(session);

    assertThat(call.isCanceled()).isTrue();
    assertThat(call.callback).isNull(); // never enqueued
    assertThat(future).isCompletedExceptionally();
    assertThat(registry.pendingCount()).isZero();
    assertThat(registry.get("s1")).isNull();
  }

  @Test void discover_afterCloseIsRejected() {
    registry.close();

    assertThatThrownBy(
      () -> registry.discover(ControlSession.create("s1", () -> Call.create(List.of("Echo")))))
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("closed");
    assertThat(registry.pendingCount()).isZero();
  }

  @Test void discover_rejectedTimeoutYieldsEmptySet() throws Exception {
    ScheduledExecutorService shutDown = Executors.newSingleThreadScheduledExecutor();
    shutDown.shutdown();
    CapabilityRegistry rejecting = CapabilityRegistry.newBuilder().scheduler(shutDown).build();

    CapabilitySet capabilities =
      rejecting.discover(ControlSession.create("s1", () -> Call.create(List.of("Echo"))))
        .get(1, TimeUnit.SECONDS);

    assertThat(capabilities.isEmpty()).isTrue();
    assertThat(rejecting.pendingCount()).isZero();
  }

  @Test void sessionClosed_forgetsCapabilities() throws Exception {
    registry.discover(ControlSession.create("s1", () -> Call.create(List.of("Echo"))))
      .get(1, TimeUnit.SECONDS);

    registry.sessionClosed("s1");

    assertThat(registry.get("s1")).isNull();
  }

  @Test void reconnect_discoversAgain() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    IntrospectionClient client = () -> {
      calls.incrementAndGet();
      return Call.create(List.of("Echo"));
    };
    registry.discover(ControlSession.create("s1", client)).get(1, TimeUnit.SECONDS);
    registry.sessionClosed("s1");

    registry.discover(ControlSession.create("s2", client)).get(1, TimeUnit.SECONDS);

    assertThat(calls).hasValue(2);
  }

  /** A producer that never answers discovery still has its spans ingested and queryable. */
  @Test void unresponsiveProducer_stillIngested() throws Exception {
    try (InMemoryStorage storage = InMemoryStorage.newBuilder().sweepInterval(Duration.ZERO)
      .build()) {
      Collector collector = Collector.newBuilder(getClass()).storage(storage).build();
      CompletableFuture<CapabilitySet> discovery =
        registry.discover(ControlSession.create("s1", PendingCall::new));

      Span root = Span.newBuilder()
        .traceId(TraceId.create(0L, 1L))
        .id(1L)
        .name("GET /")
        .serviceName("silent")
        .startTime(1L)
        .endTime(2L)
        .build();
      assertThat(collector.accept(List.of(root)).accepted()).isOne();
      assertThat(storage.getTraceSummaries(QueryRequest.newBuilder().build()).execute())
        .hasSize(1);

      assertThat(discovery.get(5, TimeUnit.SECONDS).isEmpty()).isTrue();
    }
  }

  /** Holds the callback until the test completes it. */
  static final class PendingCall extends Call.Base<List<String>> {
    volatile Callback<List<String>> callback;

    @Override protected List<String> doExecute() throws IOException {
      throw new IOException("async only");
    }

    @Override protected void doEnqueue(Callback<List<String>> callback) {
      this.callback = callback;
    }

    @Override public Call<List<String>> clone() {
      return new PendingCall();
    }
  }
}
