/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.collector.CollectorMetrics;
import hindsight.internal.Nullable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exports the following meters, tagged by transport:
 *
 * <ul>
 *   <li>hindsight_collector.messages - cumulative batches received</li>
 *   <li>hindsight_collector.messages_dropped - cumulative batches storage failed to accept</li>
 *   <li>hindsight_collector.spans - cumulative spans received</li>
 *   <li>hindsight_collector.spans_dropped - cumulative spans rejected or lost to storage
 *   failure</li>
 *   <li>hindsight_collector.message_spans - count of spans in the last batch</li>
 * </ul>
 */
final class MicrometerCollectorMetrics implements CollectorMetrics {
  final MeterRegistry registryInstance;
  @Nullable final Counter messages, messagesDropped, spans, spansDropped;
  @Nullable final AtomicInteger messageSpans;

  MicrometerCollectorMetrics(MeterRegistry registry) {
    this(null, registry);
  }

  MicrometerCollectorMetrics(@Nullable String transport, MeterRegistry meterRegistry) {
    this.registryInstance = meterRegistry;
    if (transport == null) {
      messages = messagesDropped = spans = spansDropped = null;
      messageSpans = null;
      return;
    }
    this.messages = Counter.builder("hindsight_collector.messages")
      .description("cumulative amount of span batches received")
      .tag("transport", transport)
      .register(registryInstance);
    this.messagesDropped = Counter.builder("hindsight_collector.messages_dropped")
      .description("cumulative amount of span batches that could not be stored")
      .tag("transport", transport)
      .register(registryInstance);
    this.spans = Counter.builder("hindsight_collector.spans")
      .description("cumulative amount of spans received")
      .tag("transport", transport)
      .register(registryInstance);
    this.spansDropped = Counter.builder("hindsight_collector.spans_dropped")
      .description("cumulative amount of spans received that were later dropped")
      .tag("transport", transport)
      .register(registryInstance);

    this.messageSpans = new AtomicInteger(0);
    Gauge.builder("hindsight_collector.message_spans", messageSpans, AtomicInteger::get)
      .description("count of spans per batch")
      .tag("transport", transport)
      .register(registryInstance);
  }

  @Override public MicrometerCollectorMetrics forTransport(String transportType) {
    if (transportType == null) throw new NullPointerException("transportType == null");
    return new MicrometerCollectorMetrics(transportType, registryInstance);
  }

  @Override public void incrementMessages() {
    checkScoped();
    messages.increment();
  }

  @Override public void incrementMessagesDropped() {
    checkScoped();
    messagesDropped.increment();
  }

  @Override public void incrementSpans(int quantity) {
    checkScoped();
    messageSpans.set(quantity);
    spans.increment(quantity);
  }

  @Override public void incrementSpansDropped(int quantity) {
    checkScoped();
    spansDropped.increment(quantity);
  }

  void checkScoped() {
    if (messages == null) {
      throw new IllegalStateException("always scope with MicrometerCollectorMetrics.forTransport");
    }
  }

  @Override public String toString() {
    return "MicrometerCollectorMetrics{}";
  }
}
