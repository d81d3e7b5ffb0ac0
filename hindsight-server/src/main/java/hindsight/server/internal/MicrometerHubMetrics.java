/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.storage.InMemoryStorage;
import hindsight.stream.EventBroadcaster;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/** Gauges over the state held in memory, which ingest counters alone can't show. */
final class MicrometerHubMetrics {
  final MeterRegistry registryInstance;

  MicrometerHubMetrics(MeterRegistry registryInstance) {
    this.registryInstance = registryInstance;
  }

  void bind(InMemoryStorage storage) {
    Gauge.builder("hindsight_storage.traces", storage::traceCount)
      .description("number of traces held, including ones awaiting their root span")
      .register(registryInstance);
  }

  void bind(EventBroadcaster broadcaster) {
    Gauge.builder("hindsight_stream.subscribers", broadcaster::subscriberCount)
      .description("number of live event subscriptions")
      .register(registryInstance);
    FunctionCounter.builder("hindsight_stream.dropped_events", broadcaster,
        EventBroadcaster::droppedEvents)
      .description("cumulative events dropped because a subscriber fell behind")
      .register(registryInstance);
  }
}
