/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.classify.TraceClassifier;
import hindsight.collector.Collector;
import hindsight.collector.CollectorMetrics;
import hindsight.collector.discovery.CapabilityRegistry;
import hindsight.server.HindsightService;
import hindsight.storage.InMemoryStorage;
import hindsight.storage.StorageComponent;
import hindsight.stream.BroadcastingTraceListener;
import hindsight.stream.EventBroadcaster;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-scoped components of the hub. Each is built once here and handed to its collaborators,
 * so nothing reaches for a global.
 */
@Configuration
@EnableConfigurationProperties({
  HindsightStorageProperties.class,
  HindsightStreamProperties.class,
  HindsightDiscoveryProperties.class,
  HindsightClassifierProperties.class
})
public class HindsightConfiguration {

  @Bean TraceClassifier traceClassifier(HindsightClassifierProperties classifier) {
    return classifier.toClassifier();
  }

  @Bean MicrometerHubMetrics hubMetrics(MeterRegistry registry) {
    return new MicrometerHubMetrics(registry);
  }

  @Bean CollectorMetrics metrics(MeterRegistry registry) {
    return new MicrometerCollectorMetrics(registry);
  }

  @Bean EventBroadcaster eventBroadcaster(HindsightStreamProperties stream,
    MicrometerHubMetrics hubMetrics) {
    EventBroadcaster result = EventBroadcaster.newBuilder()
      .queueCapacity(stream.getQueueCapacity())
      .build();
    hubMetrics.bind(result);
    return result;
  }

  /** Declared as the abstract type, so a persistent backend can replace it. */
  @Bean StorageComponent storage(HindsightStorageProperties storage, TraceClassifier classifier,
    EventBroadcaster broadcaster, MicrometerHubMetrics hubMetrics) {
    InMemoryStorage result = InMemoryStorage.newBuilder()
      .ttl(storage.getTtl())
      .sweepInterval(storage.getSweepInterval())
      .classifier(classifier)
      .listener(new BroadcastingTraceListener(broadcaster))
      .build();
    hubMetrics.bind(result);
    return result;
  }

  @Bean Collector collector(StorageComponent storage, CollectorMetrics metrics) {
    return Collector.newBuilder(Collector.class)
      .storage(storage)
      .metrics(metrics.forTransport("rpc"))
      .build();
  }

  @Bean CapabilityRegistry capabilityRegistry(HindsightDiscoveryProperties discovery) {
    return CapabilityRegistry.newBuilder().timeout(discovery.getTimeout()).build();
  }

  @Bean HindsightService hindsightService(StorageComponent storage, Collector collector,
    EventBroadcaster broadcaster, CapabilityRegistry capabilityRegistry) {
    return new HindsightService(storage, collector, broadcaster, capabilityRegistry);
  }

  @Bean HealthIndicator storageHealthIndicator(StorageComponent storage) {
    return new HindsightHealthIndicator(storage);
  }
}
