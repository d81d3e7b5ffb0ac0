/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.Span;
import hindsight.TraceId;
import hindsight.classify.ClassificationRule;
import hindsight.classify.TraceClassifier;
import hindsight.collector.discovery.CapabilityRegistry;
import hindsight.server.HindsightService;
import hindsight.storage.InMemoryStorage;
import hindsight.storage.QueryRequest;
import hindsight.storage.StorageComponent;
import hindsight.stream.EventBroadcaster;
import hindsight.stream.Subscription;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.context.PropertyPlaceholderAutoConfiguration;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class HindsightConfigurationTest {
  AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();

  @AfterEach void close() {
    context.close();
  }

  void refresh() {
    context.register(
      PropertyPlaceholderAutoConfiguration.class,
      MeterRegistryConfiguration.class,
      HindsightConfiguration.class,
      SeedTracesConfiguration.class);
    context.refresh();
  }

  @Test void defaults() {
    refresh();

    InMemoryStorage storage = (InMemoryStorage) context.getBean(StorageComponent.class);
    assertThat(storage.ttl()).isEqualTo(Duration.ofHours(1));
    assertThat(context.getBean(EventBroadcaster.class))
      .hasToString("EventBroadcaster{queueCapacity=1024, subscriberCount=0}");
    assertThat(context.getBean(CapabilityRegistry.class).toString())
      .startsWith("CapabilityRegistry{timeout=PT5S");
    assertThat(context.getBean(TraceClassifier.class).rules())
      .extracting(ClassificationRule::framework)
      .containsExactly("picante", "rapace", "dodeca");
    assertThat(context.getBean(HindsightService.class).ping()).isEqualTo("pong");
  }

  @Test void seedDataDisabledByDefault() {
    refresh();

    assertThatExceptionOfType(NoSuchBeanDefinitionException.class)
      .isThrownBy(() -> context.getBean(SeedTraces.class));
    assertThat(((InMemoryStorage) context.getBean(StorageComponent.class)).traceCount()).isZero();
  }

  @Test void readsDontStoreSpansAboutThemselves() throws Exception {
    refresh();
    HindsightService service = context.getBean(HindsightService.class);

    service.getServiceNames();
    service.listTraces(QueryRequest.newBuilder().build());
    service.getDependencies();

    InMemoryStorage storage = (InMemoryStorage) context.getBean(StorageComponent.class);
    assertThat(storage.traceCount()).isZero();
    assertThat(context.getBean(MeterRegistry.class).find("hindsight_collector.spans").counters())
      .allMatch(counter -> counter.count() == 0);
  }

  @Test void storageProperties() {
    TestPropertyValues.of(
      "hindsight.storage.ttl:30m",
      "hindsight.storage.sweep-interval:0s"
    ).applyTo(context);
    refresh();

    assertThat(((InMemoryStorage) context.getBean(StorageComponent.class)).ttl())
      .isEqualTo(Duration.ofMinutes(30));
  }

  @Test void streamQueueCapacity() {
    TestPropertyValues.of("hindsight.stream.queue-capacity:8").applyTo(context);
    refresh();

    assertThat(context.getBean(EventBroadcaster.class).toString())
      .contains("queueCapacity=8");
  }

  @Test void discoveryTimeout() {
    TestPropertyValues.of("hindsight.discovery.timeout:250ms").applyTo(context);
    refresh();

    assertThat(context.getBean(CapabilityRegistry.class).toString())
      .startsWith("CapabilityRegistry{timeout=PT0.25S");
  }

  @Test void classifierFrameworks_replaceDefaults() {
    TestPropertyValues.of("hindsight.classifier.frameworks.acme:acme.").applyTo(context);
    refresh();

    assertThat(context.getBean(TraceClassifier.class).rules())
      .extracting(ClassificationRule::framework)
      .containsExactly("acme");
  }

  @Test void collectorMetrics_taggedRpc() {
    refresh();

    context.getBean(HindsightService.class).ingestSpans(List.of(span(1L), span(2L)));

    MeterRegistry registry = context.getBean(MeterRegistry.class);
    assertThat(registry.get("hindsight_collector.spans").tag("transport", "rpc").counter()
      .count()).isEqualTo(2.0);
    assertThat(registry.get("hindsight_collector.messages").tag("transport", "rpc").counter()
      .count()).isEqualTo(1.0);
    assertThat(registry.get("hindsight_storage.traces").gauge().value()).isEqualTo(2.0);
  }

  @Test void streamMetrics() {
    refresh();

    MeterRegistry registry = context.getBean(MeterRegistry.class);
    try (Subscription subscription = context.getBean(EventBroadcaster.class).subscribe()) {
      assertThat(registry.get("hindsight_stream.subscribers").gauge().value()).isEqualTo(1.0);
    }
    assertThat(registry.get("hindsight_stream.subscribers").gauge().value()).isZero();
    assertThat(registry.get("hindsight_stream.dropped_events").functionCounter().count()).isZero();
  }

  @Test void health_reflectsStorage() throws Exception {
    refresh();

    HealthIndicator health = context.getBean("storageHealthIndicator", HealthIndicator.class);
    assertThat(health.health().getStatus()).isEqualTo(Status.UP);

    context.getBean(StorageComponent.class).close();

    assertThat(health.health().getStatus()).isEqualTo(Status.DOWN);
  }

  static Span span(long traceIdLow) {
    return Span.newBuilder()
      .traceId(TraceId.create(0L, traceIdLow))
      .id(1L)
      .name("get")
      .serviceName("frontend")
      .startTime(1704067200_000_000_000L)
      .endTime(1704067200_001_000_000L)
      .build();
  }
}
