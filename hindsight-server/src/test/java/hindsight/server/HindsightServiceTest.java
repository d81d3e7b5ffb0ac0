/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server;

import hindsight.Call;
import hindsight.DependencyLink;
import hindsight.Span;
import hindsight.Trace;
import hindsight.TraceId;
import hindsight.TraceSummary;
import hindsight.TraceType;
import hindsight.collector.discovery.CapabilitySet;
import hindsight.collector.discovery.ControlSession;
import hindsight.server.internal.HindsightConfiguration;
import hindsight.server.internal.MeterRegistryConfiguration;
import hindsight.storage.IngestResult;
import hindsight.storage.QueryRequest;
import hindsight.stream.Subscription;
import hindsight.stream.TraceEvent;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.context.PropertyPlaceholderAutoConfiguration;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

class HindsightServiceTest {
  static final long START = 1704067200_000_000_000L;
  static final long MILLIS = 1_000_000L;
  static final TraceId T1 = TraceId.parse("463ac35c9f6413ad48485a3953bb6124");

  static final Span S1 = Span.newBuilder()
    .traceId(T1)
    .id(1L)
    .name("GET /checkout")
    .serviceName("frontend")
    .startTime(START)
    .endTime(START + 20 * MILLIS)
    .build();
  static final Span S2 = Span.newBuilder()
    .traceId(T1)
    .parentId(1L)
    .id(2L)
    .name("reserve")
    .serviceName("inventory")
    .startTime(START + 2 * MILLIS)
    .endTime(START + 10 * MILLIS)
    .build();
  static final Span S3 = Span.newBuilder()
    .traceId(T1)
    .parentId(2L)
    .id(3L)
    .name("lookup")
    .serviceName("inventory")
    .startTime(START + 3 * MILLIS)
    .endTime(START + 5 * MILLIS)
    .putAttribute("picante.query", true)
    .build();

  AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
  HindsightService service;

  @BeforeEach void init() {
    context.register(
      PropertyPlaceholderAutoConfiguration.class,
      MeterRegistryConfiguration.class,
      HindsightConfiguration.class);
    context.refresh();
    service = context.getBean(HindsightService.class);
  }

  @AfterEach void close() {
    context.close();
  }

  @Test void ping() {
    assertThat(service.ping()).isEqualTo("pong");
  }

  @Test void rootAndChild_areGeneric() throws Exception {
    IngestResult result = service.ingestSpans(List.of(S1, S2));

    assertThat(result.accepted()).isEqualTo(2);
    Trace trace = service.getTrace(T1).get();
    assertThat(trace.spanCount()).isEqualTo(2);
    assertThat(trace.root()).isEqualTo(S1);
    assertThat(service.listTraces(QueryRequest.newBuilder().build()))
      .extracting(TraceSummary::traceType)
      .containsExactly(TraceType.GENERIC);
  }

  @Test void frameworkAttribute_reclassifiesTrace() throws Exception {
    service.ingestSpans(List.of(S1, S2));
    service.ingestSpans(List.of(S3));

    assertThat(service.getTrace(T1).get().spanCount()).isEqualTo(3);
    assertThat(service.listTraces(QueryRequest.newBuilder().build()))
      .extracting(TraceSummary::traceType)
      .containsExactly(TraceType.framework("picante"));
  }

  @Test void getTrace_unknown() throws Exception {
    assertThat(service.getTrace(TraceId.create(0L, 2L))).isEqualTo(Optional.empty());
  }

  @Test void ingestSpans_rejectsMalformedIndividually() {
    Span noStart = S2.toBuilder().id(4L).startTime(0L).endTime(0L).build();

    IngestResult result = service.ingestSpans(List.of(S1, noStart));

    assertThat(result.accepted()).isEqualTo(1);
    assertThat(result.rejected()).isEqualTo(1);
    assertThat(result.errors()).hasSize(1);
  }

  @Test void serviceNamesAndDependencies() throws Exception {
    service.ingestSpans(List.of(S1, S2));

    assertThat(service.getServiceNames()).containsExactly("frontend", "inventory");
    assertThat(service.getDependencies())
      .containsExactly(DependencyLink.create("frontend", "inventory", 1, 0));
  }

  @Test void subscribeEvents_seesIngest() throws Exception {
    try (Subscription subscription = service.subscribeEvents()) {
      service.ingestSpans(List.of(S1, S2));

      assertThat(subscription.poll(1, TimeUnit.SECONDS))
        .isInstanceOf(TraceEvent.TraceStarted.class);
      assertThat(subscription.poll(1, TimeUnit.SECONDS)).isInstanceOf(TraceEvent.SpanAdded.class);
      assertThat(subscription.poll(1, TimeUnit.SECONDS)).isInstanceOf(TraceEvent.SpanAdded.class);
      assertThat(subscription.poll(1, TimeUnit.SECONDS))
        .isInstanceOf(TraceEvent.TraceCompleted.class);
    }
  }

  @Test void discoverCapabilities() throws Exception {
    ControlSession session = ControlSession.create("s1", () -> Call.create(List.of("Echo")));

    CapabilitySet capabilities =
      service.discoverCapabilities(session).get(1, TimeUnit.SECONDS);

    assertThat(capabilities.serviceNames()).containsExactly("Echo");
    assertThat(service.capabilities("s1")).isEqualTo(capabilities);

    service.sessionClosed("s1");

    assertThat(service.capabilities("s1")).isNull();
  }
}
