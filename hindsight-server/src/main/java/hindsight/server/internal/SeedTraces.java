/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.AttributeValue;
import hindsight.Span;
import hindsight.SpanEvent;
import hindsight.SpanId;
import hindsight.SpanStatus;
import hindsight.collector.Collector;
import hindsight.storage.IngestResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Sample traces with a range of shapes: fast and slow, failed, nested across services, and one
 * written by a framework producer. They let someone build a UI without a live producer.
 */
final class SeedTraces implements SmartInitializingSingleton {
  static final Logger LOG = LoggerFactory.getLogger(SeedTraces.class);
  static final long MILLIS = TimeUnit.MILLISECONDS.toNanos(1);

  final Collector collector;

  SeedTraces(Collector collector) {
    this.collector = collector;
  }

  @Override public void afterSingletonsInstantiated() {
    List<Span> spans = create(System.currentTimeMillis() * MILLIS);
    IngestResult result = collector.accept(spans);
    LOG.info("Loaded {} seed spans", result.accepted());
  }

  /** Traces that ended shortly before {@code now}, in epoch nanoseconds. */
  static List<Span> create(long now) {
    List<Span> spans = new ArrayList<>();

    // fast successful request
    long start = now - 50 * MILLIS;
    spans.add(span("a1b2c3d4e5f6789012345678901234ab", "1234567890abcdef", null,
      "GET /api/users", "api-gateway", start, start + 12 * MILLIS)
      .putAttribute("http.method", "GET")
      .putAttribute("http.url", "/api/users")
      .putAttribute("http.status_code", 200L)
      .build());
    spans.add(span("a1b2c3d4e5f6789012345678901234ab", "abcdef1234567890", "1234567890abcdef",
      "db.query users", "api-gateway", start + 2 * MILLIS, start + 10 * MILLIS)
      .putAttribute("db.system", "postgresql")
      .putAttribute("db.statement", "SELECT * FROM users LIMIT 10")
      .build());

    // slow request waiting on a lock
    start = now - 2500 * MILLIS;
    spans.add(span("deadbeef12345678901234567890abcd", "fedcba9876543210", null,
      "POST /api/orders", "order-service", start, start + 2345 * MILLIS)
      .putAttribute("http.method", "POST")
      .putAttribute("http.status_code", 200L)
      .build());
    spans.add(span("deadbeef12345678901234567890abcd", "1111222233334444", "fedcba9876543210",
      "db.transaction", "order-service", start + 50 * MILLIS, start + 2340 * MILLIS)
      .putAttribute("db.system", "postgresql")
      .putAttribute("db.operation", "INSERT")
      .addEvent(SpanEvent.create(start + 100 * MILLIS, "Waiting for lock",
        Map.of("lock.type", AttributeValue.of("ROW EXCLUSIVE"))))
      .build());

    // failed request
    start = now - 15 * MILLIS;
    spans.add(span("e440e404e440e404e440e404e440e404", "5555666677778888", null,
      "GET /api/user/999", "user-service", start, start + 8 * MILLIS)
      .putAttribute("http.method", "GET")
      .putAttribute("http.status_code", 404L)
      .addEvent(SpanEvent.create(start + 5 * MILLIS, "exception",
        Map.of("exception.type", AttributeValue.of("UserNotFoundException"))))
      .status(SpanStatus.error("User not found"))
      .build());

    // checkout fanning out to several services
    start = now - 500 * MILLIS;
    String checkout = "c0a10000c0a10000c0a10000c0a10000";
    spans.add(span(checkout, "1111000000000001", null,
      "POST /api/checkout", "api-gateway", start, start + 485 * MILLIS)
      .putAttribute("http.method", "POST")
      .build());
    spans.add(span(checkout, "2222000000000002", "1111000000000001",
      "validate_cart", "cart-service", start + 5 * MILLIS, start + 50 * MILLIS).build());
    spans.add(span(checkout, "3333000000000003", "1111000000000001",
      "check_inventory", "inventory-service", start + 55 * MILLIS, start + 175 * MILLIS)
      .putAttribute("items.checked", 3L)
      .build());
    spans.add(span(checkout, "4444000000000004", "1111000000000001",
      "process_payment", "payment-service", start + 180 * MILLIS, start + 460 * MILLIS)
      .putAttribute("payment.provider", "stripe")
      .build());
    spans.add(span(checkout, "5555000000000005", "1111000000000001",
      "create_order", "order-service", start + 455 * MILLIS, start + 485 * MILLIS)
      .putAttribute("order.id", "ORD-12345")
      .build());

    // upstream timeout
    start = now - 5100 * MILLIS;
    spans.add(span("00e0000000e0000000e0000000e00000", "1a2b3c4d5e6f7890", null,
      "GET /api/external", "api-gateway", start, start + 5050 * MILLIS)
      .putAttribute("http.status_code", 504L)
      .status(SpanStatus.error("Gateway timeout"))
      .build());
    spans.add(span("00e0000000e0000000e0000000e00000", "2b3c4d5e6f7890a1", "1a2b3c4d5e6f7890",
      "http.call external-api", "api-gateway", start + 10 * MILLIS, start + 5040 * MILLIS)
      .putAttribute("http.url", "https://external-api.example.com")
      .putAttribute("peer.service", "external-api")
      .addEvent(start + 5000 * MILLIS, "timeout")
      .status(SpanStatus.error("Request timeout"))
      .build());

    // query evaluated by a picante producer
    start = now - 120 * MILLIS;
    spans.add(span("9c0a9c0a9c0a9c0a9c0a9c0a9c0a9c0a", "7000000000000001", null,
      "compile", "build-server", start, start + 110 * MILLIS)
      .putAttribute("picante.query", true)
      .build());
    spans.add(span("9c0a9c0a9c0a9c0a9c0a9c0a9c0a9c0a", "7000000000000002", "7000000000000001",
      "parse_module", "build-server", start + 4 * MILLIS, start + 60 * MILLIS)
      .putAttribute("picante.query", true)
      .putAttribute("picante.cache_hit", false)
      .build());
    return spans;
  }

  static Span.Builder span(String traceId, String id, String parentId, String name,
    String serviceName, long startTime, long endTime) {
    Span.Builder result = Span.newBuilder()
      .traceId(traceId)
      .id(SpanId.parse(id))
      .name(name)
      .serviceName(serviceName)
      .startTime(startTime)
      .endTime(endTime);
    if (parentId != null) result.parentId(SpanId.parse(parentId));
    return result;
  }
}
