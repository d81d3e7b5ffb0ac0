/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server;

import hindsight.DependencyLink;
import hindsight.Span;
import hindsight.Trace;
import hindsight.TraceId;
import hindsight.TraceSummary;
import hindsight.collector.Collector;
import hindsight.collector.discovery.CapabilityRegistry;
import hindsight.collector.discovery.CapabilitySet;
import hindsight.collector.discovery.ControlSession;
import hindsight.internal.Nullable;
import hindsight.storage.IngestResult;
import hindsight.storage.QueryRequest;
import hindsight.storage.StorageComponent;
import hindsight.stream.EventBroadcaster;
import hindsight.stream.Subscription;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The operations a transport exposes to producers and observers. This type holds no state of its
 * own: each call delegates to the storage, collector, broadcaster or capability registry it was
 * built with.
 *
 * <p>Read methods declare {@link IOException} as {@link StorageComponent} implementations may do
 * I/O. The in-memory storage never throws it.
 */
public final class HindsightService {
  final StorageComponent storage;
  final Collector collector;
  final EventBroadcaster broadcaster;
  final CapabilityRegistry capabilities;

  public HindsightService(StorageComponent storage, Collector collector,
    EventBroadcaster broadcaster, CapabilityRegistry capabilities) {
    if (storage == null) throw new NullPointerException("storage == null");
    if (collector == null) throw new NullPointerException("collector == null");
    if (broadcaster == null) throw new NullPointerException("broadcaster == null");
    if (capabilities == null) throw new NullPointerException("capabilities == null");
    this.storage = storage;
    this.collector = collector;
    this.broadcaster = broadcaster;
    this.capabilities = capabilities;
  }

  /**
   * Stores a batch of spans from a producer. Malformed spans are rejected individually and never
   * fail the batch.
   */
  public IngestResult ingestSpans(List<Span> spans) {
    return collector.accept(spans);
  }

  /** Returns the trace if it is stored, not expired and has a root span. */
  public Optional<Trace> getTrace(TraceId traceId) throws IOException {
    return Optional.ofNullable(storage.spanStore().getTrace(traceId).execute());
  }

  /** Newest first, at most {@link QueryRequest#limit()}. */
  public List<TraceSummary> listTraces(QueryRequest request) throws IOException {
    return storage.spanStore().getTraceSummaries(request).execute();
  }

  public List<String> getServiceNames() throws IOException {
    return storage.spanStore().getServiceNames().execute();
  }

  public List<DependencyLink> getDependencies() throws IOException {
    return storage.spanStore().getDependencies().execute();
  }

  /** Live events from now on. Close the subscription when done with it. */
  public Subscription subscribeEvents() {
    return broadcaster.subscribe();
  }

  /** Called when a producer connects. Never completes exceptionally due to the producer. */
  public CompletableFuture<CapabilitySet> discoverCapabilities(ControlSession session) {
    return capabilities.discover(session);
  }

  /** Called when a producer disconnects. */
  public void sessionClosed(String sessionId) {
    capabilities.sessionClosed(sessionId);
  }

  @Nullable public CapabilitySet capabilities(String sessionId) {
    return capabilities.get(sessionId);
  }

  public String ping() {
    return "pong";
  }

  @Override public String toString() {
    return "HindsightService{storage=" + storage + "}";
  }
}
