/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

import hindsight.Call;
import hindsight.CheckResult;
import hindsight.DependencyLink;
import hindsight.Span;
import hindsight.SpanId;
import hindsight.Trace;
import hindsight.TraceAssembler;
import hindsight.TraceId;
import hindsight.TraceSummary;
import hindsight.classify.TraceClassifier;
import hindsight.internal.DependencyLinker;
import hindsight.internal.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Storage that keeps traces in memory for a bounded time, accepting spans on the calling thread.
 *
 * <p>Each trace ID maps to an immutable entry holding its spans, the last assembled {@link Trace}
 * and the time of its last write. A write computes a new entry with {@link
 * ConcurrentHashMap#compute}, so writes to the same trace are linearizable while writes to
 * different traces never contend on a shared lock.
 *
 * <p>Traces expire when no span was written for {@link Builder#ttl(Duration) ttl}. Reads ignore
 * expired entries, and a background sweep removes them every {@link Builder#sweepInterval(Duration)
 * sweep interval}, regardless of traffic.
 *
 * <p>Here's an example of the state after spans A (root), B (child of A) and C (parent unknown):
 *
 * <pre>{@code
 * traces:
 *    aaaa --> TraceEntry{spans=[A, B, C], trace=Trace{root=A, children={A=[B]}, orphans=[C]},
 *                        lastWriteNanos=...}
 *    bbbb --> TraceEntry{spans=[D(parent=E)], trace=null (no root yet), lastWriteNanos=...}
 * }</pre>
 */
public final class InMemoryStorage extends StorageComponent implements SpanStore, SpanConsumer {
  static final Logger LOG = Logger.getLogger(InMemoryStorage.class.getName());

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    Duration ttl = Duration.ofHours(1), sweepInterval = Duration.ofSeconds(30);
    LongSupplier ticker = System::nanoTime;
    TraceClassifier classifier;
    TraceListener listener = TraceListener.NOOP;

    /** How long a trace is kept after its last write. Defaults to one hour. */
    public Builder ttl(Duration ttl) {
      if (ttl == null) throw new NullPointerException("ttl == null");
      if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl <= 0");
      this.ttl = ttl;
      return this;
    }

    /**
     * How often expired traces are removed in the background. Zero disables the sweep, leaving
     * removal to {@link InMemoryStorage#evictExpired()}. Defaults to 30 seconds.
     */
    public Builder sweepInterval(Duration sweepInterval) {
      if (sweepInterval == null) throw new NullPointerException("sweepInterval == null");
      if (sweepInterval.isNegative()) throw new IllegalArgumentException("sweepInterval < 0");
      this.sweepInterval = sweepInterval;
      return this;
    }

    /** Source of monotonic nanoseconds used for expiry. Defaults to {@link System#nanoTime()}. */
    public Builder ticker(LongSupplier ticker) {
      if (ticker == null) throw new NullPointerException("ticker == null");
      this.ticker = ticker;
      return this;
    }

    /** Classifies traces returned by {@link #getTraceSummaries(QueryRequest)}. */
    public Builder classifier(TraceClassifier classifier) {
      if (classifier == null) throw new NullPointerException("classifier == null");
      this.classifier = classifier;
      return this;
    }

    /** Notified of each write, inside the per-trace atomic section. */
    public Builder listener(TraceListener listener) {
      if (listener == null) throw new NullPointerException("listener == null");
      this.listener = listener;
      return this;
    }

    public InMemoryStorage build() {
      return new InMemoryStorage(this);
    }

    Builder() {
    }
  }

  /** Immutable. Identity is used by conditional removal, so equals is not overridden. */
  static final class TraceEntry {
    final Map<SpanId, Span> spans;
    @Nullable final Trace trace;
    final long lastWriteNanos;
    final boolean started, completed;

    TraceEntry(Map<SpanId, Span> spans, @Nullable Trace trace, long lastWriteNanos,
      boolean started, boolean completed) {
      this.spans = spans;
      this.trace = trace;
      this.lastWriteNanos = lastWriteNanos;
      this.started = started;
      this.completed = completed;
    }

    TraceEntry touch(long now) {
      return new TraceEntry(spans, trace, now, started, completed);
    }
  }

  final ConcurrentHashMap<TraceId, TraceEntry> traces = new ConcurrentHashMap<>();
  final Duration ttl;
  final long ttlNanos;
  final LongSupplier ticker;
  final TraceListener listener;
  final QueryEngine queryEngine;
  @Nullable final ScheduledExecutorService sweeper;
  volatile boolean closed;

  InMemoryStorage(Builder builder) {
    this.ttl = builder.ttl;
    this.ttlNanos = builder.ttl.toNanos();
    this.ticker = builder.ticker;
    this.listener = builder.listener;
    this.queryEngine = new QueryEngine(
      builder.classifier != null ? builder.classifier : TraceClassifier.create());
    if (builder.sweepInterval.isZero()) {
      this.sweeper = null;
    } else {
      this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "hindsight-ttl-sweep");
        thread.setDaemon(true);
        return thread;
      });
      long interval = builder.sweepInterval.toNanos();
      sweeper.scheduleWithFixedDelay(this::sweep, interval, interval, NANOSECONDS);
    }
  }

  @Override public InMemoryStorage spanStore() {
    return this;
  }

  @Override public InMemoryStorage spanConsumer() {
    return this;
  }

  @Override public Call<IngestResult> accept(List<Span> spans) {
    if (spans == null) throw new NullPointerException("spans == null");
    if (spans.isEmpty()) return Call.create(IngestResult.EMPTY);

    List<String> errors = new ArrayList<>();
    Map<TraceId, List<Span>> byTrace = new LinkedHashMap<>();
    for (int i = 0, length = spans.size(); i < length; i++) {
      Span span = spans.get(i);
      String error = validate(span);
      if (error != null) {
        errors.add("span[" + i + "]: " + error);
        continue;
      }
      byTrace.computeIfAbsent(span.traceId(), k -> new ArrayList<>()).add(span);
    }

    int accepted = 0;
    for (Map.Entry<TraceId, List<Span>> entry : byTrace.entrySet()) {
      List<Span> batch = entry.getValue();
      traces.compute(entry.getKey(), (traceId, existing) -> write(traceId, existing, batch));
      accepted += batch.size();
    }
    return Call.create(IngestResult.create(accepted, errors));
  }

  /** Returns why the span can't be stored, or null if it can. */
  @Nullable static String validate(@Nullable Span span) {
    if (span == null) return "span was null";
    if (!span.traceId().isValid()) return "traceId was zero";
    if (!span.id().isValid()) return "id was zero: traceId=" + span.traceId();
    if (span.id().equals(span.parentId())) {
      return "span is its own parent: traceId=" + span.traceId() + ", id=" + span.id();
    }
    if (span.startTime() <= 0L) {
      return "startTime <= 0: traceId=" + span.traceId() + ", id=" + span.id();
    }
    Long endTime = span.endTime();
    if (endTime != null && endTime < span.startTime()) {
      return "endTime < startTime: traceId=" + span.traceId() + ", id=" + span.id();
    }
    if (span.attributes().containsKey("")) {
      return "empty attribute key: traceId=" + span.traceId() + ", id=" + span.id();
    }
    return null;
  }

  /** Runs inside {@link ConcurrentHashMap#compute} for the trace ID. */
  TraceEntry write(TraceId traceId, @Nullable TraceEntry existing, List<Span> batch) {
    long now = ticker.getAsLong();
    if (existing != null && isExpired(existing, now)) existing = null; // starts over

    Map<SpanId, Span> merged =
      existing != null ? new LinkedHashMap<>(existing.spans) : new LinkedHashMap<>();
    Map<SpanId, Span> changed = new LinkedHashMap<>();
    for (Span span : batch) {
      merged.put(span.id(), span);
      if (existing != null && span.equals(existing.spans.get(span.id()))) {
        changed.remove(span.id());
      } else {
        changed.put(span.id(), span);
      }
    }
    if (changed.isEmpty()) return existing.touch(now); // redelivery refreshes the ttl only

    Trace trace = TraceAssembler.assemble(traceId, merged.values());
    boolean wasStarted = existing != null && existing.started;
    boolean wasCompleted = existing != null && existing.completed;
    boolean started = trace != null && !wasStarted;
    boolean completed = trace != null && trace.isComplete() && !wasCompleted;

    List<Span> added = new ArrayList<>(changed.values());
    added.sort(TraceAssembler.SPAN_ORDER);
    publish(new TraceUpdate(traceId, Collections.unmodifiableList(added), trace, started,
      completed));
    return new TraceEntry(Collections.unmodifiableMap(merged), trace, now,
      wasStarted || started, wasCompleted || completed);
  }

  void publish(TraceUpdate update) {
    try {
      listener.onUpdate(update);
    } catch (Throwable t) {
      Call.propagateIfFatal(t);
      LOG.log(WARNING, "listener " + listener + " failed on " + update, t);
    }
  }

  boolean isExpired(TraceEntry entry, long now) {
    return now - entry.lastWriteNanos >= ttlNanos;
  }

  @Override public Call<Trace> getTrace(TraceId traceId) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    TraceEntry entry = traces.get(traceId);
    if (entry == null || isExpired(entry, ticker.getAsLong())) return Call.create(null);
    return Call.create(entry.trace);
  }

  @Override public Call<List<TraceSummary>> getTraceSummaries(QueryRequest request) {
    if (request == null) throw new NullPointerException("request == null");
    return Call.create(queryEngine.query(snapshot(), request));
  }

  @Override public Call<List<String>> getServiceNames() {
    TreeSet<String> result = new TreeSet<>();
    for (Trace trace : snapshot()) {
      for (Span span : trace.spans()) {
        if (!span.serviceName().isEmpty()) result.add(span.serviceName());
      }
    }
    return Call.create(List.copyOf(result));
  }

  @Override public Call<List<DependencyLink>> getDependencies() {
    DependencyLinker linker = new DependencyLinker();
    for (Trace trace : snapshot()) linker.putTrace(trace);
    return Call.create(linker.link());
  }

  /** Copies assembled, unexpired traces. */
  List<Trace> snapshot() {
    long now = ticker.getAsLong();
    List<Trace> result = new ArrayList<>();
    for (TraceEntry entry : traces.values()) {
      if (entry.trace != null && !isExpired(entry, now)) result.add(entry.trace);
    }
    return result;
  }

  /**
   * Removes traces not written to within the ttl, and returns how many were removed. An entry is
   * only removed if it wasn't replaced since it was read, so a concurrent write always survives.
   */
  public int evictExpired() {
    long now = ticker.getAsLong();
    int evicted = 0;
    for (Map.Entry<TraceId, TraceEntry> entry : traces.entrySet()) {
      TraceEntry value = entry.getValue();
      if (isExpired(value, now) && traces.remove(entry.getKey(), value)) evicted++;
    }
    if (evicted > 0 && LOG.isLoggable(FINE)) {
      LOG.fine("evicted " + evicted + " traces older than " + ttl);
    }
    return evicted;
  }

  void sweep() {
    try {
      evictExpired();
    } catch (Throwable t) { // an exception would cancel future sweeps
      Call.propagateIfFatal(t);
      LOG.log(WARNING, "ttl sweep failed", t);
    }
  }

  /** Count of traces held, including ones without a root span yet. */
  public int traceCount() {
    return traces.size();
  }

  public void clear() {
    traces.clear();
  }

  public Duration ttl() {
    return ttl;
  }

  @Override public CheckResult check() {
    if (closed) return CheckResult.failed(new IllegalStateException("storage closed"));
    return CheckResult.OK;
  }

  @Override public void close() {
    closed = true;
    if (sweeper != null) sweeper.shutdownNow();
  }

  @Override public String toString() {
    return "InMemoryStorage{ttl=" + ttl + ", traceCount=" + traces.size() + "}";
  }
}
