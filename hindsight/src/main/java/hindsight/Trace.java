/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An immutable snapshot of the spans recorded for one trace ID, with a root and a parent to
 * children index computed once when {@linkplain TraceAssembler assembled}.
 *
 * <p>Storage replaces its snapshot on every write. Readers never see a trace change underneath
 * them.
 */
// @Immutable
public final class Trace {
  final TraceId traceId;
  final List<Span> spans;
  final Span root;
  final Map<SpanId, List<Span>> children;
  final List<Span> orphans;
  final long startTime, endTime; // endTime zero means open
  final int errorCount;

  Trace(TraceId traceId, List<Span> spans, Span root, Map<SpanId, List<Span>> children,
    List<Span> orphans, long startTime, long endTime, int errorCount) {
    this.traceId = traceId;
    this.spans = spans;
    this.root = root;
    this.children = children;
    this.orphans = orphans;
    this.startTime = startTime;
    this.endTime = endTime;
    this.errorCount = errorCount;
  }

  public TraceId traceId() {
    return traceId;
  }

  /** All spans, sorted by start time then span ID. */
  public List<Span> spans() {
    return spans;
  }

  public Span root() {
    return root;
  }

  public SpanId rootSpanId() {
    return root.id();
  }

  /** The service of the root span. */
  public String serviceName() {
    return root.serviceName();
  }

  /**
   * Returns the direct children of the given span, sorted by start time, or an empty list when
   * the span has none or isn't in this trace.
   */
  public List<Span> children(SpanId spanId) {
    List<Span> result = children.get(spanId);
    return result != null ? result : Collections.emptyList();
  }

  /**
   * Spans whose parent is not present, plus any parentless span other than the root. They are
   * kept, but not reachable from {@link #root()}.
   */
  public List<Span> orphans() {
    return orphans;
  }

  /** The earliest span start time, in epoch nanoseconds. */
  public long startTime() {
    return startTime;
  }

  /**
   * The latest span end time, or null while any span reachable from the root is still open.
   */
  @Nullable public Long endTime() {
    return endTime != 0L ? endTime : null;
  }

  public boolean isComplete() {
    return endTime != 0L;
  }

  /** End minus start in nanoseconds, or null when {@link #endTime()} is. */
  @Nullable public Long durationNanos() {
    return endTime != 0L ? endTime - startTime : null;
  }

  public int spanCount() {
    return spans.size();
  }

  /** Count of spans whose status is an error. */
  public int errorCount() {
    return errorCount;
  }

  @Override public String toString() {
    return "Trace{traceId=" + traceId + ", rootSpanId=" + root.id() + ", spanCount="
      + spans.size() + ", orphans=" + orphans.size() + ", startTime=" + startTime
      + ", endTime=" + endTime + "}";
  }

  /** Two traces are equal when they hold the same spans. Indexes are derived. */
  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Trace)) return false;
    Trace that = (Trace) o;
    return traceId.equals(that.traceId) && spans.equals(that.spans);
  }

  @Override public int hashCode() {
    return traceId.hashCode() * 1000003 ^ spans.hashCode();
  }
}
