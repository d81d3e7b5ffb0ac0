/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.stream;

import hindsight.Span;
import hindsight.TraceId;
import hindsight.internal.Nullable;

/**
 * A live notification about a trace. Subscribers see, per trace, one {@link TraceStarted}, then a
 * {@link SpanAdded} per span, then at most one {@link TraceCompleted}, unless events were dropped
 * because the subscriber fell behind.
 */
public abstract class TraceEvent {
  final TraceId traceId;

  TraceEvent(TraceId traceId) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    this.traceId = traceId;
  }

  public final TraceId traceId() {
    return traceId;
  }

  /** The root span of a trace arrived. */
  public static final class TraceStarted extends TraceEvent {
    final String rootSpanName, serviceName;

    public TraceStarted(TraceId traceId, String rootSpanName, String serviceName) {
      super(traceId);
      this.rootSpanName = rootSpanName;
      this.serviceName = serviceName;
    }

    public String rootSpanName() {
      return rootSpanName;
    }

    public String serviceName() {
      return serviceName;
    }

    @Override public String toString() {
      return "TraceStarted{traceId=" + traceId + ", rootSpanName=" + rootSpanName
        + ", serviceName=" + serviceName + "}";
    }
  }

  /** A span was stored or replaced. */
  public static final class SpanAdded extends TraceEvent {
    final Span span;

    public SpanAdded(TraceId traceId, Span span) {
      super(traceId);
      if (span == null) throw new NullPointerException("span == null");
      this.span = span;
    }

    public Span span() {
      return span;
    }

    @Override public String toString() {
      return "SpanAdded{traceId=" + traceId + ", spanId=" + span.id() + "}";
    }
  }

  /** No span reachable from the root is open anymore. */
  public static final class TraceCompleted extends TraceEvent {
    @Nullable final Long durationNanos;
    final int spanCount;

    public TraceCompleted(TraceId traceId, @Nullable Long durationNanos, int spanCount) {
      super(traceId);
      this.durationNanos = durationNanos;
      this.spanCount = spanCount;
    }

    @Nullable public Long durationNanos() {
      return durationNanos;
    }

    public int spanCount() {
      return spanCount;
    }

    @Override public String toString() {
      return "TraceCompleted{traceId=" + traceId + ", durationNanos=" + durationNanos
        + ", spanCount=" + spanCount + "}";
    }
  }
}
