/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

import hindsight.Span;
import hindsight.Trace;
import hindsight.TraceId;
import hindsight.internal.Nullable;
import java.util.List;

/** Describes one atomic write to a trace, as seen by a {@link TraceListener}. */
// @Immutable
public final class TraceUpdate {
  final TraceId traceId;
  final List<Span> addedSpans;
  @Nullable final Trace trace;
  final boolean started, completed;

  TraceUpdate(TraceId traceId, List<Span> addedSpans, @Nullable Trace trace, boolean started,
    boolean completed) {
    this.traceId = traceId;
    this.addedSpans = addedSpans;
    this.trace = trace;
    this.started = started;
    this.completed = completed;
  }

  public TraceId traceId() {
    return traceId;
  }

  /** Spans that were new or changed by this write, sorted by start time. */
  public List<Span> addedSpans() {
    return addedSpans;
  }

  /** The trace after this write, or null if its root span hasn't arrived. */
  @Nullable public Trace trace() {
    return trace;
  }

  /** True on the first write that produced an assembled trace. */
  public boolean started() {
    return started;
  }

  /** True on the first write after which the trace had no open spans reachable from its root. */
  public boolean completed() {
    return completed;
  }

  @Override public String toString() {
    return "TraceUpdate{traceId=" + traceId + ", addedSpans=" + addedSpans.size()
      + ", started=" + started + ", completed=" + completed + "}";
  }
}
