/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.stream;

import hindsight.Span;
import hindsight.Trace;
import hindsight.storage.TraceListener;
import hindsight.storage.TraceUpdate;

/**
 * Turns storage writes into {@link TraceEvent}s.
 *
 * <p>Spans that arrive before the root are held back: the write that assembles the trace
 * publishes {@link TraceEvent.TraceStarted} followed by a {@link TraceEvent.SpanAdded} for every
 * span so far. Later writes publish one event per new or changed span.
 */
public final class BroadcastingTraceListener implements TraceListener {
  final EventBroadcaster broadcaster;

  public BroadcastingTraceListener(EventBroadcaster broadcaster) {
    if (broadcaster == null) throw new NullPointerException("broadcaster == null");
    this.broadcaster = broadcaster;
  }

  @Override public void onUpdate(TraceUpdate update) {
    Trace trace = update.trace();
    if (trace == null) return; // no root yet

    if (update.started()) {
      broadcaster.publish(new TraceEvent.TraceStarted(trace.traceId(), trace.root().name(),
        trace.serviceName()));
    }
    for (Span span : update.started() ? trace.spans() : update.addedSpans()) {
      broadcaster.publish(new TraceEvent.SpanAdded(trace.traceId(), span));
    }
    if (update.completed()) {
      broadcaster.publish(new TraceEvent.TraceCompleted(trace.traceId(), trace.durationNanos(),
        trace.spanCount()));
    }
  }

  @Override public String toString() {
    return "BroadcastingTraceListener{" + broadcaster + "}";
  }
}
