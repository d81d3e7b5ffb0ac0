/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.logging.Level.FINE;

/**
 * Turns an unordered collection of spans sharing a trace ID into a rooted {@link Trace}.
 *
 * <p>The result depends only on the set of spans, never on arrival order:
 * <ul>
 *   <li>The root is the parentless span that starts first, ties broken by span ID.</li>
 *   <li>Other parentless spans, and spans whose parent isn't present, are orphans.</li>
 *   <li>Spans and child lists are sorted by start time, then span ID.</li>
 * </ul>
 *
 * <p>Assembly is linear after sorting, so callers can run it on every write.
 */
public final class TraceAssembler {
  /** Orders spans by start time, then unsigned span ID. */
  public static final Comparator<Span> SPAN_ORDER = (left, right) -> {
    if (left == right) return 0;
    int byStart = Long.compare(left.startTime(), right.startTime());
    if (byStart != 0) return byStart;
    return left.id().compareTo(right.id());
  };

  static final Logger LOG = Logger.getLogger(TraceAssembler.class.getName());

  /**
   * Returns the assembled trace, or null if no root span has arrived yet. A missing root is a
   * normal transient state, not an error.
   *
   * <p>Spans must have distinct IDs. Spans with a different trace ID are skipped.
   *
   * @throws IllegalArgumentException if spans are empty
   */
  @Nullable public static Trace assemble(TraceId traceId, Collection<Span> input) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    if (input.isEmpty()) throw new IllegalArgumentException("spans were empty");

    List<Span> spans = new ArrayList<>(input.size());
    for (Span span : input) {
      if (!traceId.equals(span.traceId())) {
        if (LOG.isLoggable(FINE)) {
          LOG.fine(format("skipping span from another trace: traceId=%s, spanId=%s, spanTraceId=%s",
            traceId, span.id(), span.traceId()));
        }
        continue;
      }
      spans.add(span);
    }
    if (spans.isEmpty()) return null;
    spans.sort(SPAN_ORDER);

    // sorted input means the first parentless span is the root
    Span root = null;
    Map<SpanId, Span> byId = new LinkedHashMap<>();
    for (Span span : spans) {
      byId.put(span.id(), span);
      if (root == null && span.parentId() == null) root = span;
    }
    if (root == null) {
      if (LOG.isLoggable(FINE)) {
        LOG.fine(format("trace incomplete, no root span yet: traceId=%s, spanCount=%s",
          traceId, spans.size()));
      }
      return null;
    }

    Map<SpanId, List<Span>> children = new LinkedHashMap<>();
    List<Span> orphans = new ArrayList<>();
    long startTime = Long.MAX_VALUE, maxEnd = 0L;
    int errorCount = 0;
    for (Span span : spans) {
      startTime = Math.min(startTime, span.startTime());
      maxEnd = Math.max(maxEnd, span.endTimeAsLong());
      if (span.status().isError()) errorCount++;
      if (span == root) continue;

      SpanId parentId = span.parentId();
      if (parentId == null || !byId.containsKey(parentId)) {
        if (LOG.isLoggable(FINE)) {
          LOG.fine(format("orphaned span: traceId=%s, rootSpanId=%s, spanId=%s, parentId=%s",
            traceId, root.id(), span.id(), parentId));
        }
        orphans.add(span);
        continue;
      }
      children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(span);
    }

    long endTime = anyOpenFrom(root, children) ? 0L : maxEnd;

    for (Map.Entry<SpanId, List<Span>> entry : children.entrySet()) {
      entry.setValue(Collections.unmodifiableList(entry.getValue()));
    }
    return new Trace(traceId, Collections.unmodifiableList(spans), root,
      Collections.unmodifiableMap(children), Collections.unmodifiableList(orphans), startTime,
      endTime, errorCount);
  }

  /** Walks breadth-first from the root, which can't loop as each span has one parent. */
  static boolean anyOpenFrom(Span root, Map<SpanId, List<Span>> children) {
    ArrayDeque<Span> queue = new ArrayDeque<>();
    queue.add(root);
    while (!queue.isEmpty()) {
      Span current = queue.pop();
      if (current.isOpen()) return true;
      List<Span> next = children.get(current.id());
      if (next != null) queue.addAll(next);
    }
    return false;
  }

  TraceAssembler() {
  }
}
