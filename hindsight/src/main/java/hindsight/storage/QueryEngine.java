/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

import hindsight.Trace;
import hindsight.TraceSummary;
import hindsight.classify.TraceClassifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Serves trace listings over a point-in-time snapshot of storage. Callers pass a copy of the stored
 * values, so concurrent writes or eviction can neither duplicate nor skip a trace.
 *
 * <p>Results are classified at read time, as rules can change independently of stored data.
 */
public final class QueryEngine {
  /** Newest start first, ties broken by trace ID. */
  public static final Comparator<TraceSummary> NEWEST_FIRST = (left, right) -> {
    if (left == right) return 0;
    int byStart = Long.compare(right.startTime(), left.startTime());
    if (byStart != 0) return byStart;
    return left.traceId().compareTo(right.traceId());
  };

  final TraceClassifier classifier;

  public QueryEngine(TraceClassifier classifier) {
    if (classifier == null) throw new NullPointerException("classifier == null");
    this.classifier = classifier;
  }

  public List<TraceSummary> query(Collection<Trace> snapshot, QueryRequest request) {
    if (request == null) throw new NullPointerException("request == null");
    List<TraceSummary> matched = new ArrayList<>();
    for (Trace trace : snapshot) {
      TraceSummary summary = TraceSummary.create(trace, classifier.classify(trace));
      if (request.test(summary)) matched.add(summary);
    }
    matched.sort(NEWEST_FIRST);
    return matched.size() > request.limit()
      ? List.copyOf(matched.subList(0, request.limit()))
      : List.copyOf(matched);
  }
}
