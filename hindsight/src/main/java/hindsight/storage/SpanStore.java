/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

import hindsight.Call;
import hindsight.DependencyLink;
import hindsight.Trace;
import hindsight.TraceId;
import hindsight.TraceSummary;
import java.util.List;

/** Read side of storage. Results are snapshots and never change after they are returned. */
public interface SpanStore {
  /**
   * Retrieves an assembled trace. The value is null when the trace was never stored, has no root
   * span yet, or has expired.
   */
  Call<Trace> getTrace(TraceId traceId);

  /**
   * Returns summaries matching the request, newest first.
   *
   * @see QueryEngine
   */
  Call<List<TraceSummary>> getTraceSummaries(QueryRequest request);

  /** Returns all distinct, non-empty service names in stored spans, sorted. */
  Call<List<String>> getServiceNames();

  /** Returns the service call graph derived from stored traces. */
  Call<List<DependencyLink>> getDependencies();
}
