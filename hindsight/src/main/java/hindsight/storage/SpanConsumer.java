/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

import hindsight.Call;
import hindsight.Span;
import java.util.List;

/** Write side of storage. */
public interface SpanConsumer {
  /**
   * Stores a batch of spans, which may belong to many traces and arrive in any order.
   *
   * <p>Malformed spans are rejected one by one in the {@link IngestResult}. They never fail the
   * call or the rest of the batch. Storing a span again replaces it rather than duplicating it.
   */
  Call<IngestResult> accept(List<Span> spans);
}
