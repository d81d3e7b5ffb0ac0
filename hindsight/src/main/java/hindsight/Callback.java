/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.Nullable;

/**
 * A callback of a single result or error. Implementations will call either {@link #onSuccess} or
 * {@link #onError}, but not both.
 *
 * <p>Bridges to {@link java.util.concurrent.CompletableFuture} by completing it from each method.
 */
public interface Callback<V> {
  /** Invoked when computation produces its potentially null value successfully. */
  void onSuccess(@Nullable V value);

  /** Invoked when computation fails or is canceled. */
  void onError(Throwable t);
}
