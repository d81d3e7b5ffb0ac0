/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

/**
 * Receives each write to storage. Calls for the same trace are made in write order, from the
 * writing thread, while that trace is locked against other writers.
 *
 * <p>Implementations must be fast and must not call back into storage.
 */
@FunctionalInterface
public interface TraceListener {
  TraceListener NOOP = new TraceListener() {
    @Override public void onUpdate(TraceUpdate update) {
    }

    @Override public String toString() {
      return "NoopTraceListener{}";
    }
  };

  void onUpdate(TraceUpdate update);
}
