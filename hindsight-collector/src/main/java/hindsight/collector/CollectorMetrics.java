/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector;

/**
 * Producers send batches of spans over a transport. The {@link Collector} stores them and reports
 * what happened here, so a telemetry system can watch the health of ingest.
 *
 * <h3>Key Relationships</h3>
 * <ul>
 *   <li>Successful batches = {@link #incrementMessages() batches} - {@link
 *   #incrementMessagesDropped() dropped batches}.</li>
 *   <li>Stored spans = {@link #incrementSpans(int) received spans} - {@link
 *   #incrementSpansDropped(int) dropped spans}.</li>
 * </ul>
 *
 * <p>Stored spans can exceed the spans queryable, because a redelivered span replaces the
 * previous copy.
 */
public interface CollectorMetrics {

  /**
   * Partitions metrics by transport. For example, the default key "hindsight.collector.spans"
   * might become "hindsight.collector.spans{transport=rpc}" after {@code
   * metrics.forTransport("rpc")}.
   *
   * @param transportType ex "rpc"
   */
  CollectorMetrics forTransport(String transportType);

  /** Increments count of batches received, which contain 0 or more spans. */
  void incrementMessages();

  /** Increments count of batches that could not be stored at all, for example storage failure. */
  void incrementMessagesDropped();

  /** Increments the count of spans received. */
  void incrementSpans(int quantity);

  /** Increments the count of spans not stored, because they were malformed or storage failed. */
  void incrementSpansDropped(int quantity);

  CollectorMetrics NOOP_METRICS = new CollectorMetrics() {

    @Override public CollectorMetrics forTransport(String transportType) {
      return this;
    }

    @Override public void incrementMessages() {
    }

    @Override public void incrementMessagesDropped() {
    }

    @Override public void incrementSpans(int quantity) {
    }

    @Override public void incrementSpansDropped(int quantity) {
    }

    @Override public String toString() {
      return "NoOpCollectorMetrics";
    }
  };
}
