/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector;

import hindsight.Callback;
import hindsight.Span;
import hindsight.storage.IngestResult;
import hindsight.storage.StorageComponent;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static hindsight.Call.propagateIfFatal;

/**
 * Stores batches of spans received from producers and accounts for them in {@link
 * CollectorMetrics}.
 *
 * <p>Producers never see an exception from this type. Malformed spans are rejected individually,
 * and a storage failure rejects the whole batch, in both cases reported in the {@link
 * IngestResult} and logged at debug in this collector's log category.
 */
public class Collector { // not final for mock

  /** Needed to scope this to the correct logging category */
  public static Builder newBuilder(Class<?> loggingClass) {
    if (loggingClass == null) throw new NullPointerException("loggingClass == null");
    return new Builder(LoggerFactory.getLogger(loggingClass));
  }

  public static final class Builder {
    final Logger logger;
    StorageComponent storage;
    CollectorMetrics metrics;

    Builder(Logger logger) {
      this.logger = logger;
    }

    public Builder storage(StorageComponent storage) {
      if (storage == null) throw new NullPointerException("storage == null");
      this.storage = storage;
      return this;
    }

    public Builder metrics(CollectorMetrics metrics) {
      if (metrics == null) throw new NullPointerException("metrics == null");
      this.metrics = metrics;
      return this;
    }

    public Collector build() {
      return new Collector(this);
    }
  }

  final Logger logger;
  final CollectorMetrics metrics;
  final StorageComponent storage;

  Collector(Builder builder) {
    if (builder.logger == null) throw new NullPointerException("logger == null");
    this.logger = builder.logger;
    this.metrics = builder.metrics == null ? CollectorMetrics.NOOP_METRICS : builder.metrics;
    if (builder.storage == null) throw new NullPointerException("storage == null");
    this.storage = builder.storage;
  }

  /** Stores the spans on the calling thread. */
  public IngestResult accept(List<Span> spans) {
    if (spans == null) throw new NullPointerException("spans == null");
    metrics.incrementMessages();
    if (spans.isEmpty()) return IngestResult.EMPTY;
    metrics.incrementSpans(spans.size());

    IngestResult result;
    try {
      result = storage.spanConsumer().accept(spans).execute();
    } catch (Throwable e) {
      return handleStorageError(spans, e);
    }
    if (result.rejected() > 0) handleRejected(result);
    return result;
  }

  /**
   * Stores the spans using the executor, then completes the callback with the result.
   *
   * <p>Storage could be slow. This ensures requests that block callers, such as RPC handlers, are
   * released as soon as the work is queued.
   */
  public void accept(List<Span> spans, Callback<IngestResult> callback, Executor executor) {
    if (spans == null) throw new NullPointerException("spans == null");
    if (callback == null) throw new NullPointerException("callback == null");
    StoreSpans storeSpans = new StoreSpans(spans, callback);
    try {
      executor.execute(storeSpans);
    } catch (Throwable unexpected) { // ex RejectedExecutionException
      metrics.incrementMessages();
      metrics.incrementSpans(spans.size());
      handleStorageError(spans, unexpected);
      callback.onError(unexpected);
    }
  }

  final class StoreSpans implements Runnable {
    final List<Span> spans;
    final Callback<IngestResult> callback;

    StoreSpans(List<Span> spans, Callback<IngestResult> callback) {
      this.spans = spans;
      this.callback = callback;
    }

    @Override public void run() {
      callback.onSuccess(accept(spans));
    }

    @Override public String toString() {
      return appendSpanIds(spans, new StringBuilder("StoreSpans(")) + ")";
    }
  }

  void handleRejected(IngestResult result) {
    metrics.incrementSpansDropped(result.rejected());
    if (!logger.isDebugEnabled()) return;
    logger.debug("Rejected " + result.rejected() + " of " + (result.accepted() + result.rejected())
      + " spans: " + result.errors());
  }

  /**
   * When storage fails, the whole batch is dropped. This adds context of span ids to give logs
   * more relevance.
   */
  IngestResult handleStorageError(List<Span> spans, Throwable e) {
    propagateIfFatal(e);
    metrics.incrementMessagesDropped();
    metrics.incrementSpansDropped(spans.size());

    String error = e.getMessage() != null ? e.getMessage() : "";
    // The exception could be related to a span being huge. Instead of filling logs,
    // print trace id, span id pairs
    String message = appendSpanIds(spans, new StringBuilder("Cannot store spans "))
      + " due to " + e.getClass().getSimpleName() + "(" + error + ")";
    if (logger.isDebugEnabled()) logger.debug(message, e);
    return IngestResult.create(0, spans.size(), List.of(message));
  }

  String idString(Span span) {
    return span.traceId() + "/" + span.id();
  }

  String appendSpanIds(List<Span> spans, StringBuilder message) {
    message.append("[");
    int i = 0;
    Iterator<Span> iterator = spans.iterator();
    while (iterator.hasNext() && i++ < 3) {
      Span next = iterator.next();
      message.append(next != null ? idString(next) : "null");
      if (iterator.hasNext()) message.append(", ");
    }
    if (iterator.hasNext()) message.append("...");

    return message.append("]").toString();
  }

  @Override public String toString() {
    return "Collector{storage=" + storage + ", metrics=" + metrics + "}";
  }
}
