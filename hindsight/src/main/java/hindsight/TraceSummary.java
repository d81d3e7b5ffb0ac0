/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.Nullable;

/** A compact row describing a trace, as returned by trace listings. */
// @Immutable
public final class TraceSummary {
  public static TraceSummary create(Trace trace, TraceType traceType) {
    if (trace == null) throw new NullPointerException("trace == null");
    if (traceType == null) throw new NullPointerException("traceType == null");
    return new TraceSummary(trace.traceId(), trace.root().name(), trace.serviceName(),
      trace.startTime(), trace.durationNanos(), trace.spanCount(), trace.errorCount(), traceType);
  }

  final TraceId traceId;
  final String rootSpanName, serviceName;
  final long startTime;
  @Nullable final Long durationNanos;
  final int spanCount, errorCount;
  final TraceType traceType;

  TraceSummary(TraceId traceId, String rootSpanName, String serviceName, long startTime,
    @Nullable Long durationNanos, int spanCount, int errorCount, TraceType traceType) {
    this.traceId = traceId;
    this.rootSpanName = rootSpanName;
    this.serviceName = serviceName;
    this.startTime = startTime;
    this.durationNanos = durationNanos;
    this.spanCount = spanCount;
    this.errorCount = errorCount;
    this.traceType = traceType;
  }

  public TraceId traceId() {
    return traceId;
  }

  public String rootSpanName() {
    return rootSpanName;
  }

  public String serviceName() {
    return serviceName;
  }

  public long startTime() {
    return startTime;
  }

  /** Null while the trace is open. */
  @Nullable public Long durationNanos() {
    return durationNanos;
  }

  public int spanCount() {
    return spanCount;
  }

  public int errorCount() {
    return errorCount;
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  public TraceType traceType() {
    return traceType;
  }

  @Override public String toString() {
    return "TraceSummary{traceId=" + traceId + ", rootSpanName=" + rootSpanName
      + ", serviceName=" + serviceName + ", startTime=" + startTime
      + ", durationNanos=" + durationNanos + ", spanCount=" + spanCount
      + ", errorCount=" + errorCount + ", traceType=" + traceType + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceSummary)) return false;
    TraceSummary that = (TraceSummary) o;
    return traceId.equals(that.traceId)
      && rootSpanName.equals(that.rootSpanName)
      && serviceName.equals(that.serviceName)
      && startTime == that.startTime
      && (durationNanos == null ? that.durationNanos == null
      : durationNanos.equals(that.durationNanos))
      && spanCount == that.spanCount
      && errorCount == that.errorCount
      && traceType.equals(that.traceType);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= rootSpanName.hashCode();
    h *= 1000003;
    h ^= serviceName.hashCode();
    h *= 1000003;
    h ^= Long.hashCode(startTime);
    h *= 1000003;
    h ^= durationNanos == null ? 0 : durationNanos.hashCode();
    h *= 1000003;
    h ^= spanCount;
    h *= 1000003;
    h ^= errorCount;
    h *= 1000003;
    h ^= traceType.hashCode();
    return h;
  }
}
