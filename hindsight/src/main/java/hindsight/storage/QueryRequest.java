/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

import hindsight.TraceSummary;
import hindsight.internal.Nullable;

/**
 * Invoking this request retrieves summaries of traces matching all of the given criteria, newest
 * first.
 *
 * <p>Malformed requests fail in {@link Builder#build()}, never later during the query.
 */
// @Immutable
public final class QueryRequest {
  /** Requests default to, and are capped at, this many results. */
  public static final int MAX_LIMIT = 100;

  /** When present, only include traces whose root span is from this service. */
  @Nullable public String serviceName() {
    return serviceName;
  }

  /** When present, only include traces whose duration is at least this many nanoseconds. */
  @Nullable public Long minDuration() {
    return minDuration;
  }

  /** When present, only include traces whose duration is at most this many nanoseconds. */
  @Nullable public Long maxDuration() {
    return maxDuration;
  }

  /** When present, only include traces which do or do not contain error spans. */
  @Nullable public Boolean hasErrors() {
    return hasErrors;
  }

  /** Maximum number of summaries to return. */
  public int limit() {
    return limit;
  }

  /**
   * Tests the supplied summary against all criteria except {@link #limit()}. Traces without a
   * duration, because they are still open, never match a duration bound.
   */
  public boolean test(TraceSummary summary) {
    if (serviceName != null && !serviceName.equals(summary.serviceName())) return false;
    if (minDuration != null || maxDuration != null) {
      Long duration = summary.durationNanos();
      if (duration == null) return false;
      if (minDuration != null && duration < minDuration) return false;
      if (maxDuration != null && duration > maxDuration) return false;
    }
    return hasErrors == null || hasErrors == summary.hasErrors();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String serviceName;
    Long minDuration, maxDuration;
    Boolean hasErrors;
    int limit = MAX_LIMIT;

    Builder(QueryRequest source) {
      serviceName = source.serviceName;
      minDuration = source.minDuration;
      maxDuration = source.maxDuration;
      hasErrors = source.hasErrors;
      limit = source.limit;
    }

    Builder() {
    }

    /** @see QueryRequest#serviceName() */
    public Builder serviceName(@Nullable String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    /** @see QueryRequest#minDuration() */
    public Builder minDuration(@Nullable Long minDuration) {
      this.minDuration = minDuration;
      return this;
    }

    /** @see QueryRequest#maxDuration() */
    public Builder maxDuration(@Nullable Long maxDuration) {
      this.maxDuration = maxDuration;
      return this;
    }

    /** @see QueryRequest#hasErrors() */
    public Builder hasErrors(@Nullable Boolean hasErrors) {
      this.hasErrors = hasErrors;
      return this;
    }

    /** Values above {@link #MAX_LIMIT} are capped. @see QueryRequest#limit() */
    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public QueryRequest build() {
      // coerce an empty service name to null, as a form field would send it
      if ("".equals(serviceName)) serviceName = null;

      if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
      if (minDuration != null && minDuration < 0) {
        throw new IllegalArgumentException("minDuration < 0");
      }
      if (maxDuration != null && maxDuration < 0) {
        throw new IllegalArgumentException("maxDuration < 0");
      }
      if (minDuration != null && maxDuration != null && maxDuration < minDuration) {
        throw new IllegalArgumentException("maxDuration < minDuration");
      }
      return new QueryRequest(serviceName, minDuration, maxDuration, hasErrors,
        Math.min(limit, MAX_LIMIT));
    }
  }

  final String serviceName;
  final Long minDuration, maxDuration;
  final Boolean hasErrors;
  final int limit;

  QueryRequest(@Nullable String serviceName, @Nullable Long minDuration,
    @Nullable Long maxDuration, @Nullable Boolean hasErrors, int limit) {
    this.serviceName = serviceName;
    this.minDuration = minDuration;
    this.maxDuration = maxDuration;
    this.hasErrors = hasErrors;
    this.limit = limit;
  }

  @Override public String toString() {
    String result = "QueryRequest{";
    if (serviceName != null) result += "serviceName=" + serviceName + ", ";
    if (minDuration != null) result += "minDuration=" + minDuration + ", ";
    if (maxDuration != null) result += "maxDuration=" + maxDuration + ", ";
    if (hasErrors != null) result += "hasErrors=" + hasErrors + ", ";
    return result + "limit=" + limit + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof QueryRequest)) return false;
    QueryRequest that = (QueryRequest) o;
    return (serviceName == null ? that.serviceName == null : serviceName.equals(that.serviceName))
      && (minDuration == null ? that.minDuration == null : minDuration.equals(that.minDuration))
      && (maxDuration == null ? that.maxDuration == null : maxDuration.equals(that.maxDuration))
      && (hasErrors == null ? that.hasErrors == null : hasErrors.equals(that.hasErrors))
      && limit == that.limit;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= serviceName == null ? 0 : serviceName.hashCode();
    h *= 1000003;
    h ^= minDuration == null ? 0 : minDuration.hashCode();
    h *= 1000003;
    h ^= maxDuration == null ? 0 : maxDuration.hashCode();
    h *= 1000003;
    h ^= hasErrors == null ? 0 : hasErrors.hashCode();
    h *= 1000003;
    h ^= limit;
    return h;
  }
}
