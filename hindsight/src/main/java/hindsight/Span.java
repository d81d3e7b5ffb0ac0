/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A span is a single timed operation reported by a producer. Spans sharing a {@link #traceId()}
 * form a trace, linked by {@link #parentId()}.
 *
 * <p>Timestamps are epoch nanoseconds supplied by the producer and never corrected. A span without
 * an {@link #endTime()} is still running, called "open".
 *
 * <p>This type does not validate identifiers or timestamps beyond presence. Storage rejects
 * malformed spans per item so that one bad span never aborts a batch.
 */
// @Immutable
public final class Span {
  final TraceId traceId;
  @Nullable final SpanId parentId;
  final SpanId id;
  final String name, serviceName;
  final long startTime, endTime; // endTime zero means open
  final Map<String, AttributeValue> attributes;
  final List<SpanEvent> events;
  final SpanStatus status;

  public TraceId traceId() {
    return traceId;
  }

  /** The parent's span ID or null if this is the root span of a trace. */
  @Nullable public SpanId parentId() {
    return parentId;
  }

  public SpanId id() {
    return id;
  }

  /** Operation name, or empty. */
  public String name() {
    return name;
  }

  /** The service that produced this span, or empty when the producer didn't say. */
  public String serviceName() {
    return serviceName;
  }

  /** Epoch nanoseconds when this span started. */
  public long startTime() {
    return startTime;
  }

  /** Epoch nanoseconds when this span ended, or null if it is still open. */
  @Nullable public Long endTime() {
    return endTime != 0L ? endTime : null;
  }

  /** Like {@link #endTime()} except returns zero when open. */
  public long endTimeAsLong() {
    return endTime;
  }

  public boolean isOpen() {
    return endTime == 0L;
  }

  /** End minus start in nanoseconds, or null if the span is open. */
  @Nullable public Long durationNanos() {
    return endTime != 0L ? endTime - startTime : null;
  }

  /** Sorted by key. */
  public Map<String, AttributeValue> attributes() {
    return attributes;
  }

  /** Sorted ascending by timestamp. */
  public List<SpanEvent> events() {
    return events;
  }

  public SpanStatus status() {
    return status;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    TraceId traceId;
    SpanId parentId, id;
    String name = "", serviceName = "";
    long startTime, endTime;
    TreeMap<String, AttributeValue> attributes;
    ArrayList<SpanEvent> events;
    SpanStatus status = SpanStatus.OK;

    Builder() {
    }

    Builder(Span source) {
      traceId = source.traceId;
      parentId = source.parentId;
      id = source.id;
      name = source.name;
      serviceName = source.serviceName;
      startTime = source.startTime;
      endTime = source.endTime;
      if (!source.attributes.isEmpty()) attributes = new TreeMap<>(source.attributes);
      if (!source.events.isEmpty()) events = new ArrayList<>(source.events);
      status = source.status;
    }

    public Builder traceId(TraceId traceId) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      this.traceId = traceId;
      return this;
    }

    /** @see TraceId#parse(String) */
    public Builder traceId(String traceId) {
      return traceId(TraceId.parse(traceId));
    }

    public Builder parentId(@Nullable SpanId parentId) {
      this.parentId = parentId;
      return this;
    }

    /** Zero means no parent. */
    public Builder parentId(long parentId) {
      this.parentId = parentId != 0L ? SpanId.create(parentId) : null;
      return this;
    }

    public Builder id(SpanId id) {
      if (id == null) throw new NullPointerException("id == null");
      this.id = id;
      return this;
    }

    public Builder id(long id) {
      return id(SpanId.create(id));
    }

    public Builder name(@Nullable String name) {
      this.name = name == null ? "" : name;
      return this;
    }

    public Builder serviceName(@Nullable String serviceName) {
      this.serviceName = serviceName == null ? "" : serviceName;
      return this;
    }

    public Builder startTime(long startTime) {
      this.startTime = startTime;
      return this;
    }

    /** Zero means the span is still open. */
    public Builder endTime(long endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder endTime(@Nullable Long endTime) {
      this.endTime = endTime != null ? endTime : 0L;
      return this;
    }

    public Builder putAttribute(String key, AttributeValue value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      if (attributes == null) attributes = new TreeMap<>();
      attributes.put(key, value);
      return this;
    }

    public Builder putAttribute(String key, String value) {
      return putAttribute(key, AttributeValue.of(value));
    }

    public Builder putAttribute(String key, long value) {
      return putAttribute(key, AttributeValue.of(value));
    }

    public Builder putAttribute(String key, double value) {
      return putAttribute(key, AttributeValue.of(value));
    }

    public Builder putAttribute(String key, boolean value) {
      return putAttribute(key, AttributeValue.of(value));
    }

    public Builder clearAttributes() {
      if (attributes != null) attributes.clear();
      return this;
    }

    public Builder addEvent(SpanEvent event) {
      if (event == null) throw new NullPointerException("event == null");
      if (events == null) events = new ArrayList<>();
      events.add(event);
      return this;
    }

    public Builder addEvent(long timestamp, String name) {
      return addEvent(SpanEvent.create(timestamp, name));
    }

    public Builder status(SpanStatus status) {
      if (status == null) throw new NullPointerException("status == null");
      this.status = status;
      return this;
    }

    public Span build() {
      String missing = "";
      if (traceId == null) missing += " traceId";
      if (id == null) missing += " id";
      if (!"".equals(missing)) throw new IllegalStateException("Missing :" + missing);
      return new Span(this);
    }
  }

  Span(Builder builder) {
    traceId = builder.traceId;
    parentId = builder.parentId;
    id = builder.id;
    name = builder.name;
    serviceName = builder.serviceName;
    startTime = builder.startTime;
    endTime = builder.endTime;
    attributes = builder.attributes == null || builder.attributes.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new TreeMap<>(builder.attributes));
    if (builder.events == null || builder.events.isEmpty()) {
      events = Collections.emptyList();
    } else {
      ArrayList<SpanEvent> sorted = new ArrayList<>(builder.events);
      Collections.sort(sorted);
      events = Collections.unmodifiableList(sorted);
    }
    status = builder.status;
  }

  @Override public String toString() {
    return "Span{traceId=" + traceId + ", parentId=" + parentId + ", id=" + id
      + ", name=" + name + ", serviceName=" + serviceName
      + ", startTime=" + startTime + ", endTime=" + endTime
      + ", attributes=" + attributes + ", events=" + events + ", status=" + status + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Span)) return false;
    Span that = (Span) o;
    return traceId.equals(that.traceId)
      && (parentId == null ? that.parentId == null : parentId.equals(that.parentId))
      && id.equals(that.id)
      && name.equals(that.name)
      && serviceName.equals(that.serviceName)
      && startTime == that.startTime
      && endTime == that.endTime
      && attributes.equals(that.attributes)
      && events.equals(that.events)
      && status.equals(that.status);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= (parentId == null) ? 0 : parentId.hashCode();
    h *= 1000003;
    h ^= id.hashCode();
    h *= 1000003;
    h ^= name.hashCode();
    h *= 1000003;
    h ^= serviceName.hashCode();
    h *= 1000003;
    h ^= Long.hashCode(startTime);
    h *= 1000003;
    h ^= Long.hashCode(endTime);
    h *= 1000003;
    h ^= attributes.hashCode();
    h *= 1000003;
    h ^= events.hashCode();
    h *= 1000003;
    h ^= status.hashCode();
    return h;
  }
}
