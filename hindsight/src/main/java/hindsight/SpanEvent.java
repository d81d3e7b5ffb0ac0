/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** A named point in time inside a span, such as "retry" or "cache.miss". */
// @Immutable
public final class SpanEvent implements Comparable<SpanEvent> {
  public static SpanEvent create(long timestamp, String name) {
    return create(timestamp, name, Collections.emptyMap());
  }

  public static SpanEvent create(long timestamp, String name,
    Map<String, AttributeValue> attributes) {
    if (name == null) throw new NullPointerException("name == null");
    if (attributes == null) throw new NullPointerException("attributes == null");
    Map<String, AttributeValue> copy = attributes.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new TreeMap<>(attributes));
    return new SpanEvent(timestamp, name, copy);
  }

  final long timestamp;
  final String name;
  final Map<String, AttributeValue> attributes;

  SpanEvent(long timestamp, String name, Map<String, AttributeValue> attributes) {
    this.timestamp = timestamp;
    this.name = name;
    this.attributes = attributes;
  }

  /** Epoch nanoseconds when this event occurred. */
  public long timestamp() {
    return timestamp;
  }

  public String name() {
    return name;
  }

  /** Sorted by key. */
  public Map<String, AttributeValue> attributes() {
    return attributes;
  }

  /** Compares by {@link #timestamp()}, then {@link #name()}. */
  @Override public int compareTo(SpanEvent that) {
    if (this == that) return 0;
    int byTimestamp = Long.compare(timestamp, that.timestamp);
    if (byTimestamp != 0) return byTimestamp;
    return name.compareTo(that.name);
  }

  @Override public String toString() {
    return "SpanEvent{timestamp=" + timestamp + ", name=" + name
      + ", attributes=" + attributes + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanEvent)) return false;
    SpanEvent that = (SpanEvent) o;
    return timestamp == that.timestamp && name.equals(that.name)
      && attributes.equals(that.attributes);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) (timestamp ^ (timestamp >>> 32));
    h *= 1000003;
    h ^= name.hashCode();
    h *= 1000003;
    h ^= attributes.hashCode();
    return h;
  }
}
