/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector.discovery;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** Services a producer session advertised when it connected. */
// @Immutable
public final class CapabilitySet {
  public static CapabilitySet create(String sessionId, Collection<String> serviceNames,
    Instant discoveredAt) {
    if (sessionId == null) throw new NullPointerException("sessionId == null");
    if (serviceNames == null) throw new NullPointerException("serviceNames == null");
    if (discoveredAt == null) throw new NullPointerException("discoveredAt == null");
    TreeSet<String> sorted = new TreeSet<>();
    for (String name : serviceNames) {
      if (name != null && !name.isEmpty()) sorted.add(name);
    }
    return new CapabilitySet(sessionId, Collections.unmodifiableSet(sorted), discoveredAt);
  }

  /** Recorded when discovery fails or times out. The producer still works, minus extras. */
  public static CapabilitySet empty(String sessionId, Instant discoveredAt) {
    return create(sessionId, Collections.emptyList(), discoveredAt);
  }

  final String sessionId;
  final Set<String> serviceNames;
  final Instant discoveredAt;

  CapabilitySet(String sessionId, Set<String> serviceNames, Instant discoveredAt) {
    this.sessionId = sessionId;
    this.serviceNames = serviceNames;
    this.discoveredAt = discoveredAt;
  }

  public String sessionId() {
    return sessionId;
  }

  /** Sorted, without empty names. */
  public Set<String> serviceNames() {
    return serviceNames;
  }

  public Instant discoveredAt() {
    return discoveredAt;
  }

  public boolean supports(String serviceName) {
    return serviceNames.contains(serviceName);
  }

  public boolean isEmpty() {
    return serviceNames.isEmpty();
  }

  @Override public String toString() {
    return "CapabilitySet{sessionId=" + sessionId + ", serviceNames=" + serviceNames
      + ", discoveredAt=" + discoveredAt + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof CapabilitySet)) return false;
    CapabilitySet that = (CapabilitySet) o;
    return sessionId.equals(that.sessionId) && serviceNames.equals(that.serviceNames)
      && discoveredAt.equals(that.discoveredAt);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= sessionId.hashCode();
    h *= 1000003;
    h ^= serviceNames.hashCode();
    h *= 1000003;
    h ^= discoveredAt.hashCode();
    return h;
  }
}
