/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.internal;

import hindsight.AttributeValue;
import hindsight.DependencyLink;
import hindsight.Span;
import hindsight.Trace;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import static java.util.logging.Level.FINE;

/**
 * Derives service dependency links from assembled traces.
 *
 * <p>Each parent to child span edge whose services differ counts as one call. A span can also name
 * the service it called with the {@value #PEER_SERVICE} string attribute. That adds a call to the
 * named service, unless a child span already recorded that service, so the same call isn't
 * counted twice. A call is an error when the callee's span (or the caller's, for a peer call) has
 * an error status.
 */
public final class DependencyLinker {
  public static final String PEER_SERVICE = "peer.service";

  final Logger logger;
  final Map<Pair, long[]> counts = new TreeMap<>(); // [calls, errors], sorted for stable output

  public DependencyLinker() {
    this(Logger.getLogger(DependencyLinker.class.getName()));
  }

  DependencyLinker(Logger logger) {
    this.logger = logger;
  }

  public DependencyLinker putTrace(Trace trace) {
    if (logger.isLoggable(FINE)) logger.fine("linking trace " + trace.traceId());
    for (Span span : trace.spans()) {
      String service = span.serviceName();
      if (service.isEmpty()) continue;

      List<Span> children = trace.children(span.id());
      for (Span child : children) {
        String childService = child.serviceName();
        if (childService.isEmpty() || childService.equals(service)) continue;
        increment(service, childService, child.status().isError());
      }

      AttributeValue peer = span.attributes().get(PEER_SERVICE);
      if (peer == null || peer.type() != AttributeValue.Type.STRING) continue;
      String peerService = peer.stringValue();
      if (peerService.isEmpty() || peerService.equals(service)) continue;
      if (anyFromService(children, peerService)) continue;
      increment(service, peerService, span.status().isError());
    }
    return this;
  }

  public List<DependencyLink> link() {
    List<DependencyLink> result = new ArrayList<>(counts.size());
    for (Map.Entry<Pair, long[]> entry : counts.entrySet()) {
      long[] value = entry.getValue();
      result.add(DependencyLink.create(entry.getKey().left, entry.getKey().right, value[0],
        value[1]));
    }
    return result;
  }

  void increment(String parent, String child, boolean error) {
    if (logger.isLoggable(FINE)) logger.fine("incrementing link " + parent + " -> " + child);
    long[] value = counts.computeIfAbsent(new Pair(parent, child), k -> new long[2]);
    value[0]++;
    if (error) value[1]++;
  }

  static boolean anyFromService(List<Span> spans, String serviceName) {
    for (Span span : spans) {
      if (serviceName.equals(span.serviceName())) return true;
    }
    return false;
  }

  static final class Pair implements Comparable<Pair> {
    final String left, right;

    Pair(String left, String right) {
      this.left = left;
      this.right = right;
    }

    @Override public int compareTo(Pair that) {
      int result = left.compareTo(that.left);
      return result != 0 ? result : right.compareTo(that.right);
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Pair)) return false;
      Pair that = (Pair) o;
      return left.equals(that.left) && right.equals(that.right);
    }

    @Override public int hashCode() {
      return left.hashCode() * 1000003 ^ right.hashCode();
    }
  }
}
