/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector.discovery;

/**
 * A connection used only for control traffic such as discovery.
 *
 * <p>A control session has no span path. Spans enter only through {@link
 * hindsight.collector.Collector}, a separate type, so the hub's own discovery calls can never be
 * ingested as spans.
 */
// @Immutable
public final class ControlSession {
  public static ControlSession create(String sessionId, IntrospectionClient client) {
    if (sessionId == null) throw new NullPointerException("sessionId == null");
    if (sessionId.isEmpty()) throw new IllegalArgumentException("sessionId is empty");
    if (client == null) throw new NullPointerException("client == null");
    return new ControlSession(sessionId, client);
  }

  final String sessionId;
  final IntrospectionClient client;

  ControlSession(String sessionId, IntrospectionClient client) {
    this.sessionId = sessionId;
    this.client = client;
  }

  /** Unique per connection. A reconnect gets a new session. */
  public String sessionId() {
    return sessionId;
  }

  public IntrospectionClient client() {
    return client;
  }

  @Override public String toString() {
    return "ControlSession{" + sessionId + "}";
  }
}
