/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.Nullable;

/**
 * Which producing framework's conventions a trace follows. Framework names are open-ended: new
 * frameworks are added with classification rules, not by changing this type.
 */
// @Immutable
public final class TraceType {
  public enum Kind {
    /** No framework rule matched. */
    GENERIC,
    /** Exactly one framework matched. */
    FRAMEWORK,
    /** Two or more frameworks matched. */
    MIXED
  }

  public static final TraceType GENERIC = new TraceType(Kind.GENERIC, null);
  public static final TraceType MIXED = new TraceType(Kind.MIXED, null);

  public static TraceType framework(String framework) {
    if (framework == null) throw new NullPointerException("framework == null");
    if (framework.isEmpty()) throw new IllegalArgumentException("framework is empty");
    return new TraceType(Kind.FRAMEWORK, framework);
  }

  final Kind kind;
  final String framework;

  TraceType(Kind kind, @Nullable String framework) {
    this.kind = kind;
    this.framework = framework;
  }

  public Kind kind() {
    return kind;
  }

  /** Present when {@link #kind()} is {@link Kind#FRAMEWORK}. */
  @Nullable public String framework() {
    return framework;
  }

  /** Returns "Generic", "Mixed" or "Framework(name)". */
  @Override public String toString() {
    switch (kind) {
      case GENERIC:
        return "Generic";
      case MIXED:
        return "Mixed";
      default:
        return "Framework(" + framework + ")";
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceType)) return false;
    TraceType that = (TraceType) o;
    return kind == that.kind
      && (framework == null ? that.framework == null : framework.equals(that.framework));
  }

  @Override public int hashCode() {
    return kind.hashCode() * 1000003 ^ (framework == null ? 0 : framework.hashCode());
  }
}
