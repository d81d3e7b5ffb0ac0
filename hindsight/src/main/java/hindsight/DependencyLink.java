/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

/** A directed edge in the service call graph, with how often it was used and failed. */
// @Immutable
public final class DependencyLink {
  public static DependencyLink create(String parent, String child, long callCount,
    long errorCount) {
    if (parent == null) throw new NullPointerException("parent == null");
    if (child == null) throw new NullPointerException("child == null");
    if (callCount < 0) throw new IllegalArgumentException("callCount < 0");
    if (errorCount < 0 || errorCount > callCount) {
      throw new IllegalArgumentException("errorCount should be between 0 and callCount");
    }
    return new DependencyLink(parent, child, callCount, errorCount);
  }

  final String parent, child;
  final long callCount, errorCount;

  DependencyLink(String parent, String child, long callCount, long errorCount) {
    this.parent = parent;
    this.child = child;
    this.callCount = callCount;
    this.errorCount = errorCount;
  }

  /** The calling service. */
  public String parent() {
    return parent;
  }

  /** The called service. */
  public String child() {
    return child;
  }

  public long callCount() {
    return callCount;
  }

  /** How many calls ended in an error status. */
  public long errorCount() {
    return errorCount;
  }

  @Override public String toString() {
    return "DependencyLink{parent=" + parent + ", child=" + child + ", callCount=" + callCount
      + ", errorCount=" + errorCount + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof DependencyLink)) return false;
    DependencyLink that = (DependencyLink) o;
    return parent.equals(that.parent) && child.equals(that.child)
      && callCount == that.callCount && errorCount == that.errorCount;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= parent.hashCode();
    h *= 1000003;
    h ^= child.hashCode();
    h *= 1000003;
    h ^= Long.hashCode(callCount);
    h *= 1000003;
    h ^= Long.hashCode(errorCount);
    return h;
  }
}
