/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.storage;

import java.util.Collections;
import java.util.List;

/** Outcome of storing a batch of spans. */
// @Immutable
public final class IngestResult {
  public static final IngestResult EMPTY = new IngestResult(0, 0, Collections.emptyList());

  /** One error message per rejected span. */
  public static IngestResult create(int accepted, List<String> errors) {
    if (errors == null) throw new NullPointerException("errors == null");
    return create(accepted, errors.size(), errors);
  }

  public static IngestResult create(int accepted, int rejected, List<String> errors) {
    if (accepted < 0) throw new IllegalArgumentException("accepted < 0");
    if (rejected < 0) throw new IllegalArgumentException("rejected < 0");
    if (errors == null) throw new NullPointerException("errors == null");
    if (accepted == 0 && rejected == 0 && errors.isEmpty()) return EMPTY;
    return new IngestResult(accepted, rejected, List.copyOf(errors));
  }

  final int accepted, rejected;
  final List<String> errors;

  IngestResult(int accepted, int rejected, List<String> errors) {
    this.accepted = accepted;
    this.rejected = rejected;
    this.errors = errors;
  }

  public int accepted() {
    return accepted;
  }

  public int rejected() {
    return rejected;
  }

  /** Why spans were rejected, in batch order. */
  public List<String> errors() {
    return errors;
  }

  @Override public String toString() {
    return "IngestResult{accepted=" + accepted + ", rejected=" + rejected
      + ", errors=" + errors + "}";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof IngestResult)) return false;
    IngestResult that = (IngestResult) o;
    return accepted == that.accepted && rejected == that.rejected && errors.equals(that.errors);
  }

  @Override public int hashCode() {
    return (accepted * 1000003 ^ rejected) * 1000003 ^ errors.hashCode();
  }
}
