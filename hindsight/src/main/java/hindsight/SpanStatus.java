/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.Nullable;

/** Outcome of a span: {@link #OK} or an error with a message. */
// @Immutable
public final class SpanStatus {
  public static final SpanStatus OK = new SpanStatus(false, null);

  public static SpanStatus error(String message) {
    if (message == null) throw new NullPointerException("message == null");
    return new SpanStatus(true, message);
  }

  final boolean error;
  final String message;

  SpanStatus(boolean error, @Nullable String message) {
    this.error = error;
    this.message = message;
  }

  public boolean isError() {
    return error;
  }

  /** Present when {@link #isError()}. */
  @Nullable public String message() {
    return message;
  }

  @Override public String toString() {
    return error ? "Error(" + message + ")" : "Ok";
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanStatus)) return false;
    SpanStatus that = (SpanStatus) o;
    return error == that.error
      && (message == null ? that.message == null : message.equals(that.message));
  }

  @Override public int hashCode() {
    return (error ? 1231 : 1237) ^ (message == null ? 0 : message.hashCode());
  }
}
