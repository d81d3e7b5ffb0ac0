/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.HexCodec;

/** A 64-bit span identifier, unique within its trace. Zero is invalid. */
// @Immutable
public final class SpanId implements Comparable<SpanId> {
  public static SpanId create(long value) {
    return new SpanId(value);
  }

  /**
   * Parses a 16 character hex string, as written by {@link #toString()}.
   *
   * @throws IllegalArgumentException if the input isn't 16 hex characters
   */
  public static SpanId parse(String hex) {
    if (hex == null) throw new NullPointerException("hex == null");
    if (hex.length() != 16) {
      throw new IllegalArgumentException(hex + " should be a 16 character hex string");
    }
    return new SpanId(HexCodec.hexToUnsignedLong(hex, 0));
  }

  final long value;

  SpanId(long value) {
    this.value = value;
  }

  public long value() {
    return value;
  }

  public boolean isValid() {
    return value != 0L;
  }

  @Override public int compareTo(SpanId that) {
    return Long.compareUnsigned(value, that.value);
  }

  /** Returns 16 lower-hex characters. */
  @Override public String toString() {
    char[] data = new char[16];
    HexCodec.writeHexLong(data, 0, value);
    return new String(data);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanId)) return false;
    return value == ((SpanId) o).value;
  }

  @Override public int hashCode() {
    return Long.hashCode(value);
  }
}
