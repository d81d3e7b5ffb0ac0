/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import hindsight.internal.HexCodec;

/**
 * A 128-bit trace identifier, shared by every span in a trace. Equality is by value, so two
 * instances built from the same bytes are interchangeable as map keys.
 *
 * <p>The all-zero value is reserved as invalid: {@link #isValid()} returns false and storage
 * rejects spans that carry it.
 */
// @Immutable
public final class TraceId implements Comparable<TraceId> {
  public static TraceId create(long high, long low) {
    return new TraceId(high, low);
  }

  /**
   * Parses a 32 character hex string, as written by {@link #toString()}.
   *
   * @throws IllegalArgumentException if the input isn't 32 hex characters
   */
  public static TraceId parse(String hex) {
    if (hex == null) throw new NullPointerException("hex == null");
    if (hex.length() != 32) {
      throw new IllegalArgumentException(hex + " should be a 32 character hex string");
    }
    return new TraceId(HexCodec.hexToUnsignedLong(hex, 0), HexCodec.hexToUnsignedLong(hex, 16));
  }

  /** Reads 16 big-endian bytes. */
  public static TraceId fromBytes(byte[] bytes) {
    if (bytes == null) throw new NullPointerException("bytes == null");
    if (bytes.length != 16) throw new IllegalArgumentException("bytes.length != 16");
    long high = 0, low = 0;
    for (int i = 0; i < 8; i++) {
      high = (high << 8) | (bytes[i] & 0xff);
      low = (low << 8) | (bytes[i + 8] & 0xff);
    }
    return new TraceId(high, low);
  }

  final long high, low;

  TraceId(long high, long low) {
    this.high = high;
    this.low = low;
  }

  /** The upper 64 bits. */
  public long high() {
    return high;
  }

  /** The lower 64 bits. */
  public long low() {
    return low;
  }

  public boolean isValid() {
    return (high | low) != 0L;
  }

  public byte[] toBytes() {
    byte[] result = new byte[16];
    for (int i = 7; i >= 0; i--) {
      result[i] = (byte) (high >>> (8 * (7 - i)));
      result[i + 8] = (byte) (low >>> (8 * (7 - i)));
    }
    return result;
  }

  /** Unsigned ordering, which matches the ordering of the hex form. */
  @Override public int compareTo(TraceId that) {
    int result = Long.compareUnsigned(high, that.high);
    if (result != 0) return result;
    return Long.compareUnsigned(low, that.low);
  }

  /** Returns 32 lower-hex characters. */
  @Override public String toString() {
    char[] data = new char[32];
    HexCodec.writeHexLong(data, 0, high);
    HexCodec.writeHexLong(data, 16, low);
    return new String(data);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceId)) return false;
    TraceId that = (TraceId) o;
    return high == that.high && low == that.low;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) (high ^ (high >>> 32));
    h *= 1000003;
    h ^= (int) (low ^ (low >>> 32));
    return h;
  }
}
