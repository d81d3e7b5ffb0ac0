/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.internal;

/** Fixed-width hex encoding of identifier halves. */
public final class HexCodec {
  static final char[] HEX_DIGITS = {
    '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
  };

  /**
   * Parses exactly 16 hex characters of {@code hex}, starting at {@code index}, into an unsigned
   * long. Upper-case digits are accepted.
   *
   * @throws IllegalArgumentException if the range holds a non-hex character or is too short
   */
  public static long hexToUnsignedLong(String hex, int index) {
    if (index < 0 || index + 16 > hex.length()) throw notHex(hex);
    long result = 0;
    for (int endIndex = index + 16; index < endIndex; index++) {
      char c = hex.charAt(index);
      result <<= 4;
      if (c >= '0' && c <= '9') {
        result |= c - '0';
      } else if (c >= 'a' && c <= 'f') {
        result |= c - 'a' + 10;
      } else if (c >= 'A' && c <= 'F') {
        result |= c - 'A' + 10;
      } else {
        throw notHex(hex);
      }
    }
    return result;
  }

  /** Writes {@code v} as 16 lower-hex characters into {@code data} at {@code pos}. */
  public static void writeHexLong(char[] data, int pos, long v) {
    for (int shift = 60; shift >= 0; shift -= 4) {
      data[pos++] = HEX_DIGITS[(int) (v >>> shift) & 0xf];
    }
  }

  static IllegalArgumentException notHex(String hex) {
    return new IllegalArgumentException(hex + " is not a fixed-width hex identifier");
  }

  HexCodec() {
  }
}
