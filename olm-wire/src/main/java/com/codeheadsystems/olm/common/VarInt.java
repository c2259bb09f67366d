package com.codeheadsystems.olm.common;

/**
 * Unsigned variable-length integer encoder.
 * <p>
 * Each output byte carries seven value bits, least significant group first. Every byte except the last has the
 * continuation bit ({@code 0x80}) set. Zero encodes to a single {@code 0x00} byte.
 * <p>
 * Only the encode direction exists here. Reading integers back is done by the structured decoder.
 */
public class VarInt {

  /**
   * Continuation bit.
   */
  public static final int MSB = 0x80;

  /**
   * Longest encoding of a 64-bit value.
   */
  public static final int MAX_LENGTH = 10;

  private VarInt() {
  }

  /**
   * Number of bytes {@link #encode(long)} produces for the value, read as unsigned.
   *
   * @param value the value
   * @return the encoded length, between 1 and 10
   */
  public static int encodedLength(long value) {
    if (value == 0) {
      return 1;
    }
    int length = 0;
    long v = value;
    while (v != 0) {
      length++;
      v >>>= 7;
    }
    return length;
  }

  /**
   * Encodes the value as an unsigned 64-bit varint.
   *
   * @param value the value, read as unsigned
   * @return the byte [ ]
   */
  public static byte[] encode(long value) {
    byte[] out = new byte[encodedLength(value)];
    long n = value;
    int i = 0;
    // unsigned compare: n >= 0x80
    while (Long.compareUnsigned(n, MSB) >= 0) {
      out[i++] = (byte) (MSB | (n & 0x7F));
      n >>>= 7;
    }
    out[i] = (byte) n;
    return out;
  }

  /**
   * Encodes a length or count.
   *
   * @param value the value
   * @return the byte [ ]
   * @throws IllegalArgumentException if the value is negative
   */
  public static byte[] encode(int value) {
    if (value < 0) {
      throw new IllegalArgumentException("Cannot varint-encode a negative length: " + value);
    }
    return encode((long) value);
  }
}
