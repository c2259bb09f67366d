package com.codeheadsystems.olm.model;

import java.util.Arrays;

/**
 * A full HMAC-SHA-256 output computed by the ratchet layer. Messages carry only its first
 * {@value #TRUNCATED_LENGTH} bytes.
 */
public record Mac(byte[] macBytes) {

  /**
   * Full MAC length.
   */
  public static final int LENGTH = 32;

  /**
   * Length of the tag written on the wire.
   */
  public static final int TRUNCATED_LENGTH = 8;

  /**
   * Validates the length and takes a private copy.
   */
  public Mac {
    if (macBytes == null || macBytes.length != LENGTH) {
      throw new IllegalArgumentException("MAC must be " + LENGTH + " bytes, got "
          + (macBytes == null ? "null" : macBytes.length));
    }
    macBytes = macBytes.clone();
  }

  @Override
  public byte[] macBytes() {
    return macBytes.clone();
  }

  /**
   * The wire tag: the first {@value #TRUNCATED_LENGTH} bytes of the MAC.
   *
   * @return the byte [ ]
   */
  public byte[] truncate() {
    return Arrays.copyOf(macBytes, TRUNCATED_LENGTH);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Mac other && org.bouncycastle.util.Arrays.constantTimeAreEqual(macBytes, other.macBytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(macBytes);
  }

  @Override
  public String toString() {
    return "Mac[redacted]";
  }
}
