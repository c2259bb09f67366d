package com.codeheadsystems.olm.model;

import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.util.encoders.Hex;

/**
 * A Curve25519 public key: exactly {@value #KEY_LENGTH} raw bytes. No curve arithmetic happens here.
 */
public record Curve25519PublicKey(byte[] keyBytes) {

  /**
   * Raw public key length.
   */
  public static final int KEY_LENGTH = 32;

  /**
   * Validates the length and takes a private copy.
   */
  public Curve25519PublicKey {
    if (keyBytes == null || keyBytes.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Curve25519 public key must be " + KEY_LENGTH + " bytes, got "
          + (keyBytes == null ? "null" : keyBytes.length));
    }
    keyBytes = keyBytes.clone();
  }

  /**
   * Builds a key from exactly 32 raw bytes.
   *
   * @param bytes the bytes
   * @return the curve 25519 public key
   */
  public static Curve25519PublicKey fromBytes(byte[] bytes) {
    return new Curve25519PublicKey(bytes);
  }

  /**
   * Builds a key from its unpadded base64 form, as Olm publishes identity and one-time keys.
   *
   * @param base64 the base 64
   * @return the curve 25519 public key
   */
  public static Curve25519PublicKey fromBase64(String base64) {
    return new Curve25519PublicKey(Base64.getDecoder().decode(base64));
  }

  @Override
  public byte[] keyBytes() {
    return keyBytes.clone();
  }

  public byte[] toBytes() {
    return keyBytes.clone();
  }

  public String toBase64() {
    return Base64.getEncoder().withoutPadding().encodeToString(keyBytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Curve25519PublicKey other && Arrays.equals(keyBytes, other.keyBytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(keyBytes);
  }

  @Override
  public String toString() {
    return "Curve25519PublicKey[" + Hex.toHexString(keyBytes) + "]";
  }
}
