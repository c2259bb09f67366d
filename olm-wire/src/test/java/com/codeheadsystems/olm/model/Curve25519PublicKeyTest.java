package com.codeheadsystems.olm.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class Curve25519PublicKeyTest {

  private static byte[] filled(int length, int value) {
    byte[] bytes = new byte[length];
    Arrays.fill(bytes, (byte) value);
    return bytes;
  }

  @Test
  void fromBytes_keepsBytes() {
    byte[] raw = filled(32, 0x11);
    assertThat(Curve25519PublicKey.fromBytes(raw).toBytes()).isEqualTo(raw);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 31, 33, 64})
  void fromBytes_wrongLength_throwsIAE(int length) {
    assertThatThrownBy(() -> Curve25519PublicKey.fromBytes(new byte[length]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be 32 bytes, got " + length);
  }

  @Test
  void fromBytes_null_throwsIAE() {
    assertThatThrownBy(() -> Curve25519PublicKey.fromBytes(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_copiesInput() {
    byte[] raw = filled(32, 0x22);
    Curve25519PublicKey key = Curve25519PublicKey.fromBytes(raw);
    raw[0] = 0;
    assertThat(key.toBytes()[0]).isEqualTo((byte) 0x22);
  }

  @Test
  void accessor_returnsCopy() {
    Curve25519PublicKey key = Curve25519PublicKey.fromBytes(filled(32, 0x33));
    key.keyBytes()[0] = 0;
    assertThat(key.keyBytes()[0]).isEqualTo((byte) 0x33);
  }

  @Test
  void base64_isUnpaddedAndRoundTrips() {
    Curve25519PublicKey key = Curve25519PublicKey.fromBytes(filled(32, 0x44));
    String encoded = key.toBase64();
    assertThat(encoded).hasSize(43).doesNotContain("=");
    assertThat(Curve25519PublicKey.fromBase64(encoded)).isEqualTo(key);
  }

  @Test
  void equals_comparesContent() {
    assertThat(Curve25519PublicKey.fromBytes(filled(32, 1)))
        .isEqualTo(Curve25519PublicKey.fromBytes(filled(32, 1)))
        .hasSameHashCodeAs(Curve25519PublicKey.fromBytes(filled(32, 1)))
        .isNotEqualTo(Curve25519PublicKey.fromBytes(filled(32, 2)));
  }

  @Test
  void toString_isHex() {
    assertThat(Curve25519PublicKey.fromBytes(filled(32, 0xAB)).toString()).contains("abababab");
  }
}
