package com.codeheadsystems.olm.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class VarIntTest {

  // --- encode ---

  @Test
  void encode_zero_isSingleZeroByte() {
    assertThat(VarInt.encode(0L)).isEqualTo(new byte[]{0x00});
  }

  @Test
  void encode_oneByteMax() {
    assertThat(VarInt.encode(127L)).isEqualTo(new byte[]{0x7F});
  }

  @Test
  void encode_128_setsContinuationBit() {
    assertThat(VarInt.encode(128L)).isEqualTo(new byte[]{(byte) 0x80, 0x01});
  }

  @Test
  void encode_300_lowGroupFirst() {
    // 300 = 0b10_0101100 -> 0xAC 0x02
    assertThat(VarInt.encode(300L)).isEqualTo(new byte[]{(byte) 0xAC, 0x02});
  }

  @Test
  void encode_unsignedMax_isTenBytes() {
    byte[] encoded = VarInt.encode(-1L);
    assertThat(encoded).hasSize(10);
    for (int i = 0; i < 9; i++) {
      assertThat(encoded[i]).isEqualTo((byte) 0xFF);
    }
    assertThat(encoded[9]).isEqualTo((byte) 0x01);
  }

  @Test
  void encode_onlyLastByteLacksContinuationBit() {
    byte[] encoded = VarInt.encode(1L << 40);
    for (int i = 0; i < encoded.length - 1; i++) {
      assertThat(encoded[i] & VarInt.MSB).isEqualTo(VarInt.MSB);
    }
    assertThat(encoded[encoded.length - 1] & VarInt.MSB).isZero();
  }

  @Test
  void encode_intOverload_matchesLong() {
    assertThat(VarInt.encode(32)).isEqualTo(VarInt.encode(32L));
  }

  @Test
  void encode_negativeInt_throwsIAE() {
    assertThatThrownBy(() -> VarInt.encode(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  // --- encodedLength ---

  static Stream<Arguments> lengths() {
    return Stream.of(
        Arguments.of(0L, 1),
        Arguments.of(1L, 1),
        Arguments.of(127L, 1),
        Arguments.of(128L, 2),
        Arguments.of(16383L, 2),
        Arguments.of(16384L, 3),
        Arguments.of(Long.MAX_VALUE, 9),
        Arguments.of(Long.MIN_VALUE, 10),
        Arguments.of(-1L, 10)
    );
  }

  @ParameterizedTest
  @MethodSource("lengths")
  void encodedLength_matchesEncoding(long value, int expected) {
    assertThat(VarInt.encodedLength(value)).isEqualTo(expected);
    assertThat(VarInt.encode(value)).hasSize(expected);
  }
}
