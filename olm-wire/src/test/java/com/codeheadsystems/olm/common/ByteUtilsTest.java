package com.codeheadsystems.olm.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── concat ───────────────────────────────────────────────────────────────

  @Test
  void concat_noArraysReturnsEmpty() {
    assertThat(ByteUtils.concat()).isEmpty();
  }

  @Test
  void concat_threeArrays() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[]{2}, new byte[]{3})).isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void concat_emptyArrayAmongOthers() {
    assertThat(ByteUtils.concat(new byte[]{1, 2}, new byte[0], new byte[]{3, 4}))
        .isEqualTo(new byte[]{1, 2, 3, 4});
  }

  @Test
  void concat_doesNotMutateInputs() {
    byte[] a = {1, 2};
    byte[] result = ByteUtils.concat(a, new byte[]{3, 4});
    result[0] = 99;
    assertThat(a[0]).isEqualTo((byte) 1);
  }

  // ─── slice ────────────────────────────────────────────────────────────────

  @Test
  void slice_copiesRange() {
    byte[] data = {0, 1, 2, 3, 4};
    assertThat(ByteUtils.slice(data, 1, 3)).isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void slice_emptyAtEnd() {
    assertThat(ByteUtils.slice(new byte[]{1, 2}, 2, 0)).isEmpty();
  }

  @Test
  void slice_pastEnd_throwsIAE() {
    assertThatThrownBy(() -> ByteUtils.slice(new byte[4], 2, 3))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of bounds");
  }

  @Test
  void slice_negativeOffset_throwsIAE() {
    assertThatThrownBy(() -> ByteUtils.slice(new byte[4], -1, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
