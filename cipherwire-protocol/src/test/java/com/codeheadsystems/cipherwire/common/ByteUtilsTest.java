package com.codeheadsystems.cipherwire.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── Constructor ──────────────────────────────────────────────────────────

  @Test
  void privateConstructorIsInaccessible() throws Exception {
    Constructor<ByteUtils> ctor = ByteUtils.class.getDeclaredConstructor();
    ctor.setAccessible(true);
    ctor.newInstance();
  }

  // ─── concat ───────────────────────────────────────────────────────────────

  @Test
  void concat_noArraysReturnsEmpty() {
    assertThat(ByteUtils.concat()).isEmpty();
  }

  @Test
  void concat_twoArrays() {
    assertThat(ByteUtils.concat(new byte[]{1, 2}, new byte[]{3, 4})).isEqualTo(new byte[]{1, 2, 3, 4});
  }

  @Test
  void concat_emptyArrayAmongOthers() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[0], new byte[]{2})).isEqualTo(new byte[]{1, 2});
  }

  @Test
  void concat_doesNotMutateInputs() {
    byte[] a = {1, 2};
    byte[] result = ByteUtils.concat(a, new byte[]{3});
    result[0] = 99;
    assertThat(a[0]).isEqualTo((byte) 1);
  }

  // ─── slice / tail ─────────────────────────────────────────────────────────

  @Test
  void slice_copiesRange() {
    byte[] src = {0, 1, 2, 3, 4};
    assertThat(ByteUtils.slice(src, 1, 3)).isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void slice_zeroLengthAtEnd() {
    assertThat(ByteUtils.slice(new byte[]{1, 2}, 2, 0)).isEmpty();
  }

  @Test
  void slice_pastEndThrows() {
    assertThatThrownBy(() -> ByteUtils.slice(new byte[]{1, 2}, 1, 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of range");
  }

  @Test
  void slice_negativeOffsetThrows() {
    assertThatThrownBy(() -> ByteUtils.slice(new byte[]{1, 2}, -1, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void tail_returnsTrailingBytes() {
    assertThat(ByteUtils.tail(new byte[]{1, 2, 3, 4}, 2)).isEqualTo(new byte[]{3, 4});
  }

  @Test
  void tail_longerThanSourceThrows() {
    assertThatThrownBy(() -> ByteUtils.tail(new byte[]{1}, 2))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
