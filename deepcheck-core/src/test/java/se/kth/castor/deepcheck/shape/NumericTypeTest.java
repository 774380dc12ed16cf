package se.kth.castor.deepcheck.shape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class NumericTypeTest {

  @Test
  void testLookup() {
    assertThat(NumericType.of(Integer.class)).contains(NumericType.INT);
    assertThat(NumericType.of(UnsignedLong.class)).contains(NumericType.UNSIGNED_LONG);
    assertThat(NumericType.of(AtomicInteger.class)).isEmpty();
    assertThat(NumericType.of(String.class)).isEmpty();
  }

  @Test
  void testNarrowingKeepsLowOrderBits() {
    assertThat(NumericType.BYTE.convert(300)).isEqualTo((byte) 44);
    assertThat(NumericType.SHORT.convert(70000L)).isEqualTo((short) 4464);
    assertThat(NumericType.INT.convert(UnsignedInteger.MAX_VALUE)).isEqualTo(-1);
  }

  @Test
  void testSignedValuesSignExtendIntoUnsigned() {
    assertThat(NumericType.UNSIGNED_INT.convert(-1)).isEqualTo(UnsignedInteger.MAX_VALUE);
    assertThat(NumericType.UNSIGNED_INT.convert((byte) -1)).isEqualTo(UnsignedInteger.MAX_VALUE);
    assertThat(NumericType.UNSIGNED_LONG.convert(-1L)).isEqualTo(UnsignedLong.MAX_VALUE);
  }

  @Test
  void testUnsignedValuesZeroExtend() {
    assertThat(NumericType.LONG.convert(UnsignedInteger.MAX_VALUE)).isEqualTo(4294967295L);
    assertThat(NumericType.BIG_INTEGER.convert(UnsignedLong.MAX_VALUE))
        .isEqualTo(new BigInteger("18446744073709551615"));
    assertThat(NumericType.DOUBLE.convert(UnsignedInteger.MAX_VALUE)).isEqualTo(4294967295.0);
  }

  @Test
  void testFloatingPointTruncatesTowardZero() {
    assertThat(NumericType.INT.convert(3.9)).isEqualTo(3);
    assertThat(NumericType.INT.convert(-3.9)).isEqualTo(-3);
    assertThat(NumericType.BIG_INTEGER.convert(2.5f)).isEqualTo(BigInteger.TWO);
    assertThat(NumericType.BIG_DECIMAL.convert(0.5)).isEqualTo(new BigDecimal("0.5"));
  }

  @Test
  void testNonFiniteValuesOnlyConvertToFloatingPoint() {
    assertThat(NumericType.BIG_DECIMAL.canConvert(Double.NaN)).isFalse();
    assertThat(NumericType.BIG_INTEGER.canConvert(Float.POSITIVE_INFINITY)).isFalse();
    assertThat(NumericType.BIG_INTEGER.canConvert(1.0)).isTrue();
    assertThat(NumericType.LONG.canConvert(Double.NaN)).isFalse();
    assertThat(NumericType.INT.canConvert(Float.NEGATIVE_INFINITY)).isFalse();
    assertThat(NumericType.FLOAT.canConvert(Double.NaN)).isTrue();
  }

  @Test
  void testFloatingPointOutOfRangeIsRejected() {
    assertThat(NumericType.LONG.canConvert(0x1p64)).isFalse();
    assertThat(NumericType.LONG.canConvert(0x1p62)).isTrue();
    assertThat(NumericType.INT.canConvert(3.0e9)).isFalse();
    assertThat(NumericType.BYTE.canConvert(127.9)).isTrue();
    assertThat(NumericType.BYTE.canConvert(128.0)).isFalse();
    assertThat(NumericType.UNSIGNED_INT.canConvert(-1.0f)).isFalse();
    assertThat(NumericType.UNSIGNED_INT.canConvert(-0.5f)).isTrue();
    assertThat(NumericType.UNSIGNED_LONG.canConvert(0x1p63)).isTrue();
    assertThat(NumericType.UNSIGNED_LONG.canConvert(0x1p64)).isFalse();
    assertThat(NumericType.BIG_INTEGER.canConvert(0x1p64)).isTrue();
    // integral sources narrow by keeping their low order bits
    assertThat(NumericType.BYTE.canConvert(300)).isTrue();
  }

  @Test
  void testConvertRejectsWhatCanNotBeConverted() {
    assertThatThrownBy(() -> NumericType.LONG.convert(Double.NaN))
        .isInstanceOf(ArithmeticException.class);
    assertThatThrownBy(() -> NumericType.UNSIGNED_LONG.convert(0x1p64))
        .isInstanceOf(ArithmeticException.class);
    assertThat(NumericType.UNSIGNED_LONG.convert(0x1p63))
        .isEqualTo(UnsignedLong.fromLongBits(Long.MIN_VALUE));
  }

  @Test
  void testSameValue() {
    assertThat(NumericType.DOUBLE.sameValue(0.0, -0.0)).isTrue();
    assertThat(NumericType.DOUBLE.sameValue(Double.NaN, Double.NaN)).isFalse();
    assertThat(NumericType.BIG_DECIMAL.sameValue(new BigDecimal("1.0"), new BigDecimal("1.00")))
        .isTrue();
    assertThat(NumericType.LONG.sameValue(1L, 2L)).isFalse();
  }

  @Test
  void testSizes() {
    assertThat(NumericType.BYTE.size()).isLessThan(NumericType.SHORT.size());
    assertThat(NumericType.INT.size()).isEqualTo(NumericType.FLOAT.size());
    assertThat(NumericType.UNSIGNED_LONG.size()).isEqualTo(NumericType.LONG.size());
    assertThat(NumericType.BIG_INTEGER.size()).isLessThan(NumericType.BIG_DECIMAL.size());
    assertThat(NumericType.DOUBLE.isFloatingPoint()).isTrue();
    assertThat(NumericType.BIG_DECIMAL.isFloatingPoint()).isFalse();
  }
}
