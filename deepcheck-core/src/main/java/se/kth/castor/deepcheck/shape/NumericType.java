package se.kth.castor.deepcheck.shape;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * The numeric representations the library knows how to convert between. The size is the width of
 * the representation in bytes; arbitrary precision types are larger than every fixed width type.
 */
public enum NumericType {
  BYTE(Byte.class, 1),
  SHORT(Short.class, 2),
  INT(Integer.class, 4),
  UNSIGNED_INT(UnsignedInteger.class, 4),
  FLOAT(Float.class, 4),
  LONG(Long.class, 8),
  UNSIGNED_LONG(UnsignedLong.class, 8),
  DOUBLE(Double.class, 8),
  BIG_INTEGER(BigInteger.class, 16),
  BIG_DECIMAL(BigDecimal.class, 32);

  private static final ImmutableMap<Class<? extends Number>, NumericType> BY_TYPE =
      Maps.uniqueIndex(Arrays.asList(values()), NumericType::type);

  private final Class<? extends Number> type;
  private final int size;

  NumericType(Class<? extends Number> type, int size) {
    this.type = type;
    this.size = size;
  }

  public Class<? extends Number> type() {
    return type;
  }

  public int size() {
    return size;
  }

  public boolean isFloatingPoint() {
    return this == FLOAT || this == DOUBLE;
  }

  public static Optional<NumericType> of(Class<?> type) {
    return Optional.ofNullable(BY_TYPE.get(type));
  }

  public static boolean isNumeric(Object value) {
    return value != null && of(value.getClass()).isPresent();
  }

  /**
   * Checks whether {@link #convert(Number)} accepts a value. Floating point values must be finite
   * to become an integral or arbitrary precision number, and must lie within the range of an
   * integral target once truncated.
   *
   * @param value the number to convert
   * @return true if the value can be converted to this representation
   */
  public boolean canConvert(Number value) {
    if (isFloatingPoint() || !(value instanceof Double || value instanceof Float)) {
      return true;
    }
    double d = value.doubleValue();
    if (!Double.isFinite(d)) {
      return false;
    }
    return this == BIG_DECIMAL || fits(new BigDecimal(d).toBigInteger());
  }

  /**
   * Converts a number into this representation. Integral sources keep their low order bits when
   * narrowed, floating point sources are truncated toward zero.
   *
   * @param value the number to convert
   * @return the converted number, an instance of {@link #type()}
   * @throws ArithmeticException if {@link #canConvert(Number)} rejects the value
   */
  public Number convert(Number value) {
    if (!canConvert(value)) {
      throw new ArithmeticException(value + " does not fit into " + type.getSimpleName());
    }
    return switch (this) {
      case BYTE -> (byte) integralBits(value);
      case SHORT -> (short) integralBits(value);
      case INT -> (int) integralBits(value);
      case LONG -> integralBits(value);
      case UNSIGNED_INT -> UnsignedInteger.fromIntBits((int) integralBits(value));
      case UNSIGNED_LONG -> UnsignedLong.fromLongBits(integralBits(value));
      case FLOAT -> value.floatValue();
      case DOUBLE -> value.doubleValue();
      case BIG_INTEGER -> toBigInteger(value);
      case BIG_DECIMAL -> toBigDecimal(value);
    };
  }

  /**
   * Compares two numbers of this representation by value.
   *
   * @param a a number of this representation
   * @param b a number of this representation
   * @return true if both denote the same number
   */
  public boolean sameValue(Number a, Number b) {
    return switch (this) {
      case FLOAT, DOUBLE -> a.doubleValue() == b.doubleValue();
      case BIG_DECIMAL -> ((BigDecimal) a).compareTo((BigDecimal) b) == 0;
      default -> a.equals(b);
    };
  }

  private boolean fits(BigInteger integral) {
    return switch (this) {
      case BYTE -> within(integral, Byte.MIN_VALUE, Byte.MAX_VALUE);
      case SHORT -> within(integral, Short.MIN_VALUE, Short.MAX_VALUE);
      case INT -> within(integral, Integer.MIN_VALUE, Integer.MAX_VALUE);
      case LONG -> within(integral, Long.MIN_VALUE, Long.MAX_VALUE);
      case UNSIGNED_INT -> integral.signum() >= 0 && integral.bitLength() <= Integer.SIZE;
      case UNSIGNED_LONG -> integral.signum() >= 0 && integral.bitLength() <= Long.SIZE;
      default -> true;
    };
  }

  private static boolean within(BigInteger value, long min, long max) {
    return value.compareTo(BigInteger.valueOf(min)) >= 0
        && value.compareTo(BigInteger.valueOf(max)) <= 0;
  }

  private static long integralBits(Number value) {
    if (value instanceof Double || value instanceof Float) {
      // finite and in range, see canConvert
      return new BigDecimal(value.doubleValue()).toBigInteger().longValue();
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toBigInteger().longValue();
    }
    // sign extends signed types, zero extends UnsignedInteger, keeps the bits of the rest
    return value.longValue();
  }

  private static BigInteger toBigInteger(Number value) {
    if (value instanceof BigInteger bigInteger) {
      return bigInteger;
    }
    if (value instanceof UnsignedLong unsignedLong) {
      return unsignedLong.bigIntegerValue();
    }
    if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
      return toBigDecimal(value).toBigInteger();
    }
    return BigInteger.valueOf(value.longValue());
  }

  private static BigDecimal toBigDecimal(Number value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof Double || value instanceof Float) {
      return new BigDecimal(value.doubleValue());
    }
    if (value instanceof BigInteger || value instanceof UnsignedLong) {
      return new BigDecimal(toBigInteger(value));
    }
    return BigDecimal.valueOf(value.longValue());
  }
}
