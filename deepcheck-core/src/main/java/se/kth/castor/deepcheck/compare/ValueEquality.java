package se.kth.castor.deepcheck.compare;

import java.util.Optional;
import se.kth.castor.deepcheck.shape.NumericType;

/**
 * Equality that looks through differing numeric representations and the conversions of
 * {@link Conversions}.
 */
public final class ValueEquality {

  private ValueEquality() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Determines if two values are equal, or equal after converting the expected value.
   * <p>
   * Two numbers are compared after converting the one with the smaller representation to the type
   * of the larger one, so a truncating conversion can never make different numbers equal. On a tie
   * the actual value is converted to the expected value's type.
   *
   * @param expected the expected value
   * @param actual the actual value
   * @return true if both are equal
   */
  public static boolean equalValues(Object expected, Object actual) {
    if (DeepEquality.equal(expected, actual)) {
      return true;
    }
    if (expected == null || actual == null) {
      return false;
    }

    Class<?> expectedType = expected.getClass();
    Class<?> actualType = actual.getClass();
    if (!Conversions.isConvertible(expectedType, actualType)) {
      return false;
    }

    Optional<NumericType> expectedNumeric = NumericType.of(expectedType);
    Optional<NumericType> actualNumeric = NumericType.of(actualType);
    if (expectedNumeric.isEmpty() || actualNumeric.isEmpty()) {
      return DeepEquality.equal(Conversions.convert(expected, actualType), actual);
    }

    // both numeric, always widen and never narrow
    if (expectedNumeric.get().size() >= actualNumeric.get().size()) {
      return sameAfterConversion(expectedNumeric.get(), (Number) actual, (Number) expected);
    }
    return sameAfterConversion(actualNumeric.get(), (Number) expected, (Number) actual);
  }

  private static boolean sameAfterConversion(NumericType target, Number converted, Number other) {
    if (!target.canConvert(converted)) {
      return false;
    }
    return target.sameValue(target.convert(converted), other);
  }
}
