package se.kth.castor.deepcheck.compare;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import se.kth.castor.deepcheck.shape.NumericType;

/**
 * The conversions {@link ValueEquality} may apply to an expected value before comparing it.
 */
public final class Conversions {

  private Conversions() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Checks if values of one class can be converted to another class. Numbers convert into every
   * other numeric representation, strings convert to and from {@code byte[]} (UTF-8) and
   * {@code char[]}, characters convert to strings, and every class converts to its supertypes.
   *
   * @param from the source class
   * @param to the target class
   * @return true if {@link #convert(Object, Class)} can be used
   */
  public static boolean isConvertible(Class<?> from, Class<?> to) {
    if (to.isAssignableFrom(from)) {
      return true;
    }
    if (NumericType.of(from).isPresent() && NumericType.of(to).isPresent()) {
      return true;
    }
    if (from == String.class) {
      return to == byte[].class || to == char[].class;
    }
    if (to == String.class) {
      return from == byte[].class || from == char[].class || from == Character.class;
    }
    return false;
  }

  /**
   * Converts a value to another class.
   *
   * @param value the value to convert
   * @param to the target class
   * @return the converted value, an instance of {@code to}
   * @throws IllegalArgumentException if the value is not {@link #isConvertible(Class, Class)
   *     convertible}
   */
  public static Object convert(Object value, Class<?> to) {
    Class<?> from = value.getClass();
    if (to.isAssignableFrom(from)) {
      return value;
    }

    Optional<NumericType> numericTarget = NumericType.of(to);
    if (numericTarget.isPresent() && value instanceof Number number) {
      return numericTarget.get().convert(number);
    }

    if (value instanceof String string) {
      if (to == byte[].class) {
        return string.getBytes(StandardCharsets.UTF_8);
      }
      if (to == char[].class) {
        return string.toCharArray();
      }
    }
    if (to == String.class) {
      if (value instanceof byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
      }
      if (value instanceof char[] chars) {
        return new String(chars);
      }
      if (value instanceof Character character) {
        return character.toString();
      }
    }

    throw new IllegalArgumentException(
        "Can not convert " + from.getName() + " to " + to.getName()
    );
  }
}
