package se.kth.castor.deepcheck.util;

/**
 * Thrown when two values can not be compared by the requested check at all, for example because
 * one of them is not a list.
 */
public class IncomparableValuesException extends Exception {

  private final Class<?> expectedType;
  private final Class<?> actualType;

  public IncomparableValuesException(String reason, Class<?> expectedType, Class<?> actualType) {
    super(reason + " (" + typeName(expectedType) + ", " + typeName(actualType) + ")");
    this.expectedType = expectedType;
    this.actualType = actualType;
  }

  /**
   * @return the runtime class of the expected value, {@code null} if it was {@code null}
   */
  public Class<?> getExpectedType() {
    return expectedType;
  }

  /**
   * @return the runtime class of the actual value, {@code null} if it was {@code null}
   */
  public Class<?> getActualType() {
    return actualType;
  }

  private static String typeName(Class<?> type) {
    return type == null ? "null" : type.getName();
  }
}
