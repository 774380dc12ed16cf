package se.kth.castor.deepcheck.shape;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.ClassUtils;

/**
 * Classifies runtime values into {@link Shape}s.
 */
public final class Shapes {

  private static final String FUNCTION_PACKAGE = "java.util.function";

  private Shapes() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static Shape of(Object value) {
    if (value == null) {
      return Shape.NIL;
    }
    if (value instanceof Boolean) {
      return Shape.BOOL;
    }
    if (NumericType.isNumeric(value)) {
      return Shape.NUMERIC;
    }
    if (value instanceof String || value instanceof Character) {
      return Shape.TEXT;
    }
    if (value instanceof byte[]) {
      return Shape.RAW_BYTES;
    }
    if (value.getClass().isArray() || value instanceof List<?>) {
      return Shape.SEQUENCE;
    }
    if (value instanceof Map<?, ?> || value instanceof Set<?>) {
      return Shape.ASSOCIATIVE;
    }
    if (value instanceof Queue<?>) {
      return Shape.CHANNEL_LIKE;
    }
    if (value instanceof Optional<?> || value instanceof AtomicReference<?>) {
      return Shape.REFERENCE;
    }
    if (isCallable(value.getClass())) {
      return Shape.CALLABLE;
    }
    if (CompositeTypes.lookup(value.getClass()).isPresent()) {
      return Shape.COMPOSITE;
    }
    return Shape.OPAQUE;
  }

  /**
   * Returns the composite view of a value of shape {@link Shape#COMPOSITE}.
   *
   * @param value the composite value
   * @return its type information
   * @throws IllegalArgumentException if the value is not a composite
   */
  public static CompositeType compositeType(Object value) {
    return CompositeTypes.lookup(value.getClass())
        .orElseThrow(() -> new IllegalArgumentException(
            "Not a composite: " + value.getClass().getName()
        ));
  }

  /**
   * Returns the number of elements or entries of a countable value.
   *
   * @param value a value whose shape is {@link Shape#isCountable() countable}
   * @return the element count
   */
  public static int count(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.size();
    }
    if (value instanceof Map<?, ?> map) {
      return map.size();
    }
    if (value.getClass().isArray()) {
      return Array.getLength(value);
    }
    throw new IllegalArgumentException("Not countable: " + value.getClass().getName());
  }

  private static boolean isCallable(Class<?> type) {
    if (type.isSynthetic() || Method.class.equals(type)) {
      return true;
    }
    if (Runnable.class.isAssignableFrom(type) || Callable.class.isAssignableFrom(type)) {
      return true;
    }
    return ClassUtils.getAllInterfaces(type)
        .stream()
        .anyMatch(it -> it.getPackageName().equals(FUNCTION_PACKAGE));
  }
}
