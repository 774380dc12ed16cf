package se.kth.castor.deepcheck.compare;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;
import se.kth.castor.deepcheck.shape.CompositeType;
import se.kth.castor.deepcheck.shape.FieldDescriptor;
import se.kth.castor.deepcheck.shape.References;
import se.kth.castor.deepcheck.shape.Sequences;
import se.kth.castor.deepcheck.shape.Shape;
import se.kth.castor.deepcheck.shape.Shapes;

/**
 * Deep structural equality without any type coercion.
 */
public final class DeepEquality {

  private DeepEquality() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Determines if two values are structurally equal.
   * <p>
   * {@code null} only equals {@code null}. Byte arrays are compared byte for byte and never equal
   * anything that is not a byte array. Everything else must have the same shape and type, and
   * recursively equal contents. Composites are compared field by field, including fields that are
   * not exported.
   *
   * @param expected the expected value
   * @param actual the actual value
   * @return true if both are equal
   */
  public static boolean equal(Object expected, Object actual) {
    if (expected == null || actual == null) {
      return expected == actual;
    }

    if (expected instanceof byte[] expectedBytes) {
      if (!(actual instanceof byte[] actualBytes)) {
        return false;
      }
      return Arrays.equals(expectedBytes, actualBytes);
    }

    Shape shape = Shapes.of(expected);
    if (shape != Shapes.of(actual)) {
      return false;
    }

    return switch (shape) {
      case NIL -> true;
      case BOOL, TEXT, OPAQUE -> sameClass(expected, actual) && expected.equals(actual);
      case NUMERIC -> sameClass(expected, actual) && numbersEqual(expected, actual);
      case RAW_BYTES -> Arrays.equals((byte[]) expected, (byte[]) actual);
      case SEQUENCE -> sequencesEqual(expected, actual);
      case ASSOCIATIVE -> associativesEqual(expected, actual);
      case CHANNEL_LIKE -> sameClass(expected, actual)
          && iterablesEqual((Collection<?>) expected, (Collection<?>) actual);
      case REFERENCE -> sameClass(expected, actual)
          && equal(References.referent(expected), References.referent(actual));
      case CALLABLE -> expected == actual;
      case COMPOSITE -> sameClass(expected, actual) && compositesEqual(expected, actual);
    };
  }

  private static boolean sameClass(Object a, Object b) {
    return a.getClass() == b.getClass();
  }

  private static boolean numbersEqual(Object a, Object b) {
    if (a instanceof Double || a instanceof Float) {
      double x = ((Number) a).doubleValue();
      double y = ((Number) b).doubleValue();
      // NaN equals itself so equality stays reflexive
      return x == y || (Double.isNaN(x) && Double.isNaN(y));
    }
    // BigDecimal equality is scale sensitive, 1.0 is not 1.00
    return a.equals(b);
  }

  private static boolean sequencesEqual(Object a, Object b) {
    boolean aIsArray = a.getClass().isArray();
    boolean bIsArray = b.getClass().isArray();
    if (aIsArray != bIsArray) {
      return false;
    }
    if (aIsArray && a.getClass().getComponentType() != b.getClass().getComponentType()) {
      return false;
    }

    int length = Sequences.length(a);
    if (length != Sequences.length(b)) {
      return false;
    }
    for (int i = 0; i < length; i++) {
      if (!equal(Sequences.get(a, i), Sequences.get(b, i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean associativesEqual(Object a, Object b) {
    if (a instanceof Map<?, ?> aMap && b instanceof Map<?, ?> bMap) {
      if (aMap.size() != bMap.size()) {
        return false;
      }
      // keys are looked up by iteration, lookups of the map itself may throw for null or
      // incomparable keys
      List<Map.Entry<?, ?>> bEntries = new ArrayList<>(bMap.entrySet());
      return DeepEquality.<Map.Entry<?, ?>, Map.Entry<?, ?>>matchAll(
          aMap.entrySet(),
          bEntries,
          (aEntry, bEntry) -> Objects.equals(aEntry.getKey(), bEntry.getKey())
              && equal(aEntry.getValue(), bEntry.getValue())
      );
    }

    if (a instanceof Set<?> aSet && b instanceof Set<?> bSet) {
      if (aSet.size() != bSet.size()) {
        return false;
      }
      return DeepEquality.<Object, Object>matchAll(
          aSet,
          new ArrayList<Object>(bSet),
          DeepEquality::equal
      );
    }

    return false;
  }

  /**
   * Pairs every element of {@code as} with a distinct element of {@code bs}. Each element of
   * {@code bs} is used at most once.
   */
  private static <A, B> boolean matchAll(
      Collection<? extends A> as,
      List<? extends B> bs,
      BiPredicate<A, B> matches
  ) {
    boolean[] used = new boolean[bs.size()];
    for (A a : as) {
      boolean found = false;
      for (int j = 0; j < bs.size(); j++) {
        if (!used[j] && matches.test(a, bs.get(j))) {
          used[j] = true;
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return true;
  }

  private static boolean iterablesEqual(Collection<?> a, Collection<?> b) {
    if (a.size() != b.size()) {
      return false;
    }
    Iterator<?> aIterator = a.iterator();
    Iterator<?> bIterator = b.iterator();
    while (aIterator.hasNext() && bIterator.hasNext()) {
      if (!equal(aIterator.next(), bIterator.next())) {
        return false;
      }
    }
    return aIterator.hasNext() == bIterator.hasNext();
  }

  private static boolean compositesEqual(Object a, Object b) {
    CompositeType type = Shapes.compositeType(a);
    for (FieldDescriptor field : type.fields()) {
      if (!equal(field.read(a), field.read(b))) {
        return false;
      }
    }
    return true;
  }
}
