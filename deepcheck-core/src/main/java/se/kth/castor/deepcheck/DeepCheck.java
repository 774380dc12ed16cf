package se.kth.castor.deepcheck;

import java.util.OptionalInt;
import se.kth.castor.deepcheck.compare.Containment;
import se.kth.castor.deepcheck.compare.DeepEquality;
import se.kth.castor.deepcheck.compare.EmptinessClassifier;
import se.kth.castor.deepcheck.compare.NilClassifier;
import se.kth.castor.deepcheck.compare.ValueEquality;
import se.kth.castor.deepcheck.copy.ExportedFieldCopier;
import se.kth.castor.deepcheck.diff.DiffResult;
import se.kth.castor.deepcheck.diff.ListDiffer;
import se.kth.castor.deepcheck.shape.References;
import se.kth.castor.deepcheck.shape.Shape;
import se.kth.castor.deepcheck.shape.Shapes;
import se.kth.castor.deepcheck.util.IncomparableValuesException;

/**
 * Entry point for assertion layers. All methods are pure and safe to call from multiple threads.
 */
public final class DeepCheck {

  private DeepCheck() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static boolean isEmpty(Object value) {
    return EmptinessClassifier.isEmpty(value);
  }

  public static boolean isNil(Object value) {
    return NilClassifier.isNil(value);
  }

  public static boolean isList(Object value) {
    return ListDiffer.isList(value);
  }

  public static boolean equal(Object expected, Object actual) {
    return DeepEquality.equal(expected, actual);
  }

  public static boolean equalValues(Object expected, Object actual) {
    return ValueEquality.equalValues(expected, actual);
  }

  public static Object copyExported(Object value) {
    return ExportedFieldCopier.copyExported(value);
  }

  /**
   * Diffs two lists as multisets. Callers check {@link #isList(Object)} first.
   *
   * @param listA an array or list
   * @param listB an array or list
   * @return the elements only in A and the elements only in B
   * @throws IllegalArgumentException if either argument is not an array or list
   */
  public static DiffResult diffLists(Object listA, Object listB) {
    return ListDiffer.diffLists(listA, listB);
  }

  /**
   * Equality that also demands the exact same runtime class.
   *
   * @param expected the expected value
   * @param actual the actual value
   * @return true if both are {@code null}, or of the same class and equal
   */
  public static boolean exactly(Object expected, Object actual) {
    if (expected == null || actual == null) {
      return expected == actual;
    }
    return expected.getClass() == actual.getClass() && equal(expected, actual);
  }

  public static boolean isType(Class<?> type, Object value) {
    return value != null && value.getClass() == type;
  }

  /**
   * Returns the element count of collection-like values and the character count of text.
   *
   * @param value any value
   * @return the length, or nothing if the value has no length
   */
  public static OptionalInt length(Object value) {
    Shape shape = Shapes.of(value);
    if (shape.isCountable()) {
      return OptionalInt.of(Shapes.count(value));
    }
    if (value instanceof CharSequence text) {
      return OptionalInt.of(text.length());
    }
    if (value instanceof Character) {
      return OptionalInt.of(1);
    }
    return OptionalInt.empty();
  }

  public static Containment contains(Object container, Object element) {
    return Containment.of(container, element);
  }

  /**
   * Checks that two lists contain the same elements, ignoring their order. Two empty values
   * always match, whatever their shape.
   *
   * @param listA an array or list
   * @param listB an array or list
   * @return true if the multiset difference is empty
   * @throws IncomparableValuesException if a non-empty argument is not an array or list
   */
  public static boolean elementsMatch(Object listA, Object listB)
      throws IncomparableValuesException {
    if (isEmpty(listA) && isEmpty(listB)) {
      return true;
    }
    if (!isList(listA) || !isList(listB)) {
      throw new IncomparableValuesException(
          "Expected two arrays or lists",
          typeOf(listA),
          typeOf(listB)
      );
    }
    return diffLists(listA, listB).isEmpty();
  }

  /**
   * Compares two composites (or references to composites) of the same class by their exported
   * fields only.
   *
   * @param expected the expected value
   * @param actual the actual value
   * @return true if the exported fields are equal, allowing differing numeric representations
   * @throws IncomparableValuesException if the classes differ or are not composites
   */
  public static boolean equalExportedValues(Object expected, Object actual)
      throws IncomparableValuesException {
    if (expected == null || actual == null || expected.getClass() != actual.getClass()) {
      throw new IncomparableValuesException(
          "Types expected to match exactly",
          typeOf(expected),
          typeOf(actual)
      );
    }
    if (!isCompositeOrReferenceToComposite(expected)
        || !isCompositeOrReferenceToComposite(actual)) {
      throw new IncomparableValuesException(
          "Types expected to both be composites or references to composites",
          typeOf(expected),
          typeOf(actual)
      );
    }

    return equalValues(copyExported(expected), copyExported(actual));
  }

  private static boolean isCompositeOrReferenceToComposite(Object value) {
    Shape shape = Shapes.of(value);
    if (shape == Shape.REFERENCE) {
      return Shapes.of(References.referent(value)) == Shape.COMPOSITE;
    }
    return shape == Shape.COMPOSITE;
  }

  private static Class<?> typeOf(Object value) {
    return value == null ? null : value.getClass();
  }
}
