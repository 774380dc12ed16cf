package se.kth.castor.deepcheck.compare;

import com.google.common.base.Defaults;
import se.kth.castor.deepcheck.shape.CompositeType;
import se.kth.castor.deepcheck.shape.FieldDescriptor;
import se.kth.castor.deepcheck.shape.NumericType;
import se.kth.castor.deepcheck.shape.References;
import se.kth.castor.deepcheck.shape.Shapes;

/**
 * Decides whether a value is empty for its shape.
 */
public final class EmptinessClassifier {

  private EmptinessClassifier() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * A value is empty if it is {@code null}, a collection-like value without elements, a reference
   * that points to nothing or to an empty value, or a scalar or composite that equals the zero
   * value of its type.
   *
   * @param value any value
   * @return true if the value is empty
   */
  public static boolean isEmpty(Object value) {
    return switch (Shapes.of(value)) {
      case NIL -> true;
      case RAW_BYTES, SEQUENCE, ASSOCIATIVE, CHANNEL_LIKE -> Shapes.count(value) == 0;
      case REFERENCE -> References.pointsToNothing(value)
          || isEmpty(References.referent(value));
      case BOOL -> !((Boolean) value);
      case NUMERIC -> isZeroNumber((Number) value);
      case TEXT -> value instanceof Character character
          ? character.charValue() == '\0'
          : ((String) value).isEmpty();
      case COMPOSITE -> isZeroComposite(value);
      // the zero value of these is null
      case CALLABLE, OPAQUE -> false;
    };
  }

  private static boolean isZeroNumber(Number value) {
    NumericType type = NumericType.of(value.getClass()).orElseThrow();
    return type.sameValue(value, type.convert(0));
  }

  private static boolean isZeroComposite(Object value) {
    CompositeType type = Shapes.compositeType(value);
    for (FieldDescriptor field : type.fields()) {
      Object zero = Defaults.defaultValue(field.type());
      if (!DeepEquality.equal(zero, field.read(value))) {
        return false;
      }
    }
    return true;
  }
}
