package se.kth.castor.deepcheck.compare;

import se.kth.castor.deepcheck.shape.References;
import se.kth.castor.deepcheck.shape.Shape;
import se.kth.castor.deepcheck.shape.Shapes;

/**
 * Decides whether a value is a reference that points to nothing.
 */
public final class NilClassifier {

  private NilClassifier() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Only the outermost reference is inspected: an {@code Optional} holding an empty composite is
   * not nil. Values whose shape has no notion of nil are never nil.
   *
   * @param value any value
   * @return true if the value is {@code null} or an empty reference holder
   */
  public static boolean isNil(Object value) {
    Shape shape = Shapes.of(value);
    return switch (shape) {
      case NIL -> true;
      case REFERENCE -> References.pointsToNothing(value);
      default -> false;
    };
  }
}
