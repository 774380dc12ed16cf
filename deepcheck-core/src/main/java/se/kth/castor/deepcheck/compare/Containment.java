package se.kth.castor.deepcheck.compare;

import java.util.Collection;
import java.util.Map;
import se.kth.castor.deepcheck.shape.Sequences;
import se.kth.castor.deepcheck.shape.Shapes;

/**
 * Outcome of searching an element in a container.
 */
public enum Containment {
  FOUND,
  NOT_FOUND,
  /**
   * The container is of a shape that can not be searched.
   */
  UNSUPPORTED;

  /**
   * Searches an element. Text is searched for the element's text as a substring, maps are searched
   * by key, and every other container by element. Elements and keys are matched with
   * {@link DeepEquality#equal(Object, Object)}.
   *
   * @param container the container to search
   * @param element the element to find
   * @return the outcome
   */
  public static Containment of(Object container, Object element) {
    return switch (Shapes.of(container)) {
      case TEXT -> fromBoolean(
          (element instanceof String || element instanceof Character)
              && container.toString().contains(element.toString())
      );
      case RAW_BYTES, SEQUENCE -> fromBoolean(sequenceContains(container, element));
      case ASSOCIATIVE -> container instanceof Map<?, ?> map
          ? fromBoolean(collectionContains(map.keySet(), element))
          : fromBoolean(collectionContains((Collection<?>) container, element));
      case CHANNEL_LIKE -> fromBoolean(collectionContains((Collection<?>) container, element));
      default -> UNSUPPORTED;
    };
  }

  public boolean isFound() {
    return this == FOUND;
  }

  private static Containment fromBoolean(boolean found) {
    return found ? FOUND : NOT_FOUND;
  }

  private static boolean sequenceContains(Object sequence, Object element) {
    for (int i = 0; i < Sequences.length(sequence); i++) {
      if (DeepEquality.equal(Sequences.get(sequence, i), element)) {
        return true;
      }
    }
    return false;
  }

  private static boolean collectionContains(Collection<?> collection, Object element) {
    for (Object candidate : collection) {
      if (DeepEquality.equal(candidate, element)) {
        return true;
      }
    }
    return false;
  }
}
