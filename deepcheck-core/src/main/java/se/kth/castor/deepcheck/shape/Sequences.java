package se.kth.castor.deepcheck.shape;

import java.lang.reflect.Array;
import java.util.List;

/**
 * Index based access to arrays and lists.
 */
public final class Sequences {

  private Sequences() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static int length(Object sequence) {
    if (sequence instanceof List<?> list) {
      return list.size();
    }
    return Array.getLength(sequence);
  }

  public static Object get(Object sequence, int index) {
    if (sequence instanceof List<?> list) {
      return list.get(index);
    }
    // boxes elements of primitive arrays
    return Array.get(sequence, index);
  }
}
