package se.kth.castor.deepcheck.diff;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import se.kth.castor.deepcheck.compare.DeepEquality;
import se.kth.castor.deepcheck.shape.Sequences;
import se.kth.castor.deepcheck.shape.Shape;
import se.kth.castor.deepcheck.shape.Shapes;

/**
 * Computes the difference of two arrays or lists, ignoring order but counting duplicates.
 */
public final class ListDiffer {

  private ListDiffer() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static boolean isList(Object value) {
    Shape shape = Shapes.of(value);
    return shape == Shape.SEQUENCE || shape == Shape.RAW_BYTES;
  }

  /**
   * Diffs two lists as multisets. If an element is present twice in A and five times in B, it is
   * reported zero times in the first and three times in the second result list.
   *
   * @param listA an array or list
   * @param listB an array or list
   * @return the elements only in A and the elements only in B, each in original order
   * @throws IllegalArgumentException if either argument is not an array or list
   */
  public static DiffResult diffLists(Object listA, Object listB) {
    Preconditions.checkArgument(isList(listA), "%s is not an array or list", listA);
    Preconditions.checkArgument(isList(listB), "%s is not an array or list", listB);

    int aLength = Sequences.length(listA);
    int bLength = Sequences.length(listB);

    List<Object> extraA = new ArrayList<>();
    List<Object> extraB = new ArrayList<>();

    // indexes in B that are already matched
    boolean[] visited = new boolean[bLength];
    for (int i = 0; i < aLength; i++) {
      Object element = Sequences.get(listA, i);
      boolean found = false;
      for (int j = 0; j < bLength; j++) {
        if (visited[j]) {
          continue;
        }
        if (DeepEquality.equal(Sequences.get(listB, j), element)) {
          visited[j] = true;
          found = true;
          break;
        }
      }
      if (!found) {
        extraA.add(element);
      }
    }

    for (int j = 0; j < bLength; j++) {
      if (!visited[j]) {
        extraB.add(Sequences.get(listB, j));
      }
    }

    return new DiffResult(extraA, extraB);
  }
}
