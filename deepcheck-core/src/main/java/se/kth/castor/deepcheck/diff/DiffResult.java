package se.kth.castor.deepcheck.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The multiset difference of two lists. Both lists may contain {@code null}.
 *
 * @param extraInFirst elements of the first list without a partner in the second
 * @param extraInSecond elements of the second list without a partner in the first
 */
public record DiffResult(List<Object> extraInFirst, List<Object> extraInSecond) {

  public DiffResult {
    extraInFirst = Collections.unmodifiableList(new ArrayList<>(extraInFirst));
    extraInSecond = Collections.unmodifiableList(new ArrayList<>(extraInSecond));
  }

  public boolean isEmpty() {
    return extraInFirst.isEmpty() && extraInSecond.isEmpty();
  }
}
