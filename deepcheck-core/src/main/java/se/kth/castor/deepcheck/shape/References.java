package se.kth.castor.deepcheck.shape;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Uniform access to values of shape {@link Shape#REFERENCE}.
 */
public final class References {

  private References() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static boolean pointsToNothing(Object reference) {
    return referent(reference) == null;
  }

  /**
   * Returns the value a reference points to.
   *
   * @param reference an {@link Optional} or {@link AtomicReference}
   * @return the referent, or {@code null} if the reference points to nothing
   */
  public static Object referent(Object reference) {
    if (reference instanceof Optional<?> optional) {
      return optional.orElse(null);
    }
    if (reference instanceof AtomicReference<?> atomicReference) {
      return atomicReference.get();
    }
    throw new IllegalArgumentException("Not a reference: " + reference.getClass().getName());
  }

  /**
   * Creates a new reference of the same kind as the template, pointing at the given referent.
   *
   * @param template the reference whose kind to copy
   * @param referent the new referent, may be {@code null}
   * @return a fresh reference
   */
  public static Object pointingAt(Object template, Object referent) {
    if (template instanceof Optional<?>) {
      return Optional.ofNullable(referent);
    }
    if (template instanceof AtomicReference<?>) {
      return new AtomicReference<>(referent);
    }
    throw new IllegalArgumentException("Not a reference: " + template.getClass().getName());
  }
}
