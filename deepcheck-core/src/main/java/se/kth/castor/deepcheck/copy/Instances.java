package se.kth.castor.deepcheck.copy;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Creates empty containers of the same class as an existing one.
 */
final class Instances {

  private Instances() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Instantiates a class through its public no-arg constructor, or uses the fallback if the class
   * has none we may call (immutable and private implementations).
   *
   * @param type the class to instantiate
   * @param fallback the supplier of a replacement instance
   * @param <T> the container type
   * @return a new, empty instance
   */
  @SuppressWarnings("unchecked")
  static <T> T newOrElse(Class<?> type, Supplier<? extends T> fallback) {
    Optional<Constructor<?>> constructor = noArgConstructor(type);
    if (constructor.isEmpty()) {
      return fallback.get();
    }
    try {
      return (T) constructor.get().newInstance();
    } catch (InvocationTargetException e) {
      throw new IllegalStateException("Constructor of " + type.getName() + " failed", e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Could not instantiate " + type.getName(), e);
    }
  }

  @SuppressWarnings("unchecked")
  static <T> Comparator<? super T> comparator(Comparator<?> comparator) {
    return (Comparator<? super T>) comparator;
  }

  private static Optional<Constructor<?>> noArgConstructor(Class<?> type) {
    if (!Modifier.isPublic(type.getModifiers()) || Modifier.isAbstract(type.getModifiers())) {
      return Optional.empty();
    }
    for (Constructor<?> constructor : type.getConstructors()) {
      if (constructor.getParameterCount() == 0 && constructor.canAccess(null)) {
        return Optional.of(constructor);
      }
    }
    return Optional.empty();
  }
}
