package se.kth.castor.deepcheck.shape;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Computes and caches the {@link CompositeType} of classes. Classes from the JDK, and classes whose
 * fields can not be opened for us, have no composite view.
 */
public final class CompositeTypes {

  public static final int MAXIMUM_CACHED_TYPES = 6000;

  private static final List<String> PLATFORM_PREFIXES = List.of(
      "java.", "javax.", "jdk.", "sun.", "com.sun."
  );

  private static final LoadingCache<Class<?>, Optional<CompositeType>> CACHE = CacheBuilder
      .newBuilder()
      .maximumSize(MAXIMUM_CACHED_TYPES)
      .build(new CacheLoader<>() {
        @Override
        public Optional<CompositeType> load(Class<?> key) {
          return inspect(key);
        }
      });

  private CompositeTypes() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Returns the composite view of a class, or an empty optional if its instances are opaque.
   *
   * @param type the class to inspect
   * @return the composite view, if the class has one
   */
  public static Optional<CompositeType> lookup(Class<?> type) {
    return CACHE.getUnchecked(type);
  }

  public static boolean isPlatformType(Class<?> type) {
    String name = type.getName();
    return PLATFORM_PREFIXES.stream().anyMatch(name::startsWith);
  }

  private static Optional<CompositeType> inspect(Class<?> type) {
    if (type.isPrimitive() || type.isArray() || type.isEnum() || type.isInterface()) {
      return Optional.empty();
    }
    if (isPlatformType(type)) {
      return Optional.empty();
    }

    List<FieldDescriptor> fields = new ArrayList<>();
    for (Field field : getAllFieldsInHierarchy(type)) {
      if (!field.trySetAccessible()) {
        // the module system got in the way
        System.out.println("FALLING BACK TO equals() FOR " + type.getName());
        return Optional.empty();
      }
      fields.add(new FieldDescriptor(field, isExported(field)));
    }

    Constructor<?> canonicalConstructor = canonicalConstructor(type);
    if (type.isRecord() && canonicalConstructor == null) {
      System.out.println("FALLING BACK TO equals() FOR " + type.getName());
      return Optional.empty();
    }

    return Optional.of(new CompositeType(type, List.copyOf(fields), canonicalConstructor));
  }

  private static boolean isExported(Field field) {
    if (field.isAnnotationPresent(NotExported.class)) {
      return false;
    }
    if (field.isAnnotationPresent(Exported.class)) {
      return true;
    }
    if (Modifier.isPublic(field.getModifiers())) {
      return true;
    }
    // record components are published through their accessors
    return field.getDeclaringClass().isRecord();
  }

  private static Constructor<?> canonicalConstructor(Class<?> type) {
    if (!type.isRecord()) {
      return null;
    }
    Class<?>[] parameterTypes = Arrays.stream(type.getRecordComponents())
        .map(RecordComponent::getType)
        .toArray(Class<?>[]::new);
    try {
      Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
      if (!constructor.trySetAccessible()) {
        return null;
      }
      return constructor;
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException("Record without canonical constructor: " + type, e);
    }
  }

  private static List<Field> getAllFieldsInHierarchy(Class<?> root) {
    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> current = root; current != null; current = current.getSuperclass()) {
      hierarchy.push(current);
    }

    List<Field> fields = new ArrayList<>();
    for (Class<?> current : hierarchy) {
      for (Field field : current.getDeclaredFields()) {
        if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
          fields.add(field);
        }
      }
    }
    return fields;
  }
}
