package se.kth.castor.deepcheck.copy;

import com.google.common.base.Defaults;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.objenesis.Objenesis;
import org.objenesis.ObjenesisStd;
import se.kth.castor.deepcheck.compare.NilClassifier;
import se.kth.castor.deepcheck.shape.CompositeType;
import se.kth.castor.deepcheck.shape.FieldDescriptor;
import se.kth.castor.deepcheck.shape.References;
import se.kth.castor.deepcheck.shape.Shapes;

/**
 * Creates deep copies that only retain exported fields. The input is never modified.
 */
public final class ExportedFieldCopier {

  private static final Objenesis OBJENESIS = new ObjenesisStd(true);

  private ExportedFieldCopier() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Copies a value, dropping every field that is not exported.
   * <p>
   * Composites are re-created as zero-valued instances of their exact class and only receive
   * exported, non-nil fields. References, sequences and maps are copied with their contents copied
   * recursively. Set elements and map keys are kept as they are. Nil values and all other shapes
   * are returned unchanged.
   * <p>
   * Nil fields and nil array or list elements are left at zero, so an empty {@code Optional} in a
   * field or element becomes {@code null} in the copy. Guava's immutable collections can not hold
   * {@code null} and keep their nil elements as they are. They are rebuilt with their own type, so
   * the copy still fits fields declared with that type.
   *
   * @param value the value to copy
   * @return the copy
   * @throws IllegalStateException if the copy of a non-empty container does not fit the type the
   *     field or array declares for it
   */
  public static Object copyExported(Object value) {
    if (NilClassifier.isNil(value)) {
      return value;
    }

    return switch (Shapes.of(value)) {
      case COMPOSITE -> copyComposite(value);
      case REFERENCE -> References.pointingAt(value, copyExported(References.referent(value)));
      case SEQUENCE -> value.getClass().isArray() ? copyArray(value) : copyList((List<?>) value);
      case RAW_BYTES -> ((byte[]) value).clone();
      case ASSOCIATIVE -> value instanceof Map<?, ?> map ? copyMap(map) : copySet((Set<?>) value);
      default -> value;
    };
  }

  private static Object copyComposite(Object value) {
    CompositeType type = Shapes.compositeType(value);
    if (type.isRecord()) {
      return copyRecord(type, value);
    }

    Object copy = OBJENESIS.newInstance(type.type());
    for (FieldDescriptor field : type.exportedFields()) {
      Object fieldValue = field.read(value);
      if (NilClassifier.isNil(fieldValue)) {
        continue;
      }
      field.write(copy, fitting(field.type(), copyExported(fieldValue), fieldValue));
    }
    return copy;
  }

  private static Object copyRecord(CompositeType type, Object value) {
    ImmutableMap<String, FieldDescriptor> fields = Maps.uniqueIndex(
        type.fields(),
        FieldDescriptor::name
    );
    RecordComponent[] components = type.type().getRecordComponents();
    Object[] arguments = new Object[components.length];

    for (int i = 0; i < components.length; i++) {
      FieldDescriptor field = fields.get(components[i].getName());
      Object fieldValue = field.read(value);
      if (field.exported() && !NilClassifier.isNil(fieldValue)) {
        arguments[i] = fitting(field.type(), copyExported(fieldValue), fieldValue);
      } else {
        arguments[i] = Defaults.defaultValue(components[i].getType());
      }
    }

    try {
      return type.canonicalConstructor().newInstance(arguments);
    } catch (InvocationTargetException e) {
      throw new IllegalStateException(
          "Record " + type.type().getName() + " rejected its exported-field copy",
          e.getCause()
      );
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Could not construct " + type.type().getName(), e);
    }
  }

  private static Object copyArray(Object array) {
    Class<?> componentType = array.getClass().getComponentType();
    int length = Array.getLength(array);
    Object copy = Array.newInstance(componentType, length);

    for (int i = 0; i < length; i++) {
      Object element = Array.get(array, i);
      if (NilClassifier.isNil(element)) {
        continue;
      }
      Array.set(copy, i, fitting(componentType, copyExported(element), element));
    }
    return copy;
  }

  private static List<Object> copyList(List<?> list) {
    if (list instanceof ImmutableList<?>) {
      return list.stream()
          .map(ExportedFieldCopier::copyExported)
          .collect(ImmutableList.toImmutableList());
    }

    List<Object> copy = Instances.newOrElse(list.getClass(), ArrayList::new);
    for (Object element : list) {
      copy.add(NilClassifier.isNil(element) ? null : copyExported(element));
    }
    return copy;
  }

  private static Map<Object, Object> copyMap(Map<?, ?> map) {
    Map<Object, Object> copy;
    if (map instanceof SortedMap<?, ?> sortedMap) {
      copy = new TreeMap<>(Instances.<Object>comparator(sortedMap.comparator()));
    } else {
      copy = Instances.newOrElse(map.getClass(), LinkedHashMap::new);
    }

    for (Map.Entry<?, ?> entry : map.entrySet()) {
      copy.put(entry.getKey(), copyExported(entry.getValue()));
    }

    if (map instanceof ImmutableSortedMap<?, ?>) {
      return ImmutableSortedMap.copyOfSorted((SortedMap<Object, Object>) copy);
    }
    if (map instanceof ImmutableMap<?, ?>) {
      return ImmutableMap.copyOf(copy);
    }
    return copy;
  }

  private static Set<?> copySet(Set<?> set) {
    if (set instanceof ImmutableSortedSet<?> sortedSet) {
      return ImmutableSortedSet.copyOfSorted(sortedSet);
    }
    if (set instanceof ImmutableSet<?>) {
      return ImmutableSet.copyOf(set);
    }

    Set<Object> copy;
    if (set instanceof SortedSet<?> sortedSet) {
      copy = new TreeSet<>(Instances.<Object>comparator(sortedSet.comparator()));
    } else {
      copy = Instances.newOrElse(set.getClass(), LinkedHashSet::new);
    }
    copy.addAll(set);
    return copy;
  }

  /**
   * Checks that a copy fits the declared type of the field or array it is stored in. An empty
   * container holds nothing that could be filtered, so the original is used in its place.
   */
  private static Object fitting(Class<?> declaredType, Object copy, Object original) {
    if (declaredType.isPrimitive() || declaredType.isInstance(copy)) {
      return copy;
    }
    if (Shapes.of(original).isCountable() && Shapes.count(original) == 0) {
      return original;
    }
    throw new IllegalStateException(
        "Copy of " + original.getClass().getName() + " does not fit into "
            + declaredType.getName()
    );
  }
}
