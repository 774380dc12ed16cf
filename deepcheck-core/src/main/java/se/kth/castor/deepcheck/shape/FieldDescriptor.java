package se.kth.castor.deepcheck.shape;

import java.lang.reflect.Field;

/**
 * A readable instance field of a {@link CompositeType}.
 *
 * @param field the field, already made accessible
 * @param exported whether the field takes part in exported-field copies
 */
public record FieldDescriptor(Field field, boolean exported) {

  public String name() {
    return field.getName();
  }

  public Class<?> type() {
    return field.getType();
  }

  public Class<?> declaringClass() {
    return field.getDeclaringClass();
  }

  public Object read(Object instance) {
    try {
      return field.get(instance);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Access denied after setAccessible succeeded", e);
    }
  }

  public void write(Object instance, Object value) {
    try {
      field.set(instance, value);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Could not write " + this, e);
    }
  }

  @Override
  public String toString() {
    return declaringClass().getName() + "#" + name() + (exported ? "" : " (not exported)");
  }
}
