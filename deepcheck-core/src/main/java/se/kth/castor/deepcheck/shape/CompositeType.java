package se.kth.castor.deepcheck.shape;

import java.lang.reflect.Constructor;
import java.util.List;

/**
 * Reflective view on a record or class whose instance fields are all readable.
 *
 * @param type the inspected class
 * @param fields all non-static fields, superclass fields first
 * @param canonicalConstructor the canonical constructor for records, {@code null} otherwise
 */
public record CompositeType(
    Class<?> type,
    List<FieldDescriptor> fields,
    Constructor<?> canonicalConstructor
) {

  public boolean isRecord() {
    return canonicalConstructor != null;
  }

  public List<FieldDescriptor> exportedFields() {
    return fields.stream().filter(FieldDescriptor::exported).toList();
  }
}
