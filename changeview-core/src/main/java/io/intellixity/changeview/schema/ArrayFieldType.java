package io.intellixity.changeview.schema;

import java.util.List;
import java.util.Objects;

/** Repeated field. Exposed through a child view with one row per element. */
public record ArrayFieldType(Field element) implements FieldType {
  public ArrayFieldType {
    Objects.requireNonNull(element, "element");
  }

  /** Array whose elements are maps with the given fields; the element itself is unnamed. */
  public static ArrayFieldType ofMaps(List<Field> elementFields) {
    return new ArrayFieldType(Field.of("", new MapFieldType(elementFields)));
  }

  /** Array of scalars; the element column is named {@link Field#DEFAULT_ELEMENT_NAME}. */
  public static ArrayFieldType of(String elementTypeId) {
    return new ArrayFieldType(Field.of(Field.DEFAULT_ELEMENT_NAME, new ScalarFieldType(elementTypeId)));
  }

  @Override
  public String id() { return ScalarTypes.ARRAY; }
}
