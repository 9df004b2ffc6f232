package io.intellixity.changeview.schema;

import java.util.List;

/** Nested map; its fields flatten inline into the enclosing view. */
public record MapFieldType(List<Field> fields) implements FieldType {
  public MapFieldType {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  @Override
  public String id() { return ScalarTypes.MAP; }
}
