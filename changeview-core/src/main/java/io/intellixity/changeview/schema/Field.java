package io.intellixity.changeview.schema;

import java.util.Objects;

public record Field(
    String name,
    FieldType type,
    /** Optional free-text description; not used for SQL generation. */
    String description
) {
  public static final String DEFAULT_ELEMENT_NAME = "value";

  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public static Field of(String name, FieldType type) {
    return new Field(name, type, null);
  }

  public static Field scalar(String name, String typeId) {
    return new Field(name, new ScalarFieldType(typeId), null);
  }
}
