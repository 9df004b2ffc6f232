package io.intellixity.changeview.schema;

import java.util.Locale;
import java.util.Objects;

/**
 * Leaf field type identified by its {@code typeId}.
 * <p>
 * Unknown ids are kept as-is; the dialect rejects them when the schema is compiled.
 */
public record ScalarFieldType(String typeId) implements FieldType {
  public ScalarFieldType {
    Objects.requireNonNull(typeId, "typeId");
    typeId = typeId.trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public String id() { return typeId; }
}
