package io.intellixity.changeview.compile;

/** A field type id with no resolution rule in the active dialect. */
public final class UnsupportedFieldTypeException extends SchemaViewException {
  private final String typeId;

  public UnsupportedFieldTypeException(String typeId, String schemaName, String fieldPath) {
    super("Unsupported field type '" + typeId + "'", schemaName, null, fieldPath);
    this.typeId = typeId;
  }

  public String typeId() { return typeId; }
}
