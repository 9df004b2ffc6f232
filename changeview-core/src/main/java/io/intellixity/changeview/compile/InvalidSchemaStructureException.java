package io.intellixity.changeview.compile;

/** Malformed field tree: duplicate sibling names, blank names, colliding columns or view names. */
public final class InvalidSchemaStructureException extends SchemaViewException {
  public InvalidSchemaStructureException(String message, String schemaName, String fieldPath) {
    super(message, schemaName, null, fieldPath);
  }

  public InvalidSchemaStructureException(String message, String schemaName, String viewName, String fieldPath) {
    super(message, schemaName, viewName, fieldPath);
  }

  public InvalidSchemaStructureException(String message, Throwable cause) {
    super(message, null, null, null, cause);
  }
}
