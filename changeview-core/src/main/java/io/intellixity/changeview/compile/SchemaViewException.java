package io.intellixity.changeview.compile;

/**
 * Base of all errors raised while compiling or installing the views of one schema.
 * <p>
 * Carries whatever location is known (schema name, view name, nested field path) so the offending
 * declaration can be found. Any of them may be null.
 */
public class SchemaViewException extends RuntimeException {
  private final String detail;
  private final String schemaName;
  private final String viewName;
  private final String fieldPath;

  public SchemaViewException(String message, String schemaName, String viewName, String fieldPath) {
    this(message, schemaName, viewName, fieldPath, null);
  }

  public SchemaViewException(String message, String schemaName, String viewName, String fieldPath,
                             Throwable cause) {
    super(decorate(message, schemaName, viewName, fieldPath), cause);
    this.detail = message;
    this.schemaName = schemaName;
    this.viewName = viewName;
    this.fieldPath = fieldPath;
  }

  /** Message without the location suffix. */
  public String detail() { return detail; }
  public String schemaName() { return schemaName; }
  public String viewName() { return viewName; }
  public String fieldPath() { return fieldPath; }

  private static String decorate(String message, String schemaName, String viewName, String fieldPath) {
    StringBuilder sb = new StringBuilder(message == null ? "" : message);
    if (schemaName != null) sb.append(" [schema=").append(schemaName).append(']');
    if (viewName != null) sb.append(" [view=").append(viewName).append(']');
    if (fieldPath != null && !fieldPath.isEmpty()) sb.append(" [field=").append(fieldPath).append(']');
    return sb.toString();
  }
}
