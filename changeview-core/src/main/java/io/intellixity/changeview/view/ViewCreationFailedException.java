package io.intellixity.changeview.view;

import io.intellixity.changeview.compile.SchemaViewException;

/**
 * The database rejected a generated view (syntax, permissions, name taken by an incompatible resource).
 * <p>
 * Holds the offending statement for diagnosis. Never retried automatically.
 */
public final class ViewCreationFailedException extends SchemaViewException {
  private final String statement;

  public ViewCreationFailedException(String message, String schemaName, String viewName, String statement,
                                     Throwable cause) {
    super(message, schemaName, viewName, null, cause);
    this.statement = statement;
  }

  public ViewCreationFailedException(String message, String viewName, String statement, Throwable cause) {
    this(message, null, viewName, statement, cause);
  }

  public String statement() { return statement; }

  /**
   * Attaches the schema being installed to a failure reported by a resource manager. A manager's own
   * message and statement are kept; other failures get the generated SQL as statement.
   */
  public static ViewCreationFailedException forSchema(String schemaName, ViewDefinition view, RuntimeException e) {
    if (e instanceof ViewCreationFailedException vcf) {
      if (vcf.schemaName() != null) return vcf;
      ViewCreationFailedException out = new ViewCreationFailedException(vcf.detail(), schemaName,
          vcf.viewName() != null ? vcf.viewName() : view.viewName(),
          vcf.statement() != null ? vcf.statement() : view.sql(),
          vcf.getCause());
      out.setStackTrace(vcf.getStackTrace());
      return out;
    }
    String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    return new ViewCreationFailedException("Failed to create view: " + detail,
        schemaName, view.viewName(), view.sql(), e);
  }
}
