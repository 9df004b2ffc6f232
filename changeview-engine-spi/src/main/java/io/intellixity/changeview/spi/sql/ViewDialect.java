package io.intellixity.changeview.spi.sql;

import io.intellixity.changeview.compile.TypeResolver;
import io.intellixity.changeview.view.ChangelogLayout;

/**
 * Backend SQL dialect: JSON extraction rules (via {@link TypeResolver}) plus view SQL rendering.
 * <p>
 * Output must be a pure function of the inputs so that recompiling an unchanged schema yields
 * byte-identical SQL.
 */
public interface ViewDialect extends TypeResolver {
  String id();

  /** Fully qualified, quoted reference to a table or view. */
  String tableRef(String projectId, String datasetId, String name);

  /** Latest live row per document path; deletes excluded. */
  String latestSnapshotSql(String changelogTableRef, ChangelogLayout layout);

  /** Raw JSON expression of a typed view level: the source's data column, or the unnested element. */
  String dataExpression(String sourceAlias, ChangelogLayout layout, ArrayUnnest unnest);

  String typedViewSql(TypedViewSpec spec);

  /** Output column name for a dotted qualified name (unquoted). */
  String columnName(String qualifiedName);

  /** Idempotent DDL installing {@code selectSql} under {@code viewRef}. */
  String createViewDdl(String viewRef, String selectSql);
}
