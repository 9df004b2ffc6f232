package io.intellixity.changeview.spi.sql;

import io.intellixity.changeview.compile.ColumnLocation;
import io.intellixity.changeview.compile.FlattenedColumn;
import io.intellixity.changeview.compile.InvalidSchemaStructureException;
import io.intellixity.changeview.compile.UnsupportedFieldTypeException;
import io.intellixity.changeview.schema.ScalarFieldType;
import io.intellixity.changeview.schema.ScalarTypes;
import io.intellixity.changeview.view.ChangelogLayout;

import java.util.*;

/**
 * SQL-generic view rendering.
 *
 * Provides:
 * - latest snapshot: rank changelog rows per document path, keep the newest, drop deletes
 * - typed views: project document path, ordinals and flattened columns from a source view
 * - type resolution: dispatch scalar type ids to per-dialect extraction hooks
 *
 * Dialects override quoting, JSON extraction, array unnesting and SQL type names.
 */
public abstract class AbstractViewSqlDialect implements ViewDialect {
  protected static final String RANK_COLUMN = "change_rank";
  protected static final String RANKED_ALIAS = "ranked";
  protected static final String INDENT = "  ";
  /** Raw JSON of a typed view level, read by the child views that unnest from it. */
  protected static final String RAW_DATA_COLUMN = "__data";

  // ---- latest snapshot ----

  @Override
  public String latestSnapshotSql(String changelogTableRef, ChangelogLayout layout) {
    Objects.requireNonNull(changelogTableRef, "changelogTableRef");
    ChangelogLayout l = layout == null ? ChangelogLayout.DEFAULT : layout;

    List<String> cols = new ArrayList<>();
    cols.add(quoteIdent(l.documentNameColumn()));
    if (l.documentIdColumn() != null) cols.add(quoteIdent(l.documentIdColumn()));
    cols.add(quoteIdent(l.timestampColumn()));
    cols.add(quoteIdent(l.sequenceColumn()));
    cols.add(quoteIdent(l.operationColumn()));
    cols.add(quoteIdent(l.dataColumn()));

    List<String> inner = new ArrayList<>(cols);
    inner.add("ROW_NUMBER() OVER (PARTITION BY " + quoteIdent(l.documentNameColumn())
        + " ORDER BY " + newestFirst(quoteIdent(l.timestampColumn())) + ", "
        + newestFirst(quoteIdent(l.sequenceColumn())) + ") AS " + quoteIdent(RANK_COLUMN));

    return "SELECT\n"
        + INDENT + String.join(",\n" + INDENT, cols) + "\n"
        + "FROM (\n"
        + INDENT + "SELECT\n"
        + INDENT + INDENT + String.join(",\n" + INDENT + INDENT, inner) + "\n"
        + INDENT + "FROM " + changelogTableRef + "\n"
        + ") AS " + RANKED_ALIAS + "\n"
        + "WHERE " + quoteIdent(RANK_COLUMN) + " = 1 AND "
        + quoteIdent(l.operationColumn()) + " != " + stringLiteral(l.deleteOperation());
  }

  // ---- typed views ----

  @Override
  public String dataExpression(String sourceAlias, ChangelogLayout layout, ArrayUnnest unnest) {
    if (unnest != null) return elementExpression();
    ChangelogLayout l = layout == null ? ChangelogLayout.DEFAULT : layout;
    return sourceAlias + "." + quoteIdent(l.dataColumn());
  }

  /** Raw JSON column of the parent typed view, as seen from a child level. */
  protected String parentDataExpression(String sourceAlias) {
    return sourceAlias + "." + quoteIdent(RAW_DATA_COLUMN);
  }

  @Override
  public String typedViewSql(TypedViewSpec spec) {
    ChangelogLayout l = spec.layout();
    String a = spec.sourceAlias();
    Projection proj = new Projection(spec);

    proj.add(a + "." + quoteIdent(l.documentNameColumn()), l.documentNameColumn(), l.documentNameColumn());
    for (String carried : spec.carriedColumns()) {
      proj.add(a + "." + quoteIdent(carried), carried, carried);
    }
    if (spec.unnest() != null) {
      String ordinal = spec.unnest().ordinalColumn();
      proj.add(ordinalExpression(spec.unnest()), ordinal, ordinal);
    }
    Set<String> internal = internalNames();
    for (FlattenedColumn c : spec.columns()) {
      String name = columnName(c.qualifiedName());
      if (internal.contains(name.toLowerCase(Locale.ROOT))) {
        throw new InvalidSchemaStructureException("Column name '" + name + "' is reserved",
            spec.schemaName(), spec.viewName(), c.qualifiedName());
      }
      proj.add(c.expression(), name, c.qualifiedName());
    }
    if (spec.exposeData()) {
      proj.add(dataExpression(a, l, spec.unnest()), RAW_DATA_COLUMN, null);
    }

    StringBuilder sql = new StringBuilder();
    sql.append("SELECT\n").append(INDENT).append(String.join(",\n" + INDENT, proj.items)).append('\n');
    sql.append("FROM ").append(spec.sourceRef()).append(" AS ").append(a);
    if (spec.unnest() != null) {
      sql.append('\n').append(unnestClause(a, spec.unnest()));
    }
    return sql.toString();
  }

  @Override
  public String createViewDdl(String viewRef, String selectSql) {
    return "CREATE OR REPLACE VIEW " + viewRef + " AS\n" + selectSql;
  }

  /** Collects select items and rejects duplicate output names. */
  private final class Projection {
    private final TypedViewSpec spec;
    private final List<String> items = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    Projection(TypedViewSpec spec) {
      this.spec = spec;
    }

    void add(String expression, String outputName, String fieldPath) {
      if (!names.add(outputName.toLowerCase(Locale.ROOT))) {
        throw new InvalidSchemaStructureException("Column name '" + outputName + "' is produced more than once",
            spec.schemaName(), spec.viewName(), fieldPath);
      }
      String quoted = quoteIdent(outputName);
      items.add(expression.equals(quoted) ? expression : expression + " AS " + quoted);
    }
  }

  // ---- type resolution ----

  @Override
  public final List<FlattenedColumn> resolve(ScalarFieldType type, ColumnLocation loc) {
    String d = loc.dataExpression();
    List<String> p = loc.jsonPath();
    String n = loc.qualifiedName();
    return switch (type.typeId()) {
      case ScalarTypes.STRING -> List.of(new FlattenedColumn(n, extractString(d, p), stringType()));
      case ScalarTypes.NUMBER -> List.of(new FlattenedColumn(n, extractNumber(d, p), numberType()));
      case ScalarTypes.BOOLEAN -> List.of(new FlattenedColumn(n, extractBoolean(d, p), booleanType()));
      case ScalarTypes.TIMESTAMP -> List.of(new FlattenedColumn(n, extractTimestamp(d, p), timestampType()));
      case ScalarTypes.GEOPOINT -> List.of(
          new FlattenedColumn(n + ".latitude", extractFloat(d, child(p, "_latitude")), floatType()),
          new FlattenedColumn(n + ".longitude", extractFloat(d, child(p, "_longitude")), floatType()));
      case ScalarTypes.REFERENCE -> List.of(new FlattenedColumn(n, extractReference(d, p), stringType()));
      case ScalarTypes.NULL -> List.of(new FlattenedColumn(n, nullString(), stringType()));
      case ScalarTypes.STRINGIFIED_MAP -> List.of(new FlattenedColumn(n, extractJsonText(d, p), stringType()));
      default -> throw new UnsupportedFieldTypeException(type.typeId(), loc.schemaName(), n);
    };
  }

  /**
   * Lower-case names used internally by generated views (raw JSON column, unnest aliases).
   * Flattened columns may not take them.
   */
  protected Set<String> internalNames() {
    return Set.of(RAW_DATA_COLUMN);
  }

  /** Descending sort key that ranks NULLs below every value. */
  protected String newestFirst(String column) {
    return column + " DESC NULLS LAST";
  }

  protected static List<String> child(List<String> path, String segment) {
    List<String> out = new ArrayList<>(path);
    out.add(segment);
    return out;
  }

  // ---- dialect hooks ----

  protected abstract String quoteIdent(String ident);

  protected abstract String stringLiteral(String value);

  /** Expression for the current element inside {@link #unnestClause}. */
  protected abstract String elementExpression();

  /** Zero-based element position, as selected from the unnest clause. */
  protected abstract String ordinalExpression(ArrayUnnest unnest);

  /** Join clause appended after {@code FROM source AS alias} that yields one row per array element. */
  protected abstract String unnestClause(String sourceAlias, ArrayUnnest unnest);

  protected abstract String stringType();
  protected abstract String numberType();
  protected abstract String booleanType();
  protected abstract String timestampType();
  protected abstract String floatType();

  protected abstract String extractString(String data, List<String> path);
  protected abstract String extractNumber(String data, List<String> path);
  protected abstract String extractBoolean(String data, List<String> path);
  /** ISO-8601 string, epoch milliseconds, or a {@code {_seconds, _nanoseconds}} object. */
  protected abstract String extractTimestamp(String data, List<String> path);
  protected abstract String extractFloat(String data, List<String> path);
  /** Reference path string, or {@code _path.segments} joined with {@code /}. */
  protected abstract String extractReference(String data, List<String> path);
  /** Subtree re-serialized as JSON text. */
  protected abstract String extractJsonText(String data, List<String> path);

  protected String nullString() {
    return "CAST(NULL AS " + stringType() + ")";
  }
}
