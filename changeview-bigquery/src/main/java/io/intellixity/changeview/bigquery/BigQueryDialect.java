package io.intellixity.changeview.bigquery;

import io.intellixity.changeview.spi.sql.AbstractViewSqlDialect;
import io.intellixity.changeview.spi.sql.ArrayUnnest;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * BigQuery Standard SQL dialect.
 *
 * The changelog stores document data as a JSON string, so extraction uses the legacy
 * {@code JSON_EXTRACT*} family, which accepts STRING input. Column names cannot contain dots;
 * qualified names such as {@code address.city} become {@code address_city}.
 */
public final class BigQueryDialect extends AbstractViewSqlDialect {
  private static final Pattern SIMPLE_IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern SIMPLE_SEGMENT = Pattern.compile("[A-Za-z0-9_]+");
  private static final Pattern NON_COLUMN = Pattern.compile("[^A-Za-z0-9_]");
  private static final String ELEMENT = "__element";
  private static final String OFFSET = "__offset";

  // Subset of BigQuery reserved keywords that plausibly show up as field names.
  private static final Set<String> RESERVED = Set.of(
      "all", "and", "any", "array", "as", "asc", "between", "by", "case", "cast", "collate", "contains",
      "create", "cross", "cube", "current", "default", "desc", "distinct", "else", "end", "enum", "escape",
      "except", "exclude", "exists", "extract", "false", "fetch", "following", "for", "from", "full",
      "group", "grouping", "groups", "hash", "having", "if", "ignore", "in", "inner", "intersect", "interval",
      "into", "is", "join", "lateral", "left", "like", "limit", "lookup", "merge", "natural", "new", "no",
      "not", "null", "nulls", "of", "on", "or", "order", "outer", "over", "partition", "preceding", "proto",
      "range", "recursive", "respect", "right", "rollup", "rows", "select", "set", "some", "struct",
      "tablesample", "then", "to", "treat", "true", "unbounded", "union", "unnest", "using", "when", "where",
      "window", "with", "within");

  @Override public String id() { return "bigquery"; }

  @Override
  public String tableRef(String projectId, String datasetId, String name) {
    String ref = (projectId == null || projectId.isBlank())
        ? datasetId + "." + name
        : projectId + "." + datasetId + "." + name;
    return "`" + ref.replace("`", "\\`") + "`";
  }

  @Override
  public String columnName(String qualifiedName) {
    String s = NON_COLUMN.matcher(qualifiedName).replaceAll("_");
    if (!s.isEmpty() && Character.isDigit(s.charAt(0))) s = "_" + s;
    return s;
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    if (SIMPLE_IDENT.matcher(ident).matches() && !RESERVED.contains(ident.toLowerCase(Locale.ROOT))) {
      return ident;
    }
    return "`" + ident.replace("\\", "\\\\").replace("`", "\\`") + "`";
  }

  @Override
  protected String stringLiteral(String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  @Override
  protected String elementExpression() {
    return ELEMENT;
  }

  @Override
  protected String ordinalExpression(ArrayUnnest unnest) {
    // WITH OFFSET is already zero-based.
    return OFFSET;
  }

  @Override
  protected String unnestClause(String sourceAlias, ArrayUnnest unnest) {
    String data = parentDataExpression(sourceAlias);
    return "CROSS JOIN UNNEST(JSON_EXTRACT_ARRAY(" + data + ", " + jsonPath(unnest.path()) + ")) AS " + ELEMENT
        + " WITH OFFSET AS " + OFFSET;
  }

  // Unnest aliases are unqualified; a parent column with the same name would make them ambiguous.
  @Override
  protected Set<String> internalNames() {
    return Set.of(RAW_DATA_COLUMN, ELEMENT, OFFSET);
  }

  @Override protected String stringType() { return "STRING"; }
  @Override protected String numberType() { return "NUMERIC"; }
  @Override protected String booleanType() { return "BOOL"; }
  @Override protected String timestampType() { return "TIMESTAMP"; }
  @Override protected String floatType() { return "FLOAT64"; }

  @Override
  protected String extractString(String data, List<String> path) {
    return scalar(data, path);
  }

  @Override
  protected String extractNumber(String data, List<String> path) {
    return "SAFE_CAST(" + scalar(data, path) + " AS NUMERIC)";
  }

  @Override
  protected String extractBoolean(String data, List<String> path) {
    return "SAFE_CAST(" + scalar(data, path) + " AS BOOL)";
  }

  @Override
  protected String extractTimestamp(String data, List<String> path) {
    String seconds = "SAFE_CAST(" + scalar(data, child(path, "_seconds")) + " AS INT64)";
    String nanos = "IFNULL(SAFE_CAST(" + scalar(data, child(path, "_nanoseconds")) + " AS INT64), 0)";
    return "COALESCE("
        + "SAFE_CAST(" + scalar(data, path) + " AS TIMESTAMP), "
        + "SAFE.TIMESTAMP_MILLIS(SAFE_CAST(" + scalar(data, path) + " AS INT64)), "
        + "SAFE.TIMESTAMP_MICROS(" + seconds + " * 1000000 + DIV(" + nanos + ", 1000)))";
  }

  @Override
  protected String extractFloat(String data, List<String> path) {
    return "SAFE_CAST(" + scalar(data, path) + " AS FLOAT64)";
  }

  @Override
  protected String extractReference(String data, List<String> path) {
    List<String> segments = child(child(path, "_path"), "segments");
    return "COALESCE(" + scalar(data, path) + ", "
        + "ARRAY_TO_STRING(JSON_EXTRACT_STRING_ARRAY(" + data + ", " + jsonPath(segments) + "), '/'))";
  }

  @Override
  protected String extractJsonText(String data, List<String> path) {
    return "JSON_EXTRACT(" + data + ", " + jsonPath(path) + ")";
  }

  private String scalar(String data, List<String> path) {
    return "JSON_EXTRACT_SCALAR(" + data + ", " + jsonPath(path) + ")";
  }

  /** JSONPath literal: {@code '$.a.b'}; segments with other characters use {@code ['...']}. */
  String jsonPath(List<String> path) {
    StringBuilder sb = new StringBuilder("$");
    for (String segment : path) {
      if (SIMPLE_SEGMENT.matcher(segment).matches()) {
        sb.append('.').append(segment);
      } else {
        sb.append("['").append(segment.replace("\\", "\\\\").replace("'", "\\'")).append("']");
      }
    }
    return stringLiteral(sb.toString());
  }
}
