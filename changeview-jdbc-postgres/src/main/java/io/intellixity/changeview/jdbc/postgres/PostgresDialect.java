package io.intellixity.changeview.jdbc.postgres;

import io.intellixity.changeview.spi.sql.AbstractViewSqlDialect;
import io.intellixity.changeview.spi.sql.ArrayUnnest;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Postgres dialect.
 *
 * Raw data is cast to jsonb and read with {@code #>} / {@code #>>} path operators. Column names keep
 * their dotted qualified form (quoted). The project id is ignored; the dataset maps to a schema.
 */
public final class PostgresDialect extends AbstractViewSqlDialect {
  private static final Pattern SIMPLE_IDENT = Pattern.compile("[a-z_][a-z0-9_]*");
  private static final Pattern SIMPLE_SEGMENT = Pattern.compile("[A-Za-z0-9_]+");
  private static final String UNNESTED = "unnested";
  private static final Set<String> RESERVED = Set.of(
      "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "both", "case", "cast", "check",
      "collate", "column", "constraint", "create", "current_date", "current_time", "current_timestamp",
      "current_user", "default", "desc", "distinct", "do", "else", "end", "except", "false", "fetch", "for",
      "foreign", "from", "grant", "group", "having", "in", "initially", "intersect", "into", "lateral",
      "leading", "limit", "localtime", "localtimestamp", "not", "null", "offset", "on", "only", "or",
      "order", "placing", "primary", "references", "returning", "select", "session_user", "some",
      "symmetric", "table", "then", "to", "trailing", "true", "union", "unique", "user", "using",
      "variadic", "when", "where", "window", "with");

  @Override public String id() { return "postgres"; }

  @Override
  public String tableRef(String projectId, String datasetId, String name) {
    if (datasetId == null || datasetId.isBlank()) return quoteIdent(name);
    return quoteIdent(datasetId) + "." + quoteIdent(name);
  }

  @Override
  public String columnName(String qualifiedName) {
    return qualifiedName;
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    if (SIMPLE_IDENT.matcher(ident).matches() && !RESERVED.contains(ident)) return ident;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String stringLiteral(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  @Override
  protected String elementExpression() {
    return UNNESTED + ".element";
  }

  @Override
  protected String ordinalExpression(ArrayUnnest unnest) {
    // WITH ORDINALITY counts from 1.
    return "(" + UNNESTED + ".ordinal - 1)";
  }

  @Override
  protected String unnestClause(String sourceAlias, ArrayUnnest unnest) {
    String array = jsonb(parentDataExpression(sourceAlias)) + " #> " + pgTextArrayLiteral(unnest.path());
    return "CROSS JOIN LATERAL jsonb_array_elements("
        + "CASE WHEN jsonb_typeof(" + array + ") = 'array' THEN " + array + " ELSE '[]'::jsonb END"
        + ") WITH ORDINALITY AS " + UNNESTED + "(element, ordinal)";
  }

  @Override protected String stringType() { return "TEXT"; }
  @Override protected String numberType() { return "NUMERIC"; }
  @Override protected String booleanType() { return "BOOLEAN"; }
  @Override protected String timestampType() { return "TIMESTAMPTZ"; }
  @Override protected String floatType() { return "DOUBLE PRECISION"; }

  @Override
  protected String extractString(String data, List<String> path) {
    return text(data, path);
  }

  @Override
  protected String extractNumber(String data, List<String> path) {
    return typed(data, path, "number", "NUMERIC");
  }

  @Override
  protected String extractBoolean(String data, List<String> path) {
    return typed(data, path, "boolean", "BOOLEAN");
  }

  @Override
  protected String extractTimestamp(String data, List<String> path) {
    String node = node(data, path);
    String seconds = "(" + text(data, child(path, "_seconds")) + ")::NUMERIC";
    String nanos = "COALESCE((" + text(data, child(path, "_nanoseconds")) + ")::NUMERIC, 0)";
    return "CASE jsonb_typeof(" + node + ")"
        + " WHEN 'string' THEN (" + text(data, path) + ")::TIMESTAMPTZ"
        + " WHEN 'number' THEN to_timestamp((" + text(data, path) + ")::NUMERIC / 1000)"
        + " WHEN 'object' THEN to_timestamp(" + seconds + " + " + nanos + " / 1000000000)"
        + " END";
  }

  @Override
  protected String extractFloat(String data, List<String> path) {
    return typed(data, path, "number", "DOUBLE PRECISION");
  }

  @Override
  protected String extractReference(String data, List<String> path) {
    String segments = node(data, child(child(path, "_path"), "segments"));
    return "COALESCE("
        + "CASE WHEN jsonb_typeof(" + node(data, path) + ") = 'string' THEN " + text(data, path) + " END, "
        + "(SELECT string_agg(seg.s, '/' ORDER BY seg.o) FROM jsonb_array_elements_text("
        + "CASE WHEN jsonb_typeof(" + segments + ") = 'array' THEN " + segments + " ELSE '[]'::jsonb END"
        + ") WITH ORDINALITY AS seg(s, o)))";
  }

  @Override
  protected String extractJsonText(String data, List<String> path) {
    return "(" + node(data, path) + ")::TEXT";
  }

  private String typed(String data, List<String> path, String jsonType, String sqlType) {
    return "CASE WHEN jsonb_typeof(" + node(data, path) + ") = '" + jsonType + "' THEN ("
        + text(data, path) + ")::" + sqlType + " END";
  }

  private String node(String data, List<String> path) {
    return jsonb(data) + " #> " + pgTextArrayLiteral(path);
  }

  private String text(String data, List<String> path) {
    return jsonb(data) + " #>> " + pgTextArrayLiteral(path);
  }

  private static String jsonb(String data) {
    return "(" + data + ")::jsonb";
  }

  /** Path as a Postgres text[] literal: {@code '{a,b}'}; segments with other characters are quoted. */
  String pgTextArrayLiteral(List<String> path) {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < path.size(); i++) {
      if (i > 0) sb.append(',');
      String segment = path.get(i);
      if (SIMPLE_SEGMENT.matcher(segment).matches()) {
        sb.append(segment);
      } else {
        sb.append('"').append(segment.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
      }
    }
    return stringLiteral(sb.append('}').toString());
  }
}
