package io.intellixity.changeview.jdbc.postgres;

import io.intellixity.changeview.compile.ColumnLocation;
import io.intellixity.changeview.compile.FlattenedColumn;
import io.intellixity.changeview.schema.ArrayFieldType;
import io.intellixity.changeview.schema.Field;
import io.intellixity.changeview.schema.FirestoreSchema;
import io.intellixity.changeview.schema.MapFieldType;
import io.intellixity.changeview.schema.ScalarFieldType;
import io.intellixity.changeview.spi.exec.SchemaViewFactory;
import io.intellixity.changeview.spi.exec.SchemaViewPlan;
import io.intellixity.changeview.view.ChangelogLayout;
import io.intellixity.changeview.view.ViewTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  private String expr(String typeId, String... path) {
    List<FlattenedColumn> cols = d.resolve(new ScalarFieldType(typeId),
        new ColumnLocation("users", "latest.data", List.of(path), String.join(".", path)));
    return cols.get(0).expression();
  }

  @Test
  void tableRefIgnoresProjectAndQuotesWhenNeeded() {
    assertEquals("analytics.users_schema_profile", d.tableRef("proj", "analytics", "users_schema_profile"));
    assertEquals("\"Analytics\".v", d.tableRef(null, "Analytics", "v"));
    assertEquals("\"select\"", d.tableRef(null, null, "select"));
  }

  @Test
  void pathLiteralQuotesUnusualSegments() {
    assertEquals("'{a,b}'", d.pgTextArrayLiteral(List.of("a", "b")));
    assertEquals("'{a,\"b c\"}'", d.pgTextArrayLiteral(List.of("a", "b c")));
    assertEquals("'{\"it''s\"}'", d.pgTextArrayLiteral(List.of("it's")));
  }

  @Test
  void extractsTypedValuesWithJsonTypeGuards() {
    assertEquals("(latest.data)::jsonb #>> '{name}'", expr("string", "name"));
    assertEquals("CASE WHEN jsonb_typeof((latest.data)::jsonb #> '{age}') = 'number' "
        + "THEN ((latest.data)::jsonb #>> '{age}')::NUMERIC END", expr("number", "age"));
    assertEquals("CASE WHEN jsonb_typeof((latest.data)::jsonb #> '{ok}') = 'boolean' "
        + "THEN ((latest.data)::jsonb #>> '{ok}')::BOOLEAN END", expr("boolean", "ok"));
    assertEquals("((latest.data)::jsonb #> '{raw}')::TEXT", expr("stringified_map", "raw"));
    assertEquals("CAST(NULL AS TEXT)", expr("null", "nothing"));
  }

  @Test
  void timestampHandlesStringNumberAndObject() {
    String ts = expr("timestamp", "ts");

    assertTrue(ts.startsWith("CASE jsonb_typeof((latest.data)::jsonb #> '{ts}')"));
    assertTrue(ts.contains("WHEN 'string' THEN ((latest.data)::jsonb #>> '{ts}')::TIMESTAMPTZ"));
    assertTrue(ts.contains("WHEN 'number' THEN to_timestamp(((latest.data)::jsonb #>> '{ts}')::NUMERIC / 1000)"));
    assertTrue(ts.contains("'{ts,_seconds}'"));
    assertTrue(ts.contains("'{ts,_nanoseconds}'"));
  }

  @Test
  void referenceJoinsPathSegments() {
    String ref = expr("reference", "owner");
    assertTrue(ref.contains("string_agg(seg.s, '/' ORDER BY seg.o)"));
    assertTrue(ref.contains("'{owner,_path,segments}'"));
  }

  @Test
  void geopointUsesDoublePrecision() {
    List<FlattenedColumn> cols = d.resolve(new ScalarFieldType("geopoint"),
        new ColumnLocation("users", "latest.data", List.of("home"), "home"));

    assertEquals(List.of("home.latitude", "home.longitude"), cols.stream().map(FlattenedColumn::qualifiedName).toList());
    assertEquals("DOUBLE PRECISION", cols.get(0).sqlType());
    assertTrue(cols.get(1).expression().contains("'{home,_longitude}'"));
  }

  @Test
  void latestSnapshotUsesDefaultLayout() {
    String sql = d.latestSnapshotSql("analytics.users_raw_changelog", ChangelogLayout.DEFAULT);
    assertTrue(sql.contains("ORDER BY timestamp DESC NULLS LAST, event_id DESC NULLS LAST"));
    assertTrue(sql.endsWith("WHERE change_rank = 1 AND operation != 'DELETE'"));
  }

  @Test
  void compilesViewsKeepingDottedColumnNames() {
    SchemaViewFactory factory = new SchemaViewFactory(d, (ds, view, sql) -> { },
        new ViewTarget(null, "analytics", "users"));
    FirestoreSchema schema = FirestoreSchema.of(
        Field.of("address", new MapFieldType(List.of(Field.scalar("city", "string")))),
        Field.of("items", ArrayFieldType.ofMaps(List.of(Field.scalar("a", "string")))));

    SchemaViewPlan plan = factory.compile("profile", schema);

    String top = """
        SELECT
          latest.document_name AS document_name,
          (latest.data)::jsonb #>> '{address,city}' AS "address.city",
          latest.data AS __data
        FROM analytics.users_schema_profile_latest AS latest""";
    assertEquals(top, plan.top().sql());

    String child = """
        SELECT
          parent.document_name AS document_name,
          (unnested.ordinal - 1) AS items_index,
          (unnested.element)::jsonb #>> '{a}' AS a
        FROM analytics.users_schema_profile AS parent
        CROSS JOIN LATERAL jsonb_array_elements(CASE WHEN jsonb_typeof((parent.__data)::jsonb #> '{items}') = 'array' \
        THEN (parent.__data)::jsonb #> '{items}' ELSE '[]'::jsonb END) WITH ORDINALITY AS unnested(element, ordinal)""";
    assertEquals(child, plan.children().get(0).sql());
  }
}
