package io.intellixity.changeview.compile;

import io.intellixity.changeview.schema.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

final class FieldFlattenerTest {
  private static final TypeResolver TYPES = (type, loc) -> {
    String n = loc.qualifiedName();
    if (ScalarTypes.GEOPOINT.equals(type.typeId())) {
      return List.of(
          new FlattenedColumn(n + ".latitude", "lat(" + loc.dataExpression() + ")", "FLOAT"),
          new FlattenedColumn(n + ".longitude", "lng(" + loc.dataExpression() + ")", "FLOAT"));
    }
    if (!ScalarTypes.isKnownScalar(type.typeId())) {
      throw new UnsupportedFieldTypeException(type.typeId(), loc.schemaName(), n);
    }
    String expr = "get(" + loc.dataExpression() + ", '" + String.join("/", loc.jsonPath()) + "')";
    return List.of(new FlattenedColumn(n, expr, type.typeId().toUpperCase(Locale.ROOT)));
  };

  private static FieldFlattener flattener() {
    return new FieldFlattener(TYPES, "users", "src.data");
  }

  private static List<String> names(FlattenResult r) {
    return r.columns().stream().map(FlattenedColumn::qualifiedName).toList();
  }

  @Test
  void primitiveFieldsYieldOneColumnEachInDeclarationOrder() {
    List<Field> fields = List.of(
        Field.scalar("zeta", "string"),
        Field.scalar("alpha", "number"),
        Field.scalar("active", "boolean"),
        Field.scalar("created", "timestamp"));

    FlattenResult r = flattener().flatten(fields, "");

    assertEquals(List.of("zeta", "alpha", "active", "created"), names(r));
    assertTrue(r.childSchemas().isEmpty());
    assertEquals("get(src.data, 'alpha')", r.columns().get(1).expression());
    assertEquals("NUMBER", r.columns().get(1).sqlType());
  }

  @Test
  void mapsFlattenInlineAtAnyDepth() {
    List<Field> fields = List.of(
        Field.scalar("name", "string"),
        Field.of("address", new MapFieldType(List.of(
            Field.scalar("city", "string"),
            Field.of("geo", new MapFieldType(List.of(Field.scalar("zip", "string"))))))),
        Field.scalar("age", "number"));

    FlattenResult r = flattener().flatten(fields, "");

    assertEquals(List.of("name", "address.city", "address.geo.zip", "age"), names(r));
    assertEquals("get(src.data, 'address/geo/zip')", r.columns().get(2).expression());
    assertFalse(r.hasChildren());
  }

  @Test
  void prefixQualifiesColumnsAndJsonPath() {
    FlattenResult r = flattener().flatten(List.of(Field.scalar("b", "string")), "outer.a");
    assertEquals(List.of("outer.a.b"), names(r));
    assertEquals("get(src.data, 'outer/a/b')", r.columns().get(0).expression());
  }

  @Test
  void geopointYieldsLatitudeAndLongitude() {
    FlattenResult r = flattener().flatten(List.of(Field.scalar("loc", "geopoint")), "");
    assertEquals(List.of("loc.latitude", "loc.longitude"), names(r));
  }

  @Test
  void arrayOfMapsBecomesChildSchemaWithoutInlineColumn() {
    List<Field> fields = List.of(
        Field.scalar("title", "string"),
        Field.of("items", ArrayFieldType.ofMaps(List.of(
            Field.scalar("a", "string"),
            Field.scalar("b", "number")))));

    FlattenResult r = flattener().flatten(fields, "");

    assertEquals(List.of("title"), names(r));
    assertEquals(1, r.childSchemas().size());
    ChildSchema child = r.childSchemas().get("items");
    assertEquals(List.of("items"), child.path());
    assertEquals(1, child.schema().fields().size());

    FlattenResult element = new FieldFlattener(TYPES, "users", "element").flattenElement(child.element());
    assertEquals(List.of("a", "b"), names(element));
    assertEquals("STRING", element.columns().get(0).sqlType());
    assertEquals("NUMBER", element.columns().get(1).sqlType());
    assertEquals("get(element, 'b')", element.columns().get(1).expression());
  }

  @Test
  void arrayInsideMapIsKeyedByDottedPath() {
    List<Field> fields = List.of(
        Field.of("meta", new MapFieldType(List.of(Field.of("tags", ArrayFieldType.of("string"))))));

    FlattenResult r = flattener().flatten(fields, "");

    assertTrue(r.columns().isEmpty());
    assertEquals(List.of("meta.tags"), List.copyOf(r.childSchemaMap().keySet()));
    assertEquals(List.of("meta", "tags"), r.childSchemas().get("meta.tags").path());
  }

  @Test
  void scalarElementIsReadFromTheElementRoot() {
    Field element = ArrayFieldType.of("number").element();
    FlattenResult r = new FieldFlattener(TYPES, "users", "element").flattenElement(element);
    assertEquals(List.of("value"), names(r));
    assertEquals("get(element, '')", r.columns().get(0).expression());
  }

  @Test
  void emptyMapContributesNothing() {
    List<Field> fields = List.of(
        Field.scalar("a", "string"),
        Field.of("empty", new MapFieldType(List.of())),
        Field.scalar("b", "string"));

    FlattenResult r = flattener().flatten(fields, "");
    assertEquals(List.of("a", "b"), names(r));
  }

  @Test
  void duplicateSiblingNamesAreRejected() {
    List<Field> fields = List.of(
        Field.of("address", new MapFieldType(List.of(
            Field.scalar("city", "string"),
            Field.scalar("city", "number")))));

    InvalidSchemaStructureException ex = assertThrows(InvalidSchemaStructureException.class,
        () -> flattener().flatten(fields, ""));
    assertEquals("users", ex.schemaName());
    assertEquals("address.city", ex.fieldPath());
  }

  @Test
  void blankFieldNameIsRejected() {
    assertThrows(InvalidSchemaStructureException.class,
        () -> flattener().flatten(List.of(Field.scalar(" ", "string")), ""));
  }

  @Test
  void arraysOfArraysAreRejected() {
    Field element = Field.of("inner", ArrayFieldType.of("string"));
    assertThrows(InvalidSchemaStructureException.class,
        () -> flattener().flattenElement(element));
  }

  @Test
  void unknownTypeFailsWithFieldPath() {
    List<Field> fields = List.of(
        Field.of("nested", new MapFieldType(List.of(Field.scalar("blob", "bytes")))));

    UnsupportedFieldTypeException ex = assertThrows(UnsupportedFieldTypeException.class,
        () -> flattener().flatten(fields, ""));
    assertEquals("bytes", ex.typeId());
    assertEquals("nested.blob", ex.fieldPath());
    assertTrue(ex.getMessage().contains("[schema=users]"));
  }
}
