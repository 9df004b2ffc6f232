package io.intellixity.changeview.compile;

import io.intellixity.changeview.schema.*;

import java.util.*;

/**
 * Walks a field list and produces the flat column list of one view level.
 * <p>
 * Maps are expanded inline at any depth; arrays are not inlined but registered as child schemas.
 * Declaration order is preserved at every nesting level. One flattener is bound to one view level
 * ({@code dataExpression} is the raw JSON of that level).
 */
public final class FieldFlattener {
  private final TypeResolver types;
  private final String schemaName;
  private final String dataExpression;

  public FieldFlattener(TypeResolver types, String schemaName, String dataExpression) {
    this.types = Objects.requireNonNull(types, "types");
    this.schemaName = schemaName;
    this.dataExpression = Objects.requireNonNull(dataExpression, "dataExpression");
  }

  /** Flattens {@code fields}, qualifying columns with the dotted {@code pathPrefix} (may be empty). */
  public FlattenResult flatten(List<Field> fields, String pathPrefix) {
    List<String> prefix = (pathPrefix == null || pathPrefix.isEmpty())
        ? List.of()
        : List.of(pathPrefix.split("\\.", -1));
    Accumulator acc = new Accumulator();
    flattenInto(fields, prefix, acc);
    return acc.result();
  }

  /**
   * Flattens the element of an array at a child view level.
   * <p>
   * The element is the row's whole JSON value: a map element contributes its fields at the root, a
   * scalar element becomes one column named after the element (default {@code value}).
   */
  public FlattenResult flattenElement(Field element) {
    Accumulator acc = new Accumulator();
    FieldType t = element.type();
    if (t instanceof MapFieldType m) {
      flattenInto(m.fields(), List.of(), acc);
    } else if (t instanceof ArrayFieldType) {
      throw new InvalidSchemaStructureException("Arrays of arrays are not supported", schemaName, element.name());
    } else {
      String name = element.name().isBlank() ? Field.DEFAULT_ELEMENT_NAME : element.name();
      addScalar(t, List.of(), name, acc);
    }
    return acc.result();
  }

  private void flattenInto(List<Field> fields, List<String> prefix, Accumulator acc) {
    Set<String> siblings = new HashSet<>();
    for (Field f : fields) {
      List<String> path = append(prefix, f.name());
      if (f.name().isBlank()) {
        throw new InvalidSchemaStructureException("Field name is blank", schemaName, dotted(path));
      }
      if (!siblings.add(f.name())) {
        throw new InvalidSchemaStructureException("Duplicate field name '" + f.name() + "'", schemaName, dotted(path));
      }

      FieldType t = f.type();
      if (t instanceof MapFieldType m) {
        flattenInto(m.fields(), path, acc);
      } else if (t instanceof ArrayFieldType a) {
        acc.child(new ChildSchema(path, FirestoreSchema.of(a.element())));
      } else {
        addScalar(t, path, dotted(path), acc);
      }
    }
  }

  private void addScalar(FieldType t, List<String> jsonPath, String qualifiedName, Accumulator acc) {
    if (!(t instanceof ScalarFieldType s)) {
      throw new UnsupportedFieldTypeException(t == null ? "null" : t.id(), schemaName, qualifiedName);
    }
    ColumnLocation loc = new ColumnLocation(schemaName, dataExpression, jsonPath, qualifiedName);
    for (FlattenedColumn c : types.resolve(s, loc)) {
      acc.column(c);
    }
  }

  private static List<String> append(List<String> prefix, String name) {
    List<String> out = new ArrayList<>(prefix.size() + 1);
    out.addAll(prefix);
    out.add(name);
    return out;
  }

  private static String dotted(List<String> path) {
    return String.join(".", path);
  }

  private final class Accumulator {
    private final List<FlattenedColumn> columns = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private final Map<String, ChildSchema> children = new LinkedHashMap<>();

    void column(FlattenedColumn c) {
      if (!names.add(c.qualifiedName()) || children.containsKey(c.qualifiedName())) {
        throw new InvalidSchemaStructureException("Duplicate column '" + c.qualifiedName() + "'",
            schemaName, c.qualifiedName());
      }
      columns.add(c);
    }

    void child(ChildSchema child) {
      String key = child.dottedPath();
      if (names.contains(key) || children.putIfAbsent(key, child) != null) {
        throw new InvalidSchemaStructureException("Duplicate array field '" + key + "'", schemaName, key);
      }
    }

    FlattenResult result() {
      return new FlattenResult(columns, children);
    }
  }
}
