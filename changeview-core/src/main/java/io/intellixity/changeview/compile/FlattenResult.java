package io.intellixity.changeview.compile;

import io.intellixity.changeview.schema.FirestoreSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Flattener output: columns in declaration order, and array fields keyed by relative dotted path. */
public record FlattenResult(List<FlattenedColumn> columns, Map<String, ChildSchema> childSchemas) {
  public FlattenResult {
    columns = List.copyOf(columns);
    childSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(childSchemas));
  }

  public Map<String, FirestoreSchema> childSchemaMap() {
    Map<String, FirestoreSchema> out = new LinkedHashMap<>();
    childSchemas.forEach((k, v) -> out.put(k, v.schema()));
    return out;
  }

  public boolean hasChildren() {
    return !childSchemas.isEmpty();
  }
}
