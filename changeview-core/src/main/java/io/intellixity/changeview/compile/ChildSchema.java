package io.intellixity.changeview.compile;

import io.intellixity.changeview.schema.Field;
import io.intellixity.changeview.schema.FirestoreSchema;

import java.util.List;

/**
 * Schema synthesized for the element of an array field; compiled into its own view.
 *
 * @param path array field path relative to the level that declared it
 * @param schema single-field schema holding the array element
 */
public record ChildSchema(List<String> path, FirestoreSchema schema) {
  public ChildSchema {
    path = List.copyOf(path);
  }

  public String dottedPath() {
    return String.join(".", path);
  }

  public Field element() {
    return schema.fields().get(0);
  }
}
