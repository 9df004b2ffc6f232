package io.intellixity.changeview.compile;

import java.util.List;

/**
 * Where a scalar leaf lives: the raw JSON expression of the current view level, the path of the
 * value inside it, and the column name it is exposed under.
 */
public record ColumnLocation(
    String schemaName,
    String dataExpression,
    List<String> jsonPath,
    String qualifiedName
) {
  public ColumnLocation {
    jsonPath = jsonPath == null ? List.of() : List.copyOf(jsonPath);
  }
}
