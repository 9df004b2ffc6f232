package io.intellixity.changeview.compile;

import java.util.Objects;

/**
 * One output column of a typed view.
 *
 * @param qualifiedName dotted field path, e.g. {@code address.city} or {@code loc.latitude}
 * @param expression dialect SQL that extracts the value from the level's raw data
 * @param sqlType dialect SQL type of the extracted value
 */
public record FlattenedColumn(String qualifiedName, String expression, String sqlType) {
  public FlattenedColumn {
    Objects.requireNonNull(qualifiedName, "qualifiedName");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(sqlType, "sqlType");
  }
}
