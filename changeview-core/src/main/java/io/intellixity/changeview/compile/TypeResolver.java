package io.intellixity.changeview.compile;

import io.intellixity.changeview.schema.ScalarFieldType;

import java.util.List;

/**
 * Maps a scalar field type to its column(s): SQL type plus extraction expression.
 * <p>
 * Implemented by SQL dialects so that JSON extraction syntax stays out of the flattener.
 */
public interface TypeResolver {
  /**
   * Returns one column, or two for geopoints ({@code <name>.latitude}, {@code <name>.longitude}).
   *
   * @throws UnsupportedFieldTypeException if the type id has no rule
   */
  List<FlattenedColumn> resolve(ScalarFieldType type, ColumnLocation location);
}
