package io.intellixity.changeview.spi.sql;

import java.util.List;
import java.util.Objects;

/**
 * Decomposition of an array into one row per element.
 *
 * @param path array path relative to the source level's raw data
 * @param ordinalColumn output column holding the zero-based element position
 */
public record ArrayUnnest(List<String> path, String ordinalColumn) {
  public ArrayUnnest {
    path = List.copyOf(path);
    Objects.requireNonNull(ordinalColumn, "ordinalColumn");
  }
}
