package io.intellixity.changeview.spi.sql;

import io.intellixity.changeview.compile.FlattenedColumn;
import io.intellixity.changeview.view.ChangelogLayout;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to render one typed view level.
 *
 * @param sourceRef rendered reference of the view read from (latest snapshot or parent typed view)
 * @param sourceAlias alias of that source inside the SELECT
 * @param carriedColumns ancestor ordinal columns copied from the source
 * @param unnest array decomposition for child levels; null for the top level
 * @param exposeData whether to project the level's raw JSON (needed when child views unnest from it)
 */
public record TypedViewSpec(
    String schemaName,
    String viewName,
    String sourceRef,
    String sourceAlias,
    ChangelogLayout layout,
    List<String> carriedColumns,
    ArrayUnnest unnest,
    List<FlattenedColumn> columns,
    boolean exposeData
) {
  public TypedViewSpec {
    Objects.requireNonNull(sourceRef, "sourceRef");
    Objects.requireNonNull(sourceAlias, "sourceAlias");
    layout = layout == null ? ChangelogLayout.DEFAULT : layout;
    carriedColumns = carriedColumns == null ? List.of() : List.copyOf(carriedColumns);
    columns = columns == null ? List.of() : List.copyOf(columns);
  }
}
