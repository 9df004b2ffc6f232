package io.intellixity.changeview.spi.exec;

import io.intellixity.changeview.compile.SchemaViewException;

import java.util.List;

/** Outcome of installing one schema: the state reached, views created so far, and the error if any. */
public record SchemaViewResult(
    String schemaName,
    SchemaViewState state,
    List<String> createdViews,
    SchemaViewException error
) {
  public SchemaViewResult {
    createdViews = createdViews == null ? List.of() : List.copyOf(createdViews);
  }

  public boolean succeeded() {
    return error == null && state == SchemaViewState.DONE;
  }
}
