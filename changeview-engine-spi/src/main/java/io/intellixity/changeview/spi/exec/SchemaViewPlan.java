package io.intellixity.changeview.spi.exec;

import io.intellixity.changeview.view.ViewDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiled views of one schema, in dependency order: latest snapshot, top typed view, then child
 * views depth-first (every child after its parent).
 */
public record SchemaViewPlan(
    String schemaName,
    ViewDefinition latest,
    ViewDefinition top,
    List<ViewDefinition> children
) {
  public SchemaViewPlan {
    Objects.requireNonNull(latest, "latest");
    Objects.requireNonNull(top, "top");
    children = children == null ? List.of() : List.copyOf(children);
  }

  public List<ViewDefinition> all() {
    List<ViewDefinition> out = new ArrayList<>(children.size() + 2);
    out.add(latest);
    out.add(top);
    out.addAll(children);
    return out;
  }

  public List<String> viewNames() {
    return all().stream().map(ViewDefinition::viewName).toList();
  }
}
