package io.intellixity.changeview.view;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One compiled view: its name, the SELECT it installs, and the views it reads from.
 * <p>
 * Produced fresh on every compilation and consumed once by a view resource manager.
 */
public record ViewDefinition(
    String viewName,
    String sql,
    Set<String> dependsOn
) {
  public ViewDefinition {
    Objects.requireNonNull(viewName, "viewName");
    Objects.requireNonNull(sql, "sql");
    dependsOn = dependsOn == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
  }
}
