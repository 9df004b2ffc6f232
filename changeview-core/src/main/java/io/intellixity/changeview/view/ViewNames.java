package io.intellixity.changeview.view;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Deterministic view and ordinal-column naming.
 * <p>
 * Names depend only on (prefix, schema name, field path). Characters outside {@code [A-Za-z0-9_]}
 * become {@code _}; collisions this may introduce are rejected when a schema is compiled.
 */
public final class ViewNames {
  private static final Pattern NON_IDENT = Pattern.compile("[^A-Za-z0-9_]");

  private ViewNames() {}

  /** {@code <prefix>_schema_<schema>_latest} */
  public static String latest(String tableNamePrefix, String schemaName) {
    return schemaView(tableNamePrefix, schemaName) + "_latest";
  }

  /** {@code <prefix>_schema_<schema>} */
  public static String schemaView(String tableNamePrefix, String schemaName) {
    return sanitize(tableNamePrefix) + "_schema_" + sanitize(schemaName);
  }

  /** Child view of an array field: parent view name joined with the field path. */
  public static String child(String parentViewName, List<String> relativeFieldPath) {
    return parentViewName + "_" + join(relativeFieldPath);
  }

  /** Zero-based element position column for the array at {@code absoluteFieldPath}. */
  public static String ordinalColumn(List<String> absoluteFieldPath) {
    return join(absoluteFieldPath) + "_index";
  }

  public static String sanitize(String s) {
    return NON_IDENT.matcher(s).replaceAll("_");
  }

  private static String join(List<String> path) {
    StringBuilder sb = new StringBuilder();
    for (String segment : path) {
      if (segment.isEmpty()) continue;
      if (sb.length() > 0) sb.append('_');
      sb.append(sanitize(segment));
    }
    return sb.toString();
  }
}
