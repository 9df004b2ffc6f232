package io.intellixity.changeview.schema;

import java.util.Set;

/** Type ids understood by schema files. */
public final class ScalarTypes {
  private ScalarTypes() {}

  public static final String STRING = "string";
  public static final String NUMBER = "number";
  public static final String BOOLEAN = "boolean";
  public static final String TIMESTAMP = "timestamp";
  public static final String GEOPOINT = "geopoint";
  public static final String REFERENCE = "reference";
  public static final String NULL = "null";
  public static final String STRINGIFIED_MAP = "stringified_map";

  // Container ids; never resolved to a column.
  public static final String MAP = "map";
  public static final String ARRAY = "array";

  public static final Set<String> SCALARS = Set.of(
      STRING, NUMBER, BOOLEAN, TIMESTAMP, GEOPOINT, REFERENCE, NULL, STRINGIFIED_MAP);

  public static boolean isKnownScalar(String typeId) {
    return typeId != null && SCALARS.contains(typeId);
  }
}
