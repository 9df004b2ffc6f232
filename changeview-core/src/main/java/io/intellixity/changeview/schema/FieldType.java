package io.intellixity.changeview.schema;

/**
 * Declared type of a document field.
 * <p>
 * Implementations: {@link ScalarFieldType} (a leaf resolved to one or more columns),
 * {@link MapFieldType} (flattened inline) and {@link ArrayFieldType} (split off into a child view).
 */
public interface FieldType {
  /** Type id as written in schema files (e.g. {@code string}, {@code map}, {@code array}). */
  String id();
}
