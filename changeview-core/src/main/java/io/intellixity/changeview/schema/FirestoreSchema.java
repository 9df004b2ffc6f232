package io.intellixity.changeview.schema;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.changeview.schema.json.FirestoreSchemaJsonDeserializer;

import java.util.List;

/**
 * Declared shape of the documents of one collection.
 * <p>
 * The schema name is supplied by the caller (usually the schema file name) and is not part of the value.
 */
@JsonDeserialize(using = FirestoreSchemaJsonDeserializer.class)
public record FirestoreSchema(List<Field> fields) {
  public FirestoreSchema {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  public static FirestoreSchema of(Field... fields) {
    return new FirestoreSchema(List.of(fields));
  }
}
