package io.intellixity.changeview.schema.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.changeview.schema.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Canonical JSON deserializer for {@link FirestoreSchema}.
 *
 * <pre>
 * {"fields": [
 *   {"name": "title", "type": "string"},
 *   {"name": "address", "type": "map", "fields": [ ... ]},
 *   {"name": "items", "type": "array", "fields": [ ... ]},
 *   {"name": "scores", "type": "array", "element": {"type": "number"}},
 *   {"name": "tags", "type": "array"}
 * ]}
 * </pre>
 *
 * An array with {@code fields} holds maps; without {@code fields} or {@code element} it holds strings.
 * Type ids are not checked here.
 */
public final class FirestoreSchemaJsonDeserializer extends JsonDeserializer<FirestoreSchema> {
  @Override
  public FirestoreSchema deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Schema JSON must be an object");
    return new FirestoreSchema(parseFields(root.get("fields"), ""));
  }

  private static List<Field> parseFields(JsonNode fields, String parentPath) {
    List<Field> out = new ArrayList<>();
    if (fields == null || fields.isNull()) return out;
    if (!fields.isArray()) {
      throw new IllegalArgumentException("'fields' must be an array" + at(parentPath));
    }
    for (JsonNode f : fields) {
      if (!f.isObject()) throw new IllegalArgumentException("Field must be an object" + at(parentPath));
      String name = textOrNull(f.get("name"));
      if (name == null) throw new IllegalArgumentException("Field requires 'name'" + at(parentPath));
      out.add(parseField(name, f, parentPath.isEmpty() ? name : parentPath + "." + name));
    }
    return out;
  }

  private static Field parseField(String name, JsonNode f, String path) {
    String type = textOrNull(f.get("type"));
    if (type == null) throw new IllegalArgumentException("Field requires 'type'" + at(path));
    return new Field(name, parseType(type, f, path), textOrNull(f.get("description")));
  }

  private static FieldType parseType(String type, JsonNode f, String path) {
    String id = type.trim().toLowerCase(Locale.ROOT);
    if (ScalarTypes.MAP.equals(id)) {
      return new MapFieldType(parseFields(f.get("fields"), path));
    }
    if (ScalarTypes.ARRAY.equals(id)) {
      JsonNode element = f.get("element");
      if (element != null && element.isObject()) {
        String elementName = textOrNull(element.get("name"));
        if (elementName == null) {
          elementName = ScalarTypes.MAP.equalsIgnoreCase(textOrNull(element.get("type"))) ? "" : Field.DEFAULT_ELEMENT_NAME;
        }
        return new ArrayFieldType(parseField(elementName, element, path));
      }
      JsonNode nested = f.get("fields");
      if (nested != null && nested.isArray()) {
        return ArrayFieldType.ofMaps(parseFields(nested, path));
      }
      return ArrayFieldType.of(ScalarTypes.STRING);
    }
    return new ScalarFieldType(id);
  }

  private static String at(String path) {
    return (path == null || path.isEmpty()) ? "" : " (at " + path + ")";
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.isTextual() ? n.asText() : null;
  }
}
