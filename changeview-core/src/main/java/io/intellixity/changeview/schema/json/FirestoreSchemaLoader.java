package io.intellixity.changeview.schema.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.changeview.compile.InvalidSchemaStructureException;
import io.intellixity.changeview.schema.FirestoreSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Reads schema files into {@code schemaName -> FirestoreSchema}.
 * <p>
 * Each input is a file, a directory (its {@code *.json} children), or a glob such as
 * {@code schemas/**.json}. The schema name is the file name without {@code .json}.
 * Paths that match nothing are logged and skipped.
 */
public final class FirestoreSchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(FirestoreSchemaLoader.class);
  private static final String EXTENSION = ".json";

  private final ObjectMapper json;

  public FirestoreSchemaLoader() {
    this(new ObjectMapper());
  }

  public FirestoreSchemaLoader(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public Map<String, FirestoreSchema> readSchemas(List<String> paths) {
    Map<String, FirestoreSchema> out = new LinkedHashMap<>();
    for (String p : paths) {
      if (p == null || p.isBlank()) continue;
      for (Path file : expand(p.trim())) {
        String name = schemaName(file);
        FirestoreSchema prev = out.put(name, readSchema(file));
        if (prev != null) {
          log.warn("changeview.schema duplicate name={} file={} (later file wins)", name, file);
        }
      }
    }
    return out;
  }

  public FirestoreSchema readSchema(Path file) {
    try {
      FirestoreSchema schema = json.readValue(file.toFile(), FirestoreSchema.class);
      if (schema == null) {
        throw new InvalidSchemaStructureException("Schema file is empty: " + file, schemaName(file), null);
      }
      log.debug("changeview.schema loaded file={} fields={}", file, schema.fields().size());
      return schema;
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new InvalidSchemaStructureException("Failed to parse schema file " + file + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema file " + file, e);
    }
  }

  static String schemaName(Path file) {
    String n = file.getFileName().toString();
    return n.endsWith(EXTENSION) ? n.substring(0, n.length() - EXTENSION.length()) : n;
  }

  List<Path> expand(String pattern) {
    String normalized = pattern.replace('\\', '/');
    if (!hasGlob(normalized)) {
      Path p = Paths.get(pattern);
      if (Files.isDirectory(p)) return jsonChildren(p);
      if (Files.isRegularFile(p)) return List.of(p);
      log.warn("changeview.schema no file at path={}", pattern);
      return List.of();
    }

    // Split into the literal base directory and the globbed remainder.
    String[] parts = normalized.split("/");
    int firstGlob = 0;
    while (firstGlob < parts.length && !hasGlob(parts[firstGlob])) firstGlob++;
    String baseStr = String.join("/", Arrays.copyOfRange(parts, 0, firstGlob));
    String rest = String.join("/", Arrays.copyOfRange(parts, firstGlob, parts.length));
    Path base;
    if (!baseStr.isEmpty()) base = Paths.get(baseStr);
    else base = normalized.startsWith("/") ? Paths.get("/") : Paths.get(".");
    if (!Files.isDirectory(base)) {
      log.warn("changeview.schema no directory for glob={}", pattern);
      return List.of();
    }

    PathMatcher matcher = base.getFileSystem().getPathMatcher("glob:" + rest);
    final Path root = base;
    try (Stream<Path> s = Files.walk(root)) {
      List<Path> out = s.filter(Files::isRegularFile)
          .filter(f -> matcher.matches(root.relativize(f)))
          .sorted()
          .toList();
      if (out.isEmpty()) log.warn("changeview.schema glob matched nothing glob={}", pattern);
      return out;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to expand " + pattern, e);
    }
  }

  private static List<Path> jsonChildren(Path dir) {
    try (Stream<Path> s = Files.list(dir)) {
      return s.filter(Files::isRegularFile)
          .filter(f -> f.getFileName().toString().endsWith(EXTENSION))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
  }

  private static boolean hasGlob(String s) {
    return s.indexOf('*') >= 0 || s.indexOf('?') >= 0 || s.indexOf('[') >= 0 || s.indexOf('{') >= 0;
  }
}
