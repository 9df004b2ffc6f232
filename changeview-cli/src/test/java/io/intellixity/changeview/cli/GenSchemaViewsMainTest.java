package io.intellixity.changeview.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.changeview.schema.json.FirestoreSchemaLoader;
import io.intellixity.changeview.spi.exec.ViewResourceManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class GenSchemaViewsMainTest {
  private static final String USERS = """
      {
        "fields": [
          { "name": "name", "type": "string" },
          { "name": "items", "type": "array", "fields": [ { "name": "a", "type": "string" } ] }
        ]
      }
      """;

  @TempDir
  Path dir;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private final List<String> projects = new ArrayList<>();
  private final List<String> created = new ArrayList<>();
  private Path schemas;

  @BeforeEach
  void writeSchemas() throws Exception {
    schemas = Files.createDirectory(dir.resolve("schemas"));
    Files.writeString(schemas.resolve("users.json"), USERS);
  }

  private int run(Map<String, String> env, String input, String... args) {
    return run(env, new BufferedReader(new StringReader(input)), new FirestoreSchemaLoader(), args);
  }

  private int run(Map<String, String> env, BufferedReader in, FirestoreSchemaLoader loader, String... args) {
    ViewResourceManager views = (datasetId, viewName, sql) -> created.add(datasetId + "." + viewName);
    GenSchemaViewsMain main = new GenSchemaViewsMain(
        env,
        in,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8),
        project -> {
          projects.add(project);
          return views;
        },
        loader);
    return main.run(args);
  }

  private String out() { return out.toString(StandardCharsets.UTF_8); }
  private String err() { return err.toString(StandardCharsets.UTF_8); }

  @Test
  void nonInteractiveRunCreatesAllViews() {
    int code = run(Map.of(), "", "--non-interactive", "-P", "my-project", "-d", "firestore_export", "-t", "users",
        "-f", schemas.toString());

    assertEquals(0, code, err());
    assertEquals(List.of("my-project"), projects);
    assertEquals(List.of(
        "firestore_export.users_schema_users_latest",
        "firestore_export.users_schema_users",
        "firestore_export.users_schema_users_items"), created);
    assertTrue(out().contains(
        "Created views for schema 'users': users_schema_users_latest, users_schema_users, users_schema_users_items"));
    assertTrue(out().trim().endsWith("done."));
  }

  @Test
  void separateBigQueryProjectIsUsedForViews() {
    int code = run(Map.of(), "", "--non-interactive", "-P", "my-project", "-B", "bq-project", "-d", "ds",
        "-t", "users", "-f", schemas.resolve("users.json").toString());

    assertEquals(0, code);
    assertEquals(List.of("bq-project"), projects);
  }

  @Test
  void missingSchemaFilesReportedButNotAnError() {
    int code = run(Map.of(), "", "--non-interactive", "-P", "my-project", "-d", "ds", "-t", "users",
        "-f", dir.resolve("nowhere").toString());

    assertEquals(0, code);
    assertTrue(out().contains("No schema files found!"));
    assertTrue(out().contains("done."));
    assertTrue(created.isEmpty());
  }

  @Test
  void failingSchemaYieldsNonZeroExit() throws Exception {
    Files.writeString(schemas.resolve("bad.json"), """
        { "fields": [ { "name": "blob", "type": "bytes" } ] }
        """);

    int code = run(Map.of(), "", "--non-interactive", "-P", "my-project", "-d", "ds", "-t", "users",
        "-f", schemas.toString());

    assertEquals(1, code);
    assertTrue(err().contains("Schema 'bad' failed at NOT_STARTED"));
    assertTrue(err().contains("Unsupported field type 'bytes'"));
    assertTrue(out().contains("Created views for schema 'users'"));
    assertFalse(created.stream().anyMatch(v -> v.contains("_bad")));
  }

  @Test
  void incompleteNonInteractiveArgsPrintUsage() {
    int code = run(Map.of(), "", "--non-interactive", "-P", "my-project", "-t", "users", "-f", "x");

    assertEquals(1, code);
    assertTrue(out().contains("Usage: gen-schema-views"));
    assertTrue(projects.isEmpty());
  }

  @Test
  void invalidDatasetIsRejected() {
    int code = run(Map.of(), "", "--non-interactive", "-P", "my-project", "-d", "my-dataset", "-t", "users",
        "-f", schemas.toString());

    assertEquals(1, code);
    assertTrue(err().contains("The dataset ID contains invalid characters: my-dataset"));
    assertTrue(created.isEmpty());
  }

  @Test
  void unknownOptionPrintsErrorAndUsage() {
    assertEquals(1, run(Map.of(), "", "--bogus"));
    assertTrue(err().contains("Unknown option: --bogus"));
    assertTrue(out().contains("Usage:"));
  }

  @Test
  void helpExitsCleanly() {
    assertEquals(0, run(Map.of(), "", "--help"));
    assertTrue(out().contains("--non-interactive"));
  }

  @Test
  void promptsForMissingValuesAndReasksOnInvalidInput() {
    String input = String.join("\n",
        "",                    // project: accept env default
        "",                    // BigQuery project: accept default
        "bad-dataset",         // rejected
        "firestore_export",
        "users",
        schemas.toString()) + "\n";

    int code = run(Map.of("PROJECT_ID", "env-project"), input);

    assertEquals(0, code, err());
    assertEquals(List.of("env-project"), projects);
    assertTrue(out().contains("What is your Firebase project ID? (env-project)"));
    assertTrue(out().contains("The dataset ID contains invalid characters: bad-dataset"));
    assertEquals(3, created.size());
  }

  @Test
  void flagsGivenInteractivelyAreNotAskedAgain() {
    int code = run(Map.of(), "firestore_export\n", "-P", "my-project", "-B", "my-project", "-t", "users",
        "-f", schemas.toString());

    assertEquals(0, code, err());
    assertFalse(out().contains("Firebase project ID?"));
    assertTrue(out().contains("BigQuery dataset"));
  }

  @Test
  void projectDefaultFallsBackToGoogleCloudProject() {
    int code = run(Map.of("GOOGLE_CLOUD_PROJECT", "gcp-project"), "\n", "-B", "bq-project", "-d", "ds",
        "-t", "users", "-f", schemas.toString());

    assertEquals(0, code, err());
    assertTrue(out().contains("What is your Firebase project ID? (gcp-project)"));
    assertEquals(List.of("bq-project"), projects);
  }

  @Test
  void unreadableSchemaFileIsReportedAsError() {
    FirestoreSchemaLoader unreadable = new FirestoreSchemaLoader(new ObjectMapper() {
      @Override
      public <T> T readValue(File src, Class<T> valueType) throws IOException {
        throw new AccessDeniedException(src.toString());
      }
    });

    int code = run(Map.of(), new BufferedReader(new StringReader("")), unreadable,
        "--non-interactive", "-P", "my-project", "-d", "ds", "-t", "users", "-f", schemas.toString());

    assertEquals(1, code);
    assertTrue(err().contains("Failed to read schema file"));
    assertTrue(err().contains("users.json"));
    assertTrue(created.isEmpty());
  }

  @Test
  void brokenConsoleIsReportedAsError() {
    BufferedReader broken = new BufferedReader(new StringReader("")) {
      @Override
      public String readLine() throws IOException {
        throw new IOException("Input/output error");
      }
    };

    int code = run(Map.of(), broken, new FirestoreSchemaLoader(), "-d", "ds");

    assertEquals(1, code);
    assertTrue(err().contains("Failed to read answer: Input/output error"));
  }

  @Test
  void endOfInputAbortsPrompting() {
    assertEquals(1, run(Map.of(), "my-project\n"));
    assertTrue(projects.isEmpty());
  }
}
