package io.intellixity.changeview.cli;

import com.google.cloud.bigquery.BigQueryOptions;
import io.intellixity.changeview.bigquery.BigQueryDialect;
import io.intellixity.changeview.bigquery.BigQueryViewResourceManager;
import io.intellixity.changeview.compile.SchemaViewException;
import io.intellixity.changeview.schema.FirestoreSchema;
import io.intellixity.changeview.schema.json.FirestoreSchemaLoader;
import io.intellixity.changeview.spi.exec.SchemaViewFactory;
import io.intellixity.changeview.spi.exec.SchemaViewResult;
import io.intellixity.changeview.spi.exec.ViewResourceManager;
import io.intellixity.changeview.view.ViewTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * CLI:
 *   gen-schema-views [--non-interactive] -P project [-B bigQueryProject] -d dataset -t prefix -f schemas...
 *
 * Exit codes: 0 when every schema's views were installed, 1 otherwise (bad input, failed schema).
 */
public final class GenSchemaViewsMain {
  private static final Logger log = LoggerFactory.getLogger(GenSchemaViewsMain.class);

  private final Map<String, String> env;
  private final BufferedReader in;
  private final PrintStream out;
  private final PrintStream err;
  private final Function<String, ViewResourceManager> viewManagers;
  private final FirestoreSchemaLoader loader;

  GenSchemaViewsMain(Map<String, String> env, BufferedReader in, PrintStream out, PrintStream err,
                     Function<String, ViewResourceManager> viewManagers, FirestoreSchemaLoader loader) {
    this.env = env;
    this.in = in;
    this.out = out;
    this.err = err;
    this.viewManagers = viewManagers;
    this.loader = loader;
  }

  public static void main(String[] args) {
    GenSchemaViewsMain main = new GenSchemaViewsMain(
        System.getenv(),
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
        System.out,
        System.err,
        GenSchemaViewsMain::bigQueryViews,
        new FirestoreSchemaLoader());
    System.exit(main.run(args));
  }

  int run(String[] args) {
    CliArgs parsed;
    try {
      parsed = CliArgs.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      out.println(CliArgs.USAGE);
      return 1;
    }
    if (parsed.help()) {
      out.println(CliArgs.USAGE);
      return 0;
    }

    CliConfig config;
    try {
      config = resolveConfig(parsed);
    } catch (UncheckedIOException e) {
      err.println(describe(e));
      return 1;
    }
    if (config == null) {
      out.println(CliArgs.USAGE);
      return 1;
    }
    String invalid = firstInvalid(config);
    if (invalid != null) {
      err.println(invalid);
      return 1;
    }

    Map<String, FirestoreSchema> schemas;
    try {
      schemas = loader.readSchemas(config.schemaFiles());
    } catch (SchemaViewException e) {
      err.println(e.getMessage());
      return 1;
    } catch (UncheckedIOException e) {
      err.println(describe(e));
      return 1;
    }
    if (schemas.isEmpty()) {
      out.println("No schema files found!");
    }

    ViewTarget target = new ViewTarget(config.bigQueryProjectId(), config.datasetId(), config.tableNamePrefix(),
        config.rawChangelogTable());
    SchemaViewFactory factory = new SchemaViewFactory(new BigQueryDialect(),
        viewManagers.apply(config.bigQueryProjectId()), target);

    List<SchemaViewResult> results = factory.initializeAll(schemas);
    boolean ok = true;
    for (SchemaViewResult r : results) {
      if (r.succeeded()) {
        out.println("Created views for schema '" + r.schemaName() + "': " + String.join(", ", r.createdViews()));
      } else {
        ok = false;
        err.println("Schema '" + r.schemaName() + "' failed at " + r.state() + ": " + r.error().getMessage());
      }
    }
    out.println("done.");
    return ok ? 0 : 1;
  }

  private CliConfig resolveConfig(CliArgs parsed) {
    if (parsed.nonInteractive()) {
      if (!parsed.complete()) return null;
      return parsed.toConfig();
    }
    String defaultProject = env.get("PROJECT_ID");
    if (defaultProject == null || defaultProject.isBlank()) defaultProject = env.get("GOOGLE_CLOUD_PROJECT");
    return new Prompter(in, out).complete(parsed, defaultProject);
  }

  private static String describe(UncheckedIOException e) {
    return e.getMessage() + ": " + e.getCause().getMessage();
  }

  private static String firstInvalid(CliConfig c) {
    String e = InputValidation.validateProject(c.projectId());
    if (e == null) e = InputValidation.validateBigQueryProject(c.bigQueryProjectId());
    if (e == null) e = InputValidation.validateDataset(c.datasetId());
    if (e == null) e = InputValidation.validateTableNamePrefix(c.tableNamePrefix());
    return e;
  }

  private static ViewResourceManager bigQueryViews(String bigQueryProjectId) {
    log.debug("changeview.cli bigquery project={}", bigQueryProjectId);
    return new BigQueryViewResourceManager(
        BigQueryOptions.newBuilder().setProjectId(bigQueryProjectId).build().getService(),
        bigQueryProjectId);
  }
}
