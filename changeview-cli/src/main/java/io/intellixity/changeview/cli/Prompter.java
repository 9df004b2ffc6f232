package io.intellixity.changeview.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Asks for missing configuration on the console, re-asking until the answer validates. */
final class Prompter {
  private final BufferedReader in;
  private final PrintStream out;

  Prompter(BufferedReader in, PrintStream out) {
    this.in = in;
    this.out = out;
  }

  /**
   * Fills every value {@code given} lacks.
   *
   * @return null when input ends before all answers are collected
   */
  CliConfig complete(CliArgs given, String defaultProject) {
    String project = given.project() != null ? given.project()
        : ask("What is your Firebase project ID?", defaultProject, InputValidation::validateProject);
    if (project == null) return null;

    String bqDefault = defaultProject != null ? defaultProject : project;
    String bigQueryProject = given.bigQueryProject() != null ? given.bigQueryProject()
        : ask("What is your Google Cloud Project ID for BigQuery? (can be the same as the Firebase project ID)",
            bqDefault, InputValidation::validateBigQueryProject);
    if (bigQueryProject == null) return null;

    String dataset = given.dataset() != null ? given.dataset()
        : ask("What is the ID of the BigQuery dataset the raw changelog lives in? "
            + "(The dataset and the raw changelog must already exist!)", null, InputValidation::validateDataset);
    if (dataset == null) return null;

    String prefix = given.tableNamePrefix() != null ? given.tableNamePrefix()
        : ask("What is the name of the Cloud Firestore collection for which you want to generate a schema view?",
            null, InputValidation::validateTableNamePrefix);
    if (prefix == null) return null;

    List<String> files = given.schemaFiles();
    if (files.isEmpty()) {
      String answer = ask("Where should this script look for schema definitions? (Enter a comma-separated list of, "
          + "optionally globbed, paths to files or directories).", null, v -> null);
      if (answer == null) return null;
      files = new ArrayList<>();
      for (String part : answer.split(",")) {
        if (!part.isBlank()) files.add(part.trim());
      }
    }
    return new CliConfig(project, bigQueryProject, dataset, prefix, files, given.rawChangelogTable());
  }

  private String ask(String question, String defaultValue, Function<String, String> validator) {
    while (true) {
      out.print(defaultValue == null ? question + " " : question + " (" + defaultValue + ") ");
      out.flush();
      String line;
      try {
        line = in.readLine();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read answer", e);
      }
      if (line == null) return null;
      String value = line.isBlank() && defaultValue != null ? defaultValue : line.trim();
      String error = validator.apply(value);
      if (error == null) return value;
      out.println(error);
    }
  }
}
