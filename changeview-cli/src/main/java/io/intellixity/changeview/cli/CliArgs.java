package io.intellixity.changeview.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed {@code gen-schema-views} flags. Values are null when not given.
 * <p>
 * Accepts {@code --flag value}, {@code --flag=value} and the short forms {@code -P -B -d -t -f -h}.
 * {@code --schema-files} may be repeated.
 */
record CliArgs(
    boolean nonInteractive,
    boolean help,
    String project,
    String bigQueryProject,
    String dataset,
    String tableNamePrefix,
    List<String> schemaFiles,
    String rawChangelogTable
) {
  static final String USAGE = String.join("\n",
      "Usage: gen-schema-views [options]",
      "",
      "Generates typed BigQuery views over a raw Cloud Firestore document changelog.",
      "",
      "Options:",
      "  --non-interactive                    Parse all input from command line flags instead of prompting.",
      "  -P, --project <project>              Firebase project ID of the Cloud Firestore database.",
      "  -B, --big-query-project <project>    Google Cloud project ID for BigQuery (defaults to --project).",
      "  -d, --dataset <dataset>              BigQuery dataset containing the raw changelog.",
      "  -t, --table-name-prefix <prefix>     Common prefix of the generated view names.",
      "  -f, --schema-files <schema-files>    File, directory or glob to read schemas from (repeatable).",
      "  --raw-changelog-table <table>        Raw changelog table (default: <prefix>_raw_changelog).",
      "  -h, --help                           Print this help.");

  CliArgs {
    schemaFiles = schemaFiles == null ? List.of() : List.copyOf(schemaFiles);
  }

  /** @throws IllegalArgumentException for unknown flags or a flag missing its value */
  static CliArgs parse(String[] args) {
    boolean nonInteractive = false;
    boolean help = false;
    String project = null;
    String bigQueryProject = null;
    String dataset = null;
    String prefix = null;
    String rawChangelog = null;
    List<String> files = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String inline = null;
      int eq = arg.indexOf('=');
      if (arg.startsWith("--") && eq > 0) {
        inline = arg.substring(eq + 1);
        arg = arg.substring(0, eq);
      }

      switch (arg) {
        case "--non-interactive" -> nonInteractive = true;
        case "-h", "--help" -> help = true;
        case "-P", "--project" -> project = inline != null ? inline : value(args, ++i, arg);
        case "-B", "--big-query-project" -> bigQueryProject = inline != null ? inline : value(args, ++i, arg);
        case "-d", "--dataset" -> dataset = inline != null ? inline : value(args, ++i, arg);
        case "-t", "--table-name-prefix" -> prefix = inline != null ? inline : value(args, ++i, arg);
        case "-f", "--schema-files" -> files.add(inline != null ? inline : value(args, ++i, arg));
        case "--raw-changelog-table" -> rawChangelog = inline != null ? inline : value(args, ++i, arg);
        default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
    }
    return new CliArgs(nonInteractive, help, project, bigQueryProject, dataset, prefix, files, rawChangelog);
  }

  /** True when every value non-interactive mode needs was given. */
  boolean complete() {
    return project != null && dataset != null && tableNamePrefix != null && !schemaFiles.isEmpty();
  }

  CliConfig toConfig() {
    return new CliConfig(project, bigQueryProject, dataset, tableNamePrefix, schemaFiles, rawChangelogTable);
  }

  private static String value(String[] args, int i, String flag) {
    if (i >= args.length || args[i].startsWith("-")) {
      throw new IllegalArgumentException("Option " + flag + " requires a value");
    }
    return args[i];
  }
}
