package io.intellixity.changeview.cli;

import java.util.regex.Pattern;

/** Identifier rules for command line and prompted input. */
final class InputValidation {
  static final Pattern BIGQUERY_VALID_CHARACTERS = Pattern.compile("^[a-zA-Z0-9_]+$");
  static final Pattern FIRESTORE_VALID_CHARACTERS = Pattern.compile("^[^/]+$");
  static final Pattern GCP_PROJECT_VALID_CHARACTERS = Pattern.compile("^[a-z][a-z0-9-]{0,29}$");

  private InputValidation() {}

  /** Returns an error message, or null when {@code value} is acceptable. */
  static String validate(String value, String name, Pattern pattern) {
    if (value == null || value.isBlank()) return "Please supply a " + name;
    if (!pattern.matcher(value).matches()) return "The " + name + " contains invalid characters: " + value;
    return null;
  }

  static String validateProject(String value) {
    return validate(value, "project ID", FIRESTORE_VALID_CHARACTERS);
  }

  static String validateBigQueryProject(String value) {
    return validate(value, "BigQuery project ID", GCP_PROJECT_VALID_CHARACTERS);
  }

  static String validateDataset(String value) {
    return validate(value, "dataset ID", BIGQUERY_VALID_CHARACTERS);
  }

  static String validateTableNamePrefix(String value) {
    return validate(value, "table name prefix", BIGQUERY_VALID_CHARACTERS);
  }
}
