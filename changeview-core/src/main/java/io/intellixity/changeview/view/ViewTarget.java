package io.intellixity.changeview.view;

import java.util.Objects;

/**
 * Where views are installed and which changelog they read.
 *
 * @param projectId database project (BigQuery project id; ignored by dialects without projects)
 * @param datasetId dataset / schema holding both the raw changelog and the generated views
 * @param tableNamePrefix common prefix of every generated view name
 * @param rawChangelogTable raw changelog table name; defaults to {@code <prefix>_raw_changelog}
 */
public record ViewTarget(
    String projectId,
    String datasetId,
    String tableNamePrefix,
    String rawChangelogTable
) {
  public static final String RAW_CHANGELOG_SUFFIX = "_raw_changelog";

  public ViewTarget {
    Objects.requireNonNull(datasetId, "datasetId");
    Objects.requireNonNull(tableNamePrefix, "tableNamePrefix");
    if (datasetId.isBlank()) throw new IllegalArgumentException("datasetId is blank");
    if (tableNamePrefix.isBlank()) throw new IllegalArgumentException("tableNamePrefix is blank");
    if (rawChangelogTable == null || rawChangelogTable.isBlank()) {
      rawChangelogTable = tableNamePrefix + RAW_CHANGELOG_SUFFIX;
    }
  }

  public ViewTarget(String projectId, String datasetId, String tableNamePrefix) {
    this(projectId, datasetId, tableNamePrefix, null);
  }
}
