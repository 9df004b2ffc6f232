package io.intellixity.changeview.cli;

import java.util.List;

/** Resolved run configuration of {@code gen-schema-views}. */
public record CliConfig(
    String projectId,
    String bigQueryProjectId,
    String datasetId,
    String tableNamePrefix,
    List<String> schemaFiles,
    /** Optional override of the {@code <prefix>_raw_changelog} convention. */
    String rawChangelogTable
) {
  public CliConfig {
    schemaFiles = schemaFiles == null ? List.of() : List.copyOf(schemaFiles);
    if (bigQueryProjectId == null || bigQueryProjectId.isBlank()) bigQueryProjectId = projectId;
  }
}
