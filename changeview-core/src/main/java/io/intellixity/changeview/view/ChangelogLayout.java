package io.intellixity.changeview.view;

import java.util.Objects;

/**
 * Column names of the raw changelog table, as written by the export pipeline.
 * <p>
 * {@code sequenceColumn} breaks ties between writes carrying the same timestamp; the latest row wins.
 */
public record ChangelogLayout(
    String documentNameColumn,
    String documentIdColumn,
    String timestampColumn,
    String sequenceColumn,
    String operationColumn,
    String dataColumn,
    String deleteOperation
) {
  public static final ChangelogLayout DEFAULT = new ChangelogLayout(
      "document_name", "document_id", "timestamp", "event_id", "operation", "data", "DELETE");

  public ChangelogLayout {
    Objects.requireNonNull(documentNameColumn, "documentNameColumn");
    Objects.requireNonNull(timestampColumn, "timestampColumn");
    Objects.requireNonNull(sequenceColumn, "sequenceColumn");
    Objects.requireNonNull(operationColumn, "operationColumn");
    Objects.requireNonNull(dataColumn, "dataColumn");
    Objects.requireNonNull(deleteOperation, "deleteOperation");
  }

  public ChangelogLayout withSequenceColumn(String column) {
    return new ChangelogLayout(documentNameColumn, documentIdColumn, timestampColumn, column,
        operationColumn, dataColumn, deleteOperation);
  }
}
