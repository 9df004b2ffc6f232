package io.intellixity.changeview.bigquery;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.ViewDefinition;
import io.intellixity.changeview.spi.exec.ViewResourceManager;
import io.intellixity.changeview.view.ViewCreationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Installs views through the BigQuery tables API.
 * <p>
 * A missing view is created; an existing view gets its query replaced; an existing table or other
 * non-view resource with the same name is left untouched and reported as a failure.
 */
public final class BigQueryViewResourceManager implements ViewResourceManager {
  private static final Logger LOG = LoggerFactory.getLogger(BigQueryViewResourceManager.class);

  private final BigQuery bigQuery;
  private final String projectId;

  public BigQueryViewResourceManager(BigQuery bigQuery, String projectId) {
    this.bigQuery = Objects.requireNonNull(bigQuery, "bigQuery");
    this.projectId = projectId;
  }

  public BigQueryViewResourceManager(BigQuery bigQuery) {
    this(bigQuery, bigQuery.getOptions().getProjectId());
  }

  @Override
  public void createOrReplaceView(String datasetId, String viewName, String sql) {
    TableId tableId = projectId == null ? TableId.of(datasetId, viewName) : TableId.of(projectId, datasetId, viewName);
    ViewDefinition definition = ViewDefinition.newBuilder(sql).setUseLegacySql(false).build();
    try {
      Table existing = bigQuery.getTable(tableId);
      if (existing == null) {
        LOG.info("Creating view {}.{}", datasetId, viewName);
        bigQuery.create(TableInfo.of(tableId, definition));
        return;
      }

      TableDefinition current = existing.getDefinition();
      if (current == null || !TableDefinition.Type.VIEW.equals(current.getType())) {
        throw new ViewCreationFailedException(
            "A non-view resource of type " + (current == null ? "unknown" : current.getType())
                + " already exists with this name", viewName, sql, null);
      }
      LOG.info("Updating view {}.{}", datasetId, viewName);
      bigQuery.update(TableInfo.of(tableId, definition));
    } catch (BigQueryException e) {
      throw new ViewCreationFailedException("BigQuery rejected view: " + e.getMessage(), viewName, sql, e);
    }
  }
}
