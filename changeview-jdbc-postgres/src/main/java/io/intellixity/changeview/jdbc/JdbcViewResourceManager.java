package io.intellixity.changeview.jdbc;

import io.intellixity.changeview.spi.exec.ViewResourceManager;
import io.intellixity.changeview.spi.sql.ViewDialect;
import io.intellixity.changeview.view.ViewCreationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/** Installs views by executing the dialect's {@code CREATE OR REPLACE VIEW} over JDBC (auto-commit). */
public final class JdbcViewResourceManager implements ViewResourceManager {
  private static final Logger log = LoggerFactory.getLogger(JdbcViewResourceManager.class);

  private final DataSource ds;
  private final ViewDialect dialect;

  public JdbcViewResourceManager(DataSource ds, ViewDialect dialect) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public void createOrReplaceView(String datasetId, String viewName, String sql) {
    String ddl = dialect.createViewDdl(dialect.tableRef(null, datasetId, viewName), sql);
    long start = System.nanoTime();
    try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
      st.execute(ddl);
    } catch (SQLException e) {
      throw new ViewCreationFailedException(
          "Database rejected view (sqlState=" + e.getSQLState() + "): " + e.getMessage(), viewName, ddl, e);
    }
    if (log.isDebugEnabled()) {
      log.debug("changeview.jdbc_done op=create_view dialect={} schema={} view={} durationMs={}",
          dialect.id(), datasetId, viewName, (System.nanoTime() - start) / 1_000_000.0);
    }
  }
}
