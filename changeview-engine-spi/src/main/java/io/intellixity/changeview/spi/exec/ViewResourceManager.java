package io.intellixity.changeview.spi.exec;

/**
 * View-management capability of the target database.
 * <p>
 * Implementations must be idempotent: an existing view with the same name is replaced, never duplicated.
 * Failures are reported as {@link io.intellixity.changeview.view.ViewCreationFailedException}; no retries.
 */
public interface ViewResourceManager {
  void createOrReplaceView(String datasetId, String viewName, String sql);
}
