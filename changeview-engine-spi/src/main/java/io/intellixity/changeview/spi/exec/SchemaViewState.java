package io.intellixity.changeview.spi.exec;

/** Progress of installing one schema's views. Views are created in this order. */
public enum SchemaViewState {
  NOT_STARTED,
  LATEST_VIEW_CREATED,
  TOP_VIEW_CREATED,
  /** Only reached by schemas with array fields. */
  CHILD_VIEWS_CREATED,
  DONE
}
