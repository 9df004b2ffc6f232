package io.intellixity.changeview.spi.exec;

import io.intellixity.changeview.compile.*;
import io.intellixity.changeview.schema.Field;
import io.intellixity.changeview.schema.FirestoreSchema;
import io.intellixity.changeview.spi.sql.ArrayUnnest;
import io.intellixity.changeview.spi.sql.TypedViewSpec;
import io.intellixity.changeview.spi.sql.ViewDialect;
import io.intellixity.changeview.view.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles schemas into view definitions and installs them.
 *
 * Per schema: latest-snapshot view, top typed view, then one typed view per array field (recursively).
 * Compilation is pure; installation walks {@link SchemaViewState} and stops at the first rejected view
 * without rolling back. Schemas are independent: one failing schema does not affect the others.
 */
public final class SchemaViewFactory {
  private static final Logger log = LoggerFactory.getLogger(SchemaViewFactory.class);

  static final String LATEST_ALIAS = "latest";
  static final String PARENT_ALIAS = "parent";

  private final ViewDialect dialect;
  private final ViewResourceManager views;
  private final ViewTarget target;
  private final ChangelogLayout layout;

  public SchemaViewFactory(ViewDialect dialect, ViewResourceManager views, ViewTarget target, ChangelogLayout layout) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.views = Objects.requireNonNull(views, "views");
    this.target = Objects.requireNonNull(target, "target");
    this.layout = layout == null ? ChangelogLayout.DEFAULT : layout;
  }

  public SchemaViewFactory(ViewDialect dialect, ViewResourceManager views, ViewTarget target) {
    this(dialect, views, target, ChangelogLayout.DEFAULT);
  }

  public ViewTarget target() { return target; }

  /** Pure compilation; no views are touched. */
  public SchemaViewPlan compile(String schemaName, FirestoreSchema schema) {
    Objects.requireNonNull(schemaName, "schemaName");
    Objects.requireNonNull(schema, "schema");

    String latestName = ViewNames.latest(target.tableNamePrefix(), schemaName);
    String topName = ViewNames.schemaView(target.tableNamePrefix(), schemaName);
    String changelogRef = dialect.tableRef(target.projectId(), target.datasetId(), target.rawChangelogTable());
    ViewDefinition latest = new ViewDefinition(latestName, dialect.latestSnapshotSql(changelogRef, layout), Set.of());

    Set<String> names = new HashSet<>();
    names.add(latestName.toLowerCase(Locale.ROOT));
    List<ViewDefinition> typed = new ArrayList<>();
    Level top = new Level(topName, latestName, LATEST_ALIAS, null, List.of(), List.of());
    compileLevel(schemaName, top, schema.fields(), null, typed, names);

    return new SchemaViewPlan(schemaName, latest, typed.get(0), typed.subList(1, typed.size()));
  }

  /**
   * Compiles and installs one schema's views in dependency order.
   *
   * @throws SchemaViewException on the first compilation or creation failure
   */
  public SchemaViewPlan initializeSchemaViewResources(String schemaName, FirestoreSchema schema) {
    return install(compile(schemaName, schema), new Progress());
  }

  /**
   * Installs every schema sequentially. A failure is recorded in that schema's result and the next
   * schema is processed. A schema generating a view name already generated by an earlier schema of
   * the same call fails before any of its views is created. An empty map yields an empty list.
   */
  public List<SchemaViewResult> initializeAll(Map<String, FirestoreSchema> schemas) {
    if (schemas == null || schemas.isEmpty()) {
      log.info("changeview.views no schemas to process dataset={} prefix={}",
          target.datasetId(), target.tableNamePrefix());
      return List.of();
    }
    List<SchemaViewResult> out = new ArrayList<>(schemas.size());
    Map<String, String> claimed = new HashMap<>();
    for (var e : schemas.entrySet()) {
      Progress progress = new Progress();
      try {
        SchemaViewPlan plan = compile(e.getKey(), e.getValue());
        claim(plan, claimed);
        install(plan, progress);
        out.add(new SchemaViewResult(e.getKey(), progress.state, progress.created, null));
      } catch (SchemaViewException ex) {
        log.error("changeview.views_failed schema={} state={} error={}", e.getKey(), progress.state, ex.getMessage());
        out.add(new SchemaViewResult(e.getKey(), progress.state, progress.created, ex));
      }
    }
    return out;
  }

  private static void claim(SchemaViewPlan plan, Map<String, String> claimed) {
    for (String name : plan.viewNames()) {
      String owner = claimed.get(name.toLowerCase(Locale.ROOT));
      if (owner != null) {
        throw new InvalidSchemaStructureException(
            "View name '" + name + "' is already generated by schema '" + owner + "'",
            plan.schemaName(), name, null);
      }
    }
    for (String name : plan.viewNames()) {
      claimed.put(name.toLowerCase(Locale.ROOT), plan.schemaName());
    }
  }

  private SchemaViewPlan install(SchemaViewPlan plan, Progress progress) {
    String schemaName = plan.schemaName();
    log.info("changeview.views schema={} dataset={} views={}", schemaName, target.datasetId(), plan.all().size());

    create(schemaName, plan.latest(), progress);
    progress.state = SchemaViewState.LATEST_VIEW_CREATED;

    create(schemaName, plan.top(), progress);
    progress.state = SchemaViewState.TOP_VIEW_CREATED;

    if (!plan.children().isEmpty()) {
      for (ViewDefinition child : plan.children()) {
        create(schemaName, child, progress);
      }
      progress.state = SchemaViewState.CHILD_VIEWS_CREATED;
    }

    progress.state = SchemaViewState.DONE;
    log.info("changeview.views_done schema={} created={}", schemaName, progress.created);
    return plan;
  }

  private void create(String schemaName, ViewDefinition view, Progress progress) {
    if (log.isDebugEnabled()) {
      log.debug("changeview.create_view schema={} dataset={} view={} dependsOn={} sql={}",
          schemaName, target.datasetId(), view.viewName(), view.dependsOn(), view.sql());
    }
    try {
      views.createOrReplaceView(target.datasetId(), view.viewName(), view.sql());
    } catch (RuntimeException e) {
      throw ViewCreationFailedException.forSchema(schemaName, view, e);
    }
    progress.created.add(view.viewName());
  }

  private void compileLevel(String schemaName, Level level, List<Field> fields, Field element,
                            List<ViewDefinition> out, Set<String> names) {
    String fieldPath = String.join(".", level.absolutePath());
    if (!names.add(level.viewName().toLowerCase(Locale.ROOT))) {
      throw new InvalidSchemaStructureException("View name '" + level.viewName() + "' is generated more than once",
          schemaName, level.viewName(), fieldPath);
    }

    String data = dialect.dataExpression(level.sourceAlias(), layout, level.unnest());
    FieldFlattener flattener = new FieldFlattener(dialect, schemaName, data);
    FlattenResult flat = element == null ? flattener.flatten(fields, "") : flattener.flattenElement(element);

    String sourceRef = dialect.tableRef(target.projectId(), target.datasetId(), level.sourceView());
    TypedViewSpec spec = new TypedViewSpec(schemaName, level.viewName(), sourceRef, level.sourceAlias(), layout,
        level.carried(), level.unnest(), flat.columns(), flat.hasChildren());
    out.add(new ViewDefinition(level.viewName(), dialect.typedViewSql(spec), Set.of(level.sourceView())));

    List<String> carried = new ArrayList<>(level.carried());
    if (level.unnest() != null) carried.add(level.unnest().ordinalColumn());

    for (ChildSchema child : flat.childSchemas().values()) {
      List<String> absolute = new ArrayList<>(level.absolutePath());
      absolute.addAll(child.path());
      Level childLevel = new Level(
          ViewNames.child(level.viewName(), child.path()),
          level.viewName(),
          PARENT_ALIAS,
          new ArrayUnnest(child.path(), ViewNames.ordinalColumn(absolute)),
          absolute,
          carried);
      compileLevel(schemaName, childLevel, null, child.element(), out, names);
    }
  }

  private record Level(
      String viewName,
      String sourceView,
      String sourceAlias,
      ArrayUnnest unnest,
      List<String> absolutePath,
      List<String> carried
  ) {}

  private static final class Progress {
    SchemaViewState state = SchemaViewState.NOT_STARTED;
    final List<String> created = new ArrayList<>();
  }
}
