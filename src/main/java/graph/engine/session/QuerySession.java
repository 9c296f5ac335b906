package graph.engine.session;

import java.util.Map;

import com.google.gson.JsonObject;

import graph.engine.catalog.GraphCatalog;
import graph.engine.plan.ExecutionPlan;
import graph.engine.query.ParameterBinder;
import graph.engine.table.Datasets;
import graph.engine.table.ResultTable;
import graph.engine.table.Table;

/**
 * Reusable execution context: one built catalog plus one set of datasets.
 * Each call parses, compiles and executes with per-call state only, so a session can be
 * shared between threads.
 */
public class QuerySession {
    private final GraphCatalog catalog;
    private final Datasets datasets;

    public QuerySession(GraphCatalog catalog, Datasets datasets) {
        if (catalog == null) throw new IllegalArgumentException("catalog must not be null");
        if (datasets == null) throw new IllegalArgumentException("datasets must not be null");
        this.catalog = catalog;
        this.datasets = datasets;
    }

    public QuerySession(GraphCatalog catalog, Map<String, ? extends Table> datasets) {
        this(catalog, datasets == null ? null : Datasets.of(datasets));
    }

    public ResultTable execute(String query) {
        return execute(query, Map.of());
    }

    public ResultTable execute(String query, Map<String, ?> parameters) {
        return QueryPipeline.execute(compile(query, parameters), datasets);
    }

    public ResultTable execute(String query, JsonObject parameters) {
        return execute(query, ParameterBinder.fromJson(parameters));
    }

    /** Compiles without touching the datasets. */
    public ExecutionPlan compile(String query) {
        return compile(query, Map.of());
    }

    public ExecutionPlan compile(String query, Map<String, ?> parameters) {
        return QueryPipeline.compile(catalog, QueryPipeline.parse(query), parameters);
    }

    /** Rendered plan tree for the query. */
    public String explain(String query) {
        return compile(query).explain();
    }

    public GraphCatalog config() { return catalog; }

    public Datasets datasets() { return datasets; }
}
