package graph.engine.session;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.JsonObject;

import graph.engine.catalog.GraphCatalog;
import graph.engine.plan.ExecutionPlan;
import graph.engine.query.CypherQuery;
import graph.engine.query.ParameterBinder;
import graph.engine.table.Datasets;
import graph.engine.table.ResultTable;
import graph.engine.table.Table;

/**
 * Single-shot entry point: query text bound to a catalog, datasets supplied at execution.
 * The text is parsed when the query is created. Instances are immutable; the with* methods
 * return copies.
 */
public final class BoundQuery {
    private final String text;
    private final CypherQuery parsed;
    private final GraphCatalog catalog; // null until withConfig
    private final Map<String, Object> parameters;

    private BoundQuery(String text, CypherQuery parsed, GraphCatalog catalog, Map<String, Object> parameters) {
        this.text = text;
        this.parsed = parsed;
        this.catalog = catalog;
        this.parameters = parameters;
    }

    public static BoundQuery of(String text) {
        return new BoundQuery(text, QueryPipeline.parse(text), null, Map.of());
    }

    public BoundQuery withConfig(GraphCatalog catalog) {
        if (catalog == null) throw new IllegalArgumentException("catalog must not be null");
        return new BoundQuery(text, parsed, catalog, parameters);
    }

    public BoundQuery withParameters(Map<String, ?> parameters) {
        if (parameters == null) throw new IllegalArgumentException("parameters must not be null");
        return new BoundQuery(text, parsed, catalog, new LinkedHashMap<>(parameters));
    }

    public BoundQuery withParameters(JsonObject parameters) {
        return withParameters(ParameterBinder.fromJson(parameters));
    }

    public String text() { return text; }

    public CypherQuery query() { return parsed; }

    public ExecutionPlan plan() {
        if (catalog == null) throw new IllegalStateException("No catalog bound; call withConfig first");
        return QueryPipeline.compile(catalog, parsed, parameters);
    }

    public ResultTable execute(Datasets datasets) {
        if (datasets == null) throw new IllegalArgumentException("datasets must not be null");
        return QueryPipeline.execute(plan(), datasets);
    }

    public ResultTable execute(Map<String, ? extends Table> datasets) {
        if (datasets == null) throw new IllegalArgumentException("datasets must not be null");
        return execute(Datasets.of(datasets));
    }

    @Override
    public String toString() { return "BoundQuery{" + text + "}"; }
}
