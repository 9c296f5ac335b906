package graph.engine.session;

import java.util.Map;

import graph.engine.catalog.GraphCatalog;
import graph.engine.exec.ExecutionEngine;
import graph.engine.plan.ExecutionPlan;
import graph.engine.plan.PatternCompiler;
import graph.engine.query.CypherParser;
import graph.engine.query.CypherQuery;
import graph.engine.query.ParameterBinder;
import graph.engine.table.Datasets;
import graph.engine.table.ResultTable;

/**
 * parse -> bind parameters -> compile -> execute, shared by the session and the bound query
 * so both paths produce the same result for the same inputs.
 */
final class QueryPipeline {
    private static final CypherParser PARSER = new CypherParser();
    private static final ExecutionEngine ENGINE = new ExecutionEngine();

    private QueryPipeline() {}

    static CypherQuery parse(String text) {
        if (text == null) throw new IllegalArgumentException("query text must not be null");
        return PARSER.parse(text);
    }

    static ExecutionPlan compile(GraphCatalog catalog, CypherQuery query, Map<String, ?> parameters) {
        CypherQuery bound = ParameterBinder.bind(query, parameters == null ? Map.of() : parameters);
        return new PatternCompiler(catalog).compile(bound);
    }

    static ResultTable execute(ExecutionPlan plan, Datasets datasets) {
        return ENGINE.execute(plan, datasets);
    }
}
