package graph.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import graph.engine.SampleGraph;
import graph.engine.plan.ExecutionPlan;
import graph.engine.plan.PatternCompiler;
import graph.engine.query.CypherParser;
import graph.engine.table.ResultTable;

public class ExecutionEngineTest {
    private final ExecutionEngine engine = new ExecutionEngine();

    private ExecutionPlan plan(String text) {
        return new PatternCompiler(SampleGraph.catalog()).compile(new CypherParser().parse(text));
    }

    @Test
    void filterOverScanIsFusedIntoTheScan() {
        ExecutionPlan plan = plan("MATCH (p:Person) WHERE p.age > 30 RETURN p.name");
        Operator root = engine.build(plan.root(), SampleGraph.datasets());
        assertInstanceOf(ProjectionOperator.class, root);
        ResultTable t = engine.execute(plan, SampleGraph.datasets());
        assertEquals(List.of("Bob", "David"), t.column("p.name"));
    }

    @Test
    void streamingMatchesMaterializedExecution() {
        ExecutionPlan plan = plan("MATCH (p:Person)-[:WORKS_FOR]->(c:Company) RETURN p.name, c.company_name");
        List<List<Object>> streamed = new ArrayList<>();
        for (Row r : engine.stream(plan, SampleGraph.datasets())) streamed.add(r.values());
        ResultTable t = engine.execute(plan, SampleGraph.datasets());
        assertEquals(t.rowCount(), streamed.size());
        for (int i = 0; i < streamed.size(); i++) assertEquals(t.row(i), streamed.get(i));
    }

    @Test
    void emptyMatchKeepsColumns() {
        ResultTable t = engine.execute(plan("MATCH (p:Person) WHERE p.age > 99 RETURN p.name AS name"),
            SampleGraph.datasets());
        assertEquals(0, t.rowCount());
        assertEquals(List.of("name"), t.columnNames());
    }
}
