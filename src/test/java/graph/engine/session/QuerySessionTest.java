package graph.engine.session;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

import graph.engine.SampleGraph;
import graph.engine.catalog.GraphCatalog;
import graph.engine.error.ErrorKind;
import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;
import graph.engine.table.ColumnarTable;
import graph.engine.table.Datasets;
import graph.engine.table.ResultTable;

public class QuerySessionTest {
    private final QuerySession session = new QuerySession(SampleGraph.catalog(), SampleGraph.datasets());

    private static List<Object> col(ResultTable t, String name) {
        return t.column(name);
    }

    private void assertError(ErrorKind kind, Stage stage, String query) {
        GraphQueryException ex = assertThrows(GraphQueryException.class, () -> session.execute(query), query);
        assertEquals(kind, ex.kind(), query);
        assertEquals(stage, ex.stage(), query);
    }

    @Test
    void basicProjection() {
        ResultTable t = session.execute("MATCH (p:Person) RETURN p.name, p.age");
        assertEquals(List.of("p.name", "p.age"), t.columnNames());
        assertEquals(4, t.rowCount());
        assertEquals(List.of("Alice", "Bob", "Carol", "David"), col(t, "p.name"));
    }

    @Test
    void filteredQuery() {
        ResultTable t = session.execute("MATCH (p:Person) WHERE p.age > 30 RETURN p.name, p.age");
        assertEquals(Set.of("Bob", "David"), new HashSet<>(col(t, "p.name")));
        for (Object age : col(t, "p.age")) assertTrue((Long) age > 30);
    }

    @Test
    void relationshipTraversal() {
        ResultTable t = session.execute("MATCH (p:Person)-[:WORKS_FOR]->(c:Company) "
            + "RETURN p.name AS person_name, c.company_name AS company_name");
        assertEquals(List.of("Alice", "Bob", "Carol", "David"), col(t, "person_name"));
        assertEquals(List.of("TechCorp", "TechCorp", "DataInc", "CloudSoft"), col(t, "company_name"));
    }

    @Test
    void incomingTraversal() {
        ResultTable t = session.execute("MATCH (c:Company)<-[:WORKS_FOR]-(p:Person) "
            + "WHERE c.company_name = 'TechCorp' RETURN p.name ORDER BY p.name");
        assertEquals(List.of("Alice", "Bob"), col(t, "p.name"));
    }

    @Test
    void undirectedTraversalMatchesBothOrientations() {
        ResultTable alice = session.execute("MATCH (a:Person)-[:FRIEND_OF]-(b:Person) WHERE a.name = 'Alice' "
            + "RETURN b.name ORDER BY b.name");
        assertEquals(List.of("Bob", "Carol"), col(alice, "b.name"));
        ResultTable david = session.execute("MATCH (a:Person {name: 'David'})-[:FRIEND_OF]-(b:Person) "
            + "RETURN b.name ORDER BY b.name");
        assertEquals(List.of("Bob", "Carol"), col(david, "b.name"));
        assertEquals(8L, session.execute("MATCH (a:Person)-[:FRIEND_OF]-(b:Person) RETURN count(*) AS n")
            .column("n").get(0));
    }

    @Test
    void multiHopTraversal() {
        ResultTable t = session.execute("MATCH (a:Person)-[:FRIEND_OF]->(b:Person)-[:WORKS_FOR]->(c:Company) "
            + "RETURN a.name, b.name, c.company_name");
        assertEquals(List.of("Alice", "Alice", "Bob", "Carol"), col(t, "a.name"));
        assertEquals(List.of("Bob", "Carol", "David", "David"), col(t, "b.name"));
        assertEquals(List.of("TechCorp", "DataInc", "CloudSoft", "CloudSoft"), col(t, "c.company_name"));
    }

    @Test
    void relationshipProperties() {
        ResultTable t = session.execute("MATCH (a:Person)-[f:FRIEND_OF]->(b:Person) WHERE f.years_known >= 3 "
            + "RETURN a.name, b.name, f.friendship_type AS kind");
        assertEquals(List.of("Alice", "Bob"), col(t, "a.name"));
        assertEquals(List.of("Bob", "David"), col(t, "b.name"));
        assertEquals(List.of("close", "close"), col(t, "kind"));
    }

    @Test
    void inlinePropertyMaps() {
        ResultTable t = session.execute("MATCH (p:Person {city: 'New York'}) RETURN p.name");
        assertEquals(List.of("Alice", "Carol"), col(t, "p.name"));
        ResultTable rel = session.execute("MATCH (a:Person)-[:FRIEND_OF {friendship_type: 'casual'}]->(b:Person) "
            + "RETURN a.name, b.name");
        assertEquals(List.of("Alice", "Carol"), col(rel, "a.name"));
        assertEquals(List.of("Carol", "David"), col(rel, "b.name"));
    }

    @Test
    void labelInferenceFromRelationship() {
        ResultTable t = session.execute("MATCH (p:Person)-[:WORKS_FOR]->(c) WHERE p.name = 'Carol' RETURN c.company_name");
        assertEquals(List.of("DataInc"), col(t, "c.company_name"));
    }

    @Test
    void aggregates() {
        ResultTable t = session.execute("MATCH (p:Person) RETURN count(*) as total, avg(p.age) as avg_age");
        assertEquals(4L, t.column("total").get(0));
        assertEquals(33.25, (Double) t.column("avg_age").get(0), 0.01);
        ResultTable stats = session.execute("MATCH (p:Person) RETURN min(p.age) AS lo, max(p.age) AS hi, sum(p.age) AS total");
        assertEquals(List.of(28L), col(stats, "lo"));
        assertEquals(List.of(42L), col(stats, "hi"));
        assertEquals(List.of(133L), col(stats, "total"));
    }

    @Test
    void groupedAggregationOrderedByAlias() {
        ResultTable t = session.execute("MATCH (p:Person)-[:WORKS_FOR]->(c:Company) "
            + "RETURN c.company_name AS company, count(*) AS n ORDER BY n DESC, company");
        assertEquals(List.of("TechCorp", "CloudSoft", "DataInc"), col(t, "company"));
        assertEquals(List.of(2L, 1L, 1L), col(t, "n"));
    }

    @Test
    void aggregationOverNoMatchesYieldsOneRow() {
        ResultTable t = session.execute("MATCH (p:Person) WHERE p.age > 100 RETURN count(*) AS n, avg(p.age) AS a");
        assertEquals(1, t.rowCount());
        assertEquals(0L, t.column("n").get(0));
        assertNull(t.column("a").get(0));
    }

    @Test
    void distinctAndCountDistinct() {
        ResultTable cities = session.execute("MATCH (p:Person) RETURN DISTINCT p.city ORDER BY p.city");
        assertEquals(List.of("Chicago", "New York", "San Francisco"), col(cities, "p.city"));
        ResultTable n = session.execute("MATCH (p:Person) RETURN count(DISTINCT p.city) AS n");
        assertEquals(List.of(3L), col(n, "n"));
    }

    @Test
    void orderingSkipAndLimit() {
        ResultTable t = session.execute("MATCH (p:Person) RETURN p.name ORDER BY p.age DESC SKIP 1 LIMIT 2");
        assertEquals(List.of("Bob", "Carol"), col(t, "p.name"));
        ResultTable byHiddenKey = session.execute("MATCH (p:Person) RETURN p.name AS name ORDER BY p.age");
        assertEquals(List.of("Alice", "Carol", "Bob", "David"), col(byHiddenKey, "name"));
        assertEquals(0, session.execute("MATCH (p:Person) RETURN p.name LIMIT 0").rowCount());
    }

    @Test
    void computedExpressions() {
        ResultTable t = session.execute("MATCH (p:Person) WHERE p.name STARTS WITH 'D' OR p.age IN [28, 29] "
            + "RETURN p.name, p.age + 1 AS next_age, p.age % 10 AS digit ORDER BY p.name");
        assertEquals(List.of("Alice", "Carol", "David"), col(t, "p.name"));
        assertEquals(List.of(29L, 30L, 43L), col(t, "next_age"));
        assertEquals(List.of(8L, 9L, 2L), col(t, "digit"));
    }

    @Test
    void parametersFromMapAndJson() {
        String q = "MATCH (p:Person) WHERE p.age > $min RETURN p.name";
        assertEquals(List.of("Bob", "David"), col(session.execute(q, Map.of("min", 30)), "p.name"));
        JsonObject json = new JsonObject();
        json.addProperty("min", 33.5);
        assertEquals(List.of("Bob", "David"), col(session.execute(q, json), "p.name"));
    }

    @Test
    void nullsAreFilteredAndSortedLast() {
        QuerySession withNulls = new QuerySession(SampleGraph.catalog(), SampleGraph.datasetsWithNulls());
        assertEquals(List.of("Bob"), col(withNulls.execute("MATCH (p:Person) WHERE p.age > 30 RETURN p.name"), "p.name"));
        assertEquals(List.of("Alice", "Bob"),
            col(withNulls.execute("MATCH (p:Person) WHERE NOT p.age > 100 RETURN p.name"), "p.name"));
        assertEquals(List.of("Eve"), col(withNulls.execute("MATCH (p:Person) WHERE p.city IS NULL RETURN p.name"), "p.name"));
        assertEquals(List.of("Bob", "Alice", "Eve"),
            col(withNulls.execute("MATCH (p:Person) RETURN p.name ORDER BY p.age DESC"), "p.name"));
        ResultTable stats = withNulls.execute("MATCH (p:Person) RETURN count(p.age) AS n, count(*) AS rows");
        assertEquals(List.of(2L), col(stats, "n"));
        assertEquals(List.of(3L), col(stats, "rows"));
        ResultTable grouped = withNulls.execute("MATCH (p:Person) RETURN p.city AS city, count(*) AS n");
        assertEquals(Arrays.asList("New York", "San Francisco", null), col(grouped, "city"));
    }

    @Test
    void crossJoinOfDisconnectedPatterns() {
        ResultTable t = session.execute("MATCH (p:Person), (c:Company) WHERE p.name = 'Alice' RETURN c.company_name");
        assertEquals(List.of("TechCorp", "DataInc", "CloudSoft"), col(t, "c.company_name"));
    }

    @Test
    void patternsSharingAVariable() {
        ResultTable t = session.execute("MATCH (a:Person)-[:WORKS_FOR]->(c:Company), (b:Person)-[:WORKS_FOR]->(c) "
            + "WHERE a.name = 'Alice' AND b.name <> 'Alice' RETURN b.name");
        assertEquals(List.of("Bob"), col(t, "b.name"));
    }

    @Test
    void labelsAreCaseInsensitive() {
        ResultTable t = session.execute("MATCH (p:PERSON)-[:works_for]->(c:company) RETURN count(*) AS n");
        assertEquals(List.of(4L), col(t, "n"));
    }

    @Test
    void configExposesCatalog() {
        assertTrue(session.config().nodeLabels().contains("person"));
        assertTrue(session.config().nodeLabels().contains("company"));
        assertTrue(session.config().relationshipTypes().contains("friend_of"));
    }

    @Test
    void multipleQueriesReuseTheSession() {
        ResultTable r1 = session.execute("MATCH (p:Person) WHERE p.age > 30 RETURN p.name");
        ResultTable r2 = session.execute("MATCH (p:Person) WHERE p.city = 'New York' RETURN p.name");
        ResultTable r3 = session.execute("MATCH (p:Person) RETURN count(*) as total");
        assertEquals(2, r1.rowCount());
        assertEquals(2, r2.rowCount());
        assertEquals(4L, r3.column("total").get(0));
        assertEquals(r1, session.execute("MATCH (p:Person) WHERE p.age > 30 RETURN p.name"));
    }

    @Test
    void executionErrors() {
        assertError(ErrorKind.COLUMN_NOT_FOUND, Stage.EXECUTE, "MATCH (p:Person) RETURN p.salary");
        assertError(ErrorKind.TYPE_MISMATCH, Stage.EXECUTE, "MATCH (p:Person) WHERE p.name > 3 RETURN p.name");
        assertError(ErrorKind.TYPE_MISMATCH, Stage.EXECUTE, "MATCH (p:Person) RETURN sum(p.name)");
        assertError(ErrorKind.TYPE_MISMATCH, Stage.EXECUTE, "MATCH (p:Person) WHERE p.age RETURN p.name");
        assertError(ErrorKind.TYPE_MISMATCH, Stage.COMPILE, "MATCH (p:Person) WHERE p.age > 'x' + 1 RETURN p.name");
        assertError(ErrorKind.UNBOUND_VARIABLE, Stage.COMPILE,
            "MATCH (p:Person) WHERE total > 1 RETURN count(*) AS total");
        assertError(ErrorKind.MISSING_PARAMETER, Stage.COMPILE, "MATCH (p:Person) WHERE p.age > $min RETURN p.name");
        assertError(ErrorKind.PARSE_ERROR, Stage.PARSE, "MATCH p:Person RETURN p.name");
    }

    @Test
    void missingDatasetIsAnExecutionError() {
        QuerySession partial = new QuerySession(SampleGraph.catalog(), Map.of("Person", SampleGraph.people()));
        assertEquals(4, partial.execute("MATCH (p:Person) RETURN p.name").rowCount());
        assertNotNull(partial.compile("MATCH (c:Company) RETURN c.company_name"));
        GraphQueryException ex = assertThrows(GraphQueryException.class,
            () -> partial.execute("MATCH (c:Company) RETURN c.company_name"));
        assertEquals(ErrorKind.MISSING_DATASET, ex.kind());
        assertEquals(Stage.EXECUTE, ex.stage());
    }

    @Test
    void datasetsMayBeKeyedByTableReferenceOrByLabel() {
        String q = "MATCH (p:Person)-[:WORKS_FOR]->(c:Company) RETURN p.name, c.company_name";
        ResultTable byLabel = new QuerySession(SampleGraph.catalogWithTableReferences(), Map.of(
            "Person", SampleGraph.people(), "Company", SampleGraph.companies(),
            "WORKS_FOR", SampleGraph.employment())).execute(q);
        ResultTable byTable = new QuerySession(SampleGraph.catalogWithTableReferences(), Map.of(
            "people", SampleGraph.people(), "companies", SampleGraph.companies(),
            "employment", SampleGraph.employment())).execute(q);
        ResultTable mixed = new QuerySession(SampleGraph.catalogWithTableReferences(), Map.of(
            "PEOPLE", SampleGraph.people(), "company", SampleGraph.companies(),
            "employment", SampleGraph.employment())).execute(q);

        assertEquals(List.of("Alice", "Bob", "Carol", "David"), col(byLabel, "p.name"));
        assertEquals(List.of("TechCorp", "TechCorp", "DataInc", "CloudSoft"), col(byLabel, "c.company_name"));
        assertEquals(byLabel, byTable);
        assertEquals(byLabel, mixed);
    }

    @Test
    void tableReferenceWinsOverLabelName() {
        ColumnarTable others = ColumnarTable.builder("people")
            .addColumn("person_id", List.of(9))
            .addColumn("name", List.of("Zed"))
            .build();
        QuerySession s = new QuerySession(SampleGraph.catalogWithTableReferences(),
            Map.of("people", others, "Person", SampleGraph.people()));
        assertEquals(List.of("Zed"), col(s.execute("MATCH (p:Person) RETURN p.name"), "p.name"));
    }

    @Test
    void missingDatasetNamesTableReferenceAndLabel() {
        QuerySession s = new QuerySession(SampleGraph.catalogWithTableReferences(), Map.of("Company", SampleGraph.companies()));
        GraphQueryException ex = assertThrows(GraphQueryException.class,
            () -> s.execute("MATCH (p:Person) RETURN p.name"));
        assertEquals(ErrorKind.MISSING_DATASET, ex.kind());
        assertTrue(ex.getMessage().contains("people or person"), ex.getMessage());
    }

    @Test
    void integerOverflowIsComputedInDouble() {
        GraphCatalog catalog = GraphCatalog.builder().withNodeLabel("Counter", "id").build();
        ColumnarTable counters = ColumnarTable.builder("Counter")
            .addColumn("id", List.of(1, 2))
            .addColumn("v", List.of(Long.MAX_VALUE, 1L))
            .build();
        QuerySession s = new QuerySession(catalog, Map.of("Counter", counters));

        assertEquals(List.of(Long.MAX_VALUE + 1.0), col(s.execute("MATCH (n:Counter) RETURN sum(n.v) AS total"), "total"));
        List<Object> plusOne = col(s.execute("MATCH (n:Counter) RETURN n.v + 1 AS w"), "w");
        assertEquals(Long.MAX_VALUE + 1.0, ((Number) plusOne.get(0)).doubleValue());
        assertEquals(2.0, ((Number) plusOne.get(1)).doubleValue());
    }

    @Test
    void explainDescribesThePlan() {
        String plan = session.explain("MATCH (p:Person)-[:WORKS_FOR]->(c:Company) WHERE c.industry = 'Cloud' RETURN p.name");
        assertTrue(plan.contains("Filter(c.industry = 'Cloud')"), plan);
        assertTrue(plan.contains("Scan(c <- Company"), plan);
    }

    @Test
    void concurrentExecutionIsDeterministic() throws Exception {
        String q = "MATCH (a:Person)-[:FRIEND_OF]-(b:Person) RETURN a.name, b.name, count(*) AS n";
        ResultTable expected = session.execute(q);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ResultTable>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) tasks.add(() -> session.execute(q));
            for (Future<ResultTable> f : pool.invokeAll(tasks)) assertEquals(expected, f.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void datasetsAreNotMutated() {
        Datasets data = SampleGraph.datasets();
        QuerySession s = new QuerySession(SampleGraph.catalog(), data);
        s.execute("MATCH (p:Person) WHERE p.age > 30 RETURN p.name ORDER BY p.name DESC");
        assertEquals(SampleGraph.people().column("name"), data.find("Person").orElseThrow().column("name"));
    }
}
