package graph.engine.session;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import graph.engine.SampleGraph;
import graph.engine.error.ErrorKind;
import graph.engine.error.GraphQueryException;
import graph.engine.table.ResultTable;

public class BoundQueryTest {

    private static final List<String> QUERIES = List.of(
        "MATCH (p:Person) WHERE p.age > 30 RETURN p.name, p.age ORDER BY p.age",
        "MATCH (p:Person) RETURN p.name, p.city",
        "MATCH (p:Person)-[:WORKS_FOR]->(c:Company) RETURN c.company_name AS company, count(*) AS n",
        "MATCH (a:Person)-[:FRIEND_OF]-(b:Person) RETURN a.name, b.name");

    @Test
    void matchesSessionExecution() {
        QuerySession session = new QuerySession(SampleGraph.catalog(), SampleGraph.datasets());
        for (String q : QUERIES) {
            ResultTable viaSession = session.execute(q);
            ResultTable viaBound = BoundQuery.of(q).withConfig(SampleGraph.catalog()).execute(SampleGraph.datasets());
            assertEquals(viaSession, viaBound, q);
            assertEquals(viaSession.toRows(), viaBound.toRows(), q);
        }
    }

    @Test
    void acceptsPlainMapsAndParameters() {
        ResultTable t = BoundQuery.of("MATCH (p:Person) WHERE p.city = $city RETURN p.name")
            .withConfig(SampleGraph.catalog())
            .withParameters(Map.of("city", "New York"))
            .execute(Map.of("Person", SampleGraph.people()));
        assertEquals(List.of("Alice", "Carol"), t.column("p.name"));
    }

    @Test
    void parsesEagerly() {
        GraphQueryException ex = assertThrows(GraphQueryException.class, () -> BoundQuery.of("MATCH RETURN"));
        assertEquals(ErrorKind.PARSE_ERROR, ex.kind());
    }

    @Test
    void requiresCatalogBeforePlanning() {
        BoundQuery q = BoundQuery.of("MATCH (p:Person) RETURN p.name");
        assertThrows(IllegalStateException.class, q::plan);
        assertNotNull(q.withConfig(SampleGraph.catalog()).plan());
    }
}
