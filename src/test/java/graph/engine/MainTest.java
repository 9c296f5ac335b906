package graph.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import graph.engine.catalog.GraphCatalog;
import graph.engine.session.QuerySession;

public class MainTest {

    @Test
    void bundledCatalogMatchesBundledData() {
        GraphCatalog catalog = Main.loadSampleCatalog();
        assertEquals(SampleGraph.catalog(), catalog);
        QuerySession session = new QuerySession(catalog, Main.sampleData());
        assertEquals(List.of(4L), session.execute("MATCH (p:Person)-[:WORKS_FOR]->(c:Company) RETURN count(*) AS n")
            .column("n"));
    }
}
