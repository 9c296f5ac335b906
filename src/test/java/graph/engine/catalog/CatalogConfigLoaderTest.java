package graph.engine.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import graph.engine.SampleGraph;

public class CatalogConfigLoaderTest {
    private final CatalogConfigLoader loader = new CatalogConfigLoader();

    @Test
    void loadsNodesAndRelationships() {
        GraphCatalog catalog = loader.fromJson("""
            { "nodes": [ {"label": "Person", "table": "people", "idColumn": "person_id"} ],
              "relationships": [ {"type": "KNOWS", "fromColumn": "src", "toColumn": "dst"} ] }
            """);
        assertEquals("people", catalog.resolveLabel("person").tableReference());
        RelationshipBinding knows = catalog.resolveRelationship("knows");
        assertEquals("KNOWS", knows.tableReference());
        assertEquals("src", knows.fromColumn());
    }

    @Test
    void writesWhatItReads(@TempDir Path dir) {
        GraphCatalog catalog = SampleGraph.catalog();
        Path file = dir.resolve("catalog.json");
        loader.save(catalog, file);
        assertTrue(Files.exists(file));
        assertEquals(catalog, loader.load(file));
        assertEquals(catalog, loader.fromJson(loader.toJson(catalog)));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> loader.fromJson("{ \"nodes\": [ "));
        assertThrows(IllegalArgumentException.class, () -> loader.fromJson(""));
        assertThrows(IllegalArgumentException.class, () -> loader.fromJson("{\"nodes\": [ {\"idColumn\": \"id\"} ]}"));
    }
}
