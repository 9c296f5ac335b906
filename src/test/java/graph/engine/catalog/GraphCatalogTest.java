package graph.engine.catalog;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import graph.engine.SampleGraph;
import graph.engine.error.ErrorKind;
import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;

public class GraphCatalogTest {

    @Test
    void labelsAndTypesAreNormalizedToLowercase() {
        GraphCatalog catalog = SampleGraph.catalog();
        assertTrue(catalog.nodeLabels().contains("person"));
        assertTrue(catalog.nodeLabels().contains("company"));
        assertTrue(catalog.relationshipTypes().contains("works_for"));
        assertEquals("person_id", catalog.resolveLabel("PERSON").idColumn());
        assertEquals("Person", catalog.resolveLabel("person").tableReference());
        RelationshipBinding rel = catalog.resolveRelationship("Works_For");
        assertEquals("person_id", rel.fromColumn());
        assertEquals("company_id", rel.toColumn());
    }

    @Test
    void unknownNamesFailAtCompileStage() {
        GraphCatalog catalog = SampleGraph.catalog();
        GraphQueryException label = assertThrows(GraphQueryException.class, () -> catalog.resolveLabel("Animal"));
        assertEquals(ErrorKind.UNKNOWN_LABEL, label.kind());
        assertEquals(Stage.COMPILE, label.stage());
        GraphQueryException type = assertThrows(GraphQueryException.class, () -> catalog.resolveRelationship("LIKES"));
        assertEquals(ErrorKind.UNKNOWN_RELATIONSHIP_TYPE, type.kind());
        assertTrue(catalog.findLabel("animal").isEmpty());
    }

    @Test
    void identicalReRegistrationIsAccepted() {
        GraphCatalog catalog = GraphCatalog.builder()
            .withNodeLabel("Person", "person_id")
            .withNodeLabel("Person", "person_id")
            .build();
        assertEquals(1, catalog.nodeLabels().size());
    }

    @Test
    void labelsDifferingOnlyInCaseConflict() {
        GraphCatalog.Builder builder = GraphCatalog.builder().withNodeLabel("Person", "person_id");
        GraphQueryException ex = assertThrows(GraphQueryException.class,
            () -> builder.withNodeLabel("PERSON", "id"));
        assertEquals(ErrorKind.DUPLICATE_BINDING, ex.kind());
    }

    @Test
    void labelAndRelationshipTypeCannotShareAName() {
        GraphCatalog.Builder builder = GraphCatalog.builder().withNodeLabel("Knows", "id");
        GraphQueryException ex = assertThrows(GraphQueryException.class,
            () -> builder.withRelationship("KNOWS", "a", "b"));
        assertEquals(ErrorKind.DUPLICATE_BINDING, ex.kind());
    }

    @Test
    void blankColumnsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> GraphCatalog.builder().withNodeLabel("Person", " "));
    }

    @Test
    void builderCanBuildRepeatedly() {
        GraphCatalog.Builder builder = GraphCatalog.builder().withNodeLabel("Person", "person_id");
        GraphCatalog first = builder.build();
        builder.withNodeLabel("Company", "company_id");
        GraphCatalog second = builder.build();
        assertEquals(1, first.nodeLabels().size());
        assertEquals(2, second.nodeLabels().size());
        assertNotEquals(first, second);
    }
}
