package graph.engine.catalog;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Reads and writes catalog definitions as JSON:
 * <pre>
 * { "nodes": [ {"label": "Person", "table": "people", "idColumn": "person_id"} ],
 *   "relationships": [ {"type": "WORKS_FOR", "table": "employment",
 *                       "fromColumn": "person_id", "toColumn": "company_id"} ] }
 * </pre>
 * "table" may be omitted, in which case the label / type name is used.
 */
public class CatalogConfigLoader {
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public GraphCatalog load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed loading catalog file: " + file, e);
        }
    }

    public GraphCatalog load(Reader reader) {
        CatalogFile parsed;
        try {
            parsed = gson.fromJson(reader, CatalogFile.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed catalog JSON: " + e.getMessage(), e);
        }
        if (parsed == null) throw new IllegalArgumentException("Empty catalog JSON");
        GraphCatalog.Builder builder = GraphCatalog.builder();
        if (parsed.nodes() != null) {
            for (NodeEntry n : parsed.nodes()) {
                if (n == null || n.label() == null) throw new IllegalArgumentException("Node entry requires 'label'");
                builder.addNodeLabel(n.label(), n.table() != null ? n.table() : n.label(), n.idColumn());
            }
        }
        if (parsed.relationships() != null) {
            for (RelationshipEntry r : parsed.relationships()) {
                if (r == null || r.type() == null) throw new IllegalArgumentException("Relationship entry requires 'type'");
                builder.addRelationship(r.type(), r.fromColumn(), r.toColumn(), r.table() != null ? r.table() : r.type());
            }
        }
        return builder.build();
    }

    public GraphCatalog fromJson(String json) {
        return load(new StringReader(json));
    }

    public String toJson(GraphCatalog catalog) {
        return gson.toJson(toFile(catalog));
    }

    public void save(GraphCatalog catalog, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(toFile(catalog), writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed saving catalog file: " + file, e);
        }
    }

    private CatalogFile toFile(GraphCatalog catalog) {
        List<NodeEntry> nodes = new ArrayList<>();
        for (NodeBinding n : catalog.nodeBindings().values()) {
            nodes.add(new NodeEntry(n.label(), n.tableReference(), n.idColumn()));
        }
        List<RelationshipEntry> rels = new ArrayList<>();
        for (RelationshipBinding r : catalog.relationshipBindings().values()) {
            rels.add(new RelationshipEntry(r.type(), r.tableReference(), r.fromColumn(), r.toColumn()));
        }
        return new CatalogFile(nodes, rels);
    }

    private record CatalogFile(List<NodeEntry> nodes, List<RelationshipEntry> relationships) {}

    private record NodeEntry(String label, String table, String idColumn) {}

    private record RelationshipEntry(String type, String table, String fromColumn, String toColumn) {}
}
