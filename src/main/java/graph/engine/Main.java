package graph.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Scanner;

import graph.engine.catalog.CatalogConfigLoader;
import graph.engine.catalog.GraphCatalog;
import graph.engine.cli.TablePrinter;
import graph.engine.error.GraphQueryException;
import graph.engine.session.QuerySession;
import graph.engine.table.ColumnarTable;
import graph.engine.table.Datasets;

/**
 * Interactive shell over a small built-in people / companies graph.
 * Usage: Main [catalog.json]. Without an argument the bundled sample catalog is used.
 * Prefix a query with "explain " to print its plan instead of running it.
 */
public class Main {
    private static final String SAMPLE_CATALOG = "/sample-catalog.json";

    public static void main(String[] args) {
        GraphCatalog catalog = args.length > 0
            ? new CatalogConfigLoader().load(Path.of(args[0]))
            : loadSampleCatalog();
        System.out.println("Labels: " + catalog.nodeLabels() + ", relationship types: " + catalog.relationshipTypes() + "\n");

        QuerySession session = new QuerySession(catalog, sampleData());
        System.out.println("Query mode (type 'exit' to quit)\n");
        try (Scanner scanner = new Scanner(System.in)) {
            while (true) {
                System.out.print("cypher> ");
                String line;
                try {
                    line = scanner.nextLine();
                } catch (NoSuchElementException eof) {
                    break;
                }
                line = line.trim();
                if (line.equalsIgnoreCase("exit")) {
                    System.out.println("Exiting query mode");
                    break;
                }
                if (line.isEmpty()) continue;
                try {
                    if (line.regionMatches(true, 0, "explain ", 0, 8)) {
                        System.out.print(session.explain(line.substring(8)));
                    } else {
                        TablePrinter.print(session.execute(line));
                    }
                } catch (GraphQueryException ex) {
                    System.out.println("Error [" + ex.kind() + " @ " + ex.stage() + "]: " + ex.getMessage());
                } catch (IllegalArgumentException ex) {
                    System.out.println("Error: " + ex.getMessage());
                }
            }
        }
    }

    static GraphCatalog loadSampleCatalog() {
        InputStream in = Main.class.getResourceAsStream(SAMPLE_CATALOG);
        if (in == null) throw new IllegalStateException("Missing resource " + SAMPLE_CATALOG);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new CatalogConfigLoader().load(reader);
        } catch (IOException e) {
            System.err.println("[Main] Failed reading " + SAMPLE_CATALOG + ": " + e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    static Datasets sampleData() {
        return Datasets.builder()
            .put("Person", ColumnarTable.builder("Person")
                .addColumn("person_id", List.of(1, 2, 3, 4))
                .addColumn("name", List.of("Alice", "Bob", "Carol", "David"))
                .addColumn("age", List.of(28, 34, 29, 42))
                .addColumn("city", List.of("New York", "San Francisco", "New York", "Chicago"))
                .build())
            .put("Company", ColumnarTable.builder("Company")
                .addColumn("company_id", List.of(101, 102, 103))
                .addColumn("company_name", List.of("TechCorp", "DataInc", "CloudSoft"))
                .addColumn("industry", List.of("Technology", "Analytics", "Cloud"))
                .build())
            .put("WORKS_FOR", ColumnarTable.builder("WORKS_FOR")
                .addColumn("person_id", List.of(1, 2, 3, 4))
                .addColumn("company_id", List.of(101, 101, 102, 103))
                .addColumn("position", List.of("Engineer", "Designer", "Manager", "Director"))
                .addColumn("salary", List.of(120000, 95000, 130000, 180000))
                .build())
            .put("FRIEND_OF", ColumnarTable.builder("FRIEND_OF")
                .addColumn("person1_id", List.of(1, 1, 2, 3))
                .addColumn("person2_id", List.of(2, 3, 4, 4))
                .addColumn("friendship_type", List.of("close", "casual", "close", "casual"))
                .addColumn("years_known", List.of(5, 2, 3, 1))
                .build())
            .build();
    }
}

/* -------------------------------------------------------------------------
 * Example queries:
 *   MATCH (p:Person) WHERE p.age > 30 RETURN p.name, p.age ORDER BY p.age
 *   MATCH (p:Person)-[:WORKS_FOR]->(c:Company) RETURN p.name AS person, c.company_name AS company
 *   MATCH (a:Person)-[f:FRIEND_OF]-(b:Person) WHERE f.years_known >= 3 RETURN a.name, b.name
 *   MATCH (p:Person) RETURN p.city, count(*) AS n, avg(p.age) AS avg_age ORDER BY n DESC
 *   explain MATCH (p:Person)-[:WORKS_FOR]->(c:Company) WHERE c.industry = 'Cloud' RETURN p.name
 * ------------------------------------------------------------------------- */
