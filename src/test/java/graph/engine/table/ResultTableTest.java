package graph.engine.table;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import graph.engine.catalog.DataType;

public class ResultTableTest {

    private static ResultTable sample() {
        return ResultTable.fromRows(List.of("name", "age"), List.of(
            Arrays.asList("Alice", 28),
            Arrays.asList("Eve", null)));
    }

    @Test
    void exposesColumnsAndRows() {
        ResultTable t = sample();
        assertEquals(List.of("name", "age"), t.columnNames());
        assertEquals(List.of("Alice", "Eve"), t.toColumns().get("name"));
        Map<String, Object> first = t.toRows().get(0);
        assertEquals(List.of("name", "age"), List.copyOf(first.keySet()));
        assertEquals(28L, first.get("age"));
        assertEquals(DataType.INT, t.schema().get(1).type());
    }

    @Test
    void mixedIntegerAndFloatColumnsWiden() {
        ResultTable t = ResultTable.fromRows(List.of("x"), List.of(List.of(1), List.of(2.5)));
        assertEquals(List.of(1.0, 2.5), t.column("x"));
    }

    @Test
    void equalityIsByValue() {
        assertEquals(sample(), sample());
        assertEquals(sample().hashCode(), sample().hashCode());
        ResultTable reordered = ResultTable.fromRows(List.of("name", "age"), List.of(
            Arrays.asList("Eve", null),
            Arrays.asList("Alice", 28)));
        assertNotEquals(sample(), reordered);
    }

    @Test
    void jsonKeepsNulls() {
        JsonArray rows = JsonParser.parseString(sample().toJson()).getAsJsonArray();
        assertEquals(2, rows.size());
        JsonObject eve = rows.get(1).getAsJsonObject();
        assertEquals("Eve", eve.get("name").getAsString());
        assertTrue(eve.has("age"));
        assertTrue(eve.get("age").isJsonNull());
    }

    @Test
    void emptyTableKeepsColumnNames() {
        ResultTable t = ResultTable.empty(List.of("a", "b"));
        assertEquals(0, t.rowCount());
        assertEquals(List.of("a", "b"), t.columnNames());
    }
}
