package graph.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;
import graph.engine.expr.Values;
import graph.engine.plan.JoinKey;

/**
 * Hash INNER JOIN on one or more equality keys; with no keys, a cross product.
 * The right side is materialized on open and probed per left row. Output keeps left order,
 * and within one left row the right side's order. Null keys never match.
 */
public class JoinOperator implements Operator {
    private final Operator left;
    private final Operator right;
    private final int[] leftKeys;
    private final int[] rightKeys;
    private final RowSchema joinedSchema;

    // Materialized right side keyed by join value for faster lookup
    private Map<List<Object>, List<Row>> rightHash;
    private List<Row> rightRows; // cross join only
    private Row currentLeft;
    private List<Row> currentMatchList = Collections.emptyList();
    private int matchIndex = 0;

    public JoinOperator(Operator left, Operator right, List<JoinKey> keys) {
        this.left = left;
        this.right = right;
        this.leftKeys = new int[keys.size()];
        this.rightKeys = new int[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            leftKeys[i] = left.schema().indexOf(keys.get(i).leftColumn());
            rightKeys[i] = right.schema().indexOf(keys.get(i).rightColumn());
        }
        this.joinedSchema = left.schema().concat(right.schema());
    }

    @Override
    public void open() {
        left.open();
        right.open();
        rightHash = new HashMap<>();
        rightRows = new ArrayList<>();
        Row r;
        while ((r = right.next()) != null) {
            if (leftKeys.length == 0) {
                rightRows.add(r);
                continue;
            }
            List<Object> key = keyOf(r, rightKeys);
            if (key != null) rightHash.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        right.close(); // no longer needed
        currentLeft = left.next();
        currentMatchList = Collections.emptyList();
        matchIndex = 0;
    }

    @Override
    public Row next() {
        while (true) {
            if (currentLeft == null) return null;

            if (matchIndex < currentMatchList.size()) {
                Row output = Row.concat(joinedSchema, currentLeft, currentMatchList.get(matchIndex++));
                if (matchIndex >= currentMatchList.size()) {
                    currentLeft = left.next();
                    currentMatchList = Collections.emptyList();
                    matchIndex = 0;
                }
                return output;
            }

            List<Row> matches;
            if (leftKeys.length == 0) {
                matches = rightRows;
            } else {
                List<Object> key = keyOf(currentLeft, leftKeys);
                matches = key == null ? null : rightHash.get(key);
            }
            if (matches == null || matches.isEmpty()) {
                currentLeft = left.next();
                continue;
            }
            currentMatchList = matches;
            matchIndex = 0;
        }
    }

    /**
     * Hash key for a row; null when any component is null. Integral doubles are folded to Long
     * so 1 and 1.0 land in the same bucket; other type pairings are rejected.
     */
    private List<Object> keyOf(Row row, int[] positions) {
        List<Object> key = new ArrayList<>(positions.length);
        for (int p : positions) {
            Object v = row.get(p);
            if (v == null) return null;
            key.add(canonical(v));
        }
        return key;
    }

    private static Object canonical(Object v) {
        if (v instanceof Long || v instanceof Double || v instanceof String || v instanceof Boolean) {
            return Values.canonical(v);
        }
        throw GraphQueryException.typeMismatch(Stage.EXECUTE, "Unsupported join key value: " + v);
    }

    @Override
    public void close() {
        left.close();
        // right already closed after build
        rightHash = null;
        rightRows = null;
        currentLeft = null;
    }

    @Override
    public RowSchema schema() { return joinedSchema; }
}
