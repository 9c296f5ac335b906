package graph.engine.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Inner equi-join on all keys; with no keys the join is a cross product.
 * Output columns are the left columns followed by the right columns.
 */
public record JoinNode(PlanNode left, PlanNode right, List<JoinKey> keys, Kind kind) implements PlanNode {
    public enum Kind { INNER, CROSS }

    public JoinNode {
        keys = List.copyOf(keys);
        if (kind == Kind.INNER && keys.isEmpty()) throw new IllegalArgumentException("INNER join requires keys");
        if (kind == Kind.CROSS && !keys.isEmpty()) throw new IllegalArgumentException("CROSS join takes no keys");
    }

    public static JoinNode inner(PlanNode left, PlanNode right, List<JoinKey> keys) {
        return new JoinNode(left, right, keys, Kind.INNER);
    }

    public static JoinNode cross(PlanNode left, PlanNode right) {
        return new JoinNode(left, right, List.of(), Kind.CROSS);
    }

    @Override
    public List<PlanNode> children() { return List.of(left, right); }

    @Override
    public List<String> outputColumns() {
        List<String> cols = new ArrayList<>(left.outputColumns());
        cols.addAll(right.outputColumns());
        return cols;
    }

    @Override
    public String describe() {
        return kind == Kind.CROSS ? "CrossJoin" : "Join(" + keys + ")";
    }
}
