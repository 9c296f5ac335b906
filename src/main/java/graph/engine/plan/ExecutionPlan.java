package graph.engine.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiled query: the root plan node plus the result column names in RETURN order.
 */
public record ExecutionPlan(PlanNode root, List<String> columns) {
    public ExecutionPlan {
        columns = List.copyOf(columns);
    }

    /** All nodes in execution order (inputs before the nodes that consume them). */
    public List<PlanNode> nodes() {
        List<PlanNode> out = new ArrayList<>();
        postOrder(root, out);
        return out;
    }

    /** Plan nodes of the given kind in execution order. */
    public <T extends PlanNode> List<T> nodesOf(Class<T> kind) {
        List<T> out = new ArrayList<>();
        for (PlanNode n : nodes()) if (kind.isInstance(n)) out.add(kind.cast(n));
        return out;
    }

    private static void postOrder(PlanNode n, List<PlanNode> out) {
        for (PlanNode c : n.children()) postOrder(c, out);
        out.add(n);
    }

    /** Indented tree rendering, root first. */
    public String explain() {
        StringBuilder sb = new StringBuilder();
        render(root, 0, sb);
        return sb.toString();
    }

    private static void render(PlanNode n, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(n.describe()).append('\n');
        for (PlanNode c : n.children()) render(c, depth + 1, sb);
    }

    @Override
    public String toString() { return explain(); }
}
