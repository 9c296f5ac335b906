package graph.engine.plan;

import java.util.List;

/** Stable multi-key sort; nulls last in either direction. */
public record SortNode(PlanNode child, List<SortKey> keys) implements PlanNode {
    public SortNode {
        keys = List.copyOf(keys);
    }

    @Override
    public List<PlanNode> children() { return List.of(child); }

    @Override
    public List<String> outputColumns() { return child.outputColumns(); }

    @Override
    public String describe() { return "Sort(" + keys + ")"; }
}
