package graph.engine.plan;

import java.util.List;

public record SkipNode(PlanNode child, long count) implements PlanNode {
    @Override
    public List<PlanNode> children() { return List.of(child); }

    @Override
    public List<String> outputColumns() { return child.outputColumns(); }

    @Override
    public String describe() { return "Skip(" + count + ")"; }
}
