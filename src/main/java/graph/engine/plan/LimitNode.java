package graph.engine.plan;

import java.util.List;

public record LimitNode(PlanNode child, long count) implements PlanNode {
    @Override
    public List<PlanNode> children() { return List.of(child); }

    @Override
    public List<String> outputColumns() { return child.outputColumns(); }

    @Override
    public String describe() { return "Limit(" + count + ")"; }
}
