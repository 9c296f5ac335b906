package graph.engine.plan;

import java.util.List;

import graph.engine.expr.Expression;

/** Keeps rows for which the predicate is TRUE. */
public record FilterNode(PlanNode child, Expression predicate) implements PlanNode {
    @Override
    public List<PlanNode> children() { return List.of(child); }

    @Override
    public List<String> outputColumns() { return child.outputColumns(); }

    @Override
    public String describe() { return "Filter(" + predicate.text() + ")"; }
}
