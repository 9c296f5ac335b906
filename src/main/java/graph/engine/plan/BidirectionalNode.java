package graph.engine.plan;

import java.util.ArrayList;
import java.util.List;

import graph.engine.expr.PropertyRef;

/**
 * Emits every relationship row in its stored orientation and then, unless it is a
 * self loop, reversed. Adds variable.__start / variable.__end holding the endpoint
 * keys of each orientation, so an undirected pattern joins like a directed one.
 */
public record BidirectionalNode(PlanNode child, String variable, String fromColumn, String toColumn)
        implements PlanNode {
    public static final String START = "__start";
    public static final String END = "__end";

    @Override
    public List<PlanNode> children() { return List.of(child); }

    @Override
    public List<String> outputColumns() {
        List<String> cols = new ArrayList<>(child.outputColumns());
        cols.add(PropertyRef.qualify(variable, START));
        cols.add(PropertyRef.qualify(variable, END));
        return cols;
    }

    @Override
    public String describe() {
        return "BothOrientations(" + variable + ": " + fromColumn + " <-> " + toColumn + ")";
    }
}
