package graph.engine.plan;

import java.util.List;

import graph.engine.expr.PropertyRef;

/**
 * Reads the listed columns of the table bound to a pattern variable.
 * Output columns are qualified with the variable name. {@code bindingName} is the label or
 * relationship type the table was resolved from; a dataset keyed by it is used when none is
 * keyed by the table reference.
 */
public record ScanNode(String variable, String tableReference, String bindingName, List<String> columns)
    implements PlanNode {
    public ScanNode {
        columns = List.copyOf(columns);
    }

    @Override
    public List<PlanNode> children() { return List.of(); }

    @Override
    public List<String> outputColumns() {
        return columns.stream().map(c -> PropertyRef.qualify(variable, c)).toList();
    }

    @Override
    public String describe() {
        return "Scan(" + variable + " <- " + tableReference + " " + columns + ")";
    }
}
