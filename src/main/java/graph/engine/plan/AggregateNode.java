package graph.engine.plan;

import java.util.List;

/**
 * Groups rows by the non-aggregate items and computes the aggregate items per group.
 * Output columns follow item order. With no group keys exactly one row is produced.
 */
public record AggregateNode(PlanNode child, List<ProjectItem> items) implements PlanNode {
    public AggregateNode {
        items = List.copyOf(items);
    }

    public List<ProjectItem> groupKeys() {
        return items.stream().filter(i -> !i.expression().isAggregate()).toList();
    }

    public List<ProjectItem> aggregates() {
        return items.stream().filter(i -> i.expression().isAggregate()).toList();
    }

    @Override
    public List<PlanNode> children() { return List.of(child); }

    @Override
    public List<String> outputColumns() { return items.stream().map(ProjectItem::outputName).toList(); }

    @Override
    public String describe() { return "Aggregate(keys=" + groupKeys() + ", aggregates=" + aggregates() + ")"; }
}
