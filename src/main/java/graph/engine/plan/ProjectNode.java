package graph.engine.plan;

import java.util.List;

/** Evaluates each item per row, in order. */
public record ProjectNode(PlanNode child, List<ProjectItem> items) implements PlanNode {
    public ProjectNode {
        items = List.copyOf(items);
    }

    @Override
    public List<PlanNode> children() { return List.of(child); }

    @Override
    public List<String> outputColumns() { return items.stream().map(ProjectItem::outputName).toList(); }

    @Override
    public String describe() { return "Project(" + items + ")"; }
}
