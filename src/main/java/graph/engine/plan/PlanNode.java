package graph.engine.plan;

import java.util.List;

/**
 * One step of an execution plan. Nodes are immutable values linked to their inputs;
 * each declares the columns it produces, qualified as variable.property or by output name.
 */
public interface PlanNode {
    List<PlanNode> children();

    List<String> outputColumns();

    /** One-line label used when rendering the plan. */
    String describe();
}
