package graph.engine.exec;

import java.util.ArrayList;
import java.util.List;

import graph.engine.expr.ExpressionEvaluator;
import graph.engine.plan.AggregateNode;
import graph.engine.plan.BidirectionalNode;
import graph.engine.plan.ExecutionPlan;
import graph.engine.plan.FilterNode;
import graph.engine.plan.JoinNode;
import graph.engine.plan.LimitNode;
import graph.engine.plan.PlanNode;
import graph.engine.plan.ProjectNode;
import graph.engine.plan.ScanNode;
import graph.engine.plan.SkipNode;
import graph.engine.plan.SortNode;
import graph.engine.table.Datasets;
import graph.engine.table.ResultTable;

/**
 * Builds the operator pipeline for a plan over a set of datasets and drains it into a table.
 * A filter directly above a scan is evaluated inside the scan.
 */
public class ExecutionEngine {
    private final ExpressionEvaluator evaluator;

    public ExecutionEngine() { this(new ExpressionEvaluator()); }

    public ExecutionEngine(ExpressionEvaluator evaluator) { this.evaluator = evaluator; }

    public ResultTable execute(ExecutionPlan plan, Datasets datasets) {
        Operator root = build(plan.root(), datasets);
        List<List<Object>> rows = new ArrayList<>();
        root.open();
        try {
            Row r;
            while ((r = root.next()) != null) rows.add(r.values());
        } finally {
            root.close();
        }
        return ResultTable.fromRows(plan.columns(), rows);
    }

    /** Streams rows of the plan one at a time; the pipeline is opened on first iteration. */
    public Iterable<Row> stream(ExecutionPlan plan, Datasets datasets) {
        return () -> new RowIterator(build(plan.root(), datasets));
    }

    public Operator build(PlanNode node, Datasets datasets) {
        if (node instanceof ScanNode s) {
            return new ScanOperator(s.variable(), s.tableReference(), s.bindingName(), s.columns(), datasets, null, evaluator);
        }
        if (node instanceof FilterNode f) {
            if (f.child() instanceof ScanNode s) {
                return new ScanOperator(s.variable(), s.tableReference(), s.bindingName(), s.columns(), datasets, f.predicate(), evaluator);
            }
            return new FilterOperator(build(f.child(), datasets), f.predicate(), evaluator);
        }
        if (node instanceof BidirectionalNode b) {
            return new BidirectionalOperator(build(b.child(), datasets), b.variable(), b.fromColumn(), b.toColumn());
        }
        if (node instanceof JoinNode j) {
            return new JoinOperator(build(j.left(), datasets), build(j.right(), datasets), j.keys());
        }
        if (node instanceof ProjectNode p) {
            return new ProjectionOperator(build(p.child(), datasets), p.items(), evaluator);
        }
        if (node instanceof AggregateNode a) {
            return new AggregateOperator(build(a.child(), datasets), a.items(), evaluator);
        }
        if (node instanceof SortNode s) {
            return new SortOperator(build(s.child(), datasets), s.keys(), evaluator);
        }
        if (node instanceof SkipNode s) return new SkipOperator(build(s.child(), datasets), s.count());
        if (node instanceof LimitNode l) return new LimitOperator(build(l.child(), datasets), l.count());
        throw new IllegalStateException("No operator for plan node " + node.describe());
    }
}
