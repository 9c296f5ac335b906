package graph.engine.plan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import graph.engine.catalog.GraphCatalog;
import graph.engine.catalog.NodeBinding;
import graph.engine.catalog.RelationshipBinding;
import graph.engine.error.ErrorKind;
import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;
import graph.engine.expr.Aggregate;
import graph.engine.expr.BooleanExpression;
import graph.engine.expr.ColumnRef;
import graph.engine.expr.Comparison;
import graph.engine.expr.Expression;
import graph.engine.expr.Expressions;
import graph.engine.expr.FunctionCall;
import graph.engine.expr.Parameter;
import graph.engine.expr.PropertyRef;
import graph.engine.expr.StaticTypeChecker;
import graph.engine.expr.VariableRef;
import graph.engine.query.CypherQuery;
import graph.engine.query.Direction;
import graph.engine.query.NodePattern;
import graph.engine.query.OrderItem;
import graph.engine.query.PathPattern;
import graph.engine.query.RelationshipPattern;
import graph.engine.query.ReturnItem;

/**
 * Turns a parsed query into an execution plan against a catalog.
 * <ol>
 *   <li>Each node variable is bound to a label (given, or inferred from an adjacent typed relationship).</li>
 *   <li>Each relationship becomes a scan of its table joined to both endpoint nodes on the declared key
 *       columns: outgoing binds left.id = from and right.id = to, incoming the reverse, undirected
 *       scans the table in both orientations. Patterns chain left to right.</li>
 *   <li>WHERE conjuncts (and inline property maps) are placed right after the first scan or join
 *       that binds every variable they use.</li>
 *   <li>RETURN becomes a projection, or a single aggregation when any item is an aggregate
 *       (the non-aggregate items are the group keys); then sort, skip and limit.</li>
 * </ol>
 * Scans read only the key columns and the properties the query references.
 * Compilation never touches datasets; every error here is a compile-stage error.
 */
public class PatternCompiler {
    private final GraphCatalog catalog;

    public PatternCompiler(GraphCatalog catalog) {
        if (catalog == null) throw new IllegalArgumentException("catalog must not be null");
        this.catalog = catalog;
    }

    public ExecutionPlan compile(CypherQuery query) {
        if (query == null) throw new IllegalArgumentException("query must not be null");
        return new Compilation(query).run();
    }

    private static final class NodeVar {
        final String name;
        String label; // as written, null until known
        NodeBinding binding;

        NodeVar(String name) { this.name = name; }
    }

    private static final class RelVar {
        final String name;
        final RelationshipBinding binding;

        RelVar(String name, RelationshipBinding binding) {
            this.name = name;
            this.binding = binding;
        }
    }

    private final class Compilation {
        private final CypherQuery query;
        private final Map<String, NodeVar> nodes = new LinkedHashMap<>();
        private final Map<String, RelVar> rels = new LinkedHashMap<>();
        // pattern variable names resolved per occurrence, parallel to query.patterns()
        private final List<List<String>> pathNodeNames = new ArrayList<>();
        private final List<List<String>> pathRelNames = new ArrayList<>();
        private final Map<String, Set<String>> requiredColumns = new HashMap<>();
        private final List<Expression> pending = new ArrayList<>();
        private int anonymous;

        Compilation(CypherQuery query) { this.query = query; }

        ExecutionPlan run() {
            bindVariables();
            inferMissingLabels();

            List<Expression> conjuncts = new ArrayList<>(inlinePropertyConjuncts());
            Expression where = query.where() == null ? null : normalize(query.where());
            if (where != null) {
                if (Expressions.containsAggregate(where)) {
                    throw GraphQueryException.unsupportedAggregate("Aggregates are not allowed in WHERE: " + where.text());
                }
                checkBound(where, Set.of());
                conjuncts.addAll(Expressions.conjuncts(where));
            }
            for (Expression c : conjuncts) requirePredicate(c);

            List<ProjectItem> items = returnItems();
            Map<String, ProjectItem> byAlias = new HashMap<>();
            for (int i = 0; i < items.size(); i++) {
                if (query.returnItems().get(i).alias() != null) byAlias.put(items.get(i).outputName(), items.get(i));
            }
            boolean aggregating = query.distinct() || items.stream().anyMatch(i -> i.expression().isAggregate());
            OrderPlan order = orderKeys(items, byAlias, aggregating);

            for (Expression c : conjuncts) require(c);
            for (ProjectItem i : items) require(i.expression());
            for (SortKey k : order.keys) require(k.expression());

            pending.addAll(conjuncts);
            PlanNode root = matchPlan();
            if (!pending.isEmpty()) {
                // conjuncts without variables that no stage picked up
                root = new FilterNode(root, BooleanExpression.allOf(pending));
                pending.clear();
            }

            if (order.beforeProjection) root = new SortNode(root, order.keys);
            root = aggregating ? new AggregateNode(root, items) : new ProjectNode(root, items);
            if (!order.beforeProjection && !order.keys.isEmpty()) root = new SortNode(root, order.keys);
            if (query.skip() != null) root = new SkipNode(root, query.skip());
            if (query.limit() != null) root = new LimitNode(root, query.limit());
            return new ExecutionPlan(root, root.outputColumns());
        }

        // ---- variable binding ------------------------------------------------

        private void bindVariables() {
            for (PathPattern path : query.patterns()) {
                List<String> nodeNames = new ArrayList<>();
                List<String> relNames = new ArrayList<>();
                nodeNames.add(bindNode(path.start()));
                for (PathPattern.Segment seg : path.segments()) {
                    relNames.add(bindRelationship(seg.relationship()));
                    nodeNames.add(bindNode(seg.end()));
                }
                pathNodeNames.add(nodeNames);
                pathRelNames.add(relNames);
            }
        }

        private String bindNode(NodePattern p) {
            String name = p.variable() != null ? p.variable() : "__n" + anonymous++;
            if (rels.containsKey(name)) {
                throw GraphQueryException.duplicateBinding("Variable '" + name + "' is already bound to a relationship");
            }
            NodeVar var = nodes.computeIfAbsent(name, NodeVar::new);
            if (p.label() != null) {
                NodeBinding binding = catalog.resolveLabel(p.label());
                if (var.binding != null && !var.binding.equals(binding)) {
                    throw GraphQueryException.ambiguousNode(name, "labels " + var.label + " and " + p.label() + " conflict");
                }
                var.label = p.label();
                var.binding = binding;
            }
            return name;
        }

        private String bindRelationship(RelationshipPattern p) {
            String name = p.variable() != null ? p.variable() : "__r" + anonymous++;
            if (nodes.containsKey(name)) {
                throw GraphQueryException.duplicateBinding("Variable '" + name + "' is already bound to a node");
            }
            if (rels.containsKey(name)) {
                throw GraphQueryException.duplicateBinding("Relationship variable '" + name + "' is used more than once");
            }
            RelationshipBinding binding;
            if (p.type() != null) {
                binding = catalog.resolveRelationship(p.type());
            } else if (catalog.relationshipTypes().size() == 1) {
                binding = catalog.relationshipBindings().values().iterator().next();
            } else {
                throw new GraphQueryException(ErrorKind.UNKNOWN_RELATIONSHIP_TYPE,
                    "Relationship pattern without a type is ambiguous among " + catalog.relationshipTypes());
            }
            rels.put(name, new RelVar(name, binding));
            return name;
        }

        /** A node without a label takes the unique label whose id column is the endpoint column binding it. */
        private void inferMissingLabels() {
            for (NodeVar var : nodes.values()) {
                if (var.binding != null) continue;
                Set<NodeBinding> candidates = null;
                for (int p = 0; p < query.patterns().size(); p++) {
                    PathPattern path = query.patterns().get(p);
                    List<String> names = pathNodeNames.get(p);
                    for (int s = 0; s < path.segments().size(); s++) {
                        RelationshipPattern rp = path.segments().get(s).relationship();
                        RelationshipBinding rb = rels.get(pathRelNames.get(p).get(s)).binding;
                        Set<String> endpointColumns = new HashSet<>();
                        if (names.get(s).equals(var.name)) endpointColumns.addAll(leftEndpoints(rp.direction(), rb));
                        if (names.get(s + 1).equals(var.name)) endpointColumns.addAll(rightEndpoints(rp.direction(), rb));
                        if (endpointColumns.isEmpty()) continue;
                        Set<NodeBinding> matching = new LinkedHashSet<>();
                        for (NodeBinding nb : catalog.nodeBindings().values()) {
                            if (endpointColumns.contains(nb.idColumn())) matching.add(nb);
                        }
                        if (candidates == null) candidates = matching;
                        else candidates.retainAll(matching);
                    }
                }
                String shown = var.name.startsWith("__") ? "(anonymous)" : var.name;
                if (candidates == null) {
                    throw GraphQueryException.ambiguousNode(shown, "no label and no adjacent typed relationship");
                }
                if (candidates.size() != 1) {
                    throw GraphQueryException.ambiguousNode(shown, candidates.isEmpty()
                        ? "no label has the relationship endpoint as its id column"
                        : "several labels match the relationship endpoint: " + candidates);
                }
                var.binding = candidates.iterator().next();
            }
        }

        private List<String> leftEndpoints(Direction d, RelationshipBinding rb) {
            return switch (d) {
                case OUTGOING -> List.of(rb.fromColumn());
                case INCOMING -> List.of(rb.toColumn());
                case EITHER -> List.of(rb.fromColumn(), rb.toColumn());
            };
        }

        private List<String> rightEndpoints(Direction d, RelationshipBinding rb) {
            return switch (d) {
                case OUTGOING -> List.of(rb.toColumn());
                case INCOMING -> List.of(rb.fromColumn());
                case EITHER -> List.of(rb.fromColumn(), rb.toColumn());
            };
        }

        // ---- expressions -----------------------------------------------------

        /** Resolves function calls: known aggregates become Aggregate nodes, anything else is rejected. */
        private Expression normalize(Expression e) {
            Expression out = Expressions.rewrite(e, x -> {
                if (!(x instanceof FunctionCall f)) return x;
                Aggregate.Function fn = Aggregate.Function.byName(f.name()).orElseThrow(() ->
                    GraphQueryException.unsupportedAggregate("Unsupported function: " + f.name()));
                if (f.star()) {
                    throw GraphQueryException.unsupportedAggregate(f.name() + "(*) is not supported; only count(*)");
                }
                if (f.arguments().size() != 1) {
                    throw GraphQueryException.unsupportedAggregate(f.name() + "() takes exactly one argument");
                }
                Expression arg = f.arguments().get(0);
                if (Expressions.containsAggregate(arg)) {
                    throw GraphQueryException.unsupportedAggregate("Nested aggregate in " + f.text());
                }
                return new Aggregate(fn, arg, f.distinct());
            });
            List<Expression> unbound = Expressions.collect(out, x -> x instanceof Parameter);
            if (!unbound.isEmpty()) throw GraphQueryException.missingParameter(((Parameter) unbound.get(0)).name());
            return out;
        }

        private void checkBound(Expression e, Set<String> aliases) {
            for (Expression x : Expressions.collect(e, n -> n instanceof PropertyRef || n instanceof VariableRef)) {
                String var = x instanceof PropertyRef p ? p.variable() : ((VariableRef) x).name();
                if (x instanceof VariableRef && aliases.contains(var)) continue;
                if (!nodes.containsKey(var) && !rels.containsKey(var)) throw GraphQueryException.unboundVariable(var);
            }
        }

        private void requirePredicate(Expression e) {
            StaticTypeChecker.Kind k = StaticTypeChecker.check(e);
            if (k == StaticTypeChecker.Kind.NUMBER || k == StaticTypeChecker.Kind.STRING) {
                throw GraphQueryException.typeMismatch(Stage.COMPILE, "Predicate is not boolean: " + e.text());
            }
        }

        /** Records referenced properties so scans read them. */
        private void require(Expression e) {
            for (PropertyRef p : Expressions.propertyRefs(e)) {
                requiredColumns.computeIfAbsent(p.variable(), v -> new LinkedHashSet<>()).add(p.property());
            }
        }

        private List<Expression> inlinePropertyConjuncts() {
            List<Expression> out = new ArrayList<>();
            for (int p = 0; p < query.patterns().size(); p++) {
                PathPattern path = query.patterns().get(p);
                List<String> names = pathNodeNames.get(p);
                addInline(out, names.get(0), path.start().properties());
                for (int s = 0; s < path.segments().size(); s++) {
                    addInline(out, pathRelNames.get(p).get(s), path.segments().get(s).relationship().properties());
                    addInline(out, names.get(s + 1), path.segments().get(s).end().properties());
                }
            }
            return out;
        }

        private void addInline(List<Expression> out, String variable, Map<String, Expression> props) {
            for (Map.Entry<String, Expression> e : props.entrySet()) {
                Expression value = normalize(e.getValue());
                if (Expressions.containsAggregate(value)) {
                    throw GraphQueryException.unsupportedAggregate("Aggregates are not allowed in property maps");
                }
                checkBound(value, Set.of());
                out.add(new Comparison(Comparison.Op.EQ, new PropertyRef(variable, e.getKey()), value));
            }
        }

        private List<ProjectItem> returnItems() {
            List<ProjectItem> items = new ArrayList<>();
            Set<String> names = new HashSet<>();
            for (ReturnItem ri : query.returnItems()) {
                Expression e = normalize(ri.expression());
                checkBound(e, Set.of());
                if (Expressions.containsAggregate(e) && !e.isAggregate()) {
                    throw GraphQueryException.unsupportedAggregate(
                        "Aggregates must be the whole RETURN expression: " + e.text());
                }
                StaticTypeChecker.check(e);
                String name = ri.alias() != null ? ri.alias() : e.text();
                if (!names.add(name)) throw GraphQueryException.duplicateBinding("Duplicate result column: " + name);
                items.add(new ProjectItem(e, name));
            }
            return items;
        }

        private record OrderPlan(List<SortKey> keys, boolean beforeProjection) {}

        /**
         * ORDER BY keys naming an alias or repeating a RETURN expression sort the projected output.
         * Anything else sorts the matched rows before projection, which needs a non-aggregating query.
         */
        private OrderPlan orderKeys(List<ProjectItem> items, Map<String, ProjectItem> byAlias, boolean aggregating) {
            if (query.orderBy().isEmpty()) return new OrderPlan(List.of(), false);
            List<SortKey> post = new ArrayList<>();
            List<SortKey> pre = new ArrayList<>();
            boolean allPost = true;
            for (OrderItem o : query.orderBy()) {
                Expression e = normalize(o.expression());
                checkBound(e, byAlias.keySet());
                ProjectItem match = null;
                if (e instanceof VariableRef v && byAlias.containsKey(v.name())) {
                    match = byAlias.get(v.name());
                } else {
                    for (ProjectItem i : items) {
                        if (i.expression().text().equals(e.text())) { match = i; break; }
                    }
                }
                if (match != null) {
                    post.add(new SortKey(new ColumnRef(match.outputName()), o.ascending()));
                    pre.add(new SortKey(match.expression(), o.ascending()));
                    continue;
                }
                allPost = false;
                if (aggregating) {
                    if (Expressions.containsAggregate(e)) {
                        throw GraphQueryException.unsupportedAggregate("ORDER BY aggregate must appear in RETURN: " + e.text());
                    }
                    throw GraphQueryException.unboundVariable("ORDER BY " + e.text()
                        + " (must appear in RETURN when the query aggregates or uses DISTINCT)");
                }
                if (Expressions.containsAggregate(e)) {
                    throw GraphQueryException.unsupportedAggregate("ORDER BY aggregate in a non-aggregating query: " + e.text());
                }
                Expression resolved = Expressions.rewrite(e, x ->
                    x instanceof VariableRef v && byAlias.containsKey(v.name()) ? byAlias.get(v.name()).expression() : x);
                StaticTypeChecker.check(resolved);
                pre.add(new SortKey(resolved, o.ascending()));
            }
            return allPost ? new OrderPlan(post, false) : new OrderPlan(pre, true);
        }

        // ---- join tree ---------------------------------------------------------

        private PlanNode matchPlan() {
            Set<String> bound = new HashSet<>();
            PlanNode current = null;
            for (int p = 0; p < query.patterns().size(); p++) {
                PathPattern path = query.patterns().get(p);
                List<String> names = pathNodeNames.get(p);
                String left = names.get(0);
                if (!bound.contains(left)) {
                    PlanNode scan = withFilters(nodeScan(left), Set.of(left));
                    current = current == null ? scan : JoinNode.cross(current, scan);
                    bound.add(left);
                    current = withFilters(current, bound);
                }
                for (int s = 0; s < path.segments().size(); s++) {
                    Direction dir = path.segments().get(s).relationship().direction();
                    String relName = pathRelNames.get(p).get(s);
                    String right = names.get(s + 1);
                    RelationshipBinding rb = rels.get(relName).binding;

                    PlanNode relPlan = relationshipScan(relName);
                    String relLeft;
                    String relRight;
                    switch (dir) {
                        case OUTGOING -> { relLeft = rb.fromColumn(); relRight = rb.toColumn(); }
                        case INCOMING -> { relLeft = rb.toColumn(); relRight = rb.fromColumn(); }
                        default -> {
                            relPlan = new BidirectionalNode(relPlan, relName, rb.fromColumn(), rb.toColumn());
                            relLeft = BidirectionalNode.START;
                            relRight = BidirectionalNode.END;
                        }
                    }
                    relPlan = withFilters(relPlan, Set.of(relName));

                    List<JoinKey> keys = new ArrayList<>();
                    keys.add(new JoinKey(idColumn(left), PropertyRef.qualify(relName, relLeft)));
                    if (bound.contains(right)) {
                        keys.add(new JoinKey(idColumn(right), PropertyRef.qualify(relName, relRight)));
                    }
                    current = JoinNode.inner(current, relPlan, keys);
                    bound.add(relName);
                    current = withFilters(current, bound);

                    if (!bound.contains(right)) {
                        PlanNode scan = withFilters(nodeScan(right), Set.of(right));
                        current = JoinNode.inner(current, scan,
                            List.of(new JoinKey(PropertyRef.qualify(relName, relRight), idColumn(right))));
                        bound.add(right);
                        current = withFilters(current, bound);
                    }
                    left = right;
                }
            }
            return current;
        }

        private String idColumn(String nodeVar) {
            return PropertyRef.qualify(nodeVar, nodes.get(nodeVar).binding.idColumn());
        }

        private ScanNode nodeScan(String var) {
            NodeBinding nb = nodes.get(var).binding;
            Set<String> cols = new LinkedHashSet<>();
            cols.add(nb.idColumn());
            cols.addAll(requiredColumns.getOrDefault(var, Set.of()));
            return new ScanNode(var, nb.tableReference(), nb.label(), new ArrayList<>(cols));
        }

        private ScanNode relationshipScan(String var) {
            RelationshipBinding rb = rels.get(var).binding;
            Set<String> cols = new LinkedHashSet<>();
            cols.add(rb.fromColumn());
            cols.add(rb.toColumn());
            cols.addAll(requiredColumns.getOrDefault(var, Set.of()));
            return new ScanNode(var, rb.tableReference(), rb.type(), new ArrayList<>(cols));
        }

        /** Wraps the plan in a filter with every pending conjunct whose variables are all available. */
        private PlanNode withFilters(PlanNode plan, Set<String> available) {
            List<Expression> ready = new ArrayList<>();
            for (Iterator<Expression> it = pending.iterator(); it.hasNext(); ) {
                Expression c = it.next();
                if (available.containsAll(Expressions.referencedVariables(c))) {
                    ready.add(c);
                    it.remove();
                }
            }
            return ready.isEmpty() ? plan : new FilterNode(plan, BooleanExpression.allOf(ready));
        }
    }
}
