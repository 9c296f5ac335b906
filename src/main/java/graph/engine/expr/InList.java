package graph.engine.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** operand IN [item, ...]. */
public record InList(Expression operand, List<Expression> items) implements Expression {
    public InList {
        items = List.copyOf(items);
    }

    @Override
    public String text() {
        return Expressions.operand(operand) + " IN ["
            + items.stream().map(Expression::text).collect(Collectors.joining(", ")) + "]";
    }

    @Override
    public List<Expression> children() {
        List<Expression> all = new ArrayList<>(items.size() + 1);
        all.add(operand);
        all.addAll(items);
        return all;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new InList(children.get(0), children.subList(1, children.size()));
    }

    @Override
    public String toString() { return text(); }
}
