package graph.engine.expr;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Function invocation as written in the query. The compiler turns the known
 * aggregate names into {@link Aggregate} nodes and rejects everything else.
 * star marks the count(*) form.
 */
public record FunctionCall(String name, List<Expression> arguments, boolean distinct, boolean star)
        implements Expression {
    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String text() {
        String args = star ? "*" : arguments.stream().map(Expression::text).collect(Collectors.joining(", "));
        return name.toLowerCase(Locale.ROOT) + "(" + (distinct ? "DISTINCT " : "") + args + ")";
    }

    @Override
    public List<Expression> children() { return arguments; }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new FunctionCall(name, children, distinct, star);
    }

    @Override
    public String toString() { return text(); }
}
