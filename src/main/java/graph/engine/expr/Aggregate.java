package graph.engine.expr;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Aggregate function over a group of rows. argument is null only for count(*).
 */
public record Aggregate(Function function, Expression argument, boolean distinct) implements Expression {
    public enum Function {
        COUNT, SUM, AVG, MIN, MAX;

        public static Optional<Function> byName(String name) {
            for (Function f : values()) {
                if (f.name().equalsIgnoreCase(name)) return Optional.of(f);
            }
            return Optional.empty();
        }
    }

    public Aggregate {
        if (argument == null && function != Function.COUNT) {
            throw new IllegalArgumentException(function + " requires an argument");
        }
        if (argument == null && distinct) {
            throw new IllegalArgumentException("count(DISTINCT *) is not valid");
        }
    }

    public static Aggregate countStar() { return new Aggregate(Function.COUNT, null, false); }

    public boolean isCountStar() { return argument == null; }

    @Override
    public boolean isAggregate() { return true; }

    @Override
    public String text() {
        String fn = function.name().toLowerCase(Locale.ROOT);
        if (argument == null) return fn + "(*)";
        return fn + "(" + (distinct ? "DISTINCT " : "") + argument.text() + ")";
    }

    @Override
    public List<Expression> children() { return argument == null ? List.of() : List.of(argument); }

    @Override
    public Expression withChildren(List<Expression> children) {
        return children.isEmpty() ? this : new Aggregate(function, children.get(0), distinct);
    }

    @Override
    public String toString() { return text(); }
}
