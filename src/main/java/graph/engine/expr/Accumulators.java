package graph.engine.expr;

import java.util.HashSet;
import java.util.Set;

import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;

/**
 * Accumulator implementations. Nulls are skipped by everything except count(*);
 * with no contributing rows count yields 0 and the others yield null.
 */
public final class Accumulators {
    private Accumulators() {}

    public static Accumulator create(Aggregate aggregate) {
        if (aggregate.isCountStar()) return new CountStar();
        Accumulator base = switch (aggregate.function()) {
            case COUNT -> new Count();
            case SUM -> new Sum();
            case AVG -> new Avg();
            case MIN -> new Extreme(true);
            case MAX -> new Extreme(false);
        };
        return aggregate.distinct() ? new Distinct(base) : base;
    }

    private static final class CountStar implements Accumulator {
        private long count;

        @Override public void add(Object value) { count++; }
        @Override public Object result() { return count; }
    }

    private static final class Count implements Accumulator {
        private long count;

        @Override public void add(Object value) { if (value != null) count++; }
        @Override public Object result() { return count; }
    }

    private static final class Sum implements Accumulator {
        private long longSum;
        private double doubleSum;
        private boolean floating;
        private boolean any;

        @Override
        public void add(Object value) {
            if (value == null) return;
            requireNumber("sum", value);
            any = true;
            if (value instanceof Long l && !floating) {
                try {
                    longSum = Math.addExact(longSum, l);
                    return;
                } catch (ArithmeticException overflow) {
                    promote();
                }
            }
            if (!floating) promote();
            doubleSum += ((Number) value).doubleValue();
        }

        // continues the running total in double
        private void promote() {
            doubleSum = longSum;
            floating = true;
        }

        @Override
        public Object result() {
            if (!any) return null;
            return floating ? (Object) doubleSum : (Object) longSum;
        }
    }

    private static final class Avg implements Accumulator {
        private double sum;
        private long count;

        @Override
        public void add(Object value) {
            if (value == null) return;
            requireNumber("avg", value);
            sum += ((Number) value).doubleValue();
            count++;
        }

        @Override
        public Object result() { return count == 0 ? null : sum / count; }
    }

    private static final class Extreme implements Accumulator {
        private final boolean min;
        private Object best;

        Extreme(boolean min) { this.min = min; }

        @Override
        public void add(Object value) {
            if (value == null) return;
            if (best == null) {
                best = value;
                return;
            }
            int cmp = Values.compare(value, best);
            if (min ? cmp < 0 : cmp > 0) best = value;
        }

        @Override
        public Object result() { return best; }
    }

    private static final class Distinct implements Accumulator {
        private final Accumulator delegate;
        private final Set<Object> seen = new HashSet<>();

        Distinct(Accumulator delegate) { this.delegate = delegate; }

        @Override
        public void add(Object value) {
            if (value == null) return;
            if (seen.add(value)) delegate.add(value);
        }

        @Override
        public Object result() { return delegate.result(); }
    }

    private static void requireNumber(String fn, Object value) {
        if (!Values.isNumber(value)) {
            throw GraphQueryException.typeMismatch(Stage.EXECUTE, fn + "() requires numbers, got " + Values.describe(value));
        }
    }
}
