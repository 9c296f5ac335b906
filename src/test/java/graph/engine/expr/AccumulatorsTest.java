package graph.engine.expr;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import graph.engine.error.ErrorKind;
import graph.engine.error.GraphQueryException;

public class AccumulatorsTest {
    private static final Expression ARG = new PropertyRef("p", "age");

    private static Object run(Aggregate aggregate, List<Object> values) {
        Accumulator acc = Accumulators.create(aggregate);
        for (Object v : values) acc.add(v);
        return acc.result();
    }

    private static Aggregate agg(Aggregate.Function fn) { return new Aggregate(fn, ARG, false); }

    @Test
    void countStarCountsNullsButCountDoesNot() {
        List<Object> values = Arrays.asList(1L, null, 3L);
        assertEquals(3L, run(Aggregate.countStar(), values));
        assertEquals(2L, run(agg(Aggregate.Function.COUNT), values));
    }

    @Test
    void sumStaysIntegralUntilAFloatAppears() {
        assertEquals(6L, run(agg(Aggregate.Function.SUM), List.of(1L, 2L, 3L)));
        assertEquals(6.5, run(agg(Aggregate.Function.SUM), List.of(1L, 2.5, 3L)));
    }

    @Test
    void sumThatOverflowsLongContinuesInDouble() {
        assertEquals(Long.MAX_VALUE + 1.0, run(agg(Aggregate.Function.SUM), List.of(Long.MAX_VALUE, 1L)));
        assertEquals(Long.MAX_VALUE + 3.5, run(agg(Aggregate.Function.SUM), List.of(Long.MAX_VALUE, 1L, 2.5)));
        assertEquals(Long.MAX_VALUE, run(agg(Aggregate.Function.SUM), List.of(Long.MAX_VALUE, -1L, 1L)));
    }

    @Test
    void averageOfAges() {
        assertEquals(33.25, (Double) run(agg(Aggregate.Function.AVG), List.of(28L, 34L, 29L, 42L)), 1e-9);
    }

    @Test
    void emptyInputGivesZeroCountAndNullOthers() {
        assertEquals(0L, run(Aggregate.countStar(), List.of()));
        assertNull(run(agg(Aggregate.Function.AVG), List.of()));
        assertNull(run(agg(Aggregate.Function.SUM), List.of()));
        assertNull(run(agg(Aggregate.Function.MIN), List.of()));
    }

    @Test
    void minAndMaxIgnoreNulls() {
        List<Object> values = Arrays.asList("b", null, "a", "c");
        assertEquals("a", run(agg(Aggregate.Function.MIN), values));
        assertEquals("c", run(agg(Aggregate.Function.MAX), values));
    }

    @Test
    void distinctCountsEachValueOnce() {
        Aggregate distinct = new Aggregate(Aggregate.Function.COUNT, ARG, true);
        assertEquals(2L, run(distinct, Arrays.asList("NY", "SF", "NY", null)));
    }

    @Test
    void sumOfStringsIsTypeMismatch() {
        GraphQueryException ex = assertThrows(GraphQueryException.class,
            () -> run(agg(Aggregate.Function.SUM), List.of("x")));
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
    }
}
