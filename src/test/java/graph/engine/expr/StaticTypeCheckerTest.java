package graph.engine.expr;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import graph.engine.error.ErrorKind;
import graph.engine.error.GraphQueryException;
import graph.engine.error.Stage;

public class StaticTypeCheckerTest {

    private static void assertMismatch(Expression e) {
        GraphQueryException ex = assertThrows(GraphQueryException.class, () -> StaticTypeChecker.check(e));
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals(Stage.COMPILE, ex.stage());
    }

    @Test
    void propertiesAreUnknownUntilExecution() {
        Expression e = new Comparison(Comparison.Op.GT, new PropertyRef("p", "age"), new Literal("x"));
        assertEquals(StaticTypeChecker.Kind.BOOLEAN, StaticTypeChecker.check(e));
    }

    @Test
    void literalConflictsAreRejected() {
        assertMismatch(new Comparison(Comparison.Op.EQ, new Literal(1), new Literal("1")));
        assertMismatch(new Arithmetic(Arithmetic.Op.SUB, new Literal("a"), new Literal(1)));
        assertMismatch(BooleanExpression.and(new Literal(1), Literal.TRUE));
        assertMismatch(new InList(new Literal(1), List.of(new Literal("a"))));
    }

    @Test
    void bareVariablesAreNotValues() {
        assertMismatch(new VariableRef("p"));
    }

    @Test
    void numericAggregatesRejectStrings() {
        assertMismatch(new Aggregate(Aggregate.Function.SUM, new Literal("a"), false));
        assertEquals(StaticTypeChecker.Kind.NUMBER,
            StaticTypeChecker.check(new Aggregate(Aggregate.Function.AVG, new PropertyRef("p", "age"), false)));
    }

    @Test
    void nullLiteralsAreCompatibleWithEverything() {
        assertEquals(StaticTypeChecker.Kind.BOOLEAN,
            StaticTypeChecker.check(new Comparison(Comparison.Op.EQ, new Literal(1), Literal.NULL)));
        assertEquals(StaticTypeChecker.Kind.NULL,
            StaticTypeChecker.check(new Arithmetic(Arithmetic.Op.ADD, new Literal(1), Literal.NULL)));
    }
}
