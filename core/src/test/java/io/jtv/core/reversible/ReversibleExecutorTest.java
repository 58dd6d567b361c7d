package io.jtv.core.reversible;

import static io.jtv.core.ast.DataExpr.add;
import static io.jtv.core.ast.DataExpr.floating;
import static io.jtv.core.ast.DataExpr.integer;
import static io.jtv.core.ast.DataExpr.negate;
import static io.jtv.core.ast.DataExpr.symbol;
import static io.jtv.core.ast.DataExpr.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.jtv.core.ast.Condition;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Program;
import io.jtv.core.ast.Purity;
import io.jtv.core.ast.ReversibleOp;
import io.jtv.core.error.ReversibilityException;
import io.jtv.core.eval.ExecutionContext;
import io.jtv.core.eval.Interpreter;
import io.jtv.core.eval.State;
import io.jtv.core.number.Arithmetic;
import io.jtv.core.number.NumericValue;
import io.jtv.core.number.NumericValue.FloatValue;
import io.jtv.core.number.NumericValue.IntegerValue;
import io.jtv.core.number.NumericValue.RationalValue;
import io.jtv.core.number.NumericValue.SymbolicValue;
import io.jtv.core.types.Type;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReversibleExecutorTest")
class ReversibleExecutorTest {

    private final ReversibleExecutor executor = new ReversibleExecutor(Arithmetic.unbounded());
    private final Interpreter interpreter = new Interpreter(ExecutionContext.forProgram(Program.of()));

    private Function<DataExpr, NumericValue> evaluator(State state) {
        return expr -> interpreter.evalData(expr, state);
    }

    private static ControlStmt.ReverseBlock block(ReversibleOp... ops) {
        return new ControlStmt.ReverseBlock(List.of(ops));
    }

    private static ReversibleOp plus(String target, DataExpr value) {
        return new ReversibleOp.AddAssign(target, value);
    }

    private static ReversibleOp minus(String target, DataExpr value) {
        return new ReversibleOp.SubAssign(target, value);
    }

    @Nested
    @DisplayName("Forward and backward")
    class RoundTrip {

        @Test
        @DisplayName("reverse { x += y } with x = 10, y = 4: 14 after forward, 10 after backward")
        void forwardThenBackwardRestoresState() {
            State state = State.of(Map.of("x", IntegerValue.of(10), "y", IntegerValue.of(4)));

            ReversalTrace trace = executor.forward(block(plus("x", var("y"))), state, evaluator(state));
            assertThat(state.lookup("x")).isEqualTo(IntegerValue.of(14));

            executor.backward(trace, state);
            assertThat(state.lookup("x")).isEqualTo(IntegerValue.of(10));
            assertThat(state.lookup("y")).isEqualTo(IntegerValue.of(4));
        }

        @Test
        void laterUpdatesSeeEarlierOnes() {
            State state = State.of(Map.of("x", IntegerValue.of(10), "y", IntegerValue.of(4)));
            State initial = state.copy();

            ReversalTrace trace = executor.forward(
                    block(plus("x", var("y")), plus("y", var("x")), minus("x", add(var("y"), integer(1)))),
                    state,
                    evaluator(state));

            assertThat(state.lookup("x")).isEqualTo(IntegerValue.of(-5));
            assertThat(state.lookup("y")).isEqualTo(IntegerValue.of(18));
            assertThat(trace.entries())
                    .extracting(TraceEntry::toString)
                    .containsExactly("x += 4", "y += 14", "x -= 19");

            executor.backward(trace, state);
            assertThat(state).isEqualTo(initial);
        }

        @Test
        void exactKindsRoundTripExactly() {
            State state = State.of(Map.of(
                    "r", RationalValue.of(1, 3),
                    "d", RationalValue.of(2, 7),
                    "n", IntegerValue.of(-9)));
            State initial = state.copy();

            ReversalTrace trace = executor.forward(
                    block(plus("r", var("d")), minus("n", integer(1000)), plus("d", negate(var("n")))),
                    state,
                    evaluator(state));
            executor.backward(trace, state);

            assertThat(state).isEqualTo(initial);
        }

        @Test
        void symbolicUpdatesAreUndoneStructurally() {
            State state = State.of(Map.of("s", SymbolicValue.atom("a")));

            ReversalTrace trace = executor.forward(
                    block(plus("s", symbol("b")), minus("s", symbol("c"))), state, evaluator(state));
            assertThat(state.lookup("s").toString()).isEqualTo("a + b + -(c)");

            executor.backward(trace, state);
            assertThat(state.lookup("s")).isEqualTo(SymbolicValue.atom("a"));
        }

        @Test
        void floatRoundTripIsWithinRounding() {
            State state = State.of(Map.of("f", new FloatValue(0.1)));

            ReversalTrace trace = executor.forward(
                    block(plus("f", floating(0.2)), plus("f", floating(1e-3))), state, evaluator(state));
            executor.backward(trace, state);

            assertThat(((FloatValue) state.lookup("f")).value()).isCloseTo(0.1, within(1e-12));
        }

        @Test
        void promotionIsNotUndone() {
            State state = State.of(Map.of("x", IntegerValue.of(1)));

            ReversalTrace trace = executor.forward(block(plus("x", floating(0.5))), state, evaluator(state));
            executor.backward(trace, state);

            assertThat(state.lookup("x")).isEqualTo(new FloatValue(1.0));
        }

        @Test
        void emptyBlockHasEmptyTrace() {
            State state = State.of(Map.of("x", IntegerValue.of(1)));

            ReversalTrace trace = executor.forward(block(), state, evaluator(state));

            assertThat(trace.isEmpty()).isTrue();
            assertThat(state.lookup("x")).isEqualTo(IntegerValue.of(1));
        }
    }

    @Nested
    @DisplayName("Reversibility precondition")
    class Precondition {

        @Test
        @DisplayName("reverse { x += x } is rejected before anything runs")
        void targetInExpressionIsRejected() {
            State state = State.of(Map.of("x", IntegerValue.of(3), "y", IntegerValue.of(1)));
            ControlStmt.ReverseBlock bad = block(plus("y", integer(1)), plus("x", var("x")));

            assertThatThrownBy(() -> executor.forward(bad, state, evaluator(state)))
                    .isInstanceOfSatisfying(ReversibilityException.class, e -> {
                        assertThat(e.variable()).isEqualTo("x");
                        assertThat(e.kind()).isEqualTo(ReversibilityException.Kind.TARGET_IN_EXPRESSION);
                        assertThat(e.urn()).isEqualTo(ReversibilityException.URN);
                    });
            assertThat(state.lookup("y")).isEqualTo(IntegerValue.of(1));
        }

        @Test
        void nestedOccurrenceCounts() {
            ControlStmt.ReverseBlock bad = block(minus("x", add(integer(1), negate(var("x")))));

            assertThat(ReversibilityChecker.check(bad))
                    .singleElement()
                    .satisfies(e -> assertThat(e.variable()).isEqualTo("x"));
        }

        @Test
        void checkerFindsBlocksInsideFunctionsAndBranches() {
            ControlStmt program = ControlStmt.sequence(
                    new ControlStmt.FunctionDecl(
                            "f", List.of(), Type.UNIT, Purity.TOTAL,
                            block(plus("a", var("a")))),
                    new ControlStmt.If(
                            Condition.of(integer(1)),
                            block(plus("b", var("c"))),
                            block(minus("c", var("c")))));

            assertThat(ReversibilityChecker.check(program))
                    .extracting(ReversibilityException::variable)
                    .containsExactly("a", "c");
        }
    }
}
