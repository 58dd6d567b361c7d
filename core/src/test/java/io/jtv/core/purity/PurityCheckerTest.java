package io.jtv.core.purity;

import static io.jtv.core.ast.ControlStmt.assign;
import static io.jtv.core.ast.ControlStmt.print;
import static io.jtv.core.ast.ControlStmt.sequence;
import static io.jtv.core.ast.DataExpr.call;
import static io.jtv.core.ast.DataExpr.integer;
import static io.jtv.core.ast.DataExpr.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jtv.core.ast.Condition;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Param;
import io.jtv.core.ast.Program;
import io.jtv.core.ast.Purity;
import io.jtv.core.error.PurityException;
import io.jtv.core.types.Type;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("PurityCheckerTest")
class PurityCheckerTest {

    private final PurityChecker checker = new PurityChecker();

    private static ControlStmt.FunctionDecl fn(String name, Purity purity, ControlStmt body) {
        return new ControlStmt.FunctionDecl(name, List.of(), Type.UNIT, purity, body);
    }

    private static ControlStmt loop() {
        return new ControlStmt.While(Condition.of(integer(0)), ControlStmt.skip());
    }

    private static ControlStmt callStmt(String name) {
        return new ControlStmt.CallStmt(name, List.of());
    }

    @Nested
    @DisplayName("Annotations")
    class Annotations {

        @Test
        @DisplayName("total function with a while loop is rejected")
        void loopInTotal() {
            PurityReport report = checker.check(Program.of(fn("spin", Purity.TOTAL, loop())));

            assertThat(report.isSuccess()).isFalse();
            assertThat(report.errors()).singleElement().satisfies(e -> {
                assertThat(e.kind()).isEqualTo(PurityException.Kind.LOOP_IN_TOTAL);
                assertThat(e.subject()).isEqualTo("spin");
                assertThat(e.urn()).isEqualTo("urn:jtv:error:purity:loop-in-total");
            });
        }

        @Test
        void forRangeIsALoopToo() {
            ControlStmt body = new ControlStmt.ForRange("i", integer(0), integer(3), ControlStmt.skip());

            assertThat(checker.check(Program.of(fn("count", Purity.TOTAL, body))).errors())
                    .extracting(PurityException::kind)
                    .containsExactly(PurityException.Kind.LOOP_IN_TOTAL);
        }

        @Test
        void loopsAreAllowedInPure() {
            PurityReport report = checker.check(Program.of(fn("spin", Purity.PURE, loop())));

            assertThat(report.isSuccess()).isTrue();
            assertThat(report.levelOf("spin")).contains(Purity.PURE);
        }

        @ParameterizedTest
        @EnumSource(value = Purity.class, names = {"TOTAL", "PURE"})
        void printIsIoInBothPureLevels(Purity declared) {
            PurityReport report = checker.check(Program.of(fn("say", declared, print(integer(1)))));

            assertThat(report.errors()).singleElement().satisfies(e -> {
                assertThat(e.kind()).isEqualTo(PurityException.Kind.IO_IN_PURE);
                assertThat(e.declared()).isEqualTo(declared);
                assertThat(e.required()).isEqualTo(Purity.IMPURE);
            });
        }

        @Test
        void loopIsReportedBeforeIo() {
            ControlStmt body = sequence(loop(), print(integer(1)));

            assertThat(checker.check(Program.of(fn("both", Purity.TOTAL, body))).errors())
                    .extracting(PurityException::kind)
                    .containsExactly(PurityException.Kind.LOOP_IN_TOTAL);
        }

        @Test
        void calleeLevelEscalatesTheCaller() {
            Program program = Program.of(
                    fn("looper", Purity.PURE, loop()),
                    fn("wrapper", Purity.TOTAL, callStmt("looper")));

            PurityReport report = checker.check(program);

            assertThat(report.levelOf("wrapper")).contains(Purity.PURE);
            assertThat(report.errors()).singleElement().satisfies(e -> {
                assertThat(e.kind()).isEqualTo(PurityException.Kind.ANNOTATION_TOO_OPTIMISTIC);
                assertThat(e.subject()).isEqualTo("wrapper");
                assertThat(e.required()).isEqualTo(Purity.PURE);
                assertThat(e.declared()).isEqualTo(Purity.TOTAL);
            });
        }

        @Test
        void conservativeAnnotationsAreAccepted() {
            PurityReport report = checker.check(Program.of(fn("trivial", Purity.IMPURE, ControlStmt.skip())));

            assertThat(report.isSuccess()).isTrue();
            assertThat(report.levelOf("trivial")).contains(Purity.TOTAL);
        }

        @Test
        void intrinsicsNeverEscalate() {
            ControlStmt body = assign("f", call("to_float", integer(1)));

            PurityReport report = checker.check(Program.of(fn("convert", Purity.TOTAL, body)));

            assertThat(report.isSuccess()).isTrue();
            assertThat(report.levelOf("convert")).contains(Purity.TOTAL);
        }
    }

    @Nested
    @DisplayName("Call graph fixed point")
    class CallGraph {

        @Test
        void forwardReferencesAreResolved() {
            Program program = Program.of(
                    fn("early", Purity.IMPURE, callStmt("late")),
                    fn("late", Purity.IMPURE, print(integer(1))));

            PurityReport report = checker.check(program);

            assertThat(report.levelOf("early")).contains(Purity.IMPURE);
            assertThat(report.levelOf("late")).contains(Purity.IMPURE);
        }

        @Test
        void mutualRecursionWithoutEffectsStaysTotal() {
            Program program = Program.of(
                    fn("even", Purity.TOTAL, callStmt("odd")),
                    fn("odd", Purity.TOTAL, callStmt("even")));

            PurityReport report = checker.check(program);

            assertThat(report.isSuccess()).isTrue();
            assertThat(report.levels()).containsEntry("even", Purity.TOTAL).containsEntry("odd", Purity.TOTAL);
        }

        @Test
        void effectsPropagateAroundACycle() {
            Program program = Program.of(
                    fn("a", Purity.PURE, callStmt("b")),
                    fn("b", Purity.PURE, callStmt("c")),
                    fn("c", Purity.PURE, sequence(callStmt("a"), loop())));

            PurityReport report = checker.check(program);

            assertThat(report.isSuccess()).isTrue();
            assertThat(report.levels().values()).containsOnly(Purity.PURE);
        }

        @Test
        void impurityInsideACycleIsReportedForEveryOptimisticMember() {
            Program program = Program.of(
                    fn("a", Purity.PURE, callStmt("b")),
                    fn("b", Purity.IMPURE, sequence(callStmt("a"), print(integer(1)))));

            PurityReport report = checker.check(program);

            assertThat(report.errors()).singleElement().satisfies(e -> {
                assertThat(e.subject()).isEqualTo("a");
                assertThat(e.required()).isEqualTo(Purity.IMPURE);
            });
        }

        @Test
        void nestedDeclarationsDoNotLeakIntoTheirParent() {
            ControlStmt.FunctionDecl inner = fn("inner", Purity.PURE, loop());
            ControlStmt.FunctionDecl outer = fn("outer", Purity.TOTAL, inner);

            PurityReport report = checker.check(Program.of(outer));

            assertThat(report.isSuccess()).isTrue();
            assertThat(report.levelOf("outer")).contains(Purity.TOTAL);
            assertThat(report.levelOf("inner")).contains(Purity.PURE);
        }
    }

    @Nested
    @DisplayName("Data context")
    class DataContext {

        @Test
        @DisplayName("Data expression calling an impure function is rejected")
        void impureCallInDataContext() {
            ControlStmt.FunctionDecl noisy = new ControlStmt.FunctionDecl(
                    "noisy", List.of(), Type.INTEGER, Purity.IMPURE,
                    sequence(print(integer(1)), new ControlStmt.Return(integer(2))));
            Program program = Program.of(noisy, assign("x", call("noisy")), assign("y", call("noisy")));

            PurityReport report = checker.check(program);

            assertThat(report.errors()).singleElement().satisfies(e -> {
                assertThat(e.kind()).isEqualTo(PurityException.Kind.IMPURE_CALL_IN_DATA_CONTEXT);
                assertThat(e.subject()).isEqualTo("noisy");
            });
        }

        @Test
        void impureAnnotationIsHonouredEvenWithoutEffects() {
            ControlStmt.FunctionDecl quiet = new ControlStmt.FunctionDecl(
                    "quiet", List.of(), Type.INTEGER, Purity.IMPURE, new ControlStmt.Return(integer(1)));

            PurityReport report = checker.check(Program.of(quiet, assign("x", call("quiet"))));

            assertThat(report.errors())
                    .extracting(PurityException::kind)
                    .containsExactly(PurityException.Kind.IMPURE_CALL_IN_DATA_CONTEXT);
        }

        @Test
        void impureFunctionsMayBeCalledAsStatements() {
            Program program = Program.of(fn("noisy", Purity.IMPURE, print(integer(1))), callStmt("noisy"));

            assertThat(checker.check(program).isSuccess()).isTrue();
        }

        @Test
        void pureCallsInConditionsAreAllowed() {
            ControlStmt.FunctionDecl limit = new ControlStmt.FunctionDecl(
                    "limit", List.of(new Param("n", Type.INTEGER)), Type.INTEGER, Purity.PURE,
                    sequence(loop(), new ControlStmt.Return(var("n"))));
            ControlStmt guarded = new ControlStmt.If(
                    Condition.of(call("limit", integer(3))), ControlStmt.skip(), ControlStmt.skip());

            assertThat(checker.check(Program.of(limit, guarded)).isSuccess()).isTrue();
        }

        @Test
        void unknownCalleesAreLeftToTheTypeChecker() {
            DataExpr ghost = call("ghost");

            assertThat(checker.check(Program.of(assign("x", ghost))).isSuccess()).isTrue();
        }
    }

    @Nested
    @DisplayName("checkPurity")
    class SingleDeclaration {

        @Test
        void usesTheGivenCalleeLevels() {
            ControlStmt.FunctionDecl decl = fn("caller", Purity.PURE, callStmt("helper"));

            assertThat(checker.checkPurity(decl, Map.of("helper", Purity.TOTAL))).isEqualTo(Purity.TOTAL);
            assertThat(checker.checkPurity(decl, Map.of("helper", Purity.PURE))).isEqualTo(Purity.PURE);
        }

        @Test
        void throwsTheFirstViolation() {
            ControlStmt.FunctionDecl decl = fn("caller", Purity.PURE, callStmt("helper"));

            assertThatThrownBy(() -> checker.checkPurity(decl, Map.of("helper", Purity.IMPURE)))
                    .isInstanceOfSatisfying(PurityException.class, e ->
                            assertThat(e.kind()).isEqualTo(PurityException.Kind.ANNOTATION_TOO_OPTIMISTIC));
        }
    }
}
