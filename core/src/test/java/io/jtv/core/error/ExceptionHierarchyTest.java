package io.jtv.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.jtv.core.ast.Purity;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: the two tiers, common fields and the URN of each type. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void jtvExceptionIsAbstractAndRoot() {
        assertThat(JtvException.class).isAbstract();
        assertThat(JtvException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void staticAndExecutionTiersAreAbstract() {
        assertThat(StaticCheckException.class).isAbstract();
        assertThat(StaticCheckException.class.getSuperclass()).isEqualTo(JtvException.class);
        assertThat(ExecutionException.class).isAbstract();
        assertThat(ExecutionException.class.getSuperclass()).isEqualTo(JtvException.class);
    }

    // --- Static errors ---

    @Test
    void typeCheckExceptionCarriesKindAndSubject() {
        var ex = TypeCheckException.unboundVariable("x");

        assertThat(ex).isInstanceOf(StaticCheckException.class);
        assertThat(ex.kind()).isEqualTo(TypeCheckException.Kind.UNBOUND_VARIABLE);
        assertThat(ex.subject()).isEqualTo("x");
        assertThat(ex.phase()).isEqualTo(JtvException.Phase.CHECK);
        assertThat(ex.urn()).isEqualTo("urn:jtv:error:type:unbound-variable");
        assertThat(ex.detail()).contains("'x'");
    }

    @Test
    void arityMismatchNamesFunctionAndCounts() {
        var ex = TypeCheckException.arity("f", 2, 3);

        assertThat(ex.kind()).isEqualTo(TypeCheckException.Kind.ARITY_MISMATCH);
        assertThat(ex.subject()).isEqualTo("f");
        assertThat(ex.detail()).contains("expects 2").contains("got 3");
    }

    @Test
    void purityExceptionCarriesLevels() {
        var ex = PurityException.annotationTooOptimistic("f", Purity.IMPURE, Purity.PURE);

        assertThat(ex).isInstanceOf(StaticCheckException.class);
        assertThat(ex.kind()).isEqualTo(PurityException.Kind.ANNOTATION_TOO_OPTIMISTIC);
        assertThat(ex.required()).isEqualTo(Purity.IMPURE);
        assertThat(ex.declared()).isEqualTo(Purity.PURE);
        assertThat(ex.urn()).isEqualTo("urn:jtv:error:purity:annotation-too-optimistic");
    }

    @Test
    void loopInTotalRequiresPure() {
        var ex = PurityException.loopInTotal("sum");

        assertThat(ex.required()).isEqualTo(Purity.PURE);
        assertThat(ex.declared()).isEqualTo(Purity.TOTAL);
        assertThat(ex.subject()).isEqualTo("sum");
    }

    @Test
    void reversibilityExceptionNamesVariable() {
        var ex = new ReversibilityException("x");

        assertThat(ex).isInstanceOf(StaticCheckException.class);
        assertThat(ex.variable()).isEqualTo("x");
        assertThat(ex.kind()).isEqualTo(ReversibilityException.Kind.TARGET_IN_EXPRESSION);
        assertThat(ex.phase()).isEqualTo(JtvException.Phase.CHECK);
    }

    // --- Runtime errors ---

    @Test
    void runtimeErrorsExtendExecutionException() {
        assertThat(new UnboundVariableException("y")).isInstanceOf(ExecutionException.class);
        assertThat(new ArithmeticOverflowException("too big")).isInstanceOf(ExecutionException.class);
        assertThat(new StackDepthExceededException("f", 8)).isInstanceOf(ExecutionException.class);
        assertThat(new IterationLimitExceededException(1000)).isInstanceOf(ExecutionException.class);
    }

    @Test
    void iterationLimitReportsSteps() {
        var ex = new IterationLimitExceededException(1000);

        assertThat(ex.stepsTaken()).isEqualTo(1000);
        assertThat(ex.phase()).isEqualTo(JtvException.Phase.EXECUTION);
        assertThat(ex.detail()).contains("1000");
    }

    @Test
    void stackDepthReportsLimit() {
        var ex = new StackDepthExceededException("fib", 64);

        assertThat(ex.limit()).isEqualTo(64);
        assertThat(ex.detail()).contains("fib").contains("64");
    }

    @Test
    void programLoadExceptionIsLoadPhase() {
        var cause = new RuntimeException("bad yaml");
        var ex = new ProgramLoadException("cannot parse", cause, "/tmp/p.yaml");

        assertThat(ex.phase()).isEqualTo(JtvException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/tmp/p.yaml");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    // --- URN constants ---

    @Test
    void runtimeUrnsAreStable() {
        assertThat(UnboundVariableException.URN).isEqualTo("urn:jtv:error:runtime:unbound-variable");
        assertThat(ArithmeticOverflowException.URN).isEqualTo("urn:jtv:error:runtime:arithmetic-overflow");
        assertThat(StackDepthExceededException.URN).isEqualTo("urn:jtv:error:runtime:stack-depth-exceeded");
        assertThat(IterationLimitExceededException.URN)
                .isEqualTo("urn:jtv:error:runtime:iteration-limit-exceeded");
        assertThat(ReversibilityException.URN).isEqualTo("urn:jtv:error:reversibility:target-in-expression");
    }
}
