package io.jtv.core.eval;

import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Program;
import io.jtv.core.error.IterationLimitExceededException;
import io.jtv.core.error.StackDepthExceededException;
import io.jtv.core.number.Arithmetic;
import io.jtv.core.reversible.ReversalTrace;
import io.jtv.core.spi.OutputSink;
import io.jtv.core.types.Type;
import io.jtv.core.types.TypeReport;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Everything a single run owns besides the variable state: function table, arithmetic, output sink,
 * resource counters. One instance per run; never shared between runs or threads.
 */
public final class ExecutionContext {

    private final Map<String, ControlStmt.FunctionDecl> functions;
    private final Arithmetic arithmetic;
    private final ResourceLimits limits;
    private final OutputSink output;
    private Consumer<ReversalTrace> traceObserver = trace -> {};
    private TypeReport staticTypes; // nullable

    private long steps;
    private int depth;

    public ExecutionContext(Program program, Arithmetic arithmetic, ResourceLimits limits, OutputSink output) {
        Objects.requireNonNull(program, "program must not be null");
        this.arithmetic = Objects.requireNonNull(arithmetic, "arithmetic must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.output = Objects.requireNonNull(output, "output must not be null");
        Map<String, ControlStmt.FunctionDecl> table = new LinkedHashMap<>();
        for (ControlStmt.FunctionDecl decl : program.functions()) {
            table.putIfAbsent(decl.name(), decl);
        }
        this.functions = Collections.unmodifiableMap(table);
    }

    /** A context with unbounded integers, default limits and an in-memory output buffer. */
    public static ExecutionContext forProgram(Program program) {
        return new ExecutionContext(program, Arithmetic.unbounded(), ResourceLimits.DEFAULT, new BufferedOutput());
    }

    public Optional<ControlStmt.FunctionDecl> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Arithmetic arithmetic() {
        return arithmetic;
    }

    public ResourceLimits limits() {
        return limits;
    }

    public OutputSink output() {
        return output;
    }

    /** Makes arithmetic follow the types inferred for {@code types}' program. */
    public void useStaticTypes(TypeReport types) {
        this.staticTypes = Objects.requireNonNull(types, "types must not be null");
    }

    /** Inferred type of {@code expr}; empty when no type report is attached. */
    Optional<Type> staticType(DataExpr expr) {
        return staticTypes == null ? Optional.empty() : staticTypes.typeOf(expr);
    }

    /** Receives the trace of every reverse block once its forward pass completed. */
    public void onReverseBlock(Consumer<ReversalTrace> observer) {
        this.traceObserver = Objects.requireNonNull(observer, "observer must not be null");
    }

    void reverseBlockExecuted(ReversalTrace trace) {
        traceObserver.accept(trace);
    }

    /**
     * Accounts for one loop iteration or function call.
     *
     * @throws IterationLimitExceededException if the ceiling has already been reached
     */
    void consumeStep() {
        if (steps >= limits.maxSteps()) {
            throw new IterationLimitExceededException(steps);
        }
        steps++;
    }

    /**
     * @throws StackDepthExceededException if the call would exceed the depth ceiling
     */
    void enterCall(String function) {
        if (depth >= limits.maxCallDepth()) {
            throw new StackDepthExceededException(function, limits.maxCallDepth());
        }
        depth++;
    }

    void exitCall() {
        depth--;
    }

    /** Steps consumed so far. */
    public long steps() {
        return steps;
    }

    /** Current call nesting. */
    public int depth() {
        return depth;
    }
}
