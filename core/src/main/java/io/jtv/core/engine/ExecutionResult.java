package io.jtv.core.engine;

import io.jtv.core.error.ExecutionException;
import io.jtv.core.error.StaticCheckException;
import io.jtv.core.number.NumericValue;
import io.jtv.core.reversible.ReversalTrace;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link JtvEngine#run}. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Status#SUCCESS}: the program ran to completion; {@code state} holds the final bindings.
 * <li>{@link Status#REJECTED}: a static check failed; nothing ran and nothing was printed.
 * <li>{@link Status#FAILED}: a runtime error aborted the run; {@code output} and {@code state}
 * reflect everything up to the failure.
 * </ul>
 */
public final class ExecutionResult {

    /** The outcome type. */
    public enum Status {
        SUCCESS,
        REJECTED,
        FAILED
    }

    private final Status status;
    private final String programId;
    private final List<String> output;
    private final Map<String, NumericValue> state;
    private final NumericValue returnValue;
    private final List<ReversalTrace> traces;
    private final List<StaticCheckException> staticErrors;
    private final ExecutionException failure;
    private final long steps;

    private ExecutionResult(
            Status status,
            String programId,
            List<String> output,
            Map<String, NumericValue> state,
            NumericValue returnValue,
            List<ReversalTrace> traces,
            List<StaticCheckException> staticErrors,
            ExecutionException failure,
            long steps) {
        this.status = status;
        this.programId = programId;
        this.output = List.copyOf(output);
        this.state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
        this.returnValue = returnValue;
        this.traces = List.copyOf(traces);
        this.staticErrors = List.copyOf(staticErrors);
        this.failure = failure;
        this.steps = steps;
    }

    static ExecutionResult success(
            String programId,
            List<String> output,
            Map<String, NumericValue> state,
            NumericValue returnValue,
            List<ReversalTrace> traces,
            long steps) {
        return new ExecutionResult(
                Status.SUCCESS, programId, output, state, returnValue, traces, List.of(), null, steps);
    }

    static ExecutionResult rejected(String programId, List<StaticCheckException> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty for REJECTED");
        }
        return new ExecutionResult(Status.REJECTED, programId, List.of(), Map.of(), null, List.of(), errors, null, 0);
    }

    static ExecutionResult failed(
            String programId,
            List<String> output,
            Map<String, NumericValue> state,
            List<ReversalTrace> traces,
            ExecutionException failure,
            long steps) {
        Objects.requireNonNull(failure, "failure must not be null for FAILED");
        return new ExecutionResult(Status.FAILED, programId, output, state, null, traces, List.of(), failure, steps);
    }

    public Status status() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String programId() {
        return programId;
    }

    /** Printed values, in order. Always empty for REJECTED. */
    public List<String> output() {
        return output;
    }

    /** Variable bindings at the end of the run (or at the failure point). */
    public Map<String, NumericValue> state() {
        return state;
    }

    /** The value of a top-level {@code return}, if the program ended with one. */
    public Optional<NumericValue> returnValue() {
        return Optional.ofNullable(returnValue);
    }

    /** Traces of every executed reverse block, in execution order. */
    public List<ReversalTrace> traces() {
        return traces;
    }

    /** Static errors. Only non-empty for REJECTED. */
    public List<StaticCheckException> staticErrors() {
        return staticErrors;
    }

    /** The runtime error. Only present for FAILED. */
    public Optional<ExecutionException> failure() {
        return Optional.ofNullable(failure);
    }

    /** Steps consumed by the run. */
    public long steps() {
        return steps;
    }

    @Override
    public String toString() {
        return "ExecutionResult{" + status + ", program=" + programId + ", output=" + output.size() + " line(s)}";
    }
}
