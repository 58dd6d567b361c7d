package io.jtv.core.spi;

import io.jtv.core.reversible.ReversalTrace;

/**
 * SPI for observability hooks on checks and runs.
 *
 * <p>Embedders bridge these callbacks to their own tracing or metrics. All methods receive immutable
 * event objects and default to doing nothing. Exceptions thrown by listeners are caught by the
 * engine and logged; they never affect checking or execution.
 */
public interface ExecutionListener {

    /** Called after the static checks of a program, whether or not it was accepted. */
    default void onProgramChecked(ProgramCheckedEvent event) {}

    /** Called when an accepted program starts executing. */
    default void onExecutionStarted(ExecutionStartedEvent event) {}

    /** Called when a run completes normally. */
    default void onExecutionCompleted(ExecutionCompletedEvent event) {}

    /** Called when a run aborts with a runtime error. */
    default void onExecutionFailed(ExecutionFailedEvent event) {}

    /** Called after the forward pass of every reverse block, with the recorded trace. */
    default void onReverseBlockExecuted(ReverseBlockExecutedEvent event) {}

    /** Called for every printed value, after it reached the output sink. */
    default void onPrintEmitted(PrintEmittedEvent event) {}

    // --- Event records ---

    /** Outcome of the static checks. */
    record ProgramCheckedEvent(String programId, boolean accepted, int errorCount) {}

    /** Event emitted when a run starts. */
    record ExecutionStartedEvent(String programId) {}

    /** Event emitted when a run completes normally. */
    record ExecutionCompletedEvent(String programId, long durationMs, long steps) {}

    /** Event emitted when a run aborts. */
    record ExecutionFailedEvent(String programId, long durationMs, String errorUrn, String errorDetail) {}

    /** Event emitted for every executed reverse block. */
    record ReverseBlockExecutedEvent(String programId, ReversalTrace trace) {}

    /** Event emitted for every printed value. */
    record PrintEmittedEvent(String programId, String text) {}
}
