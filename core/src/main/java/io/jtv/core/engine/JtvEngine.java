package io.jtv.core.engine;

import io.jtv.core.ast.Program;
import io.jtv.core.error.ExecutionException;
import io.jtv.core.error.ReversibilityException;
import io.jtv.core.error.StaticCheckException;
import io.jtv.core.eval.BufferedOutput;
import io.jtv.core.eval.ExecutionContext;
import io.jtv.core.eval.Interpreter;
import io.jtv.core.eval.ResourceLimits;
import io.jtv.core.eval.State;
import io.jtv.core.number.Arithmetic;
import io.jtv.core.number.NumericValue;
import io.jtv.core.purity.PurityChecker;
import io.jtv.core.purity.PurityReport;
import io.jtv.core.reversible.ReversalTrace;
import io.jtv.core.reversible.ReversibilityChecker;
import io.jtv.core.reversible.ReversibleExecutor;
import io.jtv.core.spi.ExecutionListener;
import io.jtv.core.spi.OutputSink;
import io.jtv.core.types.TypeChecker;
import io.jtv.core.types.TypeReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.FutureTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the engine: statically checks programs and runs the ones that pass.
 *
 * <p>A run is all-or-nothing with respect to the static checks: if any type, purity or
 * reversibility error is found the program never starts and prints nothing. Runtime errors abort the
 * run and are returned inside the {@link ExecutionResult}; they are never thrown from {@link #run}.
 *
 * <p>The engine holds no per-run state. Each run gets its own {@link ExecutionContext} and
 * {@link State}, so one engine may serve many runs, sequentially or from different threads. A run
 * is synchronous but executes on its own interpreter thread with a fixed stack size; listeners are
 * notified from that thread, with the caller's MDC copied onto it.
 */
public final class JtvEngine {

    private static final Logger LOG = LoggerFactory.getLogger(JtvEngine.class);

    /** MDC key carrying the id of the program being checked or run. */
    public static final String MDC_PROGRAM_ID = "programId";

    /** Stack reserved for the interpreter thread; covers {@link ResourceLimits#MAX_CALL_DEPTH} calls. */
    static final long INTERPRETER_STACK_BYTES = 512L * 1024 * 1024;

    private final EngineOptions options;
    private final ExecutionListener listener;

    /** Creates an engine with {@link EngineOptions#DEFAULT} and no listener. */
    public JtvEngine() {
        this(EngineOptions.DEFAULT, null);
    }

    public JtvEngine(EngineOptions options) {
        this(options, null);
    }

    /**
     * @param options  limits and numeric policy applied to every run
     * @param listener optional observer of checks and runs, may be {@code null}
     */
    public JtvEngine(EngineOptions options, ExecutionListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener; // nullable
    }

    public EngineOptions options() {
        return options;
    }

    // ── Static checks ──

    /** Runs all static checks and collects every error. Never executes anything. */
    public CheckReport check(Program program) {
        MDC.put(MDC_PROGRAM_ID, program.id());
        try {
            return checkInternal(program);
        } finally {
            MDC.remove(MDC_PROGRAM_ID);
        }
    }

    private CheckReport checkInternal(Program program) {
        TypeReport types = new TypeChecker().checkProgram(program);
        PurityReport purity = new PurityChecker().check(program);
        List<ReversibilityException> reversibility = ReversibilityChecker.check(program.body());
        CheckReport report = new CheckReport(program.id(), types, purity, reversibility);

        if (report.isAccepted()) {
            LOG.info("Program accepted: program_id={}, functions={}", program.id(), types.signatures().size());
        } else {
            List<StaticCheckException> errors = report.errors();
            LOG.warn("Program rejected: program_id={}, errors={}", program.id(), errors.size());
            for (StaticCheckException error : errors) {
                LOG.debug("Static error: urn={}, detail={}", error.urn(), error.detail());
            }
        }
        notifyProgramChecked(program.id(), report);
        return report;
    }

    // ── Execution ──

    /** Checks and runs {@code program} from an empty state, buffering its output. */
    public ExecutionResult run(Program program) {
        return run(program, State.empty(), null);
    }

    /**
     * Checks and runs {@code program}.
     *
     * @param initial starting bindings; not modified
     * @param sink    receives printed values as they happen, in addition to the result's buffered
     *                output; may be {@code null}
     */
    public ExecutionResult run(Program program, State initial, OutputSink sink) {
        MDC.put(MDC_PROGRAM_ID, program.id());
        try {
            CheckReport report = checkInternal(program);
            if (!report.isAccepted()) {
                return ExecutionResult.rejected(program.id(), report.errors());
            }
            return executeOnInterpreterThread(program, report.types(), initial.copy(), sink);
        } finally {
            MDC.remove(MDC_PROGRAM_ID);
        }
    }

    /**
     * Runs the program on a dedicated thread whose stack is large enough for
     * {@link ResourceLimits#MAX_CALL_DEPTH} nested calls, so the depth at which a run fails depends
     * only on its limits and never on the caller's stack. Blocks until the run finishes.
     */
    private ExecutionResult executeOnInterpreterThread(
            Program program, TypeReport types, State state, OutputSink sink) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        FutureTask<ExecutionResult> task = new FutureTask<>(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return execute(program, types, state, sink);
            } finally {
                MDC.clear();
            }
        });
        Thread worker = new Thread(null, task, "jtv-interpreter-" + program.id(), INTERPRETER_STACK_BYTES);
        worker.start();
        try {
            return task.get();
        } catch (InterruptedException e) {
            worker.interrupt();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running program " + program.id(), e);
        } catch (java.util.concurrent.ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Program " + program.id() + " failed unexpectedly", cause);
        }
    }

    private ExecutionResult execute(Program program, TypeReport types, State state, OutputSink sink) {
        BufferedOutput buffer = new BufferedOutput();
        OutputSink output = text -> {
            buffer.emit(text);
            if (sink != null) {
                sink.emit(text);
            }
            notifyPrintEmitted(program.id(), text);
        };
        ExecutionContext context =
                new ExecutionContext(program, new Arithmetic(options.numericPolicy()), options.limits(), output);
        context.useStaticTypes(types);
        List<ReversalTrace> traces = new ArrayList<>();
        context.onReverseBlock(trace -> {
            traces.add(trace);
            notifyReverseBlockExecuted(program.id(), trace);
        });

        notifyExecutionStarted(program.id());
        long startNanos = System.nanoTime();
        try {
            Optional<NumericValue> returned = new Interpreter(context).execControl(program.body(), state);
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.info(
                    "Program completed: program_id={}, steps={}, duration_ms={}",
                    program.id(),
                    context.steps(),
                    elapsedMs);
            notifyExecutionCompleted(program.id(), elapsedMs, context.steps());
            return ExecutionResult.success(
                    program.id(), buffer.lines(), state.snapshot(), returned.orElse(null), traces, context.steps());
        } catch (ExecutionException e) {
            long failedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.warn(
                    "Program failed: program_id={}, urn={}, steps={}, detail={}",
                    program.id(),
                    e.urn(),
                    context.steps(),
                    e.detail());
            notifyExecutionFailed(program.id(), failedMs, e);
            return ExecutionResult.failed(
                    program.id(), buffer.lines(), state.snapshot(), traces, e, context.steps());
        }
    }

    /**
     * Replays a reverse-block trace backwards on a copy of {@code state}.
     *
     * @return the state before the block ran
     */
    public State reverse(ReversalTrace trace, State state) {
        State restored = state.copy();
        new ReversibleExecutor(new Arithmetic(options.numericPolicy())).backward(trace, restored);
        return restored;
    }

    // ── Listener notification ──

    private void notifyProgramChecked(String programId, CheckReport report) {
        if (listener == null) return;
        try {
            listener.onProgramChecked(new ExecutionListener.ProgramCheckedEvent(
                    programId, report.isAccepted(), report.errors().size()));
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onProgramChecked failed", e);
        }
    }

    private void notifyExecutionStarted(String programId) {
        if (listener == null) return;
        try {
            listener.onExecutionStarted(new ExecutionListener.ExecutionStartedEvent(programId));
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onExecutionStarted failed", e);
        }
    }

    private void notifyExecutionCompleted(String programId, long durationMs, long steps) {
        if (listener == null) return;
        try {
            listener.onExecutionCompleted(new ExecutionListener.ExecutionCompletedEvent(programId, durationMs, steps));
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onExecutionCompleted failed", e);
        }
    }

    private void notifyExecutionFailed(String programId, long durationMs, ExecutionException error) {
        if (listener == null) return;
        try {
            listener.onExecutionFailed(new ExecutionListener.ExecutionFailedEvent(
                    programId, durationMs, error.urn(), error.detail()));
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onExecutionFailed failed", e);
        }
    }

    private void notifyReverseBlockExecuted(String programId, ReversalTrace trace) {
        if (listener == null) return;
        try {
            listener.onReverseBlockExecuted(new ExecutionListener.ReverseBlockExecutedEvent(programId, trace));
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onReverseBlockExecuted failed", e);
        }
    }

    private void notifyPrintEmitted(String programId, String text) {
        if (listener == null) return;
        try {
            listener.onPrintEmitted(new ExecutionListener.PrintEmittedEvent(programId, text));
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onPrintEmitted failed", e);
        }
    }
}
