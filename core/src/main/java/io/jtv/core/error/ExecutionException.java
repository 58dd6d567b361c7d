package io.jtv.core.error;

/**
 * Abstract parent for runtime failures. Thrown inside the evaluator and caught by the engine, which
 * returns them to the caller inside an {@code ExecutionResult}. A runtime failure aborts only the
 * current execution.
 */
public abstract class ExecutionException extends JtvException {

    private static final long serialVersionUID = 1L;

    protected ExecutionException(String message) {
        super(message, Phase.EXECUTION);
    }

    protected ExecutionException(String message, Throwable cause) {
        super(message, cause, Phase.EXECUTION);
    }
}
