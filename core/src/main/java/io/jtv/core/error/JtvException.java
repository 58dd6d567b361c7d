package io.jtv.core.error;

/**
 * Abstract base for all engine exceptions. Never thrown directly; use the concrete subclasses under
 * {@link StaticCheckException} or {@link ExecutionException}.
 */
public abstract class JtvException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        CHECK,
        EXECUTION
    }

    private final Phase phase;

    protected JtvException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected JtvException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Stable identifier of the error type, e.g. {@code urn:jtv:error:type-mismatch}. */
    public abstract String urn();
}
