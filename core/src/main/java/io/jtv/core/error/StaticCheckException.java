package io.jtv.core.error;

/**
 * Abstract parent for errors detected before execution begins (type, purity and reversibility
 * errors). Any one of them rejects the whole program; nothing runs and nothing is printed.
 * Carries the {@code subject} the error is about: a variable or function name.
 */
public abstract class StaticCheckException extends JtvException {

    private static final long serialVersionUID = 1L;

    private final String subject;

    protected StaticCheckException(String message, String subject) {
        super(message, Phase.CHECK);
        this.subject = subject;
    }

    /** The variable or function name the error refers to, or {@code null}. */
    public String subject() {
        return subject;
    }
}
