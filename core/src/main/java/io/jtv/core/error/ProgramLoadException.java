package io.jtv.core.error;

/**
 * Thrown when a serialized program document has invalid syntax, unknown keys or fails schema
 * validation. Carries the {@code source} the document was read from.
 */
public final class ProgramLoadException extends JtvException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jtv:error:load:invalid-program";

    private final String source;

    public ProgramLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    public ProgramLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }

    @Override
    public String urn() {
        return URN;
    }
}
