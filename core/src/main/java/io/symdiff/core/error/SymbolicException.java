package io.symdiff.core.error;

/**
 * Abstract base for all engine exceptions. Never thrown directly; use the concrete subclasses
 * under {@link ParseException} or {@link EvaluationException}.
 */
public abstract class SymbolicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final ErrorKind kind;
    private final Phase phase;

    protected SymbolicException(String message, ErrorKind kind, Phase phase) {
        super(message);
        this.kind = kind;
        this.phase = phase;
    }

    protected SymbolicException(String message, Throwable cause, ErrorKind kind, Phase phase) {
        super(message, cause);
        this.kind = kind;
        this.phase = phase;
    }

    /** The error kind, never {@code null}. */
    public ErrorKind kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
