package io.symdiff.core.error;

/**
 * Abstract parent for errors raised while turning expression text into a tree. Carries the
 * 0-based {@code position} in the input at which the problem was detected.
 */
public abstract class ParseException extends SymbolicException {

    private static final long serialVersionUID = 1L;

    private final int position;

    protected ParseException(String message, ErrorKind kind, int position) {
        super(message, kind, Phase.PARSE);
        this.position = position;
    }

    protected ParseException(String message, Throwable cause, ErrorKind kind, int position) {
        super(message, cause, kind, Phase.PARSE);
        this.position = position;
    }

    /** The 0-based input offset of the offending token, or the input length at end of input. */
    public int position() {
        return position;
    }
}
