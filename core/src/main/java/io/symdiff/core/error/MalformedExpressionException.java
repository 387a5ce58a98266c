package io.symdiff.core.error;

/**
 * Thrown when the token stream does not form a single well-formed expression (unmatched
 * parentheses, missing operands, stack underflow, adjacent operands).
 */
public final class MalformedExpressionException extends ParseException {

    private static final long serialVersionUID = 1L;

    public MalformedExpressionException(String message, int position) {
        super(message, ErrorKind.MALFORMED_EXPRESSION, position);
    }

    public MalformedExpressionException(String message, Throwable cause, int position) {
        super(message, cause, ErrorKind.MALFORMED_EXPRESSION, position);
    }
}
