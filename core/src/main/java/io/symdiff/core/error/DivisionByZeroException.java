package io.symdiff.core.error;

/** Thrown when a divisor evaluates (or folds) to the domain's zero. */
public final class DivisionByZeroException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    public DivisionByZeroException(String message) {
        super(message, ErrorKind.DIVISION_BY_ZERO);
    }
}
