package io.symdiff.core.error;

/** Thrown when evaluation reaches a variable that has no binding. */
public final class UnboundVariableException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    private final String variable;

    public UnboundVariableException(String variable) {
        super("Variable '" + variable + "' is not bound", ErrorKind.UNBOUND_VARIABLE);
        this.variable = variable;
    }

    /** The name of the unbound variable. */
    public String variable() {
        return variable;
    }
}
