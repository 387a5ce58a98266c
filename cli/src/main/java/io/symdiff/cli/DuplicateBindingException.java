package io.symdiff.cli;

/** Thrown when the same variable name is bound twice on one command line. */
public final class DuplicateBindingException extends ArgumentException {

    private static final long serialVersionUID = 1L;

    private final String variable;

    public DuplicateBindingException(String variable) {
        super("Variable '" + variable + "' is bound more than once");
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
