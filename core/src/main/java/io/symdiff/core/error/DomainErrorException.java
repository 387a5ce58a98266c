package io.symdiff.core.error;

/** Thrown when a function is applied outside its domain, e.g. real {@code ln} of a non-positive value. */
public final class DomainErrorException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    private final String function;
    private final String argument;

    public DomainErrorException(String function, String argument) {
        super(function + " is undefined for argument " + argument + " in the real domain", ErrorKind.DOMAIN_ERROR);
        this.function = function;
        this.argument = argument;
    }

    public String function() {
        return function;
    }

    /** The offending argument, rendered in the domain's notation. */
    public String argument() {
        return argument;
    }
}
