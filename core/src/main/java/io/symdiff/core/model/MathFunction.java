package io.symdiff.core.model;

import io.symdiff.core.spi.NumericDomain;
import java.util.Optional;

/** Unary functions recognized by the parser, keyed by their lowercase name. */
public enum MathFunction {
    SIN("sin"),
    COS("cos"),
    LN("ln"),
    EXP("exp");

    private final String functionName;

    MathFunction(String functionName) {
        this.functionName = functionName;
    }

    /** The name as written in expressions, e.g. {@code "ln"}. */
    public String functionName() {
        return functionName;
    }

    public <V> V apply(NumericDomain<V> domain, V argument) {
        return switch (this) {
            case SIN -> domain.sin(argument);
            case COS -> domain.cos(argument);
            case LN -> domain.ln(argument);
            case EXP -> domain.exp(argument);
        };
    }

    public static Optional<MathFunction> lookup(String name) {
        for (MathFunction function : values()) {
            if (function.functionName.equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
