package io.symdiff.core.model;

import io.symdiff.core.spi.NumericDomain;
import java.util.Optional;

/**
 * Binary operators of the expression language with their parser properties. Precedence follows
 * the usual convention ({@code ^} binds tightest); {@code ^} is the only right-associative
 * operator.
 */
public enum Operator {
    ADD('+', 2, false),
    SUBTRACT('-', 2, false),
    MULTIPLY('*', 3, false),
    DIVIDE('/', 3, false),
    POWER('^', 4, true);

    private final char symbol;
    private final int precedence;
    private final boolean rightAssociative;

    Operator(char symbol, int precedence, boolean rightAssociative) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean rightAssociative() {
        return rightAssociative;
    }

    /**
     * Applies the operator to two evaluated operands. Division is not guarded here; see {@link
     * BinaryOp#evaluate}.
     */
    public <V> V apply(NumericDomain<V> domain, V left, V right) {
        return switch (this) {
            case ADD -> domain.add(left, right);
            case SUBTRACT -> domain.subtract(left, right);
            case MULTIPLY -> domain.multiply(left, right);
            case DIVIDE -> domain.divide(left, right);
            case POWER -> domain.pow(left, right);
        };
    }

    /** Returns the operator written as {@code symbol}, or empty for any other character. */
    public static Optional<Operator> fromSymbol(char symbol) {
        for (Operator operator : values()) {
            if (operator.symbol == symbol) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /** Precedence of {@code symbol}, or {@code 0} if it is not an operator. */
    public static int precedenceOf(char symbol) {
        return fromSymbol(symbol).map(Operator::precedence).orElse(0);
    }
}
