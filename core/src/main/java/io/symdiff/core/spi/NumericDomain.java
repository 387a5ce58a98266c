package io.symdiff.core.spi;

import java.util.Optional;

/**
 * Numeric value policy that parameterizes every part of the engine (tree, evaluator,
 * simplifier, differentiator, parser). Implementations define the value type {@code V}, its
 * arithmetic, its literal syntax and its text form.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 *
 * @param <V> the immutable value type of the domain
 */
public interface NumericDomain<V> {

    /**
     * Returns the domain identifier, e.g. {@code "real"} or {@code "complex"}. Used by the front
     * end to select a domain by name.
     */
    String id();

    V zero();

    V one();

    /** Converts a real scalar into the domain (used for the literal constants of derivative rules). */
    V valueOf(double value);

    V add(V left, V right);

    V subtract(V left, V right);

    V multiply(V left, V right);

    /** Divides without a zero check; callers test the divisor with {@link #isZero(Object)} first. */
    V divide(V left, V right);

    V pow(V base, V exponent);

    V negate(V value);

    V sin(V value);

    V cos(V value);

    V exp(V value);

    /**
     * Natural logarithm.
     *
     * @throws io.symdiff.core.error.DomainErrorException if the domain has no logarithm for the
     *     argument
     */
    V ln(V value);

    /** Exact comparison with {@link #zero()}; no tolerance. */
    boolean isZero(V value);

    /** Exact comparison with {@link #one()}; no tolerance. */
    boolean isOne(V value);

    /**
     * Returns the fixed value of a reserved variable name, or empty if the name is an ordinary
     * variable. Reserved names evaluate to their value regardless of bindings.
     */
    Optional<V> reservedValue(String name);

    /**
     * Parses a numeric literal token produced by the expression scanner (digits with at most one
     * decimal point).
     *
     * @throws NumberFormatException if the token is not a valid literal
     */
    V parseLiteral(String token);

    /**
     * Parses a user-supplied value, e.g. the right-hand side of a {@code name=value} binding.
     *
     * @throws NumberFormatException if the text is not a valid value of this domain
     */
    V parseValue(String text);

    /** Canonical text form of a value; re-parseable as an expression in this domain. */
    String format(V value);

    /**
     * Returns {@code true} if the raw text looks like input that requires this domain. Used for
     * automatic domain selection; the real domain never claims input.
     */
    boolean looksLikeInput(String text);
}
