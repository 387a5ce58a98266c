package io.symdiff.core.model;

import io.symdiff.core.spi.NumericDomain;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * An expression tree bound to its numeric domain. Immutable value type: {@link #copy()} deep
 * copies the tree, equality is structural, and two expressions never share mutable state.
 *
 * <p>The combinators ({@link #plus}, {@link #times}, {@link #sin}, ...) build raw, unsimplified
 * trees over deep copies of their operands.
 *
 * @param <V> the domain value type
 */
public final class Expression<V> {

    private final Node<V> root;
    private final NumericDomain<V> domain;

    private Expression(Node<V> root, NumericDomain<V> domain) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
    }

    public static <V> Expression<V> of(Node<V> root, NumericDomain<V> domain) {
        return new Expression<>(root, domain);
    }

    public static <V> Expression<V> constant(V value, NumericDomain<V> domain) {
        return new Expression<>(new Constant<>(value), domain);
    }

    public static <V> Expression<V> variable(String name, NumericDomain<V> domain) {
        return new Expression<>(new Variable<>(name), domain);
    }

    public Node<V> root() {
        return root;
    }

    public NumericDomain<V> domain() {
        return domain;
    }

    /** Returns an equal expression backed by a freshly copied tree. */
    public Expression<V> copy() {
        return new Expression<>(root.copy(), domain);
    }

    /**
     * Evaluates the tree under {@code bindings}. The map is only read.
     *
     * @throws io.symdiff.core.error.EvaluationException on unbound variables, zero divisors or
     *     domain errors
     */
    public V evaluate(Map<String, V> bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        return root.evaluate(domain, Collections.unmodifiableMap(bindings));
    }

    /** Fully parenthesized canonical text of the tree. */
    public String render() {
        return root.render(domain);
    }

    public int depth() {
        return root.depth();
    }

    public int size() {
        return root.size();
    }

    // --- Combinators ---

    public Expression<V> plus(Expression<V> other) {
        return combine(Operator.ADD, other);
    }

    public Expression<V> minus(Expression<V> other) {
        return combine(Operator.SUBTRACT, other);
    }

    public Expression<V> times(Expression<V> other) {
        return combine(Operator.MULTIPLY, other);
    }

    public Expression<V> dividedBy(Expression<V> other) {
        return combine(Operator.DIVIDE, other);
    }

    public Expression<V> pow(Expression<V> exponent) {
        return combine(Operator.POWER, exponent);
    }

    public Expression<V> sin() {
        return apply(MathFunction.SIN);
    }

    public Expression<V> cos() {
        return apply(MathFunction.COS);
    }

    public Expression<V> exp() {
        return apply(MathFunction.EXP);
    }

    public Expression<V> ln() {
        return apply(MathFunction.LN);
    }

    private Expression<V> combine(Operator operator, Expression<V> other) {
        Objects.requireNonNull(other, "other must not be null");
        if (!domain.id().equals(other.domain.id())) {
            throw new IllegalArgumentException(
                    "Cannot combine a " + domain.id() + " expression with a " + other.domain.id() + " expression");
        }
        return new Expression<>(new BinaryOp<>(operator, root.copy(), other.root.copy()), domain);
    }

    private Expression<V> apply(MathFunction function) {
        return new Expression<>(new UnaryFunc<>(function, root.copy()), domain);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Expression<?> other)) return false;
        return domain.id().equals(other.domain.id()) && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain.id(), root);
    }

    @Override
    public String toString() {
        return render();
    }
}
