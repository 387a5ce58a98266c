package io.symdiff.core.engine;

import io.symdiff.core.model.BinaryOp;
import io.symdiff.core.model.Constant;
import io.symdiff.core.model.MathFunction;
import io.symdiff.core.model.Node;
import io.symdiff.core.model.Operator;
import io.symdiff.core.model.UnaryFunc;
import io.symdiff.core.model.Variable;
import io.symdiff.core.spi.NodeFactory;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;
import java.util.Objects;

/**
 * Node factory that rewrites each operator node as it is built: identity and annihilator
 * elimination, then constant folding. Rules per operator, checked in order:
 *
 * <ul>
 * <li>{@code +}: {@code x + 0 → x}, {@code 0 + x → x}, fold
 * <li>{@code -}: {@code x - 0 → x}, fold
 * <li>{@code *}: {@code x * 1 → x}, {@code 1 * x → x}, {@code x * 0 → 0}, {@code 0 * x → 0}, fold
 * <li>{@code /}: {@code x / 1 → x}, {@code 0 / x → 0}, fold
 * <li>{@code ^}: {@code x ^ 1 → x}, {@code x ^ 0 → 1}, fold
 * </ul>
 *
 * <p>"Zero", "one" and "constant" are structural tests on {@link Constant} nodes with exact value
 * comparison; a subtree that merely evaluates to zero is left alone. Folding evaluates the
 * operator node with no bindings, so a constant zero divisor throws {@link
 * io.symdiff.core.error.DivisionByZeroException} at construction time. Function nodes are never
 * rewritten.
 */
public final class Simplifier<V> implements NodeFactory<V> {

    private final NumericDomain<V> domain;

    public Simplifier(NumericDomain<V> domain) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
    }

    @Override
    public NumericDomain<V> domain() {
        return domain;
    }

    @Override
    public Node<V> constant(V value) {
        return new Constant<>(value);
    }

    @Override
    public Node<V> variable(String name) {
        return new Variable<>(name);
    }

    @Override
    public Node<V> function(MathFunction function, Node<V> argument) {
        return new UnaryFunc<>(function, argument);
    }

    @Override
    public Node<V> binary(Operator operator, Node<V> left, Node<V> right) {
        Objects.requireNonNull(operator, "operator must not be null");
        return switch (operator) {
            case ADD -> add(left, right);
            case SUBTRACT -> subtract(left, right);
            case MULTIPLY -> multiply(left, right);
            case DIVIDE -> divide(left, right);
            case POWER -> power(left, right);
        };
    }

    private Node<V> add(Node<V> left, Node<V> right) {
        if (isZero(right)) return left;
        if (isZero(left)) return right;
        return foldOrBuild(Operator.ADD, left, right);
    }

    private Node<V> subtract(Node<V> left, Node<V> right) {
        if (isZero(right)) return left;
        return foldOrBuild(Operator.SUBTRACT, left, right);
    }

    private Node<V> multiply(Node<V> left, Node<V> right) {
        if (isOne(right)) return left;
        if (isOne(left)) return right;
        if (isZero(right) || isZero(left)) return zero();
        return foldOrBuild(Operator.MULTIPLY, left, right);
    }

    private Node<V> divide(Node<V> left, Node<V> right) {
        if (isOne(right)) return left;
        if (isZero(left)) return zero();
        return foldOrBuild(Operator.DIVIDE, left, right);
    }

    private Node<V> power(Node<V> base, Node<V> exponent) {
        if (isOne(exponent)) return base;
        if (isZero(exponent)) return one();
        return foldOrBuild(Operator.POWER, base, exponent);
    }

    private Node<V> foldOrBuild(Operator operator, Node<V> left, Node<V> right) {
        BinaryOp<V> node = new BinaryOp<>(operator, left, right);
        if (left instanceof Constant && right instanceof Constant) {
            return new Constant<>(node.evaluate(domain, Map.of()));
        }
        return node;
    }

    private boolean isZero(Node<V> node) {
        return node instanceof Constant<V> constant && domain.isZero(constant.value());
    }

    private boolean isOne(Node<V> node) {
        return node instanceof Constant<V> constant && domain.isOne(constant.value());
    }
}
