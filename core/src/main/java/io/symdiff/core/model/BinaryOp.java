package io.symdiff.core.model;

import io.symdiff.core.error.DivisionByZeroException;
import io.symdiff.core.spi.NodeFactory;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;
import java.util.Objects;

/** An operator applied to two owned operands. */
public record BinaryOp<V>(Operator operator, Node<V> left, Node<V> right) implements Node<V> {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left operand must not be null");
        Objects.requireNonNull(right, "right operand must not be null");
    }

    @Override
    public V evaluate(NumericDomain<V> domain, Map<String, V> bindings) {
        V leftValue = left.evaluate(domain, bindings);
        V rightValue = right.evaluate(domain, bindings);
        if (operator == Operator.DIVIDE && domain.isZero(rightValue)) {
            throw new DivisionByZeroException(
                    "Division by zero: divisor " + right.render(domain) + " evaluates to zero");
        }
        return operator.apply(domain, leftValue, rightValue);
    }

    /**
     * Renders {@code (left OP right)}. A negative constant base of a power is parenthesized, since
     * a leading {@code -} binds looser than {@code ^} when the text is parsed again.
     */
    @Override
    public String render(NumericDomain<V> domain) {
        String leftText = left.render(domain);
        if (operator == Operator.POWER && left instanceof Constant<?> && leftText.startsWith("-")) {
            leftText = "(" + leftText + ")";
        }
        return "(" + leftText + " " + operator.symbol() + " " + right.render(domain) + ")";
    }

    @Override
    public Node<V> copy() {
        return new BinaryOp<>(operator, left.copy(), right.copy());
    }

    @Override
    public Node<V> derivative(String variable, NodeFactory<V> factory) {
        Node<V> leftDerivative = left.derivative(variable, factory);
        Node<V> rightDerivative = right.derivative(variable, factory);

        return switch (operator) {
            case ADD, SUBTRACT -> factory.binary(operator, leftDerivative, rightDerivative);
            case MULTIPLY -> factory.binary(
                    Operator.ADD,
                    factory.binary(Operator.MULTIPLY, leftDerivative, right.copy()),
                    factory.binary(Operator.MULTIPLY, left.copy(), rightDerivative));
            case DIVIDE -> {
                Node<V> numerator = factory.binary(
                        Operator.SUBTRACT,
                        factory.binary(Operator.MULTIPLY, leftDerivative, right.copy()),
                        factory.binary(Operator.MULTIPLY, left.copy(), rightDerivative));
                Node<V> denominator = factory.binary(
                        Operator.POWER, right.copy(), factory.constant(factory.domain().valueOf(2)));
                yield factory.binary(Operator.DIVIDE, numerator, denominator);
            }
            case POWER -> {
                // d(b^e) = b^e * (e' * ln(b) + e * b' / b)
                Node<V> exponentTerm = factory.binary(
                        Operator.MULTIPLY, rightDerivative, factory.function(MathFunction.LN, left.copy()));
                Node<V> baseTerm = factory.binary(
                        Operator.MULTIPLY,
                        right.copy(),
                        factory.binary(Operator.DIVIDE, leftDerivative, left.copy()));
                yield factory.binary(
                        Operator.MULTIPLY,
                        factory.binary(Operator.POWER, left.copy(), right.copy()),
                        factory.binary(Operator.ADD, exponentTerm, baseTerm));
            }
        };
    }

    @Override
    public int depth() {
        return 1 + Math.max(left.depth(), right.depth());
    }

    @Override
    public int size() {
        return 1 + left.size() + right.size();
    }
}
