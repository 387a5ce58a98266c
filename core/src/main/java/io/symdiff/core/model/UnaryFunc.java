package io.symdiff.core.model;

import io.symdiff.core.spi.NodeFactory;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;
import java.util.Objects;

/** A function applied to one owned argument. */
public record UnaryFunc<V>(MathFunction function, Node<V> argument) implements Node<V> {

    public UnaryFunc {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
    }

    @Override
    public V evaluate(NumericDomain<V> domain, Map<String, V> bindings) {
        return function.apply(domain, argument.evaluate(domain, bindings));
    }

    @Override
    public String render(NumericDomain<V> domain) {
        return function.functionName() + "(" + argument.render(domain) + ")";
    }

    @Override
    public Node<V> copy() {
        return new UnaryFunc<>(function, argument.copy());
    }

    @Override
    public Node<V> derivative(String variable, NodeFactory<V> factory) {
        Node<V> inner = argument.derivative(variable, factory);
        // chain rule: a zero inner derivative annihilates the outer factor, which is never built
        if (inner instanceof Constant<V> constant && factory.domain().isZero(constant.value())) {
            return factory.zero();
        }

        Node<V> outer = switch (function) {
            case SIN -> factory.function(MathFunction.COS, argument.copy());
            case COS -> factory.binary(
                    Operator.MULTIPLY,
                    factory.constant(factory.domain().valueOf(-1)),
                    factory.function(MathFunction.SIN, argument.copy()));
            case EXP -> factory.function(MathFunction.EXP, argument.copy());
            case LN -> factory.binary(Operator.DIVIDE, factory.one(), argument.copy());
        };
        return factory.binary(Operator.MULTIPLY, outer, inner);
    }

    @Override
    public int depth() {
        return 1 + argument.depth();
    }

    @Override
    public int size() {
        return 1 + argument.size();
    }
}
