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
import java.util.Objects;

/** Builds every node verbatim. Used by the parser unless simplification on parse is enabled. */
public final class RawNodeFactory<V> implements NodeFactory<V> {

    private final NumericDomain<V> domain;

    public RawNodeFactory(NumericDomain<V> domain) {
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
    public Node<V> binary(Operator operator, Node<V> left, Node<V> right) {
        return new BinaryOp<>(operator, left, right);
    }

    @Override
    public Node<V> function(MathFunction function, Node<V> argument) {
        return new UnaryFunc<>(function, argument);
    }
}
