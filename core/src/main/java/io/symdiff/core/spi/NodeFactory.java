package io.symdiff.core.spi;

import io.symdiff.core.model.MathFunction;
import io.symdiff.core.model.Node;
import io.symdiff.core.model.Operator;

/**
 * Construction seam for expression trees. Every operator node built by the parser or by the
 * derivative rules goes through a factory, which decides whether the node is built verbatim or
 * rewritten first.
 *
 * @param <V> the domain value type
 */
public interface NodeFactory<V> {

    /** The domain whose values the built constants carry. */
    NumericDomain<V> domain();

    Node<V> constant(V value);

    Node<V> variable(String name);

    Node<V> binary(Operator operator, Node<V> left, Node<V> right);

    Node<V> function(MathFunction function, Node<V> argument);

    default Node<V> zero() {
        return constant(domain().zero());
    }

    default Node<V> one() {
        return constant(domain().one());
    }
}
