package io.symdiff.core.model;

import io.symdiff.core.spi.NodeFactory;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;

/**
 * A node of an expression tree. The variant set is closed: constants, variables, binary
 * operations and unary functions. Nodes are immutable and every variant owns its children; a
 * transformation always produces a new subtree.
 *
 * @param <V> the domain value type carried by constants
 */
public sealed interface Node<V> permits Constant, Variable, BinaryOp, UnaryFunc {

    /**
     * Reduces this subtree to a value, children first.
     *
     * @param domain the arithmetic to apply
     * @param bindings variable values; never mutated
     * @throws io.symdiff.core.error.EvaluationException if a variable is unbound, a divisor is
     *     zero or a function is applied outside its domain
     */
    V evaluate(NumericDomain<V> domain, Map<String, V> bindings);

    /**
     * Renders this subtree as fully parenthesized text: {@code (left OP right)} for operators,
     * {@code name(arg)} for functions.
     */
    String render(NumericDomain<V> domain);

    /** Deep copy of this subtree. */
    Node<V> copy();

    /**
     * Structural derivative of this subtree with respect to {@code variable}. Every node of the
     * result is built through {@code factory}, so the result is simplified exactly when the
     * factory simplifies.
     */
    Node<V> derivative(String variable, NodeFactory<V> factory);

    /** Height of this subtree; a leaf has depth 1. */
    int depth();

    /** Number of nodes in this subtree. */
    int size();
}
