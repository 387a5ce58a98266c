package io.symdiff.core.model;

import io.symdiff.core.spi.NodeFactory;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;
import java.util.Objects;

/** A numeric literal of the active domain. */
public record Constant<V>(V value) implements Node<V> {

    public Constant {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public V evaluate(NumericDomain<V> domain, Map<String, V> bindings) {
        return value;
    }

    /**
     * Formats the value through the domain. Non-finite values render as {@code NaN}, {@code
     * Infinity} or {@code -Infinity}, which parse back as variables, so trees holding them (for
     * example a folded {@code (0 - 1) ^ 0.5}) do not survive a render and re-parse.
     */
    @Override
    public String render(NumericDomain<V> domain) {
        return domain.format(value);
    }

    @Override
    public Node<V> copy() {
        return new Constant<>(value);
    }

    @Override
    public Node<V> derivative(String variable, NodeFactory<V> factory) {
        return factory.zero();
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public int size() {
        return 1;
    }
}
