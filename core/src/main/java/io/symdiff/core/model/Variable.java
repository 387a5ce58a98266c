package io.symdiff.core.model;

import io.symdiff.core.error.UnboundVariableException;
import io.symdiff.core.spi.NodeFactory;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A symbolic name, resolved against the bindings at evaluation time. Names are non-empty runs of
 * letters. A name the domain reserves (the imaginary unit {@code i} in the complex domain)
 * evaluates to its fixed value and behaves as a constant under differentiation.
 */
public record Variable<V>(String name) implements Node<V> {

    public Variable {
        Objects.requireNonNull(name, "name must not be null");
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Variable name must be a non-empty run of letters, got: '" + name + "'");
        }
    }

    /** Returns {@code true} if {@code name} is a legal variable name. */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isLetter(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public V evaluate(NumericDomain<V> domain, Map<String, V> bindings) {
        Optional<V> reserved = domain.reservedValue(name);
        if (reserved.isPresent()) {
            return reserved.get();
        }
        V value = bindings.get(name);
        if (value == null) {
            throw new UnboundVariableException(name);
        }
        return value;
    }

    @Override
    public String render(NumericDomain<V> domain) {
        return name;
    }

    @Override
    public Node<V> copy() {
        return new Variable<>(name);
    }

    @Override
    public Node<V> derivative(String variable, NodeFactory<V> factory) {
        if (factory.domain().reservedValue(name).isPresent()) {
            return factory.zero();
        }
        return name.equals(variable) ? factory.one() : factory.zero();
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
