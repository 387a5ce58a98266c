package io.symdiff.core.engine;

import io.symdiff.core.model.Expression;
import io.symdiff.core.model.Node;
import io.symdiff.core.model.Variable;
import io.symdiff.core.spi.NumericDomain;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symbolic differentiation. Every node of a derivative is built through the {@link Simplifier},
 * which keeps repeated derivatives compact. Differentiating a well-formed tree never fails; the
 * result may still fail to evaluate for particular bindings.
 *
 * <p>Stateless and thread-safe.
 */
public final class Differentiator<V> {

    private static final Logger LOG = LoggerFactory.getLogger(Differentiator.class);

    private final NumericDomain<V> domain;
    private final Simplifier<V> simplifier;

    public Differentiator(NumericDomain<V> domain) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.simplifier = new Simplifier<>(domain);
    }

    /**
     * Returns the first derivative of {@code expression} with respect to {@code variable}.
     *
     * @throws IllegalArgumentException if {@code variable} is not a legal variable name
     */
    public Expression<V> differentiate(Expression<V> expression, String variable) {
        return differentiate(expression, variable, 1);
    }

    /**
     * Returns the {@code order}-th derivative. Order {@code 0} returns a copy of the expression.
     *
     * @throws IllegalArgumentException if {@code variable} is not a legal variable name or {@code
     *     order} is negative
     */
    public Expression<V> differentiate(Expression<V> expression, String variable, int order) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (!Variable.isValidName(variable)) {
            throw new IllegalArgumentException(
                    "Differentiation variable must be a non-empty run of letters, got: '" + variable + "'");
        }
        if (order < 0) {
            throw new IllegalArgumentException("Derivative order must not be negative, got: " + order);
        }

        Node<V> current = expression.root().copy();
        for (int n = 0; n < order; n++) {
            current = current.derivative(variable, simplifier);
        }

        LOG.debug(
                "expression.differentiated: domain={}, variable={}, order={}, inputNodes={}, outputNodes={}, depth={}",
                domain.id(),
                variable,
                order,
                expression.size(),
                current.size(),
                current.depth());
        return Expression.of(current, domain);
    }
}
