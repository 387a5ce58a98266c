package io.symdiff.core.engine;

import io.symdiff.core.model.Expression;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces expressions to values under a variable binding. The bindings are snapshotted before
 * evaluation, so the caller's map is never read again or mutated.
 *
 * <p>Stateless and thread-safe.
 */
public final class Evaluator<V> {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final NumericDomain<V> domain;

    public Evaluator(NumericDomain<V> domain) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
    }

    /**
     * Evaluates {@code expression} post-order.
     *
     * @param expression the expression; must belong to this evaluator's domain
     * @param bindings variable values; null keys or values are rejected
     * @return the value of the tree
     * @throws io.symdiff.core.error.EvaluationException if a variable is unbound, a divisor
     *     evaluates to zero or a function is applied outside its domain
     */
    public V evaluate(Expression<V> expression, Map<String, V> bindings) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(bindings, "bindings must not be null");
        if (!domain.id().equals(expression.domain().id())) {
            throw new IllegalArgumentException("Expression belongs to the " + expression.domain().id()
                    + " domain, evaluator to the " + domain.id() + " domain");
        }

        Map<String, V> snapshot = Map.copyOf(bindings);
        V value = expression.root().evaluate(domain, snapshot);
        LOG.debug(
                "expression.evaluated: domain={}, nodes={}, bindings={}, value={}",
                domain.id(),
                expression.size(),
                snapshot.size(),
                domain.format(value));
        return value;
    }
}
