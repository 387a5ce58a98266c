package io.symdiff.core.engine;

import io.symdiff.core.domain.Complex;
import io.symdiff.core.domain.ComplexDomain;
import io.symdiff.core.domain.RealDomain;
import io.symdiff.core.error.SymbolicException;
import io.symdiff.core.model.Expression;
import io.symdiff.core.model.Outcome;
import io.symdiff.core.parser.ExpressionParser;
import io.symdiff.core.spi.NumericDomain;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine for one numeric domain: parse, evaluate, differentiate and render.
 *
 * <p>Operations that can fail on user input ({@link #parse} and {@link #evaluate}) return an
 * {@link Outcome} instead of throwing. Programming errors (null arguments, an expression from
 * another domain, an illegal differentiation variable) still throw.
 *
 * <p>Thread-safe: all collaborators are stateless.
 *
 * @param <V> the value type of the domain
 */
public final class SymbolicEngine<V> {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolicEngine.class);

    private final NumericDomain<V> domain;
    private final EngineOptions options;
    private final ExpressionParser<V> parser;
    private final Evaluator<V> evaluator;
    private final Differentiator<V> differentiator;

    public SymbolicEngine(NumericDomain<V> domain) {
        this(domain, EngineOptions.DEFAULT);
    }

    public SymbolicEngine(NumericDomain<V> domain, EngineOptions options) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.parser = new ExpressionParser<>(domain, options);
        this.evaluator = new Evaluator<>(domain);
        this.differentiator = new Differentiator<>(domain);
    }

    public static SymbolicEngine<Double> real() {
        return new SymbolicEngine<>(new RealDomain());
    }

    public static SymbolicEngine<Complex> complex() {
        return new SymbolicEngine<>(new ComplexDomain());
    }

    public NumericDomain<V> domain() {
        return domain;
    }

    public EngineOptions options() {
        return options;
    }

    /** Parses infix text. Failures carry an {@code InvalidCharacter} or {@code MalformedExpression} kind. */
    public Outcome<Expression<V>> parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return Outcome.success(parser.parse(text));
        } catch (SymbolicException e) {
            LOG.debug("expression.rejected: domain={}, kind={}, detail={}", domain.id(), e.kind(), e.detail());
            return Outcome.failure(e);
        }
    }

    /**
     * Evaluates an expression. Failures carry an {@code UnboundVariable}, {@code DivisionByZero}
     * or {@code DomainError} kind.
     */
    public Outcome<V> evaluate(Expression<V> expression, Map<String, V> bindings) {
        try {
            return Outcome.success(evaluator.evaluate(expression, bindings));
        } catch (SymbolicException e) {
            LOG.debug("evaluation.failed: domain={}, kind={}, detail={}", domain.id(), e.kind(), e.detail());
            return Outcome.failure(e);
        }
    }

    /** First derivative with respect to {@code variable}. Never fails for a well-formed tree. */
    public Expression<V> differentiate(Expression<V> expression, String variable) {
        return differentiator.differentiate(expression, variable);
    }

    /** Derivative of the given order; order {@code 0} yields a copy. */
    public Expression<V> differentiate(Expression<V> expression, String variable, int order) {
        return differentiator.differentiate(expression, variable, order);
    }

    /** Fully parenthesized text form; re-parsing it yields an equal tree. */
    public String render(Expression<V> expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return expression.render();
    }
}
