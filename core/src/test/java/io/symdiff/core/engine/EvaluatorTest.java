package io.symdiff.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.symdiff.core.domain.ComplexDomain;
import io.symdiff.core.domain.RealDomain;
import io.symdiff.core.error.DivisionByZeroException;
import io.symdiff.core.error.DomainErrorException;
import io.symdiff.core.error.UnboundVariableException;
import io.symdiff.core.model.Expression;
import io.symdiff.core.parser.ExpressionParser;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator}. */
class EvaluatorTest {

    private static final RealDomain REAL = new RealDomain();

    private final ExpressionParser<Double> parser = new ExpressionParser<>(REAL);
    private final Evaluator<Double> evaluator = new Evaluator<>(REAL);

    @Test
    void evaluatesLiteralArithmetic() {
        assertThat(evaluator.evaluate(parser.parse("5 + 7"), Map.of())).isEqualTo(12.0);
        assertThat(evaluator.evaluate(parser.parse("2 * 3 + 4 / 8"), Map.of())).isEqualTo(6.5);
    }

    @Test
    void extraBindingsAreIgnored() {
        assertThat(evaluator.evaluate(parser.parse("y + 4"), Map.of("y", 6.0, "z", 1.0))).isEqualTo(10.0);
    }

    @Test
    void unboundVariableIsReported() {
        assertThatThrownBy(() -> evaluator.evaluate(parser.parse("x * y"), Map.of("x", 1.0)))
                .isInstanceOf(UnboundVariableException.class)
                .hasMessageContaining("'y'");
    }

    @Test
    void divisionByZeroIsReportedAtEvaluation() {
        Expression<Double> expr = parser.parse("1 / (x - 2)");

        assertThat(evaluator.evaluate(expr, Map.of("x", 4.0))).isEqualTo(0.5);
        assertThatThrownBy(() -> evaluator.evaluate(expr, Map.of("x", 2.0)))
                .isInstanceOf(DivisionByZeroException.class);
    }

    @Test
    void domainErrorIsReported() {
        assertThatThrownBy(() -> evaluator.evaluate(parser.parse("ln(x)"), Map.of("x", 0.0)))
                .isInstanceOf(DomainErrorException.class);
    }

    @Test
    void bindingsAreSnapshotted() {
        Map<String, Double> bindings = new HashMap<>(Map.of("x", 3.0));

        evaluator.evaluate(parser.parse("x ^ 2"), bindings);

        assertThat(bindings).containsExactly(Map.entry("x", 3.0));
    }

    @Test
    void nullBindingValuesAreRejected() {
        Map<String, Double> bindings = new HashMap<>();
        bindings.put("x", null);

        assertThatThrownBy(() -> evaluator.evaluate(parser.parse("x"), bindings))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void foreignDomainIsRejected() {
        @SuppressWarnings({"unchecked", "rawtypes"})
        Expression<Double> complexExpr = (Expression) new ExpressionParser<>(new ComplexDomain()).parse("x");

        assertThatThrownBy(() -> evaluator.evaluate(complexExpr, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("complex");
    }
}
