package io.symdiff.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.symdiff.core.domain.Complex;
import io.symdiff.core.domain.ComplexDomain;
import io.symdiff.core.domain.RealDomain;
import io.symdiff.core.engine.EngineOptions;
import io.symdiff.core.error.DivisionByZeroException;
import io.symdiff.core.error.UnboundVariableException;
import io.symdiff.core.error.InvalidCharacterException;
import io.symdiff.core.error.MalformedExpressionException;
import io.symdiff.core.error.ParseException;
import io.symdiff.core.model.Expression;
import io.symdiff.core.model.Variable;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link ExpressionParser}: precedence, associativity, functions and error reporting. */
@DisplayName("ExpressionParser")
class ExpressionParserTest {

    private static final RealDomain REAL = new RealDomain();

    private final ExpressionParser<Double> parser = new ExpressionParser<>(REAL);

    private double eval(String text) {
        return parser.parse(text).evaluate(Map.of());
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource({
            "'5 + 7', 12",
            "'2 + 3 * 4', 14",
            "'(2 + 3) * 4', 20",
            "'10 - 4 - 3', 3",
            "'16 / 4 / 2', 2",
            "'2 ^ 3 ^ 2', 512",
            "'2 * 3 ^ 2', 18",
            "'2 ^ -1', 0.5",
            "'-2 ^ 2', -4",
            "'2 * -3', -6",
            "'2 - -3', 5",
            "'--2', 2",
            "'+3', 3",
            "'.5 + 1.25', 1.75",
            "'  1+2 ', 3"
        })
        void evaluatesWithConventionalRules(String text, double expected) {
            assertThat(eval(text)).isCloseTo(expected, within(1e-12));
        }

        @Test
        void powerIsRightAssociativeInTheTree() {
            assertThat(parser.parse("2 ^ 3 ^ 2").render()).isEqualTo("(2 ^ (3 ^ 2))");
        }

        @Test
        void unaryMinusBindsLooserThanPower() {
            Expression<Double> expr = parser.parse("-x ^ 2");

            assertThat(expr.render()).isEqualTo("(-1 * (x ^ 2))");
            assertThat(expr.evaluate(Map.of("x", 3.0))).isEqualTo(-9.0);
        }

        @Test
        void negatedLiteralBecomesNegativeConstant() {
            assertThat(parser.parse("x ^ -3").render()).isEqualTo("(x ^ -3)");
        }

        @Test
        void treesAreRawByDefault() {
            assertThat(parser.parse("x * 1 + 0").render()).isEqualTo("((x * 1) + 0)");
        }
    }

    @Nested
    @DisplayName("Variables and functions")
    class Functions {

        @Test
        void functionAppliesToWholeParenthesizedArgument() {
            Expression<Double> expr = parser.parse("sin(y*(x+1))");

            assertThat(expr.render()).isEqualTo("sin((y * (x + 1)))");
            assertThat(expr.evaluate(Map.of("x", 1.0, "y", 0.25))).isCloseTo(Math.sin(0.5), within(1e-12));
        }

        @Test
        void nestedFunctionCalls() {
            assertThat(parser.parse("ln(exp(2)) + cos(0)").render()).isEqualTo("(ln(exp(2)) + cos(0))");
            assertThat(eval("ln(exp(2)) + cos(0)")).isCloseTo(3.0, within(1e-12));
        }

        @Test
        void whitespaceBeforeCallParenthesis() {
            assertThat(parser.parse("exp (x)").render()).isEqualTo("exp(x)");
        }

        @Test
        void multiLetterNamesAreVariables() {
            assertThat(parser.parse("alpha * sinx").evaluate(Map.of("alpha", 2.0, "sinx", 3.0))).isEqualTo(6.0);
        }

        @Test
        void functionWithoutParenthesisIsMalformed() {
            assertThatThrownBy(() -> parser.parse("sin x"))
                    .isInstanceOf(MalformedExpressionException.class)
                    .hasMessageContaining("sin");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void invalidCharacterReportsPosition() {
            assertThatThrownBy(() -> parser.parse("2 $ 3"))
                    .isInstanceOf(InvalidCharacterException.class)
                    .satisfies(e -> {
                        var ex = (InvalidCharacterException) e;
                        assertThat(ex.character()).isEqualTo('$');
                        assertThat(ex.position()).isEqualTo(2);
                    });
        }

        @Test
        void unclosedParenthesis() {
            assertThatThrownBy(() -> parser.parse("(2 +")).isInstanceOf(MalformedExpressionException.class);
        }

        @Test
        void unmatchedOpeningReportsItsPosition() {
            assertThatThrownBy(() -> parser.parse("1 + ((2)"))
                    .isInstanceOf(MalformedExpressionException.class)
                    .hasMessageContaining("Unmatched '('")
                    .satisfies(e -> assertThat(((ParseException) e).position()).isEqualTo(4));
        }

        @Test
        void unmatchedClosing() {
            assertThatThrownBy(() -> parser.parse("(1))"))
                    .isInstanceOf(MalformedExpressionException.class)
                    .hasMessageContaining("Unmatched ')'")
                    .satisfies(e -> assertThat(((ParseException) e).position()).isEqualTo(3));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "()", "2 3", "2x", "* 3", "1 +", "(1 +) 2", "1.2.3", ".", "x (1)", "sin()"})
        void malformedInputs(String text) {
            assertThatThrownBy(() -> parser.parse(text)).isInstanceOf(MalformedExpressionException.class);
        }

        @Test
        void nestingDepthIsBounded() {
            var shallow = new ExpressionParser<>(REAL, new EngineOptions(false, 3));

            assertThat(shallow.parse("(((1)))").evaluate(Map.of())).isEqualTo(1.0);
            assertThatThrownBy(() -> shallow.parse("sin(((1)))"))
                    .isInstanceOf(MalformedExpressionException.class)
                    .hasMessageContaining("Nesting depth");
        }

        @Test
        void simplifyOnParseFoldsConstantDivisionByZero() {
            var simplifying = new ExpressionParser<>(REAL, new EngineOptions(true, 256));

            assertThat(simplifying.parse("x * 1 + 0").render()).isEqualTo("x");
            assertThatThrownBy(() -> simplifying.parse("1 / 0")).isInstanceOf(DivisionByZeroException.class);
        }

        @Test
        void rawDivisionByZeroParses() {
            assertThat(parser.parse("1 / 0").render()).isEqualTo("(1 / 0)");
        }
    }

    @Nested
    @DisplayName("Complex domain")
    class ComplexInput {

        private final ExpressionParser<Complex> complex = new ExpressionParser<>(new ComplexDomain());

        @Test
        void imaginaryUnitSquared() {
            assertThat(complex.parse("i*i").evaluate(Map.of())).isEqualTo(new Complex(-1, 0));
        }

        @Test
        void renderedComplexConstantsReparse() {
            ComplexDomain domain = new ComplexDomain();
            Complex value = new Complex(2, -3);
            Expression<Complex> reparsed = complex.parse(domain.format(value));

            assertThat(reparsed.evaluate(Map.of())).isEqualTo(value);
        }
    }

    @Nested
    @DisplayName("Rendering round trip")
    class RoundTrip {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource({
            "(-3)^2, 9",
            "2^-1, 0.5",
            "-(2^2), -4",
            "(-2)^3^2, -512",
            "-1.5 * -4, 6",
            "(-2)^-2, 0.25",
            "-(-3)^3, 27",
            "(0 - 3) ^ 2 / -4, -2.25"
        })
        void literalTreesKeepTheirValue(String text, double expected) {
            Expression<Double> original = parser.parse(text);
            String rendered = original.render();
            Expression<Double> reparsed = parser.parse(rendered);

            assertThat(original.evaluate(Map.of())).isEqualTo(expected);
            assertThat(reparsed.evaluate(Map.of())).isEqualTo(expected);
            assertThat(reparsed.render()).isEqualTo(rendered);
        }

        @Test
        void negativeBaseIsParenthesized() {
            assertThat(parser.parse("(-3) ^ 2").render()).isEqualTo("((-3) ^ 2)");
            assertThat(parser.parse("2 ^ -3").render()).isEqualTo("(2 ^ -3)");
            assertThat(parser.parse("-3 * 2").render()).isEqualTo("(-3 * 2)");
        }

        @Test
        void complexTreesKeepTheirValue() {
            ComplexDomain domain = new ComplexDomain();
            ExpressionParser<Complex> complex = new ExpressionParser<>(domain);
            Expression<Complex> two = Expression.constant(Complex.ofReal(2), domain);
            List<Expression<Complex>> trees = List.of(
                    Expression.constant(Complex.ofReal(-3), domain).pow(two),
                    Expression.constant(new Complex(2, -3), domain).pow(two),
                    Expression.constant(new Complex(0, -2), domain).times(Expression.variable("i", domain)),
                    Expression.constant(new Complex(-1.5, 0.5), domain).minus(two),
                    complex.parse("(-2) ^ i"));

            for (Expression<Complex> tree : trees) {
                Complex expected = tree.evaluate(Map.of());
                Complex actual = complex.parse(tree.render()).evaluate(Map.of());

                assertThat(actual.real()).as(tree.render()).isCloseTo(expected.real(), within(1e-9));
                assertThat(actual.imag()).as(tree.render()).isCloseTo(expected.imag(), within(1e-9));
            }
        }

        @Test
        void evaluationIsDeterministic() {
            Expression<Double> expr = parser.parse("sin(x) ^ 2 + cos(x) ^ 2 - ln(x) / exp(x)");
            Map<String, Double> at = Map.of("x", 0.7);

            double first = expr.evaluate(at);

            assertThat(expr.evaluate(at)).isEqualTo(first);
            assertThat(parser.parse(expr.render()).evaluate(at)).isEqualTo(first);
        }

        @Test
        void nonFiniteConstantsDoNotReparse() {
            ExpressionParser<Double> simplifying = new ExpressionParser<>(REAL, new EngineOptions(true, 256));
            Expression<Double> folded = simplifying.parse("(0 - 1) ^ 0.5");

            assertThat(folded.render()).isEqualTo("NaN");
            assertThat(parser.parse(folded.render()).root()).isEqualTo(new Variable<>("NaN"));
            assertThatThrownBy(() -> parser.parse(folded.render()).evaluate(Map.of()))
                    .isInstanceOf(UnboundVariableException.class);
        }
    }
}
