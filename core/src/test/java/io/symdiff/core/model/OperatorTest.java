package io.symdiff.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.symdiff.core.domain.RealDomain;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link Operator} and {@link MathFunction}. */
class OperatorTest {

    @ParameterizedTest
    @CsvSource({"+, ADD, 2", "-, SUBTRACT, 2", "*, MULTIPLY, 3", "/, DIVIDE, 3", "^, POWER, 4"})
    void symbolsMapToOperators(char symbol, Operator expected, int precedence) {
        assertThat(Operator.fromSymbol(symbol)).hasValue(expected);
        assertThat(Operator.precedenceOf(symbol)).isEqualTo(precedence);
    }

    @Test
    void onlyPowerIsRightAssociative() {
        for (Operator operator : Operator.values()) {
            assertThat(operator.rightAssociative()).isEqualTo(operator == Operator.POWER);
        }
    }

    @Test
    void nonOperatorsHaveNoPrecedence() {
        assertThat(Operator.fromSymbol('(')).isEmpty();
        assertThat(Operator.precedenceOf('x')).isZero();
    }

    @Test
    void applyDelegatesToDomain() {
        RealDomain real = new RealDomain();

        assertThat(Operator.POWER.apply(real, 2.0, 10.0)).isEqualTo(1024.0);
        assertThat(Operator.SUBTRACT.apply(real, 2.0, 10.0)).isEqualTo(-8.0);
    }

    @Test
    void functionLookupIsCaseSensitive() {
        assertThat(MathFunction.lookup("sin")).hasValue(MathFunction.SIN);
        assertThat(MathFunction.lookup("ln")).hasValue(MathFunction.LN);
        assertThat(MathFunction.lookup("Sin")).isEmpty();
        assertThat(MathFunction.lookup("tan")).isEmpty();
        assertThat(MathFunction.EXP.apply(new RealDomain(), 0.0)).isEqualTo(1.0);
    }
}
