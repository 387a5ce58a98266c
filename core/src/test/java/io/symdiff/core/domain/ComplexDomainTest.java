package io.symdiff.core.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for {@link ComplexDomain}. */
class ComplexDomainTest {

    private final ComplexDomain domain = new ComplexDomain();

    @Test
    void imaginaryUnitIsReserved() {
        assertThat(domain.reservedValue("i")).hasValue(Complex.I);
        assertThat(domain.reservedValue("x")).isEmpty();
    }

    @Test
    void formatsRealValuesWithoutImaginaryPart() {
        assertThat(domain.format(Complex.ofReal(12))).isEqualTo("12");
    }

    @Test
    void formatsImaginaryPartAsProductWithI() {
        assertThat(domain.format(new Complex(2, 3))).isEqualTo("(2 + 3 * i)");
        assertThat(domain.format(new Complex(2, -3))).isEqualTo("(2 - 3 * i)");
        assertThat(domain.format(new Complex(0, -1.5))).isEqualTo("(-1.5 * i)");
    }

    @Test
    void lnOfNegativeRealSucceeds() {
        Complex ln = domain.ln(Complex.ofReal(-1));

        assertThat(ln.imag()).isEqualTo(Math.PI);
    }

    @Test
    void literalsAreRealAndValuesUseComplexGrammar() {
        assertThat(domain.parseLiteral("2.5")).isEqualTo(Complex.ofReal(2.5));
        assertThat(domain.parseValue("1+i")).isEqualTo(new Complex(1, 1));
    }

    @Test
    void claimsInputMentioningTheImaginaryUnit() {
        assertThat(domain.looksLikeInput("x=1+i")).isTrue();
        assertThat(domain.looksLikeInput("sin(x)")).isFalse();
    }
}
