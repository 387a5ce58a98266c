package io.symdiff.core.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

/** Tests for {@link Complex} arithmetic and its principal-branch functions. */
class ComplexTest {

    private static final double EPS = 1e-12;

    @Test
    void multiplicationOfImaginaryUnits() {
        assertThat(Complex.I.multiply(Complex.I)).isEqualTo(new Complex(-1, 0));
    }

    @Test
    void divisionInvertsMultiplication() {
        Complex a = new Complex(3, -2);
        Complex b = new Complex(1, 4);
        Complex q = a.multiply(b).divide(b);

        assertThat(q.real()).isCloseTo(3, within(EPS));
        assertThat(q.imag()).isCloseTo(-2, within(EPS));
    }

    @Test
    void lnOfNegativeRealIsPrincipalBranch() {
        Complex ln = Complex.ofReal(-1).ln();

        assertThat(ln.real()).isCloseTo(0, within(EPS));
        assertThat(ln.imag()).isCloseTo(Math.PI, within(EPS));
    }

    @Test
    void eulerIdentity() {
        Complex e = new Complex(0, Math.PI).exp();

        assertThat(e.real()).isCloseTo(-1, within(EPS));
        assertThat(e.imag()).isCloseTo(0, within(EPS));
    }

    @Test
    void powHandlesZeroBase() {
        assertThat(Complex.ZERO.pow(Complex.ZERO)).isEqualTo(Complex.ONE);
        assertThat(Complex.ZERO.pow(new Complex(2, 1))).isEqualTo(Complex.ZERO);
    }

    @Test
    void squareOfOnePlusI() {
        Complex square = new Complex(1, 1).pow(Complex.ofReal(2));

        assertThat(square.real()).isCloseTo(0, within(EPS));
        assertThat(square.imag()).isCloseTo(2, within(EPS));
    }

    @Test
    void sinAndCosAgreeWithPythagoras() {
        Complex z = new Complex(0.3, -1.2);
        Complex sum = z.sin().multiply(z.sin()).add(z.cos().multiply(z.cos()));

        assertThat(sum.real()).isCloseTo(1, within(1e-9));
        assertThat(sum.imag()).isCloseTo(0, within(1e-9));
    }

    @Test
    void exactIdentityChecks() {
        assertThat(Complex.ZERO.isZero()).isTrue();
        assertThat(Complex.ONE.isOne()).isTrue();
        assertThat(new Complex(1, 1e-300).isOne()).isFalse();
        assertThat(Complex.I.abs()).isEqualTo(1.0);
    }

    @Test
    void negatedRealStaysOnPrincipalBranch() {
        Complex minusTwo = Complex.ofReal(2).negate();

        assertThat(minusTwo).isEqualTo(Complex.ofReal(-2));
        assertThat(minusTwo.ln().imag()).isEqualTo(Math.PI);
        assertThat(new Complex(-0.0, -0.0)).isEqualTo(Complex.ZERO);
    }
}
