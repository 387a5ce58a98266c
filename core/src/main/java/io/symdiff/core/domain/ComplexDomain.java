package io.symdiff.core.domain;

import io.symdiff.core.spi.NumericDomain;
import java.util.Optional;

/**
 * Complex scalars. The variable name {@code i} is reserved for the imaginary unit; {@code ln},
 * {@code pow} and the trigonometric functions use principal-branch complex semantics and never
 * raise a domain error.
 */
public final class ComplexDomain implements NumericDomain<Complex> {

    /** Domain identifier used by the front end's {@code --domain} option. */
    public static final String DOMAIN_ID = "complex";

    /** Reserved name of the imaginary unit. */
    public static final String IMAGINARY_UNIT = "i";

    @Override
    public String id() {
        return DOMAIN_ID;
    }

    @Override
    public Complex zero() {
        return Complex.ZERO;
    }

    @Override
    public Complex one() {
        return Complex.ONE;
    }

    @Override
    public Complex valueOf(double value) {
        return Complex.ofReal(value);
    }

    @Override
    public Complex add(Complex left, Complex right) {
        return left.add(right);
    }

    @Override
    public Complex subtract(Complex left, Complex right) {
        return left.subtract(right);
    }

    @Override
    public Complex multiply(Complex left, Complex right) {
        return left.multiply(right);
    }

    @Override
    public Complex divide(Complex left, Complex right) {
        return left.divide(right);
    }

    @Override
    public Complex pow(Complex base, Complex exponent) {
        return base.pow(exponent);
    }

    @Override
    public Complex negate(Complex value) {
        return value.negate();
    }

    @Override
    public Complex sin(Complex value) {
        return value.sin();
    }

    @Override
    public Complex cos(Complex value) {
        return value.cos();
    }

    @Override
    public Complex exp(Complex value) {
        return value.exp();
    }

    @Override
    public Complex ln(Complex value) {
        return value.ln();
    }

    @Override
    public boolean isZero(Complex value) {
        return value.isZero();
    }

    @Override
    public boolean isOne(Complex value) {
        return value.isOne();
    }

    @Override
    public Optional<Complex> reservedValue(String name) {
        return IMAGINARY_UNIT.equals(name) ? Optional.of(Complex.I) : Optional.empty();
    }

    @Override
    public Complex parseLiteral(String token) {
        return Complex.ofReal(Double.parseDouble(token));
    }

    @Override
    public Complex parseValue(String text) {
        return ComplexLiterals.parse(text);
    }

    /**
     * Renders {@code a} for real values and {@code (a + b * i)}, {@code (a - b * i)} or {@code (b *
     * i)} otherwise, so the text parses back to the same value in this domain.
     */
    @Override
    public String format(Complex value) {
        if (value.imag() == 0.0) {
            return RealDomain.formatDecimal(value.real());
        }
        if (value.real() == 0.0) {
            return "(" + RealDomain.formatDecimal(value.imag()) + " * " + IMAGINARY_UNIT + ")";
        }
        String sign = value.imag() < 0 ? " - " : " + ";
        return "(" + RealDomain.formatDecimal(value.real()) + sign + RealDomain.formatDecimal(Math.abs(value.imag()))
                + " * " + IMAGINARY_UNIT + ")";
    }

    @Override
    public boolean looksLikeInput(String text) {
        return ComplexLiterals.looksComplex(text);
    }
}
