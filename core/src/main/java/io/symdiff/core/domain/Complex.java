package io.symdiff.core.domain;

/**
 * Immutable complex number with principal-branch elementary functions.
 *
 * <p>Components never hold {@code -0.0}: the constructor stores it as {@code 0.0}. A negated real
 * such as {@code -2} therefore sits on the upper side of the branch cut, and {@code ln(-2)} has
 * the principal argument {@code pi}.
 */
public record Complex(double real, double imag) {

    public Complex {
        real += 0.0;
        imag += 0.0;
    }

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    public Complex add(Complex other) {
        return new Complex(real + other.real, imag + other.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(real - other.real, imag - other.imag);
    }

    public Complex multiply(Complex other) {
        double r = real * other.real - imag * other.imag;
        double i = real * other.imag + imag * other.real;
        return new Complex(r, i);
    }

    public Complex divide(Complex other) {
        double denominator = other.real * other.real + other.imag * other.imag;
        double r = (real * other.real + imag * other.imag) / denominator;
        double i = (imag * other.real - real * other.imag) / denominator;
        return new Complex(r, i);
    }

    public Complex negate() {
        return new Complex(-real, -imag);
    }

    public double abs() {
        return Math.hypot(real, imag);
    }

    /** Argument in {@code (-pi, pi]}. */
    public double phase() {
        return Math.atan2(imag, real);
    }

    public Complex exp() {
        double scale = Math.exp(real);
        return new Complex(scale * Math.cos(imag), scale * Math.sin(imag));
    }

    /** Principal natural logarithm; {@code ln(0)} has a real part of negative infinity. */
    public Complex ln() {
        return new Complex(Math.log(abs()), phase());
    }

    public Complex sin() {
        return new Complex(Math.sin(real) * Math.cosh(imag), Math.cos(real) * Math.sinh(imag));
    }

    public Complex cos() {
        return new Complex(Math.cos(real) * Math.cosh(imag), -Math.sin(real) * Math.sinh(imag));
    }

    /** Principal power {@code exp(exponent * ln(this))}, with {@code 0^0 = 1} and {@code 0^w = 0}. */
    public Complex pow(Complex exponent) {
        if (isZero()) {
            return exponent.isZero() ? ONE : ZERO;
        }
        return exponent.multiply(ln()).exp();
    }

    public boolean isZero() {
        return real == 0.0 && imag == 0.0;
    }

    public boolean isOne() {
        return real == 1.0 && imag == 0.0;
    }

    @Override
    public String toString() {
        return String.format("(%s %s %si)", real, imag < 0 ? "-" : "+", Math.abs(imag));
    }
}
