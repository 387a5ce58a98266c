package io.symdiff.core.domain;

import io.symdiff.core.error.DomainErrorException;
import io.symdiff.core.spi.NumericDomain;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/** Real scalars backed by {@code double}. Stateless and thread-safe. */
public final class RealDomain implements NumericDomain<Double> {

    /** Domain identifier used by the front end's {@code --domain} option. */
    public static final String DOMAIN_ID = "real";

    /** Plain decimal number, optionally signed, with optional exponent. */
    static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Plain decimal text of {@code value}: no exponent, no trailing {@code .0} ({@code 12}, {@code
     * 0.5}, {@code 0.00001}). Non-finite values use Java's names.
     */
    public static String formatDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String id() {
        return DOMAIN_ID;
    }

    @Override
    public Double zero() {
        return 0.0;
    }

    @Override
    public Double one() {
        return 1.0;
    }

    @Override
    public Double valueOf(double value) {
        return value;
    }

    @Override
    public Double add(Double left, Double right) {
        return left + right;
    }

    @Override
    public Double subtract(Double left, Double right) {
        return left - right;
    }

    @Override
    public Double multiply(Double left, Double right) {
        return left * right;
    }

    @Override
    public Double divide(Double left, Double right) {
        return left / right;
    }

    @Override
    public Double pow(Double base, Double exponent) {
        return Math.pow(base, exponent);
    }

    @Override
    public Double negate(Double value) {
        return -value;
    }

    @Override
    public Double sin(Double value) {
        return Math.sin(value);
    }

    @Override
    public Double cos(Double value) {
        return Math.cos(value);
    }

    @Override
    public Double exp(Double value) {
        return Math.exp(value);
    }

    @Override
    public Double ln(Double value) {
        if (value <= 0.0) {
            throw new DomainErrorException("ln", format(value));
        }
        return Math.log(value);
    }

    @Override
    public boolean isZero(Double value) {
        return value == 0.0;
    }

    @Override
    public boolean isOne(Double value) {
        return value == 1.0;
    }

    @Override
    public Optional<Double> reservedValue(String name) {
        return Optional.empty();
    }

    @Override
    public Double parseLiteral(String token) {
        return Double.parseDouble(token);
    }

    @Override
    public Double parseValue(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new NumberFormatException("Invalid real value: '" + text + "'");
        }
        return Double.parseDouble(trimmed);
    }

    @Override
    public String format(Double value) {
        return formatDecimal(value);
    }

    @Override
    public boolean looksLikeInput(String text) {
        return false;
    }
}
