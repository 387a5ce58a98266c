package io.symdiff.core.domain;

/**
 * Text rules of the complex domain: the {@code a+bi} value grammar and the heuristic that decides
 * whether raw input mentions the imaginary unit.
 *
 * <p>All methods are static and stateless.
 */
public final class ComplexLiterals {

    private ComplexLiterals() {
        // utility class
    }

    /**
     * Parses {@code [real][sign][coefficient]i}: {@code 3}, {@code 2+3i}, {@code 2-i}, {@code
     * -4.5i}, {@code i}. Whitespace is ignored.
     *
     * @throws NumberFormatException if the text does not match the grammar
     */
    public static Complex parse(String text) {
        if (text == null) {
            throw new NumberFormatException("Complex literal must not be null");
        }
        String s = text.replaceAll("\\s+", "");
        if (s.isEmpty()) {
            throw new NumberFormatException("Complex literal must not be empty");
        }
        if (!s.endsWith("i")) {
            return Complex.ofReal(parseDecimal(s, text));
        }

        String body = s.substring(0, s.length() - 1);
        int split = -1;
        for (int k = body.length() - 1; k > 0; k--) {
            char c = body.charAt(k);
            if ((c == '+' || c == '-') && Character.toLowerCase(body.charAt(k - 1)) != 'e') {
                split = k;
                break;
            }
        }
        String realPart = split < 0 ? "" : body.substring(0, split);
        String imagPart = split < 0 ? body : body.substring(split);

        double real = realPart.isEmpty() ? 0.0 : parseDecimal(realPart, text);
        double imag = switch (imagPart) {
            case "", "+" -> 1.0;
            case "-" -> -1.0;
            default -> parseDecimal(imagPart, text);
        };
        return new Complex(real, imag);
    }

    /**
     * Returns {@code true} if {@code text} contains a stand-alone {@code i}: not adjacent to other
     * letters, preceded by the start of text, whitespace, a digit, a sign, {@code .}, {@code *},
     * {@code (} or {@code =}, and followed by the end of text, whitespace, a digit, {@code )} or
     * an operator.
     */
    public static boolean looksComplex(String text) {
        if (text == null) {
            return false;
        }
        int pos = text.indexOf('i');
        while (pos >= 0) {
            char before = pos > 0 ? text.charAt(pos - 1) : ' ';
            char after = pos < text.length() - 1 ? text.charAt(pos + 1) : ' ';
            boolean partOfWord = Character.isLetter(before) || Character.isLetter(after);
            if (!partOfWord && isLeftBoundary(before) && isRightBoundary(after)) {
                return true;
            }
            pos = text.indexOf('i', pos + 1);
        }
        return false;
    }

    private static boolean isLeftBoundary(char c) {
        return Character.isWhitespace(c) || Character.isDigit(c) || "+-.*(=".indexOf(c) >= 0;
    }

    private static boolean isRightBoundary(char c) {
        return Character.isWhitespace(c) || Character.isDigit(c) || ")+-*/^".indexOf(c) >= 0;
    }

    private static double parseDecimal(String part, String original) {
        if (!RealDomain.DECIMAL.matcher(part).matches()) {
            throw new NumberFormatException("Invalid complex literal: '" + original + "'");
        }
        return Double.parseDouble(part);
    }
}
