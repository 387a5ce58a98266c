package io.symdiff.core.parser;

import io.symdiff.core.engine.EngineOptions;
import io.symdiff.core.engine.RawNodeFactory;
import io.symdiff.core.engine.Simplifier;
import io.symdiff.core.error.InvalidCharacterException;
import io.symdiff.core.error.MalformedExpressionException;
import io.symdiff.core.model.Constant;
import io.symdiff.core.model.Expression;
import io.symdiff.core.model.MathFunction;
import io.symdiff.core.model.Node;
import io.symdiff.core.model.Operator;
import io.symdiff.core.spi.NodeFactory;
import io.symdiff.core.spi.NumericDomain;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator-precedence (shunting-yard) parser from infix text to an expression tree.
 *
 * <p>Grammar, informally:
 *
 * <ul>
 * <li>numbers: digits with at most one decimal point ({@code 2}, {@code 3.5}, {@code .5})
 * <li>identifiers: runs of letters; {@code sin}, {@code cos}, {@code ln} and {@code exp} must
 *     be followed by {@code (}, every other identifier is a variable
 * <li>binary operators {@code + - * / ^}; {@code ^} is right-associative and binds tighter
 *     than {@code * /}, which bind tighter than {@code + -}
 * <li>prefix {@code -} negates its operand with the precedence of {@code ^}, so {@code -x^2} is
 *     {@code -(x^2)} and {@code 2^-1} is {@code 0.5}; prefix {@code +} is ignored
 * <li>whitespace is insignificant; any other character is rejected
 * </ul>
 *
 * <p>Positions in errors are zero-based character offsets into the input. The parser itself is
 * stateless and thread-safe; each call works on its own stacks.
 */
public final class ExpressionParser<V> {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionParser.class);

    private static final char GROUP = '(';
    private static final char CALL = 'f';
    private static final char NEGATE = '~';
    private static final int NEGATE_PRECEDENCE = Operator.POWER.precedence();

    private final NumericDomain<V> domain;
    private final NodeFactory<V> factory;
    private final int maxNestingDepth;

    public ExpressionParser(NumericDomain<V> domain) {
        this(domain, EngineOptions.DEFAULT);
    }

    public ExpressionParser(NumericDomain<V> domain, EngineOptions options) {
        this(
                domain,
                options.simplifyOnParse() ? new Simplifier<>(domain) : new RawNodeFactory<>(domain),
                options.maxNestingDepth());
    }

    public ExpressionParser(NumericDomain<V> domain, NodeFactory<V> factory, int maxNestingDepth) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses {@code text} into an expression of this parser's domain.
     *
     * @throws InvalidCharacterException if the text contains a character outside the grammar
     * @throws MalformedExpressionException if the tokens do not form exactly one expression
     * @throws io.symdiff.core.error.DivisionByZeroException only when simplification on parse
     *     folds a constant division by zero
     */
    public Expression<V> parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Node<V> root = new Run(text).parse();
        LOG.debug("expression.parsed: domain={}, nodes={}, depth={}", domain.id(), root.size(), root.depth());
        return Expression.of(root, domain);
    }

    /** Pending entry on the operator stack: an operator symbol, or one of the markers. */
    private record Pending(char symbol, int position) {

        boolean isOpening() {
            return symbol == GROUP || symbol == CALL;
        }

        int precedence() {
            return symbol == NEGATE ? NEGATE_PRECEDENCE : Operator.precedenceOf(symbol);
        }
    }

    /** State of a single parse call. */
    private final class Run {

        private final String text;
        private final Deque<Node<V>> values = new ArrayDeque<>();
        private final Deque<Pending> operators = new ArrayDeque<>();
        private final Deque<MathFunction> functions = new ArrayDeque<>();
        private int depth;
        private boolean expectOperand = true;

        Run(String text) {
            this.text = text;
        }

        Node<V> parse() {
            int length = text.length();
            int i = 0;
            while (i < length) {
                char c = text.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (Character.isDigit(c) || c == '.') {
                    requireOperandSlot("number", i);
                    i = scanNumber(i);
                } else if (Character.isLetter(c)) {
                    requireOperandSlot("identifier", i);
                    i = scanIdentifier(i);
                } else if (c == '(') {
                    requireOperandSlot("'('", i);
                    open(GROUP, i);
                    i++;
                } else if (c == ')') {
                    close(i);
                    i++;
                } else if (Operator.fromSymbol(c).isPresent()) {
                    Operator operator = Operator.fromSymbol(c).get();
                    if (expectOperand) {
                        prefix(operator, i);
                    } else {
                        pushBinary(operator, i);
                    }
                    i++;
                } else {
                    throw new InvalidCharacterException(c, i);
                }
            }
            return finish();
        }

        private int scanNumber(int start) {
            int i = start;
            boolean seenDot = false;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (Character.isDigit(c)) {
                    i++;
                } else if (c == '.' && !seenDot) {
                    seenDot = true;
                    i++;
                } else {
                    break;
                }
            }
            String token = text.substring(start, i);
            try {
                values.push(factory.constant(domain.parseLiteral(token)));
            } catch (NumberFormatException e) {
                throw new MalformedExpressionException(
                        "Invalid numeric literal '" + token + "' at position " + start, e, start);
            }
            expectOperand = false;
            return i;
        }

        private int scanIdentifier(int start) {
            int i = start;
            while (i < text.length() && Character.isLetter(text.charAt(i))) {
                i++;
            }
            String name = text.substring(start, i);
            Optional<MathFunction> function = MathFunction.lookup(name);
            if (function.isEmpty()) {
                values.push(factory.variable(name));
                expectOperand = false;
                return i;
            }

            int next = i;
            while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
                next++;
            }
            if (next >= text.length() || text.charAt(next) != '(') {
                throw new MalformedExpressionException(
                        "Function '" + name + "' at position " + start + " must be followed by '('", start);
            }
            functions.push(function.get());
            open(CALL, next);
            return next + 1;
        }

        private void requireOperandSlot(String what, int position) {
            if (!expectOperand) {
                throw new MalformedExpressionException(
                        "Missing operator before " + what + " at position " + position, position);
            }
        }

        private void open(char marker, int position) {
            if (depth >= maxNestingDepth) {
                throw new MalformedExpressionException(
                        "Nesting depth exceeds the limit of " + maxNestingDepth + " at position " + position,
                        position);
            }
            depth++;
            operators.push(new Pending(marker, position));
            expectOperand = true;
        }

        private void close(int position) {
            if (expectOperand) {
                throw new MalformedExpressionException(
                        "Expected an operand before ')' at position " + position, position);
            }
            while (!operators.isEmpty() && !operators.peek().isOpening()) {
                applyTop();
            }
            if (operators.isEmpty()) {
                throw new MalformedExpressionException("Unmatched ')' at position " + position, position);
            }
            Pending opening = operators.pop();
            depth--;
            if (opening.symbol() == CALL) {
                applyFunction(opening.position());
            }
            expectOperand = false;
        }

        private void prefix(Operator operator, int position) {
            switch (operator) {
                case SUBTRACT -> operators.push(new Pending(NEGATE, position));
                case ADD -> {
                    // unary plus is the identity
                }
                default -> throw new MalformedExpressionException(
                        "Operator '" + operator.symbol() + "' at position " + position + " is missing its left operand",
                        position);
            }
        }

        private void pushBinary(Operator incoming, int position) {
            while (!operators.isEmpty() && shouldPop(operators.peek(), incoming)) {
                applyTop();
            }
            operators.push(new Pending(incoming.symbol(), position));
            expectOperand = true;
        }

        private boolean shouldPop(Pending top, Operator incoming) {
            if (top.isOpening()) {
                return false;
            }
            return incoming.rightAssociative()
                    ? top.precedence() > incoming.precedence()
                    : top.precedence() >= incoming.precedence();
        }

        private Node<V> finish() {
            int end = text.length();
            if (expectOperand) {
                String message = values.isEmpty() && operators.isEmpty()
                        ? "Empty expression"
                        : "Unexpected end of input at position " + end + ": expected an operand";
                throw new MalformedExpressionException(message, end);
            }
            while (!operators.isEmpty()) {
                Pending top = operators.peek();
                if (top.isOpening()) {
                    throw new MalformedExpressionException(
                            "Unmatched '(' at position " + top.position(), top.position());
                }
                applyTop();
            }
            if (values.size() != 1 || !functions.isEmpty()) {
                throw new MalformedExpressionException(
                        "Input does not form a single expression (" + values.size() + " operands left)", end);
            }
            return values.pop();
        }

        private void applyTop() {
            Pending top = operators.pop();
            if (top.symbol() == NEGATE) {
                applyNegate(top.position());
                return;
            }
            Operator operator = Operator.fromSymbol(top.symbol())
                    .orElseThrow(() -> new IllegalStateException("Unexpected stack entry: " + top));
            if (values.size() < 2) {
                throw missingOperand(top);
            }
            Node<V> right = values.pop();
            Node<V> left = values.pop();
            values.push(factory.binary(operator, left, right));
        }

        private void applyNegate(int position) {
            if (values.isEmpty()) {
                throw missingOperand(new Pending('-', position));
            }
            Node<V> operand = values.pop();
            if (operand instanceof Constant<V> constant) {
                values.push(factory.constant(domain.negate(constant.value())));
            } else {
                values.push(factory.binary(Operator.MULTIPLY, factory.constant(domain.valueOf(-1)), operand));
            }
        }

        private void applyFunction(int position) {
            if (functions.isEmpty() || values.isEmpty()) {
                throw new MalformedExpressionException(
                        "Function call at position " + position + " has no argument", position);
            }
            values.push(factory.function(functions.pop(), values.pop()));
        }

        private MalformedExpressionException missingOperand(Pending entry) {
            return new MalformedExpressionException(
                    "Operator '" + entry.symbol() + "' at position " + entry.position() + " is missing an operand",
                    entry.position());
        }
    }
}
