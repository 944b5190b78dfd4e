package dumb.fournines;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;

import static java.util.Objects.requireNonNull;

/**
 * Parses the canonical rendering produced by {@link Expr#toString()} back into a tree.
 * <p>
 * Grammar, applied to each fragment after stripping matched outer parentheses:
 * {@code sqrt(...)} spanning the fragment, a trailing {@code !}, the root-level binary operator
 * of lowest precedence ({@code + -} then {@code * / %} then {@code ^}) found scanning right to
 * left, a leading {@code -} (negative literal or negation), and finally a decimal literal.
 * A {@code +} or {@code -} at the start of a fragment or after another operator is a sign.
 */
public class ExprParser {

    private static final String SQRT_PREFIX = "sqrt(";
    private static final String SIGN_CONTEXT = "(+-*/^%";
    private static final int PRECEDENCE_LEVELS = 3;

    private ExprParser() {
    }

    public static Expr parse(String text) throws ParseException {
        requireNonNull(text);
        checkBalanced(text);
        return parseFragment(text);
    }

    private static Expr parseFragment(String text) throws ParseException {
        var expr = stripOuterParens(text.strip());

        if (expr.startsWith(SQRT_PREFIX) && matchingParen(expr, SQRT_PREFIX.length() - 1) == expr.length() - 1) {
            var inner = expr.substring(SQRT_PREFIX.length(), expr.length() - 1);
            if (inner.isBlank()) throw new ParseException("Empty sqrt()", expr);
            return new Expr.UnaryOp(Operator.Unary.SQRT, parseFragment(inner));
        }

        if (expr.endsWith("!")) {
            var inner = expr.substring(0, expr.length() - 1).strip();
            if (inner.isEmpty()) throw new ParseException("Empty factorial", expr);
            return new Expr.UnaryOp(Operator.Unary.FACTORIAL, parseFragment(inner));
        }

        var split = rootOperator(expr);
        if (split >= 0) {
            var op = Operator.Binary.of(expr.charAt(split));
            var left = expr.substring(0, split).strip();
            var right = expr.substring(split + 1).strip();
            if (left.isEmpty() || right.isEmpty())
                throw new ParseException("Missing operand for operator " + op.symbol(), expr);
            return new Expr.BinaryOp(op, parseFragment(left), parseFragment(right));
        }

        if (expr.startsWith("-")) {
            if (expr.length() > 1 && (Character.isDigit(expr.charAt(1)) || expr.charAt(1) == '.'))
                return literal(expr);
            var inner = expr.substring(1).strip();
            if (inner.isEmpty()) throw new ParseException("Empty negation", expr);
            return new Expr.UnaryOp(Operator.Unary.NEGATE, parseFragment(inner));
        }

        return literal(expr);
    }

    private static String stripOuterParens(String expr) throws ParseException {
        if (expr.isEmpty()) throw new ParseException("Empty expression");
        while (expr.startsWith("(") && matchingParen(expr, 0) == expr.length() - 1) {
            expr = expr.substring(1, expr.length() - 1).strip();
            if (expr.isEmpty()) throw new ParseException("Empty parentheses");
        }
        return expr;
    }

    /** Index of the root-level binary operator to split at, or -1. */
    private static int rootOperator(String expr) {
        for (var level = 0; level < PRECEDENCE_LEVELS; level++) {
            var depth = 0;
            for (var i = expr.length() - 1; i >= 0; i--) {
                var c = expr.charAt(i);
                if (c == ')') depth++;
                else if (c == '(') depth--;
                else if (depth == 0) {
                    var op = Operator.Binary.of(c);
                    if (op == null || op.precedence != level) continue;
                    if ((c == '-' || c == '+') && isSign(expr, i)) continue;
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean isSign(String expr, int i) {
        var j = i - 1;
        while (j >= 0 && Character.isWhitespace(expr.charAt(j))) j--;
        return j < 0 || SIGN_CONTEXT.indexOf(expr.charAt(j)) >= 0;
    }

    private static int matchingParen(String expr, int open) {
        var depth = 0;
        for (var i = open; i < expr.length(); i++) {
            var c = expr.charAt(i);
            if (c == '(') depth++;
            else if (c == ')' && --depth == 0) return i;
        }
        return -1;
    }

    private static void checkBalanced(String text) throws ParseException {
        var depth = 0;
        for (var i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            if (c == '(') depth++;
            else if (c == ')' && --depth < 0) throw new ParseException("Unmatched ')' at position " + i, text);
        }
        if (depth != 0) throw new ParseException("Unbalanced parentheses", text);
    }

    private static Expr.Num literal(String expr) throws ParseException {
        try {
            return new Expr.Num(new BigDecimal(expr));
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid number", expr);
        }
    }

    public static class ParseException extends Exception {
        private final @Nullable String fragment;

        public ParseException(String message) {
            this(message, null);
        }

        public ParseException(String message, @Nullable String fragment) {
            super(message);
            this.fragment = fragment;
        }

        public @Nullable String fragment() {
            return fragment;
        }

        @Override
        public String getMessage() {
            return super.getMessage() + (fragment != null && !fragment.isEmpty() ? " near '" + fragment + "'" : "");
        }
    }
}
