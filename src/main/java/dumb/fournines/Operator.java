package dumb.fournines;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * Operator symbols of the expression language. The symbol is what the canonical rendering
 * and the hint record show; negation shares "-" with subtraction.
 */
public sealed interface Operator permits Operator.Unary, Operator.Binary {

    String symbol();

    enum Unary implements Operator {
        FACTORIAL("!"),
        SQRT("sqrt"),
        NEGATE("-");

        private final String symbol;

        Unary(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String symbol() {
            return symbol;
        }
    }

    enum Binary implements Operator {
        ADD("+", 0),
        SUBTRACT("-", 0),
        MULTIPLY("*", 1),
        DIVIDE("/", 1),
        MODULO("%", 1),
        POWER("^", 2);

        private final String symbol;
        /** Binding strength used by the parser; lower splits first. */
        final int precedence;

        Binary(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        @Override
        public String symbol() {
            return symbol;
        }

        /** Operators with a safe magnitude profile, used when construction overshoots. */
        public boolean isLowRisk() {
            return this == ADD || this == SUBTRACT || this == DIVIDE;
        }

        public static @Nullable Binary of(char c) {
            return Arrays.stream(values())
                    .filter(b -> b.symbol.charAt(0) == c)
                    .findFirst().orElse(null);
        }
    }
}
