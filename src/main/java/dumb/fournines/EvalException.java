package dumb.fournines;

import static java.util.Objects.requireNonNull;

/**
 * Raised when an expression cannot be evaluated. Always recoverable: the search discards the
 * candidate and moves on.
 */
public class EvalException extends Exception {

    private final Kind kind;

    public EvalException(Kind kind, String reason) {
        super("evaluation failed: " + reason);
        this.kind = requireNonNull(kind);
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        /** Division or modulo by zero. */
        DIVISION_BY_ZERO,
        /** Operand outside an operator's domain: negative sqrt, non-integer factorial or modulo. */
        DOMAIN,
        /** Magnitude bound exceeded. */
        OVERFLOW,
        /** Operator-specific limit: exponent, base or factorial input too large. */
        RANGE,
        DOUBLE_NEGATION
    }
}
