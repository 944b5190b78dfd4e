package dumb.fournines;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static dumb.fournines.EvalException.Kind.*;
import static java.util.Objects.requireNonNull;

/**
 * Arithmetic expression tree over decimal literals.
 * <p>
 * Nodes are immutable and exclusively own their children. {@link #toString()} yields the
 * canonical, fully parenthesized rendering which is what gets persisted, re-parsed by
 * {@link ExprParser} and scanned for seed digits.
 */
public sealed interface Expr permits Expr.Num, Expr.UnaryOp, Expr.BinaryOp {

    /** Working precision, in significant digits. */
    MathContext MATH = new MathContext(10, RoundingMode.HALF_EVEN);
    BigDecimal MAX_MAGNITUDE = new BigDecimal("1e20");
    int MAX_FACTORIAL = 20;
    int MAX_EXPONENT = 20;
    BigDecimal MAX_BASE = BigDecimal.valueOf(100);

    static boolean isInteger(BigDecimal v) {
        return v.signum() == 0 || v.stripTrailingZeros().scale() <= 0;
    }

    /** Occurrences of {@code digit} in a rendering; literal "11" counts twice. */
    static int countDigit(String text, int digit) {
        var c = Character.forDigit(digit, 10);
        return (int) text.chars().filter(ch -> ch == c).count();
    }

    private static BigDecimal bounded(BigDecimal v) throws EvalException {
        if (v.abs().compareTo(MAX_MAGNITUDE) > 0)
            throw new EvalException(OVERFLOW, "value " + v.toPlainString() + " exceeds maximum allowed size");
        return v;
    }

    BigDecimal eval() throws EvalException;

    /** Deep copy sharing no nodes with this tree. */
    Expr copy();

    @Nullable Operator operator();

    /** Child slots of this node, in rendering order. */
    List<Step> steps();

    Expr child(Step step);

    /** This node rebuilt with the child at {@code step} replaced. */
    Expr with(Step step, Expr child);

    default List<Expr> children() {
        return steps().stream().map(this::child).toList();
    }

    /** Pre-order traversal, this node first. */
    default Stream<Expr> nodes() {
        return Stream.concat(Stream.of(this), children().stream().flatMap(Expr::nodes));
    }

    default int depth() {
        return 1 + children().stream().mapToInt(Expr::depth).max().orElse(0);
    }

    default int weight() {
        return 1 + children().stream().mapToInt(Expr::weight).sum();
    }

    /** Distinct operator symbols, sorted; negation is reported as "-". */
    default SortedSet<String> operators() {
        return nodes().map(Expr::operator).filter(Objects::nonNull).map(Operator::symbol)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    default Set<Operator> operatorKinds() {
        return nodes().map(Expr::operator).filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    /** Paths of every non-root subtree, in pre-order. */
    default List<List<Step>> paths() {
        var out = new ArrayList<List<Step>>();
        collectPaths(this, List.of(), out);
        return out;
    }

    private static void collectPaths(Expr node, List<Step> prefix, List<List<Step>> out) {
        for (var step : node.steps()) {
            var path = new ArrayList<>(prefix);
            path.add(step);
            var p = List.copyOf(path);
            out.add(p);
            collectPaths(node.child(step), p, out);
        }
    }

    default Expr at(List<Step> path) {
        Expr x = this;
        for (var step : path) x = x.child(step);
        return x;
    }

    /** A tree equal to this one except that the subtree at {@code path} is {@code replacement}. */
    default Expr replace(List<Step> path, Expr replacement) {
        if (path.isEmpty()) return replacement;
        var head = path.get(0);
        return with(head, child(head).replace(path.subList(1, path.size()), replacement));
    }

    enum Step {
        LEFT, RIGHT, OPERAND
    }

    record Num(BigDecimal value) implements Expr {
        public Num {
            requireNonNull(value);
        }

        public static Num of(String literal) {
            return new Num(new BigDecimal(literal));
        }

        public static Num of(long value) {
            return new Num(BigDecimal.valueOf(value));
        }

        @Override
        public BigDecimal eval() {
            return value;
        }

        @Override
        public Expr copy() {
            return new Num(value);
        }

        @Override
        public @Nullable Operator operator() {
            return null;
        }

        @Override
        public List<Step> steps() {
            return List.of();
        }

        @Override
        public Expr child(Step step) {
            throw new IllegalArgumentException("Literal has no " + step + " child");
        }

        @Override
        public Expr with(Step step, Expr child) {
            throw new IllegalArgumentException("Literal has no " + step + " child");
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    record UnaryOp(Operator.Unary op, Expr operand) implements Expr {
        private static final List<Step> STEPS = List.of(Step.OPERAND);

        public UnaryOp {
            requireNonNull(op);
            requireNonNull(operand);
        }

        public UnaryOp withOp(Operator.Unary newOp) {
            return new UnaryOp(newOp, operand);
        }

        @Override
        public BigDecimal eval() throws EvalException {
            if (op == Operator.Unary.NEGATE && operand instanceof UnaryOp u && u.op == Operator.Unary.NEGATE)
                throw new EvalException(DOUBLE_NEGATION, "double negatives not allowed");

            var v = operand.eval();
            return switch (op) {
                case SQRT -> sqrt(v);
                case FACTORIAL -> factorial(v);
                case NEGATE -> v.negate();
            };
        }

        private static BigDecimal sqrt(BigDecimal v) throws EvalException {
            if (v.signum() == 0 || v.compareTo(BigDecimal.ONE) == 0) return v;
            if (v.signum() < 0)
                throw new EvalException(DOMAIN, "cannot take square root of negative number");
            return bounded(new BigDecimal(Math.sqrt(v.doubleValue())).round(MATH));
        }

        private static BigDecimal factorial(BigDecimal v) throws EvalException {
            if (v.compareTo(BigDecimal.ONE) == 0) return v;
            if (!isInteger(v))
                throw new EvalException(DOMAIN, "factorial only defined for integers");
            if (v.signum() < 0)
                throw new EvalException(DOMAIN, "factorial only defined for non-negative integers");
            if (v.compareTo(BigDecimal.valueOf(MAX_FACTORIAL)) > 0)
                throw new EvalException(RANGE, "factorial input " + v.toPlainString() + " too large");
            long f = 1;
            for (int i = 2, n = v.intValue(); i <= n; i++) f *= i;
            return bounded(BigDecimal.valueOf(f));
        }

        @Override
        public Expr copy() {
            return new UnaryOp(op, operand.copy());
        }

        @Override
        public Operator operator() {
            return op;
        }

        @Override
        public List<Step> steps() {
            return STEPS;
        }

        @Override
        public Expr child(Step step) {
            if (step != Step.OPERAND) throw new IllegalArgumentException("Unary node has no " + step + " child");
            return operand;
        }

        @Override
        public Expr with(Step step, Expr child) {
            if (step != Step.OPERAND) throw new IllegalArgumentException("Unary node has no " + step + " child");
            return new UnaryOp(op, child);
        }

        @Override
        public String toString() {
            return switch (op) {
                case FACTORIAL -> "(" + operand + "!)";
                case SQRT -> "sqrt(" + operand + ")";
                case NEGATE -> operand instanceof Num ? "-" + operand : "-(" + operand + ")";
            };
        }
    }

    record BinaryOp(Operator.Binary op, Expr left, Expr right) implements Expr {
        private static final List<Step> STEPS = List.of(Step.LEFT, Step.RIGHT);

        public BinaryOp {
            requireNonNull(op);
            requireNonNull(left);
            requireNonNull(right);
        }

        public BinaryOp withOp(Operator.Binary newOp) {
            return new BinaryOp(newOp, left, right);
        }

        @Override
        public BigDecimal eval() throws EvalException {
            var l = left.eval();
            var r = right.eval();
            try {
                return bounded(switch (op) {
                    case ADD -> l.add(r, MATH);
                    case SUBTRACT -> l.subtract(r, MATH);
                    case MULTIPLY -> l.multiply(r, MATH);
                    case DIVIDE -> {
                        if (r.signum() == 0) throw new EvalException(DIVISION_BY_ZERO, "division by zero");
                        yield l.divide(r, MATH);
                    }
                    case MODULO -> {
                        if (r.signum() == 0) throw new EvalException(DIVISION_BY_ZERO, "modulo by zero");
                        if (!isInteger(l) || !isInteger(r))
                            throw new EvalException(DOMAIN, "modulo requires integer operands");
                        yield l.remainder(r, MATH);
                    }
                    case POWER -> power(l, r);
                });
            } catch (ArithmeticException e) {
                throw new EvalException(OVERFLOW, "operation " + op.symbol() + " failed: " + e.getMessage());
            }
        }

        private static BigDecimal power(BigDecimal base, BigDecimal exponent) throws EvalException {
            if (exponent.compareTo(BigDecimal.valueOf(MAX_EXPONENT)) > 0)
                throw new EvalException(RANGE, "exponent " + exponent.toPlainString() + " too large");
            if (base.abs().compareTo(MAX_BASE) > 0)
                throw new EvalException(RANGE, "base " + base.toPlainString() + " too large for exponentiation");
            if (base.signum() < 0 && !isInteger(exponent))
                throw new EvalException(DOMAIN, "cannot raise negative number to non-integer power");

            if (isInteger(exponent)) {
                var n = exponent.intValueExact();
                if (base.signum() == 0 && n == 0)
                    throw new EvalException(DOMAIN, "0 ^ 0 is undefined");
                if (base.signum() == 0 && n < 0)
                    throw new EvalException(DIVISION_BY_ZERO, "zero raised to a negative power");
                return base.pow(n, MATH);
            }

            var x = Math.exp(exponent.doubleValue() * Math.log(base.abs().doubleValue()));
            if (Double.isNaN(x) || Double.isInfinite(x))
                throw new EvalException(OVERFLOW, "exponentiation result too large");
            var result = new BigDecimal(x).round(MATH);
            return base.signum() < 0 && exponent.intValue() % 2 != 0 ? result.negate() : result;
        }

        @Override
        public Expr copy() {
            return new BinaryOp(op, left.copy(), right.copy());
        }

        @Override
        public Operator operator() {
            return op;
        }

        @Override
        public List<Step> steps() {
            return STEPS;
        }

        @Override
        public Expr child(Step step) {
            return switch (step) {
                case LEFT -> left;
                case RIGHT -> right;
                case OPERAND -> throw new IllegalArgumentException("Binary node has no operand child");
            };
        }

        @Override
        public Expr with(Step step, Expr child) {
            return switch (step) {
                case LEFT -> new BinaryOp(op, child, right);
                case RIGHT -> new BinaryOp(op, left, child);
                case OPERAND -> throw new IllegalArgumentException("Binary node has no operand child");
            };
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }
}
