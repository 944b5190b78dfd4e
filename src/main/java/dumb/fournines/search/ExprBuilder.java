package dumb.fournines.search;

import dumb.fournines.EvalException;
import dumb.fournines.Expr;
import dumb.fournines.LeafCombination;
import dumb.fournines.Operator;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Randomized recursive construction of a tree over one leaf combination. Subtrees whose
 * magnitude overshoots {@link #SOFT_CAP} are retried with a lower-risk operator and, failing
 * that, replaced by a plain sum or difference of the two halves.
 */
class ExprBuilder {

    static final double EARLY_STOP = 0.1;
    static final BigDecimal SOFT_CAP = new BigDecimal("1e10");
    private static final List<Operator.Binary> LOW_RISK =
            Arrays.stream(Operator.Binary.values()).filter(Operator.Binary::isLowRisk).toList();

    private final SearchConfig config;
    private final OperatorWeights weights;
    private final RandomGenerator rng;

    ExprBuilder(SearchConfig config, OperatorWeights weights, RandomGenerator rng) {
        this.config = config;
        this.weights = weights;
        this.rng = rng;
    }

    Expr build(LeafCombination leaves) {
        return build(leaves, 0);
    }

    private Expr build(LeafCombination leaves, int depth) {
        var maxDepth = config.maxDepth();
        if (leaves.size() == 1 || (maxDepth != null && depth >= maxDepth) || rng.nextDouble() < EARLY_STOP)
            return new Expr.Num(leaves.get(0));

        Expr node;
        try {
            node = rng.nextDouble() < config.binaryOpProb() ? binary(leaves, depth) : unary(leaves, depth);
        } catch (EvalException e) {
            node = null;
        }
        return node != null ? node : fallback(leaves, depth);
    }

    private @Nullable Expr binary(LeafCombination leaves, int depth) throws EvalException {
        var op = weights.binary(rng);
        var split = rng.nextInt(1, leaves.size());
        var left = build(leaves.slice(0, split), depth + 1);
        var right = build(leaves.slice(split, leaves.size()), depth + 1);

        var node = new Expr.BinaryOp(op, left, right);
        if (withinCap(node)) return node;
        if (op == Operator.Binary.POWER || op == Operator.Binary.MULTIPLY) {
            node = node.withOp(LOW_RISK.get(rng.nextInt(LOW_RISK.size())));
            if (withinCap(node)) return node;
        }
        return null;
    }

    private @Nullable Expr unary(LeafCombination leaves, int depth) throws EvalException {
        var node = new Expr.UnaryOp(weights.unary(rng), build(leaves, depth + 1));
        return withinCap(node) ? node : null;
    }

    private Expr fallback(LeafCombination leaves, int depth) {
        if (leaves.size() < 2) return new Expr.Num(leaves.get(0));
        var mid = leaves.size() / 2;
        var left = build(leaves.slice(0, mid), depth + 1);
        var right = build(leaves.slice(mid, leaves.size()), depth + 1);
        return new Expr.BinaryOp(rng.nextBoolean() ? Operator.Binary.ADD : Operator.Binary.SUBTRACT, left, right);
    }

    private static boolean withinCap(Expr node) throws EvalException {
        return node.eval().abs().compareTo(SOFT_CAP) <= 0;
    }
}
