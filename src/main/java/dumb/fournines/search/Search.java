package dumb.fournines.search;

import dumb.fournines.EvalException;
import dumb.fournines.Expr;
import dumb.fournines.LeafCombinations;
import dumb.fournines.Operator;
import dumb.fournines.Solution;
import dumb.fournines.SolutionSet;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.random.RandomGenerator;

import static dumb.fournines.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Searches for short expressions using a seed digit exactly four times, one per target in the
 * configured range. Single-threaded: every instance owns its population, tried strings and
 * operator weights, so one instance per seed can run on its own thread.
 */
public class Search {

    private final int seed;
    private final SearchConfig config;
    private final RandomGenerator rng;
    private final LeafCombinations leaves;
    private final OperatorWeights weights = new OperatorWeights();
    private final ExprBuilder builder;
    private final Strategy strategy;
    private final Set<String> tried = new HashSet<>();
    private final SolutionSet solutions = new SolutionSet();
    private int duplicateStreak;

    public Search(int seed) {
        this(seed, new SearchConfig(), new Random());
    }

    public Search(int seed, SearchConfig config, RandomGenerator rng) {
        this.leaves = LeafCombinations.of(seed);
        this.seed = seed;
        this.config = requireNonNull(config);
        this.rng = requireNonNull(rng);
        this.builder = new ExprBuilder(config, weights, rng);
        this.strategy = switch (config.strategy()) {
            case RANDOM -> new RandomStrategy();
            case GENETIC -> new GeneticStrategy();
        };
        message("Search for seed " + seed + ": " + config.strategy() + " over " + leaves.size() + " leaf combinations, targets "
                + config.minTarget() + ".." + config.maxTarget());
    }

    /** Same tree with its sign flipped, without stacking a second negation. */
    static Expr negated(Expr x) {
        if (x instanceof Expr.UnaryOp u && u.op() == Operator.Unary.NEGATE) return u.operand();
        if (x instanceof Expr.Num n) return new Expr.Num(n.value().negate());
        return new Expr.UnaryOp(Operator.Unary.NEGATE, x);
    }

    /** One search call within the attempt budget. */
    public Optional<Solution> next() {
        return strategy.attempt(this);
    }

    public List<Solution> run(int calls) {
        var found = new ArrayList<Solution>();
        for (var i = 0; i < calls; i++) next().ifPresent(found::add);
        return found;
    }

    /** Repeats {@link #next()} until {@code limit} elapses; the deadline is checked between calls. */
    public List<Solution> run(Duration limit) {
        var found = new ArrayList<Solution>();
        var deadline = System.nanoTime() + limit.toNanos();
        var calls = 0;
        while (System.nanoTime() - deadline < 0) {
            next().ifPresent(found::add);
            calls++;
        }
        message("Seed " + seed + ": " + calls + " calls, " + found.size() + " solutions in " + limit.toMillis() + "ms");
        return found;
    }

    /**
     * Judges a candidate. It is accepted when its rendering has not been tried before, uses the
     * seed digit exactly four times, evaluates to an integer whose absolute value is a target,
     * and is strictly shorter than the known solution for that target. A negative result is
     * recorded in negated form.
     */
    public Optional<Solution> offer(Expr candidate) {
        var rendering = candidate.toString();
        if (!tried.add(rendering)) {
            duplicateStreak++;
            return Optional.empty();
        }

        BigDecimal value;
        try {
            value = candidate.eval();
        } catch (EvalException e) {
            return Optional.empty();
        }
        if (Expr.countDigit(rendering, seed) != LeafCombinations.DIGITS || !Expr.isInteger(value))
            return Optional.empty();

        var magnitude = value.abs();
        if (magnitude.compareTo(BigDecimal.valueOf(config.minTarget())) < 0
                || magnitude.compareTo(BigDecimal.valueOf(config.maxTarget())) > 0)
            return Optional.empty();

        var accepted = value.signum() < 0 ? negated(candidate) : candidate;
        var solution = Solution.of(seed, magnitude.intValueExact(), accepted);
        if (!solutions.offer(solution)) return Optional.empty();

        weights.reward(accepted.operatorKinds());
        duplicateStreak = 0;
        message("Seed " + seed + " target " + solution.target() + ": " + solution.expression()
                + " (complexity " + solution.complexity() + ")");
        return Optional.of(solution);
    }

    Expr randomExpr() {
        return builder.build(leaves.random(rng));
    }

    public int seed() {
        return seed;
    }

    public SearchConfig config() {
        return config;
    }

    RandomGenerator rng() {
        return rng;
    }

    public OperatorWeights weights() {
        return weights;
    }

    /** Best solution per target found by this search. */
    public SolutionSet solutions() {
        return solutions.copy();
    }

    /** Consecutive already-tried candidates since the last accepted solution. Diagnostic only. */
    public int duplicateStreak() {
        return duplicateStreak;
    }

    public int triedCount() {
        return tried.size();
    }

    Strategy strategy() {
        return strategy;
    }
}
