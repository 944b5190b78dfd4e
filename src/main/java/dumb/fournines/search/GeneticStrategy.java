package dumb.fournines.search;

import dumb.fournines.EvalException;
import dumb.fournines.Expr;
import dumb.fournines.LeafCombinations;
import dumb.fournines.Solution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static dumb.fournines.util.Log.debug;

/**
 * Evolves a fixed-size population of trees: elitism, tournament selection, subtree crossover on
 * copies, operator mutation, and periodic injection of fresh random trees.
 */
final class GeneticStrategy implements Strategy {

    static final int INJECTION_INTERVAL = 10;
    static final int INJECTION_COUNT = 5;
    static final BigDecimal LARGE_RESULT = BigDecimal.valueOf(1_000_000);

    private List<Expr> population = new ArrayList<>();
    private long generation;

    /**
     * Rewards four seed digits, an integer result and closeness to the target range (on either
     * side of zero). Unevaluable trees score 0.
     */
    static double fitness(Expr expr, int seed, SearchConfig config) {
        BigDecimal result;
        try {
            result = expr.eval();
        } catch (EvalException e) {
            return 0;
        }

        var fitness = 0.0;
        var digits = Expr.countDigit(expr.toString(), seed);
        fitness += digits == LeafCombinations.DIGITS ? 100 : -Math.abs(LeafCombinations.DIGITS - digits) * 20.0;

        if (Expr.isInteger(result)) {
            fitness += 50;
            var v = result.doubleValue();
            if (config.inRange(v) || config.inRange(-v)) {
                fitness += 200;
            } else {
                var min = config.minTarget();
                var max = config.maxTarget();
                var positive = Math.min(Math.abs(v - min), Math.abs(v - max));
                var negative = Math.min(Math.abs(-v - min), Math.abs(-v - max));
                fitness += 100.0 / (1.0 + Math.min(positive, negative));
            }
        } else {
            var toInteger = result.subtract(result.setScale(0, RoundingMode.HALF_EVEN)).abs().doubleValue();
            if (toInteger < 1) fitness += 25.0 / (1.0 + toInteger);
        }

        if (result.abs().compareTo(LARGE_RESULT) > 0) fitness -= 50;
        return Math.max(0, fitness);
    }

    @Override
    public Optional<Solution> attempt(Search search) {
        var config = search.config();
        if (population.isEmpty())
            population = new ArrayList<>(IntStream.range(0, config.populationSize())
                    .mapToObj(i -> search.randomExpr()).toList());

        var generations = Math.max(1, config.maxAttempts() / config.populationSize());
        for (var g = 0; g < generations; g++) {
            evolve(search);
            var inject = ++generation % INJECTION_INTERVAL == 0;
            for (var expr : population) {
                var found = search.offer(expr);
                if (found.isPresent()) {
                    if (inject) inject(search);
                    return found;
                }
            }
            if (inject) inject(search);
        }
        return Optional.empty();
    }

    long generation() {
        return generation;
    }

    List<Expr> population() {
        return List.copyOf(population);
    }

    private List<Scored> score(Search search) {
        return population.stream()
                .map(e -> new Scored(e, fitness(e, search.seed(), search.config())))
                .sorted(Comparator.comparingDouble(Scored::fitness).reversed())
                .toList();
    }

    void evolve(Search search) {
        var config = search.config();
        var scored = score(search);
        var next = new ArrayList<Expr>(config.populationSize() + 1);
        for (var i = 0; i < config.eliteSize(); i++) next.add(scored.get(i).expr());

        while (next.size() < config.populationSize()) {
            var children = crossover(tournament(scored, search), tournament(scored, search), search);
            next.add(mutate(children.get(0), search));
            next.add(mutate(children.get(1), search));
        }
        population = new ArrayList<>(next.subList(0, config.populationSize()));
    }

    private Expr tournament(List<Scored> scored, Search search) {
        var rng = search.rng();
        return rng.ints(0, scored.size()).distinct().limit(search.config().tournamentSize())
                .mapToObj(scored::get)
                .max(Comparator.comparingDouble(Scored::fitness))
                .orElseThrow()
                .expr();
    }

    /**
     * Swaps a random non-root subtree between copies of both parents. Subtrees are addressed by
     * their path from the root.
     */
    List<Expr> crossover(Expr first, Expr second, Search search) {
        var a = first.copy();
        var b = second.copy();
        var rng = search.rng();
        if (rng.nextDouble() < search.config().crossoverRate()) {
            var pathsA = a.paths();
            var pathsB = b.paths();
            if (!pathsA.isEmpty() && !pathsB.isEmpty()) {
                var pa = pathsA.get(rng.nextInt(pathsA.size()));
                var pb = pathsB.get(rng.nextInt(pathsB.size()));
                var fromA = a.at(pa).copy();
                var fromB = b.at(pb).copy();
                a = a.replace(pa, fromB);
                b = b.replace(pb, fromA);
            }
        }
        return List.of(a, b);
    }

    Expr mutate(Expr expr, Search search) {
        var rng = search.rng();
        if (rng.nextDouble() >= search.config().mutationRate()) return expr;
        if (expr instanceof Expr.BinaryOp b) {
            return rng.nextBoolean()
                    ? b.withOp(search.weights().binary(rng))
                    : new Expr.BinaryOp(b.op(), mutate(b.left(), search), mutate(b.right(), search));
        }
        if (expr instanceof Expr.UnaryOp u) {
            return rng.nextBoolean()
                    ? u.withOp(search.weights().unary(rng))
                    : new Expr.UnaryOp(u.op(), mutate(u.operand(), search));
        }
        return expr;
    }

    private void inject(Search search) {
        var config = search.config();
        var ranked = new ArrayList<>(score(search).stream().map(Scored::expr).toList());
        var count = Math.min(INJECTION_COUNT, config.populationSize() - config.eliteSize());
        for (var i = ranked.size() - count; i < ranked.size(); i++) ranked.set(i, search.randomExpr());
        population = ranked;
        debug("Generation " + generation + ": injected " + count + " random trees");
    }

    private record Scored(Expr expr, double fitness) {
    }
}
