package dumb.fournines.search;

import dumb.fournines.Operator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Selection weights for operators, adapted toward the operators of accepted solutions.
 * Owned by a single search; not thread-safe.
 */
public class OperatorWeights {

    static final double LEARNING_RATE = 0.1;
    static final double MIN_WEIGHT = 0.1;
    static final double MAX_WEIGHT = 5.0;
    /** Starting weight of the four basic arithmetic operators; everything else starts at 1. */
    static final double BASIC_WEIGHT = 2.0;

    private final EnumMap<Operator.Unary, Double> unary = new EnumMap<>(Operator.Unary.class);
    private final EnumMap<Operator.Binary, Double> binary = new EnumMap<>(Operator.Binary.class);

    public OperatorWeights() {
        for (var op : Operator.Unary.values()) unary.put(op, 1.0);
        for (var op : Operator.Binary.values()) binary.put(op, 1.0);
        for (var op : Set.of(Operator.Binary.ADD, Operator.Binary.SUBTRACT, Operator.Binary.MULTIPLY, Operator.Binary.DIVIDE))
            binary.put(op, BASIC_WEIGHT);
    }

    private static <O extends Enum<O>> O pick(EnumMap<O, Double> weights, RandomGenerator rng) {
        var total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        var r = rng.nextDouble() * total;
        O last = null;
        for (var e : weights.entrySet()) {
            last = e.getKey();
            r -= e.getValue();
            if (r < 0) return last;
        }
        return last;
    }

    private static <O extends Enum<O>> void adapt(EnumMap<O, Double> weights, Set<? extends Operator> used) {
        weights.replaceAll((op, w) -> {
            var next = used.contains(op) ? w * (1 + LEARNING_RATE) : w * (1 - LEARNING_RATE * 0.5);
            return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, next));
        });
    }

    public Operator.Unary unary(RandomGenerator rng) {
        return pick(unary, rng);
    }

    public Operator.Binary binary(RandomGenerator rng) {
        return pick(binary, rng);
    }

    /** Moves every weight toward the operators present in a winning expression. */
    public void reward(Set<? extends Operator> used) {
        adapt(unary, used);
        adapt(binary, used);
    }

    public double weight(Operator op) {
        return op instanceof Operator.Unary u ? unary.get(u) : binary.get((Operator.Binary) op);
    }

    public Map<Operator.Unary, Double> unaryWeights() {
        return Collections.unmodifiableMap(unary);
    }

    public Map<Operator.Binary, Double> binaryWeights() {
        return Collections.unmodifiableMap(binary);
    }
}
