package dumb.fournines;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

import static java.util.Collections.unmodifiableSortedMap;

/**
 * Mapping {@code seed -> target -> Solution} that only ever keeps the lowest-complexity solution
 * per pair. Not thread-safe; each search owns its own.
 */
public class SolutionSet {

    private final SortedMap<Integer, SortedMap<Integer, Solution>> bySeed = new TreeMap<>();

    /**
     * Stores {@code s} if its pair has no solution yet or {@code s} is strictly shorter.
     *
     * @return whether the set changed
     */
    public boolean offer(Solution s) {
        var targets = bySeed.computeIfAbsent(s.seed(), k -> new TreeMap<>());
        var existing = targets.get(s.target());
        if (existing != null && !s.betterThan(existing)) return false;
        targets.put(s.target(), s);
        return true;
    }

    /** Folds {@code other} into this set under the same rule; returns how many entries changed. */
    public int merge(SolutionSet other) {
        return (int) other.stream().filter(this::offer).count();
    }

    public Optional<Solution> get(int seed, int target) {
        return Optional.ofNullable(bySeed.getOrDefault(seed, new TreeMap<>()).get(target));
    }

    public SortedMap<Integer, Solution> forSeed(int seed) {
        var targets = bySeed.get(seed);
        return targets == null ? new TreeMap<>() : unmodifiableSortedMap(targets);
    }

    public Stream<Solution> stream() {
        return bySeed.values().stream().flatMap(m -> m.values().stream());
    }

    public int size() {
        return bySeed.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public SolutionSet copy() {
        var c = new SolutionSet();
        c.merge(this);
        return c;
    }
}
