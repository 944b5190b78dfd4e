package dumb.fournines;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered literal sequence that, rendered, uses the seed digit exactly four times.
 */
public record LeafCombination(List<BigDecimal> literals) {

    public LeafCombination {
        if (literals.isEmpty()) throw new IllegalArgumentException("Leaf combination must not be empty");
        literals = List.copyOf(literals);
    }

    public static LeafCombination of(String... literals) {
        return new LeafCombination(Arrays.stream(literals).map(BigDecimal::new).toList());
    }

    public int size() {
        return literals.size();
    }

    public BigDecimal get(int index) {
        return literals.get(index);
    }

    public LeafCombination slice(int from, int to) {
        return new LeafCombination(literals.subList(from, to));
    }

    public int seedCount(int seed) {
        return literals.stream().mapToInt(l -> Expr.countDigit(l.toPlainString(), seed)).sum();
    }

    @Override
    public String toString() {
        return literals.stream().map(BigDecimal::toPlainString).collect(Collectors.joining(", ", "[", "]"));
    }
}
