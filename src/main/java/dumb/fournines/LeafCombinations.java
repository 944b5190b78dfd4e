package dumb.fournines;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Every leaf combination available to one seed digit: four single digits, concatenated
 * repdigits ("11", "111") and decimal-point forms, each padded to exactly four seed digits.
 * Built once; immutable afterwards.
 */
public final class LeafCombinations {

    public static final int DIGITS = 4;

    private final int seed;
    private final List<LeafCombination> all;

    private LeafCombinations(int seed) {
        this.seed = checkSeed(seed);
        var combos = new LinkedHashSet<LeafCombination>();
        addSingleDigits(combos);
        addConcatenated(combos);
        addDecimals(combos);
        this.all = combos.stream()
                .sorted(Comparator.comparingInt(LeafCombination::size).thenComparing(LeafCombination::toString))
                .toList();
    }

    public static LeafCombinations of(int seed) {
        return new LeafCombinations(seed);
    }

    public static int checkSeed(int seed) {
        if (seed < 1 || seed > 9)
            throw new IllegalArgumentException("Seed must be an integer from 1-9: " + seed);
        return seed;
    }

    private void addSingleDigits(Set<LeafCombination> combos) {
        var d = digits(1);
        combos.add(LeafCombination.of(d, d, d, d));
    }

    private void addConcatenated(Set<LeafCombination> combos) {
        var d = digits(1);
        combos.add(LeafCombination.of(digits(2), d, d));
        combos.add(LeafCombination.of(digits(3), d));
    }

    private void addDecimals(Set<LeafCombination> combos) {
        var forms = new LinkedHashSet<BigDecimal>();
        for (var i = 1; i < DIGITS; i++)
            forms.add(new BigDecimal("." + digits(i)));
        for (var total = 2; total <= DIGITS; total++)
            for (var whole = total - 1; whole >= 1; whole--)
                forms.add(new BigDecimal(digits(whole) + "." + digits(total - whole)));

        var single = new BigDecimal(digits(1));
        for (var form : forms) {
            var remaining = DIGITS - Expr.countDigit(form.toPlainString(), seed);
            if (remaining == 0) {
                combos.add(new LeafCombination(List.of(form)));
                continue;
            }
            var padded = new ArrayList<BigDecimal>();
            padded.add(form);
            for (var i = 0; i < remaining; i++) padded.add(single);
            combos.add(new LeafCombination(padded));
            if (remaining == 1)
                combos.add(new LeafCombination(List.of(form, new BigDecimal("." + digits(1)))));
        }
    }

    private String digits(int n) {
        return String.valueOf(seed).repeat(n);
    }

    public int seed() {
        return seed;
    }

    /** All combinations, ordered by length and then rendering. */
    public List<LeafCombination> all() {
        return all;
    }

    public LeafCombination random(RandomGenerator rng) {
        return all.get(rng.nextInt(all.size()));
    }

    public int size() {
        return all.size();
    }
}
