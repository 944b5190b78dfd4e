package dumb.fournines;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

import static dumb.fournines.util.Log.message;
import static dumb.fournines.util.Log.warning;

/**
 * Re-derives {@link Hints} from stored canonical strings. Only the string is needed; the tree
 * the search originally built is not.
 */
public class HintGenerator {

    public Hints hints(String expression) throws ExprParser.ParseException {
        return Hints.of(ExprParser.parse(expression));
    }

    /** Hints for every solution in {@code solutions}; unparseable expressions are logged and skipped. */
    public SortedMap<Integer, SortedMap<Integer, Hints>> annotate(SolutionSet solutions) {
        return annotate(solutions, (s, e) -> {
        });
    }

    public SortedMap<Integer, SortedMap<Integer, Hints>> annotate(SolutionSet solutions,
                                                                  BiConsumer<Solution, ExprParser.ParseException> onError) {
        var result = new TreeMap<Integer, SortedMap<Integer, Hints>>();
        var errors = new AtomicInteger();
        solutions.stream().forEach(s -> {
            try {
                var h = hints(s.expression());
                result.computeIfAbsent(s.seed(), k -> new TreeMap<>()).put(s.target(), h);
            } catch (ExprParser.ParseException e) {
                errors.incrementAndGet();
                warning("Error processing puzzle " + s.seed() + "->" + s.target() + ": " + e.getMessage());
                onError.accept(s, e);
            }
        });
        var count = result.values().stream().mapToInt(Map::size).sum();
        message("Hints generated for " + count + " puzzles" + (errors.get() > 0 ? ", " + errors.get() + " errors" : ""));
        return result;
    }
}
