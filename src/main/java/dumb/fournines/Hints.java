package dumb.fournines;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.fournines.util.Json;

import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Structural facts about a solution, revealed to a player step by step.
 *
 * @param leafValues distinct literal renderings, sorted
 * @param operators  distinct operator symbols, sorted; negation shows as "-"
 * @param subtrees   renderings of the non-trivial proper subexpressions, shortest first
 */
public record Hints(
        @JsonProperty("leaf_values") List<String> leafValues,
        @JsonProperty("operators") List<String> operators,
        @JsonProperty("subtrees") List<String> subtrees
) {
    /** Shorter renderings are single literals or negated literals. */
    static final int MIN_SUBTREE_LENGTH = 4;

    public Hints {
        leafValues = List.copyOf(leafValues);
        operators = List.copyOf(operators);
        subtrees = List.copyOf(subtrees);
    }

    public static Hints of(Expr root) {
        var full = root.toString();
        var leaves = root.nodes()
                .filter(Expr.Num.class::isInstance)
                .map(Expr::toString)
                .collect(Collectors.toCollection(TreeSet::new));
        var subtrees = root.nodes()
                .filter(n -> !(n instanceof Expr.Num))
                .map(Expr::toString)
                .filter(s -> s.length() >= MIN_SUBTREE_LENGTH && !s.equals(full))
                .distinct()
                .sorted(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()))
                .toList();
        return new Hints(List.copyOf(leaves), List.copyOf(root.operators()), subtrees);
    }

    public JsonNode toJson() {
        return Json.node(this);
    }
}
