package dumb.fournines;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.fournines.util.Json;

import static java.util.Objects.requireNonNull;

/**
 * Best known expression for one (seed, target) pair. Complexity is the length of the canonical
 * rendering; lower is better.
 */
public record Solution(
        @JsonProperty("seed") int seed,
        @JsonProperty("target") int target,
        @JsonProperty("expression") String expression,
        @JsonProperty("complexity") int complexity,
        @JsonProperty("unique_operators") int uniqueOperators
) {
    @JsonCreator
    public Solution {
        requireNonNull(expression);
    }

    /** Solution for an accepted tree; complexity and operator count are derived from it. */
    public static Solution of(int seed, int target, Expr accepted) {
        var expression = accepted.toString();
        return new Solution(seed, target, expression, expression.length(), accepted.operators().size());
    }

    public boolean betterThan(Solution other) {
        return complexity < other.complexity;
    }

    public JsonNode toJson() {
        return Json.node(this);
    }
}
