package dumb.fournines.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.fournines.util.Json;
import org.jetbrains.annotations.Nullable;

/**
 * Per-run search parameters. Absent JSON fields take the defaults below.
 *
 * @param maxDepth null for unbounded construction depth
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchConfig(
        @JsonProperty("strategy") Strategy.Kind strategy,
        @JsonProperty("minTarget") int minTarget,
        @JsonProperty("maxTarget") int maxTarget,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("maxDepth") @Nullable Integer maxDepth,
        @JsonProperty("populationSize") int populationSize,
        @JsonProperty("eliteSize") int eliteSize,
        @JsonProperty("mutationRate") double mutationRate,
        @JsonProperty("crossoverRate") double crossoverRate,
        @JsonProperty("tournamentSize") int tournamentSize,
        @JsonProperty("binaryOpProb") double binaryOpProb
) {
    static final Strategy.Kind DEFAULT_STRATEGY = Strategy.Kind.GENETIC;
    static final int DEFAULT_MIN_TARGET = 1;
    static final int DEFAULT_MAX_TARGET = 100;
    static final int DEFAULT_MAX_ATTEMPTS = 1000;
    static final int DEFAULT_POPULATION_SIZE = 50;
    static final int DEFAULT_ELITE_SIZE = 5;
    static final double DEFAULT_MUTATION_RATE = 0.3;
    static final double DEFAULT_CROSSOVER_RATE = 0.7;
    static final int DEFAULT_TOURNAMENT_SIZE = 5;
    static final double DEFAULT_BINARY_OP_PROB = 0.7;
    static final int ADAPTIVE_MAX_DEPTH = 10;

    public SearchConfig {
        if (strategy == null) throw new IllegalArgumentException("Search strategy is required");
        if (minTarget < 1 || minTarget > maxTarget)
            throw new IllegalArgumentException("Ill-formed target range: " + minTarget + ".." + maxTarget);
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        if (maxDepth != null && maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        if (populationSize < 2) throw new IllegalArgumentException("populationSize must be at least 2: " + populationSize);
        if (eliteSize < 0 || eliteSize >= populationSize)
            throw new IllegalArgumentException("eliteSize must be in [0, populationSize): " + eliteSize);
        if (tournamentSize < 1 || tournamentSize > populationSize)
            throw new IllegalArgumentException("tournamentSize must be in [1, populationSize]: " + tournamentSize);
        checkRate("mutationRate", mutationRate);
        checkRate("crossoverRate", crossoverRate);
        checkRate("binaryOpProb", binaryOpProb);
    }

    @JsonCreator
    public SearchConfig(
            @JsonProperty("strategy") Strategy.Kind strategy,
            @JsonProperty("minTarget") @Nullable Integer minTarget,
            @JsonProperty("maxTarget") @Nullable Integer maxTarget,
            @JsonProperty("maxAttempts") @Nullable Integer maxAttempts,
            @JsonProperty("maxDepth") @Nullable Integer maxDepth,
            @JsonProperty("populationSize") @Nullable Integer populationSize,
            @JsonProperty("eliteSize") @Nullable Integer eliteSize,
            @JsonProperty("mutationRate") @Nullable Double mutationRate,
            @JsonProperty("crossoverRate") @Nullable Double crossoverRate,
            @JsonProperty("tournamentSize") @Nullable Integer tournamentSize,
            @JsonProperty("binaryOpProb") @Nullable Double binaryOpProb
    ) {
        this(
                strategy != null ? strategy : DEFAULT_STRATEGY,
                minTarget != null ? minTarget : DEFAULT_MIN_TARGET,
                maxTarget != null ? maxTarget : DEFAULT_MAX_TARGET,
                maxAttempts != null ? maxAttempts : DEFAULT_MAX_ATTEMPTS,
                maxDepth,
                populationSize != null ? populationSize : DEFAULT_POPULATION_SIZE,
                eliteSize != null ? eliteSize : DEFAULT_ELITE_SIZE,
                mutationRate != null ? mutationRate : DEFAULT_MUTATION_RATE,
                crossoverRate != null ? crossoverRate : DEFAULT_CROSSOVER_RATE,
                tournamentSize != null ? tournamentSize : DEFAULT_TOURNAMENT_SIZE,
                binaryOpProb != null ? binaryOpProb : DEFAULT_BINARY_OP_PROB
        );
    }

    public SearchConfig() {
        this(DEFAULT_STRATEGY, DEFAULT_MIN_TARGET, DEFAULT_MAX_TARGET, DEFAULT_MAX_ATTEMPTS, null,
                DEFAULT_POPULATION_SIZE, DEFAULT_ELITE_SIZE, DEFAULT_MUTATION_RATE, DEFAULT_CROSSOVER_RATE,
                DEFAULT_TOURNAMENT_SIZE, DEFAULT_BINARY_OP_PROB);
    }

    private static void checkRate(String name, double rate) {
        if (!(rate >= 0 && rate <= 1)) throw new IllegalArgumentException(name + " must be in [0, 1]: " + rate);
    }

    public static SearchConfig parse(String json) {
        try {
            return Json.obj(json, SearchConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid search configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Genetic configuration tuned to recent progress: more mutation while improving known
     * targets, a larger population and more unary variety when nothing was gained.
     */
    public static SearchConfig adaptive(int solutionsFound, int solutionsImproved) {
        var stuck = solutionsFound + solutionsImproved == 0;
        var mutation = solutionsImproved > solutionsFound ? 0.4 : 0.2;
        return new SearchConfig(Strategy.Kind.GENETIC, DEFAULT_MIN_TARGET, DEFAULT_MAX_TARGET, DEFAULT_MAX_ATTEMPTS,
                Integer.valueOf(ADAPTIVE_MAX_DEPTH),
                stuck ? 100 : 50,
                stuck ? 10 : 5,
                mutation,
                0.9 - mutation,
                stuck ? 7 : 5,
                stuck ? 0.5 : 0.7);
    }

    public SearchConfig withStrategy(Strategy.Kind kind) {
        return new SearchConfig(kind, minTarget, maxTarget, maxAttempts, maxDepth, populationSize, eliteSize,
                mutationRate, crossoverRate, tournamentSize, binaryOpProb);
    }

    public SearchConfig withTargets(int min, int max) {
        return new SearchConfig(strategy, min, max, maxAttempts, maxDepth, populationSize, eliteSize,
                mutationRate, crossoverRate, tournamentSize, binaryOpProb);
    }

    public SearchConfig withMaxAttempts(int attempts) {
        return new SearchConfig(strategy, minTarget, maxTarget, attempts, maxDepth, populationSize, eliteSize,
                mutationRate, crossoverRate, tournamentSize, binaryOpProb);
    }

    public SearchConfig withMaxDepth(@Nullable Integer depth) {
        return new SearchConfig(strategy, minTarget, maxTarget, maxAttempts, depth, populationSize, eliteSize,
                mutationRate, crossoverRate, tournamentSize, binaryOpProb);
    }

    public boolean inRange(double value) {
        return value >= minTarget && value <= maxTarget;
    }
}
