package dumb.fournines.search;

import dumb.fournines.Solution;

import java.util.Optional;

/**
 * One way of proposing candidates to a {@link Search}. Candidates are judged by
 * {@link Search#offer}, so strategies are interchangeable.
 */
public interface Strategy {

    /** Spends at most the configured attempt budget; returns the first new or improved solution. */
    Optional<Solution> attempt(Search search);

    enum Kind {
        RANDOM, GENETIC
    }
}
