package dumb.fournines.search;

import dumb.fournines.Solution;

import java.util.Optional;

/** Independent random trees over uniformly sampled leaf combinations. */
final class RandomStrategy implements Strategy {

    @Override
    public Optional<Solution> attempt(Search search) {
        for (var i = 0; i < search.config().maxAttempts(); i++) {
            var found = search.offer(search.randomExpr());
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }
}
