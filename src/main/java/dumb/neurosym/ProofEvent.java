package dumb.neurosym;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Router lifecycle notifications, delivered through {@link Events}. */
public sealed interface ProofEvent permits ProofEvent.Started, ProofEvent.CacheHit, ProofEvent.Completed {

    default String eventType() {
        return getClass().getSimpleName();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Started(Formula goal, ProverRouter.Strategy strategy, List<String> candidates) implements ProofEvent {
        public Started {
            requireNonNull(goal);
            requireNonNull(strategy);
            candidates = List.copyOf(candidates);
        }
    }

    record CacheHit(Formula goal, String prover, ProofCache.CacheKey key) implements ProofEvent {
        public CacheHit {
            requireNonNull(goal);
            requireNonNull(prover);
            requireNonNull(key);
        }
    }

    record Completed(Formula goal, ProofResult result) implements ProofEvent {
        public Completed {
            requireNonNull(goal);
            requireNonNull(result);
        }
    }
}
