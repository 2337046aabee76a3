package dumb.neurosym;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A proving capability: the native engine, or a bridge to an external solver. Implementations must be
 * safe to call from several threads and must honor the {@link Budget} cooperatively.
 */
public interface Prover {

    String name();

    boolean isAvailable();

    Capabilities capabilities();

    /** Settings that influence results. Part of the cache key, so it must serialize deterministically. */
    default Map<String, Object> configuration() {
        return Map.of();
    }

    ProofResult prove(Formula goal, List<Formula> axioms, Budget budget);

    default ProofResult prove(Formula goal, List<Formula> axioms, Duration timeout) {
        return prove(goal, axioms, Budget.of(timeout));
    }
}
