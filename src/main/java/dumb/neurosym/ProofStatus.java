package dumb.neurosym;

public enum ProofStatus {
    PROVED,
    DISPROVED,
    /** No contradiction or derivation found, search exhausted. */
    UNKNOWN,
    TIMEOUT,
    /** Step budget exhausted. */
    DEPTH_EXCEEDED,
    ERROR,
    UNAVAILABLE;

    public boolean definitive() {
        return this == PROVED || this == DISPROVED;
    }

    /** Outcomes that depend only on the problem and the prover configuration, not on wall-clock time. */
    public boolean deterministic() {
        return this == PROVED || this == DISPROVED || this == UNKNOWN || this == DEPTH_EXCEEDED;
    }
}
