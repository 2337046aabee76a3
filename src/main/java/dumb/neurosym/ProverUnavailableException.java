package dumb.neurosym;

/** No usable prover for a request that allows no fallback. */
public class ProverUnavailableException extends RuntimeException {

    private final String prover;

    public ProverUnavailableException(String prover, String message) {
        super(message);
        this.prover = prover;
    }

    public String prover() {
        return prover;
    }
}
