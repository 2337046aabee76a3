package dumb.neurosym;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.neurosym.util.Json;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of one proof attempt. {@code attempts} holds the sub-results a router combined or fell
 * through to reach this one; it is empty for a single prover call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProofResult(ProofStatus status, List<ProofStep> steps, Duration elapsed, String prover,
                          boolean fromCache, boolean inconsistent, @Nullable ModalLogic logic,
                          @Nullable String message, List<ProofResult> attempts) {
    public ProofResult {
        requireNonNull(status);
        steps = List.copyOf(steps);
        requireNonNull(elapsed);
        requireNonNull(prover);
        attempts = List.copyOf(attempts);
    }

    public static ProofResult of(ProofStatus status, String prover, Duration elapsed, @Nullable String message) {
        return new ProofResult(status, List.of(), elapsed, prover, false, false, null, message, List.of());
    }

    public static ProofResult error(String prover, Duration elapsed, String message) {
        return of(ProofStatus.ERROR, prover, elapsed, message);
    }

    public static ProofResult unavailable(String prover, String reason) {
        return of(ProofStatus.UNAVAILABLE, prover, Duration.ZERO, reason);
    }

    @JsonIgnore
    public boolean isDefinitive() {
        return status.definitive();
    }

    @JsonIgnore
    public boolean isProved() {
        return status == ProofStatus.PROVED;
    }

    public ProofResult withFromCache(boolean cached) {
        return cached == fromCache ? this
                : new ProofResult(status, steps, elapsed, prover, cached, inconsistent, logic, message, attempts);
    }

    public ProofResult withAttempts(List<ProofResult> a) {
        return new ProofResult(status, steps, elapsed, prover, fromCache, inconsistent, logic, message, a);
    }

    /** Numbered, human-readable listing of the proof. */
    public String explain() {
        var sb = new StringBuilder();
        sb.append(status).append(" by ").append(prover);
        if (logic != null) sb.append(" (").append(logic).append(')');
        if (fromCache) sb.append(" [cached]");
        sb.append('\n');
        for (var i = 0; i < steps.size(); i++)
            sb.append(i + 1).append(". ").append(steps.get(i)).append('\n');
        if (inconsistent) sb.append("warning: the premises are inconsistent\n");
        if (message != null) sb.append(message).append('\n');
        return sb.toString();
    }

    public JsonNode toJson() {
        return Json.node(this);
    }
}
