package dumb.neurosym;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

public record ProofStep(String rule, List<Formula> premises, Formula derived, String justification) {
    public ProofStep {
        requireNonNull(rule);
        premises = List.copyOf(premises);
        requireNonNull(derived);
        requireNonNull(justification);
    }

    @Override
    public String toString() {
        var from = premises.isEmpty() ? "" : " from " + premises.stream().map(Formula::text).collect(Collectors.joining(", "));
        return derived.text() + "  [" + rule + from + "]";
    }
}
