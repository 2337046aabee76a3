package dumb.neurosym;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Structural metrics of one formula.
 *
 * @param nesting         operator nesting of the deepest path; atoms have 0
 * @param quantifierDepth quantifiers on the deepest path
 * @param temporal        unary temporal operators ({@code □ ◊ X})
 * @param binaryTemporal  {@code U} and {@code S}
 * @param functions       function applications inside terms
 * @param score           weighted complexity in [0, 100]
 * @param recommended     prover names, best first
 */
public record FormulaAnalysis(FormulaType type, int nesting, int quantifierDepth, int negations, int connectives,
                              int quantifiers, int temporal, int binaryTemporal, int deontic, int predicates,
                              int functions, int score, Complexity complexity, List<String> recommended) {

    public FormulaAnalysis {
        requireNonNull(type);
        requireNonNull(complexity);
        recommended = List.copyOf(recommended);
    }

    @JsonIgnore
    public int modalOperators() {
        return temporal + deontic;
    }

    public enum Complexity {
        LOW, MEDIUM, HIGH;

        public static Complexity of(int score) {
            if (score < 30) return LOW;
            return score < 70 ? MEDIUM : HIGH;
        }
    }
}
