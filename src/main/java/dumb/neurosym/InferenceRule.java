package dumb.neurosym;

import dumb.neurosym.ModalLogic.Frame;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A named inference schema.
 *
 * @param arity         number of premises, 1 or 2
 * @param requires      frame condition the governing modal logic must have, or null
 * @param expansive     the conclusion is larger than its premises; such conclusions are only kept when the
 *                      goal mentions them
 * @param necessitation applies to theorems only
 */
public record InferenceRule(String name, Family family, int arity, @Nullable Frame requires, boolean expansive,
                            boolean necessitation, String description, Matcher matcher) {

    public InferenceRule {
        requireNonNull(name);
        requireNonNull(family);
        if (arity < 1 || arity > 2) throw new IllegalArgumentException("Rule arity must be 1 or 2: " + name);
        requireNonNull(description);
        requireNonNull(matcher);
    }

    /** Candidate conclusions for the premises, in preference order; empty when the rule does not match. */
    public List<Formula> apply(List<Formula> premises, Context ctx) {
        if (premises.size() != arity) return List.of();
        return matcher.apply(premises, ctx);
    }

    @Override
    public String toString() {
        return name;
    }

    /** Families in the order the engine tries them. */
    public enum Family {
        BASIC, QUANTIFIER, TEMPORAL, DEONTIC, COMBINED
    }

    @FunctionalInterface
    public interface Matcher {
        List<Formula> apply(List<Formula> premises, Context ctx);
    }

    /**
     * What rules may consult besides their premises.
     *
     * @param goalParts distinct subformulas of the goal, pre-order
     * @param constants ground terms known to the problem, used for instantiation
     */
    public record Context(Formula goal, List<Formula> goalParts, Set<Formula> goalIndex, List<Term> constants) {
        public Context {
            requireNonNull(goal);
            goalParts = List.copyOf(goalParts);
            goalIndex = Set.copyOf(goalIndex);
            constants = List.copyOf(constants);
        }

        public static Context of(Formula goal, List<Term> constants) {
            var parts = new LinkedHashSet<>(goal.subformulas());
            return new Context(goal, new ArrayList<>(parts), parts, constants);
        }

        public boolean mentions(Formula f) {
            return goalIndex.contains(f);
        }
    }
}
