package dumb.neurosym;

import dumb.neurosym.InferenceRule.Family;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses the modal logic and the active rule families for a problem.
 * <table>
 *     <tr><td>any deontic operator</td><td>D</td></tr>
 *     <tr><td>temporal operators, nested or not</td><td>S4</td></tr>
 *     <tr><td>otherwise</td><td>K</td></tr>
 * </table>
 * Temporal rules are always checked against the temporal relation's logic (S4) and deontic rules against
 * the deontic relation's (D), so a problem mixing both keeps each family sound.
 */
public final class ModalStrategySelector {

    private ModalStrategySelector() {
    }

    public static Selection select(Formula goal, Collection<Formula> axioms) {
        return select(goal, axioms, null);
    }

    public static Selection select(Formula goal, Collection<Formula> axioms, @Nullable ModalLogic override) {
        var all = new ArrayList<Formula>(axioms.size() + 1);
        all.add(goal);
        all.addAll(axioms);
        var temporal = false;
        var deontic = false;
        var nesting = 0;
        for (var f : all) {
            for (var s : f.subformulas()) {
                temporal |= s instanceof Formula.Temporal || s instanceof Formula.BinaryTemporal;
                deontic |= s instanceof Formula.Deontic;
            }
            nesting = Math.max(nesting, temporalNesting(f));
        }
        ModalLogic logic;
        if (override != null) logic = override;
        else if (deontic) logic = ModalLogic.D;
        else if (temporal) logic = ModalLogic.S4;
        else logic = ModalLogic.K;
        return new Selection(logic, temporal, deontic, nesting,
                override != null ? override : ModalLogic.S4,
                override != null ? override : ModalLogic.D);
    }

    /** Largest number of temporal operators on one root-to-leaf path. */
    public static int temporalNesting(Formula f) {
        var inner = 0;
        for (var c : f.children()) inner = Math.max(inner, temporalNesting(c));
        var self = f instanceof Formula.Temporal || f instanceof Formula.BinaryTemporal ? 1 : 0;
        return inner + self;
    }

    /**
     * @param logic         the logic reported for the problem
     * @param temporalLogic governs the temporal accessibility relation
     * @param deonticLogic  governs the deontic accessibility relation
     */
    public record Selection(ModalLogic logic, boolean temporal, boolean deontic, int temporalNesting,
                            ModalLogic temporalLogic, ModalLogic deonticLogic) {

        public boolean modal() {
            return temporal || deontic;
        }

        public Set<Family> families() {
            var f = EnumSet.of(Family.BASIC, Family.QUANTIFIER);
            if (temporal) f.add(Family.TEMPORAL);
            if (deontic) f.add(Family.DEONTIC);
            if (temporal && deontic) f.add(Family.COMBINED);
            return f;
        }

        public boolean admits(InferenceRule r) {
            if (!families().contains(r.family())) return false;
            var frame = r.requires();
            if (frame == null) return true;
            return switch (r.family()) {
                case TEMPORAL -> temporalLogic.has(frame);
                case DEONTIC -> deonticLogic.has(frame);
                default -> logic.has(frame);
            };
        }

        public List<InferenceRule> rules(List<InferenceRule> all) {
            return all.stream().filter(this::admits).toList();
        }
    }
}
