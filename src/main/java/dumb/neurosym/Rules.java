package dumb.neurosym;

import dumb.neurosym.Formula.Binary;
import dumb.neurosym.Formula.BinaryTemporal;
import dumb.neurosym.Formula.BinaryTemporalOp;
import dumb.neurosym.Formula.Connective;
import dumb.neurosym.Formula.Deontic;
import dumb.neurosym.Formula.DeonticOp;
import dumb.neurosym.Formula.Not;
import dumb.neurosym.Formula.Quantified;
import dumb.neurosym.Formula.Quantifier;
import dumb.neurosym.Formula.Temporal;
import dumb.neurosym.Formula.TemporalOp;
import dumb.neurosym.InferenceRule.Context;
import dumb.neurosym.InferenceRule.Family;
import dumb.neurosym.ModalLogic.Frame;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static dumb.neurosym.Formula.always;
import static dumb.neurosym.Formula.and;
import static dumb.neurosym.Formula.eventually;
import static dumb.neurosym.Formula.forbidden;
import static dumb.neurosym.Formula.implies;
import static dumb.neurosym.Formula.next;
import static dumb.neurosym.Formula.not;
import static dumb.neurosym.Formula.obligatory;
import static dumb.neurosym.Formula.or;
import static dumb.neurosym.Formula.permitted;

/** The rule set, in the order the engine tries it. */
public final class Rules {

    /* ---- propositional ---- */

    public static final InferenceRule MODUS_PONENS = binary("ModusPonens", Family.BASIC,
            "φ, φ → ψ ⊢ ψ", (a, b) -> {
                var i = bin(b, Connective.IMPLIES);
                return i != null && i.left.equals(a) ? i.right : null;
            });

    public static final InferenceRule MODUS_TOLLENS = binary("ModusTollens", Family.BASIC,
            "φ → ψ, ¬ψ ⊢ ¬φ", (a, b) -> {
                var i = bin(a, Connective.IMPLIES);
                return i != null && i.right.equals(negated(b)) ? not(i.left) : null;
            });

    public static final InferenceRule DISJUNCTIVE_SYLLOGISM = rule("DisjunctiveSyllogism", Family.BASIC, 2,
            null, false, false, "φ ∨ ψ, ¬φ ⊢ ψ", (p, ctx) -> {
                var d = bin(p.get(0), Connective.OR);
                var n = negated(p.get(1));
                if (d == null || n == null) return List.of();
                var out = new ArrayList<Formula>(2);
                if (d.left.equals(n)) out.add(d.right);
                if (d.right.equals(n)) out.add(d.left);
                return out;
            });

    public static final InferenceRule HYPOTHETICAL_SYLLOGISM = binary("HypotheticalSyllogism", Family.BASIC,
            "φ → ψ, ψ → χ ⊢ φ → χ", (a, b) -> {
                var x = bin(a, Connective.IMPLIES);
                var y = bin(b, Connective.IMPLIES);
                return x != null && y != null && x.right.equals(y.left) ? implies(x.left, y.right) : null;
            });

    public static final InferenceRule CONJUNCTION_ELIMINATION_LEFT = unary("ConjunctionEliminationLeft", Family.BASIC,
            "φ ∧ ψ ⊢ φ", a -> {
                var c = bin(a, Connective.AND);
                return c != null ? c.left : null;
            });

    public static final InferenceRule CONJUNCTION_ELIMINATION_RIGHT = unary("ConjunctionEliminationRight", Family.BASIC,
            "φ ∧ ψ ⊢ ψ", a -> {
                var c = bin(a, Connective.AND);
                return c != null ? c.right : null;
            });

    public static final InferenceRule DOUBLE_NEGATION_ELIMINATION = unary("DoubleNegationElimination", Family.BASIC,
            "¬¬φ ⊢ φ", a -> {
                var n = negated(a);
                return n != null ? negated(n) : null;
            });

    public static final InferenceRule DE_MORGAN_AND = unary("DeMorganAnd", Family.BASIC,
            "¬(φ ∧ ψ) ⊢ ¬φ ∨ ¬ψ", a -> {
                var c = bin(negated(a), Connective.AND);
                return c != null ? or(not(c.left), not(c.right)) : null;
            });

    public static final InferenceRule DE_MORGAN_OR = unary("DeMorganOr", Family.BASIC,
            "¬(φ ∨ ψ) ⊢ ¬φ ∧ ¬ψ", a -> {
                var d = bin(negated(a), Connective.OR);
                return d != null ? and(not(d.left), not(d.right)) : null;
            });

    public static final InferenceRule CONJUNCTION_INTRODUCTION = expansive(binary("ConjunctionIntroduction", Family.BASIC,
            "φ, ψ ⊢ φ ∧ ψ", Formula::and));

    public static final InferenceRule DISJUNCTION_INTRODUCTION_LEFT = rule("DisjunctionIntroductionLeft", Family.BASIC, 1,
            null, true, false, "φ ⊢ φ ∨ ψ", (p, ctx) -> goalParts(ctx, g -> {
                var d = bin(g, Connective.OR);
                return d != null && d.left.equals(p.get(0));
            }));

    public static final InferenceRule DISJUNCTION_INTRODUCTION_RIGHT = rule("DisjunctionIntroductionRight", Family.BASIC, 1,
            null, true, false, "ψ ⊢ φ ∨ ψ", (p, ctx) -> goalParts(ctx, g -> {
                var d = bin(g, Connective.OR);
                return d != null && d.right.equals(p.get(0));
            }));

    public static final InferenceRule DOUBLE_NEGATION_INTRODUCTION = expansive(unary("DoubleNegationIntroduction", Family.BASIC,
            "φ ⊢ ¬¬φ", a -> not(not(a))));

    public static final InferenceRule CONTRAPOSITION = expansive(unary("Contraposition", Family.BASIC,
            "φ → ψ ⊢ ¬ψ → ¬φ", a -> {
                var i = bin(a, Connective.IMPLIES);
                return i != null ? implies(not(i.right), not(i.left)) : null;
            }));

    /* ---- quantifiers ---- */

    public static final InferenceRule UNIVERSAL_INSTANTIATION = rule("UniversalInstantiation", Family.QUANTIFIER, 1,
            null, false, false, "∀x. φ(x) ⊢ φ(c)", (p, ctx) -> {
                if (!(p.get(0) instanceof Quantified q) || q.op != Quantifier.FORALL) return List.of();
                if (!q.body.freeVars().contains(q.var)) return List.of(q.body);
                var out = new LinkedHashSet<Formula>();
                for (var c : ctx.constants()) out.add(q.instantiate(c));
                return new ArrayList<>(out);
            });

    public static final InferenceRule EXISTENTIAL_GENERALIZATION = rule("ExistentialGeneralization", Family.QUANTIFIER, 1,
            null, true, false, "φ(c) ⊢ ∃x. φ(x)", (p, ctx) -> goalParts(ctx, g -> {
                if (!(g instanceof Quantified q) || q.op != Quantifier.EXISTS) return false;
                var a = p.get(0);
                if (!q.body.freeVars().contains(q.var)) return q.body.equals(a);
                return ctx.constants().stream().anyMatch(c -> q.instantiate(c).equals(a));
            }));

    /* ---- temporal ---- */

    public static final InferenceRule TEMPORAL_K_AXIOM = binary("TemporalKAxiom", Family.TEMPORAL,
            "□(φ → ψ), □φ ⊢ □ψ", (a, b) -> {
                var i = bin(temporal(a, TemporalOp.ALWAYS), Connective.IMPLIES);
                return i != null && i.left.equals(temporal(b, TemporalOp.ALWAYS)) ? always(i.right) : null;
            });

    public static final InferenceRule TEMPORAL_T_AXIOM = requires(Frame.REFLEXIVE, unary("TemporalTAxiom", Family.TEMPORAL,
            "□φ ⊢ φ", a -> temporal(a, TemporalOp.ALWAYS)));

    public static final InferenceRule ALWAYS_DISTRIBUTION = unary("AlwaysDistribution", Family.TEMPORAL,
            "□(φ ∧ ψ) ⊢ □φ ∧ □ψ", a -> {
                var c = bin(temporal(a, TemporalOp.ALWAYS), Connective.AND);
                return c != null ? and(always(c.left), always(c.right)) : null;
            });

    public static final InferenceRule UNTIL_INDUCTION = unary("UntilInduction", Family.TEMPORAL,
            "ψ ∨ (φ ∧ X(φ U ψ)) ⊢ φ U ψ", a -> {
                var d = bin(a, Connective.OR);
                if (d == null) return null;
                var c = bin(d.right, Connective.AND);
                if (c == null) return null;
                var u = until(temporal(c.right, TemporalOp.NEXT));
                return u != null && u.left.equals(c.left) && u.right.equals(d.left) ? u : null;
            });

    public static final InferenceRule TEMPORAL_S4_AXIOM = requires(Frame.TRANSITIVE, expansive(unary("TemporalS4Axiom",
            Family.TEMPORAL, "□φ ⊢ □□φ", a -> temporal(a, TemporalOp.ALWAYS) != null ? always(a) : null)));

    public static final InferenceRule TEMPORAL_S5_AXIOM = requires(Frame.EUCLIDEAN, expansive(unary("TemporalS5Axiom",
            Family.TEMPORAL, "◊φ ⊢ □◊φ", a -> temporal(a, TemporalOp.EVENTUALLY) != null ? always(a) : null)));

    public static final InferenceRule EVENTUALLY_INTRODUCTION = requires(Frame.REFLEXIVE, expansive(unary(
            "EventuallyIntroduction", Family.TEMPORAL, "φ ⊢ ◊φ", Formula::eventually)));

    public static final InferenceRule ALWAYS_NECESSITATION = necessitation(unary("AlwaysNecessitation", Family.TEMPORAL,
            "⊢ φ implies ⊢ □φ", Formula::always));

    public static final InferenceRule UNTIL_UNFOLDING = expansive(unary("UntilUnfolding", Family.TEMPORAL,
            "φ U ψ ⊢ ψ ∨ (φ ∧ X(φ U ψ))", a -> {
                var u = until(a);
                return u != null ? or(u.right, and(u.left, next(u))) : null;
            }));

    public static final InferenceRule EVENTUALLY_EXPANSION = expansive(unary("EventuallyExpansion", Family.TEMPORAL,
            "◊φ ⊢ φ ∨ X◊φ", a -> {
                var b = temporal(a, TemporalOp.EVENTUALLY);
                return b != null ? or(b, next(a)) : null;
            }));

    /* ---- deontic ---- */

    public static final InferenceRule DEONTIC_K_AXIOM = binary("DeonticKAxiom", Family.DEONTIC,
            "O(φ → ψ), O(φ) ⊢ O(ψ)", (a, b) -> {
                var i = bin(deontic(a, DeonticOp.OBLIGATORY), Connective.IMPLIES);
                return i != null && i.left.equals(deontic(b, DeonticOp.OBLIGATORY)) ? obligatory(i.right) : null;
            });

    public static final InferenceRule DEONTIC_D_AXIOM = requires(Frame.SERIAL, unary("DeonticDAxiom", Family.DEONTIC,
            "O(φ) ⊢ P(φ)", a -> {
                var b = deontic(a, DeonticOp.OBLIGATORY);
                return b != null ? permitted(b) : null;
            }));

    public static final InferenceRule PROHIBITION_EQUIVALENCE = unary("ProhibitionEquivalence", Family.DEONTIC,
            "F(φ) ⊢ O(¬φ)", a -> {
                var b = deontic(a, DeonticOp.FORBIDDEN);
                return b != null ? obligatory(not(b)) : null;
            });

    public static final InferenceRule PROHIBITION_FROM_OBLIGATION = unary("ProhibitionFromObligation", Family.DEONTIC,
            "O(¬φ) ⊢ F(φ)", a -> {
                var b = negated(deontic(a, DeonticOp.OBLIGATORY));
                return b != null ? forbidden(b) : null;
            });

    public static final InferenceRule PERMISSION_NEGATION = unary("PermissionNegation", Family.DEONTIC,
            "P(φ) ⊢ ¬O(¬φ)", a -> {
                var b = deontic(a, DeonticOp.PERMITTED);
                return b != null ? not(obligatory(not(b))) : null;
            });

    public static final InferenceRule OBLIGATION_CONSISTENCY = requires(Frame.SERIAL, unary("ObligationConsistency",
            Family.DEONTIC, "O(φ) ⊢ ¬O(¬φ)", a -> {
                var b = deontic(a, DeonticOp.OBLIGATORY);
                return b != null ? not(obligatory(not(b))) : null;
            }));

    public static final InferenceRule PERMISSION_INTRODUCTION = requires(Frame.REFLEXIVE, expansive(unary(
            "PermissionIntroduction", Family.DEONTIC, "φ ⊢ P(φ)", Formula::permitted)));

    public static final InferenceRule DEONTIC_NECESSITATION = necessitation(unary("DeonticNecessitation", Family.DEONTIC,
            "⊢ φ implies ⊢ O(φ)", Formula::obligatory));

    /* ---- deontic and temporal combined ---- */

    public static final InferenceRule TEMPORAL_OBLIGATION_PERSISTENCE = unary("TemporalObligationPersistence",
            Family.COMBINED, "O(□φ) ⊢ □O(φ)", a -> {
                var b = temporal(deontic(a, DeonticOp.OBLIGATORY), TemporalOp.ALWAYS);
                return b != null ? always(obligatory(b)) : null;
            });

    public static final InferenceRule UNTIL_OBLIGATION = unary("UntilObligation", Family.COMBINED,
            "O(φ U ψ) ⊢ ◊O(ψ)", a -> {
                var u = until(deontic(a, DeonticOp.OBLIGATORY));
                return u != null ? eventually(obligatory(u.right)) : null;
            });

    public static final InferenceRule ALWAYS_PERMISSION = unary("AlwaysPermission", Family.COMBINED,
            "P(□φ) ⊢ □P(φ)", a -> {
                var b = temporal(deontic(a, DeonticOp.PERMITTED), TemporalOp.ALWAYS);
                return b != null ? always(permitted(b)) : null;
            });

    public static final InferenceRule EVENTUALLY_FORBIDDEN = unary("EventuallyForbidden", Family.COMBINED,
            "F(◊φ) ⊢ □F(φ)", a -> {
                var b = temporal(deontic(a, DeonticOp.FORBIDDEN), TemporalOp.EVENTUALLY);
                return b != null ? always(forbidden(b)) : null;
            });

    public static final InferenceRule OBLIGATION_EVENTUALLY = unary("ObligationEventually", Family.COMBINED,
            "O(◊φ) ⊢ ◊O(φ)", a -> {
                var b = temporal(deontic(a, DeonticOp.OBLIGATORY), TemporalOp.EVENTUALLY);
                return b != null ? eventually(obligatory(b)) : null;
            });

    public static final InferenceRule DEONTIC_TEMPORAL_INTRODUCTION = expansive(unary("DeonticTemporalIntroduction",
            Family.COMBINED, "O(φ) ⊢ O(Xφ)", a -> {
                var b = deontic(a, DeonticOp.OBLIGATORY);
                return b != null ? obligatory(next(b)) : null;
            }));

    public static final InferenceRule PERMISSION_TEMPORAL_WEAKENING = expansive(unary("PermissionTemporalWeakening",
            Family.COMBINED, "P(φ) ⊢ P(◊φ)", a -> {
                var b = deontic(a, DeonticOp.PERMITTED);
                return b != null ? permitted(eventually(b)) : null;
            }));

    public static final List<InferenceRule> ALL = List.of(
            MODUS_PONENS, MODUS_TOLLENS, DISJUNCTIVE_SYLLOGISM, HYPOTHETICAL_SYLLOGISM,
            CONJUNCTION_ELIMINATION_LEFT, CONJUNCTION_ELIMINATION_RIGHT, DOUBLE_NEGATION_ELIMINATION,
            DE_MORGAN_AND, DE_MORGAN_OR, CONJUNCTION_INTRODUCTION, DISJUNCTION_INTRODUCTION_LEFT,
            DISJUNCTION_INTRODUCTION_RIGHT, DOUBLE_NEGATION_INTRODUCTION, CONTRAPOSITION,

            UNIVERSAL_INSTANTIATION, EXISTENTIAL_GENERALIZATION,

            TEMPORAL_K_AXIOM, TEMPORAL_T_AXIOM, ALWAYS_DISTRIBUTION, UNTIL_INDUCTION, TEMPORAL_S4_AXIOM,
            TEMPORAL_S5_AXIOM, EVENTUALLY_INTRODUCTION, ALWAYS_NECESSITATION, UNTIL_UNFOLDING, EVENTUALLY_EXPANSION,

            DEONTIC_K_AXIOM, DEONTIC_D_AXIOM, PROHIBITION_EQUIVALENCE, PROHIBITION_FROM_OBLIGATION,
            PERMISSION_NEGATION, OBLIGATION_CONSISTENCY, PERMISSION_INTRODUCTION, DEONTIC_NECESSITATION,

            TEMPORAL_OBLIGATION_PERSISTENCE, UNTIL_OBLIGATION, ALWAYS_PERMISSION, EVENTUALLY_FORBIDDEN,
            OBLIGATION_EVENTUALLY, DEONTIC_TEMPORAL_INTRODUCTION, PERMISSION_TEMPORAL_WEAKENING
    );

    private static final Map<String, InferenceRule> byName = ALL.stream()
            .collect(Collectors.toUnmodifiableMap(InferenceRule::name, r -> r));

    private Rules() {
    }

    public static Optional<InferenceRule> named(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public static List<InferenceRule> family(Family f) {
        return ALL.stream().filter(r -> r.family() == f).toList();
    }

    private static InferenceRule rule(String name, Family family, int arity, @Nullable Frame requires, boolean expansive,
                                      boolean necessitation, String description, InferenceRule.Matcher m) {
        return new InferenceRule(name, family, arity, requires, expansive, necessitation, description, m);
    }

    private static InferenceRule unary(String name, Family family, String description, Function<Formula, Formula> f) {
        return rule(name, family, 1, null, false, false, description, (p, ctx) -> one(f.apply(p.get(0))));
    }

    private static InferenceRule binary(String name, Family family, String description,
                                        BiFunction<Formula, Formula, Formula> f) {
        return rule(name, family, 2, null, false, false, description, (p, ctx) -> one(f.apply(p.get(0), p.get(1))));
    }

    private static InferenceRule expansive(InferenceRule r) {
        return rule(r.name(), r.family(), r.arity(), r.requires(), true, r.necessitation(), r.description(), r.matcher());
    }

    private static InferenceRule necessitation(InferenceRule r) {
        return rule(r.name(), r.family(), r.arity(), r.requires(), true, true, r.description(), r.matcher());
    }

    private static InferenceRule requires(Frame frame, InferenceRule r) {
        return rule(r.name(), r.family(), r.arity(), frame, r.expansive(), r.necessitation(), r.description(), r.matcher());
    }

    private static List<Formula> goalParts(Context ctx, Predicate<Formula> test) {
        return ctx.goalParts().stream().filter(test).toList();
    }

    private static List<Formula> one(@Nullable Formula f) {
        return f == null ? List.of() : List.of(f);
    }

    static @Nullable Binary bin(@Nullable Formula f, Connective op) {
        return f instanceof Binary b && b.op == op ? b : null;
    }

    static @Nullable Formula negated(@Nullable Formula f) {
        return f instanceof Not n ? n.body : null;
    }

    static @Nullable Formula temporal(@Nullable Formula f, TemporalOp op) {
        return f instanceof Temporal t && t.op == op ? t.body : null;
    }

    static @Nullable Formula deontic(@Nullable Formula f, DeonticOp op) {
        return f instanceof Deontic d && d.op == op ? d.body : null;
    }

    static @Nullable BinaryTemporal until(@Nullable Formula f) {
        return f instanceof BinaryTemporal b && b.op == BinaryTemporalOp.UNTIL ? b : null;
    }
}
