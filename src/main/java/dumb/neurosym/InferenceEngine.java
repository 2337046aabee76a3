package dumb.neurosym;

import dumb.neurosym.Config.EngineConfig;
import dumb.neurosym.InferenceRule.Context;
import dumb.neurosym.ModalStrategySelector.Selection;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static dumb.neurosym.Formula.not;
import static dumb.neurosym.util.Log.debug;
import static dumb.neurosym.util.Log.error;
import static dumb.neurosym.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Native prover: forward chaining over the ordered rule set, then a modal tableaux pass for problems with
 * temporal or deontic operators that chaining alone could not settle.
 * <p>
 * Each pass is synchronous and bounded by a step budget and a {@link Budget}. The knowledge base is only
 * read; derived facts live in the pass.
 */
public class InferenceEngine {

    public static final String NAME = "native";
    public static final String TABLEAUX_STEP = "ModalTableaux";

    private final KnowledgeBase kb;
    private final EngineConfig config;
    private final List<InferenceRule> rules;

    public InferenceEngine(KnowledgeBase kb) {
        this(kb, new EngineConfig());
    }

    public InferenceEngine(KnowledgeBase kb, EngineConfig config) {
        this(kb, config, Rules.ALL);
    }

    public InferenceEngine(KnowledgeBase kb, EngineConfig config, List<InferenceRule> rules) {
        this.kb = requireNonNull(kb);
        this.config = requireNonNull(config);
        this.rules = List.copyOf(rules);
    }

    public EngineConfig config() {
        return config;
    }

    public ProofResult prove(Formula goal) {
        return prove(goal, config.stepBudget(), Budget.of(config.timeBudget()));
    }

    public ProofResult prove(Formula goal, int stepBudget, Duration timeBudget) {
        return prove(goal, stepBudget, Budget.of(timeBudget));
    }

    public ProofResult prove(Formula goal, int stepBudget, Budget budget) {
        requireNonNull(goal);
        requireNonNull(budget);
        if (stepBudget < 1) throw new IllegalArgumentException("Step budget must be positive: " + stepBudget);
        var start = System.nanoTime();
        try {
            var r = new Pass(goal, stepBudget, budget, start).run();
            debug(r.status() + " " + goal.text() + " in " + r.steps().size() + " steps, " + r.elapsed().toMillis() + "ms");
            return r;
        } catch (RuntimeException e) {
            error("Inference failed for " + goal.text() + ": " + e);
            return ProofResult.error(NAME, Duration.ofNanos(System.nanoTime() - start), e.toString());
        }
    }

    /** Ground terms of the formulas, in order of first occurrence. */
    static List<Term> constants(List<Formula> formulas) {
        var out = new LinkedHashSet<Term>();
        for (var f : formulas)
            for (var s : f.subformulas())
                if (s instanceof Formula.Pred p)
                    for (var a : p.args) collectGround(a, out);
        return new ArrayList<>(out);
    }

    private static void collectGround(Term t, Set<Term> out) {
        if (t instanceof Term.Fn fn) fn.args.forEach(a -> collectGround(a, out));
        if (t.ground()) out.add(t);
    }

    /** State of one proof attempt. */
    private final class Pass {
        final Formula goal;
        final int stepBudget;
        final Budget budget;
        final long start;

        final List<Formula> facts = new ArrayList<>();
        final Set<Formula> index = new HashSet<>();
        final Set<Formula> theorems = new HashSet<>();
        final List<ProofStep> steps = new ArrayList<>();
        final List<Formula> premises;
        final Selection selection;
        final List<InferenceRule> active;
        final int[] watermark;
        final Context ctx;
        final int depthLimit;
        boolean inconsistent;

        Pass(Formula goal, int stepBudget, Budget budget, long start) {
            this.goal = goal;
            this.stepBudget = stepBudget;
            this.budget = budget;
            this.start = start;
            premises = kb.all();
            for (var f : premises) assertFact(f);
            theorems.addAll(kb.theorems());
            selection = ModalStrategySelector.select(goal, premises, config.logicOverride());
            active = selection.rules(rules);
            watermark = new int[active.size()];
            var all = new ArrayList<Formula>(premises);
            all.add(goal);
            ctx = Context.of(goal, constants(all));
            depthLimit = all.stream().mapToInt(Formula::depth).max().orElse(1) + config.derivedDepthSlack();
        }

        ProofResult run() {
            if (index.contains(goal)) return result(ProofStatus.PROVED, "goal is a premise");
            while (true) {
                if (budget.exhausted()) return result(ProofStatus.TIMEOUT, interruption());
                if (steps.size() >= stepBudget)
                    return result(ProofStatus.DEPTH_EXCEEDED, "step budget of " + stepBudget + " exhausted");
                var step = fire();
                if (step == null) break;
                steps.add(step);
                if (step.derived().equals(goal)) return result(ProofStatus.PROVED, null);
            }
            if (budget.exhausted()) return result(ProofStatus.TIMEOUT, interruption());
            if (config.tableaux() && selection.modal()) return tableaux();
            return result(ProofStatus.UNKNOWN, "no rule applies to the " + facts.size() + " known facts");
        }

        private String interruption() {
            return budget.cancelled() ? "cancelled" : "time budget exhausted";
        }

        /** Applies the first rule, in order, that derives a new admissible fact. */
        private @Nullable ProofStep fire() {
            for (var ri = 0; ri < active.size(); ri++) {
                var rule = active.get(ri);
                var n = facts.size();
                for (var j = watermark[ri]; j < n; j++) {
                    if (budget.exhausted()) return null;
                    var b = facts.get(j);
                    if (rule.arity() == 1) {
                        var s = attempt(rule, List.of(b));
                        if (s != null) return s;
                        continue;
                    }
                    for (var i = 0; i <= j; i++) {
                        var a = facts.get(i);
                        var s = attempt(rule, List.of(a, b));
                        if (s == null && i != j) s = attempt(rule, List.of(b, a));
                        if (s != null) return s;
                    }
                }
                watermark[ri] = n;
            }
            return null;
        }

        private @Nullable ProofStep attempt(InferenceRule rule, List<Formula> from) {
            var fromTheorems = theorems.containsAll(from);
            if (rule.necessitation() && !fromTheorems) return null;
            for (var c : rule.apply(from, ctx)) {
                if (index.contains(c) || c.depth() > depthLimit) continue;
                if (rule.expansive() && !ctx.mentions(c)) continue;
                assertFact(c);
                if (fromTheorems) theorems.add(c);
                return new ProofStep(rule.name(), from, c, rule.description());
            }
            return null;
        }

        private void assertFact(Formula f) {
            if (!index.add(f)) return;
            facts.add(f);
            if ((f instanceof Formula.Not n && index.contains(n.body)) || index.contains(not(f))) {
                if (!inconsistent) warning("Premises are inconsistent: both " + f.text() + " and its negation hold");
                inconsistent = true;
            }
        }

        private ProofResult tableaux() {
            var t = new Tableaux(selection.temporalLogic(), selection.deonticLogic(), stepBudget, config.maxWorlds());
            var input = new ArrayList<>(facts);
            input.add(not(goal));
            var r = t.refute(input, budget);
            return switch (r.outcome()) {
                case CLOSED -> {
                    steps.add(new ProofStep(TABLEAUX_STEP, premises, goal,
                            "negated goal is unsatisfiable with the premises, " + r.reason()));
                    yield result(ProofStatus.PROVED, null);
                }
                case OPEN -> r.refuted()
                        ? result(ProofStatus.DISPROVED, "countermodel: " + r.describeCountermodel())
                        : result(ProofStatus.UNKNOWN, r.reason());
                case TIMEOUT -> result(ProofStatus.TIMEOUT, "tableaux " + r.reason());
                case STEP_LIMIT -> result(ProofStatus.DEPTH_EXCEEDED, "tableaux " + r.reason());
            };
        }

        private ProofResult result(ProofStatus status, @Nullable String message) {
            var elapsed = Duration.ofNanos(System.nanoTime() - start);
            return new ProofResult(status, steps, elapsed, NAME, false, inconsistent,
                    selection.logic(), message, List.of());
        }
    }
}
