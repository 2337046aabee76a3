package dumb.neurosym;

import dumb.neurosym.Config.AnalyzerConfig;
import dumb.neurosym.FormulaAnalysis.Complexity;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Classifies formulas and scores their complexity. Stateless after construction. */
public class FormulaAnalyzer {

    private final Set<String> arithmetic;
    private final ProverRecommendations recommendations;

    public FormulaAnalyzer() {
        this(new AnalyzerConfig());
    }

    public FormulaAnalyzer(AnalyzerConfig config) {
        this(config.arithmeticPredicates(), ProverRecommendations.load(config.recommendations()));
    }

    public FormulaAnalyzer(Set<String> arithmeticPredicates, ProverRecommendations recommendations) {
        this.arithmetic = arithmeticPredicates.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        this.recommendations = requireNonNull(recommendations);
    }

    public ProverRecommendations recommendations() {
        return recommendations;
    }

    public FormulaAnalysis analyze(Formula f) {
        var c = new Counts();
        c.visit(f, 0);

        var nesting = f.depth() - 1;
        var raw = 3 * nesting + 8 * c.quantifierDepth + 2 * c.connectives + 4 * (c.temporal + c.deontic)
                + 6 * c.binaryTemporal + c.predicates + 2 * c.functions;
        var score = Math.max(0, Math.min(100, raw));
        var complexity = Complexity.of(score);
        var type = classify(c);
        return new FormulaAnalysis(type, nesting, c.quantifierDepth, c.negations, c.connectives, c.quantifiers,
                c.temporal, c.binaryTemporal, c.deontic, c.predicates, c.functions, score, complexity,
                recommendations.recommend(type, complexity));
    }

    private static FormulaType classify(Counts c) {
        var timed = c.next > 0 || c.binaryTemporal > 0;
        var modal = c.temporal > c.next;
        if (c.deontic > 0) return timed || modal ? FormulaType.MIXED : FormulaType.DEONTIC;
        if (timed) return FormulaType.TEMPORAL;
        if (modal) return FormulaType.MODAL;
        if (c.arithmetic) return FormulaType.ARITHMETIC;
        if (c.quantifiers > 0) return FormulaType.QUANTIFIED;
        if (c.firstOrder) return FormulaType.FOL;
        return FormulaType.PROPOSITIONAL;
    }

    private final class Counts {
        int quantifierDepth, negations, connectives, quantifiers, temporal, next, binaryTemporal, deontic,
                predicates, functions;
        boolean arithmetic, firstOrder;

        void visit(Formula f, int q) {
            if (f instanceof Formula.Pred p) {
                predicates++;
                if (!p.args.isEmpty()) firstOrder = true;
                if (FormulaAnalyzer.this.arithmetic.contains(p.name.toLowerCase(Locale.ROOT))) arithmetic = true;
                p.args.forEach(this::term);
            } else if (f instanceof Formula.Not) {
                negations++;
            } else if (f instanceof Formula.Binary) {
                connectives++;
            } else if (f instanceof Formula.Quantified) {
                quantifiers++;
                q++;
                quantifierDepth = Math.max(quantifierDepth, q);
            } else if (f instanceof Formula.Temporal t) {
                temporal++;
                if (t.op == Formula.TemporalOp.NEXT) next++;
            } else if (f instanceof Formula.BinaryTemporal) {
                binaryTemporal++;
            } else if (f instanceof Formula.Deontic) {
                deontic++;
            }
            for (var c : f.children()) visit(c, q);
        }

        void term(Term t) {
            if (t instanceof Term.Fn fn) {
                functions++;
                fn.args.forEach(this::term);
            }
        }
    }
}
