package dumb.neurosym;

import dumb.neurosym.FormulaAnalysis.Complexity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AnalyzerTests extends AbstractTest {

    private final FormulaAnalyzer analyzer = new FormulaAnalyzer();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "P ∧ Q → R                     | PROPOSITIONAL",
            "Likes(mary, father(bob))      | FOL",
            "∀x. ∃y. Loves(x, y)           | QUANTIFIED",
            "∀n. gt(succ(n), n)            | ARITHMETIC",
            "□P → ◊P                       | MODAL",
            "□X(P)                         | TEMPORAL",
            "P U Q                         | TEMPORAL",
            "O(P) → F(Q)                   | DEONTIC",
            "O(□P)                         | MIXED",
            "P(Q) ∧ X(R)                   | MIXED"
    })
    void classification(String formula, FormulaType type) {
        assertEquals(type, analyzer.analyze(parse(formula)).type());
    }

    @Test
    void arithmeticNamesAreCaseInsensitive() {
        assertEquals(FormulaType.ARITHMETIC, analyzer.analyze(parse("LT(a, b)")).type());
    }

    @Test
    void counts() {
        var a = analyzer.analyze(parse("∀x. (Man(x) → ¬Immortal(father(x)))"));
        assertEquals(1, a.quantifiers());
        assertEquals(1, a.quantifierDepth());
        assertEquals(1, a.connectives());
        assertEquals(1, a.negations());
        assertEquals(2, a.predicates());
        assertEquals(1, a.functions());
        assertEquals(3, a.nesting());
    }

    @Test
    void scores() {
        assertEquals(1, analyzer.analyze(parse("P")).score());
        assertEquals(7, analyzer.analyze(parse("P ∧ Q")).score());
        var q = analyzer.analyze(parse("∀x. ∃y. Loves(x, y)"));
        assertEquals(23, q.score());
        assertEquals(Complexity.LOW, q.complexity());
    }

    @Test
    void scoreIsClipped() {
        var sb = new StringBuilder();
        for (var i = 1; i <= 12; i++) sb.append("∀x").append(i).append(". ");
        sb.append("R(x1)");
        var a = analyzer.analyze(parse(sb.toString()));
        assertEquals(100, a.score());
        assertEquals(Complexity.HIGH, a.complexity());
    }

    @Test
    void buckets() {
        assertEquals(Complexity.LOW, Complexity.of(29));
        assertEquals(Complexity.MEDIUM, Complexity.of(30));
        assertEquals(Complexity.MEDIUM, Complexity.of(69));
        assertEquals(Complexity.HIGH, Complexity.of(70));
    }

    @Test
    void recommendationsComeFromTheTable() {
        assertEquals(List.of("native", "z3", "cvc5"), analyzer.analyze(parse("P")).recommended());
        assertEquals("z3", analyzer.analyze(parse("lt(a, b)")).recommended().get(0));
    }

    @Test
    void customTable() {
        var table = new ProverRecommendations(
                Map.of(FormulaType.MODAL, Map.of(Complexity.LOW, List.of("modal-prover"))),
                List.of("catch-all"));
        var custom = new FormulaAnalyzer(Set.of(), table);
        assertEquals(List.of("modal-prover"), custom.analyze(parse("□P")).recommended());
        assertEquals(List.of("catch-all"), custom.analyze(parse("P")).recommended());
    }

    @Test
    void missingTableFallsBackToNative() {
        var r = ProverRecommendations.load("no-such-table.json");
        assertEquals(ProverRecommendations.DEFAULT_FALLBACK, r.recommend(FormulaType.MIXED, Complexity.HIGH));
    }

    @Test
    void analysisIsPure() {
        var f = parse("O(P) → F(Q)");
        assertEquals(analyzer.analyze(f), analyzer.analyze(f));
        assertTrue(analyzer.analyze(f).modalOperators() > 0);
    }
}
