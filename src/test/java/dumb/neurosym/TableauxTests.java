package dumb.neurosym;

import dumb.neurosym.Tableaux.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TableauxTests extends AbstractTest {

    private static Budget budget() {
        return Budget.of(Duration.ofSeconds(5));
    }

    private boolean valid(String formula, ModalLogic logic) {
        return new Tableaux(logic).prove(parse(formula), budget()).closed();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "□P → P              | T  | K",
            "□P → □□P            | S4 | K",
            "◊P → □◊P            | S5 | S4",
            "□P → ◊P             | D  | K",
            "O(P) → P(P)         | D  | K",
            "F(P) → ¬P(P)        | K  | K"
    })
    void validityDependsOnFrame(String formula, ModalLogic validIn, ModalLogic checkedIn) {
        assertTrue(valid(formula, validIn), formula + " in " + validIn);
        if (validIn != checkedIn) assertFalse(valid(formula, checkedIn), formula + " in " + checkedIn);
    }

    @Test
    void distributionHoldsEverywhere() {
        for (var logic : ModalLogic.values())
            assertTrue(valid("□(P → Q) → (□P → □Q)", logic), logic.name());
    }

    @Test
    void propositionalTautologies() {
        assertTrue(valid("P ∨ ¬P", ModalLogic.K));
        assertTrue(valid("(P → Q) ∧ (Q → R) → (P → R)", ModalLogic.K));
        assertTrue(valid("¬(P ∧ Q) ↔ (¬P ∨ ¬Q)", ModalLogic.K));
        assertFalse(valid("P → Q", ModalLogic.S5));
    }

    @Test
    void countermodelIsReported() {
        var r = new Tableaux(ModalLogic.S4).prove(parse("◊P → □P"), budget());
        assertEquals(Outcome.OPEN, r.outcome());
        assertTrue(r.refuted());
        assertTrue(r.countermodel().size() >= 2, r::describeCountermodel);
        assertTrue(r.describeCountermodel().contains("P"), r::describeCountermodel);
    }

    @Test
    void siblingWitnessesStaySeparate() {
        var r = new Tableaux(ModalLogic.S4).refute(parseAll("◊(P ∧ Q ∧ ◊¬P)", "◊(□P ∧ ◊Q)"), budget());
        assertEquals(Outcome.OPEN, r.outcome(), r::reason);
        assertTrue(r.refuted(), r::describeCountermodel);
    }

    @Test
    void transitiveLoopsAreBlocked() {
        var r = new Tableaux(ModalLogic.S4).refute(parseAll("□◊P", "□◊¬P"), budget());
        assertEquals(Outcome.OPEN, r.outcome(), r::reason);
        assertTrue(r.countermodel().size() < 8, r::describeCountermodel);
        assertTrue(valid("□◊P ∧ □(P → □Q) → ◊□Q ∨ ◊Q", ModalLogic.S4));
    }

    @Test
    void separateRelationsForTimeAndObligation() {
        var t = new Tableaux(ModalLogic.S4, ModalLogic.D, Tableaux.DEFAULT_MAX_STEPS, 64);
        assertTrue(t.prove(parse("□P → P"), budget()).closed());
        assertTrue(t.prove(parse("O(P) → P(P)"), budget()).closed());
        assertFalse(t.prove(parse("O(P) → P"), budget()).closed());
    }

    @Test
    void nextIsFunctional() {
        var t = new Tableaux(ModalLogic.K);
        assertTrue(t.prove(parse("X(P → Q) → (X(P) → X(Q))"), budget()).closed());
        assertTrue(t.prove(parse("¬X(P) → X(¬P)"), budget()).closed());
    }

    @Test
    void quantifiersAreOpaque() {
        var r = new Tableaux(ModalLogic.K).prove(parse("forall x. Man(x)"), budget());
        assertEquals(Outcome.OPEN, r.outcome());
        assertTrue(r.opaque());
        assertFalse(r.refuted());
    }

    @Test
    void unsatisfiableSet() {
        var r = new Tableaux(ModalLogic.K).refute(parseAll("□P", "◊¬P"), budget());
        assertTrue(r.closed());
        assertEquals(r.totalBranches(), r.closedBranches());
    }

    @Test
    void stepLimit() {
        var t = new Tableaux(ModalLogic.K, ModalLogic.K, 3, 64);
        var r = t.prove(parse("(A ∨ B) ∧ (C ∨ D) ∧ (E ∨ G) → H"), budget());
        assertEquals(Outcome.STEP_LIMIT, r.outcome());
    }

    @Test
    void worldLimit() {
        var t = new Tableaux(ModalLogic.K, ModalLogic.K, 1000, 1);
        var r = t.refute(parseAll("◊P", "◊Q", "◊R"), budget());
        assertEquals(Outcome.STEP_LIMIT, r.outcome());
        assertTrue(r.reason().contains("world"), r.reason());
    }

    @Test
    void cancellation() {
        var b = budget();
        b.cancel();
        var r = new Tableaux(ModalLogic.S5).refute(List.of(parse("◊P")), b);
        assertEquals(Outcome.TIMEOUT, r.outcome());
    }
}
