package dumb.neurosym;

import dumb.neurosym.Config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static dumb.neurosym.Formula.atom;
import static dumb.neurosym.Formula.implies;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EngineTests extends AbstractTest {

    @Test
    void modusPonensInOneStep() {
        var r = prove("Q", "P", "P -> Q");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals(1, r.steps().size());
        var step = r.steps().get(0);
        assertEquals("ModusPonens", step.rule());
        assertEquals(List.of(atom("P"), implies(atom("P"), atom("Q"))), step.premises());
        assertEquals(atom("Q"), step.derived());
        assertEquals(InferenceEngine.NAME, r.prover());
        assertEquals(ModalLogic.K, r.logic());
    }

    @Test
    void goalAlreadyKnown() {
        var r = prove("P", "P");
        assertStatus(ProofStatus.PROVED, r);
        assertTrue(r.steps().isEmpty());
    }

    @Test
    void unrelatedGoalIsUnknownNotDisproved() {
        var r = prove("Q", "P");
        assertStatus(ProofStatus.UNKNOWN, r);
        assertFalse(r.isDefinitive());
    }

    @Test
    void chainedModusPonens() {
        var r = prove("S", "P", "P -> Q", "Q -> R", "R -> S");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals(3, r.steps().size());
        assertTrue(r.steps().stream().allMatch(s -> s.rule().equals("ModusPonens")), r::explain);
    }

    @Test
    void modusTollens() {
        var r = prove("~P", "P -> Q", "~Q");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("ModusTollens", r.steps().get(r.steps().size() - 1).rule());
    }

    @Test
    void disjunctiveSyllogism() {
        var r = prove("Q", "P | Q", "~P");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("DisjunctiveSyllogism", r.steps().get(0).rule());
    }

    @Test
    void conjunctionIsBuiltOnlyTowardsTheGoal() {
        var r = prove("P & Q", "P", "Q", "R");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals(1, r.steps().size());
        assertEquals("ConjunctionIntroduction", r.steps().get(0).rule());
    }

    @Test
    void disjunctionIntroduction() {
        var r = prove("R | Q", "Q");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("DisjunctionIntroductionRight", r.steps().get(0).rule());
    }

    @Test
    void universalInstantiation() {
        var r = prove("Mortal(socrates)", "forall x. Man(x) -> Mortal(x)", "Man(socrates)");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals(List.of("UniversalInstantiation", "ModusPonens"), r.steps().stream().map(ProofStep::rule).toList());
    }

    @Test
    void existentialGeneralization() {
        var r = prove("exists x. Man(x)", "Man(socrates)");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("ExistentialGeneralization", r.steps().get(0).rule());
    }

    @Test
    void deonticK() {
        var r = prove("O(Q)", "O(P)", "O(P -> Q)");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("DeonticKAxiom", r.steps().get(0).rule());
        assertEquals(ModalLogic.D, r.logic());
    }

    @Test
    void temporalK() {
        var r = prove("□Q", "□(P -> Q)", "□P");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("TemporalKAxiom", r.steps().get(0).rule());
        assertEquals(ModalLogic.S4, r.logic());
    }

    @Test
    void reflexiveTemporalAxiom() {
        var r = prove("P", "□P");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("TemporalTAxiom", r.steps().get(0).rule());
    }

    @Test
    void necessitationNeedsATheorem() {
        var kb = new KnowledgeBase();
        kb.addTheorem(parse("P -> P"));
        var r = new InferenceEngine(kb).prove(parse("□(P -> P)"));
        assertStatus(ProofStatus.PROVED, r);
        assertEquals("AlwaysNecessitation", r.steps().get(0).rule());

        var contingent = prove("□P", "P");
        assertStatus(ProofStatus.DISPROVED, contingent);
        assertTrue(contingent.steps().stream().noneMatch(s -> s.rule().equals("AlwaysNecessitation")));
    }

    @Test
    void tableauxProvesWhatChainingCannot() {
        var r = prove("□P -> ◊P");
        assertStatus(ProofStatus.PROVED, r);
        assertEquals(1, r.steps().size());
        assertEquals(InferenceEngine.TABLEAUX_STEP, r.steps().get(0).rule());
    }

    @Test
    void tableauxFindsCountermodel() {
        var r = prove("◊P -> □P");
        assertStatus(ProofStatus.DISPROVED, r);
        assertNotNull(r.message());
        assertTrue(r.message().startsWith("countermodel"), r.message());
    }

    @Test
    void satisfiableModalSetIsNotProvedUnsatisfiable() {
        var r = prove("¬(◊(P ∧ Q ∧ ◊¬P) ∧ ◊(□P ∧ ◊Q))");
        assertStatus(ProofStatus.DISPROVED, r);
        assertEquals(ModalLogic.S4, r.logic());
    }

    @Test
    void logicOverride() {
        var goal = parse("□P -> P");
        assertStatus(ProofStatus.PROVED, new InferenceEngine(new KnowledgeBase()).prove(goal));
        var k = new InferenceEngine(new KnowledgeBase(), new EngineConfig().withLogic(ModalLogic.K)).prove(goal);
        assertStatus(ProofStatus.DISPROVED, k);
        assertEquals(ModalLogic.K, k.logic());
    }

    @Test
    void untilIsOpaqueToTheTableaux() {
        assertStatus(ProofStatus.UNKNOWN, prove("P U Q"));
    }

    @Test
    void tableauxCanBeDisabled() {
        var config = new EngineConfig(1000, 5000L, 2, false, 256, null);
        var r = new InferenceEngine(new KnowledgeBase(), config).prove(parse("□P -> ◊P"));
        assertStatus(ProofStatus.UNKNOWN, r);
    }

    @Test
    void stepBudget() {
        var engine = new InferenceEngine(new KnowledgeBase(parseAll("P", "P -> Q", "Q -> R", "R -> S")));
        var r = engine.prove(parse("S"), 1, Duration.ofSeconds(5));
        assertStatus(ProofStatus.DEPTH_EXCEEDED, r);
        assertEquals(1, r.steps().size());
    }

    @Test
    void cancelledBudget() {
        var budget = Budget.of(Duration.ofSeconds(5));
        budget.cancel();
        var r = new InferenceEngine(new KnowledgeBase(parseAll("P", "P -> Q"))).prove(parse("Q"), 100, budget);
        assertStatus(ProofStatus.TIMEOUT, r);
        assertEquals("cancelled", r.message());
    }

    @Test
    void deepProgrammaticInputStaysWithinBudget() {
        Formula f = atom("P");
        for (var i = 0; i < 2000; i++) f = Formula.always(f);
        var r = new InferenceEngine(KnowledgeBase.of(f)).prove(atom("Q"), 50, Duration.ofSeconds(5));
        assertTrue(r.status() == ProofStatus.DEPTH_EXCEEDED || r.status() == ProofStatus.TIMEOUT
                || r.status() == ProofStatus.UNKNOWN || r.status() == ProofStatus.DISPROVED, r::explain);
        assertTrue(r.steps().size() <= 50);
    }

    @Test
    void inconsistentPremisesAreReported() {
        var r = prove("R", "P", "P -> Q", "~Q");
        assertTrue(r.inconsistent(), r::explain);
        assertFalse(r.isProved());
        assertTrue(r.explain().contains("inconsistent"));
    }

    @Test
    void knowledgeBaseIsNotModified() {
        var kb = new KnowledgeBase(parseAll("P", "P -> Q"));
        new InferenceEngine(kb).prove(parse("Q"));
        assertEquals(2, kb.size());
    }

    @Test
    void resultSerializes() {
        var json = prove("Q", "P", "P -> Q").toJson();
        assertEquals("PROVED", json.get("status").asText());
        assertEquals("ModusPonens", json.get("steps").get(0).get("rule").asText());
        assertEquals("Q", json.get("steps").get(0).get("derived").asText());
    }

    @Test
    void explainListsSteps() {
        var text = prove("S", "P", "P -> Q", "Q -> R", "R -> S").explain();
        assertTrue(text.startsWith("PROVED by native"), text);
        assertTrue(text.contains("3. "), text);
    }
}
