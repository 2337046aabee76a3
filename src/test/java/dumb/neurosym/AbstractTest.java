package dumb.neurosym;

import dumb.neurosym.FormulaParser.ParseException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    protected final FormulaParser parser = new FormulaParser();

    protected Formula parse(String text) {
        try {
            return parser.parse(text);
        } catch (ParseException e) {
            return fail("Failed to parse formula:\n" + text + "\n" + e.getMessage());
        }
    }

    protected List<Formula> parseAll(String... texts) {
        var out = new ArrayList<Formula>(texts.length);
        for (var t : texts) out.add(parse(t));
        return out;
    }

    protected ProofResult prove(String goal, String... axioms) {
        return new InferenceEngine(new KnowledgeBase(parseAll(axioms))).prove(parse(goal));
    }

    protected static void assertStatus(ProofStatus expected, ProofResult r) {
        assertEquals(expected, r.status(), r::explain);
    }
}
