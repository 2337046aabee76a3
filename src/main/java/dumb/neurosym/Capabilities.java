package dumb.neurosym;

/** What a prover can handle; used by callers choosing among registered provers. */
public record Capabilities(boolean quantifiers, boolean arithmetic, boolean modal, boolean temporal,
                           boolean deontic, boolean proofTrace) {

    public static final Capabilities NONE = new Capabilities(false, false, false, false, false, false);

    public boolean handles(FormulaAnalysis a) {
        return switch (a.type()) {
            case PROPOSITIONAL -> true;
            case FOL, QUANTIFIED -> quantifiers;
            case ARITHMETIC -> arithmetic;
            case MODAL -> modal;
            case TEMPORAL -> temporal;
            case DEONTIC -> deontic;
            case MIXED -> (temporal || modal) && deontic;
        };
    }
}
