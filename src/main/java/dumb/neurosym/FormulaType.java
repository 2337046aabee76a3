package dumb.neurosym;

/** Coarse classification of a formula, used to rank provers. */
public enum FormulaType {
    PROPOSITIONAL, FOL, QUANTIFIED, ARITHMETIC, MODAL, TEMPORAL, DEONTIC, MIXED
}
