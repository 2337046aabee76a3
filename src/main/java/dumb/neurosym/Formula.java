package dumb.neurosym;

import com.fasterxml.jackson.annotation.JsonValue;
import dumb.neurosym.Term.Var;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Immutable logical formula: first-order logic extended with deontic and temporal operators.
 * <p>
 * Equality is structural and hashes are deterministic. Every node knows its depth at construction
 * and no node may be deeper than {@link #MAX_DEPTH}, whatever built it.
 */
public abstract sealed class Formula permits Formula.Pred, Formula.Not, Formula.Binary, Formula.Quantified,
        Formula.Deontic, Formula.Temporal, Formula.BinaryTemporal {

    public static final int MAX_DEPTH = 4096;

    private final int depth;
    private final int size;
    private volatile String text;
    private int hash;

    Formula(int depth, int size) {
        if (depth > MAX_DEPTH)
            throw new IllegalArgumentException("Formula depth " + depth + " exceeds the limit of " + MAX_DEPTH);
        this.depth = depth;
        this.size = size;
    }

    public static Pred atom(String name) {
        return new Pred(name, List.of());
    }

    public static Pred pred(String name, Term... args) {
        return new Pred(name, List.of(args));
    }

    public static Not not(Formula f) {
        return new Not(f);
    }

    public static Binary and(Formula l, Formula r) {
        return new Binary(Connective.AND, l, r);
    }

    public static Binary or(Formula l, Formula r) {
        return new Binary(Connective.OR, l, r);
    }

    public static Binary implies(Formula l, Formula r) {
        return new Binary(Connective.IMPLIES, l, r);
    }

    public static Binary iff(Formula l, Formula r) {
        return new Binary(Connective.IFF, l, r);
    }

    public static Binary xor(Formula l, Formula r) {
        return new Binary(Connective.XOR, l, r);
    }

    public static Quantified forall(Var v, Formula body) {
        return new Quantified(Quantifier.FORALL, v, body);
    }

    public static Quantified exists(Var v, Formula body) {
        return new Quantified(Quantifier.EXISTS, v, body);
    }

    public static Deontic obligatory(Formula f) {
        return new Deontic(DeonticOp.OBLIGATORY, f);
    }

    public static Deontic permitted(Formula f) {
        return new Deontic(DeonticOp.PERMITTED, f);
    }

    public static Deontic forbidden(Formula f) {
        return new Deontic(DeonticOp.FORBIDDEN, f);
    }

    public static Temporal always(Formula f) {
        return new Temporal(TemporalOp.ALWAYS, f);
    }

    public static Temporal eventually(Formula f) {
        return new Temporal(TemporalOp.EVENTUALLY, f);
    }

    public static Temporal next(Formula f) {
        return new Temporal(TemporalOp.NEXT, f);
    }

    public static BinaryTemporal until(Formula l, Formula r) {
        return new BinaryTemporal(BinaryTemporalOp.UNTIL, l, r);
    }

    public static BinaryTemporal since(Formula l, Formula r) {
        return new BinaryTemporal(BinaryTemporalOp.SINCE, l, r);
    }

    private static int depthOf(Formula... children) {
        var d = 0;
        for (var c : children) d = Math.max(d, c.depth);
        return d + 1;
    }

    private static int sizeOf(Formula... children) {
        var s = 1;
        for (var c : children) s += c.size;
        return s;
    }

    public final int depth() {
        return depth;
    }

    /** Number of formula nodes. */
    public final int size() {
        return size;
    }

    public abstract List<Formula> children();

    public abstract Set<Var> freeVars();

    /** Replaces free occurrences of {@code v}, renaming bound variables that would capture the replacement. */
    public abstract Formula subst(Var v, Term replacement);

    abstract int computeHash();

    /** This formula and all of its subformulas, pre-order. */
    public final List<Formula> subformulas() {
        var out = new ArrayList<Formula>(size);
        var stack = new ArrayDeque<Formula>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var f = stack.pop();
            out.add(f);
            var c = f.children();
            for (var i = c.size() - 1; i >= 0; i--) stack.push(c.get(i));
        }
        return out;
    }

    public final boolean has(Predicate<Formula> test) {
        return subformulas().stream().anyMatch(test);
    }

    /** Canonical text, see {@link FormulaWriter}. */
    @JsonValue
    public final String text() {
        var t = text;
        if (t == null) text = t = FormulaWriter.write(this);
        return t;
    }

    @Override
    public final int hashCode() {
        var h = hash;
        if (h == 0) {
            h = computeHash();
            if (h == 0) h = 1;
            hash = h;
        }
        return h;
    }

    @Override
    public final String toString() {
        return text();
    }

    public enum Connective {
        AND("∧"), OR("∨"), IMPLIES("→"), IFF("↔"), XOR("⊕");

        public final String symbol;

        Connective(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum Quantifier {
        FORALL("∀"), EXISTS("∃");

        public final String symbol;

        Quantifier(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum DeonticOp {
        OBLIGATORY("O"), PERMITTED("P"), FORBIDDEN("F");

        public final String symbol;

        DeonticOp(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum TemporalOp {
        ALWAYS("□"), EVENTUALLY("◊"), NEXT("X");

        public final String symbol;

        TemporalOp(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum BinaryTemporalOp {
        UNTIL("U"), SINCE("S");

        public final String symbol;

        BinaryTemporalOp(String symbol) {
            this.symbol = symbol;
        }
    }

    /** Predicate application; with no arguments it is a propositional atom. */
    public static final class Pred extends Formula {
        public final String name;
        public final List<Term> args;

        public Pred(String name, List<Term> args) {
            super(1, 1);
            this.name = requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Empty predicate name");
            this.args = List.copyOf(args);
        }

        public boolean propositional() {
            return args.isEmpty();
        }

        @Override
        public List<Formula> children() {
            return List.of();
        }

        @Override
        public Set<Var> freeVars() {
            var s = new LinkedHashSet<Var>();
            args.forEach(a -> s.addAll(a.vars()));
            return s;
        }

        @Override
        public Formula subst(Var v, Term replacement) {
            if (args.isEmpty()) return this;
            var changed = false;
            var next = new ArrayList<Term>(args.size());
            for (var a : args) {
                var b = a.subst(v, replacement);
                changed |= b != a;
                next.add(b);
            }
            return changed ? new Pred(name, next) : this;
        }

        @Override
        int computeHash() {
            return 31 * name.hashCode() + args.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Pred p && hashCode() == p.hashCode() && name.equals(p.name) && args.equals(p.args));
        }
    }

    public static final class Not extends Formula {
        public final Formula body;

        public Not(Formula body) {
            super(depthOf(body), sizeOf(body));
            this.body = body;
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        public Set<Var> freeVars() {
            return body.freeVars();
        }

        @Override
        public Formula subst(Var v, Term replacement) {
            var b = body.subst(v, replacement);
            return b == body ? this : new Not(b);
        }

        @Override
        int computeHash() {
            return 7 * 31 + body.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Not n && hashCode() == n.hashCode() && body.equals(n.body));
        }
    }

    public static final class Binary extends Formula {
        public final Connective op;
        public final Formula left, right;

        public Binary(Connective op, Formula left, Formula right) {
            super(depthOf(left, right), sizeOf(left, right));
            this.op = requireNonNull(op);
            this.left = left;
            this.right = right;
        }

        @Override
        public List<Formula> children() {
            return List.of(left, right);
        }

        @Override
        public Set<Var> freeVars() {
            var s = new LinkedHashSet<>(left.freeVars());
            s.addAll(right.freeVars());
            return s;
        }

        @Override
        public Formula subst(Var v, Term replacement) {
            var l = left.subst(v, replacement);
            var r = right.subst(v, replacement);
            return l == left && r == right ? this : new Binary(op, l, r);
        }

        @Override
        int computeHash() {
            return ((op.ordinal() + 17) * 31 + left.hashCode()) * 31 + right.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Binary b && hashCode() == b.hashCode() && op == b.op
                    && left.equals(b.left) && right.equals(b.right));
        }
    }

    public static final class Quantified extends Formula {
        public final Quantifier op;
        public final Var var;
        public final Formula body;

        public Quantified(Quantifier op, Var var, Formula body) {
            super(depthOf(body), sizeOf(body));
            this.op = requireNonNull(op);
            this.var = requireNonNull(var);
            this.body = body;
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        public Set<Var> freeVars() {
            var s = new LinkedHashSet<>(body.freeVars());
            s.remove(var);
            return s;
        }

        /** The body with the bound variable replaced by {@code t}. */
        public Formula instantiate(Term t) {
            return body.subst(var, t);
        }

        @Override
        public Formula subst(Var v, Term replacement) {
            if (v.equals(var) || !body.freeVars().contains(v)) return this;
            if (replacement.vars().contains(var)) {
                var used = new HashSet<Var>(body.freeVars());
                used.addAll(replacement.vars());
                var fresh = var;
                for (var i = 1; used.contains(fresh); i++) fresh = Var.of(var.name() + i);
                var renamed = body.subst(var, fresh);
                return new Quantified(op, fresh, renamed.subst(v, replacement));
            }
            return new Quantified(op, var, body.subst(v, replacement));
        }

        @Override
        int computeHash() {
            return ((op.ordinal() + 23) * 31 + var.hashCode()) * 31 + body.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Quantified q && hashCode() == q.hashCode() && op == q.op
                    && var.equals(q.var) && body.equals(q.body));
        }
    }

    public static final class Deontic extends Formula {
        public final DeonticOp op;
        public final Formula body;

        public Deontic(DeonticOp op, Formula body) {
            super(depthOf(body), sizeOf(body));
            this.op = requireNonNull(op);
            this.body = body;
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        public Set<Var> freeVars() {
            return body.freeVars();
        }

        @Override
        public Formula subst(Var v, Term replacement) {
            var b = body.subst(v, replacement);
            return b == body ? this : new Deontic(op, b);
        }

        @Override
        int computeHash() {
            return (op.ordinal() + 41) * 31 + body.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Deontic d && hashCode() == d.hashCode() && op == d.op && body.equals(d.body));
        }
    }

    public static final class Temporal extends Formula {
        public final TemporalOp op;
        public final Formula body;

        public Temporal(TemporalOp op, Formula body) {
            super(depthOf(body), sizeOf(body));
            this.op = requireNonNull(op);
            this.body = body;
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        public Set<Var> freeVars() {
            return body.freeVars();
        }

        @Override
        public Formula subst(Var v, Term replacement) {
            var b = body.subst(v, replacement);
            return b == body ? this : new Temporal(op, b);
        }

        @Override
        int computeHash() {
            return (op.ordinal() + 53) * 31 + body.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Temporal t && hashCode() == t.hashCode() && op == t.op && body.equals(t.body));
        }
    }

    public static final class BinaryTemporal extends Formula {
        public final BinaryTemporalOp op;
        public final Formula left, right;

        public BinaryTemporal(BinaryTemporalOp op, Formula left, Formula right) {
            super(depthOf(left, right), sizeOf(left, right));
            this.op = requireNonNull(op);
            this.left = left;
            this.right = right;
        }

        @Override
        public List<Formula> children() {
            return List.of(left, right);
        }

        @Override
        public Set<Var> freeVars() {
            var s = new LinkedHashSet<>(left.freeVars());
            s.addAll(right.freeVars());
            return s;
        }

        @Override
        public Formula subst(Var v, Term replacement) {
            var l = left.subst(v, replacement);
            var r = right.subst(v, replacement);
            return l == left && r == right ? this : new BinaryTemporal(op, l, r);
        }

        @Override
        int computeHash() {
            return ((op.ordinal() + 67) * 31 + left.hashCode()) * 31 + right.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof BinaryTemporal b && hashCode() == b.hashCode() && op == b.op
                    && left.equals(b.left) && right.equals(b.right));
        }
    }
}
