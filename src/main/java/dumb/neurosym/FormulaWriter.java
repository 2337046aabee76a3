package dumb.neurosym;

import dumb.neurosym.Formula.Binary;
import dumb.neurosym.Formula.BinaryTemporal;
import dumb.neurosym.Formula.Deontic;
import dumb.neurosym.Formula.Not;
import dumb.neurosym.Formula.Pred;
import dumb.neurosym.Formula.Quantified;
import dumb.neurosym.Formula.Temporal;
import dumb.neurosym.Formula.TemporalOp;
import dumb.neurosym.Term.Var;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical text form of a formula. Uses one fixed Unicode operator set and parenthesizes every binary
 * and quantified node, so the output reads back through {@link FormulaParser} as an equal formula.
 */
public final class FormulaWriter {

    static final Set<String> KEYWORDS = Set.of("forall", "exists", "always", "eventually", "next", "until", "since", "U", "S");
    /** Single letters that act as operators when immediately followed by '('. */
    static final Set<String> PREFIX_LETTERS = Set.of("O", "P", "F", "G", "X");

    private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern NUMBER = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private FormulaWriter() {
    }

    public static String write(Formula f) {
        var sb = new StringBuilder(f.size() * 4);
        write(f, Set.of(), sb);
        return sb.toString();
    }

    public static String write(Term t) {
        var sb = new StringBuilder();
        term(t, Set.of(), sb);
        return sb.toString();
    }

    static boolean plainIdentifier(String s) {
        return IDENT.matcher(s).matches() && !KEYWORDS.contains(s);
    }

    private static void write(Formula f, Set<Var> bound, StringBuilder sb) {
        if (f instanceof Pred p) {
            sb.append(p.name);
            if (!p.args.isEmpty()) {
                if (PREFIX_LETTERS.contains(p.name)) sb.append(' ');
                args(p.args, bound, sb);
            }
        } else if (f instanceof Not n) {
            sb.append('¬');
            write(n.body, bound, sb);
        } else if (f instanceof Binary b) {
            sb.append('(');
            write(b.left, bound, sb);
            sb.append(' ').append(b.op.symbol).append(' ');
            write(b.right, bound, sb);
            sb.append(')');
        } else if (f instanceof BinaryTemporal b) {
            sb.append('(');
            write(b.left, bound, sb);
            sb.append(' ').append(b.op.symbol).append(' ');
            write(b.right, bound, sb);
            sb.append(')');
        } else if (f instanceof Quantified q) {
            var inner = new HashSet<>(bound);
            inner.add(q.var);
            sb.append('(').append(q.op.symbol);
            if (plainIdentifier(q.var.name())) sb.append(q.var.name());
            else sb.append('?').append(q.var.name());
            sb.append(". ");
            write(q.body, inner, sb);
            sb.append(')');
        } else if (f instanceof Deontic d) {
            wrapped(d.op.symbol, d.body, bound, sb);
        } else if (f instanceof Temporal t) {
            if (t.op == TemporalOp.NEXT) {
                wrapped(t.op.symbol, t.body, bound, sb);
            } else {
                sb.append(t.op.symbol);
                write(t.body, bound, sb);
            }
        }
    }

    /** Operator letter immediately followed by a parenthesized body, without doubling the parentheses. */
    private static void wrapped(String symbol, Formula body, Set<Var> bound, StringBuilder sb) {
        sb.append(symbol);
        var selfParenthesized = body instanceof Binary || body instanceof BinaryTemporal || body instanceof Quantified;
        if (!selfParenthesized) sb.append('(');
        write(body, bound, sb);
        if (!selfParenthesized) sb.append(')');
    }

    private static void args(List<Term> args, Set<Var> bound, StringBuilder sb) {
        sb.append('(');
        for (var i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            term(args.get(i), bound, sb);
        }
        sb.append(')');
    }

    private static void term(Term t, Set<Var> bound, StringBuilder sb) {
        if (t instanceof Var v) {
            if (bound.contains(v) && plainIdentifier(v.name())) sb.append(v.name());
            else sb.append('?').append(v.name());
        } else if (t instanceof Term.Const c) {
            var n = c.name();
            if (NUMBER.matcher(n).matches() || (plainIdentifier(n) && !bound.contains(Var.of(n)))) sb.append(n);
            else quote(n, sb);
        } else if (t instanceof Term.Fn fn) {
            sb.append(fn.name());
            args(fn.args, bound, sb);
        }
    }

    private static void quote(String s, StringBuilder sb) {
        sb.append('"');
        for (var i = 0; i < s.length(); i++) {
            var c = s.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        sb.append('"');
    }
}
