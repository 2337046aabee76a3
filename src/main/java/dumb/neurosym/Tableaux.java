package dumb.neurosym;

import dumb.neurosym.Formula.Binary;
import dumb.neurosym.Formula.BinaryTemporal;
import dumb.neurosym.Formula.Deontic;
import dumb.neurosym.Formula.Not;
import dumb.neurosym.Formula.Pred;
import dumb.neurosym.Formula.Quantified;
import dumb.neurosym.Formula.Temporal;
import dumb.neurosym.ModalLogic.Frame;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static dumb.neurosym.Formula.not;
import static java.util.Objects.requireNonNull;

/**
 * Labelled tableaux for multi-modal formulas. Each world holds a set of formulas; worlds are linked by one
 * accessibility relation per modality. {@code □ ◊} use the temporal relation, {@code O P F} the deontic
 * relation and {@code X} a functional successor relation. Quantified and until/since formulas are treated
 * as opaque literals; an open branch that contains them is not reported as a countermodel.
 */
public class Tableaux {

    public static final int DEFAULT_MAX_STEPS = 10_000;

    private final ModalLogic temporalLogic;
    private final ModalLogic deonticLogic;
    private final int maxSteps;
    private final int maxWorlds;

    public Tableaux(ModalLogic logic) {
        this(logic, logic, DEFAULT_MAX_STEPS, Config.EngineConfig.DEFAULT_MAX_WORLDS);
    }

    public Tableaux(ModalLogic temporalLogic, ModalLogic deonticLogic, int maxSteps, int maxWorlds) {
        this.temporalLogic = requireNonNull(temporalLogic);
        this.deonticLogic = requireNonNull(deonticLogic);
        if (maxSteps < 1 || maxWorlds < 1) throw new IllegalArgumentException("Tableaux limits must be positive");
        this.maxSteps = maxSteps;
        this.maxWorlds = maxWorlds;
    }

    /** Validity of {@code f}: the tableau for {@code ¬f} closes. */
    public Result prove(Formula f, Budget budget) {
        return refute(List.of(not(f)), budget);
    }

    /** Tries to build a model of all formulas at one world; CLOSED means they are jointly unsatisfiable. */
    public Result refute(Collection<Formula> formulas, Budget budget) {
        var root = new Branch();
        var w0 = root.newWorld();
        for (var f : formulas) root.add(w0, f);
        var pending = new ArrayDeque<Branch>();
        pending.push(root);
        int total = 1, closed = 0, steps = 0;
        while (!pending.isEmpty()) {
            var b = pending.pop();
            while (true) {
                if (b.closed) {
                    closed++;
                    break;
                }
                if (budget.exhausted())
                    return new Result(Outcome.TIMEOUT, total, closed, List.of(), steps, b.opaque, budget.cancelled() ? "cancelled" : "deadline passed");
                if (++steps > maxSteps)
                    return new Result(Outcome.STEP_LIMIT, total, closed, List.of(), steps, b.opaque, "step limit of " + maxSteps + " reached");
                if (b.worlds.size() > maxWorlds)
                    return new Result(Outcome.STEP_LIMIT, total, closed, List.of(), steps, b.opaque, "world limit of " + maxWorlds + " reached");
                var alternatives = b.step();
                if (alternatives == null) {
                    var reason = b.opaque ? "open branch depends on opaque formulas" : "open branch";
                    return new Result(Outcome.OPEN, total, closed, b.view(), steps, b.opaque, reason);
                }
                for (var alt : alternatives) {
                    pending.push(alt);
                    total++;
                }
            }
        }
        return new Result(Outcome.CLOSED, total, closed, List.of(), steps, false, "all " + total + " branches closed");
    }

    private ModalLogic logicOf(Relation r) {
        return switch (r) {
            case TEMPORAL -> temporalLogic;
            case DEONTIC -> deonticLogic;
            case NEXT -> ModalLogic.D;
        };
    }

    static Expansion classify(Formula f) {
        if (f instanceof Pred) return Expansion.LITERAL;
        if (f instanceof Quantified || f instanceof BinaryTemporal) return Expansion.OPAQUE;
        if (f instanceof Binary b) {
            return switch (b.op) {
                case AND -> Expansion.alpha(b.left, b.right);
                case OR -> Expansion.beta(List.of(b.left), List.of(b.right));
                case IMPLIES -> Expansion.beta(List.of(not(b.left)), List.of(b.right));
                case IFF -> Expansion.beta(List.of(b.left, b.right), List.of(not(b.left), not(b.right)));
                case XOR -> Expansion.beta(List.of(b.left, not(b.right)), List.of(not(b.left), b.right));
            };
        }
        if (f instanceof Temporal t) {
            return switch (t.op) {
                case ALWAYS -> Expansion.box(Relation.TEMPORAL, t.body);
                case EVENTUALLY -> Expansion.diamond(Relation.TEMPORAL, t.body);
                case NEXT -> Expansion.box(Relation.NEXT, t.body);
            };
        }
        if (f instanceof Deontic d) {
            return switch (d.op) {
                case OBLIGATORY -> Expansion.box(Relation.DEONTIC, d.body);
                case PERMITTED -> Expansion.diamond(Relation.DEONTIC, d.body);
                case FORBIDDEN -> Expansion.box(Relation.DEONTIC, not(d.body));
            };
        }
        var g = ((Not) f).body;
        if (g instanceof Pred) return Expansion.LITERAL;
        if (g instanceof Quantified || g instanceof BinaryTemporal) return Expansion.OPAQUE;
        if (g instanceof Not n) return Expansion.alpha(n.body);
        if (g instanceof Binary b) {
            return switch (b.op) {
                case AND -> Expansion.beta(List.of(not(b.left)), List.of(not(b.right)));
                case OR -> Expansion.alpha(not(b.left), not(b.right));
                case IMPLIES -> Expansion.alpha(b.left, not(b.right));
                case IFF -> Expansion.beta(List.of(b.left, not(b.right)), List.of(not(b.left), b.right));
                case XOR -> Expansion.beta(List.of(b.left, b.right), List.of(not(b.left), not(b.right)));
            };
        }
        if (g instanceof Temporal t) {
            return switch (t.op) {
                case ALWAYS -> Expansion.diamond(Relation.TEMPORAL, not(t.body));
                case EVENTUALLY -> Expansion.box(Relation.TEMPORAL, not(t.body));
                case NEXT -> Expansion.box(Relation.NEXT, not(t.body));
            };
        }
        var d = (Deontic) g;
        return switch (d.op) {
            case OBLIGATORY -> Expansion.diamond(Relation.DEONTIC, not(d.body));
            case PERMITTED -> Expansion.box(Relation.DEONTIC, not(d.body));
            case FORBIDDEN -> Expansion.diamond(Relation.DEONTIC, d.body);
        };
    }

    public enum Relation {
        TEMPORAL, DEONTIC, NEXT
    }

    public enum Outcome {
        /** Every branch closed: the input is unsatisfiable. */
        CLOSED,
        /** A saturated open branch was found. */
        OPEN,
        TIMEOUT,
        STEP_LIMIT
    }

    enum Kind {
        LITERAL, OPAQUE, ALPHA, BETA, BOX, DIAMOND
    }

    record Expansion(Kind kind, List<List<Formula>> parts, @Nullable Relation relation, @Nullable Formula body) {
        static final Expansion LITERAL = new Expansion(Kind.LITERAL, List.of(), null, null);
        static final Expansion OPAQUE = new Expansion(Kind.OPAQUE, List.of(), null, null);

        static Expansion alpha(Formula... parts) {
            return new Expansion(Kind.ALPHA, List.of(List.of(parts)), null, null);
        }

        static Expansion beta(List<Formula> a, List<Formula> b) {
            return new Expansion(Kind.BETA, List.of(a, b), null, null);
        }

        static Expansion box(Relation r, Formula body) {
            return new Expansion(Kind.BOX, List.of(), r, body);
        }

        static Expansion diamond(Relation r, Formula body) {
            return new Expansion(Kind.DIAMOND, List.of(), r, body);
        }
    }

    record Edge(int from, int to) {
    }

    record Task(int world, Formula formula) {
    }

    /** A world of an open branch: its formulas and its successors per relation. */
    public record WorldView(int id, List<Formula> formulas, Map<Relation, List<Integer>> successors) {

        /** Atoms and negated atoms true at this world. */
        public List<Formula> literals() {
            return formulas.stream().filter(f -> f instanceof Pred || (f instanceof Not n && n.body instanceof Pred)).toList();
        }

        @Override
        public String toString() {
            var acc = successors.entrySet().stream()
                    .filter(e -> !e.getValue().isEmpty())
                    .map(e -> e.getKey() + "→" + e.getValue())
                    .collect(Collectors.joining(" "));
            return "w" + id + " {" + literals().stream().map(Formula::text).collect(Collectors.joining(", ")) + "}"
                    + (acc.isEmpty() ? "" : " " + acc);
        }
    }

    public record Result(Outcome outcome, int totalBranches, int closedBranches, List<WorldView> countermodel,
                         int steps, boolean opaque, String reason) {
        public Result {
            countermodel = List.copyOf(countermodel);
        }

        public boolean closed() {
            return outcome == Outcome.CLOSED;
        }

        /** An open branch that is a genuine countermodel. */
        public boolean refuted() {
            return outcome == Outcome.OPEN && !opaque;
        }

        public String describeCountermodel() {
            return countermodel.stream().map(WorldView::toString).collect(Collectors.joining("; "));
        }
    }

    private final class Branch {
        final List<LinkedHashSet<Formula>> worlds;
        final Map<Relation, LinkedHashSet<Edge>> edges;
        final Set<Task> done;
        boolean closed, opaque;

        Branch() {
            worlds = new ArrayList<>();
            edges = new EnumMap<>(Relation.class);
            for (var r : Relation.values()) edges.put(r, new LinkedHashSet<>());
            done = new HashSet<>();
        }

        Branch(Branch b) {
            worlds = new ArrayList<>(b.worlds.size());
            for (var w : b.worlds) worlds.add(new LinkedHashSet<>(w));
            edges = new EnumMap<>(Relation.class);
            b.edges.forEach((r, e) -> edges.put(r, new LinkedHashSet<>(e)));
            done = new HashSet<>(b.done);
            closed = b.closed;
            opaque = b.opaque;
        }

        int newWorld() {
            var id = worlds.size();
            worlds.add(new LinkedHashSet<>());
            for (var r : Relation.values())
                if (logicOf(r).has(Frame.REFLEXIVE)) addEdge(r, id, id);
            return id;
        }

        void add(int w, Formula f) {
            if (closed || !worlds.get(w).add(f)) return;
            var set = worlds.get(w);
            if ((f instanceof Not n && set.contains(n.body)) || set.contains(not(f))) {
                closed = true;
                return;
            }
            var e = classify(f);
            if (e.kind == Kind.OPAQUE) opaque = true;
            else if (e.kind == Kind.BOX) {
                var inherited = logicOf(e.relation).has(Frame.TRANSITIVE);
                for (var edge : List.copyOf(edges.get(e.relation))) {
                    if (edge.from != w) continue;
                    add(edge.to, e.body);
                    if (inherited) add(edge.to, f);
                }
            }
        }

        void addEdge(Relation r, int from, int to) {
            var pending = new ArrayDeque<Edge>();
            pending.add(new Edge(from, to));
            var logic = logicOf(r);
            while (!pending.isEmpty() && !closed) {
                var edge = pending.poll();
                var rel = edges.get(r);
                if (!rel.add(edge)) continue;
                for (var f : List.copyOf(worlds.get(edge.from))) {
                    var e = classify(f);
                    if (e.kind != Kind.BOX || e.relation != r) continue;
                    add(edge.to, e.body);
                    if (logic.has(Frame.TRANSITIVE)) add(edge.to, f);
                }
                if (logic.has(Frame.TRANSITIVE)) {
                    for (var other : List.copyOf(rel)) {
                        if (other.to == edge.from) pending.add(new Edge(other.from, edge.to));
                        if (other.from == edge.to) pending.add(new Edge(edge.from, other.to));
                    }
                }
                if (logic.has(Frame.EUCLIDEAN)) pending.add(new Edge(edge.to, edge.from));
            }
        }

        List<Integer> successors(Relation r, int w) {
            var out = new ArrayList<Integer>();
            for (var e : edges.get(r)) if (e.from == w) out.add(e.to);
            return out;
        }

        /**
         * Applies one expansion. Returns the extra branches created by a split (usually none), or null when
         * the branch is saturated and open.
         */
        @Nullable List<Branch> step() {
            var alpha = find(Kind.ALPHA);
            if (alpha != null) {
                done.add(alpha);
                for (var f : classify(alpha.formula).parts.get(0)) add(alpha.world, f);
                return List.of();
            }
            var beta = find(Kind.BETA);
            if (beta != null) {
                done.add(beta);
                var parts = classify(beta.formula).parts;
                var others = new ArrayList<Branch>(parts.size() - 1);
                for (var i = parts.size() - 1; i >= 1; i--) {
                    var copy = new Branch(this);
                    for (var f : parts.get(i)) copy.add(beta.world, f);
                    others.add(copy);
                }
                for (var f : parts.get(0)) add(beta.world, f);
                return others;
            }
            var diamond = unwitnessed();
            if (diamond != null) {
                done.add(diamond);
                witness(diamond.world, classify(diamond.formula));
                return List.of();
            }
            for (var w = 0; w < worlds.size(); w++) {
                for (var r : Relation.values()) {
                    if (!logicOf(r).has(Frame.SERIAL) || !successors(r, w).isEmpty() || !hasBox(w, r)) continue;
                    var v = newWorld();
                    addEdge(r, w, v);
                    return List.of();
                }
            }
            return null;
        }

        private boolean hasBox(int w, Relation r) {
            for (var f : worlds.get(w)) {
                var e = classify(f);
                if (e.kind == Kind.BOX && e.relation == r) return true;
            }
            return false;
        }

        private void witness(int w, Expansion diamond) {
            var r = diamond.relation;
            var body = diamond.body;
            for (var v : successors(r, w))
                if (worlds.get(v).contains(body)) return;
            var v = newWorld();
            addEdge(r, w, v);
            add(v, body);
        }

        /**
         * Under a transitive relation a world whose formulas all hold at an earlier predecessor is blocked:
         * its diamonds are witnessed by that predecessor's successors, so none are expanded. Boxes are inherited
         * along transitive edges, which keeps the predecessor's successors consistent with the blocked world.
         * The check runs against the current labels, so a world can become unblocked as it grows.
         */
        private boolean blocked(int w, Relation r) {
            if (!logicOf(r).has(Frame.TRANSITIVE)) return false;
            var label = worlds.get(w);
            for (var e : edges.get(r))
                if (e.to == w && e.from < w && worlds.get(e.from).containsAll(label)) return true;
            return false;
        }

        private @Nullable Task unwitnessed() {
            for (var w = 0; w < worlds.size(); w++) {
                for (var f : worlds.get(w)) {
                    var e = classify(f);
                    if (e.kind != Kind.DIAMOND) continue;
                    var t = new Task(w, f);
                    if (!done.contains(t) && !blocked(w, e.relation)) return t;
                }
            }
            return null;
        }

        private @Nullable Task find(Kind kind) {
            for (var w = 0; w < worlds.size(); w++) {
                for (var f : worlds.get(w)) {
                    if (classify(f).kind != kind) continue;
                    var t = new Task(w, f);
                    if (!done.contains(t)) return t;
                }
            }
            return null;
        }

        List<WorldView> view() {
            var out = new ArrayList<WorldView>(worlds.size());
            for (var w = 0; w < worlds.size(); w++) {
                var succ = new EnumMap<Relation, List<Integer>>(Relation.class);
                for (var r : Relation.values()) succ.put(r, successors(r, w));
                out.add(new WorldView(w, List.copyOf(worlds.get(w)), succ));
            }
            return out;
        }
    }
}
