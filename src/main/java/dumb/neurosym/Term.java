package dumb.neurosym;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Argument of a predicate: a variable, a constant, or a function application. */
sealed public interface Term permits Term.Var, Term.Const, Term.Fn {

    String name();

    /** Variables occurring in this term, in order of first occurrence. */
    Set<Var> vars();

    int weight();

    Term subst(Var v, Term replacement);

    default boolean ground() {
        return vars().isEmpty();
    }

    record Var(String name) implements Term {
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(256);

        public Var {
            requireNonNull(name);
            if (name.isEmpty() || name.startsWith("?"))
                throw new IllegalArgumentException("Variable name must be non-empty and given without '?': " + name);
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        @Override
        public Set<Var> vars() {
            return Set.of(this);
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public Term subst(Var v, Term replacement) {
            return equals(v) ? replacement : this;
        }

        @Override
        public String toString() {
            return "?" + name;
        }
    }

    record Const(String name) implements Term {
        private static final Map<String, Const> internCache = new ConcurrentHashMap<>(1024);

        public Const {
            requireNonNull(name);
        }

        public static Const of(String name) {
            return internCache.computeIfAbsent(name, Const::new);
        }

        @Override
        public Set<Var> vars() {
            return Set.of();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public Term subst(Var v, Term replacement) {
            return this;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    final class Fn implements Term {
        private final String name;
        public final List<Term> args;
        private int hash;

        public Fn(String name, List<Term> args) {
            this.name = requireNonNull(name);
            this.args = List.copyOf(args);
            if (this.args.isEmpty())
                throw new IllegalArgumentException("Function application needs at least one argument: " + name);
        }

        public static Fn of(String name, Term... args) {
            return new Fn(name, List.of(args));
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Set<Var> vars() {
            var s = new LinkedHashSet<Var>();
            args.forEach(a -> s.addAll(a.vars()));
            return s;
        }

        @Override
        public int weight() {
            return 1 + args.stream().mapToInt(Term::weight).sum();
        }

        @Override
        public Term subst(Var v, Term replacement) {
            var changed = false;
            var next = new Term[args.size()];
            for (var i = 0; i < next.length; i++) {
                var a = args.get(i);
                next[i] = a.subst(v, replacement);
                changed |= next[i] != a;
            }
            return changed ? new Fn(name, List.of(next)) : this;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Fn f && hashCode() == f.hashCode() && name.equals(f.name) && args.equals(f.args));
        }

        @Override
        public int hashCode() {
            var h = hash;
            if (h == 0) {
                h = 31 * name.hashCode() + args.hashCode();
                if (h == 0) h = 1;
                hash = h;
            }
            return h;
        }

        @Override
        public String toString() {
            return name + args.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
