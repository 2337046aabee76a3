package dumb.neurosym;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.Objects.requireNonNull;

/**
 * Ordered, duplicate-free axioms plus theorems: formulas the owner asserts are valid outright, i.e. provable
 * from no axioms. Only theorems may be necessitated. Append-only; engines read a snapshot.
 */
public class KnowledgeBase {

    private final Set<Formula> axioms = new LinkedHashSet<>();
    private final Set<Formula> theorems = new LinkedHashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public KnowledgeBase() {
    }

    public KnowledgeBase(Collection<? extends Formula> axioms) {
        axioms.forEach(this::add);
    }

    public static KnowledgeBase of(Formula... axioms) {
        return new KnowledgeBase(List.of(axioms));
    }

    /** @return false if the axiom was already present */
    public boolean add(Formula axiom) {
        requireNonNull(axiom);
        lock.writeLock().lock();
        try {
            return axioms.add(axiom);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean addTheorem(Formula theorem) {
        requireNonNull(theorem);
        lock.writeLock().lock();
        try {
            return theorems.add(theorem);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Formula> axioms() {
        lock.readLock().lock();
        try {
            return List.copyOf(axioms);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Formula> theorems() {
        lock.readLock().lock();
        try {
            return List.copyOf(theorems);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Axioms then theorems, without duplicates. */
    public List<Formula> all() {
        lock.readLock().lock();
        try {
            var s = new LinkedHashSet<>(axioms);
            s.addAll(theorems);
            return new ArrayList<>(s);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return axioms.size() + theorems.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
