package dumb.neurosym;

import dumb.neurosym.Config.RouterConfig;
import dumb.neurosym.ProofCache.CacheKey;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static dumb.neurosym.util.Log.debug;
import static dumb.neurosym.util.Log.error;
import static dumb.neurosym.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Picks provers for a goal and combines their answers. Every prover call goes through the {@link ProofCache}.
 * <p>
 * Only {@link Strategy#PARALLEL} runs provers off the calling thread; they share one {@link Budget}, and the
 * first definitive answer cancels the rest.
 */
public class ProverRouter implements AutoCloseable {

    public static final String ROUTER_NAME = "router";
    public static final String PARALLEL_NAME = "parallel";

    private final ProverRegistry registry;
    private final ProofCache cache;
    private final FormulaAnalyzer analyzer;
    private final RouterConfig config;
    private final ExecutorService exe;
    private final Events events;

    public ProverRouter(ProverRegistry registry, ProofCache cache, FormulaAnalyzer analyzer, RouterConfig config) {
        this.registry = requireNonNull(registry);
        this.cache = requireNonNull(cache);
        this.analyzer = requireNonNull(analyzer);
        this.config = requireNonNull(config);
        var n = new AtomicInteger();
        this.exe = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "prover-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.events = new Events(exe);
    }

    public Events events() {
        return events;
    }

    public ProofCache cache() {
        return cache;
    }

    public ProverRegistry registry() {
        return registry;
    }

    public FormulaAnalyzer analyzer() {
        return analyzer;
    }

    public ProofResult prove(Formula goal, List<Formula> axioms) {
        return prove(goal, axioms, config.strategy(), config.timeout());
    }

    /** @throws ProverUnavailableException under {@link Strategy#AUTO} when the chosen prover cannot answer */
    public ProofResult prove(Formula goal, List<Formula> axioms, Strategy strategy, Duration timeout) {
        requireNonNull(goal);
        requireNonNull(strategy);
        axioms = List.copyOf(axioms);
        var analysis = analyzer.analyze(goal);
        var skipped = new ArrayList<ProofResult>();
        var candidates = candidates(strategy, analysis, skipped);
        debug(strategy + " " + goal.text() + " (" + analysis.type() + ", " + analysis.complexity() + ") via "
                + candidates.stream().map(Prover::name).toList());
        events.emit(new ProofEvent.Started(goal, strategy, candidates.stream().map(Prover::name).toList()));

        var budget = Budget.of(timeout);
        var result = switch (strategy) {
            case AUTO -> auto(goal, axioms, candidates, budget);
            case SEQUENTIAL, FASTEST, MOST_CAPABLE -> sequential(goal, axioms, candidates, skipped, budget);
            case PARALLEL -> parallel(goal, axioms, candidates, skipped, budget);
        };
        events.emit(new ProofEvent.Completed(goal, result));
        return result;
    }

    /** Available provers in trial order; unavailable registered ones are reported in {@code skipped}. */
    List<Prover> candidates(Strategy strategy, FormulaAnalysis analysis, List<ProofResult> skipped) {
        var ranked = new LinkedHashSet<String>(switch (strategy) {
            case FASTEST -> config.fastestOrder();
            case MOST_CAPABLE -> config.mostCapableOrder();
            default -> analysis.recommended();
        });
        ranked.addAll(registry.names());
        var out = new ArrayList<Prover>();
        for (var name : ranked) {
            var p = registry.get(name);
            if (p == null) continue;
            if (available(p)) out.add(p);
            else skipped.add(ProofResult.unavailable(name, "prover reports unavailable"));
        }
        return out;
    }

    private static boolean available(Prover p) {
        try {
            return p.isAvailable();
        } catch (RuntimeException e) {
            error("Availability check failed for " + p.name() + ": " + e);
            return false;
        }
    }

    private ProofResult auto(Formula goal, List<Formula> axioms, List<Prover> candidates, Budget budget) {
        if (candidates.isEmpty()) throw new ProverUnavailableException(ROUTER_NAME, "No available prover for " + goal.text());
        var p = candidates.get(0);
        var r = attempt(p, goal, axioms, budget);
        if (r.status() == ProofStatus.ERROR || r.status() == ProofStatus.UNAVAILABLE)
            throw new ProverUnavailableException(p.name(), "Prover " + p.name() + " failed: " + r.message());
        return r;
    }

    private ProofResult sequential(Formula goal, List<Formula> axioms, List<Prover> candidates,
                                   List<ProofResult> skipped, Budget budget) {
        var attempts = new ArrayList<>(skipped);
        ProofResult last = null;
        for (var p : candidates) {
            if (budget.exhausted()) break;
            last = attempt(p, goal, axioms, budget);
            if (last.isDefinitive()) return last.withAttempts(attempts);
            attempts.add(last);
        }
        if (last == null) {
            if (budget.exhausted())
                return ProofResult.of(ProofStatus.TIMEOUT, ROUTER_NAME, Duration.ZERO, "no time left").withAttempts(attempts);
            return ProofResult.unavailable(ROUTER_NAME, "no available prover").withAttempts(attempts);
        }
        attempts.remove(attempts.size() - 1);
        return last.withAttempts(attempts);
    }

    private ProofResult parallel(Formula goal, List<Formula> axioms, List<Prover> candidates,
                                 List<ProofResult> skipped, Budget budget) {
        var attempts = new ArrayList<>(skipped);
        if (candidates.isEmpty())
            return ProofResult.unavailable(ROUTER_NAME, "no available prover").withAttempts(attempts);
        var start = System.nanoTime();
        var done = new LinkedBlockingQueue<ProofResult>();
        for (var p : candidates)
            CompletableFuture.supplyAsync(() -> attempt(p, goal, axioms, budget), exe).thenAccept(done::add);
        var timedOut = false;
        try {
            for (var received = 0; received < candidates.size(); received++) {
                var r = done.poll(budget.remaining().toNanos(), TimeUnit.NANOSECONDS);
                if (r == null) {
                    timedOut = true;
                    break;
                }
                if (r.isDefinitive()) {
                    budget.cancel();
                    return r.withAttempts(attempts);
                }
                attempts.add(r);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            warning("Interrupted while racing provers for " + goal.text());
            timedOut = true;
        } finally {
            budget.cancel();
        }
        var timeout = timedOut || attempts.stream().anyMatch(a -> a.status() == ProofStatus.TIMEOUT);
        return ProofResult.of(timeout ? ProofStatus.TIMEOUT : ProofStatus.UNKNOWN, PARALLEL_NAME,
                Duration.ofNanos(System.nanoTime() - start),
                "no definitive answer from " + candidates.size() + " provers").withAttempts(attempts);
    }

    /** One prover call through the cache. Never throws. */
    ProofResult attempt(Prover p, Formula goal, List<Formula> axioms, Budget budget) {
        var start = System.nanoTime();
        CacheKey key;
        try {
            key = CacheKey.of(goal, axioms, p.name(), p.configuration());
        } catch (RuntimeException e) {
            error("Unable to key " + p.name() + " request: " + e);
            return ProofResult.error(p.name(), Duration.ZERO, e.toString());
        }
        var cached = cache.get(key);
        if (cached.isPresent()) {
            events.emit(new ProofEvent.CacheHit(goal, p.name(), key));
            return cached.get();
        }
        ProofResult r;
        try {
            r = p.prove(goal, axioms, budget);
            if (r == null) r = ProofResult.error(p.name(), Duration.ofNanos(System.nanoTime() - start), "no result");
        } catch (RuntimeException e) {
            error("Prover " + p.name() + " failed on " + goal.text() + ": " + e, e);
            r = ProofResult.error(p.name(), Duration.ofNanos(System.nanoTime() - start), e.toString());
        }
        cache.put(key, r);
        return r;
    }

    @Override
    public void close() {
        exe.shutdown();
    }

    public enum Strategy {
        /** Top-ranked available prover only. */
        AUTO,
        /** Ranked order until one proves or disproves. */
        SEQUENTIAL,
        /** All candidates at once; first definitive answer wins. */
        PARALLEL,
        FASTEST,
        MOST_CAPABLE
    }
}
