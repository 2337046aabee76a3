package dumb.neurosym;

import dumb.neurosym.Config.RouterConfig;
import dumb.neurosym.FormulaAnalysis.Complexity;
import dumb.neurosym.ProverRouter.Strategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RouterTests extends AbstractTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ProverRouter router;

    /** Answers with a fixed status after an optional delay, counting its calls. */
    static class StubProver implements Prover {
        final String name;
        final ProofStatus status;
        final long delayMillis;
        boolean available = true;
        final AtomicInteger calls = new AtomicInteger();
        final CountDownLatch sawCancel = new CountDownLatch(1);

        StubProver(String name, ProofStatus status) {
            this(name, status, 0);
        }

        StubProver(String name, ProofStatus status, long delayMillis) {
            this.name = name;
            this.status = status;
            this.delayMillis = delayMillis;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Capabilities capabilities() {
            return Capabilities.NONE;
        }

        @Override
        public ProofResult prove(Formula goal, List<Formula> axioms, Budget budget) {
            calls.incrementAndGet();
            var end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMillis);
            while (System.nanoTime() < end) {
                if (budget.exhausted()) {
                    if (budget.cancelled()) sawCancel.countDown();
                    return ProofResult.of(ProofStatus.TIMEOUT, name, Duration.ZERO, "interrupted");
                }
                try {
                    Thread.sleep(2);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ProofResult.error(name, Duration.ZERO, "interrupted");
                }
            }
            return ProofResult.of(status, name, Duration.ofMillis(delayMillis), null);
        }
    }

    static class FailingProver extends StubProver {
        FailingProver(String name) {
            super(name, ProofStatus.PROVED);
        }

        @Override
        public ProofResult prove(Formula goal, List<Formula> axioms, Budget budget) {
            calls.incrementAndGet();
            throw new IllegalStateException("solver crashed");
        }
    }

    private ProverRouter router(RouterConfig config, String... ranking) {
        var table = new ProverRecommendations(Map.of(), List.of(ranking));
        var analyzer = new FormulaAnalyzer(Set.of(), table);
        router = new ProverRouter(new ProverRegistry(), new ProofCache(), analyzer, config);
        return router;
    }

    private ProverRouter router(String... ranking) {
        return router(new RouterConfig(), ranking);
    }

    @AfterEach
    void close() {
        if (router != null) router.close();
    }

    @Test
    void sequentialFallsBackPastUnavailableProver() {
        var r = router("alpha", "beta");
        var alpha = new StubProver("alpha", ProofStatus.PROVED);
        alpha.available = false;
        var beta = new StubProver("beta", ProofStatus.PROVED);
        r.registry().register(alpha).register(beta);

        var result = r.prove(parse("Q"), parseAll("P"), Strategy.SEQUENTIAL, TIMEOUT);
        assertEquals(ProofStatus.PROVED, result.status());
        assertEquals("beta", result.prover());
        assertEquals(0, alpha.calls.get());
        assertEquals(ProofStatus.UNAVAILABLE, result.attempts().get(0).status());
        assertEquals("alpha", result.attempts().get(0).prover());
    }

    @Test
    void sequentialFallsThroughUnknownAndErrors() {
        var r = router("unsure", "broken", "sure");
        r.registry()
                .register(new StubProver("unsure", ProofStatus.UNKNOWN))
                .register(new FailingProver("broken"))
                .register(new StubProver("sure", ProofStatus.DISPROVED));
        var result = r.prove(parse("Q"), List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        assertEquals("sure", result.prover());
        assertEquals(ProofStatus.DISPROVED, result.status());
        assertEquals(List.of(ProofStatus.UNKNOWN, ProofStatus.ERROR),
                result.attempts().stream().map(ProofResult::status).toList());
    }

    @Test
    void sequentialReturnsLastResultWhenNothingIsDefinitive() {
        var r = router("a", "b");
        r.registry()
                .register(new StubProver("a", ProofStatus.UNKNOWN))
                .register(new StubProver("b", ProofStatus.DEPTH_EXCEEDED));
        var result = r.prove(parse("Q"), List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        assertEquals("b", result.prover());
        assertEquals(ProofStatus.DEPTH_EXCEEDED, result.status());
        assertEquals(1, result.attempts().size());
    }

    @Test
    void unrankedRegisteredProversAreTriedLast() {
        var r = router("ranked");
        r.registry()
                .register(new StubProver("extra", ProofStatus.PROVED))
                .register(new StubProver("ranked", ProofStatus.UNKNOWN));
        var result = r.prove(parse("Q"), List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        assertEquals("extra", result.prover());
    }

    @Test
    void autoUsesTopCandidateOnly() {
        var r = router("first", "second");
        var first = new StubProver("first", ProofStatus.UNKNOWN);
        var second = new StubProver("second", ProofStatus.PROVED);
        r.registry().register(first).register(second);
        var result = r.prove(parse("Q"), List.of(), Strategy.AUTO, TIMEOUT);
        assertEquals("first", result.prover());
        assertEquals(ProofStatus.UNKNOWN, result.status());
        assertEquals(0, second.calls.get());
    }

    @Test
    void autoWithoutUsableProverThrows() {
        var r = router("only");
        var only = new StubProver("only", ProofStatus.PROVED);
        only.available = false;
        r.registry().register(only);
        assertThrows(ProverUnavailableException.class,
                () -> r.prove(parse("Q"), List.of(), Strategy.AUTO, TIMEOUT));

        r.registry().register(new FailingProver("only"));
        var e = assertThrows(ProverUnavailableException.class,
                () -> r.prove(parse("Q"), List.of(), Strategy.AUTO, TIMEOUT));
        assertEquals("only", e.prover());
    }

    @Test
    void parallelFirstDefinitiveWinsAndCancelsTheRest() throws InterruptedException {
        var r = router("slow", "quick");
        var slow = new StubProver("slow", ProofStatus.PROVED, 10_000);
        var quick = new StubProver("quick", ProofStatus.PROVED, 10);
        r.registry().register(slow).register(quick);
        var result = r.prove(parse("Q"), List.of(), Strategy.PARALLEL, TIMEOUT);
        assertEquals("quick", result.prover());
        assertTrue(slow.sawCancel.await(5, TimeUnit.SECONDS));
    }

    @Test
    void parallelAggregatesWhenNothingIsDefinitive() {
        var r = router("a", "b");
        r.registry()
                .register(new StubProver("a", ProofStatus.UNKNOWN))
                .register(new FailingProver("b"));
        var result = r.prove(parse("Q"), List.of(), Strategy.PARALLEL, TIMEOUT);
        assertEquals(ProofStatus.UNKNOWN, result.status());
        assertEquals(ProverRouter.PARALLEL_NAME, result.prover());
        assertEquals(2, result.attempts().size());
    }

    @Test
    void parallelDeadline() {
        var r = router("slow");
        r.registry().register(new StubProver("slow", ProofStatus.PROVED, 10_000));
        var result = r.prove(parse("Q"), List.of(), Strategy.PARALLEL, Duration.ofMillis(100));
        assertEquals(ProofStatus.TIMEOUT, result.status());
    }

    @Test
    void fixedOrders() {
        var config = new RouterConfig(Strategy.SEQUENTIAL, 10_000L, List.of("b", "a"), List.of("a", "b"));
        var r = router(config, "a", "b");
        r.registry()
                .register(new StubProver("a", ProofStatus.PROVED))
                .register(new StubProver("b", ProofStatus.PROVED));
        assertEquals("b", r.prove(parse("Q"), List.of(), Strategy.FASTEST, TIMEOUT).prover());
        assertEquals("a", r.prove(parse("R"), List.of(), Strategy.MOST_CAPABLE, TIMEOUT).prover());
    }

    @Test
    void repeatedRequestsAreServedFromCache() {
        var r = router(InferenceEngine.NAME);
        r.registry().register(new NativeProver());
        var goal = parse("Q");
        var axioms = parseAll("P", "P -> Q");
        var first = r.prove(goal, axioms, Strategy.SEQUENTIAL, TIMEOUT);
        var second = r.prove(goal, axioms, Strategy.SEQUENTIAL, TIMEOUT);
        assertFalse(first.fromCache());
        assertTrue(second.fromCache());
        assertEquals(first.status(), second.status());
        assertEquals(first.steps(), second.steps());
        assertEquals(first.prover(), second.prover());
        assertEquals(1, r.cache().stats().hits());
    }

    @Test
    void cachedAnswerIsFasterThanProving() {
        var r = router("slow");
        var slow = new StubProver("slow", ProofStatus.PROVED, 150);
        r.registry().register(slow);
        var goal = parse("Q");

        var t0 = System.nanoTime();
        var first = r.prove(goal, List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        var firstNanos = System.nanoTime() - t0;
        t0 = System.nanoTime();
        var second = r.prove(goal, List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        var secondNanos = System.nanoTime() - t0;

        assertEquals(ProofStatus.PROVED, first.status());
        assertTrue(second.fromCache());
        assertEquals(1, slow.calls.get());
        assertTrue(firstNanos >= TimeUnit.MILLISECONDS.toNanos(150), () -> "first call took " + firstNanos + "ns");
        assertTrue(secondNanos < firstNanos, () -> secondNanos + "ns vs " + firstNanos + "ns");
    }

    @Test
    void timeoutsAreNotCached() {
        var r = router("t");
        var t = new StubProver("t", ProofStatus.TIMEOUT);
        r.registry().register(t);
        r.prove(parse("Q"), List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        r.prove(parse("Q"), List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        assertEquals(2, t.calls.get());
        assertEquals(0, r.cache().size());
    }

    @Test
    void eventsAreEmitted() throws InterruptedException {
        var r = router("a");
        r.registry().register(new StubProver("a", ProofStatus.PROVED));
        var started = new CountDownLatch(1);
        var cached = new CountDownLatch(1);
        var completed = new CountDownLatch(2);
        r.events().on(ProofEvent.Started.class, e -> started.countDown());
        r.events().on(ProofEvent.CacheHit.class, e -> cached.countDown());
        r.events().on(ProofEvent.Completed.class, e -> {
            assertEquals(ProofStatus.PROVED, e.result().status());
            completed.countDown();
        });
        r.prove(parse("Q"), List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        r.prove(parse("Q"), List.of(), Strategy.SEQUENTIAL, TIMEOUT);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(cached.await(5, TimeUnit.SECONDS));
        assertTrue(completed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void capabilitiesMatchAnalysis() {
        var analyzer = new FormulaAnalyzer();
        var nat = new NativeProver().capabilities();
        assertTrue(nat.handles(analyzer.analyze(parse("O(□P)"))));
        assertFalse(nat.handles(analyzer.analyze(parse("lt(a, b)"))));
        assertFalse(Capabilities.NONE.handles(analyzer.analyze(parse("□P"))));
        assertEquals(Complexity.LOW, analyzer.analyze(parse("□P")).complexity());
    }
}
