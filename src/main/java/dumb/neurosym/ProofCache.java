package dumb.neurosym;

import dumb.neurosym.Config.CacheConfig;
import dumb.neurosym.util.Json;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

import static dumb.neurosym.util.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * Bounded LRU store of proof results keyed by a digest of the request. Entries expire after their TTL.
 * Only outcomes that would repeat for the same request are stored; see {@link ProofStatus#deterministic()}.
 */
public class ProofCache {

    private final int maxSize;
    private final long ttlNanos;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CacheKey, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

    private long hits, misses, evictions, expirations;

    public ProofCache() {
        this(new CacheConfig());
    }

    public ProofCache(CacheConfig config) {
        this(config.maxSize(), config.ttl(), System::nanoTime);
    }

    /** @param clock nanosecond time source */
    public ProofCache(int maxSize, Duration ttl, LongSupplier clock) {
        if (maxSize < 1) throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        this.maxSize = maxSize;
        this.ttlNanos = checkTtl(ttl);
        this.clock = requireNonNull(clock);
    }

    private static long checkTtl(Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        return ttl.compareTo(Duration.ofDays(365 * 100)) > 0 ? Long.MAX_VALUE : ttl.toNanos();
    }

    public Optional<ProofResult> get(CacheKey key) {
        requireNonNull(key);
        lock.lock();
        try {
            var e = entries.get(key);
            if (e == null) {
                misses++;
                return Optional.empty();
            }
            if (e.expired(clock.getAsLong())) {
                entries.remove(key);
                expirations++;
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(e.result.withFromCache(true));
        } finally {
            lock.unlock();
        }
    }

    /** @return whether the result was stored */
    public boolean put(CacheKey key, ProofResult result) {
        return put(key, result, null);
    }

    public boolean put(CacheKey key, ProofResult result, @Nullable Duration ttl) {
        requireNonNull(key);
        requireNonNull(result);
        if (!result.status().deterministic()) return false;
        var life = ttl != null ? checkTtl(ttl) : ttlNanos;
        lock.lock();
        try {
            var now = clock.getAsLong();
            dropEldestIfExpired(now);
            entries.put(key, new Entry(result.withFromCache(false), now, life));
            while (entries.size() > maxSize) {
                var eldest = entries.keySet().iterator().next();
                entries.remove(eldest);
                evictions++;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Expiry is otherwise lazy; a write only looks at the least recently used entry. */
    private void dropEldestIfExpired(long now) {
        if (entries.isEmpty()) return;
        var it = entries.values().iterator();
        if (it.next().expired(now)) {
            it.remove();
            expirations++;
        }
    }

    public boolean invalidate(CacheKey key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            var n = entries.size();
            entries.clear();
            debug("Cleared " + n + " cached proofs");
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public Stats stats() {
        lock.lock();
        try {
            var total = hits + misses;
            return new Stats(hits, misses, total == 0 ? 0 : (double) hits / total, entries.size(), evictions, expirations);
        } finally {
            lock.unlock();
        }
    }

    private record Entry(ProofResult result, long insertedAt, long ttl) {
        boolean expired(long now) {
            return now - insertedAt > ttl;
        }
    }

    public record Stats(long hits, long misses, double hitRate, int size, long evictions, long expirations) {
        @Override
        public String toString() {
            return String.format("hits=%d misses=%d rate=%.2f size=%d evicted=%d expired=%d",
                    hits, misses, hitRate, size, evictions, expirations);
        }
    }

    /** SHA-256 of a proof request, lowercase hex. */
    public record CacheKey(String digest) {

        private static final Pattern HEX = Pattern.compile("[0-9a-f]{64}");
        private static final char SEP = '\u001f';

        public CacheKey {
            requireNonNull(digest);
            if (!HEX.matcher(digest).matches()) throw new IllegalArgumentException("Malformed cache digest: " + digest);
        }

        /** Every field is length-prefixed, so names containing the separator cannot collide. */
        public static CacheKey of(Formula goal, List<Formula> axioms, String prover, Map<String, ?> configuration) {
            var sb = new StringBuilder();
            field(sb, goal.text());
            sb.append(axioms.size()).append(SEP);
            for (var a : axioms) field(sb, a.text());
            field(sb, prover);
            field(sb, Json.canonicalStr(configuration));
            return new CacheKey(sha256(sb.toString()));
        }

        private static void field(StringBuilder sb, String s) {
            sb.append(s.length()).append(':').append(s).append(SEP);
        }

        static String sha256(String s) {
            try {
                var d = MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
                return HexFormat.of().formatHex(d);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 unavailable", e);
            }
        }

        @Override
        public String toString() {
            return digest.substring(0, 12);
        }
    }
}
