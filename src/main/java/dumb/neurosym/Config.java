package dumb.neurosym;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.neurosym.util.Json;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static dumb.neurosym.util.Log.message;

/**
 * Settings for every component, read from the classpath resource {@value #RESOURCE}. Missing sections and
 * fields fall back to defaults; out-of-range values are rejected when the record is built.
 */
public record Config(
        @JsonProperty("parser") ParserConfig parser,
        @JsonProperty("engine") EngineConfig engine,
        @JsonProperty("cache") CacheConfig cache,
        @JsonProperty("router") RouterConfig router,
        @JsonProperty("analyzer") AnalyzerConfig analyzer
) {
    public static final String RESOURCE = "neurosym.json";

    @JsonCreator
    public Config {
        parser = parser != null ? parser : new ParserConfig();
        engine = engine != null ? engine : new EngineConfig();
        cache = cache != null ? cache : new CacheConfig();
        router = router != null ? router : new RouterConfig();
        analyzer = analyzer != null ? analyzer : new AnalyzerConfig();
    }

    public Config() {
        this(null, null, null, null, null);
    }

    public static Config load() {
        return load(RESOURCE);
    }

    public static Config load(String resource) {
        var c = Json.resource(resource, Config.class);
        if (c == null) {
            message("No " + resource + " on the classpath, using default configuration");
            return new Config();
        }
        return c;
    }

    public Config withEngine(EngineConfig e) {
        return new Config(parser, e, cache, router, analyzer);
    }

    public record ParserConfig(
            @JsonProperty("maxDepth") int maxDepth,
            @JsonProperty("maxLength") int maxLength
    ) {
        public ParserConfig {
            if (maxDepth < 1 || maxDepth > Formula.MAX_DEPTH)
                throw new IllegalArgumentException("parser.maxDepth must be within 1.." + Formula.MAX_DEPTH + ": " + maxDepth);
            if (maxLength < 1) throw new IllegalArgumentException("parser.maxLength must be positive: " + maxLength);
        }

        @JsonCreator
        public ParserConfig(
                @JsonProperty("maxDepth") Integer maxDepth,
                @JsonProperty("maxLength") Integer maxLength
        ) {
            this(
                    maxDepth != null ? maxDepth : FormulaParser.DEFAULT_MAX_DEPTH,
                    maxLength != null ? maxLength : FormulaParser.DEFAULT_MAX_LENGTH
            );
        }

        public ParserConfig() {
            this(FormulaParser.DEFAULT_MAX_DEPTH, FormulaParser.DEFAULT_MAX_LENGTH);
        }
    }

    /**
     * @param derivedDepthSlack how much deeper than the deepest input formula a derived fact may be
     * @param logicOverride     forces the modal logic instead of letting {@link ModalStrategySelector} choose
     */
    public record EngineConfig(
            @JsonProperty("stepBudget") int stepBudget,
            @JsonProperty("timeBudgetMillis") long timeBudgetMillis,
            @JsonProperty("derivedDepthSlack") int derivedDepthSlack,
            @JsonProperty("tableaux") boolean tableaux,
            @JsonProperty("maxWorlds") int maxWorlds,
            @JsonProperty("logicOverride") @Nullable ModalLogic logicOverride
    ) {
        public static final int DEFAULT_STEP_BUDGET = 1000;
        public static final long DEFAULT_TIME_BUDGET_MILLIS = 5000;
        public static final int DEFAULT_DERIVED_DEPTH_SLACK = 2;
        public static final int DEFAULT_MAX_WORLDS = 256;

        public EngineConfig {
            if (stepBudget < 1) throw new IllegalArgumentException("engine.stepBudget must be positive: " + stepBudget);
            if (timeBudgetMillis < 1)
                throw new IllegalArgumentException("engine.timeBudgetMillis must be positive: " + timeBudgetMillis);
            if (derivedDepthSlack < 0)
                throw new IllegalArgumentException("engine.derivedDepthSlack must not be negative: " + derivedDepthSlack);
            if (maxWorlds < 1) throw new IllegalArgumentException("engine.maxWorlds must be positive: " + maxWorlds);
        }

        @JsonCreator
        public EngineConfig(
                @JsonProperty("stepBudget") Integer stepBudget,
                @JsonProperty("timeBudgetMillis") Long timeBudgetMillis,
                @JsonProperty("derivedDepthSlack") Integer derivedDepthSlack,
                @JsonProperty("tableaux") Boolean tableaux,
                @JsonProperty("maxWorlds") Integer maxWorlds,
                @JsonProperty("logicOverride") @Nullable ModalLogic logicOverride
        ) {
            this(
                    stepBudget != null ? stepBudget : DEFAULT_STEP_BUDGET,
                    timeBudgetMillis != null ? timeBudgetMillis : DEFAULT_TIME_BUDGET_MILLIS,
                    derivedDepthSlack != null ? derivedDepthSlack : DEFAULT_DERIVED_DEPTH_SLACK,
                    tableaux == null || tableaux,
                    maxWorlds != null ? maxWorlds : DEFAULT_MAX_WORLDS,
                    logicOverride
            );
        }

        public EngineConfig() {
            this(DEFAULT_STEP_BUDGET, DEFAULT_TIME_BUDGET_MILLIS, DEFAULT_DERIVED_DEPTH_SLACK, true, DEFAULT_MAX_WORLDS, null);
        }

        @JsonIgnore
        public Duration timeBudget() {
            return Duration.ofMillis(timeBudgetMillis);
        }

        public EngineConfig withStepBudget(int steps) {
            return new EngineConfig(steps, timeBudgetMillis, derivedDepthSlack, tableaux, maxWorlds, logicOverride);
        }

        public EngineConfig withLogic(@Nullable ModalLogic logic) {
            return new EngineConfig(stepBudget, timeBudgetMillis, derivedDepthSlack, tableaux, maxWorlds, logic);
        }
    }

    public record CacheConfig(
            @JsonProperty("maxSize") int maxSize,
            @JsonProperty("ttlSeconds") long ttlSeconds
    ) {
        public static final int DEFAULT_MAX_SIZE = 1000;
        public static final long DEFAULT_TTL_SECONDS = 3600;

        public CacheConfig {
            if (maxSize < 1) throw new IllegalArgumentException("cache.maxSize must be positive: " + maxSize);
            if (ttlSeconds < 1) throw new IllegalArgumentException("cache.ttlSeconds must be positive: " + ttlSeconds);
        }

        @JsonCreator
        public CacheConfig(
                @JsonProperty("maxSize") Integer maxSize,
                @JsonProperty("ttlSeconds") Long ttlSeconds
        ) {
            this(
                    maxSize != null ? maxSize : DEFAULT_MAX_SIZE,
                    ttlSeconds != null ? ttlSeconds : DEFAULT_TTL_SECONDS
            );
        }

        public CacheConfig() {
            this(DEFAULT_MAX_SIZE, DEFAULT_TTL_SECONDS);
        }

        @JsonIgnore
        public Duration ttl() {
            return Duration.ofSeconds(ttlSeconds);
        }
    }

    /**
     * @param fastestOrder     fixed candidate order for {@link ProverRouter.Strategy#FASTEST}
     * @param mostCapableOrder fixed candidate order for {@link ProverRouter.Strategy#MOST_CAPABLE}
     */
    public record RouterConfig(
            @JsonProperty("strategy") ProverRouter.Strategy strategy,
            @JsonProperty("timeoutMillis") long timeoutMillis,
            @JsonProperty("fastestOrder") List<String> fastestOrder,
            @JsonProperty("mostCapableOrder") List<String> mostCapableOrder
    ) {
        public static final long DEFAULT_TIMEOUT_MILLIS = 10_000;
        public static final List<String> DEFAULT_FASTEST_ORDER = List.of("native", "z3", "cvc5", "lean", "coq");
        public static final List<String> DEFAULT_MOST_CAPABLE_ORDER = List.of("lean", "coq", "cvc5", "z3", "native");

        public RouterConfig {
            if (strategy == null) strategy = ProverRouter.Strategy.SEQUENTIAL;
            if (timeoutMillis < 1) throw new IllegalArgumentException("router.timeoutMillis must be positive: " + timeoutMillis);
            fastestOrder = fastestOrder != null ? List.copyOf(fastestOrder) : DEFAULT_FASTEST_ORDER;
            mostCapableOrder = mostCapableOrder != null ? List.copyOf(mostCapableOrder) : DEFAULT_MOST_CAPABLE_ORDER;
        }

        @JsonCreator
        public RouterConfig(
                @JsonProperty("strategy") ProverRouter.Strategy strategy,
                @JsonProperty("timeoutMillis") Long timeoutMillis,
                @JsonProperty("fastestOrder") List<String> fastestOrder,
                @JsonProperty("mostCapableOrder") List<String> mostCapableOrder
        ) {
            this(strategy, timeoutMillis != null ? timeoutMillis : DEFAULT_TIMEOUT_MILLIS, fastestOrder, mostCapableOrder);
        }

        public RouterConfig() {
            this(ProverRouter.Strategy.SEQUENTIAL, DEFAULT_TIMEOUT_MILLIS, DEFAULT_FASTEST_ORDER, DEFAULT_MOST_CAPABLE_ORDER);
        }

        @JsonIgnore
        public Duration timeout() {
            return Duration.ofMillis(timeoutMillis);
        }
    }

    /**
     * @param arithmeticPredicates predicate names (case-insensitive) that mark a formula as arithmetic
     * @param recommendations      classpath resource holding the prover recommendation table
     */
    public record AnalyzerConfig(
            @JsonProperty("arithmeticPredicates") Set<String> arithmeticPredicates,
            @JsonProperty("recommendations") String recommendations
    ) {
        public static final Set<String> DEFAULT_ARITHMETIC = Set.of(
                "lt", "gt", "le", "ge", "leq", "geq", "less", "greater", "plus", "minus", "times", "sum",
                "product", "add", "sub", "mul", "div", "mod", "succ", "equals", "eq");

        @JsonCreator
        public AnalyzerConfig {
            arithmeticPredicates = arithmeticPredicates != null ? Set.copyOf(arithmeticPredicates) : DEFAULT_ARITHMETIC;
            recommendations = recommendations != null ? recommendations : ProverRecommendations.RESOURCE;
        }

        public AnalyzerConfig() {
            this(null, null);
        }
    }
}
