package dumb.neurosym;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.neurosym.FormulaAnalysis.Complexity;
import dumb.neurosym.util.Json;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static dumb.neurosym.util.Log.warning;

/**
 * Ranked prover names per formula type and complexity bucket. Types or buckets missing from the table use
 * {@code fallback}.
 */
public record ProverRecommendations(
        @JsonProperty("table") Map<FormulaType, Map<Complexity, List<String>>> table,
        @JsonProperty("fallback") List<String> fallback
) {
    public static final String RESOURCE = "prover-recommendations.json";
    public static final List<String> DEFAULT_FALLBACK = List.of(InferenceEngine.NAME);

    @JsonCreator
    public ProverRecommendations {
        var t = new EnumMap<FormulaType, Map<Complexity, List<String>>>(FormulaType.class);
        if (table != null)
            table.forEach((type, byBucket) -> {
                var m = new EnumMap<Complexity, List<String>>(Complexity.class);
                if (byBucket != null) byBucket.forEach((c, names) -> m.put(c, List.copyOf(names)));
                t.put(type, m);
            });
        table = t;
        fallback = fallback != null ? List.copyOf(fallback) : DEFAULT_FALLBACK;
    }

    public static ProverRecommendations empty() {
        return new ProverRecommendations(Map.of(), DEFAULT_FALLBACK);
    }

    public static ProverRecommendations load(String resource) {
        var r = Json.resource(resource, ProverRecommendations.class);
        if (r == null) {
            warning("Recommendation table " + resource + " not found, using " + DEFAULT_FALLBACK);
            return empty();
        }
        return r;
    }

    public List<String> recommend(FormulaType type, Complexity complexity) {
        var byBucket = table.get(type);
        if (byBucket == null) return fallback;
        var names = byBucket.get(complexity);
        return names == null || names.isEmpty() ? fallback : names;
    }
}
