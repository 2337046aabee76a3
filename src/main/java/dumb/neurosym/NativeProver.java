package dumb.neurosym;

import com.fasterxml.jackson.core.type.TypeReference;
import dumb.neurosym.Config.EngineConfig;
import dumb.neurosym.util.Json;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** The {@link InferenceEngine} as a {@link Prover}. Every call runs on a fresh knowledge base. */
public class NativeProver implements Prover {

    private static final Capabilities CAPABILITIES = new Capabilities(true, false, true, true, true, true);

    private final EngineConfig config;
    private final List<Formula> theorems;

    public NativeProver() {
        this(new EngineConfig());
    }

    public NativeProver(EngineConfig config) {
        this(config, List.of());
    }

    /** @param theorems valid formulas added to every request, eligible for necessitation */
    public NativeProver(EngineConfig config, List<Formula> theorems) {
        this.config = requireNonNull(config);
        this.theorems = List.copyOf(theorems);
    }

    @Override
    public String name() {
        return InferenceEngine.NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Capabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Map<String, Object> configuration() {
        Map<String, Object> m = Json.the.convertValue(config, new TypeReference<Map<String, Object>>() {
        });
        if (!theorems.isEmpty()) m.put("theorems", theorems.stream().map(Formula::text).toList());
        return m;
    }

    @Override
    public ProofResult prove(Formula goal, List<Formula> axioms, Budget budget) {
        var kb = new KnowledgeBase(axioms);
        theorems.forEach(kb::addTheorem);
        return new InferenceEngine(kb, config).prove(goal, config.stepBudget(), budget.within(config.timeBudget()));
    }
}
