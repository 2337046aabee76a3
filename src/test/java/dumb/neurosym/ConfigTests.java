package dumb.neurosym;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.neurosym.FormulaAnalysis.Complexity;
import dumb.neurosym.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigTests {

    @Test
    void classpathConfiguration() {
        var c = Config.load();
        assertEquals(1000, c.engine().stepBudget());
        assertEquals(Duration.ofSeconds(5), c.engine().timeBudget());
        assertTrue(c.engine().tableaux());
        assertNull(c.engine().logicOverride());
        assertEquals(ProverRouter.Strategy.SEQUENTIAL, c.router().strategy());
        assertEquals(Duration.ofHours(1), c.cache().ttl());
        assertEquals(256, c.parser().maxDepth());
        assertTrue(c.analyzer().arithmeticPredicates().contains("lt"));
    }

    @Test
    void missingResourceGivesDefaults() {
        assertEquals(new Config(), Config.load("no-such-config.json"));
    }

    @Test
    void partialSectionsKeepDefaults() throws JsonProcessingException {
        var c = Json.obj("""
                {
                  "engine": { "stepBudget": 5, "logicOverride": "S5" },
                  "router": { "strategy": "PARALLEL" },
                  "unrelated": true
                }
                """, Config.class);
        assertEquals(5, c.engine().stepBudget());
        assertEquals(ModalLogic.S5, c.engine().logicOverride());
        assertEquals(Config.EngineConfig.DEFAULT_TIME_BUDGET_MILLIS, c.engine().timeBudgetMillis());
        assertEquals(ProverRouter.Strategy.PARALLEL, c.router().strategy());
        assertEquals(Config.RouterConfig.DEFAULT_FASTEST_ORDER, c.router().fastestOrder());
        assertEquals(new Config.CacheConfig(), c.cache());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"cache\": {\"maxSize\": 0}}",
            "{\"cache\": {\"ttlSeconds\": -1}}",
            "{\"engine\": {\"stepBudget\": 0}}",
            "{\"engine\": {\"derivedDepthSlack\": -1}}",
            "{\"parser\": {\"maxDepth\": 5000}}",
            "{\"router\": {\"timeoutMillis\": 0}}"
    })
    void invalidValuesAreRejected(String json) {
        assertThrows(JsonProcessingException.class, () -> Json.obj(json, Config.class));
    }

    @Test
    void engineCopies() {
        var e = new Config.EngineConfig();
        assertEquals(7, e.withStepBudget(7).stepBudget());
        assertEquals(ModalLogic.T, e.withLogic(ModalLogic.T).logicOverride());
        assertEquals(7, new Config().withEngine(e.withStepBudget(7)).engine().stepBudget());
    }

    @Test
    void modalLogicFrames() {
        assertTrue(ModalLogic.K.frames().isEmpty());
        assertTrue(ModalLogic.S5.has(ModalLogic.Frame.EUCLIDEAN));
        assertFalse(ModalLogic.S4.has(ModalLogic.Frame.EUCLIDEAN));
        assertTrue(ModalLogic.D.has(ModalLogic.Frame.SERIAL));
        assertFalse(ModalLogic.D.has(ModalLogic.Frame.REFLEXIVE));
    }

    @Test
    void recommendationTable() {
        var r = ProverRecommendations.load(ProverRecommendations.RESOURCE);
        assertEquals("lean", r.recommend(FormulaType.MODAL, Complexity.HIGH).get(0));
        assertEquals("native", r.recommend(FormulaType.DEONTIC, Complexity.LOW).get(0));
        assertEquals(ProverRecommendations.DEFAULT_FALLBACK, r.fallback());
    }
}
