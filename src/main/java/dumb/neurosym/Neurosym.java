package dumb.neurosym;

import dumb.neurosym.FormulaParser.ParseException;

import java.util.List;

import static dumb.neurosym.util.Log.message;

/**
 * Default wiring: parser, cache, analyzer, and a router with the native prover registered. External provers
 * are added through {@link #provers}.
 */
public class Neurosym implements AutoCloseable {

    public final Config config;
    public final FormulaParser parser;
    public final ProofCache cache;
    public final FormulaAnalyzer analyzer;
    public final ProverRegistry provers;
    public final ProverRouter router;

    public Neurosym(Config config) {
        this.config = config;
        this.parser = new FormulaParser(config.parser());
        this.cache = new ProofCache(config.cache());
        this.analyzer = new FormulaAnalyzer(config.analyzer());
        this.provers = ProverRegistry.of(new NativeProver(config.engine()));
        this.router = new ProverRouter(provers, cache, analyzer, config.router());
        message("Neurosym ready: provers " + provers.names() + ", strategy " + config.router().strategy());
    }

    public static Neurosym create() {
        return new Neurosym(Config.load());
    }

    public Formula parse(String text) throws ParseException {
        return parser.parse(text);
    }

    public ProofResult prove(String goal, String... axioms) throws ParseException {
        return prove(parse(goal), parser.parseAll(List.of(axioms)));
    }

    public ProofResult prove(Formula goal, List<Formula> axioms) {
        return router.prove(goal, axioms);
    }

    @Override
    public void close() {
        router.close();
    }
}
