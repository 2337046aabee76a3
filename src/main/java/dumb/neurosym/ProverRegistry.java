package dumb.neurosym;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dumb.neurosym.util.Log.message;
import static java.util.Objects.requireNonNull;

/** Named provers in registration order. */
public class ProverRegistry {

    private final Map<String, Prover> provers = new LinkedHashMap<>();

    public static ProverRegistry of(Prover... p) {
        var r = new ProverRegistry();
        for (var x : p) r.register(x);
        return r;
    }

    /** Replaces any prover registered under the same name. */
    public synchronized ProverRegistry register(Prover p) {
        requireNonNull(p);
        if (provers.put(p.name(), p) != null) message("Replaced prover " + p.name());
        return this;
    }

    public synchronized boolean unregister(String name) {
        return provers.remove(name) != null;
    }

    public synchronized @Nullable Prover get(String name) {
        return provers.get(name);
    }

    public synchronized List<Prover> all() {
        return new ArrayList<>(provers.values());
    }

    public synchronized List<String> names() {
        return new ArrayList<>(provers.keySet());
    }

    public List<Prover> available() {
        return all().stream().filter(Prover::isAvailable).toList();
    }
}
