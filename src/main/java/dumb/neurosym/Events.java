package dumb.neurosym;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static dumb.neurosym.util.Log.error;
import static java.util.Objects.requireNonNull;

/** Asynchronous, type-keyed event bus. Listener failures are logged and do not reach the emitter. */
public class Events {
    public final ExecutorService exe;
    final ConcurrentMap<Class<? extends ProofEvent>, CopyOnWriteArrayList<Consumer<ProofEvent>>> listeners = new ConcurrentHashMap<>();

    public Events(ExecutorService exe) {
        this.exe = requireNonNull(exe);
    }

    private static void exeSafe(Consumer<ProofEvent> listener, ProofEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            error("Error processing event listener for " + event.eventType() + ": " + e.getMessage(), e);
        }
    }

    public <T extends ProofEvent> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(ProofEvent event) {
        var l = listeners.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>());
        if (l.isEmpty() || exe.isShutdown()) return;
        try {
            exe.submit(() -> l.forEach(listener -> exeSafe(listener, event)));
        } catch (RejectedExecutionException e) {
            error("Dropped " + event.eventType() + ": " + e.getMessage());
        }
    }

    public int listenerCount() {
        return listeners.values().stream().mapToInt(List::size).sum();
    }
}
