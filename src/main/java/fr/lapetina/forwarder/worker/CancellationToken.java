package fr.lapetina.forwarder.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cooperative cancellation signal.
 *
 * Once cancelled it stays cancelled. Callbacks registered with
 * {@link #onCancel(Runnable)} run exactly once, either on the cancelling
 * thread or immediately on the registering thread if the token has already
 * fired. Registrations can be withdrawn so that long-lived tokens do not
 * accumulate callbacks from short-lived waits.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Runnable> callbacks = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();

    /**
     * Fires the token. Idempotent.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
        cancellation.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback to run when the token fires.
     *
     * @return a registration that withdraws the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Returns a future completed once the token has fired and all callbacks have run.
     */
    public CompletableFuture<Void> whenCancelled() {
        return cancellation;
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Error running cancellation callback", e);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + '}';
    }

    /**
     * Handle to a registered cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
