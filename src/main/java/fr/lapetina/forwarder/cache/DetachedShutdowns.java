package fr.lapetina.forwarder.cache;

import fr.lapetina.forwarder.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs worker shutdowns off the caller's thread.
 *
 * Used for workers evicted by {@link WorkersCache#push} and for workers pruned
 * after a RECEIVER_DROPPED send, so that cache mutations never wait for a
 * worker to stop. Outstanding shutdowns are tracked and can be awaited, which
 * lets an orderly process exit account for every retired worker.
 */
public final class DetachedShutdowns implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DetachedShutdowns.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();

    public DetachedShutdowns() {
        this(Executors.newCachedThreadPool(NamedThreadFactory.daemon("worker-shutdown-")), true);
    }

    /**
     * Uses a caller-managed executor; {@link #close()} leaves it running.
     */
    public DetachedShutdowns(ExecutorService executor) {
        this(executor, false);
    }

    private DetachedShutdowns(ExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Shuts the worker down on a separate task, if there is one. Failures are logged.
     */
    public void detachAndShutdown(Optional<ShutdownWorker> worker) {
        if (worker.isEmpty()) {
            return;
        }
        ShutdownWorker shutdownWorker = worker.get();

        CompletableFuture<Void> task;
        try {
            task = CompletableFuture.runAsync(() -> shutdown(shutdownWorker), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Shutdown executor rejected task, stopping worker in-line: leader={}",
                    shutdownWorker.leader());
            shutdown(shutdownWorker);
            return;
        }
        pending.add(task);
        task.whenComplete((ignored, error) -> pending.remove(task));
    }

    /**
     * Waits for every shutdown detached so far.
     *
     * @return true if all of them finished within the timeout
     */
    public boolean awaitPending(Duration timeout) throws InterruptedException {
        CompletableFuture<?>[] outstanding = pending.toArray(new CompletableFuture<?>[0]);
        if (outstanding.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(outstanding).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Detached worker shutdowns still pending after {}ms: pending={}",
                    timeout.toMillis(), pending.size());
            return false;
        } catch (ExecutionException e) {
            log.error("Detached worker shutdown failed unexpectedly", e.getCause());
            return pending.isEmpty();
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        try {
            awaitPending(CLOSE_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    private static void shutdown(ShutdownWorker worker) {
        try {
            worker.shutdown();
        } catch (WorkersCacheException e) {
            log.debug("Error while shutting down worker for {}: {}", worker.leader(), e.getMessage());
        }
    }
}
