package fr.lapetina.forwarder.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import fr.lapetina.forwarder.cache.DetachedShutdowns;
import fr.lapetina.forwarder.cache.ShutdownWorker;
import fr.lapetina.forwarder.cache.WorkerInfo;
import fr.lapetina.forwarder.cache.WorkersCache;
import fr.lapetina.forwarder.domain.event.BatchEvent;
import fr.lapetina.forwarder.domain.event.EventState;
import fr.lapetina.forwarder.domain.model.SendResult;
import fr.lapetina.forwarder.domain.model.TransactionBatch;
import fr.lapetina.forwarder.domain.model.WorkersCacheError;
import fr.lapetina.forwarder.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.forwarder.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Second stage handler: hands each validated batch to the worker of every destination.
 *
 * This handler is the single writer of the {@link WorkersCache}: every push, pop
 * and send happens on its thread, including the final drain in {@link #onShutdown()}.
 *
 * Missing workers are spawned on demand; the worker evicted to make room is
 * retired through {@link DetachedShutdowns}. With backpressure enabled the handler
 * waits for channel capacity, otherwise a full channel drops the batch for that
 * destination.
 */
public final class DispatchHandler implements EventHandler<BatchEvent>, LifecycleAware {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final WorkersCache workersCache;
    private final WorkerFactory workerFactory;
    private final DetachedShutdowns detachedShutdowns;
    private final MetricsRegistry metricsRegistry;
    private final boolean backpressure;
    private final CompletableFuture<Void> drained = new CompletableFuture<>();

    public DispatchHandler(
            WorkersCache workersCache,
            WorkerFactory workerFactory,
            DetachedShutdowns detachedShutdowns,
            MetricsRegistry metricsRegistry,
            boolean backpressure
    ) {
        this.workersCache = workersCache;
        this.workerFactory = workerFactory;
        this.detachedShutdowns = detachedShutdowns;
        this.metricsRegistry = metricsRegistry;
        this.backpressure = backpressure;
    }

    @Override
    public void onEvent(BatchEvent event, long sequence, boolean endOfBatch) {
        if (event.getState() != EventState.VALIDATED) {
            return;
        }

        TransactionBatch batch = event.getBatch();
        MDC.put("sequence", String.valueOf(sequence));
        try {
            for (InetSocketAddress destination : event.getDestinations()) {
                MDC.put("destination", destination.toString());
                record(destination, dispatch(destination, batch));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatch interrupted: sequence={}", sequence);
        } finally {
            MDC.remove("destination");
            MDC.remove("sequence");
        }

        event.markDispatched();
        metricsRegistry.setCachedWorkers(workersCache.size());
        metricsRegistry.recordDispatchLatency(Duration.between(event.getAcceptedAt(), Instant.now()));
    }

    private SendResult dispatch(InetSocketAddress destination, TransactionBatch batch) throws InterruptedException {
        // Do not spawn workers into a cache that is shutting down
        if (workersCache.isShutdown()) {
            return SendResult.failure(WorkersCacheError.SHUTDOWN);
        }
        if (!workersCache.contains(destination)) {
            spawnWorker(destination);
        }
        return backpressure
                ? workersCache.sendTransactionsToAddress(destination, batch)
                : workersCache.trySendTransactionsToAddress(destination, batch);
    }

    private void spawnWorker(InetSocketAddress destination) {
        WorkerInfo worker = workerFactory.spawn(destination);
        metricsRegistry.incrementWorkersSpawned();

        Optional<ShutdownWorker> evicted = workersCache.push(destination, worker);
        evicted.ifPresent(shutdownWorker -> {
            metricsRegistry.incrementWorkersEvicted();
            log.debug("Evicting worker: leader={}", shutdownWorker.leader());
        });
        detachedShutdowns.detachAndShutdown(evicted);
    }

    private void record(InetSocketAddress destination, SendResult result) {
        if (result.isSuccess()) {
            metricsRegistry.incrementBatchesDelivered();
            return;
        }

        WorkersCacheError error = result.error();
        metricsRegistry.incrementSendError(error);
        switch (error) {
            case RECEIVER_DROPPED -> {
                metricsRegistry.incrementWorkersPruned();
                log.debug("Worker for {} is gone and was removed, batch dropped", destination);
            }
            case FULL_CHANNEL -> log.debug("Worker channel full for {}, batch dropped", destination);
            case SHUTDOWN -> log.debug("Cache shutting down, batch for {} dropped", destination);
            default -> log.warn("Unexpected send failure for {}: {}", destination, error.getMessage());
        }
    }

    @Override
    public void onStart() {
        log.info("DispatchHandler started: capacity={}, backpressure={}", workersCache.capacity(), backpressure);
    }

    @Override
    public void onShutdown() {
        try {
            int remaining = workersCache.size();
            workersCache.shutdown();
            metricsRegistry.setCachedWorkers(0);
            log.info("Workers cache drained: workers={}", remaining);
        } finally {
            drained.complete(null);
        }
    }

    /**
     * Completes once the cache has been drained on the handler thread.
     */
    public CompletableFuture<Void> drained() {
        return drained;
    }
}
