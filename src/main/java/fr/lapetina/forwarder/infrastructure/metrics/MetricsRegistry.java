package fr.lapetina.forwarder.infrastructure.metrics;

import fr.lapetina.forwarder.domain.model.WorkersCacheError;
import fr.lapetina.forwarder.worker.SendTransactionStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Delivered batch and send error counters
 * - Worker spawn, eviction and prune counters
 * - Cached worker gauge
 * - Transaction counters backed by {@link SendTransactionStats}
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Counter batchesDelivered;
    private final Counter workersSpawned;
    private final Counter workersEvicted;
    private final Counter workersPruned;
    private final Timer dispatchLatency;
    private final Map<WorkersCacheError, Counter> sendErrors = new EnumMap<>(WorkersCacheError.class);

    private final AtomicInteger cachedWorkers = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.batchesDelivered = Counter.builder(prefix + "_batches_delivered_total")
                .description("Batches accepted by a worker channel")
                .register(registry);
        this.workersSpawned = Counter.builder(prefix + "_workers_spawned_total")
                .description("Workers started for new destinations")
                .register(registry);
        this.workersEvicted = Counter.builder(prefix + "_workers_evicted_total")
                .description("Workers evicted as least recently used")
                .register(registry);
        this.workersPruned = Counter.builder(prefix + "_workers_pruned_total")
                .description("Workers removed after their receiver was dropped")
                .register(registry);
        this.dispatchLatency = Timer.builder(prefix + "_dispatch_latency")
                .description("Time from submission to hand-off to all destination workers")
                .publishPercentileHistogram()
                .register(registry);

        for (WorkersCacheError error : WorkersCacheError.values()) {
            sendErrors.put(error, Counter.builder(prefix + "_send_errors_total")
                    .description("Failed hand-offs to worker channels")
                    .tag("type", error.name())
                    .register(registry));
        }

        Gauge.builder(prefix + "_cached_workers", cachedWorkers, AtomicInteger::get)
                .description("Number of workers currently cached")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Exposes the transaction counters of a worker factory.
     */
    public void bindSendStats(SendTransactionStats stats) {
        FunctionCounter.builder(prefix + "_transactions_sent_total", stats, SendTransactionStats::getSuccessfullySent)
                .description("Transactions transmitted to destinations")
                .register(registry);
        FunctionCounter.builder(prefix + "_transactions_failed_total", stats, SendTransactionStats::getFailedToSend)
                .description("Transactions whose transmission failed")
                .register(registry);
        FunctionCounter.builder(prefix + "_workers_abandoned_total", stats, SendTransactionStats::getAbandonedWorkers)
                .description("Workers that gave up after consecutive failures")
                .register(registry);
    }

    public void incrementBatchesDelivered() {
        batchesDelivered.increment();
    }

    public void incrementSendError(WorkersCacheError error) {
        sendErrors.get(error).increment();
    }

    public void incrementWorkersSpawned() {
        workersSpawned.increment();
    }

    public void incrementWorkersEvicted() {
        workersEvicted.increment();
    }

    public void incrementWorkersPruned() {
        workersPruned.increment();
    }

    public void recordDispatchLatency(Duration latency) {
        dispatchLatency.record(latency);
    }

    public void setCachedWorkers(int value) {
        cachedWorkers.set(value);
    }

    public int getCachedWorkers() {
        return cachedWorkers.get();
    }

    public double getSendErrorCount(WorkersCacheError error) {
        return sendErrors.get(error).count();
    }

    public double getBatchesDelivered() {
        return batchesDelivered.count();
    }

    public double getWorkersEvicted() {
        return workersEvicted.count();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
