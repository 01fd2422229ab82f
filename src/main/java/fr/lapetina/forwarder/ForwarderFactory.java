package fr.lapetina.forwarder;

import fr.lapetina.forwarder.disruptor.DispatchPipeline;
import fr.lapetina.forwarder.infrastructure.config.ConfigLoader;
import fr.lapetina.forwarder.infrastructure.config.ForwarderConfig;
import fr.lapetina.forwarder.infrastructure.http.HttpBatchTransport;
import fr.lapetina.forwarder.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.forwarder.worker.BatchTransport;
import fr.lapetina.forwarder.worker.ConnectionWorkerFactory;
import fr.lapetina.forwarder.worker.SendTransactionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Factory for creating a fully-wired forwarder from configuration.
 * This is the primary entry point for obtaining a configured DispatchPipeline.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ForwarderFactory factory = ForwarderFactory.create("forwarder.yaml").start()) {
 *     DispatchPipeline pipeline = factory.getPipeline();
 *     pipeline.submit(leaders, TransactionBatch.of(wiredTransactions));
 * }
 * }</pre>
 */
public class ForwarderFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ForwarderFactory.class);

    private final ForwarderConfig config;
    private final MetricsRegistry metricsRegistry;
    private final SendTransactionStats stats;
    private final ConnectionWorkerFactory workerFactory;
    private final DispatchPipeline pipeline;

    protected ForwarderFactory(String configPath, BatchTransport transportOverride) {
        log.info("Initializing ForwarderFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize transport (allow override for testing)
        BatchTransport transport = transportOverride != null ? transportOverride : createTransport();

        this.stats = new SendTransactionStats();
        metricsRegistry.bindSendStats(stats);

        this.workerFactory = new ConnectionWorkerFactory(
                transport,
                config.getWorker().getChannelSize(),
                config.getWorker().getMaxConsecutiveFailures(),
                stats
        );

        // Build pipeline
        this.pipeline = DispatchPipeline.builder()
                .fromConfig(config)
                .workerFactory(workerFactory)
                .metricsRegistry(metricsRegistry)
                .build();

        log.info("ForwarderFactory initialized: cacheCapacity={}", config.getCache().getCapacity());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ForwarderFactory create(String configPath) {
        return new ForwarderFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (forwarder.yaml).
     */
    public static ForwarderFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    /**
     * Starts the pipeline.
     */
    public ForwarderFactory start() {
        pipeline.start();
        log.info("Forwarder started");
        return this;
    }

    public DispatchPipeline getPipeline() {
        return pipeline;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public SendTransactionStats getStats() {
        return stats;
    }

    public ForwarderConfig getConfig() {
        return config;
    }

    private BatchTransport createTransport() {
        ForwarderConfig.TransportConfig transportConfig = config.getTransport();
        return new HttpBatchTransport(
                Duration.ofMillis(transportConfig.getConnectTimeoutMs()),
                Duration.ofMillis(transportConfig.getRequestTimeoutMs()),
                transportConfig.getPath()
        );
    }

    @Override
    public void close() {
        log.info("Shutting down ForwarderFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            workerFactory.close();
        } catch (Exception e) {
            log.warn("Error closing worker factory", e);
        }

        log.info("Final send stats: {}", stats);

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ForwarderFactory shut down");
    }
}
