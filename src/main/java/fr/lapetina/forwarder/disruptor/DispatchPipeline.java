package fr.lapetina.forwarder.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.forwarder.cache.DetachedShutdowns;
import fr.lapetina.forwarder.cache.WorkersCache;
import fr.lapetina.forwarder.disruptor.exception.BackpressureException;
import fr.lapetina.forwarder.disruptor.handlers.DispatchHandler;
import fr.lapetina.forwarder.disruptor.handlers.ValidationHandler;
import fr.lapetina.forwarder.domain.event.BatchEvent;
import fr.lapetina.forwarder.domain.event.BatchEventFactory;
import fr.lapetina.forwarder.domain.model.TransactionBatch;
import fr.lapetina.forwarder.infrastructure.config.ForwarderConfig;
import fr.lapetina.forwarder.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.forwarder.util.NamedThreadFactory;
import fr.lapetina.forwarder.worker.CancellationToken;
import fr.lapetina.forwarder.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Disruptor pipeline that serialises every workers cache operation on one thread.
 *
 * The cache is single-writer by contract. Publishing batches through a ring
 * buffer gives any number of producer threads a non-blocking entry point while
 * the {@link DispatchHandler} thread stays the only one touching the cache.
 *
 * Stages: Validation -> Dispatch.
 *
 * Shutdown order:
 * 1. fire the cache's cancellation token, which releases a dispatch blocked on a full channel
 * 2. shut the Disruptor down; the dispatch handler drains the cache on its own thread
 * 3. wait for detached worker shutdowns (evictions and prunes) to finish
 */
public final class DispatchPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchPipeline.class);

    private final Disruptor<BatchEvent> disruptor;
    private final RingBuffer<BatchEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final CancellationToken cancel;
    private final DetachedShutdowns detachedShutdowns;
    private final DispatchHandler dispatchHandler;
    private final Duration shutdownTimeout;

    private DispatchPipeline(Builder builder) {
        this.shutdownTimeout = Duration.ofMillis(builder.shutdownTimeoutMs);
        this.cancel = new CancellationToken();
        this.detachedShutdowns = new DetachedShutdowns();

        WorkersCache workersCache = new WorkersCache(builder.cacheCapacity, cancel, detachedShutdowns);

        this.disruptor = new Disruptor<>(
                new BatchEventFactory(),
                builder.ringBufferSize,
                new NamedThreadFactory("dispatch-handler-", false),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        ValidationHandler validationHandler = new ValidationHandler();
        this.dispatchHandler = new DispatchHandler(
                workersCache,
                builder.workerFactory,
                detachedShutdowns,
                builder.metricsRegistry,
                builder.backpressure
        );

        disruptor
                .handleEventsWith(validationHandler)
                .then(dispatchHandler);

        disruptor.setDefaultExceptionHandler(new DispatchExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DispatchPipeline created: ringBufferSize={}, waitStrategy={}, cacheCapacity={}, backpressure={}",
                builder.ringBufferSize, builder.waitStrategy, builder.cacheCapacity, builder.backpressure);
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DispatchPipeline started");
        }
    }

    /**
     * Publishes a batch for delivery to every given destination.
     *
     * @throws BackpressureException if the ring buffer is full
     * @throws IllegalStateException if the pipeline is not running
     */
    public void submit(Collection<InetSocketAddress> destinations, TransactionBatch batch) {
        if (!running.get()) {
            throw new IllegalStateException("Pipeline not running");
        }

        // Null entries are kept for the validation stage to reject
        List<InetSocketAddress> targets = destinations != null ? new ArrayList<>(destinations) : List.of();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            ringBuffer.get(sequence).initialize(targets, batch);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Batch submitted: sequence={}, destinations={}, size={}",
                sequence, targets.size(), batch != null ? batch.size() : 0);
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getPendingShutdowns() {
        return detachedShutdowns.pendingCount();
    }

    /**
     * Gracefully shuts down the pipeline, stopping every worker.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down DispatchPipeline...");

        cancel.cancel();
        try {
            disruptor.shutdown(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("DispatchPipeline shutdown timed out, halting...");
            disruptor.halt();
        }

        try {
            dispatchHandler.drained().get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            log.warn("Workers cache was not drained within {}ms", shutdownTimeout.toMillis(), e);
        }

        detachedShutdowns.close();
        log.info("DispatchPipeline shut down");
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    // Getters for testing
    public DispatchHandler getDispatchHandler() {
        return dispatchHandler;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class DispatchExceptionHandler implements ExceptionHandler<BatchEvent> {

        private static final Logger log = LoggerFactory.getLogger(DispatchExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, BatchEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for DispatchPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int cacheCapacity = 1024;
        private boolean backpressure = false;
        private long shutdownTimeoutMs = 30_000;
        private WorkerFactory workerFactory;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder cacheCapacity(int capacity) {
            this.cacheCapacity = capacity;
            return this;
        }

        public Builder backpressure(boolean backpressure) {
            this.backpressure = backpressure;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder workerFactory(WorkerFactory factory) {
            this.workerFactory = factory;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(ForwarderConfig config) {
            this.ringBufferSize = config.getDispatch().getRingBufferSize();
            this.waitStrategy = config.getDispatch().getWaitStrategy();
            this.backpressure = config.getDispatch().isBackpressure();
            this.shutdownTimeoutMs = config.getDispatch().getShutdownTimeoutMs();
            this.cacheCapacity = config.getCache().getCapacity();
            return this;
        }

        public DispatchPipeline build() {
            if (workerFactory == null) {
                throw new IllegalStateException("WorkerFactory is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new DispatchPipeline(this);
        }
    }
}
