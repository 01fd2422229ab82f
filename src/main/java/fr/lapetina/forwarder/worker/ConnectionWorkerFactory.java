package fr.lapetina.forwarder.worker;

import fr.lapetina.forwarder.cache.WorkerInfo;
import fr.lapetina.forwarder.domain.model.TransactionBatch;
import fr.lapetina.forwarder.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link WorkerFactory}: one {@link ConnectionWorker} per destination,
 * each on its own thread from a cached pool.
 */
public class ConnectionWorkerFactory implements WorkerFactory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionWorkerFactory.class);

    private final BatchTransport transport;
    private final int channelSize;
    private final int maxConsecutiveFailures;
    private final SendTransactionStats stats;
    private final ExecutorService executor;

    public ConnectionWorkerFactory(
            BatchTransport transport,
            int channelSize,
            int maxConsecutiveFailures,
            SendTransactionStats stats
    ) {
        if (channelSize <= 0) {
            throw new IllegalArgumentException("channelSize must be > 0");
        }
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be > 0");
        }
        this.transport = transport;
        this.channelSize = channelSize;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.stats = stats;
        this.executor = Executors.newCachedThreadPool(NamedThreadFactory.daemon("connection-worker-"));
        log.info("ConnectionWorkerFactory initialized: channelSize={}, maxConsecutiveFailures={}",
                channelSize, maxConsecutiveFailures);
    }

    @Override
    public WorkerInfo spawn(InetSocketAddress destination) {
        WorkerChannel<TransactionBatch> channel = new WorkerChannel<>(channelSize);
        CancellationToken cancel = new CancellationToken();
        ConnectionWorker worker = new ConnectionWorker(
                destination, channel, transport, cancel, maxConsecutiveFailures, stats);

        CompletableFuture<Void> handle = CompletableFuture.runAsync(worker, executor);
        log.debug("Worker spawned: peer={}", destination);
        return new WorkerInfo(channel, handle, cancel);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Connection workers still running after 5s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
