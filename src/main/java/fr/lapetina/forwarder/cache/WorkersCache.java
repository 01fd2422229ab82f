package fr.lapetina.forwarder.cache;

import fr.lapetina.forwarder.domain.model.SendResult;
import fr.lapetina.forwarder.domain.model.TransactionBatch;
import fr.lapetina.forwarder.domain.model.WorkersCacheError;
import fr.lapetina.forwarder.worker.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded least-recently-used cache of workers, keyed by destination address.
 *
 * Recency is refreshed by {@link #push} and by the lookups done in both send
 * methods; {@link #contains} does not touch it. Workers leaving the cache are
 * handed back as {@link ShutdownWorker} (push, pop) or retired through
 * {@link DetachedShutdowns} (dead receiver), never stopped in-line, except by
 * {@link #shutdown()}.
 *
 * NOT thread-safe: callers serialise all calls on one writer. The only state
 * shared with other threads is each worker's channel and the cancellation token.
 */
public final class WorkersCache {

    private static final Logger log = LoggerFactory.getLogger(WorkersCache.class);

    private final LinkedHashMap<InetSocketAddress, WorkerInfo> workers;
    private final int capacity;

    // Interrupts outstanding sendTransactionsToAddress() calls once shutdown() starts.
    private final CancellationToken cancel;
    private final DetachedShutdowns detachedShutdowns;
    private final boolean ownsDetachedShutdowns;

    /**
     * Creates a cache that retires workers on its own {@link DetachedShutdowns};
     * {@link #shutdown()} waits for those and releases them.
     */
    public WorkersCache(int capacity, CancellationToken cancel) {
        this(capacity, cancel, new DetachedShutdowns(), true);
    }

    /**
     * Creates a cache that retires workers on a caller-managed {@link DetachedShutdowns}.
     */
    public WorkersCache(int capacity, CancellationToken cancel, DetachedShutdowns detachedShutdowns) {
        this(capacity, cancel, detachedShutdowns, false);
    }

    private WorkersCache(int capacity, CancellationToken cancel, DetachedShutdowns detachedShutdowns,
                         boolean ownsDetachedShutdowns) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.cancel = Objects.requireNonNull(cancel, "Cancellation token is required");
        this.detachedShutdowns = Objects.requireNonNull(detachedShutdowns, "DetachedShutdowns is required");
        this.ownsDetachedShutdowns = ownsDetachedShutdowns;
        this.workers = new LinkedHashMap<>(16, 0.75f, true);
    }

    public boolean contains(InetSocketAddress peer) {
        return workers.containsKey(peer);
    }

    /**
     * Inserts the worker as most recently used.
     *
     * @return the worker previously cached for this leader, or else the least recently
     *         used worker if capacity was exceeded; the caller must retire it
     */
    public Optional<ShutdownWorker> push(InetSocketAddress leader, WorkerInfo peerWorker) {
        Objects.requireNonNull(leader, "Leader is required");
        Objects.requireNonNull(peerWorker, "Worker is required");

        WorkerInfo replaced = workers.put(leader, peerWorker);
        if (replaced != null && replaced != peerWorker) {
            return Optional.of(new ShutdownWorker(leader, replaced));
        }
        if (workers.size() > capacity) {
            return popLru();
        }
        return Optional.empty();
    }

    public Optional<ShutdownWorker> pop(InetSocketAddress leader) {
        WorkerInfo popped = workers.remove(leader);
        if (popped == null) {
            return Optional.empty();
        }
        return Optional.of(new ShutdownWorker(leader, popped));
    }

    /**
     * Hands the batch to the peer's worker without waiting.
     *
     * Returns FULL_CHANNEL if the worker's channel is full and SHUTDOWN once the
     * cache is shutting down. If the worker's receiver has been dropped, returns
     * RECEIVER_DROPPED and removes the worker from the cache.
     *
     * @throws IllegalStateException if no worker is cached for the peer; existence
     *         must be checked with {@link #contains} before this call
     */
    public SendResult trySendTransactionsToAddress(InetSocketAddress peer, TransactionBatch txsBatch) {
        if (cancel.isCancelled()) {
            return SendResult.failure(WorkersCacheError.SHUTDOWN);
        }

        WorkerInfo currentWorker = getWorker(peer);
        SendResult sendResult = currentWorker.trySendTransactions(txsBatch);

        if (sendResult.is(WorkersCacheError.RECEIVER_DROPPED)) {
            log.debug("Failed to deliver transaction batch for leader {}, drop batch.", peer.getAddress());
            detachedShutdowns.detachAndShutdown(pop(peer));
        }
        return sendResult;
    }

    /**
     * Hands the batch to the peer's worker, waiting for channel capacity.
     *
     * The wait is raced against the cache's cancellation token: once the token has
     * fired the call returns SHUTDOWN, whatever the channel state. A worker whose
     * receiver has been dropped is removed as in {@link #trySendTransactionsToAddress}.
     *
     * @throws IllegalStateException if no worker is cached for the peer
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public SendResult sendTransactionsToAddress(InetSocketAddress peer, TransactionBatch txsBatch)
            throws InterruptedException {
        if (cancel.isCancelled()) {
            return SendResult.failure(WorkersCacheError.SHUTDOWN);
        }

        WorkerInfo currentWorker = getWorker(peer);
        SendResult sendResult = currentWorker.sendTransactions(txsBatch, cancel);

        if (sendResult.is(WorkersCacheError.RECEIVER_DROPPED)) {
            // Remove the worker from the cache, if the peer has disconnected.
            detachedShutdowns.detachAndShutdown(pop(peer));
        }
        return sendResult;
    }

    /**
     * Fires the cancellation token, then stops every cached worker in least recently
     * used order. A worker that fails to stop is logged and does not halt the drain.
     * When the cache owns its {@link DetachedShutdowns}, also waits for the evicted
     * and pruned workers still stopping in the background.
     */
    public void shutdown() {
        cancel.cancel();

        Optional<ShutdownWorker> next;
        while ((next = popLru()).isPresent()) {
            ShutdownWorker worker = next.get();
            try {
                worker.shutdown();
            } catch (WorkersCacheException e) {
                log.debug("Error while shutting down worker for {}: {}", worker.leader(), e.getMessage());
            }
        }

        if (ownsDetachedShutdowns) {
            detachedShutdowns.close();
        }
    }

    public boolean isShutdown() {
        return cancel.isCancelled();
    }

    public int size() {
        return workers.size();
    }

    public int capacity() {
        return capacity;
    }

    private WorkerInfo getWorker(InetSocketAddress peer) {
        WorkerInfo worker = workers.get(peer);
        if (worker == null) {
            throw new IllegalStateException("Failed to fetch worker for peer " + peer + ". "
                    + "Peer existence must be checked before this call using `contains` method.");
        }
        return worker;
    }

    private Optional<ShutdownWorker> popLru() {
        Iterator<Map.Entry<InetSocketAddress, WorkerInfo>> eldest = workers.entrySet().iterator();
        if (!eldest.hasNext()) {
            return Optional.empty();
        }
        Map.Entry<InetSocketAddress, WorkerInfo> entry = eldest.next();
        ShutdownWorker popped = new ShutdownWorker(entry.getKey(), entry.getValue());
        eldest.remove();
        return Optional.of(popped);
    }
}
