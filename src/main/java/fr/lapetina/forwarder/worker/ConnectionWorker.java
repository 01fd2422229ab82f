package fr.lapetina.forwarder.worker;

import fr.lapetina.forwarder.domain.model.TransactionBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Worker task owning the receive side of one destination's channel.
 *
 * Runs until its cancellation token fires, the channel is closed and drained,
 * or the transport has failed {@code maxConsecutiveFailures} times in a row.
 * In every case the receiver is closed on exit, so that the cache observes
 * RECEIVER_DROPPED on its next send and prunes the entry.
 *
 * An unchecked exception from the transport ends the task exceptionally; the
 * cache reports that as TASK_JOIN_FAILURE when it shuts the worker down.
 */
public final class ConnectionWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionWorker.class);

    private final InetSocketAddress peer;
    private final WorkerChannel<TransactionBatch> receiver;
    private final BatchTransport transport;
    private final CancellationToken cancel;
    private final int maxConsecutiveFailures;
    private final SendTransactionStats stats;

    private int consecutiveFailures;

    public ConnectionWorker(
            InetSocketAddress peer,
            WorkerChannel<TransactionBatch> receiver,
            BatchTransport transport,
            CancellationToken cancel,
            int maxConsecutiveFailures,
            SendTransactionStats stats
    ) {
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be > 0");
        }
        this.peer = peer;
        this.receiver = receiver;
        this.transport = transport;
        this.cancel = cancel;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.stats = stats;
    }

    @Override
    public void run() {
        log.debug("Worker started: peer={}", peer);
        try {
            TransactionBatch batch;
            while ((batch = receiver.receive(cancel)) != null) {
                if (!deliver(batch)) {
                    stats.recordAbandonedWorker();
                    log.warn("Giving up on peer: peer={}, consecutiveFailures={}", peer, consecutiveFailures);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker interrupted: peer={}", peer);
        } finally {
            receiver.closeReceiver();
            log.debug("Worker stopped: peer={}, cancelled={}", peer, cancel.isCancelled());
        }
    }

    private boolean deliver(TransactionBatch batch) {
        try {
            transport.send(peer, batch);
            consecutiveFailures = 0;
            stats.recordSent(batch.size());
            return true;
        } catch (IOException e) {
            consecutiveFailures++;
            stats.recordFailure(batch.size());
            log.debug("Failed to deliver batch: peer={}, size={}, consecutiveFailures={}, error={}",
                    peer, batch.size(), consecutiveFailures, e.getMessage());
            return consecutiveFailures < maxConsecutiveFailures;
        }
    }
}
