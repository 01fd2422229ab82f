package fr.lapetina.forwarder.cache;

import fr.lapetina.forwarder.domain.model.SendResult;
import fr.lapetina.forwarder.domain.model.TransactionBatch;
import fr.lapetina.forwarder.domain.model.WorkersCacheError;
import fr.lapetina.forwarder.worker.CancellationToken;
import fr.lapetina.forwarder.worker.WorkerChannel;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to one live worker: the send side of its channel, the task's
 * completion future and the worker's own cancellation token.
 *
 * A handle is owned by exactly one cache slot, then by a {@link ShutdownWorker}.
 * {@link #shutdown()} consumes it; any later use throws {@link IllegalStateException}.
 */
public final class WorkerInfo {

    private final WorkerChannel<TransactionBatch> sender;
    private final CompletableFuture<Void> handle;
    private final CancellationToken cancel;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public WorkerInfo(
            WorkerChannel<TransactionBatch> sender,
            CompletableFuture<Void> handle,
            CancellationToken cancel
    ) {
        this.sender = Objects.requireNonNull(sender, "Sender is required");
        this.handle = Objects.requireNonNull(handle, "Task handle is required");
        this.cancel = Objects.requireNonNull(cancel, "Cancellation token is required");
    }

    SendResult trySendTransactions(TransactionBatch batch) {
        return sender.trySend(batch);
    }

    /**
     * Waits for channel capacity unless {@code interrupt} fires first.
     */
    SendResult sendTransactions(TransactionBatch batch, CancellationToken interrupt) throws InterruptedException {
        return sender.send(batch, interrupt);
    }

    /**
     * Stops the worker: fires its token, closes the sender so the receive loop sees
     * end of stream, then waits for the task to finish.
     *
     * @throws WorkersCacheException with TASK_JOIN_FAILURE if the task ended abnormally
     * @throws IllegalStateException if the handle was already shut down
     */
    void shutdown() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker has already been shut down");
        }
        cancel.cancel();
        sender.closeSender();
        try {
            handle.get();
        } catch (ExecutionException | CancellationException e) {
            throw new WorkersCacheException(WorkersCacheError.TASK_JOIN_FAILURE, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkersCacheException(WorkersCacheError.TASK_JOIN_FAILURE, e);
        }
    }
}
