package fr.lapetina.forwarder.worker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Transaction counters shared by all workers of a factory.
 * Thread-safe via atomic counters.
 */
public final class SendTransactionStats {

    private final AtomicLong successfullySent = new AtomicLong();
    private final AtomicLong failedToSend = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();
    private final AtomicLong abandonedWorkers = new AtomicLong();

    public void recordSent(int transactions) {
        successfullySent.addAndGet(transactions);
    }

    public void recordFailure(int transactions) {
        failedToSend.addAndGet(transactions);
        failedBatches.incrementAndGet();
    }

    public void recordAbandonedWorker() {
        abandonedWorkers.incrementAndGet();
    }

    public long getSuccessfullySent() {
        return successfullySent.get();
    }

    public long getFailedToSend() {
        return failedToSend.get();
    }

    public long getFailedBatches() {
        return failedBatches.get();
    }

    public long getAbandonedWorkers() {
        return abandonedWorkers.get();
    }

    @Override
    public String toString() {
        return "SendTransactionStats{" +
                "sent=" + successfullySent.get() +
                ", failed=" + failedToSend.get() +
                ", failedBatches=" + failedBatches.get() +
                ", abandonedWorkers=" + abandonedWorkers.get() +
                '}';
    }
}
