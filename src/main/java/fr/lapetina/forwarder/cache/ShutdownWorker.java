package fr.lapetina.forwarder.cache;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * A worker that has left the cache and still has to be stopped.
 *
 * {@link #shutdown()} waits for the worker task, so it is meant to run on a
 * separate task (see {@link DetachedShutdowns}) to hide the latency of a
 * graceful stop from whoever removed the entry.
 */
public final class ShutdownWorker {

    private final InetSocketAddress leader;
    private final WorkerInfo worker;

    ShutdownWorker(InetSocketAddress leader, WorkerInfo worker) {
        this.leader = Objects.requireNonNull(leader, "Leader is required");
        this.worker = Objects.requireNonNull(worker, "Worker is required");
    }

    public InetSocketAddress leader() {
        return leader;
    }

    /**
     * @throws WorkersCacheException with TASK_JOIN_FAILURE if the task ended abnormally
     */
    public void shutdown() {
        worker.shutdown();
    }

    @Override
    public String toString() {
        return "ShutdownWorker{leader=" + leader + '}';
    }
}
