package fr.lapetina.forwarder.domain.model;

/**
 * Closed error taxonomy for worker delivery and shutdown.
 */
public enum WorkersCacheError {
    /** The worker's receiving side is gone; typically the connection could not be established. */
    RECEIVER_DROPPED("Work receiver has been dropped unexpectedly"),

    /** Transient backpressure on the non-blocking path. */
    FULL_CHANNEL("Worker's channel is full"),

    /** Awaiting the worker task failed during shutdown. */
    TASK_JOIN_FAILURE("Task failed to join"),

    /** The cache is being shut down. */
    SHUTDOWN("The WorkersCache is being shutdown");

    private final String message;

    WorkersCacheError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
