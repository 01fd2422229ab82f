package fr.lapetina.forwarder.cache;

import fr.lapetina.forwarder.domain.model.WorkersCacheError;

/**
 * Exception thrown when retiring a worker fails.
 */
public final class WorkersCacheException extends RuntimeException {

    private final WorkersCacheError error;

    public WorkersCacheException(WorkersCacheError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public WorkersCacheError getError() {
        return error;
    }
}
