package fr.lapetina.forwarder.domain.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of handing a batch to a worker: either delivered to its channel,
 * or rejected with exactly one {@link WorkersCacheError}.
 */
public record SendResult(WorkersCacheError error) {

    private static final SendResult OK = new SendResult(null);
    private static final Map<WorkersCacheError, SendResult> FAILURES = new EnumMap<>(WorkersCacheError.class);

    static {
        for (WorkersCacheError error : WorkersCacheError.values()) {
            FAILURES.put(error, new SendResult(error));
        }
    }

    public static SendResult ok() {
        return OK;
    }

    public static SendResult failure(WorkersCacheError error) {
        return FAILURES.get(Objects.requireNonNull(error, "Error is required"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean is(WorkersCacheError candidate) {
        return error == candidate;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SendResult{OK}" : "SendResult{" + error + '}';
    }
}
