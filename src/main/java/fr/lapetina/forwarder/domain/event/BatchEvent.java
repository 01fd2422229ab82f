package fr.lapetina.forwarder.domain.event;

import fr.lapetina.forwarder.domain.model.TransactionBatch;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.List;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * It should never be accessed outside the Disruptor pipeline handlers.
 */
public final class BatchEvent {

    private List<InetSocketAddress> destinations;
    private TransactionBatch batch;

    private EventState state;
    private String errorMessage;
    private Instant acceptedAt;
    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.destinations = null;
        this.batch = null;
        this.state = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new batch.
     */
    public void initialize(List<InetSocketAddress> destinations, TransactionBatch batch) {
        clear();
        this.destinations = destinations;
        this.batch = batch;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public List<InetSocketAddress> getDestinations() {
        return destinations;
    }

    public TransactionBatch getBatch() {
        return batch;
    }

    public EventState getState() {
        return state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
    }

    public void markValidationFailed(String message) {
        this.state = EventState.VALIDATION_FAILED;
        this.errorMessage = message;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
    }

    public boolean shouldSkip() {
        return state == EventState.VALIDATION_FAILED || state == EventState.DISPATCHED;
    }

    @Override
    public String toString() {
        return "BatchEvent{" +
                "destinations=" + (destinations != null ? destinations.size() : 0) +
                ", batch=" + batch +
                ", state=" + state +
                ", seq=" + sequence +
                '}';
    }
}
