package fr.lapetina.forwarder.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating BatchEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by
 * re-initializing them on publish.
 */
public final class BatchEventFactory implements EventFactory<BatchEvent> {

    @Override
    public BatchEvent newInstance() {
        return new BatchEvent();
    }
}
