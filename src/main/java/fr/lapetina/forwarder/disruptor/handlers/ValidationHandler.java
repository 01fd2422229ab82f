package fr.lapetina.forwarder.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.forwarder.domain.event.BatchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * First stage handler: validates published batch events.
 *
 * Validates:
 * - Batch is present and not empty
 * - At least one destination, none null or unresolved
 */
public final class ValidationHandler implements EventHandler<BatchEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    @Override
    public void onEvent(BatchEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        if (event.shouldSkip()) {
            return;
        }

        String failure = validate(event);
        if (failure == null) {
            event.markValidated();
            log.debug("Batch validated: sequence={}, destinations={}", sequence, event.getDestinations().size());
        } else {
            event.markValidationFailed(failure);
            log.warn("Validation failed: sequence={}, reason={}", sequence, failure);
        }
    }

    private String validate(BatchEvent event) {
        if (event.getBatch() == null) {
            return "Batch is null";
        }
        if (event.getBatch().size() == 0) {
            return "Batch is empty";
        }
        if (event.getDestinations() == null || event.getDestinations().isEmpty()) {
            return "No destination given";
        }
        for (InetSocketAddress destination : event.getDestinations()) {
            if (destination == null) {
                return "Destination is null";
            }
            if (destination.isUnresolved()) {
                return "Destination is unresolved: " + destination;
            }
        }
        return null;
    }
}
