package fr.lapetina.forwarder.worker;

import fr.lapetina.forwarder.domain.model.TransactionBatch;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Transmits one batch to a remote destination.
 *
 * Implementations are called from the destination's worker thread only, one
 * batch at a time, in channel order.
 */
@FunctionalInterface
public interface BatchTransport {

    /**
     * Sends the batch, blocking until the destination has accepted it.
     *
     * @throws IOException if the destination could not be reached or rejected the batch
     */
    void send(InetSocketAddress destination, TransactionBatch batch) throws IOException;
}
