/**
 * Per-destination worker tasks and the plumbing between them and the cache.
 *
 * <p>Each destination gets one bounded {@link fr.lapetina.forwarder.worker.WorkerChannel},
 * one {@link fr.lapetina.forwarder.worker.CancellationToken} and one
 * {@link fr.lapetina.forwarder.worker.ConnectionWorker} draining the channel into a
 * {@link fr.lapetina.forwarder.worker.BatchTransport}. Batches for a destination are
 * transmitted in the order they were enqueued.
 *
 * <h2>Worker Contract</h2>
 * <p>A worker owns the receive side of its channel, stops when the channel is closed or
 * its token fires, and completes normally in both cases. Closing the receiver is how a
 * worker that gave up tells the cache it is dead.
 *
 * @see fr.lapetina.forwarder.worker.WorkerFactory
 * @see fr.lapetina.forwarder.cache.WorkersCache
 */
package fr.lapetina.forwarder.worker;
