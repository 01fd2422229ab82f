/**
 * Bounded LRU cache of per-destination workers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.forwarder.cache.WorkersCache} - The cache and its two delivery paths</li>
 *   <li>{@link fr.lapetina.forwarder.cache.WorkerInfo} - Handle to one live worker</li>
 *   <li>{@link fr.lapetina.forwarder.cache.ShutdownWorker} - A worker that left the cache and must be stopped</li>
 *   <li>{@link fr.lapetina.forwarder.cache.DetachedShutdowns} - Stops retired workers off the caller's thread</li>
 * </ul>
 *
 * <h2>Delivery Paths</h2>
 * <p>{@code trySendTransactionsToAddress} never waits and reports a full channel as
 * {@code FULL_CHANNEL}. {@code sendTransactionsToAddress} waits for capacity and is
 * interrupted by the cache's cancellation token. Both remove a worker whose receiver
 * has gone away and report {@code RECEIVER_DROPPED} for that one send.
 *
 * <h2>Threading</h2>
 * <p>The cache is single-writer. In this project the dispatch handler thread of
 * {@link fr.lapetina.forwarder.disruptor.DispatchPipeline} is that writer.
 */
package fr.lapetina.forwarder.cache;
