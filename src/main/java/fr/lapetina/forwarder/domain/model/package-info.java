/**
 * Domain values shared by the cache, the workers and the dispatch pipeline.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.forwarder.domain.model.TransactionBatch} - Immutable batch of wire transactions</li>
 *   <li>{@link fr.lapetina.forwarder.domain.model.SendResult} - Outcome of a delivery attempt</li>
 *   <li>{@link fr.lapetina.forwarder.domain.model.WorkersCacheError} - The four failure kinds</li>
 * </ul>
 */
package fr.lapetina.forwarder.domain.model;
