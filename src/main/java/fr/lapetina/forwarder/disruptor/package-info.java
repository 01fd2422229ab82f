/**
 * LMAX Disruptor-based pipeline feeding the workers cache.
 *
 * <p>Producers publish batches into a pre-allocated ring buffer; a single consumer thread
 * owns the {@link fr.lapetina.forwarder.cache.WorkersCache} and performs every cache
 * operation, so the cache itself needs no locking.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Validation → Dispatch
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.forwarder.disruptor.DispatchPipeline} - Pipeline orchestrator</li>
 *   <li>{@link fr.lapetina.forwarder.disruptor.exception.BackpressureException} - Thrown when ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.forwarder.disruptor;
