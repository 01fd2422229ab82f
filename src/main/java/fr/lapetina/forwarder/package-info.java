/**
 * Batch Forwarder - pushes transaction batches to a rolling set of destination peers.
 *
 * <p>Each destination gets a dedicated connection worker fed through a bounded channel.
 * Workers live in a bounded least-recently-used cache; when a new destination pushes the
 * cache over capacity, the least recently used worker is retired in the background.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.forwarder.ForwarderFactory} - Main entry point for creating
 *       a fully-configured forwarder from YAML configuration</li>
 *   <li>{@link fr.lapetina.forwarder.cache.WorkersCache} - The bounded worker cache</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ForwarderFactory factory = ForwarderFactory.create("forwarder.yaml").start()) {
 *     DispatchPipeline pipeline = factory.getPipeline();
 *     pipeline.submit(List.of(leader), TransactionBatch.of(wiredTransactions));
 * }
 * }</pre>
 *
 * @see fr.lapetina.forwarder.ForwarderFactory
 * @see fr.lapetina.forwarder.disruptor.DispatchPipeline
 */
package fr.lapetina.forwarder;
