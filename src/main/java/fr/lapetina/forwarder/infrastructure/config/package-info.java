/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing and validation.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code cache} - Maximum number of cached destination workers</li>
 *   <li>{@code worker} - Channel size and failure tolerance of each worker</li>
 *   <li>{@code dispatch} - Ring buffer, wait strategy, backpressure and shutdown timeout</li>
 *   <li>{@code transport} - HTTP timeouts and endpoint path</li>
 *   <li>{@code metrics} - Prometheus metric name prefix</li>
 * </ul>
 *
 * @see fr.lapetina.forwarder.infrastructure.config.ForwarderConfig
 * @see fr.lapetina.forwarder.infrastructure.config.ConfigLoader
 */
package fr.lapetina.forwarder.infrastructure.config;
