/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a mutable POJO tree with defaults.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, backlog)</li>
 *   <li>{@code storage} - Artifact root directory</li>
 *   <li>{@code supervisor} - supervisord XML-RPC endpoint, web UI and group naming</li>
 *   <li>{@code workers} - Worker host, port allocation, health and inference paths, timeouts</li>
 *   <li>{@code models} - Static slot endpoints per model name</li>
 *   <li>{@code lifecycle} - Readiness, drain and restart bounds</li>
 *   <li>{@code queue} - Maximum hold duration of queued requests</li>
 *   <li>{@code supervision} - Periodic checks of active workers</li>
 *   <li>{@code events} - Lifecycle event bus ring buffer</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.hotswap.infrastructure.config.HotSwapConfig
 * @see fr.lapetina.hotswap.infrastructure.config.ConfigLoader
 */
package fr.lapetina.hotswap.infrastructure.config;
