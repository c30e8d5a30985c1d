/**
 * YAML configuration for the transport.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.search.transport.infrastructure.config.TransportConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.search.transport.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code nodes} - Base URLs of the cluster nodes</li>
 *   <li>{@code timeouts} - Per-attempt request timeout and connect timeout</li>
 *   <li>{@code retry} - Number of extra attempts after a transport failure</li>
 *   <li>{@code pool} - Revival delay and node selection strategy</li>
 *   <li>{@code auth} - HTTP basic credentials</li>
 *   <li>{@code metrics} - Micrometer metrics settings</li>
 * </ul>
 *
 * <p>The node list is fixed once a transport is built; loading a new file
 * means building a new transport.
 *
 * @see fr.lapetina.search.transport.infrastructure.config.TransportConfig
 * @see fr.lapetina.search.transport.infrastructure.config.ConfigLoader
 */
package fr.lapetina.search.transport.infrastructure.config;
