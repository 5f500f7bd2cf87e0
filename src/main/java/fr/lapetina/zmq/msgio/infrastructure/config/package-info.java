/**
 * Configuration loading.
 *
 * <p>This package parses the YAML configuration that sizes pool queues, selects the
 * default write policy and tunes the load-balanced retry policy.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.zmq.msgio.infrastructure.config.MsgIoConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.zmq.msgio.infrastructure.config.ConfigLoader} - YAML loading from file, classpath or stream</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code pool} - Queue capacities, poll interval, close timeout, write policy</li>
 *   <li>{@code broadcast} - Eviction of connections that failed a broadcast</li>
 *   <li>{@code retry} - Attempt limit, eviction threshold and backoff for load-balanced writes</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.zmq.msgio.infrastructure.config;
