/**
 * Ports between the scan engine and its collaborators: DNS resolution, word sources, result sinks, passive
 * enumeration, HTTP probing, caching, clocks, and metrics.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code infrastructure}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.subscan.application.port;
