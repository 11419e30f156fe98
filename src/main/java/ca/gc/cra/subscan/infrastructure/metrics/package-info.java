/**
 * OpenTelemetry metrics adapter for the scan engine's {@code scan.*} counters and observations.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent workers.</p>
 */
package ca.gc.cra.subscan.infrastructure.metrics;
