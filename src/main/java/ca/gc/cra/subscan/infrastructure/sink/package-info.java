/**
 * Result sinks: console lines, streamed text and JSON files, and a composite fan-out.
 * <p><strong>Concurrency:</strong> Sinks are driven by the single collecting thread of a scan and are not
 * synchronized.</p>
 */
package ca.gc.cra.subscan.infrastructure.sink;
