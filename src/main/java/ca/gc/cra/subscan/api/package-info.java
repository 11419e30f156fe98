/**
 * CLI entry points for SubScan's active and passive commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and invokes use cases built by the composition root.</p>
 * <p><strong>Output:</strong> Results go to stdout through {@link ca.gc.cra.subscan.api.CliPrinter}; diagnostics go
 * to stderr through Logback.</p>
 */
package ca.gc.cra.subscan.api;
