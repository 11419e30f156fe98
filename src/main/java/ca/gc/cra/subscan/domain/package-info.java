/**
 * Value types for subdomain discovery: candidates, cached resolution outcomes, emitted results, and takeover
 * fingerprints. All types are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subscan.domain;
