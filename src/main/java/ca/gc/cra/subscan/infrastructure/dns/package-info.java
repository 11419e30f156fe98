/**
 * DNS resolution adapters: JVM default resolver plus dnsjava for explicit resolver addresses, and resolver list
 * parsing.
 */
package ca.gc.cra.subscan.infrastructure.dns;
