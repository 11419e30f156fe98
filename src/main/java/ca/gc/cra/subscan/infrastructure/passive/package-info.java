/**
 * Passive enumeration adapters backed by public certificate transparency search.
 */
package ca.gc.cra.subscan.infrastructure.passive;
