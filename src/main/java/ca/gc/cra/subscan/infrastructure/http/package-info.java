/**
 * HTTP adapters for takeover probing and proxy configuration.
 */
package ca.gc.cra.subscan.infrastructure.http;
