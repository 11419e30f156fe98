/**
 * Input adapters: candidate word sources (file, HTTP, in-memory) and domain list loading.
 */
package ca.gc.cra.subscan.infrastructure.input;
