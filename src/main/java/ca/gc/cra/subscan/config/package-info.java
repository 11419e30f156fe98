/**
 * Configuration loading and wiring: defaults, YAML sections, CLI precedence, validated config records, and the
 * composition root that builds use cases from them.
 */
package ca.gc.cra.subscan.config;
