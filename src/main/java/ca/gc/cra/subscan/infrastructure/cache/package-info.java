/**
 * Resolution cache policies: unbounded concurrent map and bounded LRU with TTL.
 */
package ca.gc.cra.subscan.infrastructure.cache;
