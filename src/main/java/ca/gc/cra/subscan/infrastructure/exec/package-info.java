/**
 * Executor factories producing named worker, producer, and maintenance threads.
 */
package ca.gc.cra.subscan.infrastructure.exec;
