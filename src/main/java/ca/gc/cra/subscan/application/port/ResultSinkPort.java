package ca.gc.cra.subscan.application.port;

import ca.gc.cra.subscan.domain.SubdomainResult;
import java.io.IOException;

/**
 * <strong>What:</strong> Output port receiving each discovered hostname exactly once.
 * <p><strong>Lifecycle:</strong> {@code beginDomain}, then {@code accept} per result, then {@code endDomain}, repeated
 * per root domain; {@link #close()} once at end of run.</p>
 * <p><strong>Thread-safety:</strong> The scan engine calls {@link #accept(SubdomainResult)} from a single
 * collecting thread; implementations need not synchronize unless shared between scans.</p>
 * <p><strong>Observability:</strong> Adapters should log where results were written on close.</p>
 *
 * @since 0.1.0
 */
public interface ResultSinkPort extends AutoCloseable {
  /**
   * Marks the start of results for one root domain.
   *
   * @param domain root domain about to be scanned
   * @throws IOException if the sink cannot record the boundary
   */
  default void beginDomain(String domain) throws IOException {}

  /**
   * Accepts one discovered hostname.
   *
   * @param result discovered hostname with optional addresses and takeover marker
   * @throws IOException if the sink cannot record the result
   */
  void accept(SubdomainResult result) throws IOException;

  /**
   * Marks the end of results for one root domain.
   *
   * @param domain root domain that was scanned
   * @param discovered number of hostnames accepted for the domain
   * @throws IOException if the sink cannot record the boundary
   */
  default void endDomain(String domain, int discovered) throws IOException {}

  /**
   * Flushes and releases the sink at end of run.
   *
   * @throws IOException if buffered output cannot be written
   */
  @Override
  default void close() throws IOException {}
}
