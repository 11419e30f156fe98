package ca.gc.cra.subscan.application.port;

import java.util.List;

/**
 * <strong>What:</strong> Port to the DNS resolution subsystem.
 * <p><strong>Why:</strong> The scan engine owns caching, fallback order, and throttling but never speaks the DNS
 * wire protocol itself.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent lookups from scan workers.</p>
 *
 * @since 0.1.0
 */
public interface ResolverPort {
  /**
   * Resolves a hostname with the platform default resolver.
   *
   * @param hostname fully-qualified name
   * @return non-empty ordered list of IP strings
   * @throws ResolutionException when the name does not resolve
   * @throws InterruptedException when the calling worker is interrupted
   */
  List<String> lookup(String hostname) throws ResolutionException, InterruptedException;

  /**
   * Resolves a hostname against a specific resolver (UDP port 53).
   *
   * @param hostname fully-qualified name
   * @param resolverAddress resolver IP or hostname
   * @return non-empty ordered list of IP strings
   * @throws ResolutionException when the resolver returns no addresses or cannot be reached
   * @throws InterruptedException when the calling worker is interrupted
   */
  List<String> lookup(String hostname, String resolverAddress) throws ResolutionException, InterruptedException;
}
