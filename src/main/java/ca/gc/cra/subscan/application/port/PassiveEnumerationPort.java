package ca.gc.cra.subscan.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Port to an external subdomain aggregation source used by passive scans. The engine treats its output as
 * opaque hostnames.
 *
 * @since 0.1.0
 */
public interface PassiveEnumerationPort {
  /**
   * Enumerates known subdomains of {@code domain}.
   *
   * @param domain root domain
   * @return distinct hostnames in source order
   * @throws IOException when the source cannot be queried
   * @throws InterruptedException when the caller is interrupted
   */
  List<String> enumerate(String domain) throws IOException, InterruptedException;
}
