package ca.gc.cra.subscan.application.port;

import java.io.IOException;
import java.net.URI;

/**
 * Single-shot HTTP GET used by takeover detection.
 *
 * @since 0.1.0
 */
public interface HttpProbePort {
  /**
   * Fetches {@code uri} and returns the response body regardless of status code.
   *
   * @param uri target URI
   * @return response body decoded as text
   * @throws IOException on transport failures or timeouts
   * @throws InterruptedException when the calling worker is interrupted
   */
  String get(URI uri) throws IOException, InterruptedException;
}
