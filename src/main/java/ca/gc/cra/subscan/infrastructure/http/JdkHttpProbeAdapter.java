package ca.gc.cra.subscan.infrastructure.http;

import ca.gc.cra.subscan.application.port.HttpProbePort;
import ca.gc.cra.subscan.validation.Net;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpProbePort} backed by {@link HttpClient}. Follows redirects, applies one timeout to the whole
 * exchange, and reads at most {@link #MAX_BODY_BYTES} of the body.
 *
 * @since 0.1.0
 */
public final class JdkHttpProbeAdapter implements HttpProbePort {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpProbeAdapter.class);

  /** Default probe timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  /** Upper bound on bytes read from a probe response. */
  public static final int MAX_BODY_BYTES = 1 << 20;
  private static final String USER_AGENT = "SubScan/0.1";

  private final HttpClient client;
  private final Duration timeout;

  /**
   * Creates an adapter.
   *
   * @param timeout connect and request timeout
   * @param proxy optional HTTP proxy, as returned by {@link #parseProxy(String)}
   */
  public JdkHttpProbeAdapter(Duration timeout, Optional<InetSocketAddress> proxy) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    HttpClient.Builder builder = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(timeout)
        .version(HttpClient.Version.HTTP_1_1);
    proxy.ifPresent(address -> {
      builder.proxy(ProxySelector.of(address));
      log.info("Takeover probes routed through proxy {}:{}", address.getHostString(), address.getPort());
    });
    this.client = builder.build();
  }

  @Override
  public String get(URI uri) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(uri)
        .GET()
        .timeout(timeout)
        .header("User-Agent", USER_AGENT)
        .build();
    HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    try (InputStream body = response.body()) {
      return new String(readBounded(body), StandardCharsets.UTF_8);
    }
  }

  /**
   * Parses a proxy URL such as {@code http://127.0.0.1:8080}.
   *
   * @param raw proxy URL; blank means no proxy
   * @return proxy socket address, or empty when {@code raw} is blank
   * @throws ProxyConfigException if the URL is malformed, not http/https, or lacks a host
   */
  public static Optional<InetSocketAddress> parseProxy(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    URI uri;
    try {
      uri = new URI(raw.trim());
    } catch (URISyntaxException ex) {
      throw new ProxyConfigException("Invalid proxy URL: " + raw, ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new ProxyConfigException("Proxy URL must use http or https: " + raw);
    }
    String host = uri.getHost();
    if (host == null || host.isBlank()) {
      throw new ProxyConfigException("Proxy URL has no host: " + raw);
    }
    try {
      host = host.startsWith("[") ? Net.validateResolverAddress(host) : validatedHost(host);
    } catch (IllegalArgumentException ex) {
      throw new ProxyConfigException("Proxy URL has an invalid host: " + raw, ex);
    }
    int port = uri.getPort();
    if (port == -1) {
      port = scheme.equals("https") ? 443 : 80;
    }
    return Optional.of(InetSocketAddress.createUnresolved(host, port));
  }

  private static String validatedHost(String host) {
    Net.validateHost(host);
    return host;
  }

  private static byte[] readBounded(InputStream in) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[8192];
    int remaining = MAX_BODY_BYTES;
    while (remaining > 0) {
      int read = in.read(buffer, 0, Math.min(buffer.length, remaining));
      if (read == -1) {
        break;
      }
      out.write(buffer, 0, read);
      remaining -= read;
    }
    return out.toByteArray();
  }
}
