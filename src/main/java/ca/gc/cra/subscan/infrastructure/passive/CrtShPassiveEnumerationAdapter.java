package ca.gc.cra.subscan.infrastructure.passive;

import ca.gc.cra.subscan.application.port.PassiveEnumerationPort;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PassiveEnumerationPort} querying the crt.sh certificate transparency search.
 * <p>The JSON response is an array of certificate entries; each {@code name_value} may hold several
 * newline-separated names. Wildcard prefixes are stripped and only names under the queried domain are kept.</p>
 *
 * @since 0.1.0
 */
public final class CrtShPassiveEnumerationAdapter implements PassiveEnumerationPort {
  private static final Logger log = LoggerFactory.getLogger(CrtShPassiveEnumerationAdapter.class);

  /** Public crt.sh endpoint. */
  public static final URI DEFAULT_ENDPOINT = URI.create("https://crt.sh/");
  /** Default request timeout; crt.sh queries for large domains are slow. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  private final HttpClient client;
  private final URI endpoint;
  private final Duration timeout;
  private final JsonFactory jsonFactory = new JsonFactory();

  /** Creates an adapter against {@link #DEFAULT_ENDPOINT}. */
  public CrtShPassiveEnumerationAdapter() {
    this(DEFAULT_ENDPOINT, DEFAULT_TIMEOUT);
  }

  /**
   * Creates an adapter against an explicit endpoint.
   *
   * @param endpoint base URI; {@code ?q=%25.<domain>&output=json} is appended
   * @param timeout request timeout
   */
  public CrtShPassiveEnumerationAdapter(URI endpoint, Duration timeout) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.client = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(timeout)
        .build();
  }

  @Override
  public List<String> enumerate(String domain) throws IOException, InterruptedException {
    Objects.requireNonNull(domain, "domain");
    String query = URLEncoder.encode("%." + domain, StandardCharsets.UTF_8);
    URI uri = endpoint.resolve("?q=" + query + "&output=json");
    HttpRequest request = HttpRequest.newBuilder(uri)
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .build();
    log.debug("Querying {}", uri);
    HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    try (InputStream body = response.body()) {
      if (response.statusCode() != 200) {
        throw new IOException("crt.sh returned HTTP " + response.statusCode() + " for " + domain);
      }
      List<String> names = parse(body, domain);
      log.debug("crt.sh listed {} names for {}", names.size(), domain);
      return names;
    }
  }

  /**
   * Extracts distinct hostnames under {@code domain} from a crt.sh JSON response.
   *
   * @param json response body
   * @param domain queried root domain
   * @return lowercase hostnames in first-seen order, excluding the root itself
   * @throws IOException if the body is not a JSON array of objects
   */
  List<String> parse(InputStream json, String domain) throws IOException {
    String root = domain.toLowerCase(Locale.ROOT);
    String suffix = "." + root;
    Set<String> names = new LinkedHashSet<>();
    try (JsonParser parser = jsonFactory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return List.of();
      }
      if (token != JsonToken.START_ARRAY) {
        throw new IOException("Expected JSON array from crt.sh but found " + token);
      }
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        if (token != JsonToken.START_OBJECT) {
          throw new IOException("Expected JSON object in crt.sh array but found " + token);
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String field = parser.getCurrentName();
          JsonToken value = parser.nextToken();
          if (("name_value".equals(field) || "common_name".equals(field)) && value == JsonToken.VALUE_STRING) {
            for (String candidate : parser.getText().split("\n")) {
              String name = normalize(candidate);
              if (name.endsWith(suffix)) {
                names.add(name);
              }
            }
          } else {
            parser.skipChildren();
          }
        }
      }
    }
    return List.copyOf(names);
  }

  private static String normalize(String raw) {
    String name = raw.trim().toLowerCase(Locale.ROOT);
    while (name.startsWith("*.")) {
      name = name.substring(2);
    }
    return name;
  }
}
