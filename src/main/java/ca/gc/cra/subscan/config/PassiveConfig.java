package ca.gc.cra.subscan.config;

import ca.gc.cra.subscan.infrastructure.passive.CrtShPassiveEnumerationAdapter;
import ca.gc.cra.subscan.validation.Domains;
import ca.gc.cra.subscan.validation.Numbers;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for passive enumeration through certificate transparency.
 *
 * @param domain single target domain; mutually exclusive with {@code domainList}
 * @param domainList file of target domains
 * @param resolvers raw resolver option used when {@code showIp} is set
 * @param showIp whether enumerated names are resolved
 * @param endpoint certificate transparency search endpoint
 * @param timeout request timeout for the endpoint
 * @param output plain-text result file
 * @param jsonOutput JSON result file
 * @since 0.1.0
 */
public record PassiveConfig(
    Optional<String> domain,
    Optional<Path> domainList,
    Optional<String> resolvers,
    boolean showIp,
    URI endpoint,
    Duration timeout,
    Optional<Path> output,
    Optional<Path> jsonOutput) {

  static final int MAX_TIMEOUT_SECONDS = 600;

  public PassiveConfig {
    domain = Objects.requireNonNullElse(domain, Optional.empty());
    domainList = Objects.requireNonNullElse(domainList, Optional.empty());
    resolvers = Objects.requireNonNullElse(resolvers, Optional.empty());
    output = Objects.requireNonNullElse(output, Optional.empty());
    jsonOutput = Objects.requireNonNullElse(jsonOutput, Optional.empty());
    endpoint = Objects.requireNonNullElse(endpoint, CrtShPassiveEnumerationAdapter.DEFAULT_ENDPOINT);
    timeout = Objects.requireNonNullElse(timeout, CrtShPassiveEnumerationAdapter.DEFAULT_TIMEOUT);
    ConfigValues.requireSingleTarget(domain, domainList);
    domain = domain.map(value -> Domains.requireValid("domain", value));
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("passiveTimeoutSeconds must be positive");
    }
  }

  /**
   * Builds a configuration from flattened key/value options.
   *
   * @param options merged CLI/YAML/default options
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed
   */
  public static PassiveConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    int timeoutSeconds = Numbers.parseInt(
        "passiveTimeoutSeconds",
        options.get("passiveTimeoutSeconds"),
        (int) CrtShPassiveEnumerationAdapter.DEFAULT_TIMEOUT.toSeconds(),
        1,
        MAX_TIMEOUT_SECONDS);
    return new PassiveConfig(
        ConfigValues.optionalString(options, "domain"),
        ConfigValues.optionalPath(options, "list"),
        ConfigValues.optionalString(options, "resolvers"),
        ConfigValues.parseBoolean(options, "showIp", false),
        ConfigValues.optionalString(options, "passiveEndpoint").map(PassiveConfig::parseEndpoint).orElse(null),
        Duration.ofSeconds(timeoutSeconds),
        ConfigValues.optionalPath(options, "output"),
        ConfigValues.optionalPath(options, "jsonOutput"));
  }

  private static URI parseEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("passiveEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("passiveEndpoint must include a host");
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("passiveEndpoint must be a valid URI", ex);
    }
  }
}
