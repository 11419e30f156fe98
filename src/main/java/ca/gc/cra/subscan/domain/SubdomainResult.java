package ca.gc.cra.subscan.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Discovered hostname emitted to result sinks.
 *
 * <p>Instances are immutable. The takeover check runs before emission and produces a copy through
 * {@link #withTakeover(String)}.</p>
 *
 * @param subdomain discovered hostname
 * @param ips resolved addresses; empty when addresses were not requested
 * @param takeover identifier of the matched service fingerprint, or {@code null}
 * @since 0.1.0
 */
public record SubdomainResult(String subdomain, List<String> ips, String takeover) {

  /**
   * Validates the hostname and copies the address list.
   */
  public SubdomainResult {
    Objects.requireNonNull(subdomain, "subdomain");
    if (subdomain.isBlank()) {
      throw new IllegalArgumentException("subdomain must not be blank");
    }
    ips = ips == null ? List.of() : List.copyOf(ips);
    if (takeover != null && takeover.isBlank()) {
      takeover = null;
    }
  }

  /**
   * Creates a result carrying only the hostname.
   *
   * @param subdomain discovered hostname
   * @return result without addresses or takeover marker
   */
  public static SubdomainResult of(String subdomain) {
    return new SubdomainResult(subdomain, List.of(), null);
  }

  /**
   * Returns a copy carrying the given addresses.
   *
   * @param addresses resolved addresses
   * @return new result
   */
  public SubdomainResult withIps(List<String> addresses) {
    return new SubdomainResult(subdomain, addresses, takeover);
  }

  /**
   * Returns a copy flagged with the matched takeover service.
   *
   * @param service fingerprint service identifier
   * @return new result
   */
  public SubdomainResult withTakeover(String service) {
    return new SubdomainResult(subdomain, ips, service);
  }

  /**
   * Returns the matched takeover service, if any.
   *
   * @return optional service identifier
   */
  public Optional<String> takeoverService() {
    return Optional.ofNullable(takeover);
  }
}
