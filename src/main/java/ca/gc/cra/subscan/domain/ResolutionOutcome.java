package ca.gc.cra.subscan.domain;

import java.util.List;
import java.util.Objects;

/**
 * Cached result of one DNS lookup.
 *
 * <p>Immutable: the address list is copied on construction, so cached values cannot be corrupted by callers.</p>
 *
 * @param found whether any resolver returned addresses
 * @param addresses resolved IP strings in resolver order; empty when {@code found} is {@code false}
 * @since 0.1.0
 */
public record ResolutionOutcome(boolean found, List<String> addresses) {
  private static final ResolutionOutcome NOT_FOUND = new ResolutionOutcome(false, List.of());

  /**
   * Copies the address list and enforces that negative outcomes carry no addresses.
   */
  public ResolutionOutcome {
    addresses = List.copyOf(Objects.requireNonNull(addresses, "addresses"));
    if (!found && !addresses.isEmpty()) {
      throw new IllegalArgumentException("negative outcome must not carry addresses");
    }
  }

  /**
   * Creates a positive outcome.
   *
   * @param addresses resolved addresses
   * @return positive outcome
   */
  public static ResolutionOutcome found(List<String> addresses) {
    return new ResolutionOutcome(true, addresses);
  }

  /**
   * Returns the shared negative outcome.
   *
   * @return negative outcome
   */
  public static ResolutionOutcome notFound() {
    return NOT_FOUND;
  }
}
