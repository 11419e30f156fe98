package ca.gc.cra.subscan.infrastructure.cache;

import ca.gc.cra.subscan.application.port.ResolutionCache;
import ca.gc.cra.subscan.domain.ResolutionOutcome;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Unbounded resolution cache backed by a {@link ConcurrentHashMap}. Entries never expire.
 *
 * @since 0.1.0
 */
public final class ConcurrentResolutionCache implements ResolutionCache {
  private final ConcurrentMap<String, ResolutionOutcome> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<ResolutionOutcome> load(String hostname) {
    if (hostname == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.get(hostname));
  }

  @Override
  public void store(String hostname, ResolutionOutcome outcome) {
    entries.put(Objects.requireNonNull(hostname, "hostname"), Objects.requireNonNull(outcome, "outcome"));
  }

  @Override
  public int size() {
    return entries.size();
  }
}
