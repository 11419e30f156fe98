package ca.gc.cra.subscan.application.port;

import ca.gc.cra.subscan.domain.ResolutionOutcome;
import java.util.Optional;

/**
 * <strong>What:</strong> Thread-safe store mapping a candidate hostname to its cached DNS outcome.
 * <p><strong>Why:</strong> Repeated candidates (within a level or across recursion levels) must not trigger a
 * second network lookup, whether the first lookup succeeded or failed.</p>
 * <p><strong>Thread-safety:</strong> Implementations are internally synchronized; callers never lock.</p>
 * <p><strong>Failure semantics:</strong> Never throws for cache misses or races; concurrent stores on one key
 * resolve last-write-wins.</p>
 *
 * @since 0.1.0
 */
public interface ResolutionCache extends AutoCloseable {
  /**
   * Looks up a cached outcome.
   *
   * @param hostname candidate hostname
   * @return cached outcome, or empty on a miss (including expired entries)
   */
  Optional<ResolutionOutcome> load(String hostname);

  /**
   * Stores an outcome, replacing any existing entry.
   *
   * @param hostname candidate hostname
   * @param outcome positive or negative outcome
   */
  void store(String hostname, ResolutionOutcome outcome);

  /**
   * Returns the number of entries currently held (expired entries may still be counted until swept).
   *
   * @return entry count
   */
  int size();

  /** Releases background resources such as sweep schedulers. */
  @Override
  default void close() {}
}
