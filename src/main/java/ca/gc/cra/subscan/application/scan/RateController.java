package ca.gc.cra.subscan.application.scan;

import ca.gc.cra.subscan.validation.Domains;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * <strong>What:</strong> Per-root-host exponential backoff and proactive rate-limit gate.
 * <p><strong>Why:</strong> Scans issue thousands of lookups against the same authoritative servers; backing off
 * per root host keeps a scan from being throttled or blocked.</p>
 * <p><strong>Role:</strong> Shared by every scan worker for the lifetime of one scan, across recursion levels.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Group hostnames by root host (last two labels) so siblings share state.</li>
 *   <li>Grow the delay as {@code base * factor^(attempts-1)} plus jitter on each failure, capped at the max.</li>
 *   <li>Decay attempts by one on each success instead of resetting.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All state transitions are synchronized on the controller.</p>
 *
 * @since 0.1.0
 */
public final class RateController {
  private final BackoffSettings settings;
  private final DoubleSupplier random;
  private final Map<String, BackoffState> states = new HashMap<>();

  /**
   * Creates a controller using {@link ThreadLocalRandom} for jitter.
   *
   * @param settings backoff tuning
   */
  public RateController(BackoffSettings settings) {
    this(settings, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Creates a controller with an explicit jitter source.
   *
   * @param settings backoff tuning
   * @param random supplier of uniform values in {@code [0, 1)}
   */
  public RateController(BackoffSettings settings, DoubleSupplier random) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Records a failed or pending attempt and returns the delay to wait before the next one.
   *
   * @param host hostname; grouped by root host
   * @return jittered delay, never above the configured maximum
   */
  public synchronized Duration nextDelay(String host) {
    BackoffState state = stateFor(host);
    state.attempts++;
    state.totalRequests++;
    double delay = baseNanos() * Math.pow(settings.factor(), state.attempts - 1);
    delay += settings.jitter() * random.getAsDouble() * delay;
    return cap(delay);
  }

  /**
   * Updates backoff after a completed request.
   *
   * @param host hostname; grouped by root host
   * @param success whether the request succeeded
   * @return un-jittered delay at the decayed attempt count on success (zero once fully recovered), or
   *     {@link #nextDelay(String)} on failure
   */
  public synchronized Duration adaptiveDelay(String host, boolean success) {
    if (!success) {
      return nextDelay(host);
    }
    BackoffState state = stateFor(host);
    state.attempts = Math.max(0, state.attempts - 1);
    if (state.attempts == 0) {
      return Duration.ZERO;
    }
    return cap(baseNanos() * Math.pow(settings.factor(), state.attempts - 1));
  }

  /**
   * Reports whether the host's root has accumulated at least {@code threshold} attempts.
   *
   * @param host hostname; grouped by root host
   * @param threshold attempt count that triggers proactive throttling
   * @return {@code true} when callers should sleep before the next request
   */
  public synchronized boolean isRateLimited(String host, int threshold) {
    BackoffState state = states.get(Domains.rootHost(host));
    return state != null && state.attempts >= threshold;
  }

  /**
   * Clears the attempt counter for the host's root.
   *
   * @param host hostname; grouped by root host
   */
  public synchronized void reset(String host) {
    BackoffState state = states.get(Domains.rootHost(host));
    if (state != null) {
      state.attempts = 0;
    }
  }

  /** Drops all tracked hosts. */
  public synchronized void resetAll() {
    states.clear();
  }

  /**
   * Returns the number of attempts recorded for the host's root.
   *
   * @param host hostname; grouped by root host
   * @return current attempt count
   */
  public synchronized int attempts(String host) {
    BackoffState state = states.get(Domains.rootHost(host));
    return state == null ? 0 : state.attempts;
  }

  /**
   * Returns the total number of delayed requests recorded for the host's root.
   *
   * @param host hostname; grouped by root host
   * @return running request count
   */
  public synchronized long requestCount(String host) {
    BackoffState state = states.get(Domains.rootHost(host));
    return state == null ? 0L : state.totalRequests;
  }

  /**
   * Returns the threshold configured for proactive throttling.
   *
   * @return fail threshold
   */
  public int failThreshold() {
    return settings.failThreshold();
  }

  private BackoffState stateFor(String host) {
    return states.computeIfAbsent(Domains.rootHost(host), key -> new BackoffState());
  }

  private double baseNanos() {
    return settings.baseDelay().toNanos();
  }

  private Duration cap(double delayNanos) {
    long maxNanos = settings.maxDelay().toNanos();
    if (delayNanos >= maxNanos) {
      return settings.maxDelay();
    }
    return Duration.ofNanos(Math.round(delayNanos));
  }

  private static final class BackoffState {
    private int attempts;
    private long totalRequests;
  }
}
