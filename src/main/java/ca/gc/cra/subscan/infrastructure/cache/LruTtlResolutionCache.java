package ca.gc.cra.subscan.infrastructure.cache;

import ca.gc.cra.subscan.application.port.ClockPort;
import ca.gc.cra.subscan.application.port.ResolutionCache;
import ca.gc.cra.subscan.domain.ResolutionOutcome;
import ca.gc.cra.subscan.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded resolution cache with least-recently-used eviction and per-entry TTL.
 * <p><strong>Why:</strong> Large wordlists across several recursion levels would otherwise grow the cache without
 * bound.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Evict the least-recently-used hostname when storing a new key at capacity.</li>
 *   <li>Refresh recency on {@link #load(String)} and recency plus expiry on {@link #store(String, ResolutionOutcome)}.</li>
 *   <li>Treat entries past their expiry as absent on read, removing them.</li>
 *   <li>Run a periodic sweep on a daemon thread so untouched expired entries are reclaimed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All map access happens under one lock; the access-ordered
 * {@link LinkedHashMap} mutates on reads.</p>
 *
 * @since 0.1.0
 */
public final class LruTtlResolutionCache implements ResolutionCache {
  private static final Logger log = LoggerFactory.getLogger(LruTtlResolutionCache.class);

  private final int capacity;
  private final long ttlMillis;
  private final ClockPort clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, Entry> entries;
  private final ScheduledExecutorService sweeper;

  /**
   * Creates a cache reading time from {@code clock}.
   *
   * @param capacity maximum number of entries; must be positive
   * @param ttl entry lifetime after store; must be positive
   * @param sweepInterval sweep period; {@link Duration#ZERO} disables the background sweep
   * @param clock time source
   */
  public LruTtlResolutionCache(int capacity, Duration ttl, Duration sweepInterval, ClockPort clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    Objects.requireNonNull(sweepInterval, "sweepInterval");
    this.capacity = capacity;
    this.ttlMillis = ttl.toMillis();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.entries = new LinkedHashMap<>(Math.min(capacity, 1 << 16), 0.75f, true);
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      this.sweeper = null;
    } else {
      this.sweeper = ExecutorFactories.newDaemonScheduler("resolution-cache-sweeper");
      long periodMillis = sweepInterval.toMillis();
      sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }
  }

  @Override
  public Optional<ResolutionOutcome> load(String hostname) {
    if (hostname == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      Entry entry = entries.get(hostname);
      if (entry == null) {
        return Optional.empty();
      }
      if (clock.nowMillis() > entry.expiresAtMillis()) {
        entries.remove(hostname);
        return Optional.empty();
      }
      return Optional.of(entry.outcome());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void store(String hostname, ResolutionOutcome outcome) {
    Objects.requireNonNull(hostname, "hostname");
    Objects.requireNonNull(outcome, "outcome");
    lock.lock();
    try {
      Entry replacement = new Entry(outcome, clock.nowMillis() + ttlMillis);
      if (entries.containsKey(hostname)) {
        entries.remove(hostname);
      } else if (entries.size() >= capacity) {
        Iterator<String> eldest = entries.keySet().iterator();
        String evicted = eldest.next();
        eldest.remove();
        log.trace("Evicted least recently used entry {}", evicted);
      }
      entries.put(hostname, replacement);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every entry whose expiry has passed.
   *
   * @return number of entries removed
   */
  public int cleanup() {
    long now = clock.nowMillis();
    int removed = 0;
    lock.lock();
    try {
      Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
      while (it.hasNext()) {
        if (now > it.next().getValue().expiresAtMillis()) {
          it.remove();
          removed++;
        }
      }
    } finally {
      lock.unlock();
    }
    return removed;
  }

  /** Stops the background sweep. Entries remain readable. */
  @Override
  public void close() {
    if (sweeper != null) {
      sweeper.shutdownNow();
    }
  }

  private void sweepQuietly() {
    try {
      int removed = cleanup();
      if (removed > 0) {
        log.debug("Cache sweep removed {} expired entries", removed);
      }
    } catch (RuntimeException ex) {
      // A failing sweep must not cancel the schedule.
      log.warn("Cache sweep failed", ex);
    }
  }

  private record Entry(ResolutionOutcome outcome, long expiresAtMillis) {}
}
