package ca.gc.cra.subscan.config;

import ca.gc.cra.subscan.application.scan.BackoffSettings;
import ca.gc.cra.subscan.application.scan.CacheSettings;
import ca.gc.cra.subscan.application.scan.ScanOrchestrator;
import ca.gc.cra.subscan.infrastructure.http.JdkHttpProbeAdapter;
import ca.gc.cra.subscan.validation.Domains;
import ca.gc.cra.subscan.validation.Numbers;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Configuration for the active (wordlist brute-force) scan.
 * <p><strong>Why:</strong> Collects the CLI/YAML knobs into one validated value before any thread, socket, or
 * file is opened.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param domain single target domain; mutually exclusive with {@code domainList}
 * @param domainList file of target domains, one per line
 * @param wordlist wordlist file or URL; empty selects the bundled default URL
 * @param resolvers raw resolver option (comma list or file); empty uses the system resolver
 * @param rateLimit base delay of the per-root-host backoff
 * @param recursive whether discoveries are scanned again as new targets
 * @param depth last level scanned, or {@link ScanOrchestrator.Settings#UNLIMITED_DEPTH}
 * @param showIp whether results carry resolved addresses
 * @param takeover whether discovered hosts are fingerprinted for takeover
 * @param proxy HTTP proxy for takeover probes
 * @param workers resolver threads per level
 * @param stream force streamed word ingestion
 * @param output plain-text result file
 * @param jsonOutput JSON result file
 * @param cache bounded cache sizing
 * @since 0.1.0
 */
public record ScanConfig(
    Optional<String> domain,
    Optional<Path> domainList,
    Optional<String> wordlist,
    Optional<String> resolvers,
    Duration rateLimit,
    boolean recursive,
    int depth,
    boolean showIp,
    boolean takeover,
    Optional<InetSocketAddress> proxy,
    int workers,
    boolean stream,
    Optional<Path> output,
    Optional<Path> jsonOutput,
    CacheSettings cache) {

  /** Default base delay in milliseconds. */
  public static final int DEFAULT_RATE_LIMIT_MS = 100;
  /** Default worker count. */
  public static final int DEFAULT_WORKERS = 10;
  /** Default recursion depth. */
  public static final int DEFAULT_DEPTH = 1;

  static final int MAX_WORKERS = 1_000;
  static final int MAX_DEPTH = 32;
  static final int MAX_RATE_LIMIT_MS = 60_000;
  static final int MAX_CACHE_CAPACITY = 10_000_000;
  static final int MAX_CACHE_SECONDS = 86_400;

  public ScanConfig {
    domain = Objects.requireNonNullElse(domain, Optional.empty());
    domainList = Objects.requireNonNullElse(domainList, Optional.empty());
    wordlist = Objects.requireNonNullElse(wordlist, Optional.empty());
    resolvers = Objects.requireNonNullElse(resolvers, Optional.empty());
    proxy = Objects.requireNonNullElse(proxy, Optional.empty());
    output = Objects.requireNonNullElse(output, Optional.empty());
    jsonOutput = Objects.requireNonNullElse(jsonOutput, Optional.empty());
    Objects.requireNonNull(rateLimit, "rateLimit");
    Objects.requireNonNull(cache, "cache");
    ConfigValues.requireSingleTarget(domain, domainList);
    domain = domain.map(value -> Domains.requireValid("domain", value));
    if (rateLimit.isNegative()) {
      throw new IllegalArgumentException("rateLimit must not be negative");
    }
    if (depth == 0 || depth < ScanOrchestrator.Settings.UNLIMITED_DEPTH || depth > MAX_DEPTH) {
      throw new IllegalArgumentException(
          "depth must be -1 (unlimited) or between 1 and " + MAX_DEPTH + " (was " + depth + ")");
    }
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
  }

  /**
   * Builds a configuration from flattened key/value options.
   *
   * @param options merged CLI/YAML/default options
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ScanConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    int rateLimitMs = Numbers.parseInt(
        "rateLimit", options.get("rateLimit"), DEFAULT_RATE_LIMIT_MS, 0, MAX_RATE_LIMIT_MS);
    int depth = Numbers.parseInt(
        "depth", options.get("depth"), DEFAULT_DEPTH, ScanOrchestrator.Settings.UNLIMITED_DEPTH, MAX_DEPTH);
    int workers = Numbers.parseInt("workers", options.get("workers"), DEFAULT_WORKERS, 1, MAX_WORKERS);
    int capacity = Numbers.parseInt(
        "cacheCapacity", options.get("cacheCapacity"), CacheSettings.DEFAULT_CAPACITY, 1, MAX_CACHE_CAPACITY);
    int ttlSeconds = Numbers.parseInt(
        "cacheTtlSeconds",
        options.get("cacheTtlSeconds"),
        (int) CacheSettings.DEFAULT_TTL.toSeconds(),
        1,
        MAX_CACHE_SECONDS);
    int sweepSeconds = Numbers.parseInt(
        "cacheSweepSeconds",
        options.get("cacheSweepSeconds"),
        (int) CacheSettings.DEFAULT_SWEEP.toSeconds(),
        0,
        MAX_CACHE_SECONDS);
    boolean takeover = ConfigValues.parseBoolean(options, "takeover", false);
    // The proxy only serves takeover probes; a stale value is ignored when they are off.
    Optional<InetSocketAddress> proxy =
        takeover ? JdkHttpProbeAdapter.parseProxy(options.get("proxy")) : Optional.empty();

    return new ScanConfig(
        ConfigValues.optionalString(options, "domain"),
        ConfigValues.optionalPath(options, "list"),
        ConfigValues.optionalString(options, "wordlist"),
        ConfigValues.optionalString(options, "resolvers"),
        Duration.ofMillis(rateLimitMs),
        ConfigValues.parseBoolean(options, "recursive", false),
        depth,
        ConfigValues.parseBoolean(options, "showIp", false),
        takeover,
        proxy,
        workers,
        ConfigValues.parseBoolean(options, "stream", false),
        ConfigValues.optionalPath(options, "output"),
        ConfigValues.optionalPath(options, "jsonOutput"),
        new CacheSettings(capacity, Duration.ofSeconds(ttlSeconds), Duration.ofSeconds(sweepSeconds)));
  }

  /**
   * Derives the backoff tuning from {@link #rateLimit()}.
   *
   * @return backoff settings
   */
  public BackoffSettings backoff() {
    return BackoffSettings.forRateLimit(rateLimit);
  }
}
