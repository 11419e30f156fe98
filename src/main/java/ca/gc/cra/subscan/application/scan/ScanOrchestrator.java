package ca.gc.cra.subscan.application.scan;

import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.application.port.ResolutionCache;
import ca.gc.cra.subscan.application.port.ResolutionException;
import ca.gc.cra.subscan.application.port.ResolverPort;
import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.application.port.WordSource;
import ca.gc.cra.subscan.application.port.WordlistLoadException;
import ca.gc.cra.subscan.domain.Candidate;
import ca.gc.cra.subscan.domain.ResolutionOutcome;
import ca.gc.cra.subscan.domain.SubdomainResult;
import ca.gc.cra.subscan.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Level-based scan engine expanding a root domain with a word source, resolving each
 * candidate through the cache, rate controller, and resolver, and emitting discoveries to a sink.
 * <p><strong>Why:</strong> Bounds concurrency with one worker pool per level and makes the recursion frontier
 * an explicit {@link ScanLevel} rather than implicit call-stack recursion.</p>
 * <p><strong>Role:</strong> Application service driven by {@code ActiveScanUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk {@link ScanState} from {@code LEVEL_START} to {@code FINISHED}, logging each transition.</li>
 *   <li>Dispatch {@code targets x words} candidates from a producer thread into a {@link WorkerPool}.</li>
 *   <li>Collect results on the calling thread, forwarding each hostname to the sink once.</li>
 *   <li>Recurse on the level's discoveries until depth is exhausted or nothing new is found.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-use; {@link #run()} may be invoked once. The cache and rate
 * controller are the only state shared with workers.</p>
 * <p><strong>Observability:</strong> Sets MDC keys {@code domain} and {@code level}; emits
 * {@code scan.candidates.dispatched}, {@code scan.cache.hit}, {@code scan.resolve.success},
 * {@code scan.resolve.failure}, {@code scan.ratelimit.sleep}, {@code scan.level.candidates}, and
 * {@code scan.resolve.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class ScanOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

  private static final String WORKER_PREFIX = "scan-worker";

  private final String domain;
  private final WordSource words;
  private final ResolverPort resolver;
  private final List<String> resolvers;
  private final ResolutionCache cache;
  private final RateController rateController;
  private final TakeoverDetector takeoverDetector;
  private final ResultSinkPort sink;
  private final MetricsPort metrics;
  private final Settings settings;

  private final AtomicBoolean started = new AtomicBoolean();
  private final LongAdder cacheHits = new LongAdder();
  private final LongAdder resolutionFailures = new LongAdder();
  private volatile ScanState state = ScanState.IDLE;

  /**
   * Creates an orchestrator for one scan.
   *
   * @param domain cleaned root domain
   * @param words candidate word source
   * @param resolver DNS resolver port
   * @param resolvers resolver addresses tried in order; empty to use the default resolver
   * @param cache resolution cache shared across levels
   * @param rateController backoff state shared across levels
   * @param takeoverDetector detector for positive results, or {@code null} when takeover checks are off
   * @param sink destination for discovered hostnames; not closed by the orchestrator
   * @param metrics metrics sink
   * @param settings scan tuning
   */
  public ScanOrchestrator(
      String domain,
      WordSource words,
      ResolverPort resolver,
      List<String> resolvers,
      ResolutionCache cache,
      RateController rateController,
      TakeoverDetector takeoverDetector,
      ResultSinkPort sink,
      MetricsPort metrics,
      Settings settings) {
    this.domain = Objects.requireNonNull(domain, "domain");
    this.words = Objects.requireNonNull(words, "words");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.resolvers = List.copyOf(Objects.requireNonNull(resolvers, "resolvers"));
    this.cache = Objects.requireNonNull(cache, "cache");
    this.rateController = Objects.requireNonNull(rateController, "rateController");
    this.takeoverDetector = takeoverDetector;
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Returns the current lifecycle state.
   *
   * @return state observed by the orchestrating thread
   */
  public ScanState state() {
    return state;
  }

  /**
   * Runs every level of the scan.
   *
   * @return summary of the scan
   * @throws WordlistLoadException if the word source cannot be read
   * @throws IOException if the sink fails
   * @throws InterruptedException if the calling thread is interrupted; the worker pool is aborted first
   */
  public ScanReport run() throws IOException, InterruptedException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Scan orchestrator already ran");
    }
    MDC.put("domain", domain);
    try {
      List<String> eagerWords = null;
      if (!settings.streamed()) {
        eagerWords = words.readAll();
        log.debug("Loaded {} words from {}", eagerWords.size(), words.describe());
      }

      Set<String> emitted = new HashSet<>();
      List<SubdomainResult> results = new ArrayList<>();
      List<Long> candidatesPerLevel = new ArrayList<>();
      ScanLevel level = new ScanLevel(1, List.of(domain));
      while (true) {
        transition(ScanState.LEVEL_START);
        MDC.put("level", Integer.toString(level.level()));
        log.info("Level {} scanning {} target(s)", level.level(), level.targets().size());

        LevelResult outcome = runLevel(level, eagerWords, emitted, results);
        candidatesPerLevel.add(outcome.dispatched());
        metrics.observe("scan.level.candidates", outcome.dispatched());

        transition(ScanState.LEVEL_DONE);
        log.info(
            "Level {} dispatched {} candidates and discovered {} hostname(s)",
            level.level(),
            outcome.dispatched(),
            outcome.discovered().size());
        if (!shouldRecurse(level.level(), outcome.discovered())) {
          break;
        }
        level = level.next(outcome.discovered());
      }
      transition(ScanState.FINISHED);
      return new ScanReport(
          domain, candidatesPerLevel, results, cacheHits.sum(), resolutionFailures.sum());
    } finally {
      MDC.remove("level");
      MDC.remove("domain");
    }
  }

  private boolean shouldRecurse(int level, List<String> discovered) {
    if (!settings.recursive()) {
      return false;
    }
    if (settings.depth() != Settings.UNLIMITED_DEPTH && level >= settings.depth()) {
      return false;
    }
    return !discovered.isEmpty();
  }

  private LevelResult runLevel(
      ScanLevel level, List<String> eagerWords, Set<String> emitted, List<SubdomainResult> results)
      throws IOException, InterruptedException {
    transition(ScanState.INGESTING);
    WorkerPool<SubdomainResult> pool = new WorkerPool<>(settings.workers(), WORKER_PREFIX, metrics);
    pool.start();
    LongAdder dispatched = new LongAdder();
    Map<String, String> context = MDC.getCopyOfContextMap();
    ExecutorService producer = ExecutorFactories.newSingleThread("scan-dispatcher");
    Future<?> dispatch = null;
    try {
      transition(ScanState.DISPATCHING);
      dispatch = producer.submit(() -> {
        if (context != null) {
          MDC.setContextMap(context);
        }
        boolean completed = false;
        try {
          dispatchLevel(level, eagerWords, pool, dispatched);
          completed = true;
        } finally {
          if (completed) {
            pool.close();
          } else {
            pool.stop();
          }
          MDC.clear();
        }
        return null;
      });

      transition(ScanState.COLLECTING);
      Set<String> discovered = new LinkedHashSet<>();
      Optional<SubdomainResult> next;
      while ((next = pool.takeResult()).isPresent()) {
        SubdomainResult result = next.get();
        if (!emitted.add(result.subdomain())) {
          continue;
        }
        sink.accept(result);
        results.add(result);
        discovered.add(result.subdomain());
      }
      awaitDispatch(dispatch);
      return new LevelResult(dispatched.sum(), List.copyOf(discovered));
    } catch (InterruptedException | IOException | RuntimeException failure) {
      pool.abort();
      if (dispatch != null) {
        dispatch.cancel(true);
      }
      throw failure;
    } finally {
      producer.shutdownNow();
    }
  }

  private void awaitDispatch(Future<?> dispatch) throws IOException, InterruptedException {
    try {
      dispatch.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof UncheckedIOException unchecked) {
        cause = unchecked.getCause();
      }
      if (cause instanceof IOException io) {
        throw io;
      }
      if (cause instanceof InterruptedException ie) {
        throw ie;
      }
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Candidate dispatch failed", cause);
    }
  }

  private void dispatchLevel(
      ScanLevel level, List<String> eagerWords, WorkerPool<SubdomainResult> pool, LongAdder dispatched)
      throws WordlistLoadException, InterruptedException {
    for (String target : level.targets()) {
      if (eagerWords != null) {
        for (String word : eagerWords) {
          if (!dispatch(new Candidate(word, target), pool, dispatched)) {
            return;
          }
        }
        continue;
      }
      try (Stream<String> stream = words.stream()) {
        Iterator<String> it = stream.iterator();
        while (it.hasNext()) {
          if (!dispatch(new Candidate(it.next(), target), pool, dispatched)) {
            return;
          }
        }
      } catch (UncheckedIOException ex) {
        if (ex.getCause() instanceof WordlistLoadException wle) {
          throw wle;
        }
        throw new WordlistLoadException("Failed to read wordlist " + words.describe(), ex.getCause());
      }
    }
  }

  private boolean dispatch(Candidate candidate, WorkerPool<SubdomainResult> pool, LongAdder dispatched)
      throws InterruptedException {
    String hostname = candidate.hostname();
    dispatched.increment();
    metrics.increment("scan.candidates.dispatched");
    Optional<ResolutionOutcome> cached = cache.load(hostname);
    if (cached.isPresent()) {
      cacheHits.increment();
      metrics.increment("scan.cache.hit");
      ResolutionOutcome outcome = cached.get();
      if (!outcome.found()) {
        return true;
      }
      return pool.addTask(() -> toResult(hostname, outcome));
    }
    return pool.addTask(() -> resolve(hostname));
  }

  private SubdomainResult resolve(String hostname) throws InterruptedException {
    if (rateController.isRateLimited(hostname, rateController.failThreshold())) {
      Duration delay = rateController.nextDelay(hostname);
      metrics.increment("scan.ratelimit.sleep");
      log.trace("Throttling {} for {} ms", hostname, delay.toMillis());
      TimeUnit.NANOSECONDS.sleep(delay.toNanos());
    }

    long startNanos = System.nanoTime();
    Optional<List<String>> addresses = lookup(hostname);
    metrics.observe("scan.resolve.latencyNanos", System.nanoTime() - startNanos);

    if (addresses.isEmpty()) {
      cache.store(hostname, ResolutionOutcome.notFound());
      resolutionFailures.increment();
      metrics.increment("scan.resolve.failure");
      rateController.adaptiveDelay(hostname, false);
      return null;
    }

    ResolutionOutcome outcome = ResolutionOutcome.found(addresses.get());
    cache.store(hostname, outcome);
    metrics.increment("scan.resolve.success");
    SubdomainResult result = toResult(hostname, outcome);
    rateController.adaptiveDelay(hostname, true);
    return result;
  }

  private Optional<List<String>> lookup(String hostname) throws InterruptedException {
    if (resolvers.isEmpty()) {
      try {
        return nonEmpty(resolver.lookup(hostname));
      } catch (ResolutionException ex) {
        log.trace("{} did not resolve: {}", hostname, ex.getMessage());
        return Optional.empty();
      }
    }
    for (String address : resolvers) {
      try {
        Optional<List<String>> found = nonEmpty(resolver.lookup(hostname, address));
        if (found.isPresent()) {
          return found;
        }
      } catch (ResolutionException ex) {
        log.trace("{} did not resolve via {}: {}", hostname, address, ex.getMessage());
      }
    }
    return Optional.empty();
  }

  private static Optional<List<String>> nonEmpty(List<String> addresses) {
    return addresses == null || addresses.isEmpty() ? Optional.empty() : Optional.of(addresses);
  }

  private SubdomainResult toResult(String hostname, ResolutionOutcome outcome) throws InterruptedException {
    SubdomainResult result = SubdomainResult.of(hostname);
    if (settings.showIp()) {
      result = result.withIps(outcome.addresses());
    }
    if (takeoverDetector != null) {
      result = takeoverDetector.check(result);
    }
    return result;
  }

  private void transition(ScanState next) {
    log.debug("Scan state {} -> {}", state, next);
    state = next;
  }

  private record LevelResult(long dispatched, List<String> discovered) {}

  /**
   * Scan tuning.
   *
   * @param workers worker threads per level
   * @param recursive whether discoveries are expanded again
   * @param depth last level to scan, or {@link #UNLIMITED_DEPTH}
   * @param showIp whether results carry resolved addresses
   * @param streamed whether words are re-read lazily per target instead of materialized once
   */
  public record Settings(int workers, boolean recursive, int depth, boolean showIp, boolean streamed) {
    /** Depth value meaning no limit. */
    public static final int UNLIMITED_DEPTH = -1;

    public Settings {
      if (workers <= 0) {
        throw new IllegalArgumentException("workers must be positive");
      }
      if (depth != UNLIMITED_DEPTH && depth < 1) {
        throw new IllegalArgumentException("depth must be -1 or >= 1");
      }
    }
  }
}
