package ca.gc.cra.subscan.testutil;

import ca.gc.cra.subscan.application.port.ResolutionException;
import ca.gc.cra.subscan.application.port.ResolverPort;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory resolver. Hostnames registered with {@link #answer} resolve everywhere; {@link #answerVia} restricts an
 * answer to one resolver address.
 */
public final class StubResolver implements ResolverPort {
  private final Map<String, List<String>> answers = new ConcurrentHashMap<>();
  private final Map<String, Map<String, List<String>>> viaResolver = new ConcurrentHashMap<>();
  private final Queue<String> queries = new ConcurrentLinkedQueue<>();
  private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
  private volatile long delayMillis;

  public StubResolver answer(String hostname, String... addresses) {
    answers.put(hostname, List.of(addresses));
    return this;
  }

  public StubResolver answerVia(String resolverAddress, String hostname, String... addresses) {
    viaResolver.computeIfAbsent(resolverAddress, key -> new ConcurrentHashMap<>())
        .put(hostname, List.of(addresses));
    return this;
  }

  public StubResolver delay(long millis) {
    this.delayMillis = millis;
    return this;
  }

  @Override
  public List<String> lookup(String hostname) throws ResolutionException, InterruptedException {
    record(hostname, hostname);
    List<String> found = answers.get(hostname);
    if (found == null) {
      throw new ResolutionException("NXDOMAIN " + hostname);
    }
    return found;
  }

  @Override
  public List<String> lookup(String hostname, String resolverAddress)
      throws ResolutionException, InterruptedException {
    record(hostname, hostname + "@" + resolverAddress);
    Map<String, List<String>> scoped = viaResolver.get(resolverAddress);
    if (scoped != null) {
      List<String> found = scoped.get(hostname);
      if (found != null) {
        return found;
      }
      throw new ResolutionException("NXDOMAIN " + hostname + " via " + resolverAddress);
    }
    List<String> found = answers.get(hostname);
    if (found == null) {
      throw new ResolutionException("NXDOMAIN " + hostname);
    }
    return found;
  }

  public List<String> queries() {
    return List.copyOf(queries);
  }

  public int lookupCount(String hostname) {
    AtomicInteger count = counts.get(hostname);
    return count == null ? 0 : count.get();
  }

  public int totalLookups() {
    return queries.size();
  }

  private void record(String hostname, String query) throws InterruptedException {
    queries.add(query);
    counts.computeIfAbsent(hostname, key -> new AtomicInteger()).incrementAndGet();
    if (delayMillis > 0) {
      Thread.sleep(delayMillis);
    }
  }
}
