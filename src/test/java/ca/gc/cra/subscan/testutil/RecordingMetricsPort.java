package ca.gc.cra.subscan.testutil;

import ca.gc.cra.subscan.application.port.MetricsPort;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.LongAdder;

/** Thread-safe metrics double that keeps counters and observations in memory. */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
  private final Map<String, Queue<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new LongAdder()).increment();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ConcurrentLinkedQueue<>()).add(value);
  }

  public long count(String key) {
    LongAdder adder = counters.get(key);
    return adder == null ? 0L : adder.sum();
  }

  public List<Long> observed(String key) {
    Queue<Long> values = observations.get(key);
    return values == null ? List.of() : List.copyOf(values);
  }
}
