package ca.gc.cra.subscan.testutil;

import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import java.util.ArrayList;
import java.util.List;

/** Captures sink callbacks in order. */
public final class RecordingResultSink implements ResultSinkPort {
  private final List<SubdomainResult> results = new ArrayList<>();
  private final List<String> events = new ArrayList<>();
  private boolean closed;

  @Override
  public synchronized void beginDomain(String domain) {
    events.add("begin:" + domain);
  }

  @Override
  public synchronized void accept(SubdomainResult result) {
    results.add(result);
    events.add("accept:" + result.subdomain());
  }

  @Override
  public synchronized void endDomain(String domain, int discovered) {
    events.add("end:" + domain + ":" + discovered);
  }

  @Override
  public synchronized void close() {
    closed = true;
  }

  public synchronized List<SubdomainResult> results() {
    return List.copyOf(results);
  }

  public synchronized List<String> subdomains() {
    return results.stream().map(SubdomainResult::subdomain).toList();
  }

  public synchronized List<String> events() {
    return List.copyOf(events);
  }

  public synchronized boolean closed() {
    return closed;
  }
}
