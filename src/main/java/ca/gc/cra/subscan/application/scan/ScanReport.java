package ca.gc.cra.subscan.application.scan;

import ca.gc.cra.subscan.domain.SubdomainResult;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one completed scan.
 *
 * @param domain root domain
 * @param candidatesPerLevel candidates dispatched at each level, in level order
 * @param results emitted results in collection order
 * @param cacheHits candidates answered from the resolution cache
 * @param resolutionFailures lookups that produced a negative cache entry
 * @since 0.1.0
 */
public record ScanReport(
    String domain,
    List<Long> candidatesPerLevel,
    List<SubdomainResult> results,
    long cacheHits,
    long resolutionFailures) {

  public ScanReport {
    Objects.requireNonNull(domain, "domain");
    candidatesPerLevel = List.copyOf(candidatesPerLevel);
    results = List.copyOf(results);
  }

  /**
   * Returns the number of levels executed.
   *
   * @return level count
   */
  public int levels() {
    return candidatesPerLevel.size();
  }

  /**
   * Returns the total number of candidates dispatched across levels.
   *
   * @return candidate count
   */
  public long totalCandidates() {
    return candidatesPerLevel.stream().mapToLong(Long::longValue).sum();
  }
}
