package ca.gc.cra.subscan.infrastructure.sink;

import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Renders results as plain console lines:
 * <pre>
 *  +  www.example.com
 *  +  www.example.com (93.184.216.34)
 *  !  shop.example.com | Possible Takeover: shopify
 * </pre>
 * followed by a {@code » Found N subdomains} summary per domain. The writer is flushed but never closed.
 *
 * @since 0.1.0
 */
public final class ConsoleResultSink implements ResultSinkPort {
  private final PrintWriter out;
  private final boolean showIp;

  /**
   * Creates a console sink.
   *
   * @param out destination writer, normally stdout
   * @param showIp whether to print the first resolved address
   */
  public ConsoleResultSink(PrintWriter out, boolean showIp) {
    this.out = Objects.requireNonNull(out, "out");
    this.showIp = showIp;
  }

  @Override
  public void beginDomain(String domain) {
    out.println();
    out.println("» Scanning " + domain);
    out.flush();
  }

  @Override
  public void accept(SubdomainResult result) {
    out.println(render(result, showIp));
    out.flush();
  }

  @Override
  public void endDomain(String domain, int discovered) {
    out.println();
    out.println("» Found " + discovered + " subdomains");
    out.flush();
  }

  @Override
  public void close() {
    out.flush();
  }

  static String render(SubdomainResult result, boolean showIp) {
    StringBuilder line = new StringBuilder(64);
    line.append(result.takeover() != null ? " !  " : " +  ").append(result.subdomain());
    if (showIp && !result.ips().isEmpty()) {
      line.append(" (").append(result.ips().get(0)).append(')');
    }
    if (result.takeover() != null) {
      line.append(" | Possible Takeover: ").append(result.takeover());
    }
    return line.toString();
  }
}
