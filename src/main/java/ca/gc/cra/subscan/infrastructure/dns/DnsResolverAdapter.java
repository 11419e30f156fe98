package ca.gc.cra.subscan.infrastructure.dns;

import ca.gc.cra.subscan.application.port.ResolutionException;
import ca.gc.cra.subscan.application.port.ResolverPort;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

/**
 * <strong>What:</strong> {@link ResolverPort} using the JVM resolver by default and dnsjava
 * {@link SimpleResolver} instances for explicitly configured resolvers.
 * <p><strong>Why:</strong> The JDK cannot direct a query at a specific server; dnsjava can, over UDP port 53.</p>
 * <p><strong>Thread-safety:</strong> Resolver instances are created once per address and shared; dnsjava lookups
 * run with caching disabled so results always reflect the chosen server.</p>
 *
 * @since 0.1.0
 */
public final class DnsResolverAdapter implements ResolverPort {
  private static final Logger log = LoggerFactory.getLogger(DnsResolverAdapter.class);

  /** Default per-query timeout for explicit resolvers. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);
  private static final int DNS_PORT = 53;

  private final Duration timeout;
  private final int port;
  private final ConcurrentMap<String, SimpleResolver> resolvers = new ConcurrentHashMap<>();

  /** Creates an adapter with {@link #DEFAULT_TIMEOUT}. */
  public DnsResolverAdapter() {
    this(DEFAULT_TIMEOUT);
  }

  /**
   * Creates an adapter with an explicit query timeout.
   *
   * @param timeout per-query timeout for explicit resolvers
   */
  public DnsResolverAdapter(Duration timeout) {
    this(timeout, DNS_PORT);
  }

  DnsResolverAdapter(Duration timeout, int port) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.port = port;
  }

  @Override
  public List<String> lookup(String hostname) throws ResolutionException, InterruptedException {
    checkInterrupted();
    try {
      InetAddress[] addresses = InetAddress.getAllByName(hostname);
      Set<String> unique = new LinkedHashSet<>();
      for (InetAddress address : addresses) {
        unique.add(address.getHostAddress());
      }
      return List.copyOf(unique);
    } catch (UnknownHostException ex) {
      throw new ResolutionException("No such host: " + hostname, ex);
    }
  }

  @Override
  public List<String> lookup(String hostname, String resolverAddress)
      throws ResolutionException, InterruptedException {
    checkInterrupted();
    SimpleResolver resolver = resolverFor(resolverAddress);
    Name name;
    try {
      name = Name.fromString(hostname, Name.root);
    } catch (TextParseException ex) {
      throw new ResolutionException("Invalid hostname: " + hostname, ex);
    }

    List<String> addresses = new ArrayList<>();
    Lookup ipv4 = query(name, Type.A, resolver);
    if (ipv4.getResult() == Lookup.HOST_NOT_FOUND) {
      throw new ResolutionException(hostname + " not found via " + resolverAddress);
    }
    collect(ipv4, addresses);
    checkInterrupted();
    Lookup ipv6 = query(name, Type.AAAA, resolver);
    collect(ipv6, addresses);

    if (addresses.isEmpty()) {
      throw new ResolutionException(
          hostname + " has no addresses via " + resolverAddress + " (" + ipv4.getErrorString() + ")");
    }
    return List.copyOf(addresses);
  }

  private Lookup query(Name name, int type, SimpleResolver resolver) {
    Lookup lookup = new Lookup(name, type);
    lookup.setResolver(resolver);
    lookup.setCache(null);
    lookup.setSearchPath((Name[]) null);
    lookup.run();
    return lookup;
  }

  private static void collect(Lookup lookup, List<String> addresses) {
    if (lookup.getResult() != Lookup.SUCCESSFUL) {
      return;
    }
    for (Record record : lookup.getAnswers()) {
      String value = null;
      if (record instanceof ARecord a) {
        value = a.getAddress().getHostAddress();
      } else if (record instanceof AAAARecord aaaa) {
        value = aaaa.getAddress().getHostAddress();
      }
      if (value != null && !addresses.contains(value)) {
        addresses.add(value);
      }
    }
  }

  private SimpleResolver resolverFor(String resolverAddress) throws ResolutionException {
    SimpleResolver existing = resolvers.get(resolverAddress);
    if (existing != null) {
      return existing;
    }
    try {
      SimpleResolver created = new SimpleResolver(resolverAddress);
      created.setPort(port);
      created.setTimeout(timeout);
      SimpleResolver raced = resolvers.putIfAbsent(resolverAddress, created);
      if (raced == null) {
        log.debug("Created resolver for {} (timeout {} ms)", resolverAddress, timeout.toMillis());
        return created;
      }
      return raced;
    } catch (UnknownHostException ex) {
      throw new ResolutionException("Unknown resolver " + resolverAddress, ex);
    }
  }

  private static void checkInterrupted() throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException("DNS lookup interrupted");
    }
  }
}
