package ca.gc.cra.subscan.validation;

import java.util.Locale;

/**
 * Hostname helpers shared by the scan engine and the CLI: target cleanup, sanity checks, and root-host
 * extraction for rate-limit grouping.
 *
 * @since 0.1.0
 */
public final class Domains {
  private static final String ILLEGAL_CHARACTERS = " !@#$%^&*()+={}[]:;'\"<>,?/\\|";

  private Domains() {
    // Utility
  }

  /**
   * Strips surrounding whitespace and a leading {@code http://}, {@code https://}, or {@code www.} prefix.
   *
   * @param raw user-supplied target; {@code null} yields an empty string
   * @return cleaned target, possibly empty
   */
  public static String clean(String raw) {
    if (raw == null) {
      return "";
    }
    String domain = raw.trim();
    domain = stripPrefix(domain, "http://");
    domain = stripPrefix(domain, "https://");
    domain = stripPrefix(domain, "www.");
    return domain;
  }

  /**
   * Performs a lightweight sanity check on a cleaned target: no illegal characters, at least one dot, and an
   * alphabetic top-level label of two or more characters.
   *
   * @param raw candidate domain (cleaned before checking)
   * @return {@code true} when the domain looks scannable
   */
  public static boolean isValid(String raw) {
    String domain = clean(raw);
    if (domain.isEmpty()) {
      return false;
    }
    for (int i = 0; i < domain.length(); i++) {
      if (ILLEGAL_CHARACTERS.indexOf(domain.charAt(i)) >= 0) {
        return false;
      }
    }
    int lastDot = domain.lastIndexOf('.');
    if (lastDot < 0) {
      return false;
    }
    String tld = domain.substring(lastDot + 1);
    if (tld.length() < 2) {
      return false;
    }
    for (int i = 0; i < tld.length(); i++) {
      char c = tld.charAt(i);
      if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Cleans and validates a target, returning its lowercase form.
   *
   * @param name option name used in diagnostics
   * @param raw user-supplied target
   * @return cleaned, lowercase domain
   * @throws IllegalArgumentException when the target fails {@link #isValid(String)}
   */
  public static String requireValid(String name, String raw) {
    String cleaned = clean(raw);
    if (!isValid(cleaned)) {
      throw new IllegalArgumentException(name + " is not a valid domain: '" + raw + "'");
    }
    return cleaned.toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the last two labels of a hostname. Names with two or fewer labels are returned unchanged.
   *
   * @param hostname candidate or discovered hostname
   * @return root host used as the backoff grouping key
   */
  public static String rootHost(String hostname) {
    if (hostname == null) {
      return "";
    }
    int last = hostname.lastIndexOf('.');
    if (last <= 0) {
      return hostname;
    }
    int previous = hostname.lastIndexOf('.', last - 1);
    if (previous < 0) {
      return hostname;
    }
    return hostname.substring(previous + 1);
  }

  private static String stripPrefix(String value, String prefix) {
    return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
  }
}
