package ca.gc.cra.subscan.domain;

import java.util.List;
import java.util.Optional;

/**
 * Ordered fingerprint table for subdomain takeover detection.
 *
 * <p>Matching walks {@link #DEFAULT} in declaration order and the first hit wins, so results are reproducible
 * when a body matches several services. Broad patterns that overlap (for example the generic bucket message
 * shared by several object stores) resolve to the earliest entry.</p>
 *
 * @since 0.1.0
 */
public final class TakeoverFingerprints {

  /** Built-in fingerprints grouped by provider family. */
  public static final List<TakeoverFingerprint> DEFAULT = List.of(
      // Cloud storage
      fp("aws", "NoSuchBucket"),
      fp("aws_s3", "The specified bucket does not exist"),
      fp("azure", "The specified container does not exist"),
      fp("azure_blob", "404 The specified container does not exist"),
      fp("google_cloud_storage", "The specified bucket does not exist"),
      fp("digitalocean_spaces", "NoSuchBucket"),
      fp("backblaze_b2", "No such bucket"),
      fp("oracle_cloud", "The bucket does not exist."),
      fp("alibaba_cloud_oss", "The specified bucket does not exist."),
      fp("tencent_cloud_cos", "The specified bucket does not exist."),
      fp("ibm_cloud_storage", "The specified bucket does not exist."),
      // Hosting platforms
      fp("github", "There isn't a GitHub Pages site here"),
      fp("github_pages", "Page not found"),
      fp("heroku", "No such app"),
      fp("pantheon", "The gods are wise, but do not know of this site"),
      fp("acquia", "The site you were looking for couldn't be found"),
      fp("ghost", "The thing you were looking for is no longer here, or never was"),
      fp("netlify", "Not found - Request ID"),
      fp("vercel", "The deployment could not be found"),
      fp("firebase", "This site is not currently connected to Firebase"),
      // E-commerce
      fp("shopify", "Sorry, this shop is currently unavailable"),
      fp("bigcommerce", "This store is unavailable"),
      fp("wix", "This domain is registered, but the owner hasn't connected it to a Wix site yet"),
      fp("squarespace", "You're in the right place, but we can't find the page you're looking for"),
      // CDNs
      fp("fastly", "Fastly error: unknown domain"),
      fp("cloudfront", "The request could not be satisfied"),
      fp("akamai", "Reference"),
      fp("cloudflare", "DNS points to prohibited IP"),
      // CMS
      fp("wordpress", "Do you want to register"),
      fp("drupal", "The requested page could not be found"),
      fp("joomla", "It looks like there's a server configuration issue"),
      // Productivity and support
      fp("teamwork", "Oops - We didn't find your site"),
      fp("helpjuice", "We could not find what you're looking for"),
      fp("helpscout", "No settings were found for this company"),
      fp("zendesk", "Help Center Closed"),
      fp("freshdesk", "Oops, this help center doesn't exist"),
      fp("intercom", "This page is reserved for"),
      // Miscellaneous
      fp("cargo", "The specified Cargo site could not be found"),
      fp("feedpress", "The feed has not been found"),
      fp("surge", "project not found"),
      fp("webflow", "The page you are looking for doesn't exist or has been moved"),
      fp("jazzhr", "This account no longer active"),
      fp("statuspage", "You are being redirected"),
      fp("uservoice", "This UserVoice subdomain is currently available"),
      fp("thinkific", "You may have typed the address incorrectly"),
      fp("canny", "Company Not Found"),
      fp("pingdom", "Sorry, couldn't find the status page"),
      fp("tilda", "Please renew your subscription"),
      fp("unbounce", "The requested URL was not found on this server"),
      fp("smartjob", "Job Board Is Unavailable"),
      fp("readme", "Project doesnt exist... yet!"),
      fp("getresponse", "This landing page is unavailable or doesn't exist"));

  private TakeoverFingerprints() {}

  /**
   * Returns the first fingerprint in {@code fingerprints} that matches {@code body}.
   *
   * @param fingerprints ordered fingerprint list
   * @param body response body
   * @return first matching fingerprint
   */
  public static Optional<TakeoverFingerprint> firstMatch(List<TakeoverFingerprint> fingerprints, String body) {
    if (body == null || body.isEmpty()) {
      return Optional.empty();
    }
    for (TakeoverFingerprint fingerprint : fingerprints) {
      if (fingerprint.matches(body)) {
        return Optional.of(fingerprint);
      }
    }
    return Optional.empty();
  }

  private static TakeoverFingerprint fp(String service, String pattern) {
    return new TakeoverFingerprint(service, pattern);
  }
}
