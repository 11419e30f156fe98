package ca.gc.cra.subscan.infrastructure.http;

/**
 * Raised when the configured HTTP proxy URL is malformed or uses an unsupported scheme.
 *
 * @since 0.1.0
 */
public final class ProxyConfigException extends IllegalArgumentException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public ProxyConfigException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause parse failure
   */
  public ProxyConfigException(String msg, Throwable cause) { super(msg, cause); }
}
