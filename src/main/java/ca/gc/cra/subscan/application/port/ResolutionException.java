package ca.gc.cra.subscan.application.port;

/**
 * Checked exception raised when a hostname cannot be resolved by a resolver.
 *
 * <p>The scan engine absorbs it per candidate and records a negative cache entry.</p>
 *
 * @since 0.1.0
 */
public final class ResolutionException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public ResolutionException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause resolver or socket failure
   */
  public ResolutionException(String msg, Throwable cause) { super(msg, cause); }
}
