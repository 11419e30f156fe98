package ca.gc.cra.subscan.infrastructure.dns;

import java.io.IOException;

/**
 * Raised when a resolver file cannot be read or contains an invalid entry.
 *
 * @since 0.1.0
 */
public final class ResolverListException extends IOException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error naming the file
   */
  public ResolverListException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error naming the file
   * @param cause IO or validation failure
   */
  public ResolverListException(String msg, Throwable cause) { super(msg, cause); }
}
