package ca.gc.cra.subscan.application.port;

import java.io.IOException;

/**
 * Raised when a candidate word source is unreachable or unreadable. Fatal for the current scan.
 *
 * @since 0.1.0
 */
public final class WordlistLoadException extends IOException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error naming the source
   */
  public WordlistLoadException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error naming the source
   * @param cause IO or HTTP failure
   */
  public WordlistLoadException(String msg, Throwable cause) { super(msg, cause); }
}
