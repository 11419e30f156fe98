package ca.gc.cra.subscan.api;

/**
 * <strong>What:</strong> Process exit codes shared by the SubScan commands.
 * <p><strong>Why:</strong> Lets wrapper scripts tell a bad invocation apart from a resolver, file, or network
 * failure without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Scan finished. */
  SUCCESS(0),
  /** Arguments or merged options failed validation. */
  INVALID_ARGS(2),
  /** A wordlist, domain list, or result file could not be read or written. */
  IO_ERROR(3),
  /** A referenced configuration source (YAML, resolver list) was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected failure inside the scan engine. */
  RUNTIME_FAILURE(5),
  /** Scan was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
