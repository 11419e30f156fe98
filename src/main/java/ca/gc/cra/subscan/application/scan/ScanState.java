package ca.gc.cra.subscan.application.scan;

/**
 * Lifecycle states of {@link ScanOrchestrator}. A scan loops from {@link #LEVEL_DONE} back to
 * {@link #LEVEL_START} while recursion continues.
 *
 * @since 0.1.0
 */
public enum ScanState {
  /** Not yet started. */
  IDLE,
  /** Computing the target frontier for a level. */
  LEVEL_START,
  /** Opening the word source for the level. */
  INGESTING,
  /** Producer is enqueueing candidates. */
  DISPATCHING,
  /** Collector is forwarding results to the sink. */
  COLLECTING,
  /** Level finished; deciding whether to recurse. */
  LEVEL_DONE,
  /** Terminal state. */
  FINISHED
}
