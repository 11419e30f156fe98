package ca.gc.cra.subscan.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named thread pools used by the scan engine.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for scan workers. Each worker thread is long-lived and pulls tasks from the
   * pool's own queue, so the executor itself never queues.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix; threads are named {@code prefix-N} starting at 1
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = namedFactory(prefix, "scan-worker", false, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded daemon scheduler for background maintenance such as cache sweeps.
   *
   * @param name thread name
   * @return scheduler that never blocks JVM exit
   */
  public static ScheduledExecutorService newDaemonScheduler(String name) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(name);
          thread.setDaemon(true);
          return thread;
        });
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Builds a single-thread executor used to run a producer loop next to the collecting thread.
   *
   * @param name thread name
   * @return executor with one non-daemon thread
   */
  public static ExecutorService newSingleThread(String name) {
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(name);
      thread.setDaemon(false);
      return thread;
    };
    return new ThreadPoolExecutor(
        1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory);
  }

  private static ThreadFactory namedFactory(
      String prefix, String fallback, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(
        handler, (t, ex) -> log.error("Uncaught exception in {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger(1);
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
