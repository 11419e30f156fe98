package ca.gc.cra.subscan.application.scan;

import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed-size pool of long-lived workers pulling tasks from a bounded queue and publishing
 * non-null results to a bounded result queue.
 * <p><strong>Why:</strong> Candidate generation is unbounded while the worker budget is fixed; the bounded task
 * queue pushes back on the producer.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} is idempotent. {@link #close()} finishes gracefully,
 * {@link #stop()} cancels first so pending results may be dropped, and {@link #abort()} additionally discards
 * queued tasks and interrupts workers. Instances are single-use.</p>
 * <p><strong>Guarantees:</strong> Every task accepted by {@link #addTask(Callable)} executes exactly once unless
 * the pool is aborted; no task is accepted once intake is closed.</p>
 * <p><strong>Thread-safety:</strong> {@link #addTask(Callable)} may be called from any thread; results are
 * normally consumed by a single collector.</p>
 * <p><strong>Observability:</strong> Failed tasks are logged and counted under {@code scan.pool.task.failed}.</p>
 *
 * @param <R> task result type
 * @since 0.1.0
 */
public final class WorkerPool<R> {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final long ABORT_WAIT_SECONDS = 5L;

  private final int size;
  private final String threadPrefix;
  private final MetricsPort metrics;
  private final BlockingQueue<Callable<R>> tasks;
  private final BlockingQueue<R> results;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicLong executed = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final ReentrantReadWriteLock intakeLock = new ReentrantReadWriteLock();

  private volatile boolean intakeClosed;
  private volatile boolean resultsClosed;
  private volatile ExecutorService executor;

  /**
   * Creates a pool whose task and result queues hold {@code size} entries each.
   *
   * @param size worker count; must be positive
   * @param threadPrefix worker thread name prefix (threads are named {@code prefix-N})
   * @param metrics metrics sink
   */
  public WorkerPool(int size, String threadPrefix, MetricsPort metrics) {
    if (size <= 0) {
      throw new IllegalArgumentException("worker pool size must be positive");
    }
    this.size = size;
    this.threadPrefix = threadPrefix;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.tasks = new ArrayBlockingQueue<>(size);
    this.results = new ArrayBlockingQueue<>(size);
  }

  /** Starts the workers. Further calls have no effect. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    executor = ExecutorFactories.newWorkerPool(size, threadPrefix, this::handleWorkerCrash);
    for (int i = 0; i < size; i++) {
      executor.execute(new Worker());
    }
    log.debug("Started {} scan workers", size);
  }

  /**
   * Submits a task, blocking while the task queue is full.
   *
   * @param task work producing a result, or {@code null} for no result
   * @return {@code true} when accepted; {@code false} once the pool is stopping or stopped
   * @throws InterruptedException if the caller is interrupted while waiting for queue space
   */
  public boolean addTask(Callable<R> task) throws InterruptedException {
    Objects.requireNonNull(task, "task");
    while (true) {
      intakeLock.readLock().lock();
      try {
        if (intakeClosed || cancelled.get()) {
          return false;
        }
        if (tasks.offer(task, WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          return true;
        }
      } finally {
        intakeLock.readLock().unlock();
      }
    }
  }

  /**
   * Waits for the next result.
   *
   * @return next result, or empty once the pool has shut down and every buffered result was consumed
   * @throws InterruptedException if the caller is interrupted while waiting
   */
  public Optional<R> takeResult() throws InterruptedException {
    while (true) {
      R result = results.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (result != null) {
        return Optional.of(result);
      }
      if (resultsClosed && results.isEmpty()) {
        return Optional.empty();
      }
    }
  }

  /**
   * Waits up to {@code timeout} for the next result.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return next result, or empty when none arrived in time or the pool has fully drained
   * @throws InterruptedException if the caller is interrupted while waiting
   */
  public Optional<R> pollResult(long timeout, TimeUnit unit) throws InterruptedException {
    return Optional.ofNullable(results.poll(timeout, unit));
  }

  /**
   * Reports whether the result side has been closed and fully consumed.
   *
   * @return {@code true} when no further results can arrive
   */
  public boolean isDrained() {
    return resultsClosed && results.isEmpty();
  }

  /**
   * Closes intake, runs every accepted task, waits for the workers, and closes the result side. Results are
   * never dropped, so a collector must keep consuming while this call blocks.
   *
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public void close() throws InterruptedException {
    shutdown();
  }

  /**
   * Cancels the pool: closes intake, lets workers finish every accepted task, waits for them, and closes the
   * result side. Results that cannot be buffered after cancellation are dropped.
   *
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public void stop() throws InterruptedException {
    cancelled.set(true);
    shutdown();
  }

  /**
   * Stops the pool and returns every buffered result.
   *
   * @return results that were published before cancellation, in publication order
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public List<R> stopAndDrain() throws InterruptedException {
    stop();
    List<R> drained = new ArrayList<>(results.size());
    results.drainTo(drained);
    return drained;
  }

  /**
   * Cancels the pool, discards queued tasks, and interrupts in-flight work. Used when the owning scan is
   * interrupted; waits at most a few seconds for workers to exit.
   */
  public void abort() {
    cancelled.set(true);
    closeIntake();
    int discarded = tasks.size();
    tasks.clear();
    ExecutorService current = executor;
    if (current != null) {
      current.shutdownNow();
      try {
        if (!current.awaitTermination(ABORT_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Scan workers did not exit within {}s of abort", ABORT_WAIT_SECONDS);
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }
    resultsClosed = true;
    log.debug("Worker pool aborted; discarded {} queued tasks", discarded);
  }

  /**
   * Returns how many tasks have run to completion or failure.
   *
   * @return executed task count
   */
  public long executedCount() {
    return executed.get();
  }

  /**
   * Returns how many results were dropped because cancellation fired before they could be published.
   *
   * @return dropped result count
   */
  public long droppedCount() {
    return dropped.get();
  }

  private void shutdown() throws InterruptedException {
    closeIntake();
    start();
    ExecutorService current = executor;
    current.shutdown();
    // In-flight tasks are bounded by resolver and probe timeouts.
    current.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    resultsClosed = true;
    if (dropped.get() > 0) {
      log.debug("Worker pool dropped {} results after cancellation", dropped.get());
    }
  }

  private void closeIntake() {
    intakeLock.writeLock().lock();
    try {
      intakeClosed = true;
    } finally {
      intakeLock.writeLock().unlock();
    }
  }

  private void execute(Callable<R> task) throws InterruptedException {
    R result;
    try {
      result = task.call();
    } catch (InterruptedException ie) {
      throw ie;
    } catch (Exception ex) {
      metrics.increment("scan.pool.task.failed");
      log.warn("Scan task failed", ex);
      return;
    } finally {
      executed.incrementAndGet();
    }
    if (result != null) {
      publish(result);
    }
  }

  private void publish(R result) throws InterruptedException {
    if (results.offer(result)) {
      return;
    }
    while (!cancelled.get()) {
      if (results.offer(result, WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return;
      }
    }
    dropped.incrementAndGet();
  }

  private void handleWorkerCrash(Thread thread, Throwable error) {
    log.error("Scan worker {} terminated unexpectedly", thread.getName(), error);
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      try {
        while (!Thread.currentThread().isInterrupted()) {
          if (intakeClosed && tasks.isEmpty()) {
            break;
          }
          Callable<R> task = tasks.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (task == null) {
            continue;
          }
          execute(task);
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
