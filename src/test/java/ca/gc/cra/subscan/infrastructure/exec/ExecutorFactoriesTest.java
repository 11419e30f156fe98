package ca.gc.cra.subscan.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerThreadsAreNamedWithPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "scan-worker", null);
    try {
      Future<String> name = pool.submit(() -> Thread.currentThread().getName());
      assertEquals("scan-worker-1", name.get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void workerPoolHandsOffWithoutQueueing() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "busy", null);
    try {
      pool.execute(() -> {
        try {
          Thread.sleep(5_000);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void schedulerThreadsAreDaemons() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newDaemonScheduler("sweeper");
    try {
      Future<Boolean> daemon = scheduler.submit(() -> Thread.currentThread().isDaemon());
      assertTrue(daemon.get(5, TimeUnit.SECONDS));
    } finally {
      scheduler.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositivePoolSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
