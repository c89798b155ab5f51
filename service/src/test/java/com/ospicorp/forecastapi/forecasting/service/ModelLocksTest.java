package com.ospicorp.forecastapi.forecasting.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ModelLocksTest {

  @Test
  void sameKeyRunsOneAtATime() throws Exception {
    var locks = new ModelLocks();
    var active = new AtomicInteger();
    var maxActive = new AtomicInteger();
    var start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      Future<?>[] futures = new Future<?>[8];
      for (int i = 0; i < futures.length; i++) {
        futures[i] = pool.submit(() -> {
          start.await();
          return locks.withLock("1_AUTO_REGRESSION", () -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
              Thread.sleep(5);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return active.decrementAndGet();
          });
        });
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(maxActive.get()).isEqualTo(1);
    assertThat(locks.isLocked("1_AUTO_REGRESSION")).isFalse();
  }

  @Test
  void lockIsHeldOnlyDuringAction() {
    var locks = new ModelLocks();

    boolean heldInside = locks.withLock("2_EXPONENTIAL_SMOOTHING",
        () -> locks.isLocked("2_EXPONENTIAL_SMOOTHING"));

    assertThat(heldInside).isTrue();
    assertThat(locks.isLocked("2_EXPONENTIAL_SMOOTHING")).isFalse();
    assertThat(locks.isLocked("3_AUTO_REGRESSION")).isFalse();
  }
}
