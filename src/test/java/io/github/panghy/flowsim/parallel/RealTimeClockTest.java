package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.ClockConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.temporal.ChronoUnit;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class RealTimeClockTest {

  @Test
  void testRejectsTooShortPeriod() {
    assertThrows(IllegalArgumentException.class, () -> new RealTimeClock(0.0001));
  }

  @Test
  void testFiresActionsInWallTime() throws InterruptedException {
    try (RealTimeClock clock = new RealTimeClock(0.005).start()) {
      CountDownLatch fired = new CountDownLatch(1);
      long start = System.nanoTime();
      assertTrue(clock.after(fired::countDown, 0.05));

      assertTrue(fired.await(2, TimeUnit.SECONDS));
      assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(40));
      assertTrue(clock.isRunning());
    }
  }

  @Test
  void testRepeatingActionAndConditions() throws InterruptedException {
    ClockConfig config = ClockConfig.builder().unit(ChronoUnit.SECONDS).dt(0.01).build();
    try (RealTimeClock clock = new RealTimeClock(0.005, config).start()) {
      AtomicInteger ticks = new AtomicInteger();
      CountDownLatch enough = new CountDownLatch(1);
      clock.every(ticks::incrementAndGet, 0.01);
      clock.on(enough::countDown, () -> ticks.get() >= 5);

      assertTrue(enough.await(2, TimeUnit.SECONDS));
    }
  }

  @Test
  void testFaultsAreKept() throws InterruptedException {
    try (RealTimeClock clock = new RealTimeClock(0.005).start()) {
      CountDownLatch after = new CountDownLatch(1);
      clock.after(() -> {
        throw new IllegalStateException("late");
      }, 0.01);
      clock.after(after::countDown, 0.05);

      assertTrue(after.await(2, TimeUnit.SECONDS));
      assertEquals("late", clock.getLastFault().getMessage());
    }
  }

  @Test
  void testCloseStopsThread() {
    RealTimeClock clock = new RealTimeClock(0.005).start();
    clock.close();
    assertFalse(clock.isRunning());
    assertFalse(clock.after(() -> { }, 1));
  }
}
