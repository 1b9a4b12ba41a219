package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockConfig;
import io.github.panghy.flowsim.clock.ClockSnapshot;
import io.github.panghy.flowsim.clock.ConditionalAction;
import io.github.panghy.flowsim.clock.Schedulable;
import io.github.panghy.flowsim.clock.TimedAction;
import io.github.panghy.flowsim.core.FutureStream;
import io.github.panghy.flowsim.core.PromiseStream;
import io.github.panghy.flowsim.util.LoggingUtil;

import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * A clock paced by the wall clock instead of being run to a target time.
 *
 * <p>Its thread wakes up every period, applies the commands received since, sets the
 * clock time to the seconds elapsed since start and fires every tick and timed action
 * due by then. Other threads only talk to it through its command channel.</p>
 */
public class RealTimeClock implements AutoCloseable {

  private static final Logger LOGGER = Logger.getLogger(RealTimeClock.class.getName());

  /** Shortest supported period, in seconds. */
  public static final double MIN_PERIOD = 0.001;

  private static final long STOP_TIMEOUT_MILLIS = 5000;

  private final Clock clock;
  private final long periodNanos;
  private final PromiseStream<ClockMessage> commands = new PromiseStream<>();
  private final Thread thread;
  private volatile ClockSnapshot snapshot;
  private volatile Throwable lastFault;

  /**
   * Creates a real-time clock counting seconds.
   *
   * @param period Seconds between wake-ups, at least {@link #MIN_PERIOD}
   */
  public RealTimeClock(double period) {
    this(period, ClockConfig.builder().unit(ChronoUnit.SECONDS).build());
  }

  public RealTimeClock(double period, ClockConfig config) {
    if (period < MIN_PERIOD) {
      throw new IllegalArgumentException("Period must be at least " + MIN_PERIOD + "s: " + period);
    }
    this.clock = new Clock(config);
    this.periodNanos = (long) (period * 1e9);
    this.snapshot = clock.snapshot();
    this.thread = new Thread(this::loop, "flowsim-realtime");
    this.thread.setDaemon(true);
  }

  /**
   * Starts pacing.
   *
   * @return This clock
   */
  public RealTimeClock start() {
    thread.start();
    return this;
  }

  private void loop() {
    FutureStream<ClockMessage> inbox = commands.getFutureStream();
    clock.init();
    long start = System.nanoTime();
    try {
      while (true) {
        ClockMessage message;
        while ((message = inbox.poll()) != null) {
          if (message instanceof ClockMessage.Stop) {
            return;
          }
          if (message instanceof ClockMessage.Register register) {
            clock.register(register.item());
          } else if (message instanceof ClockMessage.Reset reset) {
            clock.reset(reset.hard());
            start = System.nanoTime();
          } else {
            LoggingUtil.warn(LOGGER, "real-time clock ignores " + message);
          }
        }
        double elapsed = (System.nanoTime() - start) / 1e9;
        try {
          clock.catchUp(clock.getConfig().getT0() + elapsed);
        } catch (RuntimeException e) {
          lastFault = e;
          LoggingUtil.warn(LOGGER, "action of real-time clock failed", e);
        }
        snapshot = clock.snapshot();
        TimeUnit.NANOSECONDS.sleep(periodNanos);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      commands.close();
      clock.close();
    }
  }

  /**
   * Registers an item with the clock on its next wake-up.
   *
   * @param item The item
   * @return false if the clock was closed
   */
  public boolean register(Schedulable item) {
    return commands.send(new ClockMessage.Register(item));
  }

  /**
   * Schedules an action {@code delay} seconds from the last published time.
   */
  public boolean after(Runnable action, double delay) {
    return register(new TimedAction(action, snapshot.time() + delay, 0));
  }

  public boolean every(Runnable action, double interval) {
    if (interval <= 0) {
      throw new IllegalArgumentException("Repeat interval must be positive: " + interval);
    }
    return register(new TimedAction(action, snapshot.time(), interval));
  }

  public boolean on(Runnable action, BooleanSupplier... checks) {
    return register(new ConditionalAction(action, Arrays.asList(checks)));
  }

  /**
   * Clears the registry and restarts time from the start time.
   */
  public boolean reset() {
    return commands.send(new ClockMessage.Reset(true, 0, 0));
  }

  /**
   * @return The clock state published after the last wake-up
   */
  public ClockSnapshot snapshot() {
    return snapshot;
  }

  public double getTime() {
    return snapshot.time();
  }

  /**
   * @return The last fault raised by an action, or null
   */
  public Throwable getLastFault() {
    return lastFault;
  }

  public boolean isRunning() {
    return thread.isAlive();
  }

  @Override
  public void close() {
    commands.send(new ClockMessage.Stop());
    try {
      thread.join(STOP_TIMEOUT_MILLIS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while stopping the real-time clock", e);
    }
  }
}
