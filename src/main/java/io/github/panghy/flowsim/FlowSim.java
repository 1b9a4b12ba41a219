package io.github.panghy.flowsim;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockConfig;
import io.github.panghy.flowsim.clock.RunSummary;
import io.github.panghy.flowsim.process.ProcessBody;
import io.github.panghy.flowsim.process.SimProcess;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Convenience access to a default clock for applications that only need one.
 *
 * <p>The engine itself never uses this class; clocks are always passed explicitly. The
 * default clock has an explicit lifecycle: {@link #init()} creates it, {@link #reset()}
 * discards it.</p>
 */
public final class FlowSim {

  private static final AtomicReference<Clock> DEFAULT_CLOCK = new AtomicReference<>();

  private FlowSim() {
  }

  /**
   * Creates and initializes a new default clock with the default configuration.
   *
   * @return The default clock
   */
  public static Clock init() {
    return init(ClockConfig.DEFAULT);
  }

  /**
   * Creates and initializes a new default clock, replacing any previous one.
   *
   * @param config The configuration
   * @return The default clock
   */
  public static Clock init(ClockConfig config) {
    Clock clock = new Clock(config);
    clock.init();
    Clock previous = DEFAULT_CLOCK.getAndSet(clock);
    if (previous != null) {
      previous.reset(true);
    }
    return clock;
  }

  /**
   * @return The default clock
   * @throws IllegalStateException if {@link #init()} was not called
   */
  public static Clock clock() {
    Clock clock = DEFAULT_CLOCK.get();
    if (clock == null) {
      throw new IllegalStateException("No default clock, call FlowSim.init() first");
    }
    return clock;
  }

  public static boolean isInitialized() {
    return DEFAULT_CLOCK.get() != null;
  }

  /**
   * Hard resets and discards the default clock.
   */
  public static void reset() {
    Clock previous = DEFAULT_CLOCK.getAndSet(null);
    if (previous != null) {
      previous.reset(true);
    }
  }

  public static double at(Runnable action, double t) {
    return clock().at(action, t);
  }

  public static double after(Runnable action, double delay) {
    return clock().after(action, delay);
  }

  public static double every(Runnable action, double interval) {
    return clock().every(action, interval);
  }

  public static SimProcess process(Object id, ProcessBody body) {
    return clock().process(id, body);
  }

  public static RunSummary run(double duration) {
    return clock().run(duration);
  }

  /**
   * @return The current time of the default clock
   */
  public static double now() {
    return clock().getTime();
  }
}
