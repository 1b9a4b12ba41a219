package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockSnapshot;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * A handle on a clock owned by the calling thread.
 */
public final class LocalClock implements ClockHandle {

  private final Clock clock;

  public LocalClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  public Clock getClock() {
    return clock;
  }

  @Override
  public int getId() {
    return clock.getId();
  }

  @Override
  public double at(Runnable action, double t) {
    return clock.at(action, t);
  }

  @Override
  public double after(Runnable action, double delay) {
    return clock.after(action, delay);
  }

  @Override
  public double every(Runnable action, double interval) {
    return clock.every(action, interval);
  }

  @Override
  public double on(Runnable action, BooleanSupplier... checks) {
    return clock.on(action, checks);
  }

  @Override
  public double periodic(Runnable action) {
    return clock.periodic(action);
  }

  @Override
  public ClockSnapshot query() {
    return clock.snapshot();
  }
}
