package io.github.panghy.flowsim.clock;

import java.util.Objects;

/**
 * An action run on every sampling tick of its clock.
 */
public final class PeriodicAction implements Schedulable {

  private final Runnable action;
  // requested sampling interval, 0 keeps or derives the clock's
  private final double interval;

  public PeriodicAction(Runnable action, double interval) {
    if (interval < 0) {
      throw new IllegalArgumentException("Sampling interval cannot be negative: " + interval);
    }
    this.action = Objects.requireNonNull(action, "Action cannot be null");
    this.interval = interval;
  }

  public Runnable getAction() {
    return action;
  }

  public double getInterval() {
    return interval;
  }
}
