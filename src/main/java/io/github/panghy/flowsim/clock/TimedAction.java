package io.github.panghy.flowsim.clock;

import java.util.Objects;

/**
 * An action fired once at a virtual time, or repeatedly when it carries a cycle.
 * Instances are immutable; a clock stores the copy carrying the fire time it actually
 * assigned.
 */
public final class TimedAction implements Schedulable {

  private final Runnable action;
  private final double time;
  private final double cycle;

  /**
   * Creates a timed action.
   *
   * @param action The work to run
   * @param time   The requested fire time
   * @param cycle  Interval after which the action reschedules itself, 0 for one-shot
   */
  public TimedAction(Runnable action, double time, double cycle) {
    if (cycle < 0) {
      throw new IllegalArgumentException("Cycle cannot be negative: " + cycle);
    }
    this.action = Objects.requireNonNull(action, "Action cannot be null");
    this.time = time;
    this.cycle = cycle;
  }

  public Runnable getAction() {
    return action;
  }

  public double getTime() {
    return time;
  }

  public double getCycle() {
    return cycle;
  }

  public boolean isRepeating() {
    return cycle > 0;
  }

  TimedAction withTime(double newTime) {
    return new TimedAction(action, newTime, cycle);
  }

  TimedAction rescaled(double factor) {
    return new TimedAction(action, time * factor, cycle * factor);
  }

  @Override
  public String toString() {
    return "TimedAction{" +
        "time=" + time +
        ", cycle=" + cycle +
        '}';
  }
}
