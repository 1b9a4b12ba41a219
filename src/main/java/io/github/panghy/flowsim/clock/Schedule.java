package io.github.panghy.flowsim.clock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The registry of a single clock: timed actions ordered by fire time, and the
 * conditional and periodic actions in registration order.
 *
 * <p>No two timed actions share a fire time. A colliding time is advanced to the next
 * representable double until it is free, so actions requested for the same instant
 * fire in insertion order.</p>
 *
 * <p>Not thread-safe. Only the owning clock's thread (or a process holding its baton)
 * touches a schedule.</p>
 */
public class Schedule {

  private final TreeMap<Double, TimedAction> events = new TreeMap<>();
  private final List<ConditionalAction> conditions = new ArrayList<>();
  private final List<PeriodicAction> samples = new ArrayList<>();

  /**
   * Inserts a timed action.
   *
   * @param action The action, its time is taken as the requested fire time
   * @return The fire time actually assigned
   */
  public double addEvent(TimedAction action) {
    double time = action.getTime();
    while (events.containsKey(time)) {
      time = Math.nextUp(time);
    }
    events.put(time, time == action.getTime() ? action : action.withTime(time));
    return time;
  }

  public boolean hasEvents() {
    return !events.isEmpty();
  }

  /**
   * @return The earliest fire time, or NaN if there are no timed actions
   */
  public double nextEventTime() {
    return events.isEmpty() ? Double.NaN : events.firstKey();
  }

  TimedAction pollEvent() {
    Map.Entry<Double, TimedAction> first = events.pollFirstEntry();
    return first == null ? null : first.getValue();
  }

  public void addCondition(ConditionalAction condition) {
    conditions.add(condition);
  }

  /**
   * Removes and returns the first condition whose checks all hold.
   *
   * @return The condition, or null if none is satisfied
   */
  ConditionalAction pollSatisfiedCondition() {
    for (int i = 0; i < conditions.size(); i++) {
      if (conditions.get(i).isSatisfied()) {
        return conditions.remove(i);
      }
    }
    return null;
  }

  public void addSample(PeriodicAction sample) {
    samples.add(sample);
  }

  public List<TimedAction> getEvents() {
    return Collections.unmodifiableList(new ArrayList<>(events.values()));
  }

  public List<ConditionalAction> getConditions() {
    return Collections.unmodifiableList(conditions);
  }

  public List<PeriodicAction> getSamples() {
    return Collections.unmodifiableList(samples);
  }

  /**
   * Moves every timed action by {@code delta}, keeping their relative order.
   */
  void shift(double delta) {
    List<TimedAction> pending = new ArrayList<>(events.values());
    events.clear();
    for (TimedAction event : pending) {
      addEvent(event.withTime(event.getTime() + delta));
    }
  }

  /**
   * Multiplies every fire time and cycle by {@code factor}, used when the clock changes unit.
   */
  void rescale(double factor) {
    List<TimedAction> pending = new ArrayList<>(events.values());
    events.clear();
    for (TimedAction event : pending) {
      addEvent(event.rescaled(factor));
    }
  }

  public void clear() {
    events.clear();
    conditions.clear();
    samples.clear();
  }

  @Override
  public String toString() {
    return "Schedule{" +
        "events=" + events.size() +
        ", conditions=" + conditions.size() +
        ", samples=" + samples.size() +
        '}';
  }
}
