package io.github.panghy.flowsim.clock;

/**
 * Connects a clock to the other clocks of a parallel group. A master clock routes to
 * its workers and runs them in lockstep; a worker routes everything through its master.
 */
public interface ClockRouter {

  /** Target id asking the master to pick a clock at random. */
  int ANY = -1;

  /**
   * Registers an item on another clock of the group.
   *
   * @param item   The item to register
   * @param target The target clock id, or {@link #ANY}
   * @return The time reported for the registration
   */
  double route(Schedulable item, int target);

  /**
   * @return The id of the clock that should receive a spawned item
   */
  int spawnTarget();

  /**
   * @return The time from which synchronization boundaries are counted
   */
  double syncOrigin();

  /**
   * @return The interval between synchronization boundaries
   */
  double syncInterval();

  /**
   * Runs the whole group for {@code duration}.
   *
   * @return The summary, or null when the clock should run on its own
   */
  default RunSummary runSynchronized(Clock clock, double duration, boolean resetCounters) {
    return null;
  }

  /**
   * Called after the routed clock was reset.
   */
  default void afterReset(Clock clock, boolean hard) {
  }
}
