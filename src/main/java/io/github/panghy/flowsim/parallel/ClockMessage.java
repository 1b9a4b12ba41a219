package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.Schedulable;

/**
 * Messages exchanged between a master clock and its workers. Commands travel on a
 * worker's forth channel; answers, forwarded registrations and faults travel back.
 * Every command except {@link Stop} gets exactly one answer.
 */
public interface ClockMessage {

  /** Register an item on the receiving clock. Answered with a {@link Response} of the time. */
  record Register(Schedulable item) implements ClockMessage {
  }

  /** Ask for a {@code ClockSnapshot}. */
  record Query() implements ClockMessage {
  }

  /**
   * Run the worker's clock for one slice. Answered with {@link Done}.
   *
   * @param duration The slice
   * @param sync     true for the continuation rounds of a synchronized run, whose
   *                 counters keep accumulating
   */
  record Run(double duration, boolean sync) implements ClockMessage {
  }

  /** Move the worker to the master's time and sampling interval. */
  record Sync(double time, double dt) implements ClockMessage {
  }

  /** Reset the worker, then synchronize it to the master's time and interval. */
  record Reset(boolean hard, double time, double dt) implements ClockMessage {
  }

  /** Ask for the worker's last fault. Answered with a {@link Response} of a {@link Diagnosis}. */
  record Diag() implements ClockMessage {
  }

  /**
   * A finished slice.
   *
   * @param elapsedNanos Wall time the slice took
   */
  record Done(long elapsedNanos) implements ClockMessage {
  }

  /** A registration a worker asks the master to deliver to another clock. */
  record Forward(Schedulable item, int target) implements ClockMessage {
  }

  /** A fault raised while a worker handled a command. */
  record Error(Throwable fault) implements ClockMessage {
  }

  /** Ends the worker loop and closes its channels. */
  record Stop() implements ClockMessage {
  }

  /** A generic answer. */
  record Response(Object value) implements ClockMessage {
  }
}
