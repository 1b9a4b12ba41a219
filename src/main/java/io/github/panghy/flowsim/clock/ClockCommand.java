package io.github.panghy.flowsim.clock;

/**
 * A command driving the {@link Clock} state machine.
 *
 * @param kind     What to do
 * @param duration The run duration, only meaningful for {@link Kind#RUN}
 * @param hard     Whether a {@link Kind#RESET} clears the registry
 */
public record ClockCommand(Kind kind, double duration, boolean hard) {

  /**
   * Command kinds. {@code STOP} doubles as the signal that ends a process.
   */
  public enum Kind {
    INIT,
    STEP,
    RUN,
    STOP,
    RESUME,
    RESET
  }

  public static ClockCommand init() {
    return new ClockCommand(Kind.INIT, 0, false);
  }

  public static ClockCommand step() {
    return new ClockCommand(Kind.STEP, 0, false);
  }

  /**
   * @param duration Virtual time to advance, must not be negative
   * @return A run command
   */
  public static ClockCommand run(double duration) {
    if (duration < 0) {
      throw new IllegalArgumentException("Run duration cannot be negative: " + duration);
    }
    return new ClockCommand(Kind.RUN, duration, false);
  }

  public static ClockCommand stop() {
    return new ClockCommand(Kind.STOP, 0, false);
  }

  public static ClockCommand resume() {
    return new ClockCommand(Kind.RESUME, 0, false);
  }

  public static ClockCommand reset(boolean hard) {
    return new ClockCommand(Kind.RESET, 0, hard);
  }
}
