package io.github.panghy.flowsim.clock;

/**
 * States of a {@link Clock}.
 */
public enum ClockState {
  /** Created but never initialized. */
  UNDEFINED,
  /** Ready to step or run. */
  IDLE,
  /** Inside a step or run. */
  BUSY,
  /** Stopped in the middle of a run, may be resumed. */
  HALTED
}
