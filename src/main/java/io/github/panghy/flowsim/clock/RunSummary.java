package io.github.panghy.flowsim.clock;

/**
 * The result of handing a {@link ClockCommand} to a clock.
 *
 * @param handled    false if the command was not valid in the clock's state
 * @param state      The clock state after the command
 * @param time       The clock time after the command
 * @param eventCount Timed actions fired since the run started
 * @param tickCount  Sampling ticks taken since the run started
 * @param message    A human readable report
 */
public record RunSummary(boolean handled, ClockState state, double time, long eventCount,
                         long tickCount, String message) {

  public boolean isHalted() {
    return state == ClockState.HALTED;
  }

  @Override
  public String toString() {
    return message;
  }
}
