package io.github.panghy.flowsim.process;

import io.github.panghy.flowsim.clock.ClockCommand;

/**
 * Thrown inside a suspended process at its suspension point when it is interrupted.
 * A {@link ClockCommand.Kind#STOP} signal ends the process normally; any other signal
 * fails the process unless its body catches the interrupt.
 */
public class ProcessInterrupt extends RuntimeException {

  private final ClockCommand.Kind signal;
  private final transient Object value;

  public ProcessInterrupt(ClockCommand.Kind signal, Object value) {
    super("Process interrupted with " + signal + (value == null ? "" : ": " + value));
    this.signal = signal;
    this.value = value;
  }

  public ClockCommand.Kind getSignal() {
    return signal;
  }

  public Object getValue() {
    return value;
  }

  public boolean isStop() {
    return signal == ClockCommand.Kind.STOP;
  }
}
