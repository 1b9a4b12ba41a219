package io.github.panghy.flowsim.parallel;

import java.util.List;

/**
 * The last fault a worker caught, as answered to {@link ClockMessage.Diag}.
 *
 * @param clockId The worker id
 * @param fault   The fault, or null if the worker never failed
 * @param trace   The fault's stack trace, empty without a fault
 */
public record Diagnosis(int clockId, Throwable fault, List<StackTraceElement> trace) {

  public boolean hasFault() {
    return fault != null;
  }
}
