package io.github.panghy.flowsim.clock;

import java.time.temporal.ChronoUnit;

/**
 * Converts dimensioned times into the magnitude a clock works with.
 */
@FunctionalInterface
public interface TimeUnitAdapter {

  /**
   * @param value  The dimensioned time
   * @param target The clock's unit
   * @return The magnitude of {@code value} expressed in {@code target}
   */
  double convert(TimeValue value, ChronoUnit target);
}
