package io.github.panghy.flowsim.clock;

import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A dimensioned time, converted to a clock's unit through its {@link TimeUnitAdapter}.
 *
 * @param amount The magnitude
 * @param unit   The unit of the magnitude
 */
public record TimeValue(double amount, ChronoUnit unit) {

  public TimeValue {
    Objects.requireNonNull(unit, "Unit cannot be null");
  }

  public static TimeValue of(double amount, ChronoUnit unit) {
    return new TimeValue(amount, unit);
  }
}
