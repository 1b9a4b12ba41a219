package io.github.panghy.flowsim.clock;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Converts between {@link ChronoUnit}s using their estimated durations.
 */
public class ChronoTimeUnitAdapter implements TimeUnitAdapter {

  public static final ChronoTimeUnitAdapter INSTANCE = new ChronoTimeUnitAdapter();

  @Override
  public double convert(TimeValue value, ChronoUnit target) {
    if (value.unit() == target) {
      return value.amount();
    }
    return value.amount() * seconds(value.unit().getDuration()) / seconds(target.getDuration());
  }

  // doubles, the nanosecond count of the long units overflows a long
  private static double seconds(Duration duration) {
    return duration.getSeconds() + duration.getNano() * 1e-9;
  }
}
