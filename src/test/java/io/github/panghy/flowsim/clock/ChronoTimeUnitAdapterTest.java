package io.github.panghy.flowsim.clock;

import org.junit.jupiter.api.Test;

import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChronoTimeUnitAdapterTest {

  private final ChronoTimeUnitAdapter adapter = ChronoTimeUnitAdapter.INSTANCE;

  @Test
  void testSameUnitIsIdentity() {
    assertEquals(1.5, adapter.convert(TimeValue.of(1.5, ChronoUnit.HOURS), ChronoUnit.HOURS));
  }

  @Test
  void testConversions() {
    assertEquals(90.0, adapter.convert(TimeValue.of(1.5, ChronoUnit.MINUTES), ChronoUnit.SECONDS),
        1e-9);
    assertEquals(0.25, adapter.convert(TimeValue.of(250, ChronoUnit.MILLIS), ChronoUnit.SECONDS),
        1e-12);
    assertEquals(48.0, adapter.convert(TimeValue.of(2, ChronoUnit.DAYS), ChronoUnit.HOURS), 1e-9);
    assertEquals(2.5e-6, adapter.convert(TimeValue.of(2.5, ChronoUnit.NANOS), ChronoUnit.MILLIS),
        1e-18);
  }

  @Test
  void testLongUnitsDoNotOverflow() {
    double nanos = adapter.convert(TimeValue.of(1, ChronoUnit.CENTURIES), ChronoUnit.NANOS);
    assertEquals(3.15569520e18, nanos, 1e9);
  }

  @Test
  void testTimeValueNeedsUnit() {
    assertThrows(NullPointerException.class, () -> TimeValue.of(1, null));
  }
}
