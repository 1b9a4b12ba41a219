package io.github.panghy.flowsim.process;

import io.github.panghy.flowsim.clock.Clock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessTableTest {

  private static final ProcessBody IDLE = c -> c.delay(1000);

  @Test
  void testStringIdsGetCounterSuffix() {
    Clock clock = new Clock();
    assertEquals("A", clock.process("A", IDLE).getId());
    assertEquals("A#1", clock.process("A", IDLE).getId());
    assertEquals("A#2", clock.process("A", IDLE).getId());
    assertEquals(3, clock.getProcesses().size());
  }

  @Test
  void testNumericIdsCountUp() {
    Clock clock = new Clock();
    assertEquals(7, clock.process(7, IDLE).getId());
    assertEquals(8, clock.process(7, IDLE).getId());
    assertEquals(1.5, clock.process(1.5, IDLE).getId());
    assertEquals(Math.nextUp(1.5), clock.process(1.5, IDLE).getId());
    assertEquals(2L, clock.process(2L, IDLE).getId());
    assertEquals(3L, clock.process(2L, IDLE).getId());
  }

  @Test
  void testSuffixOnlyCountsNumbers() {
    ProcessTable table = new ProcessTable();
    assertEquals("x#", table.uniqueId("x#"));
  }

  @Test
  void testRejectsUnsupportedIds() {
    Clock clock = new Clock();
    assertThrows(IllegalArgumentException.class, () -> clock.process(true, IDLE));
    assertTrue(clock.getProcesses().isEmpty());
  }

  @Test
  void testRegistrationValidation() {
    assertThrows(IllegalArgumentException.class, () -> new ProcessRegistration("p", IDLE, 0));
    assertThrows(NullPointerException.class, () -> new ProcessRegistration(null, IDLE));
    assertEquals(ProcessRegistration.FOREVER, new ProcessRegistration("p", IDLE).cycles());
  }
}
