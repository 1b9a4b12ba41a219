package io.github.panghy.flowsim.clock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventOptionsTest {

  @Test
  void testNone() {
    assertEquals(0.0, EventOptions.NONE.getCycle());
    assertNull(EventOptions.NONE.getCid());
    assertFalse(EventOptions.NONE.isSpawn());
    assertFalse(EventOptions.NONE.isSync());
  }

  @Test
  void testOnClock() {
    EventOptions options = EventOptions.onClock(3);
    assertEquals(3, options.getCid());
    assertFalse(options.isSpawn());
  }

  @Test
  void testBuilder() {
    EventOptions options = EventOptions.builder().cycle(2).spawn(true).sync(true).build();
    assertEquals(2.0, options.getCycle());
    assertTrue(options.isSpawn());
    assertTrue(options.isSync());
  }

  @Test
  void testRejectsInvalidCombinations() {
    assertThrows(IllegalArgumentException.class, () -> EventOptions.builder().cycle(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> EventOptions.builder().cid(2).spawn(true).build());
  }

  @Test
  void testTargetIdWithoutParallelClocksRegistersLocally() {
    Clock clock = new Clock();
    assertEquals(4.0, clock.at(() -> { }, 4, EventOptions.onClock(5)));
    assertEquals(1, clock.getSchedule().getEvents().size());
  }

  @Test
  void testSyncWithoutParallelClocksKeepsTime() {
    Clock clock = new Clock();
    assertEquals(0.25, clock.at(() -> { }, 0.25, EventOptions.builder().sync(true).build()));
  }

  @Test
  void testCommandValidation() {
    assertThrows(IllegalArgumentException.class, () -> ClockCommand.run(-1));
    assertEquals(ClockCommand.Kind.RESET, ClockCommand.reset(false).kind());
    assertFalse(ClockCommand.reset(false).hard());
  }
}
