package io.github.panghy.flowsim;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockConfig;
import io.github.panghy.flowsim.clock.ClockState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowSimTest {

  @AfterEach
  void tearDown() {
    FlowSim.reset();
  }

  @Test
  void testClockRequiresInit() {
    assertFalse(FlowSim.isInitialized());
    assertThrows(IllegalStateException.class, FlowSim::clock);
  }

  @Test
  void testInitCreatesIdleClock() {
    Clock clock = FlowSim.init();
    assertTrue(FlowSim.isInitialized());
    assertSame(clock, FlowSim.clock());
    assertEquals(ClockState.IDLE, clock.getState());

    Clock replaced = FlowSim.init(ClockConfig.builder().t0(5).build());
    assertNotSame(clock, replaced);
    assertEquals(5.0, FlowSim.now());
  }

  @Test
  void testStaticShortcuts() {
    FlowSim.init();
    List<String> log = new ArrayList<>();
    FlowSim.at(() -> log.add("at@" + FlowSim.now()), 2);
    FlowSim.after(() -> log.add("after@" + FlowSim.now()), 1);
    FlowSim.every(() -> log.add("every@" + FlowSim.now()), 3);
    FlowSim.process("p", c -> {
      c.delay(2.5);
      log.add("process@" + c.getTime());
    });

    FlowSim.run(4);

    assertEquals(List.of("every@0.0", "after@1.0", "at@2.0", "process@2.5", "every@3.0"), log);
    assertEquals(4.0, FlowSim.now());
  }
}
