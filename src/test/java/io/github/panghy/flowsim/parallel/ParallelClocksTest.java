package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockConfig;
import io.github.panghy.flowsim.clock.ClockSnapshot;
import io.github.panghy.flowsim.clock.EventOptions;
import io.github.panghy.flowsim.clock.RunSummary;
import io.github.panghy.flowsim.core.PromiseStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for forking a clock onto worker threads and running the group in lockstep.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class ParallelClocksTest {

  private Clock master;

  @BeforeEach
  void setUp() {
    master = new Clock(ClockConfig.builder().dt(0.05).build());
  }

  @AfterEach
  void tearDown() {
    ParallelClocks.collapse(master);
  }

  @Test
  void testLockstepRun() {
    assertEquals(2, ParallelClocks.fork(master, 2));
    AtomicInteger hits = new AtomicInteger();
    AtomicInteger samples = new AtomicInteger();
    ClockHandle worker = ParallelClocks.workerClock(master, 2);
    worker.at(hits::incrementAndGet, 1);
    worker.periodic(samples::incrementAndGet);

    RunSummary summary = master.run(10);

    assertEquals(10.0, master.getTime(), 1e-9);
    assertEquals(200, summary.tickCount());
    assertEquals(1, hits.get());
    assertEquals(200, samples.get());
    ClockSnapshot snapshot = worker.query();
    assertEquals(10.0, snapshot.time(), 1e-9);
    assertEquals(200, snapshot.tickCount());
    assertEquals(1, snapshot.eventCount());
  }

  @Test
  void testWorkersStartAtMasterTime() {
    master.run(2);
    ParallelClocks.fork(master, 2);
    for (RemoteClockHandle worker : ParallelClocks.workers(master)) {
      ClockSnapshot snapshot = worker.query();
      assertEquals(2.0, snapshot.time());
      assertEquals(0.05, snapshot.dt());
    }
  }

  @Test
  void testWorkerIds() {
    ParallelClocks.fork(master, 3);
    List<Integer> ids = new ArrayList<>();
    for (RemoteClockHandle worker : ParallelClocks.workers(master)) {
      ids.add(worker.getId());
      assertTrue(worker.isAlive());
    }
    assertEquals(List.of(2, 3, 4), ids);
  }

  @Test
  void testWorkerForwardsToMaster() {
    ParallelClocks.fork(master, 2);
    List<String> log = new CopyOnWriteArrayList<>();
    ParallelClocks.workerClock(master, 2).at(() -> {
      Clock self = ActiveClock.current();
      log.add("worker " + self.getId() + "@" + self.getTime());
      self.at(() -> log.add("master on " + Thread.currentThread().getName()), self.getTime(),
          EventOptions.onClock(Clock.MASTER_ID));
    }, 1);

    master.run(2);

    assertEquals(2, log.size());
    assertThat(log.get(0)).startsWith("worker 2@");
    assertEquals("master on " + Thread.currentThread().getName(), log.get(1));
  }

  @Test
  void testMasterRoutesToWorker() {
    ParallelClocks.fork(master, 2);
    List<String> threads = new CopyOnWriteArrayList<>();
    master.at(() -> threads.add(Thread.currentThread().getName()), 0.5, EventOptions.onClock(3));
    assertTrue(master.getSchedule().getEvents().isEmpty());

    master.run(1);

    assertEquals(List.of("flowsim-worker-3"), threads);
  }

  @Test
  void testUnknownTargetRegistersOnMaster() {
    ParallelClocks.fork(master, 1);
    master.at(() -> { }, 0.5, EventOptions.onClock(42));
    assertEquals(1, master.getSchedule().getEvents().size());
  }

  @Test
  void testSpawnPlacementIsDeterministic() {
    ParallelClocks.fork(master, 3);
    Clock other = new Clock(master.getConfig());
    ParallelClocks.fork(other, 3);
    try {
      WorkerGroup first = (WorkerGroup) master.getRouter();
      WorkerGroup second = (WorkerGroup) other.getRouter();
      List<Integer> a = new ArrayList<>();
      List<Integer> b = new ArrayList<>();
      for (int i = 0; i < 50; i++) {
        a.add(first.spawnTarget());
        b.add(second.spawnTarget());
      }
      assertEquals(a, b);
      assertThat(a).allMatch(id -> id >= 1 && id <= 4);
      assertThat(a).contains(1, 2, 3, 4);
    } finally {
      ParallelClocks.collapse(other);
    }
  }

  @Test
  void testSpawnedActionsRunSomewhere() {
    ParallelClocks.fork(master, 2);
    AtomicInteger fired = new AtomicInteger();
    for (int i = 0; i < 20; i++) {
      master.at(fired::incrementAndGet, 0.5, EventOptions.builder().spawn(true).build());
    }
    master.run(1);
    assertEquals(20, fired.get());
  }

  @Test
  void testDiagnosisAfterFault() {
    ParallelClocks.fork(master, 1);
    RemoteClockHandle worker = ParallelClocks.workers(master).get(0);
    assertFalse(worker.diagnose().hasFault());

    ClockMessage reply = worker.talk(new ClockMessage.Done(0));

    assertInstanceOf(ClockMessage.Error.class, reply);
    Diagnosis diagnosis = worker.diagnose();
    assertTrue(diagnosis.hasFault());
    assertEquals(2, diagnosis.clockId());
    assertInstanceOf(IllegalStateException.class, diagnosis.fault());
    assertFalse(diagnosis.trace().isEmpty());
    assertTrue(worker.isAlive());
    assertEquals(master.getTime(), worker.query().time());
  }

  @Test
  void testWorkerTerminatesWithoutFaultHandling() throws InterruptedException {
    master = new Clock(ClockConfig.builder().dt(0.05).handleWorkerFaults(false).build());
    ParallelClocks.fork(master, 1);
    RemoteClockHandle worker = ParallelClocks.workers(master).get(0);

    ClockMessage reply = worker.talk(new ClockMessage.Done(0));

    assertInstanceOf(ClockMessage.Error.class, reply);
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (worker.isAlive() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertFalse(worker.isAlive());
    // the master keeps running alone
    master.run(1);
    assertEquals(1.0, master.getTime(), 1e-9);
  }

  @Test
  void testWorkerActionFaultIsReported() {
    ParallelClocks.fork(master, 1);
    RemoteClockHandle worker = ParallelClocks.workers(master).get(0);
    worker.at(() -> {
      throw new IllegalStateException("worker boom");
    }, 0.5);

    master.run(1);

    assertEquals(1.0, master.getTime(), 1e-9);
    assertEquals("worker boom", worker.getLastError().getMessage());
    assertTrue(worker.isAlive());
    assertEquals("worker boom", worker.diagnose().fault().getMessage());
  }

  @Test
  void testResetPropagatesToWorkers() {
    ParallelClocks.fork(master, 2);
    ParallelClocks.workerClock(master, 2).at(() -> { }, 5);
    master.run(1);

    master.reset(true);

    assertEquals(0.0, master.getTime());
    for (RemoteClockHandle worker : ParallelClocks.workers(master)) {
      ClockSnapshot snapshot = worker.query();
      assertEquals(0.0, snapshot.time());
      assertTrue(snapshot.events().isEmpty());
    }
  }

  @Test
  void testCollapseMovesActionsToMaster() {
    ParallelClocks.fork(master, 2);
    List<String> threads = new CopyOnWriteArrayList<>();
    ParallelClocks.workerClock(master, 3).at(() -> threads.add(Thread.currentThread().getName()), 5);
    master.run(1);

    ParallelClocks.collapse(master);

    assertNull(master.getRouter());
    assertTrue(ParallelClocks.workers(master).isEmpty());
    assertEquals(1, master.getSchedule().getEvents().size());
    master.run(5);
    assertEquals(List.of(Thread.currentThread().getName()), threads);
  }

  @Test
  void testWorkerClockLookup() {
    ParallelClocks.fork(master, 1);
    ClockHandle local = ParallelClocks.workerClock(master, Clock.MASTER_ID);
    assertInstanceOf(LocalClock.class, local);
    assertSame(master, ((LocalClock) local).getClock());
    assertInstanceOf(RemoteClockHandle.class, ParallelClocks.workerClock(master, 2));
    assertThrows(IllegalArgumentException.class, () -> ParallelClocks.workerClock(master, 99));
  }

  @Test
  void testOnlyMasterCanFork() {
    Clock worker = new Clock(2, ClockConfig.DEFAULT);
    new ActiveClock(worker, Clock.MASTER_ID, new PromiseStream<>(), new PromiseStream<>(), true, 0);
    assertThrows(IllegalStateException.class, () -> ParallelClocks.fork(worker, 1));
  }

  @Test
  void testForkWithoutWorkers() {
    assertEquals(0, ParallelClocks.fork(master, 0));
    assertNull(master.getRouter());
  }

  @Test
  void testForkTwice() {
    assertEquals(1, ParallelClocks.fork(master, 1));
    assertEquals(0, ParallelClocks.fork(master, 1));
    assertEquals(1, ParallelClocks.workers(master).size());
  }

  @Test
  void testForkDefaultsSyncInterval() {
    master = new Clock();
    ParallelClocks.fork(master, 1);
    assertEquals(ParallelClocks.DEFAULT_SYNC_INTERVAL, master.getRouter().syncInterval());
  }

  @Test
  void testSyncOptionAlignsToBoundary() {
    master = new Clock(ClockConfig.builder().dt(0.1).build());
    ParallelClocks.fork(master, 1);
    double assigned = master.at(() -> { }, 0.25, EventOptions.builder().sync(true).build());
    assertEquals(0.3, assigned, 1e-9);
    assertThat(assigned).isGreaterThan(0.1 * 3);
  }

  @Test
  void testStopAndResumeForkedMaster() {
    ParallelClocks.fork(master, 1);
    AtomicInteger samples = new AtomicInteger();
    ParallelClocks.workerClock(master, 2).periodic(samples::incrementAndGet);
    master.at(master::stop, 2.5);

    RunSummary halted = master.run(5);
    assertTrue(halted.isHalted());

    master.resume();
    assertEquals(5.0, master.getTime(), 1e-9);
    assertEquals(100, samples.get());
  }
}
