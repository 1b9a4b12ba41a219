package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockSnapshot;
import io.github.panghy.flowsim.clock.ClockState;
import io.github.panghy.flowsim.clock.ConditionalAction;
import io.github.panghy.flowsim.clock.PeriodicAction;
import io.github.panghy.flowsim.clock.TimedAction;
import io.github.panghy.flowsim.core.PromiseStream;
import io.github.panghy.flowsim.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Forks a clock onto worker threads and collapses it back.
 *
 * <p>After {@link #fork(Clock, int)}, running the master runs the whole group in lockstep,
 * and registrations carrying a clock id or the spawn option are routed to the workers.</p>
 */
public final class ParallelClocks {

  private static final Logger LOGGER = Logger.getLogger(ParallelClocks.class.getName());

  /** Synchronization interval used when the master has no sampling interval. */
  static final double DEFAULT_SYNC_INTERVAL = 0.01;

  private ParallelClocks() {
  }

  /**
   * Forks {@code master} onto the configured number of workers.
   *
   * @param master The master clock
   * @return The number of workers started
   */
  public static int fork(Clock master) {
    return fork(master, master.getConfig().getWorkerCount());
  }

  /**
   * Forks {@code master} onto {@code workerCount} workers, numbered after the master's id.
   * Each worker gets a fresh clock synchronized to the master's time, unit and interval.
   *
   * @param master      The master clock, idle or not yet initialized
   * @param workerCount The number of workers
   * @return The number of workers started, 0 if none could be
   * @throws IllegalStateException if {@code master} is itself a worker or is not idle
   */
  public static int fork(Clock master, int workerCount) {
    if (master.getRouter() instanceof ActiveClock) {
      throw new IllegalStateException("only a master clock can fork, clock " + master.getId()
          + " is a worker");
    }
    if (master.getRouter() instanceof WorkerGroup) {
      LoggingUtil.warn(LOGGER, "clock " + master.getId() + " is already forked");
      return 0;
    }
    if (workerCount < 1) {
      LoggingUtil.warn(LOGGER, "no parallel threads available");
      return 0;
    }
    if (master.getState() == ClockState.UNDEFINED) {
      master.init();
    }
    if (master.getState() != ClockState.IDLE) {
      throw new IllegalStateException("clock " + master.getId() + " must be idle to fork, it is "
          + master.getState());
    }
    double interval = master.getDt() > 0 ? master.getDt() : DEFAULT_SYNC_INTERVAL;
    WorkerGroup group = new WorkerGroup(master, interval,
        new Random(master.getConfig().getSpawnSeed()));
    for (int i = 1; i <= workerCount; i++) {
      int id = master.getId() + i;
      Clock clock = new Clock(id, master.getConfig());
      clock.setUnit(master.getUnit());
      PromiseStream<ClockMessage> forth = new PromiseStream<>();
      PromiseStream<ClockMessage> back = new PromiseStream<>();
      ActiveClock worker = new ActiveClock(clock, master.getId(), forth, back,
          master.getConfig().isHandleWorkerFaults(), master.getTime());
      Thread thread = new Thread(worker, "flowsim-worker-" + id);
      thread.setDaemon(true);
      thread.start();
      RemoteClockHandle handle = new RemoteClockHandle(id, group, forth, back.getFutureStream(),
          thread);
      group.add(handle);
      handle.talk(new ClockMessage.Sync(master.getTime(), master.getDt()));
    }
    master.setRouter(group);
    LoggingUtil.info(LOGGER, "forked clock " + master.getId() + " onto " + workerCount
        + " worker clocks");
    return workerCount;
  }

  /**
   * Moves every pending action of the workers to the master, stops the workers and
   * detaches them. Processes running on workers are stopped, not moved.
   *
   * @param master The forked master clock
   */
  public static void collapse(Clock master) {
    if (!(master.getRouter() instanceof WorkerGroup group)) {
      LoggingUtil.warn(LOGGER, "clock " + master.getId() + " has no workers to collapse");
      return;
    }
    List<ClockSnapshot> collected = new ArrayList<>();
    for (RemoteClockHandle worker : group.workers()) {
      if (!worker.isAlive()) {
        continue;
      }
      try {
        collected.add(worker.query());
      } catch (IllegalStateException e) {
        LoggingUtil.warn(LOGGER, "could not collect worker clock " + worker.getId(), e);
      }
    }
    group.deliverForwards();
    for (RemoteClockHandle worker : group.workers()) {
      worker.stop();
    }
    master.setRouter(null);
    for (ClockSnapshot snapshot : collected) {
      for (TimedAction event : snapshot.events()) {
        master.register(event);
      }
      for (ConditionalAction condition : snapshot.conditions()) {
        master.register(condition);
      }
      for (PeriodicAction sample : snapshot.samples()) {
        master.register(sample);
      }
      if (snapshot.processCount() > 0) {
        LoggingUtil.warn(LOGGER, snapshot.processCount() + " processes of worker clock "
            + snapshot.id() + " were stopped");
      }
    }
    LoggingUtil.info(LOGGER, "collapsed " + group.workers().size() + " worker clocks into clock "
        + master.getId());
  }

  /**
   * Gets a handle on one clock of the group.
   *
   * @param master The master clock
   * @param id     The master's id or a worker id
   * @return A {@link LocalClock} for the master, a {@link RemoteClockHandle} for a worker
   * @throws IllegalArgumentException if there is no clock with that id
   */
  public static ClockHandle workerClock(Clock master, int id) {
    if (id == master.getId()) {
      return new LocalClock(master);
    }
    if (master.getRouter() instanceof WorkerGroup group) {
      RemoteClockHandle worker = group.worker(id);
      if (worker != null) {
        return worker;
      }
    }
    throw new IllegalArgumentException("clock " + master.getId() + " has no clock with id " + id);
  }

  /**
   * @param master The master clock
   * @return The handles of its workers, empty if it is not forked
   */
  public static List<RemoteClockHandle> workers(Clock master) {
    if (master.getRouter() instanceof WorkerGroup group) {
      return List.copyOf(group.workers());
    }
    return List.of();
  }
}
