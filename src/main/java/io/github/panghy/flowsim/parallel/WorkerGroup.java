package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockRouter;
import io.github.panghy.flowsim.clock.RunSummary;
import io.github.panghy.flowsim.clock.Schedulable;
import io.github.panghy.flowsim.util.LoggingUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

/**
 * The master side of a parallel group: routes registrations to workers and runs the
 * group in lockstep.
 *
 * <p>A synchronized run proceeds in rounds of one synchronization interval. Each round
 * sends {@link ClockMessage.Run} to every worker, waits for all of them to answer, delivers
 * the registrations they forwarded, and only then runs the master's own slice. Ordering
 * across clocks is therefore only defined at round boundaries.</p>
 */
final class WorkerGroup implements ClockRouter {

  private static final Logger LOGGER = Logger.getLogger(WorkerGroup.class.getName());

  private final Clock master;
  private final double interval;
  private final Random random;
  private final Map<Integer, RemoteClockHandle> workers = new LinkedHashMap<>();
  private final Deque<ClockMessage.Forward> pending = new ArrayDeque<>();
  private double origin;
  // time every worker has reached
  private double boundary;
  private boolean delivering;

  WorkerGroup(Clock master, double interval, Random random) {
    this.master = master;
    this.interval = interval;
    this.random = random;
    this.origin = master.getTime();
    this.boundary = master.getTime();
  }

  void add(RemoteClockHandle worker) {
    workers.put(worker.getId(), worker);
  }

  RemoteClockHandle worker(int id) {
    return workers.get(id);
  }

  Collection<RemoteClockHandle> workers() {
    return Collections.unmodifiableCollection(workers.values());
  }

  double masterTime() {
    return master.getTime();
  }

  double masterDt() {
    return master.getDt();
  }

  void defer(ClockMessage.Forward forward) {
    pending.add(forward);
  }

  /**
   * Delivers the registrations workers forwarded. Reentrant calls return immediately,
   * the outer call drains whatever they add.
   */
  void deliverForwards() {
    if (delivering) {
      return;
    }
    delivering = true;
    try {
      ClockMessage.Forward forward;
      while ((forward = pending.poll()) != null) {
        route(forward.item(), forward.target());
      }
    } finally {
      delivering = false;
    }
  }

  @Override
  public double route(Schedulable item, int target) {
    int id = target == ANY ? spawnTarget() : target;
    if (id == master.getId()) {
      return master.register(item);
    }
    RemoteClockHandle worker = workers.get(id);
    if (worker == null) {
      LoggingUtil.warn(LOGGER, "no clock with id " + id + ", registering on clock " + master.getId());
      return master.register(item);
    }
    return worker.register(item);
  }

  @Override
  public int spawnTarget() {
    List<Integer> ids = new ArrayList<>(workers.size() + 1);
    ids.add(master.getId());
    ids.addAll(workers.keySet());
    return ids.get(random.nextInt(ids.size()));
  }

  @Override
  public double syncOrigin() {
    return origin;
  }

  @Override
  public double syncInterval() {
    return interval;
  }

  @Override
  public RunSummary runSynchronized(Clock clock, double duration, boolean resetCounters) {
    double end = clock.getTime() + duration;
    boolean first = resetCounters;
    if (clock.getTime() < boundary) {
      // a stopped run left the master behind its workers
      RunSummary rest = clock.runLocal(Math.min(boundary, end) - clock.getTime(), first);
      first = false;
      if (rest.isHalted()) {
        return rest;
      }
    }
    long rounds = (long) Math.floor((end - clock.getTime()) / interval + 1e-9);
    for (long i = 0; i < rounds; i++) {
      RunSummary slice = round(clock, interval, first);
      first = false;
      if (slice.isHalted()) {
        return slice;
      }
    }
    double rest = end - clock.getTime();
    if (rest > interval * 1e-6) {
      RunSummary slice = round(clock, rest, first);
      if (slice.isHalted()) {
        return slice;
      }
    }
    // pin every clock to the horizon
    clock.sync(end, clock.getDt());
    for (RemoteClockHandle worker : workers.values()) {
      if (worker.isAlive()) {
        worker.talk(new ClockMessage.Sync(end, clock.getDt()));
      }
    }
    boundary = end;
    String message = "synchronized run finished with " + clock.getEventCount() + " clock events, "
        + clock.getTickCount() + " sample steps on " + (workers.size() + 1)
        + " clocks, simulation time: " + clock.getTime();
    LoggingUtil.debug(LOGGER, message);
    return new RunSummary(true, clock.getState(), clock.getTime(), clock.getEventCount(),
        clock.getTickCount(), message);
  }

  private RunSummary round(Clock clock, double slice, boolean first) {
    List<RemoteClockHandle> running = new ArrayList<>();
    for (RemoteClockHandle worker : workers.values()) {
      if (worker.isAlive() && worker.send(new ClockMessage.Run(slice, !first))) {
        running.add(worker);
      }
    }
    for (RemoteClockHandle worker : running) {
      // faults are logged and kept by the handle, the round goes on
      worker.awaitReply();
    }
    deliverForwards();
    boundary = clock.getTime() + slice;
    return clock.runLocal(slice, first);
  }

  @Override
  public void afterReset(Clock clock, boolean hard) {
    for (RemoteClockHandle worker : workers.values()) {
      if (worker.isAlive()) {
        worker.reset(hard);
      }
    }
    origin = clock.getTime();
    boundary = clock.getTime();
  }
}
