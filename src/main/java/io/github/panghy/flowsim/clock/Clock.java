package io.github.panghy.flowsim.clock;

import io.github.panghy.flowsim.core.FutureStream;
import io.github.panghy.flowsim.core.StreamClosedException;
import io.github.panghy.flowsim.process.ProcessBody;
import io.github.panghy.flowsim.process.ProcessInterrupt;
import io.github.panghy.flowsim.process.ProcessRegistration;
import io.github.panghy.flowsim.process.ProcessTable;
import io.github.panghy.flowsim.process.SimProcess;
import io.github.panghy.flowsim.util.LoggingUtil;

import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * A discrete-event simulation clock.
 *
 * <p>A clock owns virtual time and a {@link Schedule} of timed, conditional and periodic
 * actions. Running the clock fires timed actions in time order and, when a sampling
 * interval {@code dt} is set, takes sampling ticks that run the periodic actions and then
 * every conditional action whose checks hold.</p>
 *
 * <p>State changes go through {@link #handle(ClockCommand)}:</p>
 * <pre>
 *   UNDEFINED --INIT--> IDLE --RUN/STEP--> BUSY --STOP--> HALTED --RESUME--> BUSY
 * </pre>
 * Any other combination is reported and leaves the state unchanged.
 *
 * <p>A clock is confined to one thread. Processes registered with it run on their own
 * threads but only while the clock has handed control to them. In a parallel group, the
 * registries of other clocks are reached only through their channels.</p>
 */
public class Clock implements AutoCloseable {

  private static final Logger LOGGER = Logger.getLogger(Clock.class.getName());

  /** Id of a clock that is not a worker. */
  public static final int MASTER_ID = 1;

  private final int id;
  private final ClockConfig config;
  private final Schedule schedule = new Schedule();
  private final ProcessTable processes = new ProcessTable();
  private ClockState state = ClockState.UNDEFINED;
  private ChronoUnit unit;
  private double time;
  private double dt;
  // true while dt was derived for pending conditions rather than requested
  private boolean derivedDt;
  private double endTime;
  // end of the whole run, beyond endTime while a forked clock runs slice by slice
  private double horizon;
  private double tev;
  private double tn;
  private long evcount;
  private long scount;
  private ClockRouter router;

  /**
   * Creates an unitless, event driven clock starting at 0.
   */
  public Clock() {
    this(ClockConfig.DEFAULT);
  }

  public Clock(ClockConfig config) {
    this(MASTER_ID, config);
  }

  /**
   * Creates a clock.
   *
   * @param id     The clock id, workers are numbered after their master
   * @param config The configuration
   */
  public Clock(int id, ClockConfig config) {
    this.id = id;
    this.config = Objects.requireNonNull(config, "Config cannot be null");
    this.unit = config.getUnit();
    this.time = config.getT0();
    this.dt = config.getDt();
    this.endTime = time;
    this.horizon = time;
    this.tev = time;
    this.tn = time;
  }

  // ---------------------------------------------------------------------------------------
  // State machine
  // ---------------------------------------------------------------------------------------

  /**
   * Applies a command to the clock.
   *
   * @param command The command
   * @return The summary; {@link RunSummary#handled()} is false for an undefined transition
   */
  public RunSummary handle(ClockCommand command) {
    Objects.requireNonNull(command, "Command cannot be null");
    return switch (state) {
      case UNDEFINED -> onUndefined(command);
      case IDLE -> onIdle(command);
      case BUSY -> onBusy(command);
      case HALTED -> onHalted(command);
    };
  }

  private RunSummary onUndefined(ClockCommand command) {
    switch (command.kind()) {
      case INIT:
        state = ClockState.IDLE;
        return summary(true, "clock " + id + " initialized");
      case STEP:
      case RUN:
        state = ClockState.IDLE;
        return onIdle(command);
      case RESET:
        return doReset(command.hard());
      default:
        return unhandled(command);
    }
  }

  private RunSummary onIdle(ClockCommand command) {
    switch (command.kind()) {
      case STEP:
        state = ClockState.BUSY;
        refreshTimes();
        String message = doStep();
        if (state == ClockState.BUSY) {
          state = ClockState.IDLE;
        }
        return summary(true, message);
      case RUN:
        return doRun(command.duration(), true);
      case RESET:
        return doReset(command.hard());
      default:
        return unhandled(command);
    }
  }

  private RunSummary onBusy(ClockCommand command) {
    switch (command.kind()) {
      case STEP:
        return summary(true, doStep());
      case STOP:
        state = ClockState.HALTED;
        return summary(true, "Halted after " + evcount + " events");
      default:
        return unhandled(command);
    }
  }

  private RunSummary onHalted(ClockCommand command) {
    switch (command.kind()) {
      case STEP:
        return summary(true, doStep());
      case RESUME:
        state = ClockState.IDLE;
        return doRun(horizon - time, false);
      case RESET:
        return doReset(command.hard());
      default:
        return unhandled(command);
    }
  }

  private RunSummary unhandled(ClockCommand command) {
    String message = "undefined transition: " + state + " -> " + command.kind()
        + ", maybe you should reset the clock";
    LoggingUtil.warn(LOGGER, "clock " + id + ": " + message);
    return summary(false, message);
  }

  private RunSummary summary(boolean handled, String message) {
    return new RunSummary(handled, state, time, evcount, scount, message);
  }

  public RunSummary init() {
    return handle(ClockCommand.init());
  }

  /**
   * Takes a single step: fires the next timed action or takes the next tick.
   *
   * @return The summary
   */
  public RunSummary step() {
    return handle(ClockCommand.step());
  }

  /**
   * Runs the clock for {@code duration}, or the whole parallel group when the clock was
   * forked. Always returns a summary, also when the run was stopped.
   *
   * @param duration Virtual time to advance
   * @return The summary
   */
  public RunSummary run(double duration) {
    return handle(ClockCommand.run(duration));
  }

  public RunSummary run(TimeValue duration) {
    return run(toClockTime(duration));
  }

  /**
   * Halts a running clock. Typically called from an action fired by the clock.
   *
   * @return The summary
   */
  public RunSummary stop() {
    return handle(ClockCommand.stop());
  }

  /**
   * Continues a halted run for the remainder of its original duration.
   *
   * @return The summary of the whole run
   */
  public RunSummary resume() {
    return handle(ClockCommand.resume());
  }

  /**
   * Hard reset: stops all processes, clears the registry and restores start time,
   * sampling interval and counters.
   *
   * @return The summary
   */
  public RunSummary reset() {
    return reset(true);
  }

  /**
   * Resets the clock. A soft reset keeps the registry and moves every scheduled time
   * along with the clock back to its start time.
   *
   * @param hard Whether to clear the registry
   * @return The summary
   */
  public RunSummary reset(boolean hard) {
    return handle(ClockCommand.reset(hard));
  }

  private RunSummary doReset(boolean hard) {
    if (hard) {
      stopProcesses();
      schedule.clear();
      processes.clear();
      time = config.getT0();
      dt = config.getDt();
      derivedDt = false;
      endTime = time;
      horizon = time;
      tev = time;
      tn = time;
      evcount = 0;
      scount = 0;
    } else {
      sync(config.getT0(), dt);
    }
    state = ClockState.IDLE;
    if (router != null) {
      router.afterReset(this, hard);
    }
    return summary(true, "clock " + id + (hard ? " reset" : " resynchronized") + " to " + time);
  }

  private void stopProcesses() {
    for (SimProcess process : processes.values()) {
      if (process.getState() == SimProcess.ProcessState.SUSPENDED) {
        process.interrupt(ClockCommand.Kind.STOP, null);
      }
      // a body that caught the stop signal and suspended again
      if (!process.isDone()) {
        process.terminate();
      }
    }
  }

  /**
   * Stops every process of this clock and ends their threads. The registry and time are
   * kept, the clock can go on running actions.
   */
  @Override
  public void close() {
    stopProcesses();
    processes.clear();
  }

  // ---------------------------------------------------------------------------------------
  // Stepping and running
  // ---------------------------------------------------------------------------------------

  private RunSummary doRun(double duration, boolean resetCounters) {
    horizon = time + duration;
    if (router != null) {
      RunSummary synced = router.runSynchronized(this, duration, resetCounters);
      if (synced != null) {
        return synced;
      }
    }
    return runLocal(duration, resetCounters);
  }

  /**
   * Runs only this clock for {@code duration}, ignoring the rest of its parallel group.
   * Used for the slices of a synchronized run.
   *
   * @param duration      Virtual time to advance
   * @param resetCounters Whether event and tick counters start from zero
   * @return The summary
   */
  public RunSummary runLocal(double duration, boolean resetCounters) {
    if (state == ClockState.UNDEFINED) {
      state = ClockState.IDLE;
    }
    if (state != ClockState.IDLE) {
      return unhandled(ClockCommand.run(Math.max(0, duration)));
    }
    endTime = time + duration;
    if (resetCounters) {
      evcount = 0;
      scount = 0;
    }
    state = ClockState.BUSY;
    setTimes();
    try {
      while ((time < tn && tn <= endTime) || (schedule.hasEvents() && tev <= endTime)) {
        doStep();
        if (state == ClockState.HALTED) {
          return summary(true, "Halted after " + evcount + " events");
        }
      }
      // events scheduled at the horizon itself, within rounding
      double limit = endTime + Math.ulp(endTime) * 10;
      while (schedule.hasEvents() && schedule.nextEventTime() <= limit) {
        tev = schedule.nextEventTime();
        doStep();
        if (state == ClockState.HALTED) {
          return summary(true, "Halted after " + evcount + " events");
        }
        limit = Math.nextUp(limit);
      }
      time = endTime;
      tn = Math.max(tn, time);
      tev = schedule.hasEvents() ? schedule.nextEventTime() : time;
      state = ClockState.IDLE;
    } finally {
      if (state == ClockState.BUSY) {
        // an action threw, the exception propagates to the caller
        state = ClockState.IDLE;
      }
    }
    String message = "run finished with " + evcount + " clock events, " + scount
        + " sample steps, simulation time: " + time;
    LoggingUtil.debug(LOGGER, "clock " + id + ": " + message);
    return summary(true, message);
  }

  /**
   * Advances to {@code target}, firing every tick and timed action due until then. This
   * is how a {@code RealTimeClock} paces the clock to wall time.
   *
   * @param target The time to reach
   */
  public void catchUp(double target) {
    if (state == ClockState.UNDEFINED) {
      state = ClockState.IDLE;
    }
    if (state != ClockState.IDLE || target < time) {
      return;
    }
    state = ClockState.BUSY;
    try {
      if (dt > 0 && tn <= time) {
        tn = time + dt;
      }
      while (true) {
        double nextEvent = schedule.hasEvents() ? schedule.nextEventTime() : Double.POSITIVE_INFINITY;
        double nextTick = dt > 0 ? tn : Double.POSITIVE_INFINITY;
        if (Math.min(nextEvent, nextTick) > target) {
          break;
        }
        if (nextTick <= nextEvent) {
          tick();
          tn += dt;
        } else {
          tev = nextEvent;
          fireNextEvent();
        }
      }
      time = target;
      tev = schedule.hasEvents() ? schedule.nextEventTime() : time;
    } finally {
      state = ClockState.IDLE;
    }
  }

  /**
   * Prepares a run. A tick still pending from a stopped or sliced run keeps its place on
   * the sampling grid.
   */
  private void setTimes() {
    if (dt == 0) {
      tn = time;
    } else if (tn <= time) {
      tn = time + dt;
    }
    tev = schedule.hasEvents() ? schedule.nextEventTime() : tn;
  }

  private void refreshTimes() {
    if (tn <= time) {
      tn = dt > 0 ? time + dt : time;
    }
    tev = schedule.hasEvents() ? schedule.nextEventTime() : time;
  }

  private String doStep() {
    if (tev <= time && schedule.hasEvents()) {
      tev = schedule.nextEventTime();
    }
    if (schedule.hasEvents()) {
      if (dt > 0) {
        if (tn <= tev) {
          tick();
          if (tn == tev) {
            fireNextEvent();
          }
          tn += dt;
        } else {
          fireNextEvent();
        }
      } else {
        fireNextEvent();
        // the action may have started sampling
        if (dt == 0) {
          tn = time;
        }
      }
      return "step at " + time;
    } else if (dt > 0) {
      tick();
      tn += dt;
      tev = time;
      return "tick at " + time;
    }
    String message = "clock " + id + ": nothing to evaluate at time " + time;
    LoggingUtil.warn(LOGGER, message);
    return message;
  }

  private void fireNextEvent() {
    TimedAction event = schedule.pollEvent();
    time = Math.max(time, event.getTime());
    event.getAction().run();
    evcount++;
    if (event.isRepeating()) {
      schedule.addEvent(event.withTime(event.getTime() + event.getCycle()));
    }
    tev = schedule.hasEvents() ? schedule.nextEventTime() : time;
  }

  private void tick() {
    time = tn;
    for (PeriodicAction sample : List.copyOf(schedule.getSamples())) {
      sample.getAction().run();
    }
    ConditionalAction condition;
    while ((condition = schedule.pollSatisfiedCondition()) != null) {
      condition.getAction().run();
    }
    if (derivedDt && schedule.getConditions().isEmpty() && schedule.getSamples().isEmpty()
        && router == null) {
      dt = 0;
      derivedDt = false;
    }
    scount++;
  }

  // ---------------------------------------------------------------------------------------
  // Scheduling
  // ---------------------------------------------------------------------------------------

  /**
   * Schedules an action at an absolute time. Times in the past are clamped to now.
   *
   * @param action The action
   * @param t      The requested time
   * @return The fire time actually assigned, perturbed if {@code t} was taken
   */
  public double at(Runnable action, double t) {
    return at(action, t, EventOptions.NONE);
  }

  public double at(Runnable action, TimeValue t) {
    return at(action, toClockTime(t), EventOptions.NONE);
  }

  /**
   * Schedules an action at an absolute time with options.
   *
   * @param action  The action
   * @param t       The requested time
   * @param options Cycle, target clock and synchronization options
   * @return The fire time assigned, or the current time when routed to another clock
   */
  public double at(Runnable action, double t, EventOptions options) {
    double when = Math.max(t, time);
    if (options.isSync()) {
      when = alignToBoundary(when);
    }
    return schedule(new TimedAction(action, when, options.getCycle()), options);
  }

  public double after(Runnable action, double delay) {
    return at(action, time + delay, EventOptions.NONE);
  }

  public double after(Runnable action, TimeValue delay) {
    return after(action, toClockTime(delay));
  }

  public double after(Runnable action, double delay, EventOptions options) {
    return at(action, time + delay, options);
  }

  /**
   * Schedules an action now, repeating every {@code interval}.
   *
   * @param action   The action
   * @param interval The repeat interval, must be positive
   * @return The first fire time
   */
  public double every(Runnable action, double interval) {
    return every(action, interval, EventOptions.NONE);
  }

  public double every(Runnable action, TimeValue interval) {
    return every(action, toClockTime(interval));
  }

  public double every(Runnable action, double interval, EventOptions options) {
    if (interval <= 0) {
      throw new IllegalArgumentException("Repeat interval must be positive: " + interval);
    }
    EventOptions.Builder repeating = EventOptions.builder()
        .cycle(interval)
        .sync(options.isSync())
        .spawn(options.isSpawn());
    if (options.getCid() != null) {
      repeating.cid(options.getCid());
    }
    return at(action, time, repeating.build());
  }

  /**
   * Runs {@code action} once, at the first tick where all checks hold. While the clock is
   * busy and the checks already hold, the action runs immediately instead. Without a
   * sampling interval one is derived from the remaining run horizon.
   *
   * @param action The action
   * @param checks The predicates, all of which must hold
   * @return The current time
   */
  public double on(Runnable action, BooleanSupplier... checks) {
    return on(action, Arrays.asList(checks), EventOptions.NONE);
  }

  public double on(Runnable action, List<BooleanSupplier> checks, EventOptions options) {
    return schedule(new ConditionalAction(action, checks), options);
  }

  /**
   * Runs {@code action} on every tick. Sets the sampling interval to the clock's current
   * one, or derives one from the event density when there is none.
   *
   * @param action The action
   * @return The current time
   */
  public double periodic(Runnable action) {
    return periodic(action, 0, EventOptions.NONE);
  }

  /**
   * Runs {@code action} on every tick and sets the sampling interval.
   *
   * @param action   The action
   * @param interval The sampling interval, 0 to keep or derive the clock's
   * @return The current time
   */
  public double periodic(Runnable action, double interval) {
    return periodic(action, interval, EventOptions.NONE);
  }

  public double periodic(Runnable action, double interval, EventOptions options) {
    return schedule(new PeriodicAction(action, interval), options);
  }

  /**
   * Registers an item on this clock or, following the options, on another clock of the
   * parallel group.
   *
   * @param item    The item
   * @param options The options naming the target clock
   * @return The registration time reported by the target clock
   */
  public double schedule(Schedulable item, EventOptions options) {
    Objects.requireNonNull(item, "Item cannot be null");
    int target = id;
    if (router != null) {
      if (options.isSpawn()) {
        target = router.spawnTarget();
      } else if (options.getCid() != null) {
        target = options.getCid();
      }
    } else if (options.getCid() != null && options.getCid() != id) {
      LoggingUtil.warn(LOGGER, "clock " + id + " has no parallel clocks, registering locally");
    }
    if (target == id) {
      return register(item);
    }
    return router.route(item, target);
  }

  /**
   * Registers an item on this clock.
   *
   * @param item The item
   * @return The fire time for timed actions, otherwise the current time
   */
  public double register(Schedulable item) {
    if (item instanceof TimedAction event) {
      double when = schedule.addEvent(event.getTime() < time ? event.withTime(time) : event);
      tev = schedule.nextEventTime();
      return when;
    }
    if (item instanceof ConditionalAction condition) {
      if (state == ClockState.BUSY && condition.isSatisfied()) {
        condition.getAction().run();
        return time;
      }
      schedule.addCondition(condition);
      if (dt == 0) {
        dt = scale(endTime - time) / 100;
        derivedDt = true;
        tn = time + dt;
      }
      return time;
    }
    if (item instanceof PeriodicAction sample) {
      schedule.addSample(sample);
      if (sample.getInterval() > 0) {
        dt = sample.getInterval();
      } else if (dt == 0) {
        dt = evcount == 0 ? 0.01 : scale(time / evcount) / 100;
      }
      derivedDt = false;
      if (tn <= time) {
        tn = time + dt;
      }
      return time;
    }
    if (item instanceof ProcessRegistration registration) {
      process(registration);
      return time;
    }
    throw new IllegalArgumentException("Cannot register " + item.getClass().getName());
  }

  /**
   * The power of ten at or below {@code n}, or 1 when {@code n} is not positive.
   */
  static double scale(double n) {
    if (n <= 0) {
      return 1;
    }
    return Math.pow(10, Math.floor(Math.log10(n)));
  }

  private double alignToBoundary(double when) {
    if (router == null || router.syncInterval() <= 0) {
      return when;
    }
    double interval = router.syncInterval();
    double origin = router.syncOrigin();
    double k = Math.ceil((when - origin) / interval - 1e-9);
    return Math.nextUp(origin + k * interval);
  }

  // ---------------------------------------------------------------------------------------
  // Processes
  // ---------------------------------------------------------------------------------------

  /**
   * Starts a process that runs {@code body} until it is stopped or fails.
   *
   * @param id   The requested id
   * @param body The body
   * @return The running process
   */
  public SimProcess process(Object id, ProcessBody body) {
    return process(new ProcessRegistration(id, body));
  }

  public SimProcess process(Object id, ProcessBody body, long cycles) {
    return process(new ProcessRegistration(id, body, cycles));
  }

  /**
   * Starts a process on this clock and runs it up to its first suspension.
   *
   * @param registration The process to start
   * @return The process, already suspended or ended
   */
  public SimProcess process(ProcessRegistration registration) {
    if (state == ClockState.UNDEFINED) {
      state = ClockState.IDLE;
    }
    return SimProcess.start(this, processes, registration);
  }

  /**
   * Suspends the calling process for {@code delay} time units.
   *
   * @param delay The delay
   * @throws IllegalStateException if not called from a process
   */
  public void delay(double delay) {
    SimProcess process = SimProcess.current("delay");
    process.suspend(wake -> after(wake, delay));
  }

  public void delay(TimeValue delay) {
    delay(toClockTime(delay));
  }

  /**
   * Suspends the calling process until the absolute time {@code until}.
   *
   * @param until The wake-up time
   * @throws IllegalArgumentException if {@code until} is not in the future
   */
  public void delayUntil(double until) {
    SimProcess process = SimProcess.current("delayUntil");
    if (until <= time) {
      String message = "bad timing: cannot delay until " + until + ", current time is " + time;
      LoggingUtil.warn(LOGGER, message);
      throw new IllegalArgumentException(message);
    }
    process.suspend(wake -> at(wake, until));
  }

  /**
   * Suspends the calling process until every check holds. Returns immediately when they
   * already do.
   *
   * @param checks The predicates
   */
  public void waitFor(BooleanSupplier... checks) {
    SimProcess process = SimProcess.current("waitFor");
    ConditionalAction probe = new ConditionalAction(() -> { }, Arrays.asList(checks));
    if (probe.isSatisfied()) {
      return;
    }
    process.suspend(wake -> on(wake, checks));
  }

  /**
   * Runs {@code action} on the clock's timeline at the current time and suspends the
   * calling process until it has run.
   *
   * @param action The action, typically I/O that must stay ordered with virtual time
   */
  public void now(Runnable action) {
    Objects.requireNonNull(action, "Action cannot be null");
    SimProcess process = SimProcess.current("now");
    process.suspend(wake -> at(() -> {
      action.run();
      wake.run();
    }, time));
  }

  /**
   * Suspends the calling process until {@code stream} delivers a value. The stream must be
   * fed from code running on this clock.
   *
   * @param stream The stream
   * @param <T>    The value type
   * @return The value
   * @throws StreamClosedException if the stream is closed and drained
   */
  public <T> T receive(FutureStream<T> stream) {
    SimProcess process = SimProcess.current("receive");
    CompletableFuture<T> next = stream.nextAsync();
    if (!next.isDone()) {
      process.suspend(wake -> next.whenComplete((value, error) -> at(wake, time)));
    }
    try {
      return next.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw new StreamClosedException(e.getCause());
    }
  }

  /**
   * Interrupts a suspended process.
   *
   * @param process The process
   * @param signal  {@link ClockCommand.Kind#STOP} ends the process
   * @param value   A value carried by the {@link ProcessInterrupt}
   * @return false if the process was not suspended
   */
  public boolean interrupt(SimProcess process, ClockCommand.Kind signal, Object value) {
    Objects.requireNonNull(process, "Process cannot be null");
    return process.interrupt(signal, value);
  }

  public boolean stopProcess(SimProcess process) {
    return interrupt(process, ClockCommand.Kind.STOP, null);
  }

  // ---------------------------------------------------------------------------------------
  // Time and units
  // ---------------------------------------------------------------------------------------

  /**
   * Converts a dimensioned time into this clock's unit. An unitless clock ignores the unit.
   *
   * @param value The time
   * @return The magnitude in the clock's unit
   */
  public double toClockTime(TimeValue value) {
    Objects.requireNonNull(value, "Time cannot be null");
    if (unit == null) {
      LoggingUtil.warn(LOGGER, "clock has no time unit, ignoring units");
      return value.amount();
    }
    return config.getUnitAdapter().convert(value, unit);
  }

  /**
   * Changes the clock's unit, rescaling time, sampling interval and all scheduled times.
   * Setting a unit on an unitless clock only attaches it.
   *
   * @param newUnit The unit, or null to make the clock unitless
   */
  public void setUnit(ChronoUnit newUnit) {
    if (unit != null && newUnit != null && unit != newUnit) {
      double factor = config.getUnitAdapter().convert(new TimeValue(1, unit), newUnit);
      time *= factor;
      dt *= factor;
      endTime *= factor;
      horizon *= factor;
      tev *= factor;
      tn *= factor;
      schedule.rescale(factor);
    }
    unit = newUnit;
  }

  /**
   * Moves this clock and everything scheduled on it to {@code newTime}, adopting the
   * sampling interval {@code newDt}.
   *
   * @param newTime The time to synchronize to
   * @param newDt   The sampling interval to adopt
   */
  public void sync(double newTime, double newDt) {
    double delta = newTime - time;
    schedule.shift(delta);
    time = newTime;
    endTime += delta;
    horizon += delta;
    dt = newDt;
    tn = dt > 0 ? time + dt : time;
    tev = schedule.hasEvents() ? schedule.nextEventTime() : time;
  }

  /**
   * Synchronizes this clock to another one's time, interval and unit.
   *
   * @param other The reference clock
   */
  public void sync(Clock other) {
    unit = other.unit;
    sync(other.time, other.dt);
  }

  /**
   * @return A copy of the observable state
   */
  public ClockSnapshot snapshot() {
    return new ClockSnapshot(id, state, time, dt, evcount, scount, schedule.getEvents(),
        List.copyOf(schedule.getConditions()), List.copyOf(schedule.getSamples()),
        processes.size());
  }

  public int getId() {
    return id;
  }

  public ClockConfig getConfig() {
    return config;
  }

  public ClockState getState() {
    return state;
  }

  /**
   * Gets the current virtual time. This is the accessor loggers and recorders tap.
   *
   * @return The current time
   */
  public double getTime() {
    return time;
  }

  public ChronoUnit getUnit() {
    return unit;
  }

  public double getDt() {
    return dt;
  }

  public double getEndTime() {
    return horizon;
  }

  public double getNextEventTime() {
    return tev;
  }

  public double getNextTickTime() {
    return tn;
  }

  public long getEventCount() {
    return evcount;
  }

  public long getTickCount() {
    return scount;
  }

  public Schedule getSchedule() {
    return schedule;
  }

  public ProcessTable getProcesses() {
    return processes;
  }

  public ClockRouter getRouter() {
    return router;
  }

  /**
   * Attaches the clock to a parallel group, or detaches it with null.
   *
   * @param router The group's router
   */
  public void setRouter(ClockRouter router) {
    this.router = router;
  }

  @Override
  public String toString() {
    return "Clock{" +
        "id=" + id +
        ", state=" + state +
        ", time=" + time +
        ", dt=" + dt +
        ", " + schedule +
        ", processes=" + processes.size() +
        '}';
  }
}
