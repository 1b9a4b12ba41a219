package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockRouter;
import io.github.panghy.flowsim.clock.RunSummary;
import io.github.panghy.flowsim.clock.Schedulable;
import io.github.panghy.flowsim.core.FutureStream;
import io.github.panghy.flowsim.core.PromiseStream;
import io.github.panghy.flowsim.core.StreamClosedException;
import io.github.panghy.flowsim.util.LoggingUtil;

import java.util.List;
import java.util.logging.Logger;

/**
 * The worker side of a parallel group: owns one clock on its own thread and serves the
 * master's commands from the forth channel, answering on the back channel.
 *
 * <p>The worker never touches another clock. Registrations aimed at other clocks go back
 * to the master as {@link ClockMessage.Forward}. A fault raised while handling a command
 * is answered as {@link ClockMessage.Error} and kept for {@link ClockMessage.Diag}; the
 * loop goes on unless fault handling is disabled.</p>
 */
public class ActiveClock implements ClockRouter, Runnable {

  private static final Logger LOGGER = Logger.getLogger(ActiveClock.class.getName());

  private static final ThreadLocal<ActiveClock> CURRENT = new ThreadLocal<>();

  private final Clock clock;
  private final int masterId;
  private final PromiseStream<ClockMessage> forth;
  private final PromiseStream<ClockMessage> back;
  private final boolean handleFaults;
  private final double syncOrigin;
  private volatile Throwable lastFault;

  ActiveClock(Clock clock, int masterId, PromiseStream<ClockMessage> forth,
              PromiseStream<ClockMessage> back, boolean handleFaults, double syncOrigin) {
    this.clock = clock;
    this.masterId = masterId;
    this.forth = forth;
    this.back = back;
    this.handleFaults = handleFaults;
    this.syncOrigin = syncOrigin;
    clock.setRouter(this);
  }

  /**
   * Gets the clock of the worker running on the calling thread.
   *
   * @return The worker's clock, or null outside of a worker thread
   */
  public static Clock current() {
    ActiveClock worker = CURRENT.get();
    return worker == null ? null : worker.clock;
  }

  @Override
  public void run() {
    CURRENT.set(this);
    FutureStream<ClockMessage> inbox = forth.getFutureStream();
    LoggingUtil.debug(LOGGER, "worker clock " + clock.getId() + " started");
    try {
      while (true) {
        ClockMessage message;
        try {
          message = inbox.take();
        } catch (StreamClosedException e) {
          break;
        }
        if (message instanceof ClockMessage.Stop) {
          break;
        }
        if (message instanceof ClockMessage.Diag) {
          back.send(new ClockMessage.Response(diagnosis()));
          continue;
        }
        try {
          back.send(handle(message));
        } catch (Throwable t) {
          lastFault = t;
          LoggingUtil.warn(LOGGER, "worker clock " + clock.getId() + " failed on " + message, t);
          back.send(new ClockMessage.Error(t));
          if (!handleFaults) {
            LoggingUtil.error(LOGGER, "worker clock " + clock.getId() + " terminated", t);
            forth.closeExceptionally(t);
            back.closeExceptionally(t);
            return;
          }
        }
      }
      clock.reset(true);
    } finally {
      forth.close();
      back.close();
      CURRENT.remove();
      LoggingUtil.debug(LOGGER, "worker clock " + clock.getId() + " stopped");
    }
  }

  private ClockMessage handle(ClockMessage message) {
    LoggingUtil.debug(LOGGER, "worker clock " + clock.getId() + " <- " + message);
    if (message instanceof ClockMessage.Register register) {
      return new ClockMessage.Response(clock.register(register.item()));
    }
    if (message instanceof ClockMessage.Query) {
      return new ClockMessage.Response(clock.snapshot());
    }
    if (message instanceof ClockMessage.Run run) {
      long start = System.nanoTime();
      RunSummary summary = clock.runLocal(run.duration(), !run.sync());
      if (!summary.handled()) {
        throw new IllegalStateException(summary.message());
      }
      return new ClockMessage.Done(System.nanoTime() - start);
    }
    if (message instanceof ClockMessage.Sync sync) {
      clock.sync(sync.time(), sync.dt());
      return new ClockMessage.Response(clock.getTime());
    }
    if (message instanceof ClockMessage.Reset reset) {
      clock.reset(reset.hard());
      clock.sync(reset.time(), reset.dt());
      return new ClockMessage.Response(true);
    }
    throw new IllegalStateException("worker clock " + clock.getId() + " cannot handle " + message);
  }

  private Diagnosis diagnosis() {
    Throwable fault = lastFault;
    List<StackTraceElement> trace = fault == null ? List.of() : List.of(fault.getStackTrace());
    return new Diagnosis(clock.getId(), fault, trace);
  }

  @Override
  public double route(Schedulable item, int target) {
    back.send(new ClockMessage.Forward(item, target));
    return clock.getTime();
  }

  @Override
  public int spawnTarget() {
    return ANY;
  }

  @Override
  public double syncOrigin() {
    return syncOrigin;
  }

  @Override
  public double syncInterval() {
    return clock.getDt();
  }

  public Clock getClock() {
    return clock;
  }

  public int getMasterId() {
    return masterId;
  }
}
