package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.ClockSnapshot;
import io.github.panghy.flowsim.clock.ConditionalAction;
import io.github.panghy.flowsim.clock.PeriodicAction;
import io.github.panghy.flowsim.clock.Schedulable;
import io.github.panghy.flowsim.clock.TimedAction;
import io.github.panghy.flowsim.core.FutureStream;
import io.github.panghy.flowsim.core.PromiseStream;
import io.github.panghy.flowsim.core.StreamClosedException;
import io.github.panghy.flowsim.util.LoggingUtil;

import java.util.Arrays;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * The master's handle on a worker clock. Everything goes through the worker's channels;
 * the worker's registry is never touched directly. Only the master's thread uses a handle.
 */
public final class RemoteClockHandle implements ClockHandle {

  private static final Logger LOGGER = Logger.getLogger(RemoteClockHandle.class.getName());

  private static final long STOP_TIMEOUT_MILLIS = 5000;

  private final int id;
  private final WorkerGroup group;
  private final PromiseStream<ClockMessage> forth;
  private final FutureStream<ClockMessage> back;
  private final Thread thread;
  private volatile Throwable lastError;

  RemoteClockHandle(int id, WorkerGroup group, PromiseStream<ClockMessage> forth,
                    FutureStream<ClockMessage> back, Thread thread) {
    this.id = id;
    this.group = group;
    this.forth = forth;
    this.back = back;
    this.thread = thread;
  }

  @Override
  public int getId() {
    return id;
  }

  /**
   * Sends a command and waits for its answer. Forwarded registrations arriving meanwhile
   * are delivered once the answer is in.
   *
   * @param message The command
   * @return The answer, an {@link ClockMessage.Error} if the worker failed or is gone
   */
  public ClockMessage talk(ClockMessage message) {
    if (!send(message)) {
      return new ClockMessage.Error(new StreamClosedException());
    }
    ClockMessage reply = awaitReply();
    group.deliverForwards();
    return reply;
  }

  boolean send(ClockMessage message) {
    LoggingUtil.debug(LOGGER, "worker clock " + id + " -> " + message);
    return forth.send(message);
  }

  ClockMessage awaitReply() {
    while (true) {
      ClockMessage reply;
      try {
        reply = back.take();
      } catch (StreamClosedException e) {
        lastError = e.getCause() == null ? e : e.getCause();
        return new ClockMessage.Error(lastError);
      }
      if (reply instanceof ClockMessage.Forward forward) {
        group.defer(forward);
        continue;
      }
      if (reply instanceof ClockMessage.Error error) {
        lastError = error.fault();
        LoggingUtil.warn(LOGGER, "worker clock " + id + " reported a fault: " + error.fault());
      }
      return reply;
    }
  }

  /**
   * Registers an item on the worker.
   *
   * @param item The item
   * @return The time the worker reported, or the master's time if it failed
   */
  public double register(Schedulable item) {
    ClockMessage reply = talk(new ClockMessage.Register(item));
    if (reply instanceof ClockMessage.Response response && response.value() instanceof Double time) {
      return time;
    }
    return group.masterTime();
  }

  @Override
  public double at(Runnable action, double t) {
    return register(new TimedAction(action, Math.max(t, group.masterTime()), 0));
  }

  @Override
  public double after(Runnable action, double delay) {
    return at(action, group.masterTime() + delay);
  }

  @Override
  public double every(Runnable action, double interval) {
    if (interval <= 0) {
      throw new IllegalArgumentException("Repeat interval must be positive: " + interval);
    }
    return register(new TimedAction(action, group.masterTime(), interval));
  }

  @Override
  public double on(Runnable action, BooleanSupplier... checks) {
    return register(new ConditionalAction(action, Arrays.asList(checks)));
  }

  @Override
  public double periodic(Runnable action) {
    return register(new PeriodicAction(action, 0));
  }

  /**
   * @return A snapshot of the worker's clock
   * @throws IllegalStateException if the worker failed to answer
   */
  @Override
  public ClockSnapshot query() {
    ClockMessage reply = talk(new ClockMessage.Query());
    if (reply instanceof ClockMessage.Response response
        && response.value() instanceof ClockSnapshot snapshot) {
      return snapshot;
    }
    throw new IllegalStateException("worker clock " + id + " did not answer the query", lastError);
  }

  /**
   * @return The worker's last fault and its stack trace
   * @throws IllegalStateException if the worker failed to answer
   */
  public Diagnosis diagnose() {
    ClockMessage reply = talk(new ClockMessage.Diag());
    if (reply instanceof ClockMessage.Response response
        && response.value() instanceof Diagnosis diagnosis) {
      return diagnosis;
    }
    throw new IllegalStateException("worker clock " + id + " did not answer the diagnosis",
        lastError);
  }

  /**
   * Resets the worker and synchronizes it to the master.
   *
   * @param hard Whether to clear the worker's registry
   * @return true if the worker acknowledged
   */
  public boolean reset(boolean hard) {
    ClockMessage reply = talk(new ClockMessage.Reset(hard, group.masterTime(), group.masterDt()));
    return reply instanceof ClockMessage.Response;
  }

  /**
   * Ends the worker loop and waits for its thread.
   */
  void stop() {
    forth.send(new ClockMessage.Stop());
    try {
      thread.join(STOP_TIMEOUT_MILLIS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while stopping worker clock " + id, e);
    }
    if (thread.isAlive()) {
      LoggingUtil.warn(LOGGER, "worker clock " + id + " did not stop in time");
    }
  }

  public boolean isAlive() {
    return !forth.isClosed() && thread.isAlive();
  }

  /**
   * @return The last fault the worker reported, or null
   */
  public Throwable getLastError() {
    return lastError;
  }

  @Override
  public String toString() {
    return "RemoteClockHandle{id=" + id + ", alive=" + isAlive() + '}';
  }
}
