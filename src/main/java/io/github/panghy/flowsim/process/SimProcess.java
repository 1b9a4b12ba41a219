package io.github.panghy.flowsim.process;

import io.github.panghy.flowsim.clock.Clock;
import io.github.panghy.flowsim.clock.ClockCommand;
import io.github.panghy.flowsim.util.LoggingUtil;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.SynchronousQueue;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * A suspendable unit of user code synchronized with a clock.
 *
 * <p>Each process runs its body on a dedicated daemon thread, but only one thread of a
 * clock ever runs at a time: control moves between the clock and the process through a
 * pair of single-slot rendezvous queues. The clock hands control over with
 * {@code resume} and gets it back when the process suspends or ends. A wake-up action
 * registered by a suspending process carries a ticket, so a wake-up that lost its purpose
 * (the process was interrupted meanwhile) does nothing.</p>
 */
public class SimProcess {

  private static final Logger LOGGER = Logger.getLogger(SimProcess.class.getName());

  private static final ThreadLocal<SimProcess> CURRENT = new ThreadLocal<>();

  private static final Object GO = new Object();
  private static final Object YIELDED = new Object();
  private static final Object ENDED = new Object();

  /**
   * Process state.
   */
  public enum ProcessState {
    CREATED,
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED
  }

  private final Object id;
  private final Clock clock;
  private final ProcessBody body;
  private final long cycles;
  private final ProcessTable table;
  private final SynchronousQueue<Object> toProcess = new SynchronousQueue<>();
  private final SynchronousQueue<Object> toController = new SynchronousQueue<>();
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private volatile ProcessState state = ProcessState.CREATED;
  private volatile Throwable failure;
  private volatile long ticket;
  private volatile boolean wokenEarly;
  private volatile boolean terminated;
  private Thread thread;

  private SimProcess(Object id, Clock clock, ProcessRegistration registration, ProcessTable table) {
    this.id = id;
    this.clock = clock;
    this.body = registration.body();
    this.cycles = registration.cycles();
    this.table = table;
  }

  /**
   * Registers a process under a deduplicated id and runs it up to its first suspension.
   * Must be called from the clock's thread or from a running process of that clock.
   *
   * @param clock        The owning clock
   * @param table        The clock's process table
   * @param registration What to run
   * @return The started process
   */
  public static SimProcess start(Clock clock, ProcessTable table, ProcessRegistration registration) {
    Objects.requireNonNull(registration, "Registration cannot be null");
    SimProcess process = new SimProcess(table.uniqueId(registration.id()), clock, registration, table);
    table.add(process);
    process.thread = new Thread(process::loop, "flowsim-process-" + process.id);
    process.thread.setDaemon(true);
    process.thread.start();
    process.resume(GO);
    return process;
  }

  /**
   * Gets the process running on the calling thread.
   *
   * @param operation The primitive being called, for the error message
   * @return The current process
   * @throws IllegalStateException if called outside of a process
   */
  public static SimProcess current(String operation) {
    SimProcess process = CURRENT.get();
    if (process == null) {
      throw new IllegalStateException(operation + " called outside of a process");
    }
    return process;
  }

  /**
   * @return true if the calling thread runs a process
   */
  public static boolean isInProcess() {
    return CURRENT.get() != null;
  }

  private void loop() {
    CURRENT.set(this);
    try {
      Object signal = toProcess.take();
      if (signal instanceof ProcessInterrupt) {
        throw (ProcessInterrupt) signal;
      }
      state = ProcessState.RUNNING;
      for (long i = 0; i < cycles && !terminated; i++) {
        body.run(clock);
      }
      state = ProcessState.COMPLETED;
    } catch (ProcessInterrupt e) {
      if (e.isStop()) {
        LoggingUtil.debug(LOGGER, "process " + id + " stopped");
        state = ProcessState.COMPLETED;
      } else {
        fail(e);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fail(e);
    } catch (Throwable t) {
      fail(t);
    } finally {
      if (failure == null) {
        completion.complete(null);
      } else {
        completion.completeExceptionally(failure);
      }
      CURRENT.remove();
      try {
        toController.put(ENDED);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void fail(Throwable t) {
    failure = t;
    state = ProcessState.FAILED;
    LoggingUtil.warn(LOGGER, "process " + id + " failed at time " + clock.getTime(), t);
  }

  /**
   * Hands control to this process until it suspends or ends. Completed processes leave
   * the table; failed ones stay for inspection.
   */
  private void resume(Object signal) {
    try {
      toProcess.put(signal);
      Object answer = toController.take();
      if (answer == ENDED && state == ProcessState.COMPLETED) {
        table.remove(this);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while process " + id + " was running", e);
    }
  }

  /**
   * Suspends the calling process. {@code arm} receives the wake-up to register with the
   * clock; the call returns once that wake-up ran.
   *
   * @param arm Registers the wake-up action
   * @throws ProcessInterrupt if the process is interrupted while suspended
   */
  public void suspend(Consumer<Runnable> arm) {
    if (Thread.currentThread() != thread) {
      throw new IllegalStateException("process " + id + " can only suspend itself");
    }
    if (terminated) {
      throw new ProcessInterrupt(ClockCommand.Kind.STOP, null);
    }
    long myTicket = ++ticket;
    wokenEarly = false;
    state = ProcessState.SUSPENDED;
    arm.accept(() -> wake(myTicket));
    if (wokenEarly) {
      // the wake-up ran synchronously while arming
      state = ProcessState.RUNNING;
      return;
    }
    Object signal;
    try {
      toController.put(YIELDED);
      signal = toProcess.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProcessInterrupt(ClockCommand.Kind.STOP, e);
    }
    state = ProcessState.RUNNING;
    if (signal instanceof ProcessInterrupt) {
      throw (ProcessInterrupt) signal;
    }
  }

  private void wake(long wakeTicket) {
    if (wakeTicket != ticket || state != ProcessState.SUSPENDED) {
      return;
    }
    if (Thread.currentThread() == thread) {
      wokenEarly = true;
      return;
    }
    ticket++;
    resume(GO);
  }

  /**
   * Throws a {@link ProcessInterrupt} at the process's suspension point and runs it until
   * it suspends again or ends.
   *
   * @param signal The signal, {@link ClockCommand.Kind#STOP} ends the process
   * @param value  An optional value carried by the interrupt
   * @return false if the process was not suspended
   */
  public boolean interrupt(ClockCommand.Kind signal, Object value) {
    if (Thread.currentThread() == thread) {
      throw new ProcessInterrupt(signal, value);
    }
    if (state != ProcessState.SUSPENDED) {
      LoggingUtil.warn(LOGGER, "cannot interrupt process " + id + " in state " + state);
      return false;
    }
    ticket++;
    resume(new ProcessInterrupt(signal, value));
    return true;
  }

  /**
   * Ends the process thread without handing control to it. A process parked at a
   * suspension point gets a stop signal there, and every later suspension or cycle
   * ends it as well.
   */
  public void terminate() {
    if (isDone() || thread == null) {
      return;
    }
    terminated = true;
    thread.interrupt();
  }

  public Object getId() {
    return id;
  }

  public Clock getClock() {
    return clock;
  }

  public ProcessState getState() {
    return state;
  }

  /**
   * @return The fault that ended the process, or null
   */
  public Throwable getFailure() {
    return failure;
  }

  /**
   * @return true once the process completed or failed
   */
  public boolean isDone() {
    return state == ProcessState.COMPLETED || state == ProcessState.FAILED;
  }

  /**
   * @return A future completing when the process ends, exceptionally if it failed
   */
  public CompletableFuture<Void> getCompletion() {
    return completion;
  }

  @Override
  public String toString() {
    return "SimProcess{" +
        "id=" + id +
        ", state=" + state +
        '}';
  }
}
