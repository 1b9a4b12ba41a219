package io.github.panghy.flowsim.process;

import io.github.panghy.flowsim.clock.Schedulable;

import java.util.Objects;

/**
 * A request to start a process, routable to any clock of a parallel group.
 *
 * @param id     The requested id, deduplicated by the receiving clock
 * @param body   The body run on each cycle
 * @param cycles How many times the body runs, {@link #FOREVER} for no limit
 */
public record ProcessRegistration(Object id, ProcessBody body, long cycles) implements Schedulable {

  public static final long FOREVER = Long.MAX_VALUE;

  public ProcessRegistration {
    Objects.requireNonNull(id, "Process id cannot be null");
    Objects.requireNonNull(body, "Process body cannot be null");
    if (cycles < 1) {
      throw new IllegalArgumentException("A process needs at least one cycle: " + cycles);
    }
  }

  public ProcessRegistration(Object id, ProcessBody body) {
    this(id, body, FOREVER);
  }
}
