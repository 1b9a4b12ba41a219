package io.github.panghy.flowsim.parallel;

import io.github.panghy.flowsim.clock.ClockSnapshot;

import java.util.function.BooleanSupplier;

/**
 * Access to one clock of a parallel group. {@link LocalClock} reaches the registry
 * directly, {@link RemoteClockHandle} only through the worker's channels.
 */
public interface ClockHandle {

  int getId();

  double at(Runnable action, double t);

  double after(Runnable action, double delay);

  double every(Runnable action, double interval);

  double on(Runnable action, BooleanSupplier... checks);

  double periodic(Runnable action);

  ClockSnapshot query();
}
