package io.github.panghy.flowsim.clock;

/**
 * Anything that can be registered with a clock, locally or through a worker's channel:
 * {@link TimedAction}, {@link ConditionalAction}, {@link PeriodicAction} and process
 * registrations.
 */
public interface Schedulable {
}
