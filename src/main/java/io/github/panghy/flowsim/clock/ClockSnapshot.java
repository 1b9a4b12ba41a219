package io.github.panghy.flowsim.clock;

import java.util.List;

/**
 * A copy of a clock's observable state, as answered to a worker query.
 *
 * @param id           The clock id
 * @param state        The clock state
 * @param time         The current virtual time
 * @param dt           The sampling interval
 * @param eventCount   Timed actions fired in the last run
 * @param tickCount    Ticks taken in the last run
 * @param events       Pending timed actions in firing order
 * @param conditions   Pending conditional actions
 * @param samples      Registered periodic actions
 * @param processCount Registered processes
 */
public record ClockSnapshot(int id, ClockState state, double time, double dt, long eventCount,
                            long tickCount, List<TimedAction> events,
                            List<ConditionalAction> conditions, List<PeriodicAction> samples,
                            int processCount) {
}
