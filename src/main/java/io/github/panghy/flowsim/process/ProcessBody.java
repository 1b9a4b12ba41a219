package io.github.panghy.flowsim.process;

import io.github.panghy.flowsim.clock.Clock;

/**
 * One iteration of a process. It should suspend through the clock at least once
 * ({@link Clock#delay(double)}, {@link Clock#waitFor}, {@link Clock#now(Runnable)} or
 * {@link Clock#receive}), otherwise it keeps every other action of the clock waiting.
 */
@FunctionalInterface
public interface ProcessBody {

  void run(Clock clock) throws Exception;
}
