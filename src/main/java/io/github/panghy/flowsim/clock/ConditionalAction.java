package io.github.panghy.flowsim.clock;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * An action fired exactly once, at the first sampling tick where every check holds.
 */
public final class ConditionalAction implements Schedulable {

  private final Runnable action;
  private final List<BooleanSupplier> checks;

  /**
   * @param action The work to run
   * @param checks Predicates that must all be true, at least one
   */
  public ConditionalAction(Runnable action, List<BooleanSupplier> checks) {
    this.action = Objects.requireNonNull(action, "Action cannot be null");
    Objects.requireNonNull(checks, "Checks cannot be null");
    if (checks.isEmpty()) {
      throw new IllegalArgumentException("A conditional action needs at least one check");
    }
    this.checks = List.copyOf(checks);
  }

  public Runnable getAction() {
    return action;
  }

  public List<BooleanSupplier> getChecks() {
    return checks;
  }

  /**
   * @return true if every check currently holds
   */
  public boolean isSatisfied() {
    for (BooleanSupplier check : checks) {
      if (!check.getAsBoolean()) {
        return false;
      }
    }
    return true;
  }
}
