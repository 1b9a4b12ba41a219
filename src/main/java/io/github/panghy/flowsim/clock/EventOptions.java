package io.github.panghy.flowsim.clock;

/**
 * Per-registration options for timed, conditional and periodic actions.
 *
 * <ul>
 *   <li>{@code cycle}: reschedule a timed action this long after each firing</li>
 *   <li>{@code cid}: register on the clock with this id instead of the calling one</li>
 *   <li>{@code spawn}: register on a randomly chosen clock of the parallel group</li>
 *   <li>{@code sync}: delay a timed action to just after the next synchronization boundary</li>
 * </ul>
 */
public final class EventOptions {

  public static final EventOptions NONE = builder().build();

  private final double cycle;
  private final Integer cid;
  private final boolean spawn;
  private final boolean sync;

  private EventOptions(double cycle, Integer cid, boolean spawn, boolean sync) {
    this.cycle = cycle;
    this.cid = cid;
    this.spawn = spawn;
    this.sync = sync;
  }

  public double getCycle() {
    return cycle;
  }

  /**
   * @return The target clock id, or null for the calling clock
   */
  public Integer getCid() {
    return cid;
  }

  public boolean isSpawn() {
    return spawn;
  }

  public boolean isSync() {
    return sync;
  }

  /**
   * Shorthand for options targeting one clock.
   *
   * @param cid The clock id
   * @return The options
   */
  public static EventOptions onClock(int cid) {
    return builder().cid(cid).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link EventOptions}.
   */
  public static class Builder {
    private double cycle;
    private Integer cid;
    private boolean spawn;
    private boolean sync;

    public Builder cycle(double cycle) {
      this.cycle = cycle;
      return this;
    }

    public Builder cid(int cid) {
      this.cid = cid;
      return this;
    }

    public Builder spawn(boolean spawn) {
      this.spawn = spawn;
      return this;
    }

    public Builder sync(boolean sync) {
      this.sync = sync;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return The options
     * @throws IllegalArgumentException for a negative cycle, or a target id combined with spawn
     */
    public EventOptions build() {
      if (cycle < 0) {
        throw new IllegalArgumentException("Cycle cannot be negative: " + cycle);
      }
      if (spawn && cid != null) {
        throw new IllegalArgumentException("A target clock id cannot be combined with spawn");
      }
      return new EventOptions(cycle, cid, spawn, sync);
    }
  }
}
