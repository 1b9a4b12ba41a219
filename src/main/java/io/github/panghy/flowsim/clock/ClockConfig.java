package io.github.panghy.flowsim.clock;

import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Configuration options for a {@link Clock} and the workers forked from it.
 */
public class ClockConfig {

  /** One worker per available processor beyond the one running the master. */
  private static final int DEFAULT_WORKER_COUNT =
      Math.max(0, Runtime.getRuntime().availableProcessors() - 1);

  private static final long DEFAULT_SPAWN_SEED = 42L;

  /** Start time, restored by a hard reset. */
  private final double t0;

  /** Sampling interval, 0 for purely event driven clocks. */
  private final double dt;

  /** Time unit, or null for a unitless clock. */
  private final ChronoUnit unit;

  private final TimeUnitAdapter unitAdapter;

  /** Number of workers created when the clock is forked without an explicit count. */
  private final int workerCount;

  /** Whether workers keep running after a fault. */
  private final boolean handleWorkerFaults;

  /** Seed for placing actions registered with spawn. */
  private final long spawnSeed;

  /** The default configuration: unitless, event driven, starting at 0. */
  public static final ClockConfig DEFAULT = builder().build();

  private ClockConfig(Builder builder) {
    this.t0 = builder.t0;
    this.dt = builder.dt;
    this.unit = builder.unit;
    this.unitAdapter = builder.unitAdapter;
    this.workerCount = builder.workerCount;
    this.handleWorkerFaults = builder.handleWorkerFaults;
    this.spawnSeed = builder.spawnSeed;
  }

  public double getT0() {
    return t0;
  }

  public double getDt() {
    return dt;
  }

  public ChronoUnit getUnit() {
    return unit;
  }

  public TimeUnitAdapter getUnitAdapter() {
    return unitAdapter;
  }

  public int getWorkerCount() {
    return workerCount;
  }

  public boolean isHandleWorkerFaults() {
    return handleWorkerFaults;
  }

  public long getSpawnSeed() {
    return spawnSeed;
  }

  /**
   * @return A builder initialized with this configuration
   */
  public Builder toBuilder() {
    return builder()
        .t0(t0)
        .dt(dt)
        .unit(unit)
        .unitAdapter(unitAdapter)
        .workerCount(workerCount)
        .handleWorkerFaults(handleWorkerFaults)
        .spawnSeed(spawnSeed);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for clock configuration.
   */
  public static class Builder {
    private double t0;
    private double dt;
    private ChronoUnit unit;
    private TimeUnitAdapter unitAdapter = ChronoTimeUnitAdapter.INSTANCE;
    private int workerCount = DEFAULT_WORKER_COUNT;
    private boolean handleWorkerFaults = true;
    private long spawnSeed = DEFAULT_SPAWN_SEED;

    public Builder t0(double t0) {
      this.t0 = t0;
      return this;
    }

    /**
     * Sets the sampling interval.
     *
     * @param dt The interval, 0 disables ticking
     * @return This builder
     */
    public Builder dt(double dt) {
      this.dt = dt;
      return this;
    }

    public Builder unit(ChronoUnit unit) {
      this.unit = unit;
      return this;
    }

    public Builder unitAdapter(TimeUnitAdapter unitAdapter) {
      this.unitAdapter = unitAdapter;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets whether a worker keeps serving commands after a fault. When false the
     * worker reports the fault and closes its channels.
     *
     * @param handleWorkerFaults True to keep workers alive
     * @return This builder
     */
    public Builder handleWorkerFaults(boolean handleWorkerFaults) {
      this.handleWorkerFaults = handleWorkerFaults;
      return this;
    }

    public Builder spawnSeed(long spawnSeed) {
      this.spawnSeed = spawnSeed;
      return this;
    }

    /**
     * Builds a new configuration.
     *
     * @return A new configuration
     */
    public ClockConfig build() {
      if (dt < 0) {
        throw new IllegalArgumentException("Sampling interval cannot be negative: " + dt);
      }
      if (workerCount < 0) {
        throw new IllegalArgumentException("Worker count cannot be negative: " + workerCount);
      }
      Objects.requireNonNull(unitAdapter, "Unit adapter cannot be null");
      return new ClockConfig(this);
    }
  }
}
