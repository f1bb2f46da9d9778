package com.questrail.interlock.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for watchdog deadlines and cycle scheduling.
 *
 * <h2>Binding invariant</h2>
 * Confirmation deadlines and cycle cadence MUST be computed from a monotonic
 * source. Wall-clock time (e.g. {@code Instant.now()}) is used only to stamp
 * observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
