package com.questrail.transferd.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every daemon timer: session idle timeouts, the session id
 * grace period and handler deadlines.
 *
 * <h2>Binding invariant</h2>
 * Timing logic MUST use a monotonic time source. Wall-clock time
 * ({@code Instant.now()}) is permitted only for event timestamps and
 * observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
