package com.questrail.transferd.session;

import com.questrail.transferd.internal.time.MonotonicClock;
import com.questrail.transferd.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Hands out the lowest free session id.
 *
 * <p>A released id becomes reusable only after the reuse grace period, so a
 * late message addressed to a closed session cannot land on its
 * successor.</p>
 */
final class SessionIdAllocator
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration reuseGrace;

    private final TreeSet<Integer> free = new TreeSet<>();
    private int next = 1;

    SessionIdAllocator(MonotonicScheduler scheduler, MonotonicClock clock, Duration reuseGrace) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reuseGrace = Objects.requireNonNull(reuseGrace, "reuseGrace");
    }

    synchronized int allocate() {
        Integer reused = free.pollFirst();
        return reused != null ? reused : next++;
    }

    void release(int id) {
        if (reuseGrace.isZero() || reuseGrace.isNegative()) {
            makeFree(id);
        } else {
            scheduler.scheduleAfter(reuseGrace, clock, () -> makeFree(id));
        }
    }

    private synchronized void makeFree(int id) {
        free.add(id);
    }
}
