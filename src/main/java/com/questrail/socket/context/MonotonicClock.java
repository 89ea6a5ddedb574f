package com.questrail.socket.context;

/**
 * Source of monotonic time used for deadlines.
 *
 * <p>Values are only meaningful relative to each other; they are not wall-clock
 * timestamps.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    long nowNanos();
}
