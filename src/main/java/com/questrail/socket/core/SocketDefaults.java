package com.questrail.socket.core;

import java.time.Duration;

/**
 * Framework-wide constants.
 */
public final class SocketDefaults
{
    /** Read buffer size used when none (or a non-positive one) is given. */
    public static final int DEFAULT_BUFFER_SIZE = 32 * 1024;

    /** How often {@code shutdown} re-checks whether the server has drained. */
    public static final Duration SHUTDOWN_POLL_INTERVAL = Duration.ofMillis(1);

    /** Upper bound on the drain wait of {@code shutdown}, whatever the caller's deadline. */
    public static final Duration SHUTDOWN_MAX_WAIT = Duration.ofSeconds(1);

    /** Idle timeouts shorter than this disable idle detection. */
    public static final Duration MIN_IDLE_TIMEOUT = Duration.ofSeconds(1);

    private SocketDefaults() {
    }

    public static int bufferSize(int requested) {
        return requested > 0 ? requested : DEFAULT_BUFFER_SIZE;
    }

    /**
     * @return {@code timeout}, or {@code null} when it is below {@link #MIN_IDLE_TIMEOUT}
     */
    public static Duration idleTimeout(Duration timeout) {
        if (timeout == null || timeout.compareTo(MIN_IDLE_TIMEOUT) < 0) {
            return null;
        }
        return timeout;
    }
}
