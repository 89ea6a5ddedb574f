package com.questrail.socket.core;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ServerState
 * =============================================================================
 * The only mutable state shared between a server's listen thread, its handler
 * tasks and outside observers.
 *
 * <p>Two independent flags plus a counter, all atomics, so every read is
 * lock-free and safe from any thread, including from inside a handler:</p>
 * <ul>
 *   <li>{@code running}: the bound socket is open</li>
 *   <li>{@code gone}: teardown of the last {@code listen} call has completed</li>
 *   <li>{@code openConnections}: handlers currently dispatched</li>
 * </ul>
 *
 * <pre>
 *   Idle      running=false gone=false
 *   Listening running=true  gone=false
 *   Draining  running=true  gone=false  (run context cancelled)
 *   Closed    running=false gone=true
 * </pre>
 */
public final class ServerState
{
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean gone = new AtomicBoolean(false);
    private final AtomicLong openConnections = new AtomicLong(0);

    public boolean isRunning() {
        return running.get();
    }

    public boolean isGone() {
        return gone.get();
    }

    public long openConnections() {
        return openConnections.get();
    }

    /**
     * Enter the listening state. Only valid once the socket is bound.
     */
    public void markRunning() {
        gone.set(false);
        running.set(true);
    }

    /**
     * Enter the terminal state. Called on every exit path of {@code listen}.
     */
    public void markGone() {
        running.set(false);
        gone.set(true);
    }

    public void connectionOpened() {
        openConnections.incrementAndGet();
    }

    /**
     * Decrement, never below zero.
     */
    public void connectionClosed() {
        openConnections.updateAndGet(v -> v > 0 ? v - 1 : 0);
    }

    @Override
    public String toString() {
        return "ServerState[running=" + running.get() + ", gone=" + gone.get() + ", open=" + openConnections.get() + "]";
    }
}
