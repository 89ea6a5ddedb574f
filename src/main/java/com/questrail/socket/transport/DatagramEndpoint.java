package com.questrail.socket.transport;

import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a bound datagram socket (UDP, Unix datagram).
 *
 * <p>Reception is pull-based so it can back the blocking
 * {@code ConnectionContext.read}: nothing is read from the socket until
 * {@link #receive} asks for it. Each received datagram is delivered whole, as
 * one unit; no streaming assumptions are made at this boundary.</p>
 *
 * <p>The endpoint is meant to be driven by a single task. Implementations may be
 * backed by Netty, java.nio, or a test double.</p>
 */
public interface DatagramEndpoint extends ListeningEndpoint
{
    /**
     * Block until the next datagram arrives.
     *
     * @param timeout bound on the wait; {@code null} or zero waits indefinitely
     * @return the datagram, or {@code null} once the endpoint is closed
     * @throws java.net.SocketTimeoutException when the bound expires
     * @throws IOException a failure reported by the socket since the last receive
     */
    Datagram receive(Duration timeout) throws IOException;

    /**
     * Send one datagram to {@code remote}.
     */
    void send(SocketAddress remote, byte[] payload, int offset, int length) throws IOException;

    boolean isOpen();
}
