package com.questrail.socket.transport;

import com.questrail.socket.api.ConnectionContext;

/**
 * Callback sink for a stream {@link ListeningEndpoint}.
 *
 * <p>Called on transport I/O threads: implementations must hand work off and
 * return quickly.</p>
 */
public interface StreamAcceptListener
{
    /**
     * A connection was accepted. The listener takes ownership of {@code connection}.
     */
    void onAccepted(ConnectionContext connection);

    /**
     * A single accept or a single connection failed. Never fatal for the endpoint.
     */
    void onError(Throwable cause);
}
