package com.questrail.socket.transport;

import com.questrail.socket.api.BoundSocket;

import java.net.SocketAddress;

/**
 * ListeningEndpoint
 * -----------------------------------------------------------------------------
 * A bound server socket, as seen by the server lifecycle code.
 *
 * <p>Two levels of shutdown exist because draining needs them:
 * {@link #closeListener()} stops taking new work (for a stream socket it
 * unblocks the pending accept) while accepted connections stay usable;
 * {@link #close()} releases everything the endpoint owns.</p>
 */
public interface ListeningEndpoint
{
    SocketAddress localAddress();

    BoundSocket boundSocket();

    /**
     * Close the listening socket. Idempotent.
     */
    void closeListener();

    /**
     * Run {@code action} once the listening socket is closed, whatever the
     * reason. Runs immediately if it already is.
     */
    void onListenerClosed(Runnable action);

    /**
     * Close the listening socket and every connection and thread it owns. Idempotent.
     */
    void close();
}
