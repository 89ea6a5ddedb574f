package com.questrail.socket.api;

import java.net.SocketAddress;

/**
 * Receives connection state transitions from a server or client.
 *
 * <p>Either address may be {@code null} when it is not known yet (for example
 * the local address of a client that is still dialing).</p>
 */
@FunctionalInterface
public interface InfoCallback
{
    void onInfo(SocketAddress local, SocketAddress remote, ConnState state);
}
