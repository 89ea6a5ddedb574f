package com.questrail.socket.api;

/**
 * Receives errors observed by a server or client.
 *
 * <p>This is the only channel through which failures inside spawned tasks
 * (accepted connections, the datagram receive task) become visible.
 * Implementations are never handed {@code null} entries.</p>
 */
@FunctionalInterface
public interface ErrorCallback
{
    void onError(Throwable... errors);
}
