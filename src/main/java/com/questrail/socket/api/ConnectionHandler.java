package com.questrail.socket.api;

/**
 * Server-side connection handler.
 *
 * <p>Invoked once per accepted stream connection, or once for the whole lifetime
 * of a datagram server. Implementations typically loop reading and writing
 * through the {@link ConnectionContext} until a read reports end of stream or
 * fails, then return. Returning hands the connection back to the framework,
 * which closes it and decrements the open-connection counter.</p>
 */
@FunctionalInterface
public interface ConnectionHandler
{
    void handle(ConnectionContext connection);
}
