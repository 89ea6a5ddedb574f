package com.questrail.socket.transport;

import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.context.ExecutionContext;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.function.Consumer;

/**
 * StreamTransport
 * =============================================================================
 * Port for connection-oriented sockets (TCP, Unix stream).
 *
 * <p>Everything above this port sees only {@link ConnectionContext},
 * {@link SocketAddress} and {@code byte[]}; the implementation owns its I/O
 * threads and the wire.</p>
 *
 * <h2>Ownership</h2>
 * <p>An endpoint returned by {@link #listen} owns the threads serving its
 * connections and releases them on {@link ListeningEndpoint#close()}. A
 * connection returned by {@link #dial} owns its threads and releases them when
 * closed.</p>
 */
public interface StreamTransport
{
    /**
     * Bind and start accepting.
     *
     * @param runContext parent of every accepted connection's context
     * @throws IOException the operating-system error if binding fails
     */
    ListeningEndpoint listen(SocketAddress local, ExecutionContext runContext, StreamAcceptListener listener)
            throws IOException;

    /**
     * Open an outbound connection, honouring the deadline and cancellation of {@code ctx}.
     *
     * @param errors receives asynchronous failures of the connection
     */
    ConnectionContext dial(SocketAddress remote, ExecutionContext ctx, Consumer<Throwable> errors)
            throws IOException;
}
