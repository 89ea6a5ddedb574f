package com.questrail.socket.api;

import com.questrail.socket.context.ExecutionContext;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;

/**
 * ConnectionContext
 * =============================================================================
 * Transport-agnostic handle on one active communication channel, passed to a
 * {@link ConnectionHandler}.
 *
 * <h2>Stream transports</h2>
 * <p>One context per accepted connection. {@link #read} and {@link #write}
 * delegate to the connection in the order the handler issues them, with no
 * extra buffering layer. {@link #close()} closes the accepted socket. The
 * remote address is fixed for the lifetime of the connection.</p>
 *
 * <h2>Datagram transports</h2>
 * <p>One shared context for the server's single handler invocation.
 * {@link #read} receives the next datagram from any peer and records that peer
 * as the current remote; {@link #write} sends to the recorded peer. This "last
 * sender becomes next recipient" rule is what lets the same read-request /
 * write-response handler work on both kinds of transport. {@link #close()} only
 * marks the context closed: the socket belongs to the server.</p>
 *
 * <h2>Threading</h2>
 * <p>A context is owned by the single task running its handler. It is not safe
 * for concurrent reads or concurrent writes from several threads.</p>
 */
public interface ConnectionContext extends Closeable
{
    /**
     * Read into {@code buffer}.
     *
     * @return number of bytes read, or {@code -1} at end of stream (or when the
     *         context was closed)
     * @throws java.net.SocketTimeoutException if a read timeout is set and expires
     */
    int read(byte[] buffer) throws IOException;

    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Write all of {@code buffer}.
     *
     * @return number of bytes written
     */
    int write(byte[] buffer) throws IOException;

    int write(byte[] buffer, int offset, int length) throws IOException;

    @Override
    void close() throws IOException;

    boolean isConnected();

    SocketAddress localAddress();

    /**
     * @return the peer; for datagram contexts the sender of the most recently
     *         received datagram, {@code null} before the first one
     */
    SocketAddress remoteAddress();

    /**
     * Bound a single blocking read. {@code null} or zero disables the bound.
     */
    void setReadTimeout(Duration timeout);

    /**
     * @return execution context cancelled when the server starts draining or the
     *         connection closes
     */
    ExecutionContext context();
}
