package com.questrail.socket.api;

import com.questrail.socket.context.ExecutionContext;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * SocketServer
 * =============================================================================
 * Uniform server contract over TCP, UDP, Unix stream and Unix datagram sockets.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   Idle ── listen() ──▶ Listening ── cancel / shutdown() ──▶ Draining ──▶ Closed
 * </pre>
 * <p>The state is observable through two independent flags:
 * {@link #isRunning()} is {@code true} only while the bound socket is open, and
 * {@link #isGone()} becomes {@code true} once {@link #listen} has finished
 * tearing down, on every exit path including failures.</p>
 *
 * <h2>Error reporting</h2>
 * <p>Failures that end a {@code listen} call are thrown <em>and</em> passed to the
 * error callback. Failures of a single connection (one accept, one handler)
 * are only passed to the error callback and never stop the server; callers
 * that register no error callback do not see them.</p>
 *
 * <h2>Callbacks</h2>
 * <p>Each {@code register*} call replaces the previous callback; {@code null}
 * disables it. Compose several observers before registering if needed.</p>
 */
public interface SocketServer extends Closeable
{
    NetworkProtocol protocol();

    /**
     * Validate and store the bind address without opening a socket.
     *
     * @throws SocketErrorException {@link SocketError#INVALID_ADDRESS} on empty
     *         or unparsable input
     */
    void registerServer(String address) throws SocketErrorException;

    /**
     * Enable or disable TLS for connections accepted by subsequent
     * {@link #listen} calls. Transports without a security layer accept the
     * call and ignore it.
     *
     * @throws SocketErrorException {@link SocketError#INVALID_TLS_CONFIG} when
     *         enabling without a configuration
     */
    void setTls(boolean enabled, TlsConfig config) throws SocketErrorException;

    /**
     * Bind and serve until {@code ctx} is cancelled or {@link #shutdown} is called.
     *
     * <p>Returns normally when the server was asked to stop; cancellation is not
     * an error.</p>
     *
     * @throws SocketErrorException for configuration errors (no address, no handler)
     * @throws IOException the operating-system error if binding fails
     */
    void listen(ExecutionContext ctx) throws IOException;

    /**
     * Request graceful termination, equivalent to cancelling the context passed
     * to {@link #listen}, then wait for the server to drain.
     *
     * <p>Safe to call several times. Called before {@code listen} it is
     * remembered, and the next {@code listen} call stops right after binding.</p>
     *
     * @throws SocketErrorException {@link SocketError#SHUTDOWN_TIMEOUT} if the
     *         server is still running or has open connections when the wait
     *         bound expires
     */
    void shutdown(ExecutionContext ctx) throws IOException;

    /**
     * Same as {@code shutdown(ExecutionContext.background())}.
     */
    @Override
    default void close() throws IOException {
        shutdown(ExecutionContext.background());
    }

    boolean isRunning();

    boolean isGone();

    long openConnections();

    /**
     * @return the address actually bound while running (useful with port 0)
     */
    Optional<SocketAddress> boundAddress();

    void registerInfo(InfoCallback callback);

    void registerError(ErrorCallback callback);

    void registerServerInfo(ServerInfoCallback callback);
}
