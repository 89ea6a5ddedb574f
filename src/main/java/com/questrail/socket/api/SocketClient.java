package com.questrail.socket.api;

import com.questrail.socket.context.ExecutionContext;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/**
 * SocketClient
 * =============================================================================
 * Uniform client contract owning a single outbound socket.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   Idle ── connect() ──▶ Connected ── close() ──▶ Closed
 * </pre>
 * <p>There is no draining phase: a client owns exactly one socket and no
 * background tasks. {@link #read} and {@link #write} fail with
 * {@link SocketError#CONNECTION} outside the connected state; so does
 * {@link #close()} when nothing is connected, which makes a second close
 * report an error rather than misbehave.</p>
 *
 * <h2>Datagram clients</h2>
 * <p>Connecting only binds a local ephemeral endpoint and records the target as
 * the default destination; it does not fail because nobody is listening.
 * {@link #setTls} is accepted and ignored.</p>
 */
public interface SocketClient extends Closeable
{
    NetworkProtocol protocol();

    /**
     * Configure transport security for the next {@link #connect}.
     */
    void setTls(boolean enabled, TlsConfig config, String serverName) throws SocketErrorException;

    /**
     * Dial the target. A previous connection, if any, is closed first.
     */
    void connect(ExecutionContext ctx) throws IOException;

    boolean isConnected();

    /**
     * @return bytes read, or {@code -1} at end of stream
     */
    int read(byte[] buffer) throws IOException;

    int read(byte[] buffer, int offset, int length) throws IOException;

    int write(byte[] buffer) throws IOException;

    int write(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Bound a single blocking read. {@code null} or zero disables the bound.
     */
    void setReadTimeout(Duration timeout);

    /**
     * One request/response exchange: connect if needed, write all of
     * {@code request}, hand the response stream to {@code response}, close.
     * Does not retry or loop.
     */
    void once(ExecutionContext ctx, InputStream request, ResponseHandler response) throws IOException;

    @Override
    void close() throws IOException;

    void registerInfo(InfoCallback callback);

    void registerError(ErrorCallback callback);
}
