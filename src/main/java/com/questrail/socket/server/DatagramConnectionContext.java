package com.questrail.socket.server;

import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.transport.Datagram;
import com.questrail.socket.transport.DatagramEndpoint;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DatagramConnectionContext
 * -----------------------------------------------------------------------------
 * The single {@link ConnectionContext} of a datagram server.
 *
 * <p>{@link #read} receives the next datagram from any peer and records the
 * sender; {@link #write} sends to the most recently recorded sender. A
 * datagram longer than the read buffer is truncated, as with any datagram
 * socket read.</p>
 *
 * <p>{@link #close()} marks the context closed and leaves the socket open;
 * the socket belongs to the server.</p>
 */
final class DatagramConnectionContext implements ConnectionContext
{
    private final DatagramEndpoint endpoint;
    private final ExecutionContext context;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile SocketAddress remote;
    private volatile Duration readTimeout;

    DatagramConnectionContext(DatagramEndpoint endpoint, ExecutionContext context) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public int read(byte[] buffer) throws IOException {
        return read(buffer, 0, buffer.length);
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (closed.get()) {
            return -1;
        }

        Datagram d = endpoint.receive(readTimeout);
        if (d == null) {
            return -1;
        }

        remote = d.sender();
        int n = Math.min(length, d.payload().length);
        System.arraycopy(d.payload(), 0, buffer, offset, n);
        return n;
    }

    @Override
    public int write(byte[] buffer) throws IOException {
        return write(buffer, 0, buffer.length);
    }

    @Override
    public int write(byte[] buffer, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (closed.get()) {
            throw new ClosedChannelException();
        }

        SocketAddress to = remote;
        if (to == null) {
            throw new IOException("no peer to reply to: nothing received yet, or the sender has no address");
        }
        endpoint.send(to, buffer, offset, length);
        return length;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            context.cancel();
        }
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && endpoint.isOpen();
    }

    @Override
    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    @Override
    public SocketAddress remoteAddress() {
        return remote;
    }

    @Override
    public void setReadTimeout(Duration timeout) {
        this.readTimeout = timeout;
    }

    @Override
    public ExecutionContext context() {
        return context;
    }
}
