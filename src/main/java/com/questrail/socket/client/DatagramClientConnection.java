package com.questrail.socket.client;

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
 * Client side of a datagram "connection": a locally bound endpoint plus the
 * fixed default destination. Every write is one datagram to the target; every
 * read returns one received datagram, truncated to the buffer.
 *
 * <p>Unlike the server context this one owns its endpoint and closes it.</p>
 */
final class DatagramClientConnection implements ConnectionContext
{
    private final DatagramEndpoint endpoint;
    private final SocketAddress target;
    private final ExecutionContext context;
    private final Runnable onClose;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Duration readTimeout;

    DatagramClientConnection(DatagramEndpoint endpoint, SocketAddress target, ExecutionContext context,
                             Runnable onClose) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.target = Objects.requireNonNull(target, "target");
        this.context = Objects.requireNonNull(context, "context");
        this.onClose = Objects.requireNonNull(onClose, "onClose");
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
        endpoint.send(target, buffer, offset, length);
        return length;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            endpoint.close();
        } finally {
            context.cancel();
            onClose.run();
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
        return target;
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
