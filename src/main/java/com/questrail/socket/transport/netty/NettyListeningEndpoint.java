package com.questrail.socket.transport.netty;

import com.questrail.socket.api.BoundSocket;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.transport.ListeningEndpoint;

import io.netty.channel.Channel;
import io.netty.channel.EventLoopGroup;

import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bound Netty server channel plus the two event loop groups serving it.
 *
 * <p>{@link #closeListener()} only closes the server channel and never
 * blocks, because it can run on an event loop (through a cancellation
 * listener). {@link #close()} also shuts the worker group down, which closes
 * every accepted connection still open.</p>
 */
final class NettyListeningEndpoint implements ListeningEndpoint
{
    private final NetworkProtocol protocol;
    private final Channel channel;
    private final EventLoopGroup boss;
    private final EventLoopGroup workers;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    NettyListeningEndpoint(NetworkProtocol protocol, Channel channel, EventLoopGroup boss, EventLoopGroup workers) {
        this.protocol = protocol;
        this.channel = channel;
        this.boss = boss;
        this.workers = workers;
    }

    @Override
    public SocketAddress localAddress() {
        return NettyAddresses.toJdk(channel.localAddress());
    }

    @Override
    public BoundSocket boundSocket() {
        return new NettyBoundSocket(protocol, channel);
    }

    @Override
    public void closeListener() {
        channel.close();
    }

    @Override
    public void onListenerClosed(Runnable action) {
        channel.closeFuture().addListener(f -> action.run());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close().awaitUninterruptibly();
        NettyTransports.shutdown(workers, boss);
    }
}
