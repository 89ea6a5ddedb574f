package com.questrail.socket.transport.netty;

import com.questrail.socket.api.BoundSocket;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.transport.Datagram;
import com.questrail.socket.transport.DatagramEndpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.AddressedEnvelope;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.unix.DomainDatagramPacket;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port, for UDP
 * (NIO) and Unix datagram sockets (epoll).
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not track
 * peers, buffer partial reads or interpret payloads; that belongs to the
 * server and client layers above it.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and queued as
 * {@link Datagram}s. All reference-counted buffers are released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #bind} binds the socket; nothing is read until {@link #receive} asks.
 * - {@link #close()} closes the channel and shuts down the event loop group.
 */
final class NettyDatagramEndpoint implements DatagramEndpoint
{
    private static final Object END = new Object();

    private final NetworkProtocol protocol;
    private final EventLoopGroup group;
    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private volatile Channel channel;

    private NettyDatagramEndpoint(NetworkProtocol protocol, EventLoopGroup group) {
        this.protocol = protocol;
        this.group = group;
    }

    static NettyDatagramEndpoint bind(NetworkProtocol protocol, SocketAddress local, int readBufferSize)
            throws IOException {
        Objects.requireNonNull(local, "local");

        // A dedicated group keeps the endpoint self-contained.
        EventLoopGroup group = NettyTransports.newGroup(protocol, 1, protocol.code() + "-datagram");
        NettyDatagramEndpoint endpoint = new NettyDatagramEndpoint(protocol, group);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NettyTransports.datagramChannelType(protocol))
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(readBufferSize))
                .handler(endpoint.new InboundHandler());

        ChannelFuture f = bootstrap.bind(NettyAddresses.toNetty(local)).awaitUninterruptibly();
        if (!f.isSuccess()) {
            NettyTransports.shutdown(group);
            throw NettyTransports.toIOException(f.cause());
        }

        endpoint.channel = f.channel();
        endpoint.channel.closeFuture().addListener(x -> endpoint.end());
        return endpoint;
    }

    @Override
    public Datagram receive(Duration timeout) throws IOException {
        Object item = inbound.poll();
        if (item == null) {
            channel.read();
            item = take(timeout);
        }

        if (item == END) {
            inbound.add(END);
            return null;
        }
        if (item instanceof Throwable) {
            throw NettyTransports.toIOException((Throwable) item);
        }
        return (Datagram) item;
    }

    @Override
    public void send(SocketAddress remote, byte[] payload, int offset, int length) throws IOException {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        Objects.checkFromIndexSize(offset, length, payload.length);

        Channel ch = channel;
        if (!ch.isActive()) {
            throw new ClosedChannelException();
        }

        ByteBuf buf = Unpooled.copiedBuffer(payload, offset, length);
        Object packet = protocol.isUnix()
                ? new DomainDatagramPacket(buf, (DomainSocketAddress) NettyAddresses.toNetty(remote))
                : new DatagramPacket(buf, (InetSocketAddress) remote);

        ChannelFuture f = ch.writeAndFlush(packet);
        try {
            f.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while sending to " + remote);
        }
        if (!f.isSuccess()) {
            throw NettyTransports.toIOException(f.cause());
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
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
        end();
        NettyTransports.shutdown(group);
    }

    private void end() {
        if (ended.compareAndSet(false, true)) {
            inbound.add(END);
        }
    }

    private Object take(Duration timeout) throws IOException {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return inbound.take();
            }
            Object item = inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (item == null) {
                throw new SocketTimeoutException("receive timed out after " + timeout.toMillis() + " ms");
            }
            return item;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for a datagram");
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Queues each received packet as a {@link Datagram}. Socket errors are
     * queued too and do not close the channel: a datagram socket stays usable
     * after, for example, an ICMP port-unreachable report.
     */
    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            try {
                if (msg instanceof AddressedEnvelope) {
                    AddressedEnvelope<?, ?> envelope = (AddressedEnvelope<?, ?>) msg;
                    if (envelope.content() instanceof ByteBuf) {
                        byte[] bytes = ByteBufUtil.getBytes((ByteBuf) envelope.content());
                        inbound.add(new Datagram(NettyAddresses.toJdk(envelope.sender()), bytes));
                    }
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            end();
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            inbound.add(cause);
        }
    }
}
