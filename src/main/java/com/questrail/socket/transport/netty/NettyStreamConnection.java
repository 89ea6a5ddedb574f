package com.questrail.socket.transport.netty;

import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.context.ExecutionContext;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * NettyStreamConnection
 * =============================================================================
 * {@link ConnectionContext} over one Netty stream channel (accepted or dialed).
 *
 * <h2>Blocking bridge</h2>
 * <p>The channel runs with auto-read disabled; {@link #read} pulls through an
 * {@link InboundQueue} that requests one channel read at a time. {@link #write}
 * waits for the write to complete, so the caller observes its own writes in
 * order and sees failures at the call site.</p>
 *
 * <h2>Netty containment</h2>
 * <p>Inbound buffers are copied into {@code byte[]} and released on the event
 * loop; addresses are converted to JDK types before they leave.</p>
 *
 * <h2>Ownership</h2>
 * <p>{@code release} runs once after the channel is closed through
 * {@link #close()}. Dialed connections use it to shut down their private event
 * loop; accepted connections pass a no-op.</p>
 */
final class NettyStreamConnection implements ConnectionContext
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamConnection.class);

    static final AttributeKey<NettyStreamConnection> KEY =
            AttributeKey.valueOf(NettyStreamConnection.class, "connection");

    private final Channel channel;
    private final InboundQueue inbound;
    private final ExecutionContext context;
    private final Consumer<Throwable> errors;
    private final Runnable release;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Duration readTimeout;

    NettyStreamConnection(Channel channel, ExecutionContext context, Consumer<Throwable> errors, Runnable release) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.context = Objects.requireNonNull(context, "context");
        this.errors = Objects.requireNonNull(errors, "errors");
        this.release = Objects.requireNonNull(release, "release");
        this.inbound = new InboundQueue(channel::read);

        channel.attr(KEY).set(this);
        channel.closeFuture().addListener(f -> {
            inbound.end();
            context.cancel();
        });
    }

    /**
     * Pipeline handler feeding this connection.
     *
     * @param onActive run on the event loop once the channel is active
     */
    ChannelHandler bridge(Runnable onActive) {
        return new Bridge(onActive);
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
        return inbound.read(buffer, offset, length, readTimeout);
    }

    @Override
    public int write(byte[] buffer) throws IOException {
        return write(buffer, 0, buffer.length);
    }

    @Override
    public int write(byte[] buffer, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (closed.get() || !channel.isActive()) {
            throw new ClosedChannelException();
        }
        if (length == 0) {
            return 0;
        }

        ChannelFuture f = channel.writeAndFlush(Unpooled.copiedBuffer(buffer, offset, length));
        try {
            f.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while writing");
        }
        if (!f.isSuccess()) {
            throw NettyTransports.toIOException(f.cause());
        }
        return length;
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        ChannelFuture f = channel.close().awaitUninterruptibly();
        inbound.end();
        context.cancel();
        release.run();

        if (!f.isSuccess()) {
            throw NettyTransports.toIOException(f.cause());
        }
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && channel.isActive();
    }

    @Override
    public SocketAddress localAddress() {
        return NettyAddresses.toJdk(channel.localAddress());
    }

    @Override
    public SocketAddress remoteAddress() {
        return NettyAddresses.toJdk(channel.remoteAddress());
    }

    @Override
    public void setReadTimeout(Duration timeout) {
        this.readTimeout = timeout;
    }

    @Override
    public ExecutionContext context() {
        return context;
    }

    @Override
    public String toString() {
        return "NettyStreamConnection[" + localAddress() + " <-> " + remoteAddress() + "]";
    }

    private final class Bridge extends ChannelInboundHandlerAdapter {
        private final Runnable onActive;

        private Bridge(Runnable onActive) {
            this.onActive = onActive;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            // A TLS handshake needs inbound traffic before the handler asks for any.
            if (ctx.pipeline().get(SslHandler.class) != null) {
                ctx.read();
            }
            onActive.run();
            ctx.fireChannelActive();
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            try {
                if (msg instanceof ByteBuf) {
                    inbound.offer(ByteBufUtil.getBytes((ByteBuf) msg));
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            inbound.end();
            ctx.fireChannelInactive();
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) {
            if (evt instanceof IdleStateEvent) {
                log.debug("Closing idle connection {}", ctx.channel().remoteAddress());
                ctx.close();
                return;
            }
            ctx.fireUserEventTriggered(evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            inbound.fail(cause);
            errors.accept(cause);
            ctx.close();
        }
    }
}
