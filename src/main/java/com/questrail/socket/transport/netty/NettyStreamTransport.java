package com.questrail.socket.transport.netty;

import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.TlsConfig;
import com.questrail.socket.context.Cancellable;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.transport.ListeningEndpoint;
import com.questrail.socket.transport.StreamAcceptListener;
import com.questrail.socket.transport.StreamOptions;
import com.questrail.socket.transport.StreamTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * NettyStreamTransport
 * =============================================================================
 * {@link StreamTransport} for TCP (NIO) and Unix stream sockets (epoll).
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   [tls: SslHandler]  [idle: IdleStateHandler]  bridge: NettyStreamConnection
 * </pre>
 * <p>The TLS stage is present when {@link StreamOptions#tls()} is set, the idle
 * stage (servers only) when an idle timeout is configured.</p>
 *
 * <h2>Threads</h2>
 * <p>A listening endpoint owns a one-thread accept group and a worker group.
 * A dialed connection owns a one-thread group that is shut down when the
 * connection is closed.</p>
 */
final class NettyStreamTransport implements StreamTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamTransport.class);

    private final NetworkProtocol protocol;
    private final StreamOptions options;

    NettyStreamTransport(NetworkProtocol protocol, StreamOptions options) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public ListeningEndpoint listen(SocketAddress local, ExecutionContext runContext, StreamAcceptListener listener)
            throws IOException {
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(runContext, "runContext");
        Objects.requireNonNull(listener, "listener");

        EventLoopGroup boss = NettyTransports.newGroup(protocol, 1, protocol.code() + "-accept");
        EventLoopGroup workers = NettyTransports.newGroup(protocol, 0, protocol.code() + "-io");

        TlsConfig tls = options.tls();
        Duration idle = options.idleTimeout();

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(boss, workers)
                .channel(NettyTransports.serverChannelType(protocol))
                .handler(new AcceptErrorHandler(listener))
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(options.readBufferSize()))
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (tls != null) {
                            p.addLast("tls", new SslHandler(tls.newServerEngine()));
                        }
                        if (idle != null) {
                            p.addLast("idle", new IdleStateHandler(0, 0, idle.toMillis(), TimeUnit.MILLISECONDS));
                        }
                        NettyStreamConnection connection =
                                new NettyStreamConnection(ch, runContext.child(), listener::onError, () -> { });
                        p.addLast("bridge", connection.bridge(() -> listener.onAccepted(connection)));
                    }
                });

        ChannelFuture bound = bootstrap.bind(NettyAddresses.toNetty(local)).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            NettyTransports.shutdown(workers, boss);
            throw NettyTransports.toIOException(bound.cause());
        }

        log.debug("{} listening on {}", protocol, bound.channel().localAddress());
        return new NettyListeningEndpoint(protocol, bound.channel(), boss, workers);
    }

    @Override
    public ConnectionContext dial(SocketAddress remote, ExecutionContext ctx, Consumer<Throwable> errors)
            throws IOException {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(errors, "errors");

        EventLoopGroup group = NettyTransports.newGroup(protocol, 1, protocol.code() + "-client");
        Runnable release = () -> NettyTransports.shutdownLater(group);
        TlsConfig tls = options.tls();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NettyTransports.socketChannelType(protocol))
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(options.readBufferSize()))
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (tls != null) {
                            p.addLast("tls", new SslHandler(tls.newClientEngine(options.serverName(), portOf(remote))));
                        }
                        NettyStreamConnection connection =
                                new NettyStreamConnection(ch, ExecutionContext.background().child(), errors, release);
                        p.addLast("bridge", connection.bridge(() -> { }));
                    }
                });

        ctx.remaining().ifPresent(d -> bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) Math.max(1L, Math.min(Integer.MAX_VALUE, d.toMillis()))));

        ChannelFuture connect = bootstrap.connect(NettyAddresses.toNetty(remote));
        awaitOrCancel(connect, connect.channel(), ctx, release, "connect to " + remote);
        if (!connect.isSuccess()) {
            release.run();
            throw NettyTransports.toIOException(connect.cause());
        }

        Channel ch = connect.channel();
        NettyStreamConnection connection = ch.attr(NettyStreamConnection.KEY).get();

        SslHandler ssl = ch.pipeline().get(SslHandler.class);
        if (ssl != null) {
            Future<Channel> handshake = ssl.handshakeFuture();
            try {
                awaitOrCancel(handshake, ch, ctx, release, "TLS handshake with " + remote);
            } catch (IOException e) {
                connection.close();
                throw e;
            }
            if (!handshake.isSuccess()) {
                connection.close();
                throw NettyTransports.toIOException(handshake.cause());
            }
        }
        return connection;
    }

    /**
     * Wait for {@code f}. Cancelling {@code ctx} closes {@code ch}, which fails
     * {@code f}; operations in flight cannot be cancelled directly once Netty
     * has started them. Failures other than cancellation are left for the caller.
     */
    private static void awaitOrCancel(Future<?> f, Channel ch, ExecutionContext ctx, Runnable release, String what)
            throws IOException {
        Cancellable detach = ctx.onCancel(() -> {
            if (!f.cancel(false)) {
                ch.close();
            }
        });
        try {
            f.await();
        } catch (InterruptedException e) {
            ch.close();
            release.run();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted during " + what);
        } finally {
            detach.cancel();
        }

        if (!f.isSuccess() && ctx.isCancelled()) {
            release.run();
            if (ctx.hasDeadline() && ctx.remaining().map(Duration::isZero).orElse(false)) {
                throw new SocketTimeoutException(what + " exceeded its deadline");
            }
            throw new IOException(what + " cancelled");
        }
    }

    private static int portOf(SocketAddress address) {
        return address instanceof InetSocketAddress ? ((InetSocketAddress) address).getPort() : -1;
    }

    /**
     * Accept failures are reported and otherwise ignored; the server channel stays open.
     */
    private static final class AcceptErrorHandler extends ChannelInboundHandlerAdapter {
        private final StreamAcceptListener listener;

        private AcceptErrorHandler(StreamAcceptListener listener) {
            this.listener = listener;
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            listener.onError(cause);
        }
    }
}
