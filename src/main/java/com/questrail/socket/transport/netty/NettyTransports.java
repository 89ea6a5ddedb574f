package com.questrail.socket.transport.netty;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.transport.DatagramEndpoint;
import com.questrail.socket.transport.StreamOptions;
import com.questrail.socket.transport.StreamTransport;

import io.netty.channel.Channel;
import io.netty.channel.ChannelException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainDatagramChannel;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * NettyTransports
 * =============================================================================
 * Composition point for the Netty-backed transports.
 *
 * <p>IP protocols run on the NIO transport. Unix stream and Unix datagram
 * sockets need the native epoll transport, which only exists on Linux; on
 * other platforms {@link #isSupported(NetworkProtocol)} is {@code false} for
 * them and the factories fail with {@link SocketError#INVALID_PROTOCOL}.</p>
 *
 * <p>Every endpoint gets its own event loop group with daemon threads, so an
 * endpoint can be released completely without coordinating with others.</p>
 */
public final class NettyTransports
{
    static final long SHUTDOWN_QUIET_MILLIS = 0;
    static final long SHUTDOWN_TIMEOUT_MILLIS = 2_000;

    private NettyTransports() {
    }

    public static boolean isSupported(NetworkProtocol protocol) {
        return !protocol.isUnix() || Epoll.isAvailable();
    }

    public static StreamTransport stream(NetworkProtocol protocol, StreamOptions options) throws SocketErrorException {
        Objects.requireNonNull(options, "options");
        if (!protocol.isStream()) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, protocol + " is not a stream protocol");
        }
        requireSupported(protocol);
        return new NettyStreamTransport(protocol, options);
    }

    /**
     * Bind a datagram socket at {@code local}.
     *
     * @param readBufferSize largest datagram received whole; longer ones are truncated
     */
    public static DatagramEndpoint bindDatagram(NetworkProtocol protocol, SocketAddress local, int readBufferSize)
            throws IOException {
        if (protocol.isStream()) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, protocol + " is not a datagram protocol");
        }
        requireSupported(protocol);
        return NettyDatagramEndpoint.bind(protocol, local, readBufferSize);
    }

    static void requireSupported(NetworkProtocol protocol) throws SocketErrorException {
        if (!isSupported(protocol)) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL,
                    protocol + " requires the native epoll transport", Epoll.unavailabilityCause());
        }
    }

    /**
     * @param threads {@code 0} for Netty's default
     */
    static EventLoopGroup newGroup(NetworkProtocol protocol, int threads, String name) {
        ThreadFactory threadFactory = new DefaultThreadFactory(name, true);
        if (protocol.isUnix()) {
            return new EpollEventLoopGroup(threads, threadFactory);
        }
        return new NioEventLoopGroup(threads, threadFactory);
    }

    static Class<? extends ServerChannel> serverChannelType(NetworkProtocol protocol) {
        return protocol.isUnix() ? EpollServerDomainSocketChannel.class : NioServerSocketChannel.class;
    }

    static Class<? extends Channel> socketChannelType(NetworkProtocol protocol) {
        return protocol.isUnix() ? EpollDomainSocketChannel.class : NioSocketChannel.class;
    }

    static Class<? extends Channel> datagramChannelType(NetworkProtocol protocol) {
        return protocol.isUnix() ? EpollDomainDatagramChannel.class : NioDatagramChannel.class;
    }

    /**
     * Shut the groups down and wait, bounded, for their threads to finish.
     * Must not be called from one of their own event loops.
     */
    static void shutdown(EventLoopGroup... groups) {
        Future<?>[] pending = new Future<?>[groups.length];
        for (int i = 0; i < groups.length; i++) {
            pending[i] = groups[i].shutdownGracefully(SHUTDOWN_QUIET_MILLIS, SHUTDOWN_TIMEOUT_MILLIS,
                    TimeUnit.MILLISECONDS);
        }
        for (Future<?> f : pending) {
            f.awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS + 1_000);
        }
    }

    /**
     * Shut the group down without waiting. Safe from any thread.
     */
    static void shutdownLater(EventLoopGroup group) {
        group.shutdownGracefully(SHUTDOWN_QUIET_MILLIS, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    }

    /**
     * Netty reports operating-system failures either directly or wrapped in
     * {@link ChannelException}; callers of this package only see {@link IOException}.
     */
    static IOException toIOException(Throwable cause) {
        if (cause instanceof IOException) {
            return (IOException) cause;
        }
        if (cause instanceof ChannelException && cause.getCause() instanceof IOException) {
            return (IOException) cause.getCause();
        }
        return new IOException(cause.getMessage(), cause);
    }
}
