package com.questrail.socket.transport.netty;

import com.questrail.socket.api.BoundSocket;
import com.questrail.socket.api.NetworkProtocol;

import io.netty.channel.Channel;
import io.netty.channel.ChannelException;
import io.netty.channel.ChannelOption;
import io.netty.channel.socket.nio.NioChannelOption;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.SocketOption;

/**
 * {@link BoundSocket} over a bound Netty channel.
 *
 * <p>NIO channels accept any {@link SocketOption} their JDK channel supports.
 * Native (epoll) channels accept the options Netty knows by the same name,
 * e.g. {@code SO_RCVBUF} and {@code SO_SNDBUF}.</p>
 */
final class NettyBoundSocket implements BoundSocket
{
    private final NetworkProtocol protocol;
    private final Channel channel;

    NettyBoundSocket(NetworkProtocol protocol, Channel channel) {
        this.protocol = protocol;
        this.channel = channel;
    }

    @Override
    public NetworkProtocol protocol() {
        return protocol;
    }

    @Override
    public SocketAddress localAddress() {
        return NettyAddresses.toJdk(channel.localAddress());
    }

    @Override
    public <T> void setOption(SocketOption<T> option, T value) throws IOException {
        ChannelOption<T> o = channelOption(option);
        try {
            if (!channel.config().setOption(o, value)) {
                throw new UnsupportedOperationException(option.name() + " not supported on " + protocol);
            }
        } catch (ChannelException e) {
            throw NettyTransports.toIOException(e);
        }
    }

    @Override
    public <T> T getOption(SocketOption<T> option) throws IOException {
        ChannelOption<T> o = channelOption(option);
        try {
            T value = channel.config().getOption(o);
            if (value == null) {
                throw new UnsupportedOperationException(option.name() + " not supported on " + protocol);
            }
            return value;
        } catch (ChannelException e) {
            throw NettyTransports.toIOException(e);
        }
    }

    private <T> ChannelOption<T> channelOption(SocketOption<T> option) {
        if (!protocol.isUnix()) {
            return NioChannelOption.of(option);
        }
        if (ChannelOption.exists(option.name())) {
            return ChannelOption.valueOf(option.name());
        }
        throw new UnsupportedOperationException(option.name() + " not supported on " + protocol);
    }
}
