package com.questrail.socket.api;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.SocketOption;

/**
 * View of a freshly bound server socket handed to a {@link ConnectionCustomizer}.
 */
public interface BoundSocket
{
    NetworkProtocol protocol();

    SocketAddress localAddress();

    /**
     * Set a socket option, e.g. {@link java.net.StandardSocketOptions#SO_RCVBUF}.
     *
     * @throws UnsupportedOperationException if the transport does not support the option
     * @throws IOException if the operating system rejects the value
     */
    <T> void setOption(SocketOption<T> option, T value) throws IOException;

    /**
     * @throws UnsupportedOperationException if the transport does not support the option
     */
    <T> T getOption(SocketOption<T> option) throws IOException;
}
