package com.questrail.socket.server.tcp;

import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.core.SocketAddresses;
import com.questrail.socket.server.AbstractStreamServer;
import com.questrail.socket.transport.StreamOptions;

import java.net.SocketAddress;
import java.util.EnumSet;

/**
 * TCP server ({@code tcp}, {@code tcp4}, {@code tcp6}).
 *
 * <p>The only server type where {@link #setTls} has an effect: every accepted
 * connection then completes a TLS handshake before the handler reads.</p>
 */
public final class TcpServer extends AbstractStreamServer
{
    public TcpServer(ConnectionCustomizer customizer, ConnectionHandler handler,
                     NetworkProtocol protocol, int readBufferSize) throws SocketErrorException {
        super(customizer, handler, protocol, readBufferSize,
                EnumSet.of(NetworkProtocol.TCP, NetworkProtocol.TCP4, NetworkProtocol.TCP6));
    }

    @Override
    protected SocketAddress parseAddress(String address) throws SocketErrorException {
        return SocketAddresses.bindAddress(address, protocol);
    }

    @Override
    protected StreamOptions streamOptions() {
        return new StreamOptions(readBufferSize, idleTimeout(), tls(), null);
    }
}
