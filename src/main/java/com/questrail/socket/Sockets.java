package com.questrail.socket;

import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketClient;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.SocketServer;
import com.questrail.socket.api.UnixSocketServer;
import com.questrail.socket.client.tcp.TcpClient;
import com.questrail.socket.client.udp.UdpClient;
import com.questrail.socket.client.unix.UnixClient;
import com.questrail.socket.client.unixgram.UnixgramClient;
import com.questrail.socket.config.ClientConfig;
import com.questrail.socket.config.ServerConfig;
import com.questrail.socket.core.SocketDefaults;
import com.questrail.socket.server.AbstractStreamServer;
import com.questrail.socket.server.tcp.TcpServer;
import com.questrail.socket.server.udp.UdpServer;
import com.questrail.socket.server.unix.UnixServer;
import com.questrail.socket.server.unixgram.UnixgramServer;
import com.questrail.socket.transport.netty.NettyTransports;

/**
 * Sockets
 * =============================================================================
 * Composition root: picks the concrete server or client type for a
 * {@link NetworkProtocol}.
 *
 * <pre>
 *   tcp, tcp4, tcp6  → TcpServer / TcpClient
 *   udp, udp4, udp6  → UdpServer / UdpClient
 *   unix             → UnixServer / UnixClient
 *   unixgram         → UnixgramServer / UnixgramClient
 * </pre>
 */
public final class Sockets
{
    private Sockets() {
    }

    /**
     * @return whether {@code protocol} can be used on this host; Unix
     *         transports need the native epoll transport (Linux)
     */
    public static boolean isSupported(NetworkProtocol protocol) {
        return protocol != null && NettyTransports.isSupported(protocol);
    }

    /**
     * Create a server and register {@code address} on it.
     *
     * @param customizer optional hook run once on the bound socket
     */
    public static SocketServer newServer(NetworkProtocol protocol, String address, ConnectionHandler handler,
                                         ConnectionCustomizer customizer) throws SocketErrorException {
        SocketServer server = create(protocol, handler, customizer, SocketDefaults.DEFAULT_BUFFER_SIZE);
        server.registerServer(address);
        return server;
    }

    public static SocketServer newServer(ServerConfig config, ConnectionHandler handler,
                                         ConnectionCustomizer customizer) throws SocketErrorException {
        config.validate();

        SocketServer server = create(config.network(), handler, customizer, config.readBufferSize());
        if (server instanceof UnixSocketServer unix) {
            if (config.groupId() != null) {
                unix.registerSocket(config.address(), config.permission(), config.groupId());
            } else {
                unix.registerSocket(config.address(), config.permission());
            }
        } else {
            server.registerServer(config.address());
        }

        if (config.tls() != null) {
            server.setTls(true, config.tls());
        }
        if (server instanceof AbstractStreamServer stream) {
            stream.setIdleTimeout(config.idleTimeout());
        }
        return server;
    }

    public static SocketClient newClient(NetworkProtocol protocol, String address) throws SocketErrorException {
        if (protocol == null) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, "no network given");
        }
        return switch (protocol) {
            case TCP, TCP4, TCP6 -> new TcpClient(protocol, address);
            case UDP, UDP4, UDP6 -> new UdpClient(protocol, address);
            case UNIX -> new UnixClient(protocol, address);
            case UNIX_GRAM -> new UnixgramClient(protocol, address);
        };
    }

    public static SocketClient newClient(ClientConfig config) throws SocketErrorException {
        config.validate();
        SocketClient client = newClient(config.network(), config.address());
        if (config.tls() != null) {
            client.setTls(true, config.tls(), config.serverName());
        }
        return client;
    }

    private static SocketServer create(NetworkProtocol protocol, ConnectionHandler handler,
                                       ConnectionCustomizer customizer, int readBufferSize)
            throws SocketErrorException {
        if (protocol == null) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, "no network given");
        }
        return switch (protocol) {
            case TCP, TCP4, TCP6 -> new TcpServer(customizer, handler, protocol, readBufferSize);
            case UDP, UDP4, UDP6 -> new UdpServer(customizer, handler, protocol, readBufferSize);
            case UNIX -> new UnixServer(customizer, handler, protocol, readBufferSize);
            case UNIX_GRAM -> new UnixgramServer(customizer, handler, protocol, readBufferSize);
        };
    }
}
