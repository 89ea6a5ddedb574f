package com.questrail.socket.server.udp;

import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.core.SocketAddresses;
import com.questrail.socket.server.AbstractDatagramServer;

import java.net.SocketAddress;
import java.util.EnumSet;

/**
 * UDP server ({@code udp}, {@code udp4}, {@code udp6}). TLS settings are accepted and ignored.
 */
public final class UdpServer extends AbstractDatagramServer
{
    public UdpServer(ConnectionCustomizer customizer, ConnectionHandler handler,
                     NetworkProtocol protocol, int readBufferSize) throws SocketErrorException {
        super(customizer, handler, protocol, readBufferSize,
                EnumSet.of(NetworkProtocol.UDP, NetworkProtocol.UDP4, NetworkProtocol.UDP6));
    }

    @Override
    protected SocketAddress parseAddress(String address) throws SocketErrorException {
        return SocketAddresses.bindAddress(address, protocol);
    }
}
