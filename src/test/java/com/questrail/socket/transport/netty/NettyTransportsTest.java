package com.questrail.socket.transport.netty;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.transport.Datagram;
import com.questrail.socket.transport.DatagramEndpoint;
import com.questrail.socket.transport.StreamOptions;

import io.netty.channel.ChannelException;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NettyTransportsTest {

    @Test
    void ipProtocolsAreSupportedEverywhere() {
        for (NetworkProtocol p : new NetworkProtocol[] {
                NetworkProtocol.TCP, NetworkProtocol.TCP4, NetworkProtocol.TCP6,
                NetworkProtocol.UDP, NetworkProtocol.UDP4, NetworkProtocol.UDP6}) {
            assertTrue(NettyTransports.isSupported(p), p.code());
        }
    }

    @Test
    void streamTransportRejectsDatagramProtocols() {
        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> NettyTransports.stream(NetworkProtocol.UDP, StreamOptions.plain(1024)));

        assertEquals(SocketError.INVALID_PROTOCOL, e.error());
    }

    @Test
    void datagramBindRejectsStreamProtocols() {
        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> NettyTransports.bindDatagram(NetworkProtocol.TCP,
                        new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 1024));

        assertEquals(SocketError.INVALID_PROTOCOL, e.error());
    }

    @Test
    void channelExceptionsAreUnwrapped() {
        SocketException cause = new SocketException("boom");

        assertSame(cause, NettyTransports.toIOException(cause));
        assertSame(cause, NettyTransports.toIOException(new ChannelException(cause)));
        IOException wrapped = NettyTransports.toIOException(new IllegalStateException("other"));
        assertEquals("other", wrapped.getMessage());
    }

    @Test
    void datagramEndpointsExchangeOverLoopback() throws Exception {
        InetSocketAddress any = new InetSocketAddress(InetAddress.getLoopbackAddress(), 0);
        DatagramEndpoint a = NettyTransports.bindDatagram(NetworkProtocol.UDP, any, 1024);
        DatagramEndpoint b = NettyTransports.bindDatagram(NetworkProtocol.UDP, any, 1024);
        try {
            byte[] payload = "frame".getBytes(StandardCharsets.UTF_8);
            a.send(b.localAddress(), payload, 0, payload.length);
            Datagram d = b.receive(Duration.ofSeconds(5));

            assertEquals("frame", new String(d.payload(), StandardCharsets.UTF_8));
            assertEquals(((InetSocketAddress) a.localAddress()).getPort(),
                    ((InetSocketAddress) d.sender()).getPort());
        } finally {
            a.close();
            b.close();
        }
    }

    @Test
    void closedDatagramEndpointReportsEnd() throws Exception {
        DatagramEndpoint endpoint = NettyTransports.bindDatagram(NetworkProtocol.UDP,
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 1024);

        endpoint.closeListener();

        assertNull(endpoint.receive(Duration.ofSeconds(5)));
        endpoint.close();
    }
}
