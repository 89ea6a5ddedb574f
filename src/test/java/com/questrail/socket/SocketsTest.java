package com.questrail.socket;

import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketClient;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.SocketServer;
import com.questrail.socket.client.tcp.TcpClient;
import com.questrail.socket.client.udp.UdpClient;
import com.questrail.socket.client.unix.UnixClient;
import com.questrail.socket.client.unixgram.UnixgramClient;
import com.questrail.socket.config.ClientConfig;
import com.questrail.socket.config.ServerConfig;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.server.ServerHarness;
import com.questrail.socket.server.tcp.TcpServer;
import com.questrail.socket.server.udp.UdpServer;
import com.questrail.socket.server.unix.UnixServer;
import com.questrail.socket.server.unixgram.UnixgramServer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SocketsTest {

    private static final ConnectionHandler NOOP = connection -> { };

    @TempDir
    Path dir;

    @Test
    void ipProtocolsAreAlwaysSupported() {
        assertTrue(Sockets.isSupported(NetworkProtocol.TCP));
        assertTrue(Sockets.isSupported(NetworkProtocol.UDP6));
        assertFalse(Sockets.isSupported(null));
    }

    @Test
    void serverTypeFollowsProtocol() throws Exception {
        String sock = dir.resolve("s.sock").toString();

        assertInstanceOf(TcpServer.class, Sockets.newServer(NetworkProtocol.TCP4, ":0", NOOP, null));
        assertInstanceOf(UdpServer.class, Sockets.newServer(NetworkProtocol.UDP, ":0", NOOP, null));
        assertInstanceOf(UnixServer.class, Sockets.newServer(NetworkProtocol.UNIX, sock, NOOP, null));
        assertInstanceOf(UnixgramServer.class, Sockets.newServer(NetworkProtocol.UNIX_GRAM, sock, NOOP, null));
    }

    @Test
    void clientTypeFollowsProtocol() throws Exception {
        String sock = dir.resolve("s.sock").toString();

        assertInstanceOf(TcpClient.class, Sockets.newClient(NetworkProtocol.TCP, "127.0.0.1:1"));
        assertInstanceOf(UdpClient.class, Sockets.newClient(NetworkProtocol.UDP4, "127.0.0.1:1"));
        assertInstanceOf(UnixClient.class, Sockets.newClient(NetworkProtocol.UNIX, sock));
        assertInstanceOf(UnixgramClient.class, Sockets.newClient(NetworkProtocol.UNIX_GRAM, sock));
    }

    @Test
    void missingProtocolIsRejected() {
        SocketErrorException server = assertThrows(SocketErrorException.class,
                () -> Sockets.newServer(null, ":0", NOOP, null));
        SocketErrorException client = assertThrows(SocketErrorException.class,
                () -> Sockets.newClient(null, "127.0.0.1:1"));

        assertEquals(SocketError.INVALID_PROTOCOL, server.error());
        assertEquals(SocketError.INVALID_PROTOCOL, client.error());
    }

    @Test
    void configuredServerCarriesIdleTimeout() throws Exception {
        ServerConfig config = ServerConfig.builder()
                .withNetwork(NetworkProtocol.TCP)
                .withAddress("127.0.0.1:0")
                .withIdleTimeout(Duration.ofSeconds(30))
                .build();

        TcpServer server = (TcpServer) Sockets.newServer(config, NOOP, null);

        assertEquals(Duration.ofSeconds(30), server.idleTimeout());
    }

    @Test
    void configuredPairTalksOverTcp() throws Exception {
        ConnectionHandler echo = connection -> {
            byte[] buffer = new byte[64];
            try {
                int n = connection.read(buffer);
                if (n > 0) {
                    connection.write(buffer, 0, n);
                }
            } catch (java.io.IOException e) {
                // peer went away
            }
        };
        SocketServer server = Sockets.newServer(ServerConfig.builder()
                .withNetwork(NetworkProtocol.TCP)
                .withAddress("127.0.0.1:0")
                .build(), echo, null);

        try (ServerHarness harness = ServerHarness.start(server)) {
            SocketClient client = Sockets.newClient(ClientConfig.builder()
                    .withNetwork(NetworkProtocol.TCP)
                    .withAddress(harness.loopback())
                    .build());
            client.setReadTimeout(Duration.ofSeconds(5));
            client.connect(ExecutionContext.background());
            try {
                client.write("hi".getBytes(StandardCharsets.UTF_8));
                byte[] buffer = new byte[2];
                int total = 0;
                while (total < 2) {
                    int n = client.read(buffer, total, 2 - total);
                    assertTrue(n > 0);
                    total += n;
                }
                assertEquals("hi", new String(buffer, StandardCharsets.UTF_8));
            } finally {
                client.close();
            }
        }
    }

    @Test
    void invalidConfigIsRejectedBeforeCreation() {
        ServerConfig config = ServerConfig.builder()
                .withNetwork(NetworkProtocol.UDP)
                .withAddress("nonsense")
                .build();

        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> Sockets.newServer(config, NOOP, null));

        assertEquals(SocketError.INVALID_ADDRESS, e.error());
    }
}
