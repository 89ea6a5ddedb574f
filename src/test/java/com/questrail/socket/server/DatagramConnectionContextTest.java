package com.questrail.socket.server;

import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.transport.FakeDatagramEndpoint;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DatagramConnectionContextTest {

    private static final SocketAddress ALICE = new InetSocketAddress("127.0.0.1", 5001);
    private static final SocketAddress BOB = new InetSocketAddress("127.0.0.1", 5002);

    private final FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
    private final DatagramConnectionContext connection =
            new DatagramConnectionContext(endpoint, ExecutionContext.background().child());

    @Test
    void lastSenderBecomesNextRecipient() throws IOException {
        byte[] buffer = new byte[16];

        endpoint.injectDatagram(ALICE, bytes("ping-a"));
        assertEquals(6, connection.read(buffer));
        assertEquals(ALICE, connection.remoteAddress());
        connection.write(bytes("pong-a"));

        endpoint.injectDatagram(BOB, bytes("ping-b"));
        connection.read(buffer);
        assertEquals(BOB, connection.remoteAddress());
        connection.write(bytes("pong-b"));

        assertEquals(2, endpoint.sent().size());
        assertEquals(ALICE, endpoint.sent().get(0).remote());
        assertEquals("pong-a", new String(endpoint.sent().get(0).payload(), StandardCharsets.UTF_8));
        assertEquals(BOB, endpoint.sent().get(1).remote());
    }

    @Test
    void writeBeforeAnyReadHasNoPeer() {
        assertNull(connection.remoteAddress());
        assertThrows(IOException.class, () -> connection.write(bytes("orphan")));
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void unaddressedSenderCannotBeAnswered() throws IOException {
        endpoint.injectDatagram(null, bytes("anonymous"));
        connection.read(new byte[16]);

        assertThrows(IOException.class, () -> connection.write(bytes("reply")));
    }

    @Test
    void longDatagramIsTruncatedToTheBuffer() throws IOException {
        endpoint.injectDatagram(ALICE, bytes("0123456789"));
        byte[] buffer = new byte[4];

        assertEquals(4, connection.read(buffer));
        assertEquals("0123", new String(buffer, StandardCharsets.UTF_8));
    }

    @Test
    void closeLeavesTheSocketToTheServer() throws IOException {
        ExecutionContext ctx = connection.context();

        connection.close();

        assertFalse(endpoint.isClosed());
        assertTrue(ctx.isCancelled());
        assertFalse(connection.isConnected());
        assertEquals(-1, connection.read(new byte[4]));
        assertThrows(IOException.class, () -> connection.write(bytes("late")));
    }

    @Test
    void endOfStreamOnceTheEndpointCloses() throws IOException {
        endpoint.closeListener();

        assertEquals(-1, connection.read(new byte[4]));
        assertEquals(-1, connection.read(new byte[4]));
    }

    @Test
    void readTimeoutApplies() {
        connection.setReadTimeout(Duration.ofMillis(20));

        assertThrows(SocketTimeoutException.class, () -> connection.read(new byte[4]));
    }

    @Test
    void socketFailureReachesTheHandler() {
        endpoint.injectFailure(new IOException("port unreachable"));

        IOException e = assertThrows(IOException.class, () -> connection.read(new byte[4]));
        assertEquals("port unreachable", e.getMessage());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
