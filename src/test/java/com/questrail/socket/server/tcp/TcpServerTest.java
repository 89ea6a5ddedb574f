package com.questrail.socket.server.tcp;

import com.questrail.socket.Eventually;
import com.questrail.socket.api.ConnState;
import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.client.tcp.TcpClient;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.observability.RecordingObserver;
import com.questrail.socket.server.ServerHarness;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.StandardSocketOptions;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TcpServerTest
 * -----------------------------------------------------------------------------
 * Lifecycle and dispatch tests against real loopback sockets.
 */
class TcpServerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    static final ConnectionHandler ECHO = connection -> {
        byte[] buffer = new byte[1024];
        try {
            int n;
            while ((n = connection.read(buffer)) >= 0) {
                connection.write(buffer, 0, n);
            }
        } catch (IOException e) {
            // peer went away
        }
    };

    private ServerHarness harness;
    private TcpClient client;

    @AfterEach
    void tearDown() throws Exception {
        if (client != null && client.isConnected()) {
            client.close();
        }
        if (harness != null) {
            harness.close();
        }
    }

    private static TcpServer server(ConnectionHandler handler) throws SocketErrorException {
        TcpServer server = new TcpServer(null, handler, NetworkProtocol.TCP, 0);
        server.registerServer("127.0.0.1:0");
        return server;
    }

    @Test
    void echoesHello() throws Exception {
        harness = ServerHarness.start(server(ECHO));
        client = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        client.connect(ExecutionContext.background());

        client.write("Hello".getBytes(StandardCharsets.UTF_8));
        byte[] buffer = new byte[5];
        int n = readFully(client::read, buffer);

        assertEquals(5, n);
        assertEquals("Hello", new String(buffer, StandardCharsets.UTF_8));
    }

    @Test
    void bindFailureLeavesServerStopped() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            TcpServer server = new TcpServer(null, ECHO, NetworkProtocol.TCP, 0);
            server.registerServer("127.0.0.1:" + occupied.getLocalPort());
            RecordingObserver observer = new RecordingObserver();
            server.registerError(observer);

            assertThrows(IOException.class, () -> server.listen(ExecutionContext.background()));

            assertFalse(server.isRunning());
            assertTrue(server.isGone());
            assertFalse(observer.errors().isEmpty(), "bind failure is also reported to the error callback");
        }
    }

    @Test
    void missingAddressIsRejected() throws Exception {
        TcpServer server = new TcpServer(null, ECHO, NetworkProtocol.TCP, 0);

        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> server.listen(ExecutionContext.background()));

        assertEquals(SocketError.INVALID_ADDRESS, e.error());
        assertFalse(server.isRunning());
        assertTrue(server.isGone());
    }

    @Test
    void missingHandlerIsRejected() throws Exception {
        TcpServer server = server(null);

        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> server.listen(ExecutionContext.background()));

        assertEquals(SocketError.INVALID_HANDLER, e.error());
        assertTrue(server.isGone());
    }

    @Test
    void wrongProtocolIsRejectedAtConstruction() {
        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> new TcpServer(null, ECHO, NetworkProtocol.UDP, 0));

        assertEquals(SocketError.INVALID_PROTOCOL, e.error());
    }

    @Test
    void invalidAddressIsRejectedAtRegistration() throws Exception {
        TcpServer server = new TcpServer(null, ECHO, NetworkProtocol.TCP, 0);

        SocketErrorException e = assertThrows(SocketErrorException.class, () -> server.registerServer("no-port"));

        assertEquals(SocketError.INVALID_ADDRESS, e.error());
    }

    @Test
    void flagsAfterListenReturns() throws Exception {
        TcpServer server = server(ECHO);
        assertFalse(server.isRunning());
        assertFalse(server.isGone());

        harness = ServerHarness.start(server);
        assertTrue(server.isRunning());
        assertFalse(server.isGone());
        assertTrue(server.boundAddress().isPresent());

        harness.stop();

        assertFalse(server.isRunning());
        assertTrue(server.isGone());
        assertTrue(server.boundAddress().isEmpty());
    }

    @Test
    void openConnectionsFollowsHandlers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        TcpServer server = server(connection -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        harness = ServerHarness.start(server);
        assertEquals(0, server.openConnections());

        client = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        client.connect(ExecutionContext.background());

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertEquals(1, server.openConnections());

        release.countDown();
        assertTrue(Eventually.holds(() -> server.openConnections() == 0, WAIT));
    }

    @Test
    void cancellingListenReturnsPromptly() throws Exception {
        harness = ServerHarness.start(server(ECHO));

        long start = System.nanoTime();
        harness.stop();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMillis < 1_000, "listen took " + elapsedMillis + " ms to return");
    }

    @Test
    void shutdownBeforeListenIsRemembered() throws Exception {
        TcpServer server = server(ECHO);

        server.shutdown(ExecutionContext.background());

        assertTimeoutPreemptively(WAIT, () -> server.listen(ExecutionContext.background()));
        assertTrue(server.isGone());
    }

    @Test
    void shutdownWaitsForDrain() throws Exception {
        TcpServer server = server(ECHO);
        harness = ServerHarness.start(server);

        server.shutdown(ExecutionContext.background());

        assertFalse(server.isRunning());
        assertEquals(0, server.openConnections());
        harness.awaitExit(WAIT);
        assertTrue(server.isGone());
    }

    @Test
    void shutdownTimesOutWhileHandlerHoldsOn() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TcpServer server = server(connection -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        harness = ServerHarness.start(server);
        client = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        client.connect(ExecutionContext.background());
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        try {
            SocketErrorException e = assertThrows(SocketErrorException.class,
                    () -> server.shutdown(ExecutionContext.background()));
            assertEquals(SocketError.SHUTDOWN_TIMEOUT, e.error());
        } finally {
            release.countDown();
        }
        assertTrue(Eventually.holds(() -> server.openConnections() == 0, WAIT));
    }

    @Test
    void secondListenWhileRunningIsRejected() throws Exception {
        TcpServer server = server(ECHO);
        harness = ServerHarness.start(server);

        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> server.listen(ExecutionContext.background()));

        assertEquals(SocketError.ALREADY_RUNNING, e.error());
        assertTrue(server.isRunning());
    }

    @Test
    void serverCanListenAgainAfterStopping() throws Exception {
        TcpServer server = server(ECHO);
        ServerHarness.start(server).stop();

        harness = ServerHarness.start(server);

        assertTrue(server.isRunning());
        assertFalse(server.isGone());
    }

    @Test
    void handlerFailureIsIsolated() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TcpServer server = server(connection -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("handler bug");
            }
            ECHO.handle(connection);
        });
        RecordingObserver observer = new RecordingObserver();
        server.registerError(observer);
        harness = ServerHarness.start(server);

        TcpClient first = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        first.connect(ExecutionContext.background());
        assertTrue(observer.awaitError(e -> e instanceof IllegalStateException, WAIT));
        first.close();

        client = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        client.connect(ExecutionContext.background());
        client.write("again".getBytes(StandardCharsets.UTF_8));
        byte[] buffer = new byte[5];
        readFully(client::read, buffer);

        assertEquals("again", new String(buffer, StandardCharsets.UTF_8));
        assertTrue(server.isRunning());
    }

    @Test
    void reportsConnectionLifecycle() throws Exception {
        TcpServer server = server(ECHO);
        RecordingObserver observer = new RecordingObserver();
        server.registerInfo(observer);
        server.registerServerInfo(observer);
        harness = ServerHarness.start(server);

        client = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        client.connect(ExecutionContext.background());
        assertTrue(observer.awaitState(ConnState.HANDLER, 1, WAIT));
        client.close();
        assertTrue(observer.awaitState(ConnState.CLOSE, 1, WAIT));

        assertEquals(java.util.List.of(ConnState.NEW, ConnState.HANDLER, ConnState.CLOSE), observer.states());
        assertTrue(observer.serverMessages().get(0).startsWith("starting listening socket 'tcp "));
    }

    @Test
    void handlerSeesDrainingThroughItsContext() throws Exception {
        CountDownLatch cancelled = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        TcpServer server = server(connection -> {
            entered.countDown();
            try {
                connection.context().await();
                cancelled.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        harness = ServerHarness.start(server);
        client = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        client.connect(ExecutionContext.background());
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        harness.context().cancel();

        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
    }

    @Test
    void idleConnectionsAreClosed() throws Exception {
        CountDownLatch sawEnd = new CountDownLatch(1);
        TcpServer server = server(connection -> {
            try {
                if (connection.read(new byte[8]) < 0) {
                    sawEnd.countDown();
                }
            } catch (IOException e) {
                sawEnd.countDown();
            }
        });
        server.setIdleTimeout(Duration.ofSeconds(1));
        harness = ServerHarness.start(server);

        client = new TcpClient(NetworkProtocol.TCP, harness.loopback());
        client.connect(ExecutionContext.background());

        assertTrue(sawEnd.await(5, TimeUnit.SECONDS), "idle connection should be closed by the server");
    }

    @Test
    void idleTimeoutBelowOneSecondIsDisabled() throws Exception {
        TcpServer server = server(ECHO);

        server.setIdleTimeout(Duration.ofMillis(500));

        assertNull(server.idleTimeout());
    }

    @Test
    void customizerSeesTheBoundSocket() throws Exception {
        AtomicInteger receiveBuffer = new AtomicInteger();
        TcpServer server = new TcpServer(socket -> {
            try {
                socket.setOption(StandardSocketOptions.SO_RCVBUF, 64 * 1024);
                receiveBuffer.set(socket.getOption(StandardSocketOptions.SO_RCVBUF));
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }, ECHO, NetworkProtocol.TCP, 0);
        server.registerServer("127.0.0.1:0");

        harness = ServerHarness.start(server);

        assertTrue(receiveBuffer.get() > 0);
    }

    @Test
    void failingCustomizerDoesNotStopTheServer() throws Exception {
        TcpServer server = new TcpServer(socket -> {
            throw new IllegalStateException("tuning failed");
        }, ECHO, NetworkProtocol.TCP, 0);
        server.registerServer("127.0.0.1:0");
        RecordingObserver observer = new RecordingObserver();
        server.registerError(observer);

        harness = ServerHarness.start(server);

        assertTrue(server.isRunning());
        assertTrue(observer.awaitError(e -> e instanceof IllegalStateException, WAIT));
    }

    @FunctionalInterface
    interface Reader {
        int read(byte[] buffer, int offset, int length) throws IOException;
    }

    static int readFully(Reader reader, byte[] buffer) throws IOException {
        int total = 0;
        while (total < buffer.length) {
            int n = reader.read(buffer, total, buffer.length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }
}
