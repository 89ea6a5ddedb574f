package com.questrail.socket.client.unix;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.transport.netty.NettyTransports;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class UnixClientTest {

    @TempDir
    Path dir;

    @Test
    void emptyPathIsRejected() {
        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> new UnixClient(NetworkProtocol.UNIX, " "));

        assertEquals(SocketError.INVALID_ADDRESS, e.error());
    }

    @Test
    void overlongPathIsRejected() {
        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> new UnixClient(NetworkProtocol.UNIX, "/tmp/" + "x".repeat(200)));

        assertEquals(SocketError.INVALID_ADDRESS, e.error());
    }

    @Test
    void missingSocketFileFailsConnect() throws Exception {
        assumeTrue(NettyTransports.isSupported(NetworkProtocol.UNIX));
        UnixClient client = new UnixClient(NetworkProtocol.UNIX, dir.resolve("absent.sock").toString());

        assertThrows(IOException.class, () -> client.connect(ExecutionContext.background()));
        assertFalse(client.isConnected());
    }

    @Test
    void unsupportedHostFailsConnectWithInvalidProtocol() throws Exception {
        assumeTrue(!NettyTransports.isSupported(NetworkProtocol.UNIX));
        UnixClient client = new UnixClient(NetworkProtocol.UNIX, dir.resolve("any.sock").toString());

        SocketErrorException e = assertThrows(SocketErrorException.class,
                () -> client.connect(ExecutionContext.background()));
        assertEquals(SocketError.INVALID_PROTOCOL, e.error());
    }
}
