package com.questrail.socket.config;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.TlsConfig;

import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLContext;

import static org.junit.jupiter.api.Assertions.*;

class ClientConfigTest {

    @Test
    void validConfigsPass() {
        assertDoesNotThrow(() -> ClientConfig.builder()
                .withNetwork(NetworkProtocol.TCP4)
                .withAddress("127.0.0.1:443")
                .build()
                .validate());
        assertDoesNotThrow(() -> ClientConfig.builder()
                .withNetwork(NetworkProtocol.UNIX)
                .withAddress("/run/app.sock")
                .build()
                .validate());
    }

    @Test
    void dialAddressNeedsAHost() {
        ClientConfig config = ClientConfig.builder()
                .withNetwork(NetworkProtocol.TCP)
                .withAddress("")
                .build();

        SocketErrorException e = assertThrows(SocketErrorException.class, config::validate);

        assertEquals(SocketError.INVALID_ADDRESS, e.error());
    }

    @Test
    void tlsOverUnixIsRejected() throws Exception {
        ClientConfig config = ClientConfig.builder()
                .withNetwork(NetworkProtocol.UNIX)
                .withAddress("/run/app.sock")
                .withTls(TlsConfig.of(SSLContext.getDefault()))
                .build();

        SocketErrorException e = assertThrows(SocketErrorException.class, config::validate);

        assertEquals(SocketError.INVALID_TLS_CONFIG, e.error());
    }
}
