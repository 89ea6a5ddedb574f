package com.questrail.socket.transport;

import com.questrail.socket.api.TlsConfig;

import java.time.Duration;

/**
 * Per-endpoint settings for a {@link StreamTransport}.
 *
 * @param readBufferSize size of a single socket read
 * @param idleTimeout    close connections idle this long; {@code null} disables
 * @param tls            transport security, {@code null} for plain sockets
 * @param serverName     name presented and verified by TLS clients; ignored by servers
 */
public record StreamOptions(int readBufferSize, Duration idleTimeout, TlsConfig tls, String serverName) {

    public static StreamOptions plain(int readBufferSize) {
        return new StreamOptions(readBufferSize, null, null, null);
    }
}
