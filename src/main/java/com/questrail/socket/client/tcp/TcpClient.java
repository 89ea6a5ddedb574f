package com.questrail.socket.client.tcp;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.TlsConfig;
import com.questrail.socket.client.AbstractStreamClient;
import com.questrail.socket.core.SocketAddresses;
import com.questrail.socket.transport.StreamOptions;

import java.net.InetSocketAddress;
import java.util.EnumSet;

/**
 * TcpClient
 * =============================================================================
 * TCP client ({@code tcp}, {@code tcp4}, {@code tcp6}) with optional TLS.
 *
 * <p>The target is {@code host:port}; an IPv6 host is written in brackets.
 * A hostname is resolved when the client is constructed.</p>
 *
 * <p>With TLS enabled the handshake completes inside {@link #connect}, so a
 * certificate or hostname mismatch fails the connect call. The server name
 * given to {@link #setTls} is sent as SNI and checked against the
 * certificate; when it is {@code null} the host part of the target address is used.</p>
 */
public final class TcpClient extends AbstractStreamClient
{
    private final String host;

    private volatile TlsConfig tls;
    private volatile String serverName;

    public TcpClient(NetworkProtocol protocol, String address) throws SocketErrorException {
        super(protocol, EnumSet.of(NetworkProtocol.TCP, NetworkProtocol.TCP4, NetworkProtocol.TCP6),
                address, SocketAddresses::dialAddress);
        this.host = hostOf(address.strip());
    }

    // address is already validated
    private static String hostOf(String address) {
        if (address.startsWith("[")) {
            return address.substring(1, address.indexOf(']'));
        }
        return address.substring(0, address.lastIndexOf(':'));
    }

    @Override
    public void setTls(boolean enabled, TlsConfig config, String serverName) throws SocketErrorException {
        if (!enabled) {
            this.tls = null;
            this.serverName = null;
            return;
        }
        if (config == null) {
            throw new SocketErrorException(SocketError.INVALID_TLS_CONFIG, "TLS enabled without a configuration");
        }
        this.tls = config;
        this.serverName = serverName;
    }

    @Override
    protected StreamOptions streamOptions() {
        TlsConfig t = tls;
        if (t == null) {
            return super.streamOptions();
        }
        String name = serverName;
        if (name == null || name.isBlank()) {
            name = host.isEmpty() ? ((InetSocketAddress) target).getHostString() : host;
        }
        return new StreamOptions(readBufferSize, null, t, name);
    }
}
