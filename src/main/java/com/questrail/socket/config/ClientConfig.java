package com.questrail.socket.config;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.TlsConfig;
import com.questrail.socket.core.SocketAddresses;

/**
 * Declarative description of a client, consumed by {@code Sockets.newClient}.
 *
 * @param network    transport; required
 * @param address    {@code host:port} of the server, or its socket path for Unix transports
 * @param tls        TCP only; {@code null} for plain sockets
 * @param serverName name sent and verified during the TLS handshake; defaults to the target host
 */
public record ClientConfig(NetworkProtocol network, String address, TlsConfig tls, String serverName) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws SocketErrorException {@code INVALID_PROTOCOL}, {@code INVALID_ADDRESS}
     *         or {@code INVALID_TLS_CONFIG}
     */
    public void validate() throws SocketErrorException {
        if (network == null) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, "no network given");
        }
        if (network.isUnix()) {
            SocketAddresses.unixPath(address);
        } else {
            SocketAddresses.dialAddress(address, network);
        }
        if (tls != null && !ServerConfig.isTcp(network)) {
            throw new SocketErrorException(SocketError.INVALID_TLS_CONFIG, "TLS is only available over TCP, not " + network);
        }
    }

    public static final class Builder {
        private NetworkProtocol network;
        private String address;
        private TlsConfig tls;
        private String serverName;

        public Builder withNetwork(NetworkProtocol network) {
            this.network = network;
            return this;
        }

        public Builder withAddress(String address) {
            this.address = address;
            return this;
        }

        public Builder withTls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        public Builder withServerName(String serverName) {
            this.serverName = serverName;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(network, address, tls, serverName);
        }
    }
}
