package com.questrail.socket.config;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.TlsConfig;
import com.questrail.socket.api.UnixSocketServer;
import com.questrail.socket.core.SocketAddresses;
import com.questrail.socket.core.SocketDefaults;

import java.time.Duration;

/**
 * Declarative description of a server, consumed by {@code Sockets.newServer}.
 *
 * @param network        transport; required
 * @param address        {@code host:port} for IP transports, the socket path for Unix ones
 * @param permission     socket file mode for Unix transports
 * @param groupId        socket file group for Unix transports; {@code null} keeps the default group
 * @param idleTimeout    stream transports only; below one second (or {@code null}) disables
 * @param readBufferSize non-positive selects the default
 * @param tls            TCP only; {@code null} for plain sockets
 */
public record ServerConfig(
    NetworkProtocol network,
    String address,
    int permission,
    Integer groupId,
    Duration idleTimeout,
    int readBufferSize,
    TlsConfig tls
) {
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check the configuration without opening anything. Host names are resolved.
     *
     * @throws SocketErrorException {@code INVALID_PROTOCOL}, {@code INVALID_ADDRESS},
     *         {@code INVALID_GROUP} or {@code INVALID_TLS_CONFIG}
     */
    public void validate() throws SocketErrorException {
        if (network == null) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, "no network given");
        }

        if (network.isUnix()) {
            SocketAddresses.unixPath(address);
            if (groupId != null && (groupId < 0 || groupId > UnixSocketServer.MAX_GID)) {
                throw new SocketErrorException(SocketError.INVALID_GROUP, Integer.toString(groupId));
            }
        } else {
            SocketAddresses.bindAddress(address, network);
        }

        if (tls != null && !isTcp(network)) {
            throw new SocketErrorException(SocketError.INVALID_TLS_CONFIG, "TLS is only available over TCP, not " + network);
        }
    }

    static boolean isTcp(NetworkProtocol network) {
        return network == NetworkProtocol.TCP || network == NetworkProtocol.TCP4 || network == NetworkProtocol.TCP6;
    }

    public static final class Builder {
        private NetworkProtocol network;
        private String address;
        private int permission = UnixSocketServer.DEFAULT_PERMISSION;
        private Integer groupId;
        private Duration idleTimeout;
        private int readBufferSize = SocketDefaults.DEFAULT_BUFFER_SIZE;
        private TlsConfig tls;

        public Builder withNetwork(NetworkProtocol network) {
            this.network = network;
            return this;
        }

        public Builder withAddress(String address) {
            this.address = address;
            return this;
        }

        public Builder withPermission(int permission) {
            this.permission = permission;
            return this;
        }

        public Builder withGroupId(int groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder withIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder withReadBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder withTls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(network, address, permission, groupId, idleTimeout, readBufferSize, tls);
        }
    }
}
