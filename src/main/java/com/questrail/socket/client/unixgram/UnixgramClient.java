package com.questrail.socket.client.unixgram;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.client.AbstractDatagramClient;
import com.questrail.socket.core.SocketAddresses;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;

/**
 * UnixgramClient
 * =============================================================================
 * Unix domain datagram socket client. The address is the server's socket path.
 *
 * <p>A Unix datagram peer can only be answered if it has a name, so each
 * connection binds its own socket in a fresh temporary directory. Both are
 * removed when the connection closes. TLS settings are accepted and
 * ignored.</p>
 */
public final class UnixgramClient extends AbstractDatagramClient
{
    private static final Logger log = LoggerFactory.getLogger(UnixgramClient.class);

    private static final String LOCAL_SOCKET_NAME = "client.sock";

    public UnixgramClient(NetworkProtocol protocol, String path) throws SocketErrorException {
        super(protocol, EnumSet.of(NetworkProtocol.UNIX_GRAM), path,
                (address, p) -> UnixDomainSocketAddress.of(SocketAddresses.unixPath(address)));
    }

    @Override
    protected SocketAddress localBindAddress() throws IOException {
        Path dir = Files.createTempDirectory("unixgram-");
        return UnixDomainSocketAddress.of(dir.resolve(LOCAL_SOCKET_NAME));
    }

    @Override
    protected void releaseLocal(SocketAddress local) {
        Path socket = ((UnixDomainSocketAddress) local).getPath();
        try {
            Files.deleteIfExists(socket);
            Files.deleteIfExists(socket.getParent());
        } catch (IOException e) {
            log.warn("Could not remove client socket {}", socket, e);
        }
    }
}
